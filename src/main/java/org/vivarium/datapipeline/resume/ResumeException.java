package org.vivarium.datapipeline.resume;

/**
 * Thrown when an organism cannot be resumed: no snapshot exists, the latest one is unreadable,
 * or its memory hierarchy does not restore.
 * <p>
 * Unchecked because a failed resume is a data or configuration problem the run cannot recover
 * from by itself.
 */
public class ResumeException extends RuntimeException {

    /**
     * @param message Description of the resume failure.
     */
    public ResumeException(String message) {
        super(message);
    }

    /**
     * @param message Description of the resume failure.
     * @param cause   The underlying failure.
     */
    public ResumeException(String message, Throwable cause) {
        super(message, cause);
    }
}
