package org.vivarium.memory.semantic;

import java.util.Objects;

/**
 * A weighted, typed link between two concepts, referenced by id.
 */
public final class SemanticAssociation {

    public static final String RELATED_TO = "related_to";

    private final String sourceId;
    private final String targetId;
    private final String associationType;
    private double strength;
    private long evidenceCount;
    private double lastUpdated;

    public SemanticAssociation(String sourceId, String targetId, String associationType,
                               double strength, long evidenceCount, double lastUpdated) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.associationType = Objects.requireNonNull(associationType, "associationType");
        this.strength = Math.max(0.0, Math.min(1.0, strength));
        this.evidenceCount = evidenceCount;
        this.lastUpdated = lastUpdated;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getAssociationType() {
        return associationType;
    }

    public double getStrength() {
        return strength;
    }

    public long getEvidenceCount() {
        return evidenceCount;
    }

    public double getLastUpdated() {
        return lastUpdated;
    }

    /**
     * @return the store key, {@code source->target}.
     */
    public String key() {
        return key(sourceId, targetId);
    }

    static String key(String sourceId, String targetId) {
        return sourceId + "->" + targetId;
    }

    void strengthen(double amount, double now) {
        strength = Math.min(1.0, strength + amount);
        evidenceCount++;
        lastUpdated = now;
    }

    void weaken(double factor) {
        strength *= factor;
    }

    public SemanticAssociation copy() {
        return new SemanticAssociation(sourceId, targetId, associationType, strength, evidenceCount, lastUpdated);
    }
}
