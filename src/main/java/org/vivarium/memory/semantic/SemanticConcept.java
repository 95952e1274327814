package org.vivarium.memory.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A unit of abstract knowledge distilled from repeated episodic experience.
 * <p>
 * Instances handed out by {@link SemanticStore} are copies; mutators are package-private.
 */
public final class SemanticConcept {

    private static final double HOURLY_DECAY = 0.99;

    private final String conceptId;
    private final String name;
    private final String description;
    private double confidence;
    private long activationCount;
    private double lastActivation;
    private final Set<String> relatedConcepts = new TreeSet<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final double createdAt;

    public SemanticConcept(String conceptId, String name, String description, double confidence,
                           long activationCount, double lastActivation, double createdAt) {
        this.conceptId = Objects.requireNonNull(conceptId, "conceptId");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.confidence = clampUnit(confidence);
        if (activationCount < 0) {
            throw new IllegalArgumentException("activationCount must be >= 0");
        }
        this.activationCount = activationCount;
        this.lastActivation = lastActivation;
        this.createdAt = createdAt;
    }

    public String getConceptId() {
        return conceptId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public long getActivationCount() {
        return activationCount;
    }

    public double getLastActivation() {
        return lastActivation;
    }

    public double getCreatedAt() {
        return createdAt;
    }

    public Set<String> getRelatedConcepts() {
        return Collections.unmodifiableSet(relatedConcepts);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Activation strength decays by 1% per hour since the last activation.
     *
     * @param now Current time in epoch seconds.
     * @return {@code min(1, confidence * 0.99^(hours since last activation))}.
     */
    public double activationStrength(double now) {
        double hours = Math.max(0.0, now - lastActivation) / 3600.0;
        return Math.min(1.0, confidence * Math.pow(HOURLY_DECAY, hours));
    }

    void activate(double now) {
        activationCount++;
        lastActivation = now;
    }

    void setConfidence(double confidence) {
        this.confidence = clampUnit(confidence);
    }

    void mergeFrom(SemanticConcept other) {
        confidence = Math.max(confidence, other.confidence);
        activationCount += other.activationCount;
        relatedConcepts.addAll(other.relatedConcepts);
        properties.putAll(other.properties);
        lastActivation = Math.max(lastActivation, other.lastActivation);
    }

    /**
     * Adds a relation by id. Self-relations are ignored.
     * @param otherId Id of the related concept.
     */
    public void addRelation(String otherId) {
        if (!conceptId.equals(otherId)) {
            relatedConcepts.add(otherId);
        }
    }

    void removeRelation(String otherId) {
        relatedConcepts.remove(otherId);
    }

    public void putProperty(String key, Object value) {
        properties.put(key, value);
    }

    /**
     * @return a deep copy.
     */
    public SemanticConcept copy() {
        SemanticConcept copy = new SemanticConcept(conceptId, name, description, confidence,
            activationCount, lastActivation, createdAt);
        copy.relatedConcepts.addAll(relatedConcepts);
        copy.properties.putAll(properties);
        return copy;
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return "SemanticConcept{" + conceptId + ", confidence=" + confidence
            + ", activations=" + activationCount + "}";
    }
}
