package org.vivarium.memory.semantic;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.vivarium.memory.IMemoryStore;
import org.vivarium.memory.MemoryLevel;
import org.vivarium.memory.MemoryQueryParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concept graph distilled from episodic memory.
 * <p>
 * Concepts are keyed by id and never removed implicitly; only associations weaken and
 * disappear during {@link #consolidateKnowledge()}. Relations between concepts are id-based.
 * <p>
 * All read methods return copies.
 */
public class SemanticStore implements IMemoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticStore.class);

    /** Prefix of concept ids derived from an event type. */
    public static final String CONCEPT_ID_PREFIX = "concept_";

    private final SemanticStoreSettings settings;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, SemanticConcept> concepts = new LinkedHashMap<>();
    private final Map<String, SemanticAssociation> associations = new LinkedHashMap<>();
    private final Map<String, String> nameToId = new HashMap<>();

    private double lastConsolidation;

    public SemanticStore(SemanticStoreSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SemanticStore(SemanticStoreSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * Adds a concept, or merges it into an existing concept with the same id: confidence becomes
     * the maximum, activation counts add up, relations and properties are united.
     *
     * @param concept The concept; the store keeps a copy.
     */
    public void addConcept(SemanticConcept concept) {
        lock.writeLock().lock();
        try {
            SemanticConcept existing = concepts.get(concept.getConceptId());
            if (existing != null) {
                existing.mergeFrom(concept);
            } else {
                concepts.put(concept.getConceptId(), concept.copy());
                nameToId.put(concept.getName(), concept.getConceptId());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Creates or reinforces the concept for an event type. An existing concept is activated and
     * its confidence moves toward {@code frequency} by the smoothing factor; a new concept starts
     * at {@code smoothing * frequency}.
     *
     * @param eventType   The event type the concept abstracts.
     * @param occurrences Occurrences in the examined window.
     * @param frequency   Share of the window taken by this type, in {@code [0, 1]}.
     * @return A copy of the updated concept.
     */
    public SemanticConcept reinforce(String eventType, int occurrences, double frequency) {
        double now = now();
        String id = conceptIdFor(eventType);
        double alpha = settings.confidenceSmoothing();
        lock.writeLock().lock();
        try {
            SemanticConcept concept = concepts.get(id);
            if (concept == null) {
                concept = new SemanticConcept(id, eventType,
                    "Recurring '" + eventType + "' experience", 0.0, 0, now, now);
                concepts.put(id, concept);
                nameToId.put(eventType, id);
                LOG.debug("Formed concept '{}' from {} occurrences", id, occurrences);
            }
            concept.activate(now);
            concept.setConfidence(concept.getConfidence() + alpha * (frequency - concept.getConfidence()));
            concept.putProperty("last_group_size", (long) occurrences);
            return concept.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public static String conceptIdFor(String eventType) {
        return CONCEPT_ID_PREFIX + eventType;
    }

    public Optional<SemanticConcept> getConcept(String conceptId) {
        lock.readLock().lock();
        try {
            SemanticConcept concept = concepts.get(conceptId);
            return concept == null ? Optional.empty() : Optional.of(concept.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<SemanticConcept> getConceptByName(String name) {
        lock.readLock().lock();
        try {
            String id = nameToId.get(name);
            SemanticConcept concept = id == null ? null : concepts.get(id);
            return concept == null ? Optional.empty() : Optional.of(concept.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds an association, or strengthens the existing one between the same concepts by the new
     * association's strength. Both endpoints record the relation.
     *
     * @param association The association; the store keeps a copy.
     * @throws IllegalArgumentException if either endpoint is unknown.
     */
    public void addAssociation(SemanticAssociation association) {
        lock.writeLock().lock();
        try {
            SemanticConcept source = concepts.get(association.getSourceId());
            SemanticConcept target = concepts.get(association.getTargetId());
            if (source == null || target == null) {
                throw new IllegalArgumentException("Association endpoints must exist: " + association.key());
            }
            SemanticAssociation existing = associations.get(association.key());
            if (existing != null) {
                existing.strengthen(association.getStrength(), now());
            } else {
                associations.put(association.key(), association.copy());
            }
            source.addRelation(target.getConceptId());
            target.addRelation(source.getConceptId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Strengthens the {@code related_to} link between two concepts by the configured increment.
     *
     * @param sourceId First concept.
     * @param targetId Second concept.
     */
    public void relate(String sourceId, String targetId) {
        if (sourceId.equals(targetId)) {
            return;
        }
        addAssociation(new SemanticAssociation(sourceId, targetId, SemanticAssociation.RELATED_TO,
            settings.associationIncrement(), 1, now()));
    }

    /**
     * Walks associations outward from a concept. Each hop multiplies the relevance by the link
     * strength and by {@code 0.8^depth}.
     *
     * @param conceptId Start concept.
     * @param maxDepth  Maximum number of hops.
     * @return Relevance per reachable concept id, including the start concept at 1.0.
     */
    public Map<String, Double> findRelatedConcepts(String conceptId, int maxDepth) {
        lock.readLock().lock();
        try {
            Map<String, Double> relevance = new LinkedHashMap<>();
            if (!concepts.containsKey(conceptId)) {
                return relevance;
            }
            explore(conceptId, 0, 1.0, maxDepth, relevance);
            return relevance;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void explore(String currentId, int depth, double currentRelevance, int maxDepth,
                         Map<String, Double> relevance) {
        if (depth > maxDepth || relevance.containsKey(currentId)) {
            return;
        }
        relevance.put(currentId, currentRelevance);
        SemanticConcept current = concepts.get(currentId);
        if (current == null) {
            return;
        }
        for (String relatedId : current.getRelatedConcepts()) {
            SemanticAssociation link = associations.get(SemanticAssociation.key(currentId, relatedId));
            if (link == null) {
                link = associations.get(SemanticAssociation.key(relatedId, currentId));
            }
            if (link != null) {
                explore(relatedId, depth + 1, currentRelevance * link.getStrength() * Math.pow(0.8, depth),
                    maxDepth, relevance);
            }
        }
    }

    /**
     * Ranks concepts by text match weighted with activation strength. A name match scores 1.0, a
     * description match 0.5. A blank query matches every concept with weight 1.0.
     *
     * @param query         Case-insensitive substring.
     * @param limit         Maximum number of results.
     * @param minConfidence Concepts below this confidence are skipped.
     * @return Copies of the best matches, best first.
     */
    public List<SemanticConcept> searchConcepts(String query, int limit, double minConfidence) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();
        double now = now();
        lock.readLock().lock();
        try {
            List<Map.Entry<SemanticConcept, Double>> scored = new ArrayList<>();
            for (SemanticConcept concept : concepts.values()) {
                if (concept.getConfidence() < minConfidence) {
                    continue;
                }
                double score;
                if (needle.isEmpty()) {
                    score = 1.0;
                } else {
                    score = 0.0;
                    if (concept.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                        score += 1.0;
                    }
                    if (concept.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
                        score += 0.5;
                    }
                }
                score *= concept.activationStrength(now);
                if (score > 0.0 || (needle.isEmpty() && minConfidence <= 0.0)) {
                    scored.add(Map.entry(concept, score));
                }
            }
            scored.sort(Map.Entry.<SemanticConcept, Double>comparingByValue(Comparator.reverseOrder()));
            List<SemanticConcept> result = new ArrayList<>();
            for (int i = 0; i < scored.size() && i < limit; i++) {
                result.add(scored.get(i).getKey().copy());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Weakens associations that have not been updated for the stale period and removes those that
     * fall below the minimum strength. Concepts are never removed. Runs at most once per
     * consolidation interval; earlier calls return 0.
     *
     * @return Number of associations weakened or removed.
     */
    public int consolidateKnowledge() {
        double now = now();
        lock.writeLock().lock();
        try {
            if (lastConsolidation > 0.0 && now - lastConsolidation < settings.consolidationIntervalSeconds()) {
                return 0;
            }
            lastConsolidation = now;
            int optimizations = 0;
            Iterator<SemanticAssociation> it = associations.values().iterator();
            while (it.hasNext()) {
                SemanticAssociation association = it.next();
                if (now - association.getLastUpdated() <= settings.associationStaleSeconds()) {
                    continue;
                }
                association.weaken(settings.associationDecay());
                optimizations++;
                if (association.getStrength() < settings.associationMinStrength()) {
                    it.remove();
                    unlink(association.getSourceId(), association.getTargetId());
                }
            }
            if (optimizations > 0) {
                LOG.debug("Semantic consolidation adjusted {} associations", optimizations);
            }
            return optimizations;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void unlink(String a, String b) {
        if (associations.containsKey(SemanticAssociation.key(b, a))) {
            return;
        }
        SemanticConcept ca = concepts.get(a);
        SemanticConcept cb = concepts.get(b);
        if (ca != null) {
            ca.removeRelation(b);
        }
        if (cb != null) {
            cb.removeRelation(a);
        }
    }

    /**
     * @return copies of all concepts, in insertion order.
     */
    public List<SemanticConcept> getConcepts() {
        lock.readLock().lock();
        try {
            List<SemanticConcept> copies = new ArrayList<>(concepts.size());
            for (SemanticConcept concept : concepts.values()) {
                copies.add(concept.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copies of all associations, in insertion order.
     */
    public List<SemanticAssociation> getAssociations() {
        lock.readLock().lock();
        try {
            List<SemanticAssociation> copies = new ArrayList<>(associations.size());
            for (SemanticAssociation association : associations.values()) {
                copies.add(association.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole content, used when restoring a serialized hierarchy.
     *
     * @param restoredConcepts     Concepts in insertion order.
     * @param restoredAssociations Associations in insertion order.
     */
    public void restore(List<SemanticConcept> restoredConcepts, List<SemanticAssociation> restoredAssociations) {
        lock.writeLock().lock();
        try {
            concepts.clear();
            associations.clear();
            nameToId.clear();
            for (SemanticConcept concept : restoredConcepts) {
                concepts.put(concept.getConceptId(), concept.copy());
                nameToId.put(concept.getName(), concept.getConceptId());
            }
            for (SemanticAssociation association : restoredAssociations) {
                associations.put(association.key(), association.copy());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return concepts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MemoryLevel getLevel() {
        return MemoryLevel.SEMANTIC;
    }

    @Override
    public boolean isAvailable() {
        return settings.enabled();
    }

    @Override
    public List<?> query(MemoryQueryParams params) {
        double minConfidence = params.confidenceThreshold() == null ? 0.0 : params.confidenceThreshold();
        return searchConcepts(params.query(), Integer.MAX_VALUE, minConfidence);
    }

    @Override
    public Map<String, Object> getStatistics() {
        double now = now();
        lock.readLock().lock();
        try {
            double totalConfidence = 0.0;
            double totalActivation = 0.0;
            for (SemanticConcept concept : concepts.values()) {
                totalConfidence += concept.getConfidence();
                totalActivation += concept.activationStrength(now);
            }
            int count = concepts.size();
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("concepts_count", count);
            stats.put("associations_count", associations.size());
            stats.put("average_confidence", count == 0 ? 0.0 : totalConfidence / count);
            stats.put("average_activation", count == 0 ? 0.0 : totalActivation / count);
            stats.put("last_consolidation", lastConsolidation);
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            concepts.clear();
            associations.clear();
            nameToId.clear();
            lastConsolidation = 0.0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SemanticStoreSettings getSettings() {
        return settings;
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
