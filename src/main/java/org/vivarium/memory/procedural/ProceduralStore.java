package org.vivarium.memory.procedural;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.vivarium.memory.IMemoryStore;
import org.vivarium.memory.MemoryLevel;
import org.vivarium.memory.MemoryQueryParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library of learned behaviour.
 * <p>
 * <b>Learning:</b> every experience becomes a new {@link ProceduralPattern} plus a
 * {@link DecisionPattern}; nothing is merged at learning time. {@link #optimizePatterns()} later
 * folds duplicates together, drops ineffective inexperienced patterns and lowers the automation
 * of unreliable ones.
 * <p>
 * <b>Automation:</b> {@link #executeBestPattern(Map)} runs the top-ranked pattern only if that
 * pattern may be automated in the context; otherwise the decision is left to the caller.
 * <p>
 * All read methods return copies.
 */
public class ProceduralStore implements IMemoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(ProceduralStore.class);

    private static final double REMOVAL_EFFECTIVENESS = 0.2;
    private static final long REMOVAL_MIN_EXECUTIONS = 3;
    private static final double DECAY_BELOW_SUCCESS_RATE = 0.3;
    private static final double LEARNED_SUCCESS_AUTOMATION = 0.3;
    private static final double LEARNED_FAILURE_AUTOMATION = 0.1;
    private static final double DECISION_SUCCESS_CONFIDENCE = 0.8;
    private static final double DECISION_FAILURE_CONFIDENCE = 0.3;
    private static final Pattern PATTERN_ID = Pattern.compile("pattern_(\\d+)");

    private final ProceduralStoreSettings settings;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, ProceduralPattern> patterns = new LinkedHashMap<>();
    // Keyed by normalized conditions
    private final Map<Map<String, Object>, DecisionPattern> decisionPatterns = new LinkedHashMap<>();

    private long nextPatternNumber;
    private long automatedExecutions;
    private long manualExecutions;
    private double lastOptimization;

    public ProceduralStore(ProceduralStoreSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProceduralStore(ProceduralStoreSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * Adds a pattern, replacing any pattern with the same id.
     * @param pattern The pattern; the store keeps a copy.
     */
    public void addPattern(ProceduralPattern pattern) {
        lock.writeLock().lock();
        try {
            patterns.put(pattern.getPatternId(), pattern.copy());
            advancePatternNumber(pattern.getPatternId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ProceduralPattern> getPattern(String patternId) {
        lock.readLock().lock();
        try {
            ProceduralPattern pattern = patterns.get(patternId);
            return pattern == null ? Optional.empty() : Optional.of(pattern.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ranks every pattern for a context.
     *
     * @param context Behaviour context.
     * @return Copies with their relevance, most relevant first.
     */
    public List<ScoredPattern> findApplicablePatterns(Map<String, ?> context) {
        double now = now();
        lock.readLock().lock();
        try {
            return rank(context, now);
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds a lock
    private List<ScoredPattern> rank(Map<String, ?> context, double now) {
        List<ScoredPattern> ranked = new ArrayList<>();
        for (ProceduralPattern pattern : patterns.values()) {
            double relevance = relevance(pattern, context, now);
            if (relevance > 0.0) {
                ranked.add(new ScoredPattern(pattern.copy(), relevance));
            }
        }
        ranked.sort(Comparator.comparingDouble(ScoredPattern::relevance).reversed());
        return ranked;
    }

    static double relevance(ProceduralPattern pattern, Map<String, ?> context, double now) {
        double recency = 1.0;
        if (pattern.getLastExecution() > 0.0) {
            double hours = Math.max(0.0, now - pattern.getLastExecution()) / 3600.0;
            recency = Math.pow(0.9, hours);
        }
        return 0.4 * pattern.conditionMatch(context) + 0.4 * pattern.effectiveness() + 0.2 * recency;
    }

    /**
     * Executes the most relevant pattern if it may be automated in this context.
     *
     * @param context Behaviour context.
     * @return The execution, or empty if the caller has to decide manually.
     */
    public Optional<PatternExecution> executeBestPattern(Map<String, ?> context) {
        double now = now();
        lock.writeLock().lock();
        try {
            List<ScoredPattern> ranked = rank(context, now);
            if (ranked.isEmpty()) {
                manualExecutions++;
                return Optional.empty();
            }
            ScoredPattern best = ranked.get(0);
            ProceduralPattern pattern = patterns.get(best.pattern().getPatternId());
            if (!pattern.canAutomate(context)) {
                manualExecutions++;
                return Optional.empty();
            }
            long started = System.nanoTime();
            boolean success = !pattern.getActionSequence().isEmpty();
            double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
            pattern.recordExecution(success, elapsed, now);
            automatedExecutions++;
            LOG.debug("Automated execution of pattern '{}' (relevance {})", pattern.getPatternId(), best.relevance());
            return Optional.of(new PatternExecution(pattern.getPatternId(), success, elapsed,
                pattern.getActionSequence(), best.relevance()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records the outcome of an experience as a new pattern and a new decision pattern.
     *
     * @param context Conditions under which the actions were taken; become trigger conditions.
     * @param actions The actions taken.
     * @param outcome Short description of the outcome.
     * @param success Whether the experience was favourable.
     * @return A copy of the new pattern.
     */
    public ProceduralPattern learnFromExperience(Map<String, ?> context, List<ActionStep> actions,
                                                 String outcome, boolean success) {
        double now = now();
        lock.writeLock().lock();
        try {
            String patternId = "pattern_" + nextPatternNumber++;
            ProceduralPattern pattern = ProceduralPattern.builder(patternId)
                .name("Learned from " + (success ? "successful" : "failed") + " experience")
                .description("Outcome: " + outcome)
                .actionSequence(actions)
                .triggerConditions(context)
                .successCount(success ? 1 : 0)
                .failureCount(success ? 0 : 1)
                .totalExecutions(1)
                .automationLevel(success ? LEARNED_SUCCESS_AUTOMATION : LEARNED_FAILURE_AUTOMATION)
                .minAutomationThreshold(settings.minAutomationThreshold())
                .recentWindow(settings.recentOutcomeWindow())
                .recentOutcomes(List.of(success))
                .createdAt(now)
                .build();
            patterns.put(patternId, pattern);

            String decision = actions.isEmpty() ? "unknown" : actions.get(0).actionType();
            DecisionPattern decisionPattern = new DecisionPattern("decision_" + patternId, context, decision, outcome,
                success ? DECISION_SUCCESS_CONFIDENCE : DECISION_FAILURE_CONFIDENCE, 0);
            decisionPatterns.put(decisionPattern.conditionKey(), decisionPattern);
            return pattern.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param conditions The current conditions.
     * @return the decision of the best matching decision pattern, if its match exceeds the
     *         recommendation threshold.
     */
    public Optional<String> getDecisionRecommendation(Map<String, ?> conditions) {
        lock.writeLock().lock();
        try {
            DecisionPattern best = null;
            double bestScore = 0.0;
            for (DecisionPattern candidate : decisionPatterns.values()) {
                double score = candidate.matches(conditions);
                if (score > bestScore && score > settings.recommendationThreshold()) {
                    best = candidate;
                    bestScore = score;
                }
            }
            if (best == null) {
                return Optional.empty();
            }
            best.markUsed();
            return Optional.of(best.getDecision());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Optimizes the library in three steps:
     * <ol>
     *   <li>patterns with the same action sequence and trigger conditions are folded into the oldest;</li>
     *   <li>patterns with effectiveness below 0.2 and fewer than 3 executions are removed;</li>
     *   <li>patterns with a success rate below 0.3 lose 0.1 automation.</li>
     * </ol>
     *
     * @return Number of patterns merged, removed or decayed.
     */
    public int optimizePatterns() {
        double now = now();
        lock.writeLock().lock();
        try {
            int merged = 0;
            int removed = 0;
            int decayed = 0;

            List<ProceduralPattern> survivors = new ArrayList<>();
            Iterator<ProceduralPattern> it = patterns.values().iterator();
            while (it.hasNext()) {
                ProceduralPattern pattern = it.next();
                ProceduralPattern original = null;
                for (ProceduralPattern survivor : survivors) {
                    if (survivor.isDuplicateOf(pattern)) {
                        original = survivor;
                        break;
                    }
                }
                if (original != null) {
                    original.absorb(pattern);
                    it.remove();
                    merged++;
                } else {
                    survivors.add(pattern);
                }
            }

            it = patterns.values().iterator();
            while (it.hasNext()) {
                ProceduralPattern pattern = it.next();
                if (pattern.effectiveness() < REMOVAL_EFFECTIVENESS && pattern.getTotalExecutions() < REMOVAL_MIN_EXECUTIONS) {
                    it.remove();
                    removed++;
                } else if (pattern.successRate() < DECAY_BELOW_SUCCESS_RATE && pattern.decayAutomation()) {
                    decayed++;
                }
            }

            lastOptimization = now;
            if (merged + removed + decayed > 0) {
                LOG.debug("Procedural optimization: {} merged, {} removed, {} decayed", merged, removed, decayed);
            }
            return merged + removed + decayed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return copies of all patterns, in insertion order.
     */
    public List<ProceduralPattern> getPatterns() {
        lock.readLock().lock();
        try {
            List<ProceduralPattern> copies = new ArrayList<>(patterns.size());
            for (ProceduralPattern pattern : patterns.values()) {
                copies.add(pattern.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copies of all decision patterns, in insertion order.
     */
    public List<DecisionPattern> getDecisionPatterns() {
        lock.readLock().lock();
        try {
            List<DecisionPattern> copies = new ArrayList<>(decisionPatterns.size());
            for (DecisionPattern pattern : decisionPatterns.values()) {
                copies.add(pattern.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the whole content, used when restoring a serialized hierarchy.
     *
     * @param restoredPatterns  Patterns in insertion order.
     * @param restoredDecisions Decision patterns in insertion order.
     */
    public void restore(List<ProceduralPattern> restoredPatterns, List<DecisionPattern> restoredDecisions) {
        lock.writeLock().lock();
        try {
            patterns.clear();
            decisionPatterns.clear();
            nextPatternNumber = 0;
            for (ProceduralPattern pattern : restoredPatterns) {
                patterns.put(pattern.getPatternId(), pattern.copy());
                advancePatternNumber(pattern.getPatternId());
            }
            for (DecisionPattern decision : restoredDecisions) {
                decisionPatterns.put(decision.conditionKey(), decision.copy());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void advancePatternNumber(String patternId) {
        Matcher m = PATTERN_ID.matcher(patternId);
        if (m.matches()) {
            try {
                nextPatternNumber = Math.max(nextPatternNumber, Long.parseLong(m.group(1)) + 1);
            } catch (NumberFormatException e) {
                LOG.debug("Pattern id '{}' has an out-of-range number", patternId);
            }
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return patterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public MemoryLevel getLevel() {
        return MemoryLevel.PROCEDURAL;
    }

    @Override
    public boolean isAvailable() {
        return settings.enabled();
    }

    @Override
    public List<?> query(MemoryQueryParams params) {
        return findApplicablePatterns(params.context());
    }

    @Override
    public Map<String, Object> getStatistics() {
        lock.readLock().lock();
        try {
            long automatable = patterns.values().stream()
                .filter(p -> p.getAutomationLevel() >= p.getMinAutomationThreshold())
                .count();
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("patterns_count", patterns.size());
            stats.put("decision_patterns_count", decisionPatterns.size());
            stats.put("automatable_patterns", automatable);
            stats.put("automated_executions", automatedExecutions);
            stats.put("manual_executions", manualExecutions);
            stats.put("last_optimization", lastOptimization);
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            patterns.clear();
            decisionPatterns.clear();
            nextPatternNumber = 0;
            automatedExecutions = 0;
            manualExecutions = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProceduralStoreSettings getSettings() {
        return settings;
    }

    private double now() {
        return clock.millis() / 1000.0;
    }
}
