package org.vivarium.memory;

import java.util.Objects;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.vivarium.memory.procedural.ProceduralStoreSettings;
import org.vivarium.memory.semantic.SemanticStoreSettings;
import org.vivarium.memory.sensory.SensoryBufferSettings;

/**
 * Configuration of the whole memory hierarchy, read from the {@code vivarium.memory} block.
 *
 * @param sensory               Sensory buffer tunables.
 * @param episodicEnabled       Whether episodic memory is exposed as a level.
 * @param semantic              Semantic store tunables.
 * @param procedural            Procedural store tunables.
 * @param defaultSemanticLimit  Result limit of semantic queries that do not set one.
 * @param statusCacheTtlMillis  Lifetime of the cached hierarchy status.
 */
public record MemoryHierarchySettings(
    SensoryBufferSettings sensory,
    boolean episodicEnabled,
    SemanticStoreSettings semantic,
    ProceduralStoreSettings procedural,
    int defaultSemanticLimit,
    long statusCacheTtlMillis
) {

    public static final int DEFAULT_SEMANTIC_LIMIT = 10;
    public static final long DEFAULT_STATUS_CACHE_TTL_MILLIS = 1000L;

    public MemoryHierarchySettings {
        Objects.requireNonNull(sensory, "sensory");
        Objects.requireNonNull(semantic, "semantic");
        Objects.requireNonNull(procedural, "procedural");
        if (defaultSemanticLimit < 1) {
            throw new IllegalArgumentException("defaultSemanticLimit must be >= 1");
        }
        if (statusCacheTtlMillis < 0) {
            throw new IllegalArgumentException("statusCacheTtlMillis must be >= 0");
        }
    }

    public static MemoryHierarchySettings defaults() {
        return new MemoryHierarchySettings(SensoryBufferSettings.defaults(), true, SemanticStoreSettings.defaults(),
            ProceduralStoreSettings.defaults(), DEFAULT_SEMANTIC_LIMIT, DEFAULT_STATUS_CACHE_TTL_MILLIS);
    }

    public static MemoryHierarchySettings fromConfig(Config options) {
        return new MemoryHierarchySettings(
            SensoryBufferSettings.fromConfig(block(options, "sensory")),
            !options.hasPath("episodic.enabled") || options.getBoolean("episodic.enabled"),
            SemanticStoreSettings.fromConfig(block(options, "semantic")),
            ProceduralStoreSettings.fromConfig(block(options, "procedural")),
            options.hasPath("defaultSemanticLimit") ? options.getInt("defaultSemanticLimit") : DEFAULT_SEMANTIC_LIMIT,
            options.hasPath("statusCacheTtlMs") ? options.getLong("statusCacheTtlMs") : DEFAULT_STATUS_CACHE_TTL_MILLIS);
    }

    private static Config block(Config options, String path) {
        return options.hasPath(path) ? options.getConfig(path) : ConfigFactory.empty();
    }
}
