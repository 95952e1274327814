package org.vivarium.memory.serialization;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.vivarium.memory.procedural.ActionStep;
import org.vivarium.memory.procedural.ProceduralPattern;
import org.vivarium.memory.procedural.ProceduralStore;
import org.vivarium.memory.procedural.ProceduralStoreSettings;
import org.vivarium.memory.semantic.SemanticConcept;
import org.vivarium.memory.semantic.SemanticStore;
import org.vivarium.memory.semantic.SemanticStoreSettings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class MemoryHierarchySerializerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    private final MemoryHierarchySerializer serializer = new MemoryHierarchySerializer();
    private SemanticStore semantic;
    private ProceduralStore procedural;

    @BeforeEach
    void setUp() {
        semantic = new SemanticStore(SemanticStoreSettings.defaults(), CLOCK);
        procedural = new ProceduralStore(ProceduralStoreSettings.defaults(), CLOCK);

        semantic.reinforce("decay", 10, 0.5);
        semantic.reinforce("recovery", 12, 0.6);
        semantic.relate("concept_decay", "concept_recovery");
        procedural.learnFromExperience(Map.of("threat", "high", "energy", 0.4),
            List.of(new ActionStep("protect", Map.of("force", 0.9))), "survived", true);
    }

    @Test
    void serializationIsDeterministic() {
        String first = serializer.toJson(serializer.serialize(semantic, procedural));
        String second = serializer.toJson(serializer.serialize(semantic, procedural));
        String third = serializer.toJson(serializer.serialize(semantic, procedural));

        assertEquals(first, second);
        assertEquals(second, third);
    }

    @Test
    void restoresConceptsAssociationsAndPatterns() {
        JsonObject tree = serializer.parse(serializer.toJson(serializer.serialize(semantic, procedural)));
        SemanticStore restoredSemantic = new SemanticStore(SemanticStoreSettings.defaults(), CLOCK);
        ProceduralStore restoredProcedural = new ProceduralStore(ProceduralStoreSettings.defaults(), CLOCK);

        serializer.restore(tree, restoredSemantic, restoredProcedural);

        SemanticConcept original = semantic.getConcept("concept_recovery").orElseThrow();
        SemanticConcept restored = restoredSemantic.getConcept("concept_recovery").orElseThrow();
        assertThat(restored.getConfidence()).isEqualTo(original.getConfidence());
        assertThat(restored.getActivationCount()).isEqualTo(original.getActivationCount());
        assertThat(restored.getRelatedConcepts()).containsExactly("concept_decay");
        assertThat(restored.getProperties()).containsEntry("last_group_size", 12L);
        assertThat(restoredSemantic.getAssociations()).hasSize(1);

        ProceduralPattern pattern = restoredProcedural.getPattern("pattern_0").orElseThrow();
        assertThat(pattern.getActionSequence()).containsExactly(new ActionStep("protect", Map.of("force", 0.9)));
        assertThat(pattern.getTriggerConditions()).containsEntry("threat", "high");
        assertThat(restoredProcedural.getDecisionPatterns()).hasSize(1);
        assertEquals(serializer.toJson(tree), serializer.toJson(serializer.serialize(restoredSemantic, restoredProcedural)));
    }

    @Test
    void omitsAbsentStores() {
        JsonObject tree = serializer.serialize(null, procedural);

        assertThat(tree.has("semantic_store")).isFalse();
        assertThat(tree.has("procedural_store")).isTrue();
    }

    @Test
    void rejectsMalformedTreeAndLeavesStoresUntouched() {
        JsonObject tree = serializer.parse("{\"semantic_store\": {\"concepts\": 5, \"associations\": []}}");

        assertThatThrownBy(() -> serializer.restore(tree, semantic, procedural))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
        assertThat(semantic.size()).isEqualTo(2);
    }

    @Test
    void rejectsNonObjectJson() {
        assertThatThrownBy(() -> serializer.parse("[1, 2]"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
