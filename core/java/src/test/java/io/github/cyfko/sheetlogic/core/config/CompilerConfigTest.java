package io.github.cyfko.sheetlogic.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CompilerConfig} and the policies it aggregates.
 * Covers presets, builder defaults and validation.
 */
@DisplayName("CompilerConfig Tests")
class CompilerConfigTest {

    // ============================================================================
    // CompilerConfig
    // ============================================================================

    @Test
    @DisplayName("Should build CompilerConfig with default policies")
    void shouldBuildWithDefaults() {
        // When
        CompilerConfig config = CompilerConfig.defaults();

        // Then
        assertEquals(ParserPolicy.defaults(), config.getParserPolicy());
        assertEquals(CachePolicy.defaults(), config.getCachePolicy());
        assertEquals(SynthesisPolicy.defaults(), config.getSynthesisPolicy());
        assertEquals(EvaluationPolicy.SPREADSHEET_EPOCH, config.getEvaluationPolicy().epoch());
    }

    @Test
    @DisplayName("Should keep defaults for policies that are not overridden")
    void shouldOverrideSinglePolicy() {
        // When
        CompilerConfig config = CompilerConfig.builder()
                .parserPolicy(ParserPolicy.strict())
                .build();

        // Then
        assertEquals(ParserPolicy.strict(), config.getParserPolicy());
        assertEquals(CachePolicy.defaults(), config.getCachePolicy());
    }

    @Test
    @DisplayName("Should reject null policies")
    void shouldRejectNullPolicies() {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        assertThrows(NullPointerException.class, () -> builder.parserPolicy(null));
        assertThrows(NullPointerException.class, () -> builder.evaluationPolicy(null));
    }

    // ============================================================================
    // ParserPolicy
    // ============================================================================

    @Test
    @DisplayName("Should expose parser presets")
    void parserPresets() {
        ParserPolicy defaults = ParserPolicy.defaults();
        assertEquals("DEFAULT_POLICY", defaults.policyName());
        assertEquals(8192, defaults.maxFormulaLength());
        assertEquals(64, defaults.maxNestingDepth());
        assertEquals(1000, defaults.maxRangeExpansion());

        assertTrue(ParserPolicy.strict().maxNestingDepth() < defaults.maxNestingDepth());
        assertTrue(ParserPolicy.relaxed().maxRangeExpansion() > defaults.maxRangeExpansion());
    }

    @Test
    @DisplayName("Should build a custom parser policy")
    void parserBuilder() {
        // When
        ParserPolicy policy = ParserPolicy.builder()
                .maxNestingDepth(4)
                .dynamicFunctions(Set.of(" indirect "))
                .build();

        // Then
        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(4, policy.maxNestingDepth());
        assertTrue(policy.isDynamic("Indirect"));
        assertFalse(policy.isDynamic("OFFSET"));
        assertFalse(policy.isDynamic(null));
    }

    @Test
    @DisplayName("Should validate parser limits")
    void parserValidation() {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxFormulaLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxNestingDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxRangeExpansion(0).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().dynamicFunctions(null).build());
    }

    // ============================================================================
    // CachePolicy / SynthesisPolicy / EvaluationPolicy
    // ============================================================================

    @Test
    @DisplayName("Should expose cache presets")
    void cachePresets() {
        assertTrue(CachePolicy.defaults().cacheEnabled());
        assertEquals(1000, CachePolicy.defaults().cacheSize());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(42, CachePolicy.custom(42).cacheSize());
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
    }

    @Test
    void synthesisPresets() {
        assertEquals(200, SynthesisPolicy.defaults().maxCasesPerCluster());
        assertFalse(SynthesisPolicy.observedOnly().includeBoundaries());
        assertThrows(IllegalArgumentException.class, () -> new SynthesisPolicy(true, true, 0));
    }

    @Test
    @DisplayName("Should validate evaluation settings")
    void evaluationPolicy() {
        EvaluationPolicy sequential = EvaluationPolicy.sequential();
        assertEquals(1, sequential.parallelism());
        assertEquals(LocalDate.of(1899, 12, 30), sequential.epoch());

        EvaluationPolicy custom = EvaluationPolicy.builder()
                .epoch(LocalDate.of(1904, 1, 1))
                .clock(Clock.systemUTC())
                .parallelism(3)
                .build();
        assertEquals(3, custom.parallelism());

        assertThrows(IllegalArgumentException.class, () -> EvaluationPolicy.builder().parallelism(0).build());
        assertThrows(IllegalArgumentException.class, () -> EvaluationPolicy.builder().epoch(null).build());
        assertThrows(IllegalArgumentException.class, () -> EvaluationPolicy.builder().clock(null).build());
    }
}
