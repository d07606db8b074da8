package io.github.cyfko.sheetlogic.core.config;

import java.util.Objects;

/**
 * Aggregated configuration of a {@link io.github.cyfko.sheetlogic.core.SheetLogicCompiler}.
 *
 * <pre>{@code
 * CompilerConfig config = CompilerConfig.builder()
 *     .parserPolicy(ParserPolicy.strict())
 *     .evaluationPolicy(EvaluationPolicy.sequential())
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CompilerConfig {

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    private final EvaluationPolicy evaluationPolicy;
    private final SynthesisPolicy synthesisPolicy;

    private CompilerConfig(Builder builder) {
        this.parserPolicy = builder.parserPolicy;
        this.cachePolicy = builder.cachePolicy;
        this.evaluationPolicy = builder.evaluationPolicy;
        this.synthesisPolicy = builder.synthesisPolicy;
    }

    public static CompilerConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public ParserPolicy getParserPolicy() { return parserPolicy; }
    public CachePolicy getCachePolicy() { return cachePolicy; }
    public EvaluationPolicy getEvaluationPolicy() { return evaluationPolicy; }
    public SynthesisPolicy getSynthesisPolicy() { return synthesisPolicy; }

    public static final class Builder {
        private ParserPolicy parserPolicy = ParserPolicy.defaults();
        private CachePolicy cachePolicy = CachePolicy.defaults();
        private EvaluationPolicy evaluationPolicy = EvaluationPolicy.defaults();
        private SynthesisPolicy synthesisPolicy = SynthesisPolicy.defaults();

        public Builder parserPolicy(ParserPolicy policy) {
            this.parserPolicy = Objects.requireNonNull(policy, "parserPolicy");
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public Builder evaluationPolicy(EvaluationPolicy policy) {
            this.evaluationPolicy = Objects.requireNonNull(policy, "evaluationPolicy");
            return this;
        }

        public Builder synthesisPolicy(SynthesisPolicy policy) {
            this.synthesisPolicy = Objects.requireNonNull(policy, "synthesisPolicy");
            return this;
        }

        public CompilerConfig build() { return new CompilerConfig(this); }
    }
}
