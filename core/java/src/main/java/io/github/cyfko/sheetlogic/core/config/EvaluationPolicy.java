package io.github.cyfko.sheetlogic.core.config;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.Instant;

/**
 * Configuration of the expression evaluator.
 *
 * <ul>
 *   <li><strong>epoch</strong>: day zero of date serials (default: 1899-12-30, so that serial 1 is 1899-12-31
 *       and serial 45000 is 2023-03-15, matching spreadsheet serials after February 1900)</li>
 *   <li><strong>clock</strong>: source of {@code TODAY()}/{@code NOW()}; fixed by default so evaluation is reproducible</li>
 *   <li><strong>parallelism</strong>: number of clusters evaluated concurrently (1 = caller thread)</li>
 * </ul>
 *
 * <pre>{@code
 * EvaluationPolicy policy = EvaluationPolicy.defaults();
 * EvaluationPolicy policy = EvaluationPolicy.builder()
 *     .clock(Clock.fixed(Instant.parse("2024-01-31T00:00:00Z"), ZoneOffset.UTC))
 *     .parallelism(4)
 *     .build();
 * }</pre>
 *
 * @param epoch       day zero of date serials
 * @param clock       clock backing volatile date functions
 * @param parallelism worker threads used for cluster evaluation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationPolicy(
        LocalDate epoch,
        Clock clock,
        int parallelism
) {

    public static final LocalDate SPREADSHEET_EPOCH = LocalDate.of(1899, 12, 30);

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    public EvaluationPolicy {
        if (epoch == null) {
            throw new IllegalArgumentException("epoch is required");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock is required");
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
    }

    /**
     * Default configuration: spreadsheet epoch, fixed clock at 2024-01-01T00:00Z, one worker per available processor.
     *
     * @return default configuration
     */
    public static EvaluationPolicy defaults() {
        return new EvaluationPolicy(SPREADSHEET_EPOCH, FIXED_CLOCK, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Single-threaded configuration, useful for debugging and deterministic logging.
     *
     * @return sequential configuration
     */
    public static EvaluationPolicy sequential() {
        return new EvaluationPolicy(SPREADSHEET_EPOCH, FIXED_CLOCK, 1);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocalDate _epoch = SPREADSHEET_EPOCH;
        private Clock _clock = FIXED_CLOCK;
        private int _parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        private Builder() {}

        public EvaluationPolicy build() {
            return new EvaluationPolicy(_epoch, _clock, _parallelism);
        }

        public Builder epoch(LocalDate epoch) { this._epoch = epoch; return this; }
        public Builder clock(Clock clock) { this._clock = clock; return this; }
        public Builder parallelism(int parallelism) { this._parallelism = parallelism; return this; }
    }
}
