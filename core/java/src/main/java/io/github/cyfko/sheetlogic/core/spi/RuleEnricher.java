package io.github.cyfko.sheetlogic.core.spi;

import io.github.cyfko.sheetlogic.core.report.LogicExtractionResult;

import java.util.Map;

/**
 * Optional post-processing step that attaches descriptive metadata to an extracted cluster,
 * such as a business-friendly name or a summary of the rule it implements.
 * <p>
 * Enrichment is best effort: an enricher that throws is logged and skipped, and the returned
 * annotations never replace values computed by the compiler.
 * </p>
 *
 * <pre>{@code
 * RuleEnricher naming = result -> Map.of("title", "Net price after discount");
 * SheetLogicCompiler compiler = SheetLogicCompiler.create().withEnricher(naming);
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RuleEnricher {

    /**
     * @param result the extracted cluster
     * @return annotations to attach, possibly empty
     */
    Map<String, String> enrich(LogicExtractionResult result);
}
