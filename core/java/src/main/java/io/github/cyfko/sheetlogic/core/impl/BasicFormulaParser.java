package io.github.cyfko.sheetlogic.core.impl;

import io.github.cyfko.sheetlogic.core.api.FormulaParser;
import io.github.cyfko.sheetlogic.core.cache.BoundedLRUCache;
import io.github.cyfko.sheetlogic.core.config.CachePolicy;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.exception.ArityException;
import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.sheetlogic.core.exception.UnknownReferenceException;
import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.parsing.FormulaError;
import io.github.cyfko.sheetlogic.core.parsing.FormulaLexer;
import io.github.cyfko.sheetlogic.core.parsing.ParseOutcome;
import io.github.cyfko.sheetlogic.core.parsing.PostfixAstBuilder;
import io.github.cyfko.sheetlogic.core.parsing.PostfixConverter;
import io.github.cyfko.sheetlogic.core.parsing.Token;
import io.github.cyfko.sheetlogic.core.reference.ReferenceResolver;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: lexing, shunting-yard conversion and stack-based AST construction.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li>{@link FormulaLexer#tokenize(String)}: token boundaries only</li>
 *   <li>{@link PostfixConverter#toPostfix(List, ParserPolicy)}: operator precedence, argument counting,
 *       nesting limit</li>
 *   <li>{@link PostfixAstBuilder#build(List, String)}: reference resolution and arity checks</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * References resolve relative to the formula's sheet only, so outcomes are cached per
 * {@code (sheet, formula text)}. A formula copied down a column with absolute references is
 * parsed once. Failures are cached too.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser(resolver, FunctionRegistry.withBuiltins());
 * ParseOutcome outcome = parser.parse("=SUM(A1:A3)*TaxRate", Coordinate.of("Sheet1", "B1"));
 *
 * // Strict limits, no cache
 * FormulaParser strict = new BasicFormulaParser(resolver, registry, ParserPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger logger = Logger.getLogger(BasicFormulaParser.class.getName());

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    private final PostfixAstBuilder astBuilder;
    protected final BoundedLRUCache<String, ParseOutcome> cache;

    public BasicFormulaParser(ReferenceResolver resolver, FunctionRegistry registry) {
        this(resolver, registry, ParserPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param resolver     reference resolver of the workbook being compiled
     * @param registry     functions known to the compiler
     * @param parserPolicy complexity limits
     * @param cachePolicy  cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicFormulaParser(ReferenceResolver resolver, FunctionRegistry registry,
                              ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }
        this.parserPolicy = parserPolicy;
        this.cachePolicy = cachePolicy;
        this.astBuilder = new PostfixAstBuilder(resolver, registry, parserPolicy);
        this.cache = cachePolicy.cacheEnabled()
                ? new BoundedLRUCache<>(cachePolicy.cacheSize())
                : null;
    }

    @Override
    public ParseOutcome parse(String formula, Coordinate cell) {
        if (formula == null || formula.isBlank()) {
            return ParseOutcome.failure(FormulaError.from(new FormulaSyntaxException("Formula cannot be null or empty")));
        }
        String sheet = cell.sheet();
        if (cache == null) {
            return parseUncached(formula, sheet);
        }
        return cache.computeIfAbsent(sheet + '\u0000' + formula, key -> parseUncached(formula, sheet));
    }

    private ParseOutcome parseUncached(String formula, String sheet) {
        try {
            if (formula.length() > parserPolicy.maxFormulaLength()) {
                throw new FormulaSyntaxException(String.format(
                        "Formula too long (%d characters, max: %d). Policy applied: %s",
                        formula.length(), parserPolicy.maxFormulaLength(), parserPolicy.policyName()));
            }
            List<Token> tokens = FormulaLexer.tokenize(formula);
            List<Token> postfix = PostfixConverter.toPostfix(tokens, parserPolicy);
            return astBuilder.build(postfix, sheet);
        } catch (FormulaSyntaxException e) {
            logger.fine(() -> String.format("Syntax error in %s on sheet %s: %s", formula, sheet, e.getMessage()));
            return ParseOutcome.failure(FormulaError.from(e));
        } catch (UnknownReferenceException e) {
            logger.fine(() -> String.format("Unknown reference in %s on sheet %s: %s", formula, sheet, e.getMessage()));
            return ParseOutcome.failure(FormulaError.from(e));
        } catch (ArityException e) {
            logger.fine(() -> String.format("Arity error in %s on sheet %s: %s", formula, sheet, e.getMessage()));
            return ParseOutcome.failure(FormulaError.from(e));
        } catch (WorkbookDefinitionException e) {
            logger.fine(() -> String.format("Invalid reference in %s on sheet %s: %s", formula, sheet, e.getMessage()));
            return ParseOutcome.failure(FormulaError.from(e));
        }
    }

    /**
     * Clears the parser cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map with size, capacity, hits and misses, or {@code enabled=false}
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }
        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cachePolicy.cacheSize(),
                "hits", cache.getHits(),
                "misses", cache.getMisses()
        );
    }
}
