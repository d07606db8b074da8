package io.github.cyfko.sheetlogic.core;

import io.github.cyfko.sheetlogic.core.api.FormulaParser;
import io.github.cyfko.sheetlogic.core.ast.CellReference;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.ast.FormulaNodes;
import io.github.cyfko.sheetlogic.core.ast.FormulaPrinter;
import io.github.cyfko.sheetlogic.core.ast.RangeReference;
import io.github.cyfko.sheetlogic.core.config.CompilerConfig;
import io.github.cyfko.sheetlogic.core.eval.ClusterEvaluation;
import io.github.cyfko.sheetlogic.core.eval.ClusterEvaluator;
import io.github.cyfko.sheetlogic.core.eval.CycleResolution;
import io.github.cyfko.sheetlogic.core.eval.FormulaEvaluator;
import io.github.cyfko.sheetlogic.core.eval.TypeInference;
import io.github.cyfko.sheetlogic.core.graph.Cluster;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraph;
import io.github.cyfko.sheetlogic.core.graph.DependencyGraphBuilder;
import io.github.cyfko.sheetlogic.core.graph.EvaluationStep;
import io.github.cyfko.sheetlogic.core.graph.GraphNode;
import io.github.cyfko.sheetlogic.core.impl.BasicFormulaParser;
import io.github.cyfko.sheetlogic.core.model.ClassifiedCell;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.model.Workbook;
import io.github.cyfko.sheetlogic.core.parsing.ParseOutcome;
import io.github.cyfko.sheetlogic.core.parsing.UnsupportedConstruct;
import io.github.cyfko.sheetlogic.core.reference.NamedRangeTable;
import io.github.cyfko.sheetlogic.core.reference.ReferenceResolver;
import io.github.cyfko.sheetlogic.core.report.CellFailure;
import io.github.cyfko.sheetlogic.core.report.CompilationResult;
import io.github.cyfko.sheetlogic.core.report.CompiledFormula;
import io.github.cyfko.sheetlogic.core.report.ErrorReport;
import io.github.cyfko.sheetlogic.core.report.ErrorReporter;
import io.github.cyfko.sheetlogic.core.report.LogicExtractionResult;
import io.github.cyfko.sheetlogic.core.report.UnsupportedFeature;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;
import io.github.cyfko.sheetlogic.core.spi.RuleEnricher;
import io.github.cyfko.sheetlogic.core.synthesis.TestCase;
import io.github.cyfko.sheetlogic.core.synthesis.TestSynthesizer;
import io.github.cyfko.sheetlogic.core.value.ValueType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * High-level facade compiling a classified workbook into executable logic and regression tests.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li><strong>Parse:</strong> every formula cell into an AST with {@link FormulaParser}</li>
 *   <li><strong>Graph:</strong> build the {@link DependencyGraph} with {@link DependencyGraphBuilder}</li>
 *   <li><strong>Evaluate:</strong> each cluster with {@link ClusterEvaluator}, one task per cluster</li>
 *   <li><strong>Synthesize:</strong> regression cases with {@link TestSynthesizer} and infer types</li>
 *   <li><strong>Report:</strong> unsupported constructs, cycles and failures in an {@link ErrorReport}</li>
 *   <li><strong>Enrich:</strong> run the registered {@link RuleEnricher}s, if any</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * SheetLogicCompiler compiler = SheetLogicCompiler.create(CompilerConfig.builder()
 *     .parserPolicy(ParserPolicy.strict())
 *     .evaluationPolicy(EvaluationPolicy.sequential())
 *     .build());
 *
 * CompilationResult result = compiler.compile(workbook);
 * if (!result.canProceed()) {
 *     result.errorReport().criticalErrors().forEach(System.err::println);
 * }
 * }</pre>
 *
 * <p>
 * Compilation never throws for workbook content: bad formulas, cycles and unsupported functions
 * end up in the result. Instances are immutable and may be shared between threads.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SheetLogicCompiler {

    private static final Logger logger = Logger.getLogger(SheetLogicCompiler.class.getName());

    private final CompilerConfig config;
    private final FunctionRegistry registry;
    private final List<RuleEnricher> enrichers;

    private SheetLogicCompiler(CompilerConfig config, FunctionRegistry registry, List<RuleEnricher> enrichers) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.enrichers = List.copyOf(enrichers);
    }

    public static SheetLogicCompiler create() {
        return create(CompilerConfig.defaults());
    }

    public static SheetLogicCompiler create(CompilerConfig config) {
        return create(config, FunctionRegistry.withBuiltins());
    }

    /**
     * Creates a compiler with a caller-supplied function registry, for custom functions.
     *
     * @param config   compiler configuration
     * @param registry functions available to formulas
     * @return the compiler
     */
    public static SheetLogicCompiler create(CompilerConfig config, FunctionRegistry registry) {
        return new SheetLogicCompiler(config, registry, List.of());
    }

    /**
     * @param enricher enricher to run after extraction
     * @return a compiler that also runs {@code enricher}
     */
    public SheetLogicCompiler withEnricher(RuleEnricher enricher) {
        List<RuleEnricher> all = new ArrayList<>(enrichers);
        all.add(Objects.requireNonNull(enricher, "enricher"));
        return new SheetLogicCompiler(config, registry, all);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    /**
     * Compiles a workbook snapshot.
     *
     * @param workbook the classified workbook
     * @return graph, per-cluster results, parse failures and the error report
     */
    public CompilationResult compile(Workbook workbook) {
        Objects.requireNonNull(workbook, "workbook");
        long start = System.nanoTime();

        int parallelism = config.getEvaluationPolicy().parallelism();
        ExecutorService pool = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
        try {
            Parsed parsed = parse(workbook, pool);
            long parsedAt = System.nanoTime();
            logger.info(() -> String.format("Parsed %d formulas (%d failed) in %d ms",
                    parsed.formulas.size() + parsed.failures.size(), parsed.failures.size(), millis(start, parsedAt)));

            DependencyGraph graph = new DependencyGraphBuilder(config.getParserPolicy())
                    .build(workbook, parsed.formulas, parsed.failed());
            long graphAt = System.nanoTime();
            logger.info(() -> String.format("Built %s in %d ms", graph, millis(parsedAt, graphAt)));

            ErrorReporter reporter = new ErrorReporter(graph);
            List<UnsupportedFeature> unsupported = new ArrayList<>();
            parsed.unsupported.forEach((cell, constructs) -> {
                String formula = workbook.cell(cell).map(ClassifiedCell::rawFormula).orElse("");
                for (UnsupportedConstruct construct : constructs) {
                    logger.warning(() -> String.format("Unsupported %s in %s: %s", construct.function(), cell, construct.reason()));
                    unsupported.add(UnsupportedFeature.of(cell, formula, construct, reporter.impactOf(cell)));
                }
            });

            ClusterEvaluator evaluator = new ClusterEvaluator(
                    new FormulaEvaluator(registry, config.getEvaluationPolicy()), graph, workbook);
            TestSynthesizer synthesizer = new TestSynthesizer(evaluator, workbook, config.getSynthesisPolicy());
            List<Callable<Extraction>> tasks = new ArrayList<>();
            for (Cluster cluster : graph.clusters()) {
                tasks.add(() -> extract(cluster, graph, workbook, evaluator, synthesizer, unsupported));
            }
            List<Extraction> extractions = run(tasks, pool);
            long evaluatedAt = System.nanoTime();
            logger.info(() -> String.format("Evaluated %d clusters in %d ms", extractions.size(), millis(graphAt, evaluatedAt)));

            List<LogicExtractionResult> results = new ArrayList<>(extractions.size());
            List<CycleResolution> resolutions = new ArrayList<>();
            Set<Coordinate> mixed = new LinkedHashSet<>();
            for (Extraction extraction : extractions) {
                results.add(enrich(extraction.result));
                resolutions.addAll(extraction.result.cycles());
                mixed.addAll(extraction.mixed);
            }

            ErrorReport report = reporter
                    .failures(parsed.failures)
                    .unsupported(unsupported)
                    .cycles(graph.circularRefs())
                    .resolutions(resolutions)
                    .mixedTypes(mixed)
                    .build();

            logger.info(() -> String.format("Compiled workbook in %d ms, canProceed=%s",
                    millis(start, System.nanoTime()), report.canProceed()));
            return new CompilationResult(graph, results, parsed.failures, report);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    private Parsed parse(Workbook workbook, ExecutorService pool) {
        BasicFormulaParser parser = new BasicFormulaParser(
                new ReferenceResolver(NamedRangeTable.of(workbook.namedRanges()), workbook::extentOf),
                registry, config.getParserPolicy(), config.getCachePolicy());

        List<ClassifiedCell> formulaCells = new ArrayList<>();
        List<Callable<ParseOutcome>> tasks = new ArrayList<>();
        for (ClassifiedCell cell : workbook.cells()) {
            if (cell.role().participatesInGraph() && cell.hasFormula()) {
                formulaCells.add(cell);
                tasks.add(() -> parser.parse(cell.rawFormula(), cell.coordinate()));
            }
        }
        List<ParseOutcome> outcomes = run(tasks, pool);
        logger.fine(() -> "Parse cache: " + parser.getCacheStats());

        Parsed parsed = new Parsed();
        for (int i = 0; i < formulaCells.size(); i++) {
            ClassifiedCell cell = formulaCells.get(i);
            ParseOutcome outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                parsed.formulas.put(cell.coordinate(), outcome.ast());
                if (!outcome.unsupported().isEmpty()) {
                    parsed.unsupported.put(cell.coordinate(), outcome.unsupported());
                }
            } else {
                CellFailure failure = new CellFailure(cell.coordinate(), cell.rawFormula(), outcome.error());
                logger.warning(() -> "Formula could not be parsed: " + failure);
                parsed.failures.add(failure);
            }
        }
        return parsed;
    }

    private Extraction extract(Cluster cluster, DependencyGraph graph, Workbook workbook, ClusterEvaluator evaluator,
                               TestSynthesizer synthesizer, List<UnsupportedFeature> unsupported) {
        ClusterEvaluation observed = evaluator.evaluate(cluster);
        List<TestCase> cases = synthesizer.synthesize(cluster, observed);

        TypeInference types = new TypeInference();
        types.observeAll(observed.values());
        for (TestCase testCase : cases) {
            types.observeAll(testCase.inputs());
            types.observeAll(testCase.expectedOutputs());
        }

        List<CompiledFormula> formulas = new ArrayList<>();
        for (EvaluationStep step : graph.schedule()) {
            for (int id : step.nodes()) {
                GraphNode node = graph.node(id);
                if (node.clusterId() != cluster.id() || node.ast() == null) {
                    continue;
                }
                Coordinate cell = node.coordinate();
                String source = workbook.cell(cell).map(ClassifiedCell::rawFormula).orElse("");
                formulas.add(new CompiledFormula(cell, node.role(), source,
                        new FormulaPrinter(cell.sheet()).print(node.ast()), node.ast(),
                        FormulaNodes.functionNames(node.ast()), references(node.ast()),
                        types.typeOf(cell), observed.valueOf(cell)));
            }
        }

        Map<Coordinate, ValueType> inputTypes = new LinkedHashMap<>();
        cluster.inputs().forEach(input -> inputTypes.put(input, types.typeOf(input)));
        Map<Coordinate, ValueType> outputTypes = new LinkedHashMap<>();
        cluster.outputs().forEach(output -> outputTypes.put(output, types.typeOf(output)));

        List<UnsupportedFeature> own = new ArrayList<>();
        for (UnsupportedFeature feature : unsupported) {
            if (graph.node(feature.coordinate()).map(node -> node.clusterId() == cluster.id()).orElse(false)) {
                own.add(feature);
            }
        }

        LogicExtractionResult result = new LogicExtractionResult(cluster, formulas, inputTypes, outputTypes, cases,
                own, observed.cycles(), Map.of());
        logger.fine(() -> String.format("Cluster %s: %d formulas, %d test cases",
                cluster.name(), formulas.size(), cases.size()));
        return new Extraction(result, types.mixed());
    }

    private static List<String> references(FormulaNode ast) {
        Set<String> references = new LinkedHashSet<>();
        FormulaNodes.walk(ast, node -> {
            if (node instanceof CellReference cell) {
                references.add(cell.name() != null ? cell.name() : cell.coordinate().toString());
            } else if (node instanceof RangeReference range) {
                references.add(range.name() != null ? range.name() : range.range().toString());
            }
        });
        return new ArrayList<>(references);
    }

    private LogicExtractionResult enrich(LogicExtractionResult result) {
        LogicExtractionResult enriched = result;
        for (RuleEnricher enricher : enrichers) {
            try {
                Map<String, String> annotations = enricher.enrich(enriched);
                if (annotations != null && !annotations.isEmpty()) {
                    enriched = enriched.withAnnotations(annotations);
                }
            } catch (RuntimeException e) {
                logger.warning(() -> String.format("Enricher %s failed on cluster %s: %s",
                        enricher.getClass().getName(), result.clusterId(), e));
            }
        }
        return enriched;
    }

    private static <T> List<T> run(List<Callable<T>> tasks, ExecutorService pool) {
        List<T> results = new ArrayList<>(tasks.size());
        try {
            if (pool == null) {
                for (Callable<T> task : tasks) {
                    results.add(task.call());
                }
                return results;
            }
            for (Future<T> future : pool.invokeAll(tasks)) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Compilation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Compilation task failed", e.getCause());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Compilation task failed", e);
        }
    }

    private static long millis(long from, long to) {
        return (to - from) / 1_000_000;
    }

    private static final class Parsed {
        private final Map<Coordinate, FormulaNode> formulas = new LinkedHashMap<>();
        private final Map<Coordinate, List<UnsupportedConstruct>> unsupported = new LinkedHashMap<>();
        private final List<CellFailure> failures = new ArrayList<>();

        Set<Coordinate> failed() {
            Set<Coordinate> failed = new LinkedHashSet<>();
            failures.forEach(failure -> failed.add(failure.coordinate()));
            return failed;
        }
    }

    private record Extraction(LogicExtractionResult result, Set<Coordinate> mixed) {}
}
