package io.github.cyfko.sheetlogic.core.eval;

import io.github.cyfko.sheetlogic.core.ast.ArrayLiteral;
import io.github.cyfko.sheetlogic.core.ast.BinaryOp;
import io.github.cyfko.sheetlogic.core.ast.CellReference;
import io.github.cyfko.sheetlogic.core.ast.DynamicReference;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.ast.FormulaVisitor;
import io.github.cyfko.sheetlogic.core.ast.FunctionCall;
import io.github.cyfko.sheetlogic.core.ast.Literal;
import io.github.cyfko.sheetlogic.core.ast.MissingArgument;
import io.github.cyfko.sheetlogic.core.ast.RangeReference;
import io.github.cyfko.sheetlogic.core.ast.UnaryOp;
import io.github.cyfko.sheetlogic.core.config.EvaluationPolicy;
import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.spi.FunctionArguments;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;
import io.github.cyfko.sheetlogic.core.value.ValueGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Tree-walking interpreter for formula ASTs.
 * <p>
 * The evaluator is stateless: every call to {@link #evaluate(FormulaNode, ValueBinding)} reads the
 * cells it needs from the binding and returns a single value. Evaluation never throws for formula
 * content; spreadsheet errors are returned as {@link EvaluatedValue.ErrorValue}.
 * </p>
 *
 * <ul>
 *   <li>a multi-cell range used where a single value is expected is {@code #VALUE!}</li>
 *   <li>an array constant used where a single value is expected yields its top-left element</li>
 *   <li>an unknown function is {@code #NAME?}</li>
 *   <li>a {@link DynamicReference} is {@link ErrorKind#UNSUPPORTED}</li>
 * </ul>
 *
 * <pre>{@code
 * FormulaEvaluator evaluator = new FormulaEvaluator(FunctionRegistry.withBuiltins(), EvaluationPolicy.defaults());
 * EvaluatedValue total = evaluator.evaluate(ast, ValueBinding.of(values));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaEvaluator {

    private static final Logger logger = Logger.getLogger(FormulaEvaluator.class.getName());

    private final FunctionRegistry registry;
    private final EvaluationPolicy policy;

    public FormulaEvaluator(FunctionRegistry registry, EvaluationPolicy policy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public EvaluationPolicy policy() {
        return policy;
    }

    /**
     * Evaluates a formula.
     *
     * @param ast     the formula tree
     * @param binding values of the referenced cells
     * @return the formula value
     */
    public EvaluatedValue evaluate(FormulaNode ast, ValueBinding binding) {
        return new Evaluation(binding).scalar(ast);
    }

    private final class Evaluation implements FormulaVisitor<EvaluatedValue> {

        private final ValueBinding binding;

        private Evaluation(ValueBinding binding) {
            this.binding = binding;
        }

        EvaluatedValue scalar(FormulaNode node) {
            return node.accept(this);
        }

        ValueGrid grid(FormulaNode node) {
            if (node instanceof RangeReference reference) {
                CellRange range = reference.range();
                List<EvaluatedValue> values = new ArrayList<>((int) Math.min(range.size(), Integer.MAX_VALUE));
                range.forEach(coordinate -> values.add(binding.valueOf(coordinate)));
                return ValueGrid.of(range.rows(), range.columns(), values);
            }
            if (node instanceof ArrayLiteral array) {
                return ValueGrid.ofRows(array.rows());
            }
            return ValueGrid.single(scalar(node));
        }

        @Override
        public EvaluatedValue visitFunctionCall(FunctionCall node) {
            Optional<FunctionDefinition> definition = registry.lookup(node.name());
            if (definition.isEmpty()) {
                return EvaluatedValue.error(ErrorKind.NAME);
            }
            try {
                EvaluatedValue result = definition.get().body().apply(new LazyArguments(this, node.args()));
                return result == null ? EvaluatedValue.empty() : result;
            } catch (EvaluationError e) {
                return e.toValue();
            } catch (RuntimeException e) {
                logger.warning(() -> String.format("Function %s failed: %s", node.name(), e));
                return EvaluatedValue.error(ErrorKind.VALUE);
            }
        }

        @Override
        public EvaluatedValue visitBinaryOp(BinaryOp node) {
            EvaluatedValue left = scalar(node.left());
            if (left.isError()) {
                return left;
            }
            return Operators.apply(node.op(), left, scalar(node.right()));
        }

        @Override
        public EvaluatedValue visitUnaryOp(UnaryOp node) {
            return Operators.apply(node.op(), scalar(node.operand()));
        }

        @Override
        public EvaluatedValue visitCellReference(CellReference node) {
            return binding.valueOf(node.coordinate());
        }

        @Override
        public EvaluatedValue visitRangeReference(RangeReference node) {
            if (node.range().isSingleCell()) {
                return binding.valueOf(node.range().start());
            }
            return EvaluatedValue.error(ErrorKind.VALUE);
        }

        @Override
        public EvaluatedValue visitLiteral(Literal node) {
            return node.value();
        }

        @Override
        public EvaluatedValue visitArrayLiteral(ArrayLiteral node) {
            return node.rows().get(0).get(0);
        }

        @Override
        public EvaluatedValue visitMissingArgument(MissingArgument node) {
            return EvaluatedValue.empty();
        }

        @Override
        public EvaluatedValue visitDynamicReference(DynamicReference node) {
            return EvaluatedValue.error(ErrorKind.UNSUPPORTED);
        }
    }

    /**
     * Arguments evaluated on first access and memoized.
     */
    private final class LazyArguments implements FunctionArguments {

        private final Evaluation evaluation;
        private final List<FormulaNode> args;
        private final EvaluatedValue[] scalars;
        private final ValueGrid[] grids;

        private LazyArguments(Evaluation evaluation, List<FormulaNode> args) {
            this.evaluation = evaluation;
            this.args = args;
            this.scalars = new EvaluatedValue[args.size()];
            this.grids = new ValueGrid[args.size()];
        }

        @Override
        public int size() {
            return args.size();
        }

        @Override
        public EvaluatedValue value(int index) {
            if (index >= args.size()) {
                return EvaluatedValue.empty();
            }
            if (scalars[index] == null) {
                scalars[index] = evaluation.scalar(args.get(index));
            }
            return scalars[index];
        }

        @Override
        public ValueGrid grid(int index) {
            if (index >= args.size()) {
                return ValueGrid.single(EvaluatedValue.empty());
            }
            if (grids[index] == null) {
                grids[index] = evaluation.grid(args.get(index));
            }
            return grids[index];
        }

        @Override
        public boolean isGrid(int index) {
            return index < args.size()
                    && (args.get(index) instanceof RangeReference || args.get(index) instanceof ArrayLiteral);
        }

        @Override
        public boolean isReference(int index) {
            return index < args.size()
                    && (args.get(index) instanceof CellReference || args.get(index) instanceof RangeReference);
        }

        @Override
        public boolean isMissing(int index) {
            return index >= args.size() || args.get(index) instanceof MissingArgument;
        }

        @Override
        public EvaluationPolicy policy() {
            return policy;
        }
    }
}
