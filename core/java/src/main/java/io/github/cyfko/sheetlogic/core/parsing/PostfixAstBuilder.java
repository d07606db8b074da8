package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.ast.AffixOperator;
import io.github.cyfko.sheetlogic.core.ast.ArrayLiteral;
import io.github.cyfko.sheetlogic.core.ast.BinaryOp;
import io.github.cyfko.sheetlogic.core.ast.CellReference;
import io.github.cyfko.sheetlogic.core.ast.DynamicReference;
import io.github.cyfko.sheetlogic.core.ast.FormulaNode;
import io.github.cyfko.sheetlogic.core.ast.FunctionCall;
import io.github.cyfko.sheetlogic.core.ast.InfixOperator;
import io.github.cyfko.sheetlogic.core.ast.Literal;
import io.github.cyfko.sheetlogic.core.ast.MissingArgument;
import io.github.cyfko.sheetlogic.core.ast.RangeReference;
import io.github.cyfko.sheetlogic.core.ast.UnaryOp;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.exception.ArityException;
import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.sheetlogic.core.exception.UnknownReferenceException;
import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;
import io.github.cyfko.sheetlogic.core.model.CellRange;
import io.github.cyfko.sheetlogic.core.model.Coordinate;
import io.github.cyfko.sheetlogic.core.reference.ColumnLetters;
import io.github.cyfko.sheetlogic.core.reference.ReferenceKind;
import io.github.cyfko.sheetlogic.core.reference.ReferenceResolver;
import io.github.cyfko.sheetlogic.core.reference.ResolvedReference;
import io.github.cyfko.sheetlogic.core.spi.FunctionDefinition;
import io.github.cyfko.sheetlogic.core.spi.FunctionRegistry;
import io.github.cyfko.sheetlogic.core.spi.FunctionSignature;
import io.github.cyfko.sheetlogic.core.value.ErrorKind;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the formula AST from postfix tokens with a single operand stack.
 * <p>
 * Reference resolution and arity checks happen here, so a successful build means every reference
 * points at a coordinate and every known function received an argument count it accepts.
 * </p>
 *
 * <h2>Dynamic references</h2>
 * <p>
 * Calls to the policy's dynamic functions become {@link DynamicReference} nodes and are reported
 * as {@link UnsupportedConstruct}s. {@code OFFSET} whose offsets and sizes are all constants is
 * folded into the static reference it denotes instead.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixAstBuilder {

    private static final String OFFSET = "OFFSET";

    private final ReferenceResolver resolver;
    private final FunctionRegistry registry;
    private final ParserPolicy policy;

    public PostfixAstBuilder(ReferenceResolver resolver, FunctionRegistry registry, ParserPolicy policy) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Builds the AST of a formula located on {@code currentSheet}.
     *
     * @param postfix      tokens from {@link PostfixConverter}
     * @param currentSheet sheet of the formula cell
     * @return successful outcome with the AST and any unsupported constructs
     * @throws FormulaSyntaxException     on malformed postfix or literals
     * @throws UnknownReferenceException  on references that resolve nowhere
     * @throws ArityException             on argument counts a function does not accept
     */
    public ParseOutcome build(List<Token> postfix, String currentSheet) {
        Deque<FormulaNode> stack = new ArrayDeque<>();
        List<UnsupportedConstruct> unsupported = new ArrayList<>();

        for (Token token : postfix) {
            switch (token.type()) {
                case NUMBER -> stack.push(Literal.number(parseNumber(token)));
                case STRING -> stack.push(Literal.text(token.text()));
                case BOOLEAN -> stack.push(new Literal(EvaluatedValue.bool("TRUE".equals(token.text()))));
                case ERROR -> stack.push(new Literal(EvaluatedValue.error(ErrorKind.fromLiteral(token.text())
                        .orElseThrow(() -> new FormulaSyntaxException("Unknown error literal", token.position())))));
                case ARRAY -> stack.push(new ArrayLiteral(FormulaLexer.arrayRows(token)));
                case REFERENCE -> stack.push(reference(token, currentSheet));
                case MISSING -> stack.push(MissingArgument.INSTANCE);
                case PREFIX -> stack.push(new UnaryOp("-".equals(token.text()) ? AffixOperator.NEGATE : AffixOperator.PLUS,
                        pop(stack, token)));
                case POSTFIX -> stack.push(new UnaryOp(AffixOperator.PERCENT, pop(stack, token)));
                case OPERATOR -> {
                    FormulaNode right = pop(stack, token);
                    FormulaNode left = pop(stack, token);
                    InfixOperator op = InfixOperator.fromSymbol(token.text())
                            .orElseThrow(() -> new FormulaSyntaxException("Unknown operator '" + token.text() + "'", token.position()));
                    stack.push(new BinaryOp(op, left, right));
                }
                case FUNCTION -> stack.push(function(token, popArguments(stack, token), currentSheet, unsupported));
                default -> throw new FormulaSyntaxException("Unexpected token '" + token.text() + "'", token.position());
            }
        }

        if (stack.size() != 1) {
            throw new FormulaSyntaxException("Malformed expression");
        }
        return ParseOutcome.success(stack.pop(), unsupported);
    }

    private FormulaNode reference(Token token, String currentSheet) {
        ResolvedReference resolved;
        try {
            resolved = resolver.resolve(token.text(), currentSheet);
        } catch (UnknownReferenceException e) {
            throw e.at(token.position());
        } catch (WorkbookDefinitionException e) {
            throw new UnknownReferenceException(token.text(), e.getMessage(), token.position());
        }
        return resolved.isRange()
                ? new RangeReference(resolved.range(), resolved.kind(), resolved.name())
                : new CellReference(resolved.cell(), resolved.kind(), resolved.name());
    }

    private FormulaNode function(Token token, List<FormulaNode> args, String currentSheet,
                                 List<UnsupportedConstruct> unsupported) {
        String name = token.text();

        if (policy.isDynamic(name)) {
            if (OFFSET.equals(name)) {
                Optional<FormulaNode> folded = foldOffset(args, currentSheet);
                if (folded.isPresent()) {
                    return folded.get();
                }
            }
            unsupported.add(new UnsupportedConstruct(name, UnsupportedConstruct.FeatureType.DYNAMIC_REFERENCE,
                    name + " selects its target cells at run time, so its dependencies cannot be determined statically",
                    token.position()));
            return new DynamicReference(name, args, token.position());
        }

        Optional<FunctionDefinition> definition = registry.lookup(name);
        if (definition.isEmpty()) {
            unsupported.add(new UnsupportedConstruct(name, UnsupportedConstruct.FeatureType.UNKNOWN_FUNCTION,
                    "Function " + name + " is not supported", token.position()));
            return new FunctionCall(name, args);
        }

        FunctionSignature signature = definition.get().signature();
        if (!signature.accepts(args.size())) {
            throw new ArityException(name, String.format("Function %s expects %s arguments, got %d",
                    name, signature.describe(), args.size()), token.position());
        }
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) instanceof MissingArgument && !signature.emptyAllowedAt(i)) {
                throw new ArityException(name, String.format("Function %s does not accept an empty argument in position %d",
                        name, i + 1), token.position());
            }
        }
        return new FunctionCall(name, args);
    }

    /**
     * Folds {@code OFFSET(reference, rows, cols[, height, width])} when every number is a constant.
     */
    private Optional<FormulaNode> foldOffset(List<FormulaNode> args, String currentSheet) {
        if (args.size() < 3 || args.size() > 5) {
            return Optional.empty();
        }
        CellRange base;
        if (args.get(0) instanceof CellReference cell) {
            base = CellRange.of(cell.coordinate(), cell.coordinate());
        } else if (args.get(0) instanceof RangeReference range) {
            base = range.range();
        } else {
            return Optional.empty();
        }

        Integer rows = constantInteger(args.get(1), 0);
        Integer columns = constantInteger(args.get(2), 0);
        Integer height = args.size() > 3 ? constantInteger(args.get(3), base.rows()) : Integer.valueOf(base.rows());
        Integer width = args.size() > 4 ? constantInteger(args.get(4), base.columns()) : Integer.valueOf(base.columns());
        if (rows == null || columns == null || height == null || width == null) {
            return Optional.empty();
        }

        long top = (long) base.start().row() + rows;
        long left = (long) base.start().column() + columns;
        long bottom = top + height - 1;
        long right = left + width - 1;
        if (height < 1 || width < 1 || top < 1 || left < 1
                || bottom > ColumnLetters.MAX_ROW || right > ColumnLetters.MAX_COLUMN) {
            return Optional.of(new Literal(EvaluatedValue.error(ErrorKind.REF)));
        }

        String sheet = base.sheet();
        Coordinate start = new Coordinate(sheet, (int) left, (int) top);
        Coordinate end = new Coordinate(sheet, (int) right, (int) bottom);
        boolean sameSheet = sheet.equals(currentSheet);
        if (start.equals(end)) {
            return Optional.of(new CellReference(start, sameSheet ? ReferenceKind.DIRECT : ReferenceKind.CROSS_SHEET, null));
        }
        return Optional.of(new RangeReference(CellRange.of(start, end),
                sameSheet ? ReferenceKind.RANGE : ReferenceKind.CROSS_SHEET, null));
    }

    private static Integer constantInteger(FormulaNode node, int whenMissing) {
        if (node instanceof MissingArgument) {
            return whenMissing;
        }
        Double value = constantNumber(node);
        return value == null ? null : (int) Math.floor(value);
    }

    private static Double constantNumber(FormulaNode node) {
        if (node instanceof Literal literal && literal.value() instanceof EvaluatedValue.NumberValue number) {
            return number.value();
        }
        if (node instanceof UnaryOp unary && unary.op() != AffixOperator.PERCENT) {
            Double inner = constantNumber(unary.operand());
            if (inner == null) return null;
            return unary.op() == AffixOperator.NEGATE ? -inner : inner;
        }
        return null;
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.text());
        } catch (NumberFormatException e) {
            throw new FormulaSyntaxException("Malformed number '" + token.text() + "'", token.position());
        }
    }

    private static FormulaNode pop(Deque<FormulaNode> stack, Token token) {
        if (stack.isEmpty()) {
            throw new FormulaSyntaxException("Missing operand for '" + token.text() + "'", token.position());
        }
        return stack.pop();
    }

    private static List<FormulaNode> popArguments(Deque<FormulaNode> stack, Token token) {
        FormulaNode[] args = new FormulaNode[token.arity()];
        for (int i = token.arity() - 1; i >= 0; i--) {
            args[i] = pop(stack, token);
        }
        return Arrays.asList(args);
    }
}
