package io.github.cyfko.sheetlogic.core.parsing;

import io.github.cyfko.sheetlogic.core.ast.AffixOperator;
import io.github.cyfko.sheetlogic.core.ast.InfixOperator;
import io.github.cyfko.sheetlogic.core.config.ParserPolicy;
import io.github.cyfko.sheetlogic.core.exception.FormulaSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard conversion of formula tokens into postfix order.
 * <p>
 * Besides the classic operator handling the converter tracks one frame per open parenthesis so it
 * can count function arguments, detect empty argument slots and enforce the nesting limit of the
 * {@link ParserPolicy}.
 * </p>
 *
 * <ul>
 *   <li>{@code +} and {@code -} are prefix operators when no operand precedes them; they bind
 *       tighter than {@code ^}, so {@code -2^2} is {@code 4}</li>
 *   <li>{@code ^} is right-associative, every other infix operator is left-associative</li>
 *   <li>{@code %} applies to the operand immediately before it</li>
 *   <li>function calls are emitted as {@link TokenType#FUNCTION} tokens carrying their arity</li>
 *   <li>empty argument slots become {@link TokenType#MISSING} tokens</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix(FormulaLexer.tokenize("=IF(A1>0,,-B1^2)"), ParserPolicy.defaults());
 * // [A1, 0, >, MISSING, B1, -, 2, ^, IF/3]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts infix tokens to postfix order.
     *
     * @param tokens tokens from {@link FormulaLexer}
     * @param policy parser limits
     * @return postfix tokens
     * @throws FormulaSyntaxException on unbalanced parentheses, misplaced operators or excessive nesting
     */
    public static List<Token> toPostfix(List<Token> tokens, ParserPolicy policy) {
        if (tokens.isEmpty()) {
            throw new FormulaSyntaxException("Formula has no expression after '='", 1);
        }

        List<Token> output = new ArrayList<>(tokens.size() + 4);
        Deque<Token> operators = new ArrayDeque<>();
        Deque<Frame> frames = new ArrayDeque<>();
        boolean expectOperand = true;

        for (Token token : tokens) {
            switch (token.type()) {
                case NUMBER, STRING, BOOLEAN, ERROR, REFERENCE, ARRAY -> {
                    if (!expectOperand) {
                        throw new FormulaSyntaxException("Missing operator before '" + token.text() + "'", token.position());
                    }
                    output.add(token);
                    expectOperand = false;
                }

                case FUNCTION, LPAREN -> {
                    if (!expectOperand) {
                        throw new FormulaSyntaxException("Missing operator before '" + token.text() + "'", token.position());
                    }
                    frames.push(new Frame(token.type() == TokenType.FUNCTION));
                    if (frames.size() > policy.maxNestingDepth()) {
                        throw new FormulaSyntaxException(String.format(
                                "Nesting depth exceeds %d. Policy applied: %s",
                                policy.maxNestingDepth(), policy.policyName()), token.position());
                    }
                    operators.push(token);
                    expectOperand = true;
                }

                case COMMA -> {
                    Frame frame = frames.peek();
                    if (frame == null || !frame.function) {
                        throw new FormulaSyntaxException("Unexpected ',' outside a function call", token.position());
                    }
                    if (expectOperand) {
                        output.add(Token.of(TokenType.MISSING, "", token.position()));
                    }
                    popUntilOpening(operators, output);
                    frame.argCount++;
                    frame.afterComma = true;
                    expectOperand = true;
                }

                case RPAREN -> {
                    Frame frame = frames.poll();
                    if (frame == null) {
                        throw new FormulaSyntaxException("Mismatched parentheses: unmatched ')'", token.position());
                    }
                    if (frame.function) {
                        if (expectOperand) {
                            if (frame.afterComma) {
                                output.add(Token.of(TokenType.MISSING, "", token.position()));
                                frame.argCount++;
                            }
                        } else {
                            frame.argCount++;
                        }
                        popUntilOpening(operators, output);
                        output.add(operators.pop().withArity(frame.argCount));
                    } else {
                        if (expectOperand) {
                            throw new FormulaSyntaxException("Empty parentheses", token.position());
                        }
                        popUntilOpening(operators, output);
                        operators.pop();
                    }
                    expectOperand = false;
                }

                case OPERATOR -> {
                    String symbol = token.text();
                    if ("%".equals(symbol)) {
                        if (expectOperand) {
                            throw new FormulaSyntaxException("Missing operand before '%'", token.position());
                        }
                        output.add(token.as(TokenType.POSTFIX));
                    } else if (expectOperand && ("+".equals(symbol) || "-".equals(symbol))) {
                        operators.push(token.as(TokenType.PREFIX));
                    } else if (expectOperand) {
                        throw new FormulaSyntaxException("Missing operand before '" + symbol + "'", token.position());
                    } else {
                        InfixOperator op = InfixOperator.fromSymbol(symbol)
                                .orElseThrow(() -> new FormulaSyntaxException("Unknown operator '" + symbol + "'", token.position()));
                        while (!operators.isEmpty() && shouldPop(operators.peek(), op)) {
                            output.add(operators.pop());
                        }
                        operators.push(token);
                        expectOperand = true;
                    }
                }

                default -> throw new FormulaSyntaxException("Unexpected token '" + token.text() + "'", token.position());
            }
        }

        Token last = tokens.get(tokens.size() - 1);
        if (!frames.isEmpty()) {
            throw new FormulaSyntaxException("Mismatched parentheses: unmatched '('", last.position());
        }
        if (expectOperand) {
            throw new FormulaSyntaxException("Formula ends with an operator", last.position());
        }
        while (!operators.isEmpty()) {
            output.add(operators.pop());
        }
        return output;
    }

    private static void popUntilOpening(Deque<Token> operators, List<Token> output) {
        while (!operators.isEmpty()
                && operators.peek().type() != TokenType.FUNCTION
                && operators.peek().type() != TokenType.LPAREN) {
            output.add(operators.pop());
        }
    }

    private static boolean shouldPop(Token stacked, InfixOperator incoming) {
        int stackedPrecedence;
        if (stacked.type() == TokenType.PREFIX) {
            stackedPrecedence = AffixOperator.NEGATE.precedence();
        } else if (stacked.type() == TokenType.OPERATOR) {
            stackedPrecedence = InfixOperator.fromSymbol(stacked.text()).map(InfixOperator::precedence).orElse(0);
        } else {
            return false;
        }
        return stackedPrecedence > incoming.precedence()
                || (stackedPrecedence == incoming.precedence() && !incoming.isRightAssociative());
    }

    private static final class Frame {
        private final boolean function;
        private int argCount;
        private boolean afterComma;

        private Frame(boolean function) {
            this.function = function;
        }
    }
}
