package io.github.cyfko.sheetlogic.core.parsing;

/**
 * Lexical token.
 *
 * @param type     category
 * @param text     source text; for strings the unescaped content
 * @param position offset in the formula text, the leading {@code =} being offset 0
 * @param arity    argument count of a function call in postfix form, 0 otherwise
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position, int arity) {

    public static Token of(TokenType type, String text, int position) {
        return new Token(type, text, position, 0);
    }

    public Token as(TokenType newType) {
        return new Token(newType, text, position, arity);
    }

    public Token withArity(int argCount) {
        return new Token(type, text, position, argCount);
    }

    @Override
    public String toString() {
        return type == TokenType.FUNCTION ? text + "/" + arity : text;
    }
}
