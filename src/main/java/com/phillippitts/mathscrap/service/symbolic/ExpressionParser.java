package com.phillippitts.mathscrap.service.symbolic;

import com.phillippitts.mathscrap.exception.ExpressionParseException;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Constant;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.Equation;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the plain expression syntax emitted by the translator.
 *
 * <pre>
 * equation := expr ('=' expr)?
 * expr     := term (('+' | '-') term)*
 * term     := unary (('*' | '/') unary | unary)*      juxtaposition multiplies
 * unary    := ('+' | '-') unary | power
 * power    := primary ('**' unary)?                   right associative
 * primary  := number | name | function primary | '(' expr ')'
 * </pre>
 *
 * <p>Names containing {@code _} are kept whole ({@code x_1}); other letter runs are split
 * greedily into known names (functions, {@code pi}, Greek letters) and single-letter symbols,
 * so {@code xy} is {@code x*y} and {@code sinx} is {@code sin(x)}. Input that is exactly a
 * placeholder name parses back to its {@link UnparseableMarker}.
 *
 * <p>Instances are single use and not thread-safe; use {@link #parse(String)}.
 */
public final class ExpressionParser {

    static final Set<String> GREEK_NAMES = Set.of("alpha", "beta", "gamma", "delta", "epsilon",
            "zeta", "eta", "theta", "iota", "kappa", "lambda", "mu", "nu", "xi", "rho", "sigma",
            "tau", "upsilon", "phi", "chi", "psi", "omega");

    private static final int LONGEST_KNOWN_NAME = 7;

    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String text) {
        this.tokens = tokenize(text);
    }

    /**
     * Parses an expression or a single equation.
     *
     * @throws ExpressionParseException on malformed input
     * @throws ArithmeticException      when exact folding divides by zero
     */
    public static SymbolicExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Empty expression", 0);
        }
        Optional<UnparseableMarker> marker = UnparseableMarker.fromPlaceholder(text.strip());
        if (marker.isPresent()) {
            return marker.get();
        }
        return new ExpressionParser(text).equation();
    }

    private SymbolicExpression equation() {
        SymbolicExpression lhs = expr();
        if (accept(TokenType.EQUALS)) {
            SymbolicExpression rhs = expr();
            if (peek().type() == TokenType.EQUALS) {
                throw error("Chained equations are not supported");
            }
            expect(TokenType.END);
            return new Equation(lhs, rhs);
        }
        expect(TokenType.END);
        return lhs;
    }

    private SymbolicExpression expr() {
        SymbolicExpression result = term();
        while (true) {
            if (accept(TokenType.PLUS)) {
                result = Expressions.add(result, term());
            } else if (accept(TokenType.MINUS)) {
                result = Expressions.sub(result, term());
            } else {
                return result;
            }
        }
    }

    private SymbolicExpression term() {
        SymbolicExpression result = unary();
        while (true) {
            if (accept(TokenType.STAR)) {
                result = Expressions.mul(result, unary());
            } else if (accept(TokenType.SLASH)) {
                result = Expressions.div(result, unary());
            } else if (startsPrimary(peek())) {
                result = Expressions.mul(result, unary());
            } else {
                return result;
            }
        }
    }

    private SymbolicExpression unary() {
        if (accept(TokenType.MINUS)) {
            return Expressions.neg(unary());
        }
        if (accept(TokenType.PLUS)) {
            return unary();
        }
        return power();
    }

    private SymbolicExpression power() {
        SymbolicExpression base = primary();
        if (accept(TokenType.POWER)) {
            return Expressions.pow(base, unary());
        }
        return base;
    }

    private SymbolicExpression primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                index++;
                return Expressions.num(Rational.parseDecimal(token.text()));
            }
            case LPAREN -> {
                index++;
                SymbolicExpression inner = expr();
                expect(TokenType.RPAREN);
                return inner;
            }
            case NAME -> {
                index++;
                return name(token.text());
            }
            default -> throw error("Unexpected " + describe(token));
        }
    }

    private SymbolicExpression name(String name) {
        if ("sqrt".equals(name)) {
            return Expressions.sqrt(argument(name));
        }
        Optional<FunctionName> function = FunctionName.lookup(name);
        if (function.isPresent()) {
            return Expressions.func(function.get(), argument(name));
        }
        if ("pi".equals(name)) {
            return Constant.PI;
        }
        return Expressions.sym(name);
    }

    private SymbolicExpression argument(String function) {
        if (!startsPrimary(peek())) {
            throw error("Missing argument for " + function);
        }
        return power();
    }

    private static boolean startsPrimary(Token token) {
        return token.type() == TokenType.NUMBER || token.type() == TokenType.NAME
                || token.type() == TokenType.LPAREN;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!accept(type)) {
            throw error("Expected " + type.name().toLowerCase(Locale.ROOT) + " but found " + describe(peek()));
        }
    }

    private ExpressionParseException error(String message) {
        return new ExpressionParseException(message, peek().position());
    }

    private String describe(Token token) {
        return token.type() == TokenType.END ? "end of input" : "'" + token.text() + "'";
    }

    private static List<Token> tokenize(String text) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int start = i;
                while (i < text.length() && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                if (i < text.length() && text.charAt(i) == '.') {
                    i++;
                    while (i < text.length() && Character.isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                out.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (isAsciiLetter(c)) {
                i = readName(text, i, out);
            } else if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                out.add(new Token(TokenType.POWER, "**", i));
                i += 2;
            } else {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case '=' -> TokenType.EQUALS;
                    default -> throw new ExpressionParseException("Unexpected character '" + c + "'", i);
                };
                out.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        out.add(new Token(TokenType.END, "", text.length()));
        return out;
    }

    /**
     * Reads a letter run with optional subscripts. A subscripted name stays whole, with a
     * parenthesized subscript flattened into the name; a plain run is split into known names
     * and single letters.
     */
    private static int readName(String text, int start, List<Token> out) {
        int i = start;
        while (i < text.length() && isAsciiLetter(text.charAt(i))) {
            i++;
        }
        String letters = text.substring(start, i);
        if (i + 1 < text.length() && text.charAt(i) == '_') {
            StringBuilder name = new StringBuilder(letters);
            while (i + 1 < text.length() && text.charAt(i) == '_') {
                char next = text.charAt(i + 1);
                if (Character.isLetterOrDigit(next)) {
                    int end = i + 1;
                    while (end < text.length() && Character.isLetterOrDigit(text.charAt(end))) {
                        end++;
                    }
                    name.append(text, i, end);
                    i = end;
                } else if (next == '(') {
                    int end = matchingParen(text, i + 1);
                    name.append('_').append(text, i + 2, end);
                    i = end + 1;
                } else {
                    break;
                }
            }
            out.add(new Token(TokenType.NAME, name.toString(), start));
            return i;
        }
        int pos = 0;
        while (pos < letters.length()) {
            String known = longestKnownName(letters, pos);
            String piece = known != null ? known : letters.substring(pos, pos + 1);
            out.add(new Token(TokenType.NAME, piece, start + pos));
            pos += piece.length();
        }
        return i;
    }

    private static String longestKnownName(String letters, int pos) {
        for (int len = Math.min(LONGEST_KNOWN_NAME, letters.length() - pos); len >= 2; len--) {
            String candidate = letters.substring(pos, pos + len);
            if (isKnownName(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isKnownName(String name) {
        return "sqrt".equals(name) || "pi".equals(name) || GREEK_NAMES.contains(name)
                || FunctionName.lookup(name).isPresent();
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        throw new ExpressionParseException("Unbalanced subscript", open);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private enum TokenType {
        NUMBER, NAME, PLUS, MINUS, STAR, SLASH, POWER, LPAREN, RPAREN, EQUALS, END
    }

    private record Token(TokenType type, String text, int position) {
    }
}
