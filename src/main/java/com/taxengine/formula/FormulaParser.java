package com.taxengine.formula;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula expressions.
 *
 * <pre>
 * expr       := comparison
 * comparison := additive (("&lt;" | "&lt;=" | "&gt;" | "&gt;=" | "==" | "!=") additive)?
 * additive   := term (("+" | "-") term)*
 * term       := unary (("*" | "×" | "/" | "÷") unary)*
 * unary      := ("-" | "+") unary | primary
 * primary    := NUMBER "%"? | IDENT | IDENT "(" expr ("," expr)* ")" | "(" expr ")"
 * </pre>
 *
 * Identifiers are raw terms; the compiler resolves them through the registry.
 * Expressions longer than {@value #MAX_LENGTH} characters or nested deeper than
 * {@value #MAX_DEPTH} levels are rejected, which bounds the depth of every tree walk.
 */
public final class FormulaParser {

    static final int MAX_LENGTH = 4096;
    static final int MAX_DEPTH = 64;

    private final String source;
    private final List<Token> tokens;
    private int index;
    private int depth;

    private FormulaParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static Expr parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FormulaParseException(String.valueOf(expression), 0, "empty expression");
        }
        if (expression.length() > MAX_LENGTH) {
            throw new FormulaParseException(expression.substring(0, 64) + "...", MAX_LENGTH,
                "expression longer than " + MAX_LENGTH + " characters");
        }
        FormulaParser parser = new FormulaParser(expression);
        Expr tree = parser.comparison();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.END) {
            throw parser.error(trailing, "unexpected '" + trailing.text() + "'");
        }
        return tree;
    }

    private Expr comparison() {
        Expr left = additive();
        Token token = peek();
        Expr.Operator operator = switch (token.kind()) {
            case LESS -> Expr.Operator.LESS;
            case LESS_OR_EQUAL -> Expr.Operator.LESS_OR_EQUAL;
            case GREATER -> Expr.Operator.GREATER;
            case GREATER_OR_EQUAL -> Expr.Operator.GREATER_OR_EQUAL;
            case EQUAL -> Expr.Operator.EQUAL;
            case NOT_EQUAL -> Expr.Operator.NOT_EQUAL;
            default -> null;
        };
        if (operator == null) {
            return left;
        }
        index++;
        return new Expr.Binary(operator, left, additive());
    }

    private Expr additive() {
        Expr left = term();
        while (true) {
            Token token = peek();
            if (token.kind() == Kind.PLUS) {
                index++;
                left = new Expr.Binary(Expr.Operator.ADD, left, term());
            } else if (token.kind() == Kind.MINUS) {
                index++;
                left = new Expr.Binary(Expr.Operator.SUBTRACT, left, term());
            } else {
                return left;
            }
        }
    }

    private Expr term() {
        Expr left = unary();
        while (true) {
            Token token = peek();
            if (token.kind() == Kind.STAR) {
                index++;
                left = new Expr.Binary(Expr.Operator.MULTIPLY, left, unary());
            } else if (token.kind() == Kind.SLASH) {
                index++;
                left = new Expr.Binary(Expr.Operator.DIVIDE, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expr unary() {
        Token token = peek();
        if (++depth > MAX_DEPTH) {
            throw error(token, "expression nested deeper than " + MAX_DEPTH + " levels");
        }
        try {
            if (token.kind() == Kind.MINUS) {
                index++;
                return new Expr.Negate(unary());
            }
            if (token.kind() == Kind.PLUS) {
                index++;
                return unary();
            }
            return primary();
        } finally {
            depth--;
        }
    }

    private Expr primary() {
        Token token = next();
        switch (token.kind()) {
            case NUMBER -> {
                BigDecimal value = new BigDecimal(token.text());
                if (peek().kind() == Kind.PERCENT) {
                    index++;
                    value = value.movePointLeft(2);
                }
                return new Expr.NumberLiteral(value);
            }
            case IDENT -> {
                if (peek().kind() != Kind.LPAREN) {
                    return new Expr.Variable(token.text());
                }
                Expr.Function function = Expr.Function.byName(token.text());
                if (function == null) {
                    throw error(token, "unknown function '" + token.text() + "'");
                }
                index++;
                List<Expr> arguments = new ArrayList<>();
                if (peek().kind() != Kind.RPAREN) {
                    arguments.add(comparison());
                    while (peek().kind() == Kind.COMMA) {
                        index++;
                        arguments.add(comparison());
                    }
                }
                expect(Kind.RPAREN, "')' to close call of " + function.functionName());
                if (!function.accepts(arguments.size())) {
                    throw error(token, function.functionName() + " does not take " + arguments.size() + " arguments");
                }
                return new Expr.Call(function, arguments);
            }
            case LPAREN -> {
                Expr inner = comparison();
                expect(Kind.RPAREN, "')'");
                return inner;
            }
            case END -> throw error(token, "unexpected end of expression");
            default -> throw error(token, "unexpected '" + token.text() + "'");
        }
    }

    private void expect(Kind kind, String description) {
        Token token = next();
        if (token.kind() != kind) {
            throw error(token, "expected " + description);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.kind() != Kind.END) {
            index++;
        }
        return token;
    }

    private FormulaParseException error(Token token, String message) {
        return new FormulaParseException(source, token.position(), message);
    }

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                int start = i;
                boolean dot = false;
                while (i < source.length() && (Character.isDigit(source.charAt(i)) || (source.charAt(i) == '.' && !dot))) {
                    dot |= source.charAt(i) == '.';
                    i++;
                }
                tokens.add(new Token(Kind.NUMBER, source.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length()
                    && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_' || source.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(Kind.IDENT, source.substring(start, i), start));
            } else {
                String two = i + 1 < source.length() ? source.substring(i, i + 2) : "";
                Kind pair = switch (two) {
                    case "<=" -> Kind.LESS_OR_EQUAL;
                    case ">=" -> Kind.GREATER_OR_EQUAL;
                    case "==" -> Kind.EQUAL;
                    case "!=" -> Kind.NOT_EQUAL;
                    default -> null;
                };
                if (pair != null) {
                    tokens.add(new Token(pair, two, i));
                    i += 2;
                    continue;
                }
                Kind single = switch (c) {
                    case '+' -> Kind.PLUS;
                    case '-', '−' -> Kind.MINUS;
                    case '*', '×' -> Kind.STAR;
                    case '/', '÷' -> Kind.SLASH;
                    case '<' -> Kind.LESS;
                    case '>' -> Kind.GREATER;
                    case '(' -> Kind.LPAREN;
                    case ')' -> Kind.RPAREN;
                    case ',' -> Kind.COMMA;
                    case '%' -> Kind.PERCENT;
                    default -> null;
                };
                if (single == null) {
                    throw new FormulaParseException(source, i, "unexpected character '" + c + "'");
                }
                tokens.add(new Token(single, String.valueOf(c), i));
                i++;
            }
        }
        tokens.add(new Token(Kind.END, "", source.length()));
        return tokens;
    }

    private enum Kind {
        NUMBER, IDENT, PLUS, MINUS, STAR, SLASH, LESS, LESS_OR_EQUAL, GREATER, GREATER_OR_EQUAL,
        EQUAL, NOT_EQUAL, LPAREN, RPAREN, COMMA, PERCENT, END
    }

    private record Token(Kind kind, String text, int position) {
    }
}
