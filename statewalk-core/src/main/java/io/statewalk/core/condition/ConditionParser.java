package io.statewalk.core.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/// Recursive-descent parser for edge conditions.
///
/// Grammar:
/// ```
/// or         := and (("||" | "or") and)*
/// and        := unary (("&&" | "and") unary)*
/// unary      := ("!" | "not") unary | comparison
/// comparison := primary (("==" | "===" | "!=" | "!==" | "<" | "<=" | ">" | ">=") primary)?
/// primary    := NUMBER | STRING | "true" | "false" | "null" | IDENT ("." IDENT)* | "(" or ")"
/// ```
/// Strings use single or double quotes with backslash escapes.
final class ConditionParser {

    private final String source;
    private int pos;

    private ConditionParser(String source) {
        this.source = source;
    }

    /// Parses a complete expression.
    ///
    /// @param source expression text, not null
    /// @return the parsed expression, never null
    /// @throws ConditionParseException on any syntax error or trailing input
    static Expression parse(String source) {
        ConditionParser parser = new ConditionParser(source);
        Expression expression = parser.parseOr();
        parser.skipWhitespace();
        if (parser.pos < source.length()) {
            throw new ConditionParseException(
                    "Unexpected '" + source.charAt(parser.pos) + "'", parser.pos);
        }
        return expression;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (matchSymbol("||") || matchKeyword("or")) {
            left = new Expression.Binary(Expression.Operator.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseUnary();
        while (matchSymbol("&&") || matchKeyword("and")) {
            left = new Expression.Binary(Expression.Operator.AND, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        skipWhitespace();
        if (peek() == '!' && peekAt(1) != '=') {
            pos++;
            return new Expression.Not(parseUnary());
        }
        if (matchKeyword("not")) {
            return new Expression.Not(parseUnary());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parsePrimary();
        Expression.Operator operator = matchComparison();
        if (operator == null) {
            return left;
        }
        return new Expression.Binary(operator, left, parsePrimary());
    }

    private Expression.Operator matchComparison() {
        if (matchSymbol("===") || matchSymbol("==")) return Expression.Operator.EQ;
        if (matchSymbol("!==") || matchSymbol("!=")) return Expression.Operator.NE;
        if (matchSymbol("<=")) return Expression.Operator.LE;
        if (matchSymbol(">=")) return Expression.Operator.GE;
        if (matchSymbol("<")) return Expression.Operator.LT;
        if (matchSymbol(">")) return Expression.Operator.GT;
        return null;
    }

    private Expression parsePrimary() {
        skipWhitespace();
        if (pos >= source.length()) {
            throw new ConditionParseException("Unexpected end of expression", pos);
        }
        char c = peek();
        if (c == '(') {
            pos++;
            Expression inner = parseOr();
            skipWhitespace();
            if (peek() != ')') {
                throw new ConditionParseException("Expected ')'", pos);
            }
            pos++;
            return inner;
        }
        if (c == '"' || c == '\'') {
            return new Expression.Literal(readString(c));
        }
        if (Character.isDigit(c) || (c == '-' && Character.isDigit(peekAt(1)))) {
            return new Expression.Literal(readNumber());
        }
        if (isIdentifierStart(c)) {
            List<String> parts = new ArrayList<>();
            parts.add(readIdentifier());
            while (peek() == '.' && isIdentifierStart(peekAt(1))) {
                pos++;
                parts.add(readIdentifier());
            }
            if (parts.size() == 1) {
                switch (parts.get(0)) {
                    case "true":
                        return new Expression.Literal(Boolean.TRUE);
                    case "false":
                        return new Expression.Literal(Boolean.FALSE);
                    case "null":
                    case "undefined":
                        return new Expression.Literal(null);
                    default:
                        break;
                }
            }
            return new Expression.Reference(parts);
        }
        throw new ConditionParseException("Unexpected '" + c + "'", pos);
    }

    private String readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                sb.append(
                        switch (escaped) {
                            case 'n' -> '\n';
                            case 't' -> '\t';
                            default -> escaped;
                        });
            } else {
                sb.append(c);
            }
        }
        throw new ConditionParseException("Unterminated string", start);
    }

    private BigDecimal readNumber() {
        int start = pos;
        if (peek() == '-') {
            pos++;
        }
        while (Character.isDigit(peek()) || (peek() == '.' && Character.isDigit(peekAt(1)))) {
            pos++;
        }
        return new BigDecimal(source.substring(start, pos));
    }

    private String readIdentifier() {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private boolean matchSymbol(String symbol) {
        skipWhitespace();
        if (source.startsWith(symbol, pos)) {
            pos += symbol.length();
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        skipWhitespace();
        int end = pos + keyword.length();
        if (source.startsWith(keyword, pos)
                && (end >= source.length() || !isIdentifierPart(source.charAt(end)))) {
            pos = end;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '-';
    }
}
