package com.helios.transform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.helios.transform.model.ConditionOperator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for path expressions.
 *
 * <pre>
 * path      := '$' segment*
 * segment   := '.' name | '.*' | '..' (name | '*' | bracket) | bracket
 * bracket   := '[' ( '*' | index | slice | union | '?(' filter ')' ) ']'
 * filter    := and ('||' and)*
 * and       := test ('&amp;&amp;' test)*
 * test      := '(' filter ')' | field [ cmp literal ]
 * field     := '@' ('.' name | '[' quoted ']')*
 * </pre>
 *
 * Whitespace is allowed inside brackets and filters only.
 */
final class PathParser {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String text;
    private int pos;

    private PathParser(String text) {
        this.text = text;
    }

    static PathExpression parse(String expression) {
        if (expression == null) {
            throw new PathSyntaxException("null", 0, "expression is null");
        }
        String trimmed = expression.trim();
        PathParser parser = new PathParser(trimmed);
        return new PathExpression(trimmed, parser.parsePath());
    }

    private List<PathSegment> parsePath() {
        expect('$');
        List<PathSegment> segments = new ArrayList<>();
        while (!atEnd()) {
            char c = peek();
            if (c == '.') {
                if (peekAt(1) == '.') {
                    pos += 2;
                    segments.add(new PathSegment.RecursiveDescent(parseDescentSelector()));
                } else {
                    pos++;
                    segments.add(parseDotSelector());
                }
            } else if (c == '[') {
                segments.add(parseBracket());
            } else {
                throw error("unexpected character '" + c + "'");
            }
        }
        return segments;
    }

    private PathSegment parseDescentSelector() {
        if (!atEnd() && peek() == '[') {
            return parseBracket();
        }
        return parseDotSelector();
    }

    private PathSegment parseDotSelector() {
        if (atEnd()) {
            throw error("expected a member name");
        }
        if (peek() == '*') {
            pos++;
            return new PathSegment.Wildcard();
        }
        int start = pos;
        while (!atEnd() && peek() != '.' && peek() != '[') {
            pos++;
        }
        if (pos == start) {
            throw error("expected a member name");
        }
        return new PathSegment.Member(text.substring(start, pos));
    }

    private PathSegment parseBracket() {
        expect('[');
        skipWhitespace();
        if (atEnd()) {
            throw error("unterminated bracket");
        }
        char c = peek();
        if (c == '*') {
            pos++;
            closeBracket();
            return new PathSegment.Wildcard();
        }
        if (c == '?') {
            pos++;
            expect('(');
            FilterPredicate predicate = parseOr();
            skipWhitespace();
            expect(')');
            closeBracket();
            return new PathSegment.Filter(predicate);
        }
        if (c == ':' || isIntegerStart(c)) {
            Integer start = c == ':' ? null : readInt();
            skipWhitespace();
            if (!atEnd() && peek() == ':') {
                pos++;
                skipWhitespace();
                Integer end = !atEnd() && peek() != ']' ? readInt() : null;
                closeBracket();
                return new PathSegment.Slice(start, end);
            }
            return finishUnion(new PathSegment.Index(start));
        }
        if (c == '\'' || c == '"') {
            return finishUnion(new PathSegment.Member(readQuoted()));
        }
        throw error("unexpected character '" + c + "' in brackets");
    }

    private PathSegment finishUnion(PathSegment first) {
        List<PathSegment> parts = new ArrayList<>();
        parts.add(first);
        skipWhitespace();
        while (!atEnd() && peek() == ',') {
            pos++;
            skipWhitespace();
            if (atEnd()) {
                throw error("unterminated bracket");
            }
            char c = peek();
            if (c == '\'' || c == '"') {
                parts.add(new PathSegment.Member(readQuoted()));
            } else if (isIntegerStart(c)) {
                parts.add(new PathSegment.Index(readInt()));
            } else {
                throw error("expected a quoted name or an index");
            }
            skipWhitespace();
        }
        closeBracket();
        return parts.size() == 1 ? first : new PathSegment.Union(parts);
    }

    private void closeBracket() {
        skipWhitespace();
        expect(']');
    }

    // ---- filters ----

    private FilterPredicate parseOr() {
        List<FilterPredicate> terms = new ArrayList<>();
        terms.add(parseAnd());
        while (consume("||")) {
            terms.add(parseAnd());
        }
        return terms.size() == 1 ? terms.get(0) : new FilterPredicate.Or(terms);
    }

    private FilterPredicate parseAnd() {
        List<FilterPredicate> terms = new ArrayList<>();
        terms.add(parseTest());
        while (consume("&&")) {
            terms.add(parseTest());
        }
        return terms.size() == 1 ? terms.get(0) : new FilterPredicate.And(terms);
    }

    private FilterPredicate parseTest() {
        skipWhitespace();
        if (!atEnd() && peek() == '(') {
            pos++;
            FilterPredicate inner = parseOr();
            skipWhitespace();
            expect(')');
            return inner;
        }
        FilterPredicate.FieldRef field = parseFieldRef();
        skipWhitespace();
        ConditionOperator operator = readComparator();
        if (operator == null) {
            return new FilterPredicate.Exists(field);
        }
        skipWhitespace();
        return new FilterPredicate.Comparison(field, operator, readLiteral());
    }

    private FilterPredicate.FieldRef parseFieldRef() {
        expect('@');
        List<String> names = new ArrayList<>();
        while (!atEnd()) {
            if (peek() == '.') {
                pos++;
                int start = pos;
                while (!atEnd() && isNameChar(peek())) {
                    pos++;
                }
                if (pos == start) {
                    throw error("expected a field name after '@.'");
                }
                names.add(text.substring(start, pos));
            } else if (peek() == '[') {
                pos++;
                skipWhitespace();
                names.add(readQuoted());
                closeBracket();
            } else {
                break;
            }
        }
        return new FilterPredicate.FieldRef(names);
    }

    private ConditionOperator readComparator() {
        if (consumeExact("==")) return ConditionOperator.EQUAL_TO;
        if (consumeExact("!=")) return ConditionOperator.NOT_EQUAL_TO;
        if (consumeExact("<=")) return ConditionOperator.LESS_THAN_OR_EQUAL;
        if (consumeExact(">=")) return ConditionOperator.GREATER_THAN_OR_EQUAL;
        if (consumeExact("<")) return ConditionOperator.LESS_THAN;
        if (consumeExact(">")) return ConditionOperator.GREATER_THAN;
        return null;
    }

    private JsonNode readLiteral() {
        if (atEnd()) {
            throw error("expected a literal");
        }
        char c = peek();
        if (c == '\'' || c == '"') {
            return NODES.textNode(readQuoted());
        }
        if (consumeExact("true")) return NODES.booleanNode(true);
        if (consumeExact("false")) return NODES.booleanNode(false);
        if (consumeExact("null")) return NODES.nullNode();
        if (isIntegerStart(c)) {
            int start = pos;
            pos++;
            while (!atEnd() && (Character.isDigit(peek()) || "+-.eE".indexOf(peek()) >= 0)) {
                pos++;
            }
            String number = text.substring(start, pos);
            try {
                BigDecimal decimal = new BigDecimal(number);
                return NODES.numberNode(decimal);
            } catch (NumberFormatException e) {
                throw error("invalid number '" + number + "'");
            }
        }
        throw error("expected a literal");
    }

    // ---- lexical helpers ----

    private String readQuoted() {
        if (atEnd()) {
            throw error("expected a quoted name");
        }
        char quote = peek();
        if (quote != '\'' && quote != '"') {
            throw error("expected a quoted name");
        }
        pos++;
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = text.charAt(pos++);
            if (c == '\\') {
                if (atEnd()) break;
                sb.append(text.charAt(pos++));
            } else if (c == quote) {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        throw error("unterminated quoted name");
    }

    private int readInt() {
        int start = pos;
        if (!atEnd() && peek() == '-') {
            pos++;
        }
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        String digits = text.substring(start, pos);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error("invalid index '" + digits + "'");
        }
    }

    private boolean consume(String token) {
        skipWhitespace();
        return consumeExact(token);
    }

    private boolean consumeExact(String token) {
        if (text.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (atEnd() || peek() != expected) {
            throw error("expected '" + expected + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private static boolean isIntegerStart(char c) {
        return c == '-' || Character.isDigit(c);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '$';
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private PathSyntaxException error(String reason) {
        return new PathSyntaxException(text, pos, reason);
    }
}
