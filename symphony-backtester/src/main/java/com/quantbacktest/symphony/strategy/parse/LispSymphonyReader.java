package com.quantbacktest.symphony.strategy.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads Composer's Lisp/EDN program text into the nested-array form understood by {@link SymphonyParser}.
 *
 * <p>Lists {@code ( )}, vectors {@code [ ]} and maps <code>{ }</code> all become arrays; a map is read
 * as its flat key/value sequence. Commas count as whitespace and {@code ;} starts a comment.
 * Keywords keep their leading colon, strings lose their quotes.
 */
public class LispSymphonyReader {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public JsonNode read(String source) {
        List<Token> tokens = tokenize(source);
        if (tokens.isEmpty()) {
            throw StrategyParseException.malformed("Program text is empty");
        }
        Cursor cursor = new Cursor(tokens);
        JsonNode result = readForm(cursor);
        if (cursor.hasNext()) {
            throw StrategyParseException.malformed("Unexpected content after program: " + cursor.peek().text);
        }
        return result;
    }

    private JsonNode readForm(Cursor cursor) {
        if (!cursor.hasNext()) {
            throw StrategyParseException.malformed("Unexpected end of program text");
        }
        Token token = cursor.next();
        if (token.type == TokenType.OPEN) {
            char closing = closingFor(token.text.charAt(0));
            ArrayNode list = NODES.arrayNode();
            while (cursor.hasNext() && !(cursor.peek().type == TokenType.CLOSE)) {
                list.add(readForm(cursor));
            }
            if (!cursor.hasNext()) {
                throw StrategyParseException.malformed("Unbalanced '" + token.text + "' at offset " + token.offset);
            }
            Token close = cursor.next();
            if (close.text.charAt(0) != closing) {
                throw StrategyParseException.malformed(String.format(
                        "Expected '%c' but found '%s' at offset %d", closing, close.text, close.offset));
            }
            return list;
        }
        if (token.type == TokenType.CLOSE) {
            throw StrategyParseException.malformed("Unexpected '" + token.text + "' at offset " + token.offset);
        }
        if (token.type == TokenType.STRING) {
            return NODES.textNode(token.text);
        }
        return atom(token.text);
    }

    private JsonNode atom(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return NODES.booleanNode(true);
        }
        if ("false".equalsIgnoreCase(text)) {
            return NODES.booleanNode(false);
        }
        if ("nil".equals(text)) {
            return NODES.nullNode();
        }
        if (looksNumeric(text)) {
            try {
                if (text.contains(".") || text.contains("e") || text.contains("E")) {
                    return NODES.numberNode(Double.parseDouble(text));
                }
                return NODES.numberNode(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return NODES.textNode(text);
            }
        }
        return NODES.textNode(text);
    }

    private static boolean looksNumeric(String text) {
        char first = text.charAt(0);
        if (Character.isDigit(first)) {
            return true;
        }
        return (first == '-' || first == '+' || first == '.') && text.length() > 1
                && (Character.isDigit(text.charAt(1)) || text.charAt(1) == '.');
    }

    private static char closingFor(char opening) {
        return switch (opening) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
            } else if (c == ';') {
                while (i < length && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '(' || c == '[' || c == '{') {
                tokens.add(new Token(TokenType.OPEN, String.valueOf(c), i));
                i++;
            } else if (c == ')' || c == ']' || c == '}') {
                tokens.add(new Token(TokenType.CLOSE, String.valueOf(c), i));
                i++;
            } else if (c == '"') {
                int start = i;
                StringBuilder text = new StringBuilder();
                i++;
                while (i < length && source.charAt(i) != '"') {
                    char ch = source.charAt(i);
                    if (ch == '\\' && i + 1 < length) {
                        i++;
                        ch = unescape(source.charAt(i));
                    }
                    text.append(ch);
                    i++;
                }
                if (i >= length) {
                    throw StrategyParseException.malformed("Unterminated string starting at offset " + start);
                }
                i++;
                tokens.add(new Token(TokenType.STRING, text.toString(), start));
            } else {
                int start = i;
                while (i < length && !isDelimiter(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.ATOM, source.substring(start, i), start));
            }
        }
        return tokens;
    }

    private static char unescape(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 't' -> '\t';
            default -> escaped;
        };
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == ',' || c == ';' || c == '"'
                || c == '(' || c == ')' || c == '[' || c == ']' || c == '{' || c == '}';
    }

    enum TokenType { OPEN, CLOSE, STRING, ATOM }

    static final class Token {
        final TokenType type;
        final String text;
        final int offset;

        Token(TokenType type, String text, int offset) {
            this.type = type;
            this.text = text;
            this.offset = offset;
        }
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int position;

        private Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean hasNext() {
            return position < tokens.size();
        }

        Token peek() {
            return tokens.get(position);
        }

        Token next() {
            return tokens.get(position++);
        }
    }
}
