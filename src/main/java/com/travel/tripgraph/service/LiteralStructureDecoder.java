package com.travel.tripgraph.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Decodes the string-encoded nested fields of TravelPlanner records into Jackson trees.
 *
 * The dataset stores lists and dicts as Python literal text ({'days': 1, 'breakfast': '-'}),
 * which is not JSON: strings may use either quote, escapes include \x and \', and constants are
 * spelled True/False/None. This decoder accepts that literal syntax and plain JSON alike.
 * Tuples and sets decode to arrays; dict keys are rendered as text.
 *
 * Decoding is total: any syntax error yields Optional.empty(), never an exception.
 */
@Component
@Slf4j
public class LiteralStructureDecoder {

    private static final int MAX_DEPTH = 256;

    public Optional<JsonNode> decode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            Parser parser = new Parser(text);
            JsonNode value = parser.parseValue(0);
            parser.skipWhitespace();
            if (!parser.atEnd()) {
                throw parser.error("unexpected trailing content");
            }
            return Optional.of(value);
        } catch (LiteralSyntaxException e) {
            log.debug("Could not decode literal structure: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static final class LiteralSyntaxException extends RuntimeException {
        LiteralSyntaxException(String message) {
            super(message);
        }
    }

    private static final class Parser {

        private final JsonNodeFactory nodes = JsonNodeFactory.instance;
        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        JsonNode parseValue(int depth) {
            if (depth > MAX_DEPTH) {
                throw error("nesting too deep");
            }
            skipWhitespace();
            if (atEnd()) {
                throw error("unexpected end of input");
            }
            char c = text.charAt(pos);
            switch (c) {
                case '[':
                    return parseSequence(depth, ']');
                case '(':
                    return parseTuple(depth);
                case '{':
                    return parseBraces(depth);
                case '\'':
                case '"':
                    return nodes.textNode(parseString());
                default:
                    if (c == '-' || c == '+' || c == '.' || Character.isDigit(c)) {
                        return parseNumber();
                    }
                    if (Character.isLetter(c) || c == '_') {
                        return parseConstant();
                    }
                    throw error("unexpected character '" + c + "'");
            }
        }

        private ArrayNode parseSequence(int depth, char close) {
            pos++; // opening bracket
            ArrayNode array = nodes.arrayNode();
            skipWhitespace();
            if (consume(close)) {
                return array;
            }
            while (true) {
                array.add(parseValue(depth + 1));
                skipWhitespace();
                if (consume(close)) {
                    return array;
                }
                expect(',');
                skipWhitespace();
                if (consume(close)) {
                    return array; // trailing comma
                }
            }
        }

        // (x) is just a parenthesized x; (x,) and (x, y) are tuples
        private JsonNode parseTuple(int depth) {
            pos++;
            skipWhitespace();
            if (consume(')')) {
                return nodes.arrayNode();
            }
            JsonNode first = parseValue(depth + 1);
            skipWhitespace();
            if (consume(')')) {
                return first;
            }
            ArrayNode tuple = nodes.arrayNode();
            tuple.add(first);
            while (true) {
                expect(',');
                skipWhitespace();
                if (consume(')')) {
                    return tuple;
                }
                tuple.add(parseValue(depth + 1));
                skipWhitespace();
                if (consume(')')) {
                    return tuple;
                }
            }
        }

        // {} and {k: v, ...} are dicts, {a, b} is a set
        private JsonNode parseBraces(int depth) {
            pos++;
            skipWhitespace();
            if (consume('}')) {
                return nodes.objectNode();
            }
            JsonNode first = parseValue(depth + 1);
            skipWhitespace();
            if (peek() == ':') {
                return parseDictRest(depth, first);
            }
            ArrayNode set = nodes.arrayNode();
            set.add(first);
            while (true) {
                if (consume('}')) {
                    return set;
                }
                expect(',');
                skipWhitespace();
                if (consume('}')) {
                    return set;
                }
                set.add(parseValue(depth + 1));
                skipWhitespace();
            }
        }

        private ObjectNode parseDictRest(int depth, JsonNode firstKey) {
            ObjectNode dict = nodes.objectNode();
            JsonNode key = firstKey;
            while (true) {
                expect(':');
                JsonNode value = parseValue(depth + 1);
                dict.set(keyText(key), value);
                skipWhitespace();
                if (consume('}')) {
                    return dict;
                }
                expect(',');
                skipWhitespace();
                if (consume('}')) {
                    return dict;
                }
                key = parseValue(depth + 1);
                skipWhitespace();
            }
        }

        private String keyText(JsonNode key) {
            if (key.isContainerNode()) {
                throw error("unhashable dict key");
            }
            return key.isNull() ? "None" : key.asText();
        }

        private String parseString() {
            char quote = text.charAt(pos);
            boolean triple = text.startsWith(String.valueOf(quote).repeat(3), pos);
            pos += triple ? 3 : 1;
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    throw error("unterminated string");
                }
                char c = text.charAt(pos);
                if (c == quote) {
                    if (!triple) {
                        pos++;
                        return sb.toString();
                    }
                    if (text.startsWith(String.valueOf(quote).repeat(3), pos)) {
                        pos += 3;
                        return sb.toString();
                    }
                    sb.append(c);
                    pos++;
                } else if (c == '\\') {
                    pos++;
                    appendEscape(sb);
                } else if ((c == '\n' || c == '\r') && !triple) {
                    throw error("line break inside string");
                } else {
                    sb.append(c);
                    pos++;
                }
            }
        }

        private void appendEscape(StringBuilder sb) {
            if (atEnd()) {
                throw error("dangling escape");
            }
            char c = text.charAt(pos++);
            switch (c) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'v': sb.append('\u000B'); break;
                case 'a': sb.append('\u0007'); break;
                case '0': sb.append('\0'); break;
                case '\\': sb.append('\\'); break;
                case '\'': sb.append('\''); break;
                case '"': sb.append('"'); break;
                case '/': sb.append('/'); break;
                case '\n': break; // line continuation
                case 'x': sb.appendCodePoint(readHex(2)); break;
                case 'u': sb.appendCodePoint(readHex(4)); break;
                case 'U': sb.appendCodePoint(readHex(8)); break;
                default:
                    // unknown escapes are kept literally, as Python does
                    sb.append('\\').append(c);
            }
        }

        private int readHex(int digits) {
            if (pos + digits > text.length()) {
                throw error("truncated hex escape");
            }
            String hex = text.substring(pos, pos + digits);
            try {
                int codePoint = Integer.parseInt(hex, 16);
                if (!Character.isValidCodePoint(codePoint)) {
                    throw error("invalid code point \\" + hex);
                }
                pos += digits;
                return codePoint;
            } catch (NumberFormatException e) {
                throw error("invalid hex escape \\" + hex);
            }
        }

        private JsonNode parseNumber() {
            int start = pos;
            if (peek() == '-' || peek() == '+') {
                pos++;
            }
            boolean decimal = false;
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (Character.isDigit(c) || c == '_') {
                    pos++;
                } else if (c == '.' || c == 'e' || c == 'E') {
                    decimal = true;
                    pos++;
                    if ((c == 'e' || c == 'E') && (peek() == '-' || peek() == '+')) {
                        pos++;
                    }
                } else {
                    break;
                }
            }
            String literal = text.substring(start, pos).replace("_", "");
            if (literal.startsWith("+")) {
                literal = literal.substring(1);
            }
            try {
                if (decimal) {
                    return nodes.numberNode(new BigDecimal(literal).doubleValue());
                }
                BigInteger value = new BigInteger(literal);
                return value.bitLength() < 64 ? nodes.numberNode(value.longValue()) : nodes.numberNode(value);
            } catch (NumberFormatException e) {
                throw error("invalid number '" + literal + "'");
            }
        }

        private JsonNode parseConstant() {
            int start = pos;
            while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            String word = text.substring(start, pos);
            switch (word) {
                case "True":
                case "true":
                    return nodes.booleanNode(true);
                case "False":
                case "false":
                    return nodes.booleanNode(false);
                case "None":
                case "null":
                    return nodes.nullNode();
                default:
                    throw error("unknown name '" + word + "'");
            }
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        private char peek() {
            return atEnd() ? '\0' : text.charAt(pos);
        }

        private boolean consume(char c) {
            if (peek() == c && !atEnd()) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            skipWhitespace();
            if (!consume(c)) {
                throw error("expected '" + c + "'");
            }
        }

        LiteralSyntaxException error(String message) {
            return new LiteralSyntaxException(message + " at offset " + pos);
        }
    }
}
