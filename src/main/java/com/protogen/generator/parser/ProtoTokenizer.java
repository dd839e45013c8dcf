package com.protogen.generator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.exception.ProtoSyntaxException;
import com.protogen.generator.parser.ProtoToken.TokenType;

/**
 * Tokenizer for schema source files.
 *
 * Identifiers may contain dots and may start with one, so {@code .pkg.Outer.Inner}
 * is a single token. Comments ({@code //} and {@code /* *}{@code /}) are dropped.
 */
public class ProtoTokenizer {
    private static final Logger log = LoggerFactory.getLogger(ProtoTokenizer.class);

    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
            Map.entry('{', TokenType.LBRACE),
            Map.entry('}', TokenType.RBRACE),
            Map.entry('(', TokenType.LPAREN),
            Map.entry(')', TokenType.RPAREN),
            Map.entry('[', TokenType.LBRACKET),
            Map.entry(']', TokenType.RBRACKET),
            Map.entry('<', TokenType.LANGLE),
            Map.entry('>', TokenType.RANGLE),
            Map.entry('=', TokenType.EQUALS),
            Map.entry(':', TokenType.COLON),
            Map.entry(';', TokenType.SEMICOLON),
            Map.entry(',', TokenType.COMMA),
            Map.entry('-', TokenType.MINUS)
    );

    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public ProtoTokenizer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Tokenize the entire source file. The last token is always {@link TokenType#EOF}.
     */
    public List<ProtoToken> tokenize() {
        List<ProtoToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new ProtoToken(TokenType.EOF, "", line, column));
        log.debug("Tokenized {}: {} tokens", fileName, tokens.size());
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                advanceLine();
            } else if (Character.isWhitespace(c)) {
                advanceColumn();
            } else if (c == '/' && peekChar(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advanceColumn();
                }
            } else if (c == '/' && peekChar(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column;
        advanceColumn();
        advanceColumn();
        while (pos < source.length()) {
            if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                advanceColumn();
                advanceColumn();
                return;
            }
            if (source.charAt(pos) == '\n') {
                advanceLine();
            } else {
                advanceColumn();
            }
        }
        throw new ProtoSyntaxException(fileName, startLine, startCol, "unterminated block comment");
    }

    private ProtoToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '"' || c == '\'') {
            return readStringLiteral(c, startLine, startCol);
        }

        if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
            return readNumber(startLine, startCol);
        }

        if (Character.isLetter(c) || c == '_' || c == '.') {
            return readIdentifier(startLine, startCol);
        }

        TokenType punctuation = PUNCTUATION.get(c);
        if (punctuation != null) {
            advanceColumn();
            return new ProtoToken(punctuation, String.valueOf(c), startLine, startCol);
        }

        throw new ProtoSyntaxException(fileName, startLine, startCol, "unexpected character '" + c + "'");
    }

    private ProtoToken readStringLiteral(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advanceColumn(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == quote) {
                advanceColumn();
                return new ProtoToken(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
            } else if (c == '\n') {
                break;
            } else if (c == '\\') {
                advanceColumn();
                sb.append(readEscape(startLine, startCol));
            } else {
                sb.append(c);
                advanceColumn();
            }
        }

        throw new ProtoSyntaxException(fileName, startLine, startCol, "unterminated string literal");
    }

    private char readEscape(int startLine, int startCol) {
        if (pos >= source.length()) {
            throw new ProtoSyntaxException(fileName, startLine, startCol, "unterminated string literal");
        }
        char c = source.charAt(pos);
        advanceColumn();
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'a':
                return 0x07;
            case 'b':
                return '\b';
            case 'f':
                return '\f';
            case 'v':
                return 0x0B;
            case 'x':
            case 'X':
                return (char) readDigits(16, 2);
            default:
                if (c >= '0' && c <= '7') {
                    pos--;
                    column--;
                    return (char) readDigits(8, 3);
                }
                // \\ \' \" \? and anything else stand for themselves
                return c;
        }
    }

    private int readDigits(int radix, int maxDigits) {
        int value = 0;
        int count = 0;
        while (count < maxDigits && pos < source.length() && Character.digit(source.charAt(pos), radix) >= 0) {
            value = value * radix + Character.digit(source.charAt(pos), radix);
            advanceColumn();
            count++;
        }
        return value;
    }

    private ProtoToken readNumber(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        boolean isFloat = false;

        if (source.charAt(pos) == '0' && (peekChar(1) == 'x' || peekChar(1) == 'X')) {
            sb.append(source, pos, pos + 2);
            advanceColumn();
            advanceColumn();
            while (pos < source.length() && Character.digit(source.charAt(pos), 16) >= 0) {
                sb.append(source.charAt(pos));
                advanceColumn();
            }
            return new ProtoToken(TokenType.INTEGER, sb.toString(), startLine, startCol);
        }

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                sb.append(c);
            } else if (c == '.') {
                isFloat = true;
                sb.append(c);
            } else if (c == 'e' || c == 'E') {
                isFloat = true;
                sb.append(c);
                if (peekChar(1) == '-' || peekChar(1) == '+') {
                    advanceColumn();
                    sb.append(source.charAt(pos));
                }
            } else if ((c == 'f' || c == 'F') && isFloat) {
                advanceColumn();
                break;
            } else {
                break;
            }
            advanceColumn();
        }

        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new ProtoSyntaxException(fileName, startLine, startCol,
                    "malformed number '" + sb + source.charAt(pos) + "'");
        }

        return new ProtoToken(isFloat ? TokenType.FLOAT : TokenType.INTEGER, sb.toString(), startLine, startCol);
    }

    private ProtoToken readIdentifier(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                sb.append(c);
                advanceColumn();
            } else {
                break;
            }
        }

        String value = sb.toString();
        if (value.endsWith(".") || value.contains("..")) {
            throw new ProtoSyntaxException(fileName, startLine, startCol, "malformed name '" + value + "'");
        }
        return new ProtoToken(TokenType.IDENTIFIER, value, startLine, startCol);
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advanceColumn() {
        pos++;
        column++;
    }

    private void advanceLine() {
        pos++;
        line++;
        column = 1;
    }
}
