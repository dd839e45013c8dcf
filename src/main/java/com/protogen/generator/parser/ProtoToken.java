package com.protogen.generator.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the schema tokenizer.
 */
@Data
@AllArgsConstructor
public class ProtoToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        IDENTIFIER,
        INTEGER,
        FLOAT,
        STRING_LITERAL,
        LBRACE,
        RBRACE,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        LANGLE,
        RANGLE,
        EQUALS,
        COLON,
        SEMICOLON,
        COMMA,
        MINUS,
        EOF
    }

    public boolean isIdentifier(String word) {
        return type == TokenType.IDENTIFIER && value.equals(word);
    }

    /**
     * Short form used in error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of file";
            case STRING_LITERAL -> "string \"" + value + "\"";
            default -> "'" + value + "'";
        };
    }
}
