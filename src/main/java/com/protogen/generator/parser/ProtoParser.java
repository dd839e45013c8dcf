package com.protogen.generator.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.exception.DuplicateDefinitionException;
import com.protogen.generator.exception.ProtoSyntaxException;
import com.protogen.generator.model.Descriptor;
import com.protogen.generator.model.EnumDescriptor;
import com.protogen.generator.model.EnumValueDescriptor;
import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.FieldLabel;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.MethodDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.ServiceDescriptor;
import com.protogen.generator.parser.ProtoToken.TokenType;

/**
 * Parser for schema files.
 * Converts tokens into a descriptor tree.
 *
 * Parsing only:
 * - Builds the tree
 * - Collects import names
 * - Rejects malformed input with a {@link ProtoSyntaxException}
 *
 * It does NOT load imports or resolve type names; every field type stays a raw name.
 */
public class ProtoParser {
    private static final Logger log = LoggerFactory.getLogger(ProtoParser.class);

    private static final int MAX_FIELD_NUMBER = 536_870_911;

    private final List<ProtoToken> tokens;
    private final String fileName;
    private int pos = 0;

    private ProtoDescriptor proto;
    private boolean packageDeclared;

    public ProtoParser(List<ProtoToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    public ProtoDescriptor parse() {
        proto = new ProtoDescriptor(fileName);
        Set<String> topLevelNames = new HashSet<>();

        while (!isAtEnd()) {
            parseTopLevel(topLevelNames);
        }

        log.debug("Parsed {}: {} messages, {} enums, {} services, {} extends",
                fileName, proto.getMessages().size(), proto.getEnums().size(),
                proto.getServices().size(), proto.getExtends().size());
        return proto;
    }

    private void parseTopLevel(Set<String> topLevelNames) {
        ProtoToken token = peek();

        if (token.getType() == TokenType.SEMICOLON) {
            advance();
            return;
        }
        if (token.getType() == TokenType.RBRACE) {
            throw error(token, "unmatched '}'");
        }
        if (token.getType() != TokenType.IDENTIFIER) {
            throw error(token, "expected a top-level declaration but found " + token.describe());
        }

        switch (token.getValue()) {
            case "syntax" -> parseSyntax();
            case "package" -> parsePackage();
            case "import" -> parseImport();
            case "option" -> parseOptionStatement(proto);
            case "message" -> {
                MessageDescriptor message = parseMessage(topLevelNames);
                proto.addMessage(message);
            }
            case "enum" -> {
                EnumDescriptor enumDescriptor = parseEnum(topLevelNames);
                proto.addEnum(enumDescriptor);
            }
            case "service" -> {
                ServiceDescriptor service = parseService(topLevelNames);
                proto.addService(service);
            }
            case "extend" -> proto.addExtend(parseExtend(null));
            default -> throw error(token, "unexpected " + token.describe() + " at top level");
        }
    }

    private void parseSyntax() {
        expectKeyword("syntax");
        expect(TokenType.EQUALS, "'=' after syntax");
        String syntax = expect(TokenType.STRING_LITERAL, "syntax string").getValue();
        expect(TokenType.SEMICOLON, "';' after syntax declaration");
        proto.setSyntax(syntax);
    }

    private void parsePackage() {
        ProtoToken keyword = expectKeyword("package");
        if (packageDeclared) {
            throw error(keyword, "multiple package declarations");
        }
        ProtoToken name = expectName("package name");
        if (name.getValue().startsWith(".")) {
            throw error(name, "package name must not start with '.'");
        }
        expect(TokenType.SEMICOLON, "';' after package name");
        proto.setPackageName(name.getValue());
        packageDeclared = true;
    }

    private void parseImport() {
        expectKeyword("import");
        if (peek().isIdentifier("public") || peek().isIdentifier("weak")) {
            log.debug("Import modifier '{}' in {} is treated as a plain import", peek().getValue(), fileName);
            advance();
        }
        ProtoToken importName = expect(TokenType.STRING_LITERAL, "import file name");
        expect(TokenType.SEMICOLON, "';' after import");
        proto.addImportName(importName.getValue());
        log.debug("Parsed import: {} at line {}", importName.getValue(), importName.getLine());
    }

    private MessageDescriptor parseMessage(Set<String> siblingNames) {
        ProtoToken keyword = expectKeyword("message");
        ProtoToken nameToken = expectSimpleName("message name");
        claimName(siblingNames, nameToken, "type");

        MessageDescriptor message = new MessageDescriptor(nameToken.getValue(), fileName, keyword.getLine());
        expect(TokenType.LBRACE, "'{' after message name");

        Set<String> nestedTypeNames = new HashSet<>();
        Set<String> fieldNames = new HashSet<>();

        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "missing '}' to close message " + message.getName());
            }
            parseMessageElement(message, nestedTypeNames, fieldNames);
        }
        advance();

        log.debug("Parsed message: {} at line {}", message.getName(), keyword.getLine());
        return message;
    }

    private void parseMessageElement(MessageDescriptor message, Set<String> nestedTypeNames, Set<String> fieldNames) {
        ProtoToken token = peek();

        if (token.getType() == TokenType.SEMICOLON) {
            advance();
            return;
        }
        if (token.getType() != TokenType.IDENTIFIER) {
            throw error(token, "expected a field or declaration in message " + message.getName()
                    + " but found " + token.describe());
        }

        switch (token.getValue()) {
            case "message" -> message.addMessage(parseMessage(nestedTypeNames));
            case "enum" -> message.addEnum(parseEnum(nestedTypeNames));
            case "option" -> parseOptionStatement(message);
            case "oneof" -> parseOneof(message, fieldNames);
            case "extensions" -> message.addExtensionRange(parseRanges("extensions"));
            case "reserved" -> message.addReserved(parseRanges("reserved"));
            case "extend" -> proto.addExtend(parseExtend(message));
            default -> message.addField(parseField(null, true, false, fieldNames));
        }
    }

    private void parseOneof(MessageDescriptor message, Set<String> fieldNames) {
        expectKeyword("oneof");
        ProtoToken nameToken = expectSimpleName("oneof name");
        expect(TokenType.LBRACE, "'{' after oneof name");
        message.addOneof(nameToken.getValue());

        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "missing '}' to close oneof " + nameToken.getValue());
            }
            if (check(TokenType.SEMICOLON)) {
                advance();
            } else if (peek().isIdentifier("option")) {
                parseOptionStatement(message);
            } else {
                message.addField(parseField(nameToken.getValue(), false, false, fieldNames));
            }
        }
        advance();
    }

    /**
     * Field declaration: {@code [label] type name = number [options];}
     */
    private FieldDescriptor parseField(String oneofName, boolean allowLabel, boolean extension, Set<String> fieldNames) {
        ProtoToken first = peek();
        FieldLabel label = oneofName != null ? FieldLabel.OPTIONAL : FieldLabel.SINGULAR;

        if (FieldLabel.isLabelKeyword(first.getValue()) && peekAt(1).getType() == TokenType.IDENTIFIER) {
            if (!allowLabel) {
                throw error(first, "label '" + first.getValue() + "' is not allowed here");
            }
            label = FieldLabel.fromKeyword(advance().getValue());
        }

        ProtoToken typeToken = expectName("field type");
        if (typeToken.getValue().equals("map") && check(TokenType.LANGLE)) {
            throw error(typeToken, "map fields are not supported");
        }
        ProtoToken nameToken = expectSimpleName("field name");
        claimName(fieldNames, nameToken, "field");
        if (typeToken.getValue().equals("group") && Character.isUpperCase(nameToken.getValue().charAt(0))) {
            throw error(typeToken, "groups are not supported");
        }

        if (!check(TokenType.EQUALS)) {
            throw error(peek(), "missing field number for field " + nameToken.getValue());
        }
        advance();
        if (!check(TokenType.INTEGER)) {
            throw error(peek(), "missing field number for field " + nameToken.getValue());
        }
        ProtoToken numberToken = advance();
        long number = parseIntegerLiteral(numberToken);
        if (number < 1 || number > MAX_FIELD_NUMBER) {
            throw error(numberToken, "field number " + number + " of field " + nameToken.getValue() + " is out of range");
        }

        FieldDescriptor field = FieldDescriptor.builder()
                .name(nameToken.getValue())
                .rawType(typeToken.getValue())
                .number((int) number)
                .label(label)
                .oneofName(oneofName)
                .extension(extension)
                .sourceFile(fileName)
                .sourceLine(nameToken.getLine())
                .build();

        if (check(TokenType.LBRACKET)) {
            parseBracketOptions(field);
        }
        expect(TokenType.SEMICOLON, "';' after field " + field.getName());

        log.debug("Parsed field: {} {} = {} at line {}", typeToken.getValue(), field.getName(), number, nameToken.getLine());
        return field;
    }

    private EnumDescriptor parseEnum(Set<String> siblingNames) {
        ProtoToken keyword = expectKeyword("enum");
        ProtoToken nameToken = expectSimpleName("enum name");
        claimName(siblingNames, nameToken, "type");

        EnumDescriptor enumDescriptor = new EnumDescriptor(nameToken.getValue(), fileName, keyword.getLine());
        expect(TokenType.LBRACE, "'{' after enum name");

        Set<String> valueNames = new HashSet<>();
        Map<Integer, ProtoToken> numbers = new HashMap<>();
        List<ProtoToken> reusedNumbers = new ArrayList<>();

        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "missing '}' to close enum " + enumDescriptor.getName());
            }
            ProtoToken token = peek();
            if (token.getType() == TokenType.SEMICOLON) {
                advance();
            } else if (token.isIdentifier("option")) {
                parseOptionStatement(enumDescriptor);
            } else if (token.isIdentifier("reserved")) {
                parseRanges("reserved");
            } else {
                ProtoToken valueName = expectSimpleName("enum value name");
                claimName(valueNames, valueName, "enum value");
                expect(TokenType.EQUALS, "'=' after enum value " + valueName.getValue());
                boolean negative = false;
                if (check(TokenType.MINUS)) {
                    advance();
                    negative = true;
                }
                if (!check(TokenType.INTEGER)) {
                    throw error(peek(), "missing number for enum value " + valueName.getValue());
                }
                ProtoToken numberToken = advance();
                long number = negative ? -parseIntegerLiteral(numberToken) : parseIntegerLiteral(numberToken);
                if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                    throw error(numberToken, "enum value " + valueName.getValue() + " = " + number
                            + " is out of the int32 range");
                }
                int value = (int) number;

                EnumValueDescriptor enumValue = new EnumValueDescriptor(valueName.getValue(), value, fileName, valueName.getLine());
                if (check(TokenType.LBRACKET)) {
                    parseBracketOptions(enumValue);
                }
                expect(TokenType.SEMICOLON, "';' after enum value " + valueName.getValue());

                if (numbers.putIfAbsent(value, valueName) != null) {
                    reusedNumbers.add(valueName);
                }
                enumDescriptor.addValue(enumValue);
            }
        }
        advance();

        // allow_alias may be declared after the values it permits
        if (!reusedNumbers.isEmpty() && !enumDescriptor.isAliasAllowed()) {
            ProtoToken duplicate = reusedNumbers.get(0);
            throw new DuplicateDefinitionException(fileName, duplicate.getLine(), duplicate.getColumn(),
                    duplicate.getValue(), "enum value " + duplicate.getValue() + " reuses a number already used in enum "
                    + enumDescriptor.getName() + " (set option allow_alias = true to permit aliases)");
        }

        log.debug("Parsed enum: {} with {} values", enumDescriptor.getName(), enumDescriptor.getValues().size());
        return enumDescriptor;
    }

    private ServiceDescriptor parseService(Set<String> siblingNames) {
        ProtoToken keyword = expectKeyword("service");
        ProtoToken nameToken = expectSimpleName("service name");
        claimName(siblingNames, nameToken, "type");

        ServiceDescriptor service = new ServiceDescriptor(nameToken.getValue(), fileName, keyword.getLine());
        expect(TokenType.LBRACE, "'{' after service name");

        Set<String> methodNames = new HashSet<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "missing '}' to close service " + service.getName());
            }
            ProtoToken token = peek();
            if (token.getType() == TokenType.SEMICOLON) {
                advance();
            } else if (token.isIdentifier("option")) {
                parseOptionStatement(service);
            } else if (token.isIdentifier("rpc")) {
                service.addMethod(parseMethod(methodNames));
            } else {
                throw error(token, "expected 'rpc' or 'option' in service " + service.getName()
                        + " but found " + token.describe());
            }
        }
        advance();

        log.debug("Parsed service: {} with {} methods", service.getName(), service.getMethods().size());
        return service;
    }

    private MethodDescriptor parseMethod(Set<String> methodNames) {
        ProtoToken keyword = expectKeyword("rpc");
        ProtoToken nameToken = expectSimpleName("method name");
        claimName(methodNames, nameToken, "method");

        expect(TokenType.LPAREN, "'(' before input type of " + nameToken.getValue());
        boolean clientStreaming = consumeStreamModifier();
        ProtoToken inputType = expectName("input type");
        expect(TokenType.RPAREN, "')' after input type of " + nameToken.getValue());

        ProtoToken returns = expectName("'returns'");
        if (!returns.getValue().equals("returns")) {
            throw error(returns, "expected 'returns' but found " + returns.describe());
        }

        expect(TokenType.LPAREN, "'(' before output type of " + nameToken.getValue());
        boolean serverStreaming = consumeStreamModifier();
        ProtoToken outputType = expectName("output type");
        expect(TokenType.RPAREN, "')' after output type of " + nameToken.getValue());

        MethodDescriptor method = MethodDescriptor.builder()
                .name(nameToken.getValue())
                .rawInputType(inputType.getValue())
                .rawOutputType(outputType.getValue())
                .clientStreaming(clientStreaming)
                .serverStreaming(serverStreaming)
                .sourceFile(fileName)
                .sourceLine(keyword.getLine())
                .build();

        if (check(TokenType.LBRACE)) {
            advance();
            while (!check(TokenType.RBRACE)) {
                if (isAtEnd()) {
                    throw error(peek(), "missing '}' to close method " + method.getName());
                }
                if (check(TokenType.SEMICOLON)) {
                    advance();
                } else {
                    parseOptionStatement(method);
                }
            }
            advance();
            if (check(TokenType.SEMICOLON)) {
                advance();
            }
        } else {
            expect(TokenType.SEMICOLON, "';' after method " + method.getName());
        }

        return method;
    }

    private boolean consumeStreamModifier() {
        if (peek().isIdentifier("stream") && peekAt(1).getType() == TokenType.IDENTIFIER) {
            advance();
            return true;
        }
        return false;
    }

    private ExtendDescriptor parseExtend(MessageDescriptor enclosingMessage) {
        ProtoToken keyword = expectKeyword("extend");
        ProtoToken target = expectName("extended type name");

        ExtendDescriptor extend = new ExtendDescriptor(target.getValue(), enclosingMessage, fileName, keyword.getLine());
        expect(TokenType.LBRACE, "'{' after extended type name");

        Set<String> fieldNames = new HashSet<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error(peek(), "missing '}' to close extend " + target.getValue());
            }
            if (check(TokenType.SEMICOLON)) {
                advance();
                continue;
            }
            extend.addField(parseField(null, true, true, fieldNames));
        }
        advance();

        log.debug("Parsed extend: {} with {} fields", target.getValue(), extend.getFields().size());
        return extend;
    }

    /**
     * {@code extensions 100 to 199, 500 to max;} and {@code reserved 2, 15, "foo";}
     * are kept as their raw text, one entry per statement.
     */
    private String parseRanges(String keyword) {
        ProtoToken start = expectKeyword(keyword);
        StringBuilder sb = new StringBuilder();
        while (!check(TokenType.SEMICOLON)) {
            if (isAtEnd() || check(TokenType.RBRACE)) {
                throw error(peek(), "missing ';' after " + keyword + " statement at line " + start.getLine());
            }
            ProtoToken token = advance();
            if (token.getType() == TokenType.COMMA) {
                sb.append(", ");
            } else {
                if (sb.length() > 0 && !sb.toString().endsWith(" ") && !sb.toString().endsWith("-")) {
                    sb.append(' ');
                }
                sb.append(token.getType() == TokenType.STRING_LITERAL ? "\"" + token.getValue() + "\"" : token.getValue());
            }
        }
        advance();
        return sb.toString();
    }

    /**
     * {@code option name = value;} (also accepts {@code name: value}).
     */
    private void parseOptionStatement(Descriptor target) {
        expectKeyword("option");
        String name = parseOptionName();
        if (check(TokenType.EQUALS) || check(TokenType.COLON)) {
            advance();
        } else {
            throw error(peek(), "expected '=' or ':' after option " + name + " but found " + peek().describe());
        }
        Object value = parseConstant();
        expect(TokenType.SEMICOLON, "';' after option " + name);
        target.setOption(name, value);
    }

    private void parseBracketOptions(Descriptor target) {
        expect(TokenType.LBRACKET, "'['");
        do {
            String name = parseOptionName();
            if (check(TokenType.EQUALS) || check(TokenType.COLON)) {
                advance();
            } else {
                throw error(peek(), "expected '=' after option " + name + " but found " + peek().describe());
            }
            target.setOption(name, parseConstant());
        } while (match(TokenType.COMMA));
        expect(TokenType.RBRACKET, "']' to close options");
    }

    private String parseOptionName() {
        if (check(TokenType.LPAREN)) {
            advance();
            ProtoToken extensionName = expectName("custom option name");
            expect(TokenType.RPAREN, "')' after custom option name");
            StringBuilder name = new StringBuilder("(").append(extensionName.getValue()).append(")");
            while (check(TokenType.IDENTIFIER) && peek().getValue().startsWith(".")) {
                name.append(advance().getValue());
            }
            return name.toString();
        }
        return expectName("option name").getValue();
    }

    private Object parseConstant() {
        ProtoToken token = peek();

        switch (token.getType()) {
            case STRING_LITERAL -> {
                StringBuilder sb = new StringBuilder();
                while (check(TokenType.STRING_LITERAL)) {
                    sb.append(advance().getValue());
                }
                return sb.toString();
            }
            case MINUS -> {
                advance();
                Object value = parseConstant();
                if (value instanceof Integer i) {
                    return -i;
                } else if (value instanceof Long l) {
                    return -l;
                } else if (value instanceof BigInteger b) {
                    return narrow(b.negate());
                } else if (value instanceof Double d) {
                    return -d;
                }
                throw error(token, "'-' must be followed by a number");
            }
            case INTEGER -> {
                advance();
                return narrow(parseBigInteger(token));
            }
            case FLOAT -> {
                advance();
                return Double.parseDouble(token.getValue());
            }
            case IDENTIFIER -> {
                advance();
                return switch (token.getValue()) {
                    case "true" -> Boolean.TRUE;
                    case "false" -> Boolean.FALSE;
                    case "inf" -> Double.POSITIVE_INFINITY;
                    case "nan" -> Double.NaN;
                    default -> token.getValue();
                };
            }
            case LBRACE -> {
                return parseAggregate();
            }
            default -> throw error(token, "expected an option value but found " + token.describe());
        }
    }

    /**
     * Text-format aggregate value, kept as raw text.
     */
    private String parseAggregate() {
        ProtoToken open = expect(TokenType.LBRACE, "'{'");
        StringBuilder sb = new StringBuilder("{");
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw error(open, "missing '}' to close aggregate option value");
            }
            ProtoToken token = advance();
            if (token.getType() == TokenType.LBRACE) {
                depth++;
            } else if (token.getType() == TokenType.RBRACE) {
                depth--;
            }
            sb.append(' ');
            sb.append(token.getType() == TokenType.STRING_LITERAL ? "\"" + token.getValue() + "\"" : token.getValue());
        }
        return sb.toString();
    }

    private void claimName(Set<String> names, ProtoToken nameToken, String kind) {
        if (!names.add(nameToken.getValue())) {
            throw new DuplicateDefinitionException(fileName, nameToken.getLine(), nameToken.getColumn(),
                    nameToken.getValue(), "duplicate " + kind + " name '" + nameToken.getValue() + "' in the same scope");
        }
    }

    private long parseIntegerLiteral(ProtoToken token) {
        BigInteger value = parseBigInteger(token);
        if (value.bitLength() > 63) {
            throw error(token, "integer " + token.getValue() + " is too large");
        }
        return value.longValue();
    }

    private BigInteger parseBigInteger(ProtoToken token) {
        String text = token.getValue();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return new BigInteger(text.substring(2), 16);
            }
            if (text.length() > 1 && text.startsWith("0")) {
                return new BigInteger(text.substring(1), 8);
            }
            return new BigInteger(text);
        } catch (NumberFormatException e) {
            throw error(token, "malformed integer " + text);
        }
    }

    private static Object narrow(BigInteger value) {
        if (value.bitLength() <= 31) {
            return value.intValue();
        }
        if (value.bitLength() <= 63) {
            return value.longValue();
        }
        return value;
    }

    private ProtoToken expectKeyword(String keyword) {
        ProtoToken token = peek();
        if (!token.isIdentifier(keyword)) {
            throw error(token, "expected '" + keyword + "' but found " + token.describe());
        }
        return advance();
    }

    private ProtoToken expectName(String what) {
        if (check(TokenType.IDENTIFIER)) {
            return advance();
        }
        throw error(peek(), "expected " + what + " but found " + peek().describe());
    }

    private ProtoToken expectSimpleName(String what) {
        ProtoToken token = expectName(what);
        if (token.getValue().contains(".")) {
            throw error(token, what + " must not contain '.': " + token.getValue());
        }
        return token;
    }

    private ProtoToken expect(TokenType type, String what) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), "expected " + what + " but found " + peek().describe());
    }

    private ProtoSyntaxException error(ProtoToken at, String detail) {
        return new ProtoSyntaxException(fileName, at.getLine(), at.getColumn(), detail);
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private ProtoToken peek() {
        return tokens.get(pos);
    }

    private ProtoToken peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private ProtoToken previous() {
        return tokens.get(pos - 1);
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ProtoToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }
}
