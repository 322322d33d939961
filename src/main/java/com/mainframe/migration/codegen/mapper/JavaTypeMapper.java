package com.mainframe.migration.codegen.mapper;

import com.mainframe.migration.model.DataItem;
import com.mainframe.migration.model.InferredType;

import lombok.experimental.UtilityClass;

/**
 * Maps inferred type kinds to Java declarations and initial values.
 */
@UtilityClass
public class JavaTypeMapper {

    public static String javaType(InferredType type) {
        return switch (type) {
            case STRING -> "String";
            case SHORT_INTEGER -> "short";
            case INTEGER -> "int";
            case LONG_INTEGER -> "long";
            case DECIMAL -> "BigDecimal";
        };
    }

    /**
     * Java expression initializing the field for {@code item}: its VALUE
     * literal when present, otherwise the zero value of its kind.
     */
    public static String initializer(DataItem item) {
        InferredType type = item.getInferredType();
        String raw = item.getValue().map(String::trim).orElse(null);
        if (raw == null || raw.isEmpty()) {
            return zeroValue(type);
        }

        return switch (type) {
            case STRING -> '"' + escapeJavaString(stripQuotes(raw)) + '"';
            case SHORT_INTEGER, INTEGER -> integerLiteral(raw, "");
            case LONG_INTEGER -> integerLiteral(raw, "L");
            case DECIMAL -> decimalLiteral(raw);
        };
    }

    public static String zeroValue(InferredType type) {
        return switch (type) {
            case STRING -> "\"\"";
            case SHORT_INTEGER, INTEGER -> "0";
            case LONG_INTEGER -> "0L";
            case DECIMAL -> "BigDecimal.ZERO";
        };
    }

    /**
     * Keeps digits only. Figurative constants like ZERO have none and fall
     * back to 0. Leading zeros are dropped so the literal is not read as octal.
     */
    static String integerLiteral(String raw, String suffix) {
        String digits = raw.replaceAll("[^0-9]", "").replaceFirst("^0+(?=\\d)", "");
        if (digits.isEmpty()) {
            return "0" + suffix;
        }
        return digits + suffix;
    }

    static String decimalLiteral(String raw) {
        String number = raw.replaceAll("[^0-9.]", "");
        if (!number.matches("\\d*\\.?\\d+|\\d+\\.")) {
            return "BigDecimal.ZERO";
        }
        return "new BigDecimal(\"" + number + "\")";
    }

    static String stripQuotes(String raw) {
        return raw.replaceAll("^['\"]+|['\"]+$", "");
    }

    /**
     * Escapes a value for a Java string literal. Brackets and parentheses are
     * written as unicode escapes so the generated unit keeps balanced
     * structural counts whatever the COBOL literal contains.
     */
    static String escapeJavaString(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '{', '}', '(', ')' -> sb.append(String.format("\\u%04X", (int) c));
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
