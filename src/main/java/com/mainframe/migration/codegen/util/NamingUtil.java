package com.mainframe.migration.codegen.util;

import java.util.Locale;
import java.util.Set;

/**
 * COBOL to Java naming conventions used by the generators.
 */
public class NamingUtil {

    /**
     * Working-storage prefix removed from data and paragraph names by default.
     */
    public static final String DEFAULT_RESERVED_PREFIX = "WS-";

    private static final String FALLBACK_IDENTIFIER = "field";

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
            "const", "continue", "default", "do", "double", "else", "enum", "extends", "false",
            "final", "finally", "float", "for", "goto", "if", "implements", "import", "instanceof",
            "int", "interface", "long", "native", "new", "null", "package", "private", "protected",
            "public", "return", "short", "static", "strictfp", "super", "switch", "synchronized",
            "this", "throw", "throws", "transient", "true", "try", "void", "volatile", "while",
            "var", "record", "yield", "sealed", "permits");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts a COBOL name to a Java identifier using the default prefix.
     * Example: "WS-CUSTOMER-NAME" -> "customerName".
     */
    public static String toJavaIdentifier(String cobolName) {
        return toJavaIdentifier(cobolName, DEFAULT_RESERVED_PREFIX);
    }

    /**
     * Strips {@code reservedPrefix} when the name starts with it, then
     * camel-cases the hyphen separated rest. A blank prefix disables stripping.
     */
    public static String toJavaIdentifier(String cobolName, String reservedPrefix) {
        if (cobolName == null || cobolName.isBlank()) {
            return FALLBACK_IDENTIFIER;
        }

        String name = cobolName.trim();
        if (reservedPrefix != null && !reservedPrefix.isEmpty()
                && name.regionMatches(true, 0, reservedPrefix, 0, reservedPrefix.length())) {
            name = name.substring(reservedPrefix.length());
        }

        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (String part : name.split("-")) {
            if (part.isEmpty()) {
                continue;
            }
            String segment = normalizeCase(part);
            if (first) {
                sb.append(decapitalize(segment));
                first = false;
            } else {
                sb.append(capitalize(segment));
            }
        }

        return sb.length() == 0 ? FALLBACK_IDENTIFIER : sb.toString();
    }

    /**
     * Makes a mapped identifier legal in Java source: keywords get
     * {@code suffix} appended, a leading digit gets {@code prefix} in front.
     * COBOL allows names like "1000-MAIN" or "CLASS".
     */
    public static String toLegalIdentifier(String identifier, String prefix, String suffix) {
        String result = identifier;
        if (!result.isEmpty() && !Character.isJavaIdentifierStart(result.charAt(0))) {
            result = prefix + capitalize(result);
        }
        if (isJavaKeyword(result)) {
            result = result + suffix;
        }
        return result;
    }

    public static boolean isJavaKeyword(String identifier) {
        return JAVA_KEYWORDS.contains(identifier);
    }

    /**
     * Class name for a program: the name itself when it is a legal Java
     * identifier, otherwise illegal characters are replaced by '_'.
     */
    public static String toClassName(String programName) {
        if (programName == null || programName.isBlank()) {
            return "Unknown";
        }
        String trimmed = programName.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
        }
        if (!Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        String name = sb.toString();
        return isJavaKeyword(name) ? name + "_" : name;
    }

    /**
     * Name as it may appear inside generated comments: anything besides word
     * characters, '-' and '.' becomes '_'.
     */
    public static String toCommentSafe(String name) {
        return name.replaceAll("[^\\w.-]", "_");
    }

    public static String getterName(String fieldName) {
        return "get" + capitalize(fieldName);
    }

    public static String setterName(String fieldName) {
        return "set" + capitalize(fieldName);
    }

    /**
     * File name without its last extension; "" for a blank input.
     * Accepts both '/' and '\' separators.
     */
    public static String fileStem(String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String trimmed = path.trim();
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String file = trimmed.substring(slash + 1);
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    /**
     * Upper-case COBOL segments are lowered; mixed-case input is already Java
     * style and kept, so mapping an identifier twice changes nothing.
     */
    private static String normalizeCase(String segment) {
        if (segment.equals(segment.toUpperCase(Locale.ROOT))) {
            return segment.toLowerCase(Locale.ROOT);
        }
        return segment;
    }

    private static String decapitalize(String str) {
        return Character.toLowerCase(str.charAt(0)) + str.substring(1);
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) {
            return str;
        }
        return Character.toUpperCase(str.charAt(0)) + str.substring(1);
    }
}
