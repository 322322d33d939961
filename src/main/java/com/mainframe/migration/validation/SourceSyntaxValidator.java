package com.mainframe.migration.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lightweight structural check of generated Java source.
 *
 * This is not a compiler. A unit is accepted when it declares a type, has
 * balanced braces and parentheses, and carries a package declaration.
 */
public class SourceSyntaxValidator {

    private static final Pattern TYPE_DECLARATION = Pattern.compile("\\b(class|interface|enum|record)\\s+\\w+");

    private static final Pattern PACKAGE_DECLARATION = Pattern.compile("(?m)^\\s*package\\s+[\\w.]+\\s*;");

    public boolean isSyntaxValid(String source) {
        return findProblems(source).isEmpty();
    }

    /**
     * @return one message per failed check, empty when the source is accepted
     */
    public List<String> findProblems(String source) {
        List<String> problems = new ArrayList<>();
        if (source == null || source.isBlank()) {
            problems.add("Source is empty");
            return problems;
        }
        if (!TYPE_DECLARATION.matcher(source).find()) {
            problems.add("No class, interface, enum or record declaration");
        }
        if (!isBalanced(source, '{', '}')) {
            problems.add("Unbalanced braces");
        }
        if (!isBalanced(source, '(', ')')) {
            problems.add("Unbalanced parentheses");
        }
        if (!PACKAGE_DECLARATION.matcher(source).find()) {
            problems.add("Missing package declaration");
        }
        return problems;
    }

    /**
     * Raw character count; brackets inside literals are counted too.
     */
    static boolean isBalanced(String source, char open, char close) {
        int depth = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
