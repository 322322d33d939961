package com.mainframe.migration.analyzer;

import java.util.Locale;

import com.mainframe.migration.model.InferredType;

import lombok.experimental.UtilityClass;

/**
 * Maps a raw PIC string to the target type kind.
 *
 * Rule order matters: an X anywhere wins over numeric markers, so "X(3)9(2)"
 * is a string.
 */
@UtilityClass
public class PictureTypeInference {

    private static final int SHORT_MAX_DIGITS = 4;
    private static final int INT_MAX_DIGITS = 9;

    public static InferredType inferType(String picture) {
        if (picture == null || picture.isBlank()) {
            return InferredType.STRING;
        }
        String pic = picture.trim().toUpperCase(Locale.ROOT);

        if (pic.contains("X")) {
            return InferredType.STRING;
        }
        if (pic.contains("9")) {
            if (pic.contains("V") || pic.contains(".")) {
                return InferredType.DECIMAL;
            }
            int digits = countDigitPositions(pic);
            if (digits <= SHORT_MAX_DIGITS) {
                return InferredType.SHORT_INTEGER;
            }
            if (digits <= INT_MAX_DIGITS) {
                return InferredType.INTEGER;
            }
            return InferredType.LONG_INTEGER;
        }
        if (pic.contains("S")) {
            return InferredType.INTEGER;
        }
        return InferredType.STRING;
    }

    /**
     * Counts digit positions (9, Z, *) with repeat notation applied, so "9(6)"
     * counts as six. Counts are summed without expanding the picture and
     * saturate at {@link Integer#MAX_VALUE}.
     */
    static int countDigitPositions(String picture) {
        long count = 0;
        int i = 0;
        while (i < picture.length()) {
            char symbol = picture.charAt(i++);
            long repeat = 1;
            if (i < picture.length() && picture.charAt(i) == '(') {
                int close = picture.indexOf(')', i);
                if (close > i + 1 && isDigits(picture, i + 1, close)) {
                    repeat = parseRepeat(picture, i + 1, close);
                    i = close + 1;
                }
            }
            if (symbol == '9' || symbol == 'Z' || symbol == '*') {
                count = Math.min(count + repeat, Integer.MAX_VALUE);
            }
        }
        return (int) count;
    }

    private static boolean isDigits(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static long parseRepeat(String text, int from, int to) {
        long value = 0;
        for (int i = from; i < to; i++) {
            value = value * 10 + (text.charAt(i) - '0');
            if (value >= Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            }
        }
        return value;
    }
}
