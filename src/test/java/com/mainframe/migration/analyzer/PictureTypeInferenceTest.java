package com.mainframe.migration.analyzer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.mainframe.migration.model.InferredType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PIC string type inference.
 */
class PictureTypeInferenceTest {

    @ParameterizedTest
    @ValueSource(strings = {"X", "X(10)", "XXX", "x(5)", "9(3)X(2)", "S9(4)X", "A(2)X", "XV9"})
    void testAnyXIsString(String picture) {
        assertThat(PictureTypeInference.inferType(picture)).isEqualTo(InferredType.STRING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9(5)V99", "S9(7)V99", "99V9", "9.99", "ZZ9.99", "9v9"})
    void testNineWithImpliedOrExplicitPointIsDecimal(String picture) {
        assertThat(PictureTypeInference.inferType(picture)).isEqualTo(InferredType.DECIMAL);
    }

    @ParameterizedTest
    @CsvSource({
        "9, SHORT_INTEGER",
        "9(4), SHORT_INTEGER",
        "9999, SHORT_INTEGER",
        "S9(4), SHORT_INTEGER",
        "ZZ99, SHORT_INTEGER",
        "9(5), INTEGER",
        "9(6), INTEGER",
        "S9(9), INTEGER",
        "'ZZZ,ZZ9', INTEGER",
        "9(10), LONG_INTEGER",
        "S9(18), LONG_INTEGER",
        "9(9)99, LONG_INTEGER"
    })
    void testDigitCountSelectsIntegerWidth(String picture, InferredType expected) {
        assertThat(PictureTypeInference.inferType(picture)).isEqualTo(expected);
    }

    @Test
    void testSignWithoutDigitsIsInteger() {
        assertThat(PictureTypeInference.inferType("S")).isEqualTo(InferredType.INTEGER);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "A(10)", "B"})
    void testOtherPicturesAreString(String picture) {
        assertThat(PictureTypeInference.inferType(picture)).isEqualTo(InferredType.STRING);
    }

    @Test
    void testRepeatNotationIsAppliedBeforeCounting() {
        assertThat(PictureTypeInference.countDigitPositions("9(3)V9(2)")).isEqualTo(5);
        assertThat(PictureTypeInference.countDigitPositions("*(3)9")).isEqualTo(4);
        assertThat(PictureTypeInference.countDigitPositions("Z(3)9(2)")).isEqualTo(5);
        assertThat(PictureTypeInference.countDigitPositions("X(9)9")).isEqualTo(1);
        assertThat(PictureTypeInference.countDigitPositions("9()9")).isEqualTo(2);
    }

    @Test
    void testHugeRepeatCountsSaturate() {
        assertThat(PictureTypeInference.countDigitPositions("9(99999999999)")).isEqualTo(Integer.MAX_VALUE);
        assertThat(PictureTypeInference.countDigitPositions("9(2000000000)9(2000000000)"))
                .isEqualTo(Integer.MAX_VALUE);
        assertThat(PictureTypeInference.countDigitPositions("9(2000000000)")).isEqualTo(2_000_000_000);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9(99999999999)", "9(2000000000)", "S9(2147483648)"})
    void testHugeRepeatCountsAreLongIntegers(String picture) {
        assertThat(PictureTypeInference.inferType(picture)).isEqualTo(InferredType.LONG_INTEGER);
    }
}
