package com.xinyue.mathm.angle;

import com.xinyue.mathm.common.AngleConstants;
import com.xinyue.mathm.common.DecimalOps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.xinyue.mathm.common.AngleConstants.PI;
import static com.xinyue.mathm.common.AngleConstants.TWO_PI;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("角度归一化与换算测试")
class AngleNormalizerTest {

    private static final BigDecimal TOLERANCE = new BigDecimal("1e-25");

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    private static void assertExact(BigDecimal expected, BigDecimal actual) {
        assertEquals(0, expected.compareTo(actual),
                "expected " + expected.toPlainString() + " but was " + actual.toPlainString());
    }

    private static void assertClose(BigDecimal expected, BigDecimal actual) {
        BigDecimal diff = expected.subtract(actual).abs();
        assertTrue(diff.compareTo(TOLERANCE) <= 0,
                "expected " + expected.toPlainString() + " but was " + actual.toPlainString());
    }

    @Test
    @DisplayName("特殊角精确换算为弧度")
    void testToRad_LandmarkAngles_Exact() {
        assertExact(PI, AngleNormalizer.toRad(d("180")));
        assertExact(AngleConstants.PI_HALF, AngleNormalizer.toRad(d("90")));
        assertExact(TWO_PI, AngleNormalizer.toRad(d("360")));
        assertExact(AngleConstants.PI_THREE_HALVES, AngleNormalizer.toRad(d("270")));
        assertExact(AngleConstants.PI_QUARTER, AngleNormalizer.toRad(d("45")));
        assertExact(AngleConstants.PI_TWELFTH, AngleNormalizer.toRad(d("15")));
        assertExact(BigDecimal.ZERO, AngleNormalizer.toRad(d("0")));
    }

    @Test
    @DisplayName("整除检查按 360、270、180、90、45、15 的顺序")
    void testToRad_Priority_FirstDivisorWins() {
        // 540 不能被 360 整除，但能被 270 整除
        assertExact(AngleConstants.PI_THREE_HALVES.multiply(d("2")), AngleNormalizer.toRad(d("540")));
        assertExact(TWO_PI.multiply(d("-2")), AngleNormalizer.toRad(d("-720")));
        assertExact(AngleConstants.PI_TWELFTH.multiply(d("2")), AngleNormalizer.toRad(d("30")));
        assertExact(AngleConstants.PI_QUARTER.multiply(d("3")), AngleNormalizer.toRad(d("135")));
    }

    @Test
    @DisplayName("非特殊角使用 degrees * Pi / 180")
    void testToRad_GeneralAngle_UsesFormula() {
        BigDecimal expected = DecimalOps.divide(d("37").multiply(PI), d("180"));
        assertExact(expected, AngleNormalizer.toRad(d("37")));
        assertClose(d("0.6457718232379019434617655843"), AngleNormalizer.toRad(d("37")));
        assertClose(DecimalOps.divide(d("7.5").multiply(PI), d("180")), AngleNormalizer.toRad(d("7.5")));
    }

    @Test
    @DisplayName("弧度换算为角度")
    void testToDeg() {
        assertClose(d("180"), AngleNormalizer.toDeg(PI));
        assertClose(d("90"), AngleNormalizer.toDeg(AngleConstants.PI_HALF));
        assertClose(d("37"), AngleNormalizer.toDeg(AngleNormalizer.toRad(d("37"))));
        assertExact(BigDecimal.ZERO, AngleNormalizer.toDeg(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("弧度归一化到 [0, 2Pi)")
    void testNormalizeAngle_AlwaysInRange() {
        String[] inputs = {"-1000000", "-7", "-6.2831853071795864769252867666", "0",
                "6.2831853071795864769252867666", "12.5", "1000000000", "-0.0000000000000000000000000001"};
        for (String input : inputs) {
            BigDecimal normalized = AngleNormalizer.normalizeAngle(d(input));
            assertTrue(normalized.signum() >= 0, input + " -> " + normalized);
            assertTrue(normalized.compareTo(TWO_PI) < 0, input + " -> " + normalized);
            // 幂等
            assertExact(normalized, AngleNormalizer.normalizeAngle(normalized));
        }
    }

    @Test
    @DisplayName("整圈倍数被精确去除")
    void testNormalizeAngle_MultiplesOfTwoPi() {
        BigDecimal manyTurns = TWO_PI.multiply(d("1000"));
        assertExact(d("1"), AngleNormalizer.normalizeAngle(manyTurns.add(BigDecimal.ONE)));
        assertExact(TWO_PI.subtract(BigDecimal.ONE), AngleNormalizer.normalizeAngle(manyTurns.negate().subtract(BigDecimal.ONE)));
        assertExact(BigDecimal.ZERO, AngleNormalizer.normalizeAngle(TWO_PI));
        assertExact(TWO_PI.subtract(AngleConstants.PI_HALF), AngleNormalizer.normalizeAngle(AngleConstants.PI_HALF.negate()));
    }

    @Test
    @DisplayName("角度归一化到 [0, 360)")
    void testNormalizeAngleDeg() {
        assertExact(d("270"), AngleNormalizer.normalizeAngleDeg(d("-90")));
        assertExact(d("0"), AngleNormalizer.normalizeAngleDeg(d("720")));
        assertExact(d("0"), AngleNormalizer.normalizeAngleDeg(d("-360")));
        assertExact(d("10.5"), AngleNormalizer.normalizeAngleDeg(d("370.5")));
        assertExact(d("359.75"), AngleNormalizer.normalizeAngleDeg(d("-0.25")));
    }
}
