package com.xinyue.mathm.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("定点小数基础运算测试")
class DecimalOpsTest {

    private static BigDecimal d(String value) {
        return new BigDecimal(value);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, d(expected).compareTo(actual), "expected " + expected + " but was " + actual.toPlainString());
    }

    @Test
    @DisplayName("fix 统一到 28 位小数")
    void testFix_AnyScale_Returns28Digits() {
        assertEquals(ScaleConstants.SCALE, DecimalOps.fix(d("1.5")).scale());
        assertEquals(ScaleConstants.SCALE, DecimalOps.fix(d("12345")).scale());
        // 第 29 位按 HALF_EVEN 舍入
        assertDecimal("0.0000000000000000000000000002", DecimalOps.fix(d("0.00000000000000000000000000015")));
        assertThrows(NullPointerException.class, () -> DecimalOps.fix(null));
    }

    @Test
    @DisplayName("相等判断忽略 scale")
    void testEq_DifferentScales_Equal() {
        assertTrue(DecimalOps.eq(d("1.0"), d("1.000000")));
        assertFalse(DecimalOps.eq(d("1.0"), d("1.0000000000000000000000000001")));
        assertTrue(DecimalOps.isZero(d("0.000")));
    }

    @Test
    @DisplayName("取余和截断保持符号")
    void testRemainderAndTruncate_Negative_KeepSign() {
        assertDecimal("-1", DecimalOps.remainder(d("-7"), d("3")));
        assertDecimal("1", DecimalOps.remainder(d("7"), d("-3")));
        assertDecimal("-2", DecimalOps.truncate(d("-2.7")));
        assertDecimal("2", DecimalOps.truncate(d("2.9999")));
        assertTrue(DecimalOps.divisibleBy(d("540"), d("270")));
        assertFalse(DecimalOps.divisibleBy(d("540"), d("360")));
    }

    @Test
    @DisplayName("开方结果正确舍入到 28 位")
    void testSqrt_Values_CorrectlyRounded() {
        assertDecimal("1.4142135623730950488016887242", DecimalOps.sqrt(d("2")));
        assertDecimal("4", DecimalOps.sqrt(d("16")));
        assertDecimal("0.5", DecimalOps.sqrt(d("0.25")));
        assertDecimal("0", DecimalOps.sqrt(BigDecimal.ZERO));
        assertEquals(ScaleConstants.SCALE, DecimalOps.sqrt(d("16")).scale());
    }

    @Test
    @DisplayName("负数开方抛出异常")
    void testSqrt_Negative_Throws() {
        assertThrows(IllegalArgumentException.class, () -> DecimalOps.sqrt(d("-1")));
    }

    @Test
    @DisplayName("远离零舍入")
    void testRoundFromZero_HalfAwayFromZero() {
        assertDecimal("3", DecimalOps.roundFromZero(d("2.5"), 0));
        assertDecimal("-3", DecimalOps.roundFromZero(d("-2.5"), 0));
        assertDecimal("1.23", DecimalOps.roundFromZero(d("1.2345"), 2));
        assertDecimal("1.24", DecimalOps.roundFromZero(d("1.235"), 2));
        assertDecimal("-1.24", DecimalOps.roundFromZero(d("-1.235"), 2));
        assertDecimal("0", DecimalOps.roundFromZero(BigDecimal.ZERO, 3));
    }

    @Test
    @DisplayName("负的小数位数抛出异常")
    void testRoundFromZero_NegativeDecimals_Throws() {
        assertThrows(IllegalArgumentException.class, () -> DecimalOps.roundFromZero(d("1.5"), -1));
    }

    @Test
    @DisplayName("区间判断：闭区间与开区间")
    void testInRange_InclusiveAndExclusive() {
        assertTrue(DecimalOps.inRangeIncl(d("1"), d("1"), d("2")));
        assertTrue(DecimalOps.inRangeIncl(d("2"), d("1"), d("2")));
        assertFalse(DecimalOps.inRangeIncl(d("2.0001"), d("1"), d("2")));
        assertFalse(DecimalOps.inRangeExcl(d("1"), d("1"), d("2")));
        assertTrue(DecimalOps.inRangeExcl(d("1.5"), d("1"), d("2")));
        assertThrows(IllegalArgumentException.class, () -> DecimalOps.inRangeIncl(d("1"), d("2"), d("1")));
        assertThrows(IllegalArgumentException.class, () -> DecimalOps.inRangeExcl(d("1"), d("2"), d("1")));
    }

    @Test
    @DisplayName("10 的幂")
    void testPowerOfTen() {
        assertDecimal("1000", DecimalOps.powerOfTen(3));
        assertDecimal("0.01", DecimalOps.powerOfTen(-2));
        assertDecimal("1", DecimalOps.powerOfTen(0));
    }
}
