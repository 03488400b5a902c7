package com.xinyue.mathm.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import static com.xinyue.mathm.common.ScaleConstants.ROUNDING;
import static com.xinyue.mathm.common.ScaleConstants.SCALE;

/**
 * 定点小数的基础运算。
 * <p>
 * 所有方法的入参都可以是任意 scale 的 BigDecimal，返回值统一落在 {@link ScaleConstants#SCALE} 上。
 * 相等判断一律使用 compareTo，避免 BigDecimal.equals 对 scale 敏感。
 */
public final class DecimalOps {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);
    public static final BigDecimal MINUS_ONE = ONE.negate();
    public static final BigDecimal TWO = BigDecimal.valueOf(2).setScale(SCALE);

    private static final BigDecimal HALF = new BigDecimal("0.5");

    private DecimalOps() {
        // 工具类，禁止实例化
    }

    /**
     * 把入参固定到 SCALE 位小数。
     */
    public static BigDecimal fix(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, SCALE, ROUNDING);
    }

    public static BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return a.multiply(b).setScale(SCALE, ROUNDING);
    }

    /**
     * 精确取余，结果符号与被除数一致（截断除法语义）。
     */
    public static BigDecimal remainder(BigDecimal dividend, BigDecimal divisor) {
        return dividend.remainder(divisor).setScale(SCALE, ROUNDING);
    }

    /** 向零截断 */
    public static BigDecimal truncate(BigDecimal value) {
        return value.setScale(0, RoundingMode.DOWN).setScale(SCALE, ROUNDING);
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    public static boolean eq(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) == 0;
    }

    /**
     * 是否能被 divisor 整除（余数严格为 0）。
     */
    public static boolean divisibleBy(BigDecimal value, BigDecimal divisor) {
        return value.remainder(divisor).signum() == 0;
    }

    /**
     * 正确舍入的定点开方。
     *
     * @throws IllegalArgumentException value 为负数
     */
    public static BigDecimal sqrt(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("不能对负数开方: " + value.toPlainString());
        }
        if (value.signum() == 0) {
            return ZERO;
        }
        int integerDigits = Math.max(1, value.precision() - value.scale());
        return value.sqrt(ScaleConstants.sqrtContext(integerDigits)).setScale(SCALE, ROUNDING);
    }

    /**
     * 10 的 n 次方，n 可以为负。
     */
    public static BigDecimal powerOfTen(int n) {
        return BigDecimal.ONE.scaleByPowerOfTen(n);
    }

    /**
     * 判断 value 是否在 [lowerLimit, upperLimit] 闭区间内。
     *
     * @throws IllegalArgumentException upperLimit 小于 lowerLimit
     */
    public static boolean inRangeIncl(BigDecimal value, BigDecimal lowerLimit, BigDecimal upperLimit) {
        checkLimits(lowerLimit, upperLimit);
        return value.compareTo(lowerLimit) >= 0 && value.compareTo(upperLimit) <= 0;
    }

    /**
     * 判断 value 是否在 (lowerLimit, upperLimit) 开区间内。
     *
     * @throws IllegalArgumentException upperLimit 小于 lowerLimit
     */
    public static boolean inRangeExcl(BigDecimal value, BigDecimal lowerLimit, BigDecimal upperLimit) {
        checkLimits(lowerLimit, upperLimit);
        return value.compareTo(lowerLimit) > 0 && value.compareTo(upperLimit) < 0;
    }

    /**
     * 按"远离零"的方式四舍五入到 decimals 位小数，结果仍以 SCALE 位表示。
     *
     * @throws IllegalArgumentException decimals 小于 0
     */
    public static BigDecimal roundFromZero(BigDecimal value, int decimals) {
        Objects.requireNonNull(value, "value");
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals 必须大于等于 0, decimals=" + decimals);
        }
        if (decimals >= SCALE) {
            return fix(value);
        }
        BigDecimal scaleFactor = powerOfTen(decimals);
        BigDecimal roundingFactor = value.signum() > 0 ? HALF : HALF.negate();
        BigDecimal shifted = fix(value).multiply(scaleFactor).add(roundingFactor);
        return divide(shifted.setScale(0, RoundingMode.DOWN), scaleFactor);
    }

    private static void checkLimits(BigDecimal lowerLimit, BigDecimal upperLimit) {
        if (upperLimit.compareTo(lowerLimit) < 0) {
            throw new IllegalArgumentException("上限小于下限: lower=" + lowerLimit.toPlainString()
                    + ", upper=" + upperLimit.toPlainString());
        }
    }
}
