package com.xinyue.mathm.common;

import java.math.MathContext;
import java.math.RoundingMode;

/**
 * 定点小数的精度常量。
 * <p>
 * 系统中所有数值都使用 BigDecimal 存储，并固定在同一个小数位数（28 位）上，
 * 级数求和的终止条件依赖于这个固定精度：某一项在该精度下舍入为 0 即停止。
 */
public final class ScaleConstants {

    /** 固定小数位数 */
    public static final int SCALE = 28;

    /** 级数求和时额外保留的保护位数 */
    public static final int GUARD_DIGITS = 5;

    /** 级数内部的工作精度，项在该精度下为 0 即停止，部分和最后回落到 SCALE */
    public static final int WORK_SCALE = SCALE + GUARD_DIGITS;

    /** 除法、乘法结果回落到 SCALE 时使用的舍入方式 */
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    /** 开方时额外保留的保护位数 */
    public static final int SQRT_GUARD_DIGITS = 10;

    private ScaleConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 开方使用的 MathContext：有效位数 = 整数部分位数 + SCALE + 保护位。
     */
    public static MathContext sqrtContext(int integerDigits) {
        return new MathContext(integerDigits + SCALE + SQRT_GUARD_DIGITS, ROUNDING);
    }
}
