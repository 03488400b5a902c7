package com.xinyue.mathm;

import com.xinyue.mathm.angle.AngleNormalizer;
import com.xinyue.mathm.common.AngleConstants;
import com.xinyue.mathm.common.DecimalOps;
import com.xinyue.mathm.config.SeriesConfig;
import com.xinyue.mathm.trig.DirectTrig;
import com.xinyue.mathm.trig.InverseTrig;
import com.xinyue.mathm.trig.SeriesEvaluator;

import java.math.BigDecimal;

/**
 * 定点小数三角函数入口。
 * <p>
 * 所有函数都是纯函数：参数先固定到 28 位小数，结果也以 28 位小数返回。
 * 级数配置在类加载时从 mathm.properties 读取一次。
 */
public final class Mathm {

    public static final BigDecimal PI = AngleConstants.PI;
    public static final BigDecimal TWO_PI = AngleConstants.TWO_PI;
    public static final BigDecimal PI_HALF = AngleConstants.PI_HALF;
    public static final BigDecimal PI_QUARTER = AngleConstants.PI_QUARTER;
    public static final BigDecimal PI_TWELFTH = AngleConstants.PI_TWELFTH;

    private static final SeriesEvaluator SERIES = new SeriesEvaluator(SeriesConfig.load());
    private static final DirectTrig DIRECT = new DirectTrig(SERIES);
    private static final InverseTrig INVERSE = new InverseTrig(SERIES);

    private Mathm() {
        // 工具类，禁止实例化
    }

    public static BigDecimal toRad(BigDecimal degrees) {
        return AngleNormalizer.toRad(degrees);
    }

    public static BigDecimal toDeg(BigDecimal radians) {
        return AngleNormalizer.toDeg(radians);
    }

    public static BigDecimal normalizeAngle(BigDecimal radians) {
        return AngleNormalizer.normalizeAngle(radians);
    }

    public static BigDecimal normalizeAngleDeg(BigDecimal degrees) {
        return AngleNormalizer.normalizeAngleDeg(degrees);
    }

    public static BigDecimal sin(BigDecimal x) {
        return DIRECT.sin(x);
    }

    public static BigDecimal cos(BigDecimal x) {
        return DIRECT.cos(x);
    }

    /**
     * @throws ArithmeticException 正切在该角度无定义
     */
    public static BigDecimal tan(BigDecimal radians) {
        return DIRECT.tan(radians);
    }

    /**
     * @throws IllegalArgumentException z 不在 [-1, 1] 内
     */
    public static BigDecimal asin(BigDecimal z) {
        return INVERSE.asin(z);
    }

    /**
     * @throws IllegalArgumentException z 不在 [-1, 1] 内
     */
    public static BigDecimal acos(BigDecimal z) {
        return INVERSE.acos(z);
    }

    public static BigDecimal atan(BigDecimal x) {
        return INVERSE.atan(x);
    }

    public static BigDecimal atan2(BigDecimal y, BigDecimal x) {
        return INVERSE.atan2(y, x);
    }

    /**
     * @throws IllegalArgumentException value 为负数
     */
    public static BigDecimal sqrt(BigDecimal value) {
        return DecimalOps.sqrt(value);
    }

    /**
     * @throws IllegalArgumentException decimals 小于 0
     */
    public static BigDecimal roundFromZero(BigDecimal value, int decimals) {
        return DecimalOps.roundFromZero(value, decimals);
    }
}
