package com.xinyue.mathm.trig;

import com.xinyue.mathm.common.DecimalOps;

import java.math.BigDecimal;
import java.util.Objects;

import static com.xinyue.mathm.common.AngleConstants.PI;
import static com.xinyue.mathm.common.AngleConstants.PI_HALF;
import static com.xinyue.mathm.common.AngleConstants.PI_THREE_HALVES;
import static com.xinyue.mathm.common.AngleConstants.TWO_PI;
import static com.xinyue.mathm.common.DecimalOps.eq;
import static com.xinyue.mathm.common.DecimalOps.isZero;
import static com.xinyue.mathm.common.ScaleConstants.ROUNDING;
import static com.xinyue.mathm.common.ScaleConstants.WORK_SCALE;

/**
 * 正弦、余弦、正切。
 * <p>
 * 正弦、余弦使用 Maclaurin 级数，特殊角（含取余后的负特殊角）直接返回精确值，
 * 级数结果截断到 [-1, 1]；正切由两者相除得到。
 */
public final class DirectTrig {

    private final SeriesEvaluator series;

    public DirectTrig(SeriesEvaluator series) {
        this.series = Objects.requireNonNull(series, "series");
    }

    /**
     * 正弦。
     *
     * @param x 弧度，可以为负数或超过一整圈
     */
    public BigDecimal sin(BigDecimal x) {
        // 只压缩到 (-2Pi, 2Pi)，不改变符号
        BigDecimal r = DecimalOps.remainder(DecimalOps.fix(x), TWO_PI);

        BigDecimal abs = r.abs();
        if (isZero(r) || eq(abs, PI) || eq(abs, TWO_PI)) {
            return DecimalOps.ZERO;
        }
        if (eq(r, PI_HALF) || eq(r, PI_THREE_HALVES.negate())) {
            return DecimalOps.ONE;
        }
        if (eq(r, PI_THREE_HALVES) || eq(r, PI_HALF.negate())) {
            return DecimalOps.MINUS_ONE;
        }

        BigDecimal xSquared = r.multiply(r);
        // 下一项 = 上一项 * -x^2 / (d * (d + 1))
        return clampUnit(series.sum("sin", r, (previous, d) -> previous.multiply(xSquared)
                .divide(BigDecimal.valueOf((long) d * (d + 1)), WORK_SCALE, ROUNDING)
                .negate()));
    }

    /**
     * 余弦。
     *
     * @param x 弧度，可以为负数或超过一整圈
     */
    public BigDecimal cos(BigDecimal x) {
        BigDecimal r = DecimalOps.remainder(DecimalOps.fix(x), TWO_PI);

        // 余弦是偶函数，负特殊角与正特殊角结果相同
        BigDecimal abs = r.abs();
        if (isZero(r) || eq(abs, TWO_PI)) {
            return DecimalOps.ONE;
        }
        if (eq(abs, PI)) {
            return DecimalOps.MINUS_ONE;
        }
        if (eq(abs, PI_HALF) || eq(abs, PI_THREE_HALVES)) {
            return DecimalOps.ZERO;
        }

        BigDecimal xSquared = r.multiply(r);
        // 下一项 = 上一项 * -x^2 / ((d - 1) * d)
        return clampUnit(series.sum("cos", DecimalOps.ONE, (previous, d) -> previous.multiply(xSquared)
                .divide(BigDecimal.valueOf((long) d * (d - 1)), WORK_SCALE, ROUNDING)
                .negate()));
    }

    /**
     * 正切。
     *
     * @throws ArithmeticException 余弦恰好为 0（Pi/2、3Pi/2 等）
     */
    public BigDecimal tan(BigDecimal radians) {
        BigDecimal cos = cos(radians);
        if (isZero(cos)) {
            throw new ArithmeticException("正切在该角度无定义: radians=" + radians.toPlainString());
        }
        return DecimalOps.divide(sin(radians), cos);
    }

    /**
     * 舍入误差可能让特殊角附近的部分和略微超出 [-1, 1]。
     */
    private static BigDecimal clampUnit(BigDecimal value) {
        if (value.compareTo(DecimalOps.ONE) > 0) {
            return DecimalOps.ONE;
        }
        if (value.compareTo(DecimalOps.MINUS_ONE) < 0) {
            return DecimalOps.MINUS_ONE;
        }
        return value;
    }
}
