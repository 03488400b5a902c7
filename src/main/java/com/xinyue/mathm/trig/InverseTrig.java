package com.xinyue.mathm.trig;

import com.xinyue.mathm.common.DecimalOps;

import java.math.BigDecimal;
import java.util.Objects;

import static com.xinyue.mathm.common.AngleConstants.PI;
import static com.xinyue.mathm.common.AngleConstants.PI_HALF;
import static com.xinyue.mathm.common.AngleConstants.PI_QUARTER;
import static com.xinyue.mathm.common.DecimalOps.MINUS_ONE;
import static com.xinyue.mathm.common.DecimalOps.ONE;
import static com.xinyue.mathm.common.DecimalOps.eq;
import static com.xinyue.mathm.common.DecimalOps.isZero;
import static com.xinyue.mathm.common.ScaleConstants.ROUNDING;
import static com.xinyue.mathm.common.ScaleConstants.SCALE;
import static com.xinyue.mathm.common.ScaleConstants.WORK_SCALE;

/**
 * 反三角函数。
 * <p>
 * 只有反正切有自己的级数（Euler 加速形式，参见 http://mathworld.wolfram.com/InverseTangent.html），
 * 反正弦、反余弦都通过半角公式归约到反正切。直接用反正弦的 Taylor 级数在 ±1 附近需要上百万项，
 * 精度也不如归约到反正切。
 */
public final class InverseTrig {

    private final SeriesEvaluator series;

    public InverseTrig(SeriesEvaluator series) {
        this.series = Objects.requireNonNull(series, "series");
    }

    /**
     * 反正切，结果在 [-Pi/2, Pi/2]。
     */
    public BigDecimal atan(BigDecimal x) {
        BigDecimal v = DecimalOps.fix(x);

        // |v| > 1 时折叠到 [-1, 1]；1/v 舍入后绝对值不会超过 1，所以只折叠一次
        if (v.compareTo(MINUS_ONE) < 0) {
            return PI_HALF.negate().subtract(atanUnit(DecimalOps.divide(ONE, v)));
        }
        if (v.compareTo(ONE) > 0) {
            return PI_HALF.subtract(atanUnit(DecimalOps.divide(ONE, v)));
        }
        return atanUnit(v);
    }

    /**
     * [-1, 1] 上的反正切。
     */
    private BigDecimal atanUnit(BigDecimal v) {
        if (eq(v, MINUS_ONE)) {
            return PI_QUARTER.negate();
        }
        if (isZero(v)) {
            return DecimalOps.ZERO;
        }
        if (eq(v, ONE)) {
            return PI_QUARTER;
        }

        BigDecimal xSquared = v.multiply(v);
        BigDecimal onePlusXSquared = BigDecimal.ONE.add(xSquared);
        // 首项 x / (1 + x^2)，对很小的 x 比 y / x 更准确
        BigDecimal first = v.divide(onePlusXSquared, WORK_SCALE, ROUNDING);
        // 下一项 = 上一项 * y * d / (d + 1)，y = x^2 / (1 + x^2)，合并为一次除法
        return series.sum("atan", first, (previous, d) -> previous.multiply(xSquared)
                .multiply(BigDecimal.valueOf(d))
                .divide(onePlusXSquared.multiply(BigDecimal.valueOf(d + 1L)), WORK_SCALE, ROUNDING));
    }

    /**
     * 点 (x, y) 的方位角，结果在 (-Pi, Pi]。
     * <ul>
     *     <li>第一象限 0 &lt; θ &lt; Pi/2</li>
     *     <li>第二象限 Pi/2 &lt; θ ≤ Pi</li>
     *     <li>第三象限 -Pi &lt; θ &lt; -Pi/2</li>
     *     <li>第四象限 -Pi/2 &lt; θ &lt; 0</li>
     * </ul>
     * 原点 (0, 0) 返回 0；x &lt; 0 且 y/x 舍入为 0 时返回 Pi，不会返回 -Pi。
     */
    public BigDecimal atan2(BigDecimal y, BigDecimal x) {
        BigDecimal yv = DecimalOps.fix(y);
        BigDecimal xv = DecimalOps.fix(x);

        if (isZero(xv) && isZero(yv)) {
            return DecimalOps.ZERO;
        }
        if (isZero(xv)) {
            return yv.signum() > 0 ? PI_HALF : PI_HALF.negate();
        }
        if (isZero(yv)) {
            return xv.signum() > 0 ? DecimalOps.ZERO : PI;
        }

        BigDecimal aTan = atan(DecimalOps.divide(yv, xv));
        if (xv.signum() > 0) {
            return aTan;
        }
        if (isZero(aTan)) {
            return PI;
        }
        return yv.signum() > 0 ? aTan.add(PI) : aTan.subtract(PI);
    }

    /**
     * 反正弦，结果在 [-Pi/2, Pi/2]。
     *
     * @param z 正弦值，-1 ≤ z ≤ 1
     * @throws IllegalArgumentException z 不在 [-1, 1] 内
     */
    public BigDecimal asin(BigDecimal z) {
        BigDecimal v = checkUnitRange(z);

        if (eq(v, MINUS_ONE)) {
            return PI_HALF.negate();
        }
        if (isZero(v)) {
            return DecimalOps.ZERO;
        }
        if (eq(v, ONE)) {
            return PI_HALF;
        }
        BigDecimal denominator = ONE.add(DecimalOps.sqrt(BigDecimal.ONE.subtract(v.multiply(v))));
        return DecimalOps.TWO.multiply(atan(DecimalOps.divide(v, denominator))).setScale(SCALE, ROUNDING);
    }

    /**
     * 反余弦，结果在 [0, Pi]。
     *
     * @param z 余弦值，-1 ≤ z ≤ 1
     * @throws IllegalArgumentException z 不在 [-1, 1] 内
     */
    public BigDecimal acos(BigDecimal z) {
        BigDecimal v = checkUnitRange(z);

        if (eq(v, MINUS_ONE)) {
            return PI;
        }
        if (isZero(v)) {
            return PI_HALF;
        }
        if (eq(v, ONE)) {
            return DecimalOps.ZERO;
        }
        BigDecimal numerator = DecimalOps.sqrt(BigDecimal.ONE.subtract(v.multiply(v)));
        return DecimalOps.TWO.multiply(atan(DecimalOps.divide(numerator, ONE.add(v)))).setScale(SCALE, ROUNDING);
    }

    private static BigDecimal checkUnitRange(BigDecimal z) {
        BigDecimal v = DecimalOps.fix(z);
        if (!DecimalOps.inRangeIncl(v, MINUS_ONE, ONE)) {
            throw new IllegalArgumentException("参数必须在 [-1, 1] 闭区间内: z=" + z.toPlainString());
        }
        return v;
    }
}
