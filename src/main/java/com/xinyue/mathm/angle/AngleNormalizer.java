package com.xinyue.mathm.angle;

import com.xinyue.mathm.common.DecimalOps;

import java.math.BigDecimal;

import static com.xinyue.mathm.common.AngleConstants.DEG_15;
import static com.xinyue.mathm.common.AngleConstants.DEG_180;
import static com.xinyue.mathm.common.AngleConstants.DEG_270;
import static com.xinyue.mathm.common.AngleConstants.DEG_360;
import static com.xinyue.mathm.common.AngleConstants.DEG_45;
import static com.xinyue.mathm.common.AngleConstants.DEG_90;
import static com.xinyue.mathm.common.AngleConstants.PI;
import static com.xinyue.mathm.common.AngleConstants.PI_HALF;
import static com.xinyue.mathm.common.AngleConstants.PI_QUARTER;
import static com.xinyue.mathm.common.AngleConstants.PI_THREE_HALVES;
import static com.xinyue.mathm.common.AngleConstants.PI_TWELFTH;
import static com.xinyue.mathm.common.AngleConstants.RAD_TO_DEG;
import static com.xinyue.mathm.common.AngleConstants.TWO_PI;

/**
 * 角度归一化与角度/弧度换算（Pi 弧度 = 180 度）。
 */
public final class AngleNormalizer {

    /** 整除检查的顺序决定优先级：360 > 270 > 180 > 90 > 45 > 15 */
    private static final BigDecimal[] LANDMARK_DEGREES = {DEG_360, DEG_270, DEG_180, DEG_90, DEG_45, DEG_15};
    private static final BigDecimal[] LANDMARK_RADIANS = {TWO_PI, PI_THREE_HALVES, PI, PI_HALF, PI_QUARTER, PI_TWELFTH};

    private AngleNormalizer() {
        // 工具类，禁止实例化
    }

    /**
     * 角度转弧度。
     * <p>
     * 能被特殊角整除时直接用对应常量的整数倍，避免 degrees * Pi / 180 引入的舍入误差。
     */
    public static BigDecimal toRad(BigDecimal degrees) {
        BigDecimal d = DecimalOps.fix(degrees);
        for (int i = 0; i < LANDMARK_DEGREES.length; i++) {
            if (DecimalOps.divisibleBy(d, LANDMARK_DEGREES[i])) {
                BigDecimal multiple = d.divideToIntegralValue(LANDMARK_DEGREES[i]);
                return DecimalOps.multiply(multiple, LANDMARK_RADIANS[i]);
            }
        }
        return DecimalOps.divide(d.multiply(PI), DEG_180);
    }

    /**
     * 弧度转角度。
     */
    public static BigDecimal toDeg(BigDecimal radians) {
        return DecimalOps.multiply(DecimalOps.fix(radians), RAD_TO_DEG);
    }

    /**
     * 把弧度归一化到 [0, 2Pi)。
     */
    public static BigDecimal normalizeAngle(BigDecimal radians) {
        BigDecimal r = DecimalOps.remainder(DecimalOps.fix(radians), TWO_PI);
        if (r.signum() < 0) {
            r = r.add(TWO_PI);
        }
        return r;
    }

    /**
     * 把角度归一化到 [0, 360)。
     */
    public static BigDecimal normalizeAngleDeg(BigDecimal degrees) {
        BigDecimal d = DecimalOps.remainder(DecimalOps.fix(degrees), DEG_360);
        if (d.signum() < 0) {
            d = d.add(DEG_360);
        }
        return d;
    }
}
