package com.xinyue.mathm.common;

import java.math.BigDecimal;

/**
 * 角度相关的定点常量，均为 28 位小数的精确字面量。
 * <p>
 * 这些值只在类加载时初始化一次，之后不可变，可在任意线程中共享。
 */
public final class AngleConstants {

    public static final BigDecimal PI = new BigDecimal("3.1415926535897932384626433833");
    public static final BigDecimal TWO_PI = new BigDecimal("6.2831853071795864769252867666");
    public static final BigDecimal PI_HALF = new BigDecimal("1.5707963267948966192313216916");
    public static final BigDecimal PI_QUARTER = new BigDecimal("0.7853981633974483096156608458");
    public static final BigDecimal PI_TWELFTH = new BigDecimal("0.2617993877991494365385536153");

    /** Pi + PiHalf，即 3Pi/2 */
    public static final BigDecimal PI_THREE_HALVES = PI.add(PI_HALF);

    /** 180 / Pi */
    public static final BigDecimal RAD_TO_DEG = new BigDecimal("57.2957795130823208767981548141");

    public static final BigDecimal DEG_360 = BigDecimal.valueOf(360);
    public static final BigDecimal DEG_270 = BigDecimal.valueOf(270);
    public static final BigDecimal DEG_180 = BigDecimal.valueOf(180);
    public static final BigDecimal DEG_90 = BigDecimal.valueOf(90);
    public static final BigDecimal DEG_45 = BigDecimal.valueOf(45);
    public static final BigDecimal DEG_15 = BigDecimal.valueOf(15);

    private AngleConstants() {
        // 工具类，禁止实例化
    }
}
