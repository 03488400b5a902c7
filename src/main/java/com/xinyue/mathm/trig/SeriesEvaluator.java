package com.xinyue.mathm.trig;

import com.xinyue.mathm.common.DecimalOps;
import com.xinyue.mathm.common.ScaleConstants;
import com.xinyue.mathm.config.SeriesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 定点级数求和器。
 * <p>
 * 从首项开始逐项累加，每一项由上一项推导得到；当某一项在工作精度 {@link ScaleConstants#WORK_SCALE}
 * 下舍入为 0 时停止，部分和最后舍入到 {@link ScaleConstants#SCALE}。
 * 正弦、余弦、反正切使用的都是项严格递减的级数，所以一定会收敛；
 * {@link SeriesConfig#maxIterations} 只是安全上限，到达即抛出 {@link IllegalStateException}。
 * <p>
 * 本类无可变状态，可被多个线程同时使用。
 */
public final class SeriesEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesEvaluator.class);

    /**
     * 由上一项推导下一项。
     */
    @FunctionalInterface
    public interface TermStep {
        /**
         * @param previous        上一项
         * @param doubleIteration 当前迭代序号 * 2（第二项时为 2）
         * @return 下一项，已舍入到 WORK_SCALE
         */
        BigDecimal next(BigDecimal previous, int doubleIteration);
    }

    private final SeriesConfig config;

    public SeriesEvaluator(SeriesConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SeriesConfig config() {
        return config;
    }

    /**
     * 对级数求和。
     *
     * @param name      级数名称，仅用于诊断输出
     * @param firstTerm 首项，WORK_SCALE 精度
     * @param step      项递推
     * @return 截止到第一个为 0 的项之前的部分和，SCALE 精度
     */
    public BigDecimal sum(String name, BigDecimal firstTerm, TermStep step) {
        boolean trace = config.trace && LOG.isTraceEnabled();
        BigDecimal result = DecimalOps.ZERO;
        BigDecimal term = firstTerm;
        int doubleIteration = 0;

        while (true) {
            if (trace) {
                LOG.trace("{} {}: term={} sum={}", name, doubleIteration / 2,
                        term.toPlainString(), result.add(term).toPlainString());
            }
            if (term.signum() == 0) {
                break;
            }
            result = result.add(term);

            doubleIteration += 2;
            if (doubleIteration / 2 >= config.maxIterations) {
                throw new IllegalStateException(name + " 级数在 " + config.maxIterations
                        + " 项内未收敛, partialSum=" + result.toPlainString());
            }
            term = step.next(term, doubleIteration);
        }
        return result.setScale(ScaleConstants.SCALE, ScaleConstants.ROUNDING);
    }
}
