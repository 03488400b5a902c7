package com.xinyue.mathm.app;

import com.xinyue.mathm.Mathm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 命令行求值入口。
 * <p>
 * 用法: MathmApp &lt;function&gt; &lt;arg&gt; [&lt;arg&gt;]，例如 {@code MathmApp atan2 1 -1}。
 */
public final class MathmApp {

    static final String LOGBACK_CONFIG_KEY = "logback.configurationFile";

    static {
        // 命令行使用自带的日志配置（只输出 WARN 到 stderr），库本身不携带 logback.xml
        if (System.getProperty(LOGBACK_CONFIG_KEY) == null) {
            System.setProperty(LOGBACK_CONFIG_KEY, "logback-cli.xml");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MathmApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_MATH_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "用法: MathmApp <function> <arg> [<arg>]\n"
            + "  function: sin cos tan asin acos atan atan2 torad todeg normalize normalizedeg sqrt";

    private static final Set<String> UNARY = Set.of(
            "sin", "cos", "tan", "asin", "acos", "atan", "torad", "todeg", "normalize", "normalizedeg", "sqrt");

    /**
     * 按函数名和参数求值。
     */
    @FunctionalInterface
    interface Evaluator {
        BigDecimal evaluate(String function, List<BigDecimal> args);
    }

    private MathmApp() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        return run(args, MathmApp::evaluate);
    }

    static int run(String[] args, Evaluator evaluator) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        List<BigDecimal> values = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            try {
                values.add(new BigDecimal(args[i]));
            } catch (NumberFormatException e) {
                System.err.println("无效的数字: " + args[i]);
                System.err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        BigDecimal result;
        try {
            result = evaluator.evaluate(args[0], values);
        } catch (UnsupportedOperationException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (IllegalArgumentException | ArithmeticException | IllegalStateException e) {
            LOG.warn("求值失败: function={}, args={}", args[0], values, e);
            System.err.println(e.getMessage());
            return EXIT_MATH_ERROR;
        }
        System.out.println(result.toPlainString());
        return EXIT_OK;
    }

    /**
     * 按函数名分派求值。
     *
     * @throws UnsupportedOperationException 未知函数或参数个数不对
     */
    static BigDecimal evaluate(String function, List<BigDecimal> args) {
        String name = function.toLowerCase(Locale.ROOT);
        if ("atan2".equals(name)) {
            requireArity(name, args, 2);
            return Mathm.atan2(args.get(0), args.get(1));
        }
        if (!UNARY.contains(name)) {
            throw new UnsupportedOperationException("未知函数: " + function);
        }
        requireArity(name, args, 1);
        BigDecimal x = args.get(0);
        switch (name) {
            case "sin":
                return Mathm.sin(x);
            case "cos":
                return Mathm.cos(x);
            case "tan":
                return Mathm.tan(x);
            case "asin":
                return Mathm.asin(x);
            case "acos":
                return Mathm.acos(x);
            case "atan":
                return Mathm.atan(x);
            case "torad":
                return Mathm.toRad(x);
            case "todeg":
                return Mathm.toDeg(x);
            case "normalize":
                return Mathm.normalizeAngle(x);
            case "normalizedeg":
                return Mathm.normalizeAngleDeg(x);
            case "sqrt":
                return Mathm.sqrt(x);
            default:
                throw new UnsupportedOperationException("未知函数: " + function);
        }
    }

    private static void requireArity(String name, List<BigDecimal> args, int expected) {
        if (args.size() != expected) {
            throw new UnsupportedOperationException(
                    name + " 需要 " + expected + " 个参数, 实际 " + args.size() + " 个");
        }
    }
}
