package com.xinyue.mathm.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 级数求值配置读取器。
 * 从 mathm.properties 读取迭代上限和诊断开关，文件不存在时使用默认值。
 */
public final class SeriesConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesConfig.class);

    public static final String DEFAULT_RESOURCE = "mathm.properties";
    public static final String KEY_MAX_ITERATIONS = "series.maxIterations";
    public static final String KEY_TRACE = "series.trace";

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private static final SeriesConfig DEFAULTS = new SeriesConfig(DEFAULT_MAX_ITERATIONS, false);

    /** 单次级数求和允许的最大项数，到达即视为内部错误 */
    public final int maxIterations;
    /** 是否在 TRACE 级别输出每一项 */
    public final boolean trace;

    public SeriesConfig(int maxIterations, boolean trace) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException(KEY_MAX_ITERATIONS + " 必须大于 0, value=" + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.trace = trace;
    }

    public static SeriesConfig defaults() {
        return DEFAULTS;
    }

    public static SeriesConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * 从 classpath 读取配置。
     *
     * @param resource classpath 资源名
     * @return 配置；资源不存在时返回默认配置
     */
    public static SeriesConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream is = SeriesConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                LOG.warn("{} 未找到，使用默认级数配置", resource);
                return DEFAULTS;
            }
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("读取 " + resource + " 失败", e);
        }
        return fromProperties(props);
    }

    public static SeriesConfig fromProperties(Properties props) {
        int maxIterations = parseInt(props, KEY_MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS);
        boolean trace = parseBoolean(props, KEY_TRACE, false);
        SeriesConfig config = new SeriesConfig(maxIterations, trace);
        LOG.debug("级数配置加载完成: maxIterations={}, trace={}", config.maxIterations, config.trace);
        return config;
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无效的配置 " + key + "=" + value, e);
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("无效的配置 " + key + "=" + value);
    }

    @Override
    public String toString() {
        return "SeriesConfig{maxIterations=" + maxIterations + ", trace=" + trace + '}';
    }
}
