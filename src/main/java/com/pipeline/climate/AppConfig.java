package com.pipeline.climate;

import com.pipeline.climate.axis.Severity;
import com.pipeline.climate.time.CalendarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数和处理管道定义。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final String SENTINEL_PREFIX = "reader.sentinel.";

    // ---- 存储 ----
    private String storageRoot = "data/storage";

    // ---- 轴与历法 ----
    private boolean axisStrict = false;
    private CalendarType defaultCalendar = CalendarType.STANDARD;

    // ---- 读取 ----
    private boolean ensureConstantMask = false;

    // ---- 管道 ----
    private String pipelineInput;
    private String pipelineOutput;
    private List<String> pipelineVariables = Collections.emptyList();

    /** 原始配置，管道步骤参数由 PipelineConfigLoader 解析 */
    private Properties properties = defaultProperties();

    public static AppConfig load(String configPath) {
        Properties props = defaultProperties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        config.properties = props;
        config.storageRoot = props.getProperty("storage.root", "data/storage");
        config.axisStrict = Boolean.parseBoolean(props.getProperty("axis.strict", "false"));
        config.defaultCalendar = CalendarType.fromName(props.getProperty("calendar.default", "standard"));
        config.ensureConstantMask = Boolean.parseBoolean(props.getProperty("reader.constant.mask", "false"));
        config.pipelineInput = props.getProperty("pipeline.input");
        config.pipelineOutput = props.getProperty("pipeline.output");
        config.pipelineVariables = splitList(props.getProperty("pipeline.variables", ""));
        return config;
    }

    private static Properties defaultProperties() {
        Properties props = new Properties();
        props.setProperty(SENTINEL_PREFIX + "hadisst", "-1000");
        return props;
    }

    static List<String> splitList(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 指定数据集的缺测填充值，未配置时返回null。
     */
    public Double getSentinel(String dataset) {
        String value = properties.getProperty(SENTINEL_PREFIX + dataset);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric sentinel '{}' for dataset '{}'", value, dataset);
            return null;
        }
    }

    // ---- Getters ----
    public String getStorageRoot() { return storageRoot; }
    public boolean isAxisStrict() { return axisStrict; }
    public Severity getAxisSeverity() { return axisStrict ? Severity.ERROR : Severity.WARN; }
    public CalendarType getDefaultCalendar() { return defaultCalendar; }
    public boolean isEnsureConstantMask() { return ensureConstantMask; }
    public String getPipelineInput() { return pipelineInput; }
    public String getPipelineOutput() { return pipelineOutput; }
    public List<String> getPipelineVariables() { return pipelineVariables; }
    public Properties getProperties() { return properties; }

    @Override
    public String toString() {
        return "AppConfig{storageRoot='" + storageRoot + "'"
                + ", axisStrict=" + axisStrict
                + ", calendar=" + defaultCalendar
                + ", input='" + pipelineInput + "'"
                + ", output='" + pipelineOutput + "'"
                + ", variables=" + pipelineVariables + "}";
    }
}
