package com.pipeline.climate.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据集读取选项。
 */
public class ReaderOptions {
    /** 要读取的变量，空表示全部 */
    private List<String> variables = new ArrayList<>();
    /** 读取后选取的范围 */
    private Map<String, Object> bounds = new LinkedHashMap<>();
    /** 去除区域平均所用的空间范围，空表示不去除 */
    private Map<String, Object> regionalMeanBounds = new LinkedHashMap<>();
    private boolean regionalMeanSkipna = false;
    /** 缺测填充值，读取时置为 NaN */
    private Double sentinel;
    private boolean ensureConstantMask = false;

    public static ReaderOptions defaults() {
        return new ReaderOptions();
    }

    public List<String> getVariables() { return Collections.unmodifiableList(variables); }
    public ReaderOptions setVariables(List<String> variables) {
        this.variables = variables == null ? new ArrayList<>() : new ArrayList<>(variables);
        return this;
    }
    public Map<String, Object> getBounds() { return Collections.unmodifiableMap(bounds); }
    public ReaderOptions setBounds(Map<String, ?> bounds) {
        this.bounds = bounds == null ? new LinkedHashMap<>() : new LinkedHashMap<>(bounds);
        return this;
    }
    public Map<String, Object> getRegionalMeanBounds() { return Collections.unmodifiableMap(regionalMeanBounds); }
    public ReaderOptions setRegionalMeanBounds(Map<String, ?> regionalMeanBounds) {
        this.regionalMeanBounds = regionalMeanBounds == null ? new LinkedHashMap<>() : new LinkedHashMap<>(regionalMeanBounds);
        return this;
    }
    public boolean isRegionalMeanSkipna() { return regionalMeanSkipna; }
    public ReaderOptions setRegionalMeanSkipna(boolean regionalMeanSkipna) { this.regionalMeanSkipna = regionalMeanSkipna; return this; }
    public Double getSentinel() { return sentinel; }
    public ReaderOptions setSentinel(Double sentinel) { this.sentinel = sentinel; return this; }
    public boolean isEnsureConstantMask() { return ensureConstantMask; }
    public ReaderOptions setEnsureConstantMask(boolean ensureConstantMask) { this.ensureConstantMask = ensureConstantMask; return this; }

    @Override
    public String toString() {
        return "ReaderOptions{variables=" + variables + ", bounds=" + bounds
                + ", regionalMeanBounds=" + regionalMeanBounds + ", sentinel=" + sentinel
                + ", ensureConstantMask=" + ensureConstantMask + "}";
    }
}
