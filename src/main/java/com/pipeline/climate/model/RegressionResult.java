package com.pipeline.climate.model;

import java.util.List;

/**
 * 线性回归结果：slope、intercept、rvalue、pvalue、stderr 五个同形变量，
 * 回归轴已从所有变量中移除，坐标继承自因变量。
 */
public final class RegressionResult {

    public static final String SLOPE = "slope";
    public static final String INTERCEPT = "intercept";
    public static final String RVALUE = "rvalue";
    public static final String PVALUE = "pvalue";
    public static final String STDERR = "stderr";

    public static final List<String> VARIABLES = List.of(SLOPE, INTERCEPT, RVALUE, PVALUE, STDERR);

    private final LabeledDataset dataset;

    public RegressionResult(LabeledDataset dataset) {
        for (String name : VARIABLES) {
            if (!dataset.hasVariable(name)) {
                throw new IllegalArgumentException("Regression result is missing variable '" + name + "'");
            }
        }
        this.dataset = dataset;
    }

    public LabeledArray getSlope() { return dataset.getVariable(SLOPE); }
    public LabeledArray getIntercept() { return dataset.getVariable(INTERCEPT); }
    public LabeledArray getRvalue() { return dataset.getVariable(RVALUE); }
    public LabeledArray getPvalue() { return dataset.getVariable(PVALUE); }
    public LabeledArray getStderr() { return dataset.getVariable(STDERR); }

    public LabeledDataset toDataset() {
        return dataset;
    }

    @Override
    public String toString() {
        return "RegressionResult{dims=" + getSlope().getDims() + "}";
    }
}
