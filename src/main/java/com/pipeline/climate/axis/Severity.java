package com.pipeline.climate.axis;

/**
 * 无法解析显式请求的轴时的处理级别。
 */
public enum Severity {
    /** 记录诊断并继续，返回空结果 */
    WARN,
    /** 记录诊断并抛出 {@link AxisNotFoundException} */
    ERROR
}
