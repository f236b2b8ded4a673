package com.pipeline.climate.axis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 结构化诊断输出：(调用位置, 消息)。
 */
public final class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private Diagnostics() {}

    /**
     * 报告轴解析失败。严格级别下抛出异常，否则只记录警告。
     */
    public static void axisNotFound(String callSite, String requested, String message, Severity severity) {
        if (severity == Severity.ERROR) {
            log.error("[{}] {}", callSite, message);
            throw new AxisNotFoundException(callSite, requested, message);
        }
        log.warn("[{}] {}", callSite, message);
    }

    /** 调用 AxisResolver 的外部方法名，形如 "Regression.linearRegression" */
    static String callerOf(Class<?> resolverClass) {
        StackTraceElement[] stack = new Throwable().getStackTrace();
        for (StackTraceElement e : stack) {
            if (!e.getClassName().equals(resolverClass.getName())
                    && !e.getClassName().equals(Diagnostics.class.getName())) {
                String cls = e.getClassName();
                return cls.substring(cls.lastIndexOf('.') + 1) + "." + e.getMethodName();
            }
        }
        return "unknown";
    }
}
