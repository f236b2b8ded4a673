package com.pipeline.climate.axis;

/**
 * 调用方按字面名称请求的轴不存在，且处理级别为 {@link Severity#ERROR}。
 */
public class AxisNotFoundException extends RuntimeException {

    private final String callSite;
    private final String requested;

    public AxisNotFoundException(String callSite, String requested, String message) {
        super(callSite + ": " + message);
        this.callSite = callSite;
        this.requested = requested;
    }

    public String getCallSite() { return callSite; }
    public String getRequested() { return requested; }
}
