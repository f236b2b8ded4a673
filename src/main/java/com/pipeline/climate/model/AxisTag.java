package com.pipeline.climate.model;

import java.util.List;
import java.util.Optional;

/**
 * 语义轴标签：时间、经度、纬度。
 *
 * 标签不是具体轴名，而是一个角色；每次使用时通过候选名称列表解析为
 * 数据中实际存在的轴名。
 */
public enum AxisTag {
    TIME("T", List.of("time", "tim")),
    LONGITUDE("X", List.of("longitude", "lon", "x")),
    LATITUDE("Y", List.of("latitude", "lat", "y"));

    private final String code;
    private final List<String> candidates;

    AxisTag(String code, List<String> candidates) {
        this.code = code;
        this.candidates = candidates;
    }

    /** CF 轴代码：T / X / Y */
    public String getCode() { return code; }

    /** 按优先级排列的候选轴名 */
    public List<String> getCandidates() { return candidates; }

    public static Optional<AxisTag> fromCode(String code) {
        for (AxisTag tag : values()) {
            if (tag.code.equals(code)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
