package com.pipeline.climate.axis;

import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.Labeled;

import java.util.List;
import java.util.Optional;

/**
 * 轴解析器 —— 把语义轴标签映射为数据中实际的轴名。
 *
 * 解析规则：按标签的候选名称依次尝试，每个候选名称先在坐标名列表中找完全匹配，
 * 找不到再按列表顺序做模糊匹配：单字符候选要求是坐标名的首字母，
 * 多字符候选要求是坐标名的子串。第一个命中即返回。
 *
 * 例如 Y 的候选名 "y" 会命中 "year"，这是模糊规则的已知副作用，
 * 调用方应在存在真实纬度坐标时让更长的候选名先命中。
 *
 * 结果不缓存，每次调用都重新计算，所以管道步骤之间重命名轴是安全的。
 */
public class AxisResolver {

    private final Severity severity;

    public AxisResolver() {
        this(Severity.WARN);
    }

    public AxisResolver(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() { return severity; }

    /**
     * 按语义标签解析轴名，找不到时返回空，不报错。
     */
    public Optional<String> resolve(Labeled target, AxisTag tag) {
        List<String> names = target.coordinateNames();
        for (String candidate : tag.getCandidates()) {
            if (names.contains(candidate)) {
                return Optional.of(candidate);
            }
            for (String name : names) {
                if ((candidate.length() == 1 && name.startsWith(candidate))
                        || (candidate.length() > 1 && name.contains(candidate))) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 校验调用方显式请求的轴：可以是字面轴名，也可以是 CF 代码 "T"/"X"/"Y"。
     * 解析失败时按处理级别报告诊断：WARN 返回空，ERROR 抛出 {@link AxisNotFoundException}。
     */
    public Optional<String> checkDim(Labeled target, String dim) {
        Optional<String> resolved = Optional.empty();
        if (dim != null && !dim.isBlank()) {
            if (target.hasDimension(dim)) {
                resolved = Optional.of(dim);
            } else {
                Optional<AxisTag> tag = AxisTag.fromCode(dim);
                if (tag.isPresent()) {
                    resolved = resolve(target, tag.get());
                }
            }
        }
        if (resolved.isEmpty()) {
            Diagnostics.axisNotFound(Diagnostics.callerOf(AxisResolver.class), dim,
                    "unknown dimension '" + dim + "', known dimensions: " + target.dimensionNames(), severity);
        }
        return resolved;
    }

    /**
     * 经度或纬度坐标是否为二维（曲线网格）。
     */
    public boolean isCurvilinear(Labeled target) {
        return isMultiDimensional(target, AxisTag.LATITUDE) || isMultiDimensional(target, AxisTag.LONGITUDE);
    }

    private boolean isMultiDimensional(Labeled target, AxisTag tag) {
        return resolve(target, tag)
                .flatMap(target::findCoordinate)
                .map(Coordinate::isMultiDimensional)
                .orElse(false);
    }
}
