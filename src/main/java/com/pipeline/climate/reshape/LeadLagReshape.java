package com.pipeline.climate.reshape;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 超前滞后重排：把一条序列切成等长、相互重叠的窗口，用于合成分析。
 *
 * 设 half = window / 2，h1 = half - delta，h2 = half + delta，
 * 窗口起点 k 从 -h1 开始、以 delta 为步长直到 length - h2（含）。
 * 每个窗口长度恰为 window，超出序列范围的位置填缺失值。
 *
 * 例如月序列、window = 24、delta = 12 时，第 i 个窗口覆盖第 i 年 1 月到第 i+1 年 12 月。
 */
public class LeadLagReshape {

    private final AxisResolver resolver;

    public LeadLagReshape(AxisResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * 窗口个数：floor((length - h2 + h1) / delta) + 1，序列过短时为 0。
     */
    public static int segmentCount(int length, int delta, int window) {
        int half = window / 2;
        int span = length - (half + delta) + (half - delta);
        return span < 0 ? 0 : span / delta + 1;
    }

    /**
     * 沿首轴切分。values 形状为 (length, inner...) 的行主序数据，
     * 结果形状为 (segments, window, inner...)。
     */
    public static double[] splice(double[] values, int length, int inner, int delta, int window) {
        if (delta < 1 || window < 1) {
            throw new IllegalArgumentException("delta and window must be positive, got " + delta + " and " + window);
        }
        int half = window / 2;
        int h1 = half - delta;
        int segments = segmentCount(length, delta, window);
        double[] out = ArrayOps.filled(segments * window * inner, Double.NaN);
        for (int s = 0; s < segments; s++) {
            int k = -h1 + s * delta;
            int i1 = Math.max(0, k);
            int i2 = Math.min(k + window, length);
            if (i2 <= i1) {
                continue;
            }
            int o1 = i1 - k;
            System.arraycopy(values, i1 * inner, out, (s * window + o1) * inner, (i2 - i1) * inner);
        }
        return out;
    }

    /**
     * 沿给定轴重排。时间轴且 delta = 12、window 为 12 的倍数时，新轴为 (year, month)，
     * year 从首个时间步的年份起算；否则新轴为 (&lt;轴名&gt;_a, &lt;轴名&gt;_b) 整数下标。
     * 新轴排在最前，其余轴保持原顺序。
     */
    public ProcessingResult<LabeledArray> reshapeLeadLag(LabeledArray da, int delta, int window, String dim) {
        if (delta < 1 || window < 1) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                    "delta and window must be positive, got " + delta + " and " + window);
        }
        Optional<String> resolved = resolver.checkDim(da, dim).filter(da.getDims()::contains);
        if (resolved.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot reshape '" + da.getName() + "' along '" + dim + "'");
        }
        String axis = resolved.get();
        LabeledArray first = da.transpose(List.of(axis));
        int length = first.sizeOf(axis);
        int inner = length == 0 ? 0 : first.size() / length;
        int segments = segmentCount(length, delta, window);
        if (segments == 0) {
            return ProcessingResult.failure(FailureReason.EMPTY_SELECTION,
                    "Sequence of length " + length + " is too short for window " + window + " and delta " + delta);
        }
        double[] spliced = splice(first.getValues(), length, inner, delta, window);

        Coordinate axisCoord = first.getCoordinate(axis);
        Optional<String> timeDim = resolver.resolve(da, AxisTag.TIME);
        Coordinate outer;
        Coordinate offsets;
        if (timeDim.isPresent() && timeDim.get().equals(axis) && axisCoord.isTime()
                && delta == 12 && window % 12 == 0) {
            int year = axisCoord.date(0).getYear();
            outer = Coordinate.of("year", sequence(year, segments));
            offsets = Coordinate.of("month", sequence(0, window));
        } else {
            outer = Coordinate.of(axis + "_a", sequence(0, segments));
            offsets = Coordinate.of(axis + "_b", sequence(0, window));
        }

        List<String> dims = new ArrayList<>();
        dims.add(outer.getName());
        dims.add(offsets.getName());
        List<Integer> shape = new ArrayList<>(List.of(segments, window));
        for (String d : first.getDims()) {
            if (!d.equals(axis)) {
                dims.add(d);
                shape.add(first.sizeOf(d));
            }
        }
        LabeledArray.Builder b = LabeledArray.builder(da.getName())
                .dims(dims)
                .shape(shape.stream().mapToInt(Integer::intValue).toArray())
                .values(spliced)
                .coordinate(outer)
                .coordinate(offsets)
                .attributes(da.getAttributes());
        for (Coordinate c : first.getCoordinates().values()) {
            if (!c.isPositional() && !c.getDims().contains(axis)) {
                b.coordinate(c);
            }
        }
        return ProcessingResult.success(b.build());
    }

    private static double[] sequence(int start, int count) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = start + i;
        }
        return out;
    }
}
