package com.pipeline.climate.stats;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.array.AxisLayout;
import com.pipeline.climate.array.LabeledMath;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.time.CalendarTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 加权统计 —— 沿一个或多个轴的加权平均、滑动平均和标准差。
 *
 * 权重可以显式给出，也可以按归约轴自动推导：
 * - 只归约水平轴且包含纬度时，权重为 cos(纬度)
 * - 只归约时间轴时，权重为每个时间步所在月份的天数
 *
 * 曲线网格上按语义标签请求的经纬度会先换算为网格下标轴 (y, x) 再归约。
 * 所有方法都不修改输入，返回新数组；无法解析轴时返回失败结果。
 */
public class WeightedStatistics {

    private static final Logger log = LoggerFactory.getLogger(WeightedStatistics.class);

    private final AxisResolver resolver;

    public WeightedStatistics(AxisResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * 沿给定轴做（加权）平均，这些轴从结果中移除，元数据保留。
     *
     * @param da      输入数组
     * @param dims    轴名或 CF 代码 T/X/Y
     * @param weights 权重来源
     * @param skipna  为 true 时忽略缺失值，否则含缺失值的归约结果为缺失
     */
    public ProcessingResult<LabeledArray> mean(LabeledArray da, List<String> dims, Weights weights, boolean skipna) {
        List<String> requested = new ArrayList<>();
        for (String d : dims) {
            Optional<String> name = resolver.checkDim(da, d);
            if (name.isEmpty()) {
                return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                        "Cannot average '" + da.getName() + "' over unknown dimension '" + d + "'");
            }
            requested.add(name.get());
        }
        Optional<String> timeDim = resolver.resolve(da, AxisTag.TIME);
        Optional<String> lonDim = resolver.resolve(da, AxisTag.LONGITUDE);
        Optional<String> latDim = resolver.resolve(da, AxisTag.LATITUDE);

        LabeledArray w = null;
        if (weights.kind() == Weights.Kind.AUTO) {
            List<String> horizontal = new ArrayList<>();
            lonDim.ifPresent(horizontal::add);
            latDim.ifPresent(horizontal::add);
            if (latDim.isPresent() && requested.contains(latDim.get()) && horizontal.containsAll(requested)) {
                w = cosLatitude(da, latDim.get());
            } else if (timeDim.isPresent() && requested.size() == 1 && requested.contains(timeDim.get())) {
                w = timeWeights(da).orElse(null);
            }
            if (w == null) {
                log.debug("No automatic weights apply to {} over {}, using unweighted mean", da.getName(), requested);
            }
        } else if (weights.kind() == Weights.Kind.EXPLICIT) {
            w = weights.array();
            if (!da.getDims().containsAll(w.getDims())) {
                return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                        "Weights dimensions " + w.getDims() + " are not part of " + da.getDims());
            }
        }

        List<String> reduceDims = toStructuralDims(da, requested, lonDim, latDim);
        return ProcessingResult.success(reduce(da, reduceDims, w, skipna));
    }

    /**
     * 把曲线网格上的经纬度坐标名换算为其下层的网格轴：纬度取第一个轴，经度取第二个轴。
     */
    private List<String> toStructuralDims(LabeledArray da, List<String> requested,
                                          Optional<String> lonDim, Optional<String> latDim) {
        List<String> out = new ArrayList<>();
        for (String name : requested) {
            String dim = name;
            if (!da.getDims().contains(name)) {
                Coordinate c = da.getCoordinate(name);
                if (c.isMultiDimensional() && latDim.isPresent() && name.equals(latDim.get())) {
                    dim = c.getDims().get(0);
                } else if (c.isMultiDimensional() && lonDim.isPresent() && name.equals(lonDim.get())) {
                    dim = c.getDims().get(1);
                } else {
                    dim = c.getDims().get(0);
                }
            }
            if (!out.contains(dim)) {
                out.add(dim);
            }
        }
        return out;
    }

    /**
     * 沿 reduceDims 归约：sum(w * x) / sum(w)，权重只计入参与求和的元素。
     */
    static LabeledArray reduce(LabeledArray da, List<String> reduceDims, LabeledArray weights, boolean skipna) {
        List<String> dims = da.getDims();
        int[] shape = da.getShape();
        List<String> order = new ArrayList<>();
        for (String d : dims) {
            if (!reduceDims.contains(d)) {
                order.add(d);
            }
        }
        int kept = order.size();
        for (String d : dims) {
            if (reduceDims.contains(d)) {
                order.add(d);
            }
        }
        int[] perm = new int[dims.size()];
        int[] permShape = new int[dims.size()];
        int blockSize = 1;
        int outSize = 1;
        for (int i = 0; i < perm.length; i++) {
            perm[i] = dims.indexOf(order.get(i));
            permShape[i] = shape[perm[i]];
            if (i < kept) {
                outSize *= permShape[i];
            } else {
                blockSize *= permShape[i];
            }
        }
        double[] values = ArrayOps.permute(da.getValues(), shape, perm);
        double[] w = weights == null ? null
                : ArrayOps.broadcast(weights.getValues(), weights.getDims(), weights.getShape(), order, permShape);

        double[] out = new double[outSize];
        for (int j = 0; j < outSize; j++) {
            double sum = 0;
            double weightSum = 0;
            boolean missing = false;
            for (int t = 0; t < blockSize; t++) {
                int idx = j * blockSize + t;
                double x = values[idx];
                if (Double.isNaN(x)) {
                    if (!skipna) {
                        missing = true;
                        break;
                    }
                    continue;
                }
                double wt = w == null ? 1.0 : w[idx];
                if (Double.isNaN(wt)) {
                    continue;
                }
                sum += wt * x;
                weightSum += wt;
            }
            out[j] = (missing || weightSum == 0) ? Double.NaN : sum / weightSum;
        }
        return da.reduced(reduceDims, out);
    }

    /**
     * 居中滑动平均，时间轴上按月长加权：
     * rolling_sum(x * w) / rolling_sum(w)，其它轴上 w 恒为 1。
     *
     * @param minPeriods 窗口内至少需要的有效值个数；为 null 时等于窗口长度
     */
    public ProcessingResult<LabeledArray> movingAverage(LabeledArray da, String dim, int window, Integer minPeriods) {
        int minimum = minPeriods == null ? window : minPeriods;
        if (window < 1 || minimum < 1) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                    "Moving average needs window >= 1 and min_periods >= 1, got " + window + " and " + minimum);
        }
        Optional<String> resolved = resolver.checkDim(da, dim);
        if (resolved.isEmpty() || !da.getDims().contains(resolved.get())) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot roll '" + da.getName() + "' along '" + dim + "'");
        }
        String rollDim = resolved.get();
        int length = da.sizeOf(rollDim);
        double[] weights = null;
        Optional<String> timeDim = resolver.resolve(da, AxisTag.TIME);
        if (timeDim.isPresent() && timeDim.get().equals(rollDim)) {
            weights = timeWeights(da).map(LabeledArray::getValues).orElse(null);
        }
        if (weights == null) {
            weights = ArrayOps.filled(length, 1.0);
        }

        AxisLayout layout = AxisLayout.of(da.getShape(), da.axisOf(rollDim));
        double[] values = da.getValues();
        double[] out = new double[values.length];
        // 偶数窗口向前偏：窗口为 [i - window/2, i + (window-1)/2]
        int before = window / 2;
        int after = (window - 1) / 2;
        for (int line = 0; line < layout.lineCount(); line++) {
            for (int i = 0; i < length; i++) {
                int from = Math.max(0, i - before);
                int to = Math.min(length - 1, i + after);
                double numerator = 0;
                int valid = 0;
                double denominator = 0;
                int present = 0;
                for (int k = from; k <= to; k++) {
                    double x = values[layout.lineIndex(line, k)];
                    if (!Double.isNaN(x)) {
                        numerator += x * weights[k];
                        valid++;
                    }
                    denominator += weights[k];
                    present++;
                }
                double num = valid >= minimum ? numerator : Double.NaN;
                double den = present >= minimum ? denominator : Double.NaN;
                out[layout.lineIndex(line, i)] = num / den;
            }
        }
        return ProcessingResult.success(da.withValues(out));
    }

    /**
     * 沿轴的标准差：sqrt(sum((x - mean)^2) / (n - ddof))。
     */
    public ProcessingResult<LabeledArray> std(LabeledArray da, String dim, int ddof, boolean skipna) {
        Optional<String> resolved = resolver.checkDim(da, dim);
        if (resolved.isEmpty() || !da.getDims().contains(resolved.get())) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot compute std of '" + da.getName() + "' along '" + dim + "'");
        }
        String stdDim = resolved.get();
        AxisLayout layout = AxisLayout.of(da.getShape(), da.axisOf(stdDim));
        double[] values = da.getValues();
        double[] out = new double[layout.lineCount()];
        for (int line = 0; line < out.length; line++) {
            out[line] = standardDeviation(layout.readLine(values, line), ddof, skipna);
        }
        return ProcessingResult.success(da.reduced(List.of(stdDim), out));
    }

    static double standardDeviation(double[] series, int ddof, boolean skipna) {
        double mean = ArrayOps.mean(series, skipna);
        if (Double.isNaN(mean)) {
            return Double.NaN;
        }
        double ss = 0;
        int n = 0;
        for (double v : series) {
            if (!Double.isNaN(v)) {
                ss += (v - mean) * (v - mean);
                n++;
            }
        }
        return n - ddof <= 0 ? Double.NaN : Math.sqrt(ss / (n - ddof));
    }

    /**
     * 除以时间轴上的标准差，使分布无量纲；原有 units 元数据置为空串。
     */
    public ProcessingResult<LabeledArray> normalize(LabeledArray da, int ddof, boolean skipna) {
        Optional<String> timeDim = resolver.resolve(da, AxisTag.TIME);
        if (timeDim.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot normalize '" + da.getName() + "' without a time axis");
        }
        return std(da, timeDim.get(), ddof, skipna).map(sd -> {
            LabeledArray normalized = LabeledMath.divide(da, sd);
            if (da.getAttributes().containsKey("units")) {
                Map<String, Object> attrs = new LinkedHashMap<>(da.getAttributes());
                attrs.put("units", "");
                normalized = normalized.withAttributes(attrs);
            }
            return normalized;
        });
    }

    /**
     * 时间轴上每个时间步所在月份的天数，名为 month_length。
     * 数组没有日期型时间轴时返回空。
     */
    public Optional<LabeledArray> timeWeights(LabeledArray da) {
        Optional<Coordinate> time = resolver.resolve(da, AxisTag.TIME)
                .flatMap(da::findCoordinate)
                .filter(Coordinate::isTime);
        return time.map(c -> LabeledArray.builder("month_length")
                .dims(c.getDims())
                .shape(c.getShape())
                .values(CalendarTime.daysPerMonth(c.getDates(), c.getCalendar()))
                .coordinate(c)
                .build());
    }

    /** cos(纬度) 权重，轴与纬度坐标相同 */
    static LabeledArray cosLatitude(LabeledArray da, String latName) {
        Coordinate lat = da.getCoordinate(latName);
        double[] lv = lat.getValues();
        double[] w = new double[lv.length];
        for (int i = 0; i < w.length; i++) {
            w[i] = Math.cos(Math.toRadians(lv[i]));
        }
        return LabeledArray.builder("weights").dims(lat.getDims()).shape(lat.getShape()).values(w).build();
    }

    /**
     * 使缺失掩码在时间上恒定：任一时间步缺失的格点在所有时间步都置为缺失。
     * 没有时间轴时原样返回。
     */
    public LabeledArray constantMask(LabeledArray da) {
        Optional<String> timeDim = resolver.resolve(da, AxisTag.TIME).filter(da.getDims()::contains);
        if (timeDim.isEmpty()) {
            return da;
        }
        AxisLayout layout = AxisLayout.of(da.getShape(), da.axisOf(timeDim.get()));
        double[] values = da.getValues();
        for (int line = 0; line < layout.lineCount(); line++) {
            double[] series = layout.readLine(values, line);
            if (ArrayOps.countValid(series) < series.length) {
                layout.writeLine(values, line, ArrayOps.filled(series.length, Double.NaN));
            }
        }
        return da.withValues(values);
    }
}
