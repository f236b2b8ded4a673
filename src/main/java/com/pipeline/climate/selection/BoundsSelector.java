package com.pipeline.climate.selection;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Bounds;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 区间选择器 —— 按轴标签或轴名选取子区域。
 *
 * 处理流程：
 * 1. 解析每个条目的轴名，不是二元区间的条目直接忽略
 * 2. 经度界限超出 [0, 360] 时先把经度环绕到能表示该区间的范围
 * 3. 一维坐标按标签取闭区间；曲线网格上时间轴照常切片，经纬度改为掩码
 *    （单轴为开区间，经纬度同时给出时为闭区间），区域外置为缺失
 * 4. 时间轴切片后校正首尾：首个时间步早于下界则丢弃，末个晚于上界则丢弃，直到满足
 *
 * 时间界限是日期字符串，只比较界限给出的字段（"2014-12" 包含整个 12 月）。
 */
public class BoundsSelector {

    private static final Logger log = LoggerFactory.getLogger(BoundsSelector.class);

    /** 经度环绕时在严格所需最小值之外最多再让出的度数 */
    private static final double LONGITUDE_MARGIN = 10.0;

    /** 时间首尾校正只比较到日 */
    private static final int TIME_CHECK_FIELDS = 3;

    private final AxisResolver resolver;

    public BoundsSelector(AxisResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * 对数据集中每个变量做同样的选择，任一变量失败则整体失败。
     */
    public ProcessingResult<LabeledDataset> select(LabeledDataset ds, Map<String, ?> bounds) {
        LabeledDataset out = ds;
        for (LabeledArray variable : ds.getVariables()) {
            ProcessingResult<LabeledArray> selected = select(variable, bounds);
            if (selected.isFailure()) {
                return ProcessingResult.failure(selected.getReason(), selected.getMessage());
            }
            out = out.withVariable(selected.get());
        }
        return ProcessingResult.success(out);
    }

    public ProcessingResult<LabeledArray> select(LabeledArray da, Map<String, ?> bounds) {
        if (bounds == null || bounds.isEmpty()) {
            return ProcessingResult.success(da);
        }
        Map<String, Bounds> requested = resolveEntries(da, bounds);
        if (requested.isEmpty()) {
            return ProcessingResult.success(da);
        }
        log.debug("Selecting {} on {}", requested, da.getName());

        Optional<String> lonName = resolver.resolve(da, AxisTag.LONGITUDE);
        Optional<String> latName = resolver.resolve(da, AxisTag.LATITUDE);
        Optional<String> timeName = resolver.resolve(da, AxisTag.TIME);

        LabeledArray out = da;
        if (lonName.isPresent() && requested.containsKey(lonName.get())) {
            Bounds lon = requested.get(lonName.get());
            double lo = Math.min(lon.lowerValue(), lon.upperValue());
            double hi = Math.max(lon.lowerValue(), lon.upperValue());
            if (lo < 0 || hi > 360) {
                double lonMin = lo;
                if (hi - lo < 360) {
                    lonMin -= Math.min(LONGITUDE_MARGIN, 360 - (hi - lo) / 2);
                }
                out = LongitudeRoller.roll(out, lonName.get(), lonMin);
            }
        }

        if (!resolver.isCurvilinear(out)) {
            for (Map.Entry<String, Bounds> e : requested.entrySet()) {
                out = sliceByLabel(out, e.getKey(), e.getValue());
            }
        } else {
            if (timeName.isPresent() && requested.containsKey(timeName.get())) {
                out = sliceByLabel(out, timeName.get(), requested.get(timeName.get()));
            }
            boolean hasLat = latName.isPresent() && requested.containsKey(latName.get());
            boolean hasLon = lonName.isPresent() && requested.containsKey(lonName.get());
            if (hasLat || hasLon) {
                out = maskRegion(out, hasLat ? latName.get() : null, hasLat ? requested.get(latName.get()) : null,
                        hasLon ? lonName.get() : null, hasLon ? requested.get(lonName.get()) : null);
            }
        }

        if (timeName.isPresent() && requested.containsKey(timeName.get()) && out.hasDimension(timeName.get())) {
            Bounds time = requested.get(timeName.get());
            out = checkTimeBounds(out, timeName.get(), time.lowerText(), true);
            out = checkTimeBounds(out, timeName.get(), time.upperText(), false);
        }
        for (String dim : out.getDims()) {
            if (out.sizeOf(dim) == 0) {
                return ProcessingResult.failure(FailureReason.EMPTY_SELECTION,
                        "Selection " + requested + " leaves no data along '" + dim + "' in '" + da.getName() + "'");
            }
        }
        return ProcessingResult.success(out);
    }

    /**
     * 条目键为 T/X/Y 时按标签解析，否则作为字面轴名校验；无法解析或区间格式不对的条目被忽略。
     */
    private Map<String, Bounds> resolveEntries(LabeledArray da, Map<String, ?> bounds) {
        Map<String, Bounds> requested = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : bounds.entrySet()) {
            Optional<Bounds> parsed = Bounds.parse(e.getValue());
            if (parsed.isEmpty()) {
                log.debug("Ignoring bounds entry '{}': not a two-element range", e.getKey());
                continue;
            }
            Optional<String> name = AxisTag.fromCode(e.getKey()).isPresent()
                    ? resolver.resolve(da, AxisTag.fromCode(e.getKey()).get())
                    : da.findCoordinate(e.getKey()).map(Coordinate::getName);
            if (name.isEmpty()) {
                log.debug("Ignoring bounds entry '{}': no matching axis in {}", e.getKey(), da.getName());
                continue;
            }
            Coordinate coordinate = da.getCoordinate(name.get());
            if (!coordinate.isTime() && !parsed.get().isNumeric()) {
                log.warn("Ignoring bounds entry '{}': {} is not a numeric range", e.getKey(), parsed.get());
                continue;
            }
            requested.put(name.get(), parsed.get());
        }
        return requested;
    }

    /**
     * 一维坐标上取闭区间：时间按日期字段比较，其余按数值比较。
     */
    LabeledArray sliceByLabel(LabeledArray da, String coordName, Bounds bounds) {
        Coordinate c = da.getCoordinate(coordName);
        if (c.isMultiDimensional()) {
            return da;
        }
        String dim = c.getDims().get(0);
        List<Integer> keep = new ArrayList<>();
        if (c.isTime()) {
            int[] lo = CalendarDate.parseFields(bounds.lowerText());
            int[] hi = CalendarDate.parseFields(bounds.upperText());
            List<CalendarDate> dates = c.getDates();
            for (int i = 0; i < dates.size(); i++) {
                if (dates.get(i).compareToBound(lo) >= 0 && dates.get(i).compareToBound(hi) <= 0) {
                    keep.add(i);
                }
            }
        } else {
            double lo = Math.min(bounds.lowerValue(), bounds.upperValue());
            double hi = Math.max(bounds.lowerValue(), bounds.upperValue());
            for (int i = 0; i < c.size(); i++) {
                if (c.value(i) >= lo && c.value(i) <= hi) {
                    keep.add(i);
                }
            }
        }
        return da.isel(dim, keep.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * 曲线网格区域掩码，区域外的值置为缺失。
     */
    private LabeledArray maskRegion(LabeledArray da, String latName, Bounds lat, String lonName, Bounds lon) {
        Coordinate grid = da.getCoordinate(latName != null ? latName : lonName);
        double[] latValues = latName != null ? da.getCoordinate(latName).getValues() : null;
        double[] lonValues = lonName != null ? da.getCoordinate(lonName).getValues() : null;
        boolean inclusive = latName != null && lonName != null;
        double[] mask = new double[grid.size()];
        for (int i = 0; i < mask.length; i++) {
            boolean inside = true;
            if (latValues != null) {
                inside = within(latValues[i], lat, inclusive);
            }
            if (lonValues != null) {
                inside = inside && within(lonValues[i], lon, inclusive);
            }
            mask[i] = inside ? 1.0 : 0.0;
        }
        double[] broadcast = ArrayOps.broadcast(mask, grid.getDims(), grid.getShape(), da.getDims(), da.getShape());
        double[] values = da.getValues();
        for (int i = 0; i < values.length; i++) {
            if (broadcast[i] == 0.0) {
                values[i] = Double.NaN;
            }
        }
        return da.withValues(values);
    }

    private static boolean within(double v, Bounds b, boolean inclusive) {
        double lo = b.lowerValue();
        double hi = b.upperValue();
        return inclusive ? (lo <= v && v <= hi) : (lo < v && v < hi);
    }

    /**
     * 校正时间切片的一端：下界一侧首个时间步早于界限时丢弃，上界一侧末个时间步晚于界限时丢弃，
     * 重复直到满足或时间轴为空。只比较到日。
     */
    LabeledArray checkTimeBounds(LabeledArray da, String timeName, String bound, boolean lower) {
        Coordinate time = da.getCoordinate(timeName);
        if (!time.isTime()) {
            return da;
        }
        int[] fields = CalendarDate.parseFields(bound);
        int[] required = Arrays.copyOf(fields, Math.min(fields.length, TIME_CHECK_FIELDS));
        LabeledArray out = da;
        while (out.sizeOf(timeName) > 0) {
            List<CalendarDate> dates = out.getCoordinate(timeName).getDates();
            CalendarDate edge = lower ? dates.get(0) : dates.get(dates.size() - 1);
            int cmp = edge.compareToBound(required);
            if (lower ? cmp >= 0 : cmp <= 0) {
                break;
            }
            log.debug("Dropping {} time step {} outside bound {}", lower ? "first" : "last", edge, bound);
            int n = dates.size();
            out = lower ? out.slice(timeName, 1, n) : out.slice(timeName, 0, n - 1);
        }
        return out;
    }
}
