package com.pipeline.climate.model;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.time.CalendarTime;
import com.pipeline.climate.time.CalendarType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 坐标：为一个或多个轴提供标签值。
 *
 * 一维坐标沿单个轴给出数值（经纬度、年份等）或日期（时间轴）；
 * 二维坐标用于曲线网格，经纬度本身是 (y, x) 上的二维场。
 * 时间坐标的数值为小数年，仅用于展示和排序，判断和比较使用日期本身。
 * 坐标不可变。
 */
public final class Coordinate {

    private final String name;
    private final List<String> dims;
    private final int[] shape;
    private final double[] values;
    private final List<CalendarDate> dates;
    private final CalendarType calendar;
    private final Map<String, Object> attributes;
    /** 为缺少坐标的轴自动生成的位置下标坐标 */
    private final boolean positional;

    private Coordinate(String name, List<String> dims, int[] shape, double[] values,
                       List<CalendarDate> dates, CalendarType calendar,
                       Map<String, Object> attributes, boolean positional) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Coordinate name must not be blank");
        }
        if (dims.size() != shape.length) {
            throw new IllegalArgumentException("Coordinate '" + name + "' has " + dims.size()
                    + " dims but shape of rank " + shape.length);
        }
        if (ArrayOps.product(shape) != values.length) {
            throw new IllegalArgumentException("Coordinate '" + name + "' shape " + Arrays.toString(shape)
                    + " does not match " + values.length + " values");
        }
        if (dates != null && dates.size() != values.length) {
            throw new IllegalArgumentException("Coordinate '" + name + "' has mismatched dates");
        }
        this.name = name;
        this.dims = List.copyOf(dims);
        this.shape = shape.clone();
        this.values = values;
        this.dates = dates == null ? null : List.copyOf(dates);
        this.calendar = calendar;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.positional = positional;
    }

    /** 与轴同名的一维数值坐标 */
    public static Coordinate of(String name, double... values) {
        return along(name, name, values);
    }

    /** 沿轴 dim 的一维数值坐标，名称可以与轴名不同 */
    public static Coordinate along(String name, String dim, double... values) {
        return new Coordinate(name, List.of(dim), new int[]{values.length}, values.clone(),
                null, null, null, false);
    }

    /** 与轴同名的时间坐标 */
    public static Coordinate time(String name, List<CalendarDate> dates, CalendarType calendar) {
        return time(name, name, dates, calendar);
    }

    public static Coordinate time(String name, String dim, List<CalendarDate> dates, CalendarType calendar) {
        CalendarType cal = calendar == null ? CalendarType.STANDARD : calendar;
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("calendar", cal.getCfName());
        return new Coordinate(name, List.of(dim), new int[]{dates.size()},
                CalendarTime.fractionalYear(dates, cal), dates, cal, attrs, false);
    }

    /** 曲线网格上的多维坐标 */
    public static Coordinate grid(String name, List<String> dims, int[] shape, double[] values) {
        return new Coordinate(name, dims, shape, values.clone(), null, null, null, false);
    }

    static Coordinate positional(String dim, int size) {
        double[] idx = new double[size];
        for (int i = 0; i < size; i++) {
            idx[i] = i;
        }
        return new Coordinate(dim, List.of(dim), new int[]{size}, idx, null, null, null, true);
    }

    public String getName() { return name; }
    public List<String> getDims() { return dims; }
    public int[] getShape() { return shape.clone(); }
    public Map<String, Object> getAttributes() { return attributes; }
    public CalendarType getCalendar() { return calendar; }
    public boolean isPositional() { return positional; }

    public boolean isTime() {
        return dates != null;
    }

    public boolean isMultiDimensional() {
        return dims.size() > 1;
    }

    public int size() {
        return values.length;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double value(int i) {
        return values[i];
    }

    public List<CalendarDate> getDates() {
        if (dates == null) {
            throw new IllegalStateException("Coordinate '" + name + "' is not a time coordinate");
        }
        return dates;
    }

    public CalendarDate date(int i) {
        return getDates().get(i);
    }

    /**
     * 第 i 个标签，时间坐标返回日期，其余返回数值，用于坐标对齐。
     */
    public Object label(int i) {
        return dates != null ? dates.get(i) : Double.valueOf(values[i]);
    }

    /**
     * 沿轴 dim 按下标取子集。
     */
    public Coordinate select(String dim, int[] indices) {
        int axis = dims.indexOf(dim);
        if (axis < 0) {
            return this;
        }
        int[] newShape = shape.clone();
        newShape[axis] = indices.length;
        if (dates != null) {
            List<CalendarDate> picked = new ArrayList<>(indices.length);
            for (int idx : indices) {
                picked.add(dates.get(idx));
            }
            return new Coordinate(name, dims, newShape, CalendarTime.fractionalYear(picked, calendar),
                    picked, calendar, attributes, false);
        }
        return new Coordinate(name, dims, newShape, ArrayOps.take(values, shape, axis, indices),
                null, null, attributes, positional);
    }

    public Coordinate withValues(double[] newValues) {
        return new Coordinate(name, dims, shape, newValues.clone(), null, null, attributes, false);
    }

    public Coordinate withAttributes(Map<String, Object> newAttributes) {
        return new Coordinate(name, dims, shape, values, dates, calendar, newAttributes, positional);
    }

    /**
     * 重命名轴，若坐标与轴同名则一并重命名坐标。
     */
    public Coordinate renameDim(String oldDim, String newDim) {
        if (!dims.contains(oldDim)) {
            return this;
        }
        List<String> newDims = new ArrayList<>(dims);
        newDims.set(dims.indexOf(oldDim), newDim);
        String newName = name.equals(oldDim) ? newDim : name;
        return new Coordinate(newName, newDims, shape, values, dates, calendar, attributes, positional);
    }

    /** 按新的轴顺序转置多维坐标 */
    Coordinate transpose(List<String> order) {
        if (dims.size() < 2) {
            return this;
        }
        List<String> kept = new ArrayList<>();
        for (String d : order) {
            if (dims.contains(d)) {
                kept.add(d);
            }
        }
        if (kept.equals(dims)) {
            return this;
        }
        int[] perm = new int[kept.size()];
        int[] newShape = new int[kept.size()];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = dims.indexOf(kept.get(i));
            newShape[i] = shape[perm[i]];
        }
        return new Coordinate(name, kept, newShape, ArrayOps.permute(values, shape, perm),
                null, null, attributes, positional);
    }

    @Override
    public String toString() {
        String range = values.length == 0 ? "empty"
                : dates != null ? dates.get(0) + ".." + dates.get(dates.size() - 1)
                : values[0] + ".." + values[values.length - 1];
        return name + dims + "[" + range + "]";
    }
}
