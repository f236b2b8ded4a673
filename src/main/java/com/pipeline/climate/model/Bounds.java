package com.pipeline.climate.model;

import java.util.List;
import java.util.Optional;

/**
 * 一个轴上的选择区间 [lower, upper]。
 * 时间轴的界限是日期字符串，空间轴的界限是度数。
 */
public final class Bounds {

    private final Object lower;
    private final Object upper;

    private Bounds(Object lower, Object upper) {
        this.lower = lower;
        this.upper = upper;
    }

    public static Bounds of(double lower, double upper) {
        return new Bounds(lower, upper);
    }

    public static Bounds dates(String lower, String upper) {
        return new Bounds(lower, upper);
    }

    /**
     * 从配置值解析区间。只接受恰好两个元素的列表或数组，其他形式返回空。
     */
    public static Optional<Bounds> parse(Object raw) {
        Object lo;
        Object hi;
        if (raw instanceof List) {
            List<?> list = (List<?>) raw;
            if (list.size() != 2) {
                return Optional.empty();
            }
            lo = list.get(0);
            hi = list.get(1);
        } else if (raw instanceof Object[]) {
            Object[] arr = (Object[]) raw;
            if (arr.length != 2) {
                return Optional.empty();
            }
            lo = arr[0];
            hi = arr[1];
        } else if (raw instanceof double[]) {
            double[] arr = (double[]) raw;
            if (arr.length != 2) {
                return Optional.empty();
            }
            lo = arr[0];
            hi = arr[1];
        } else {
            return Optional.empty();
        }
        if (lo == null || hi == null) {
            return Optional.empty();
        }
        return Optional.of(new Bounds(lo, hi));
    }

    public Object getLower() { return lower; }
    public Object getUpper() { return upper; }

    public boolean isNumeric() {
        return asNumber(lower) != null && asNumber(upper) != null;
    }

    public double lowerValue() {
        return requireNumber(lower);
    }

    public double upperValue() {
        return requireNumber(upper);
    }

    public String lowerText() {
        return String.valueOf(lower);
    }

    public String upperText() {
        return String.valueOf(upper);
    }

    private static Double asNumber(Object o) {
        if (o instanceof Number) {
            return ((Number) o).doubleValue();
        }
        if (o instanceof String) {
            try {
                return Double.parseDouble(((String) o).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double requireNumber(Object o) {
        Double d = asNumber(o);
        if (d == null) {
            throw new IllegalStateException("Bound '" + o + "' is not numeric");
        }
        return d;
    }

    @Override
    public String toString() {
        return "(" + lower + ", " + upper + ")";
    }
}
