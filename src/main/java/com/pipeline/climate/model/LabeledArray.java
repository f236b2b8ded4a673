package com.pipeline.climate.model;

import com.pipeline.climate.array.ArrayOps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * 带标签的 N 维数组：行主序数值缓冲区 + 有序轴名 + 各轴坐标 + 元数据。
 *
 * 不变式：
 * - 轴名与形状一一对应，元素个数等于各轴长度之积
 * - 每个坐标的轴都属于本数组，且长度与对应轴一致
 * - 每个轴都有同名坐标；构造时缺失的轴会补上位置下标坐标
 *
 * 数组不可变，所有变换都返回新实例；元数据以只读快照形式整体替换。
 * 缺失值用 NaN 表示。
 */
public final class LabeledArray implements Labeled {

    private final String name;
    private final List<String> dims;
    private final int[] shape;
    private final double[] values;
    private final LinkedHashMap<String, Coordinate> coordinates;
    private final Map<String, Object> attributes;

    private LabeledArray(Builder builder) {
        if (builder.dims.size() != builder.shape.length) {
            throw new IllegalArgumentException("Array '" + builder.name + "' has " + builder.dims.size()
                    + " dims but shape of rank " + builder.shape.length);
        }
        if (builder.dims.stream().distinct().count() != builder.dims.size()) {
            throw new IllegalArgumentException("Duplicate dimension names: " + builder.dims);
        }
        if (builder.values == null || ArrayOps.product(builder.shape) != builder.values.length) {
            throw new IllegalArgumentException("Array '" + builder.name + "' shape " + Arrays.toString(builder.shape)
                    + " does not match value count "
                    + (builder.values == null ? 0 : builder.values.length));
        }
        this.name = builder.name;
        this.dims = List.copyOf(builder.dims);
        this.shape = builder.shape.clone();
        this.values = builder.values;
        this.coordinates = new LinkedHashMap<>();
        for (Coordinate c : builder.coordinates.values()) {
            checkCoordinate(c);
            coordinates.put(c.getName(), c);
        }
        for (int i = 0; i < dims.size(); i++) {
            if (!coordinates.containsKey(dims.get(i))) {
                coordinates.put(dims.get(i), Coordinate.positional(dims.get(i), shape[i]));
            }
        }
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    private void checkCoordinate(Coordinate c) {
        int[] cShape = c.getShape();
        for (int i = 0; i < c.getDims().size(); i++) {
            String dim = c.getDims().get(i);
            int axis = dims.indexOf(dim);
            if (axis < 0) {
                throw new IllegalArgumentException("Coordinate '" + c.getName() + "' uses dimension '" + dim
                        + "' which is not a dimension of array '" + name + "' " + dims);
            }
            if (shape[axis] != cShape[i]) {
                throw new IllegalArgumentException("Coordinate '" + c.getName() + "' has length " + cShape[i]
                        + " along '" + dim + "' but array '" + name + "' has " + shape[axis]);
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.dims = new ArrayList<>(dims);
        b.shape = shape.clone();
        b.values = values;
        for (Coordinate c : coordinates.values()) {
            if (!c.isPositional()) {
                b.coordinates.put(c.getName(), c);
            }
        }
        b.attributes.putAll(attributes);
        return b;
    }

    // ---- 访问 ----

    public String getName() { return name; }
    public List<String> getDims() { return dims; }
    public int[] getShape() { return shape.clone(); }
    public Map<String, Object> getAttributes() { return attributes; }

    public int rank() {
        return dims.size();
    }

    public int size() {
        return values.length;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double valueAt(int flatIndex) {
        return values[flatIndex];
    }

    public int axisOf(String dim) {
        return dims.indexOf(dim);
    }

    public int sizeOf(String dim) {
        int axis = dims.indexOf(dim);
        if (axis < 0) {
            throw new IllegalArgumentException("Array '" + name + "' has no dimension '" + dim + "'");
        }
        return shape[axis];
    }

    public Map<String, Coordinate> getCoordinates() {
        return Collections.unmodifiableMap(coordinates);
    }

    public Coordinate getCoordinate(String coordName) {
        Coordinate c = coordinates.get(coordName);
        if (c == null) {
            throw new IllegalArgumentException("Array '" + name + "' has no coordinate '" + coordName + "'");
        }
        return c;
    }

    @Override
    public Optional<Coordinate> findCoordinate(String coordName) {
        return Optional.ofNullable(coordinates.get(coordName));
    }

    @Override
    public List<String> coordinateNames() {
        return new ArrayList<>(coordinates.keySet());
    }

    @Override
    public List<String> dimensionNames() {
        return dims;
    }

    // ---- 变换 ----

    public LabeledArray withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public LabeledArray withValues(double[] newValues) {
        return toBuilder().values(newValues).build();
    }

    public LabeledArray withAttributes(Map<String, Object> newAttributes) {
        Builder b = toBuilder();
        b.attributes.clear();
        b.attributes.putAll(newAttributes);
        return b.build();
    }

    public LabeledArray withAttribute(String key, Object value) {
        return toBuilder().attribute(key, value).build();
    }

    public LabeledArray withCoordinate(Coordinate coordinate) {
        return toBuilder().coordinate(coordinate).build();
    }

    /**
     * 沿轴按下标取子集，依赖该轴的坐标同步取子集。
     */
    public LabeledArray isel(String dim, int[] indices) {
        int axis = axisOf(dim);
        if (axis < 0) {
            throw new IllegalArgumentException("Array '" + name + "' has no dimension '" + dim + "'");
        }
        Builder b = toBuilder();
        b.shape[axis] = indices.length;
        b.values = ArrayOps.take(values, shape, axis, indices);
        for (Map.Entry<String, Coordinate> e : b.coordinates.entrySet()) {
            e.setValue(e.getValue().select(dim, indices));
        }
        return b.build();
    }

    /** 沿轴取连续区间 [from, to) */
    public LabeledArray slice(String dim, int from, int to) {
        return isel(dim, ArrayOps.range(from, to));
    }

    /**
     * 按给定顺序重排轴；order 中未列出的轴按原顺序排在后面。
     */
    public LabeledArray transpose(List<String> order) {
        List<String> newDims = new ArrayList<>();
        for (String d : order) {
            if (dims.contains(d) && !newDims.contains(d)) {
                newDims.add(d);
            }
        }
        for (String d : dims) {
            if (!newDims.contains(d)) {
                newDims.add(d);
            }
        }
        if (newDims.equals(dims)) {
            return this;
        }
        int[] perm = new int[dims.size()];
        int[] newShape = new int[dims.size()];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = dims.indexOf(newDims.get(i));
            newShape[i] = shape[perm[i]];
        }
        Builder b = toBuilder();
        b.dims = newDims;
        b.shape = newShape;
        b.values = ArrayOps.permute(values, shape, perm);
        for (Map.Entry<String, Coordinate> e : b.coordinates.entrySet()) {
            e.setValue(e.getValue().transpose(newDims));
        }
        return b.build();
    }

    public LabeledArray renameDim(String oldDim, String newDim) {
        if (!dims.contains(oldDim) || oldDim.equals(newDim)) {
            return this;
        }
        Builder b = toBuilder();
        b.dims.set(dims.indexOf(oldDim), newDim);
        LinkedHashMap<String, Coordinate> renamed = new LinkedHashMap<>();
        for (Coordinate c : b.coordinates.values()) {
            Coordinate r = c.renameDim(oldDim, newDim);
            renamed.put(r.getName(), r);
        }
        b.coordinates = renamed;
        return b.build();
    }

    /**
     * 归约结果：去掉 removed 中的轴，丢弃依赖这些轴的坐标。
     * newValues 的布局必须是剩余轴按原顺序的行主序。
     */
    public LabeledArray reduced(Collection<String> removed, double[] newValues) {
        Builder b = toBuilder();
        List<String> newDims = new ArrayList<>();
        List<Integer> newShape = new ArrayList<>();
        for (int i = 0; i < dims.size(); i++) {
            if (!removed.contains(dims.get(i))) {
                newDims.add(dims.get(i));
                newShape.add(shape[i]);
            }
        }
        b.dims = newDims;
        b.shape = newShape.stream().mapToInt(Integer::intValue).toArray();
        b.values = newValues;
        b.coordinates.values().removeIf(c -> c.getDims().stream().anyMatch(removed::contains));
        return b.build();
    }

    /**
     * 用新的一维坐标替换某个轴（例如把时间轴替换为月份轴），位置不变。
     * 依赖旧轴的坐标全部丢弃。
     */
    public LabeledArray replaceDim(String oldDim, Coordinate newCoordinate, double[] newValues) {
        int axis = axisOf(oldDim);
        if (axis < 0) {
            throw new IllegalArgumentException("Array '" + name + "' has no dimension '" + oldDim + "'");
        }
        String newDim = newCoordinate.getDims().get(0);
        Builder b = toBuilder();
        b.dims.set(axis, newDim);
        b.shape[axis] = newCoordinate.size();
        b.values = newValues;
        b.coordinates.values().removeIf(c -> c.getDims().contains(oldDim));
        b.coordinates.put(newCoordinate.getName(), newCoordinate);
        return b.build();
    }

    /** 对每个元素应用函数 */
    public LabeledArray map(DoubleUnaryOperator op) {
        double[] out = new double[values.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = op.applyAsDouble(values[i]);
        }
        Builder b = toBuilder();
        b.values = out;
        return b.build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LabeledArray{").append(name).append(" (");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(dims.get(i)).append(": ").append(shape[i]);
        }
        sb.append(") coords=").append(coordinates.values()).append('}');
        return sb.toString();
    }

    /**
     * LabeledArray 构造器。
     */
    public static final class Builder {
        private String name;
        private List<String> dims = new ArrayList<>();
        private int[] shape = new int[0];
        private double[] values;
        private LinkedHashMap<String, Coordinate> coordinates = new LinkedHashMap<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder dims(String... dims) {
            this.dims = new ArrayList<>(Arrays.asList(dims));
            return this;
        }

        public Builder dims(List<String> dims) {
            this.dims = new ArrayList<>(dims);
            return this;
        }

        public Builder shape(int... shape) {
            this.shape = shape.clone();
            return this;
        }

        public Builder values(double[] values) {
            this.values = values == null ? null : values.clone();
            return this;
        }

        public Builder coordinate(Coordinate coordinate) {
            this.coordinates.put(coordinate.getName(), coordinate);
            return this;
        }

        public Builder removeCoordinate(String coordName) {
            this.coordinates.remove(coordName);
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes.putAll(attributes);
            return this;
        }

        public LabeledArray build() {
            return new LabeledArray(this);
        }
    }
}
