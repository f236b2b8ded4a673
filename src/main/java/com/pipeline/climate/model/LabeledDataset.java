package com.pipeline.climate.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 数据集：若干带标签数组（变量）的有序集合，附带数据集级元数据。
 *
 * 变量名在集合内唯一；变量之间通常共享部分轴和坐标，但不强制。
 * 数据集不可变，替换变量返回新实例。
 */
public final class LabeledDataset implements Labeled {

    private final LinkedHashMap<String, LabeledArray> variables;
    private final Map<String, Object> attributes;

    private LabeledDataset(LinkedHashMap<String, LabeledArray> variables, Map<String, Object> attributes) {
        this.variables = variables;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static LabeledDataset of(LabeledArray... arrays) {
        Builder b = builder();
        for (LabeledArray a : arrays) {
            b.variable(a);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.variables.putAll(variables);
        b.attributes.putAll(attributes);
        return b;
    }

    public Map<String, Object> getAttributes() { return attributes; }

    public List<String> variableNames() {
        return new ArrayList<>(variables.keySet());
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Optional<LabeledArray> findVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public LabeledArray getVariable(String name) {
        LabeledArray a = variables.get(name);
        if (a == null) {
            throw new IllegalArgumentException("Dataset has no variable '" + name + "'");
        }
        return a;
    }

    public List<LabeledArray> getVariables() {
        return new ArrayList<>(variables.values());
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    /** 替换同名变量（保持原位置）或追加新变量 */
    public LabeledDataset withVariable(LabeledArray variable) {
        LinkedHashMap<String, LabeledArray> copy = new LinkedHashMap<>(variables);
        copy.put(variable.getName(), variable);
        return new LabeledDataset(copy, attributes);
    }

    public LabeledDataset withoutVariable(String name) {
        LinkedHashMap<String, LabeledArray> copy = new LinkedHashMap<>(variables);
        copy.remove(name);
        return new LabeledDataset(copy, attributes);
    }

    public LabeledDataset withAttributes(Map<String, Object> newAttributes) {
        return new LabeledDataset(new LinkedHashMap<>(variables), newAttributes);
    }

    /** 对每个变量应用同一变换 */
    public LabeledDataset mapVariables(UnaryOperator<LabeledArray> op) {
        LinkedHashMap<String, LabeledArray> copy = new LinkedHashMap<>();
        for (LabeledArray a : variables.values()) {
            LabeledArray r = op.apply(a);
            copy.put(r.getName(), r);
        }
        return new LabeledDataset(copy, attributes);
    }

    @Override
    public List<String> coordinateNames() {
        Set<String> names = new LinkedHashSet<>();
        for (LabeledArray a : variables.values()) {
            names.addAll(a.coordinateNames());
        }
        return new ArrayList<>(names);
    }

    @Override
    public List<String> dimensionNames() {
        Set<String> names = new LinkedHashSet<>();
        for (LabeledArray a : variables.values()) {
            names.addAll(a.getDims());
        }
        return new ArrayList<>(names);
    }

    @Override
    public Optional<Coordinate> findCoordinate(String name) {
        for (LabeledArray a : variables.values()) {
            Optional<Coordinate> c = a.findCoordinate(name);
            if (c.isPresent()) {
                return c;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "LabeledDataset{variables=" + variables.keySet() + ", dims=" + dimensionNames() + "}";
    }

    /**
     * LabeledDataset 构造器，变量名重复时拒绝。
     */
    public static final class Builder {
        private final LinkedHashMap<String, LabeledArray> variables = new LinkedHashMap<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {}

        public Builder variable(LabeledArray array) {
            if (variables.containsKey(array.getName())) {
                throw new IllegalArgumentException("Duplicate variable name '" + array.getName() + "'");
            }
            variables.put(array.getName(), array);
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attrs) {
            attributes.putAll(attrs);
            return this;
        }

        public LabeledDataset build() {
            return new LabeledDataset(new LinkedHashMap<>(variables), attributes);
        }
    }
}
