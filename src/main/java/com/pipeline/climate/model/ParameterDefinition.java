package com.pipeline.climate.model;

import java.io.Serializable;
import java.util.List;

/**
 * 算子参数定义
 */
public class ParameterDefinition implements Serializable {

    /** 参数类型 */
    public enum Type {
        NUMBER,
        STRING,
        BOOLEAN,
        /** 取值限定在 enumValues 内的字符串 */
        ENUM,
        /** 列表，单个字符串视为单元素列表 */
        LIST,
        /** 嵌套参数表 */
        MAP
    }

    private String name;
    private String description;
    private Type type;
    private boolean required;
    private Object defaultValue;
    /** 数值型参数的取值范围下限 */
    private Double minValue;
    /** 数值型参数的取值范围上限 */
    private Double maxValue;
    /** 枚举型参数的可选值列表 */
    private List<String> enumValues;
    /** MAP 型参数内部的子参数定义 */
    private List<ParameterDefinition> children;

    public ParameterDefinition() {}

    public static ParameterDefinition of(String name, Type type, Object defaultValue, String description) {
        ParameterDefinition def = new ParameterDefinition();
        def.setName(name);
        def.setType(type);
        def.setDefaultValue(defaultValue);
        def.setDescription(description);
        return def;
    }

    public ParameterDefinition range(Double min, Double max) {
        this.minValue = min;
        this.maxValue = max;
        return this;
    }

    public ParameterDefinition allowed(List<String> values) {
        this.enumValues = values;
        return this;
    }

    public ParameterDefinition nested(List<ParameterDefinition> definitions) {
        this.children = definitions;
        return this;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Type getType() { return type; }
    public void setType(Type type) { this.type = type; }
    public boolean isRequired() { return required; }
    public void setRequired(boolean required) { this.required = required; }
    public Object getDefaultValue() { return defaultValue; }
    public void setDefaultValue(Object defaultValue) { this.defaultValue = defaultValue; }
    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }
    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }
    public List<String> getEnumValues() { return enumValues; }
    public void setEnumValues(List<String> enumValues) { this.enumValues = enumValues; }
    public List<ParameterDefinition> getChildren() { return children; }
    public void setChildren(List<ParameterDefinition> children) { this.children = children; }
}
