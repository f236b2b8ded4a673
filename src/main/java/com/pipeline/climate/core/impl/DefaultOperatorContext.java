package com.pipeline.climate.core.impl;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.model.OperatorSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 算子上下文默认实现。
 * 包装单个管道步骤的参数表，参数读取时按默认值类型做数值转换。
 */
public class DefaultOperatorContext implements OperatorContext {

    private final OperatorSpec step;
    private final AxisResolver axisResolver;

    public DefaultOperatorContext(OperatorSpec step, AxisResolver axisResolver) {
        this.step = step;
        this.axisResolver = axisResolver;
    }

    /**
     * 直接以参数表构造上下文，用于在管道之外调用单个算子。
     */
    public static DefaultOperatorContext of(String operatorName, Map<String, Object> parameters, AxisResolver axisResolver) {
        return new DefaultOperatorContext(new OperatorSpec(operatorName, parameters), axisResolver);
    }

    @Override
    public String getStepKey() {
        return step.getKey();
    }

    @Override
    public String getOperatorName() {
        return step.getOperatorName();
    }

    @Override
    public <T> T getParameter(String paramName, T defaultValue) {
        return coerce(step.getParameters().get(paramName), defaultValue);
    }

    @SuppressWarnings("unchecked")
    static <T> T coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }

        try {
            if (defaultValue != null) {
                Class<?> targetType = defaultValue.getClass();
                // 数值类型转换
                if (targetType == Double.class && value instanceof Number) {
                    return (T) Double.valueOf(((Number) value).doubleValue());
                }
                if (targetType == Integer.class && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                }
                if (targetType == Long.class && value instanceof Number) {
                    return (T) Long.valueOf(((Number) value).longValue());
                }
                if (targetType == Boolean.class && value instanceof String) {
                    return (T) Boolean.valueOf((String) value);
                }
                if (!targetType.isInstance(value)) {
                    return defaultValue;
                }
            }
            return (T) value;
        } catch (ClassCastException e) {
            return defaultValue;
        }
    }

    @Override
    public List<String> getStringList(String paramName, List<String> defaultValue) {
        Object value = step.getParameters().get(paramName);
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (value instanceof List) {
            List<String> names = new ArrayList<>();
            for (Object item : (List<?>) value) {
                names.add(String.valueOf(item));
            }
            return names;
        }
        return defaultValue;
    }

    @Override
    public Map<String, Object> getSection(String paramName) {
        Object value = step.getParameters().get(paramName);
        if (!(value instanceof Map)) {
            return Collections.emptyMap();
        }
        Map<String, Object> section = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> section.put(String.valueOf(k), v));
        return section;
    }

    @Override
    public <T> T getSectionParameter(String sectionName, String paramName, T defaultValue) {
        return coerce(getSection(sectionName).get(paramName), defaultValue);
    }

    @Override
    public AxisResolver getAxisResolver() {
        return axisResolver;
    }
}
