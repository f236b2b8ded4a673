package com.pipeline.climate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 管道中的一个步骤："&lt;顺序标记&gt;--&lt;算子名&gt;" 形式的键及其参数表。
 * 顺序标记只为可读性服务，步骤按配置中的插入顺序执行。
 */
public final class OperatorSpec {

    private static final String SEPARATOR = "--";

    private final String key;
    private final String operatorName;
    private final Map<String, Object> parameters;

    public OperatorSpec(String key, Map<String, Object> parameters) {
        this.key = key;
        int cut = key.lastIndexOf(SEPARATOR);
        this.operatorName = cut < 0 ? key : key.substring(cut + SEPARATOR.length());
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getKey() { return key; }

    /** 键中最后一个 "--" 之后的部分 */
    public String getOperatorName() { return operatorName; }

    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return key + parameters;
    }
}
