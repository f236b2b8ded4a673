package com.pipeline.climate.core.impl;

import com.pipeline.climate.core.FunctionManager;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ValidationResult;
import com.pipeline.climate.operators.AverageMovingOperator;
import com.pipeline.climate.operators.AverageOperator;
import com.pipeline.climate.operators.DetrendOperator;
import com.pipeline.climate.operators.InterannualAnomaliesOperator;
import com.pipeline.climate.operators.NetcdfSelectorOperator;
import com.pipeline.climate.operators.NormalizeOperator;
import com.pipeline.climate.operators.ReshapeLeadLagOperator;
import com.pipeline.climate.operators.SeasonMeanOperator;
import com.pipeline.climate.operators.SeasonalCycleOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 算子管理器默认实现。
 * 注册表由 {@link #builtin()} 一次性构建，不是线程安全的，不应在管道运行时修改。
 */
public class DefaultFunctionManager implements FunctionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultFunctionManager.class);

    /** 算子注册表：算子名 -> Processor实例 */
    private final Map<String, Processor<?>> functionRegistry = new HashMap<>();

    /**
     * 创建注册了全部内置算子的管理器。
     */
    public static DefaultFunctionManager builtin() {
        DefaultFunctionManager manager = new DefaultFunctionManager();
        manager.registerFunction(AverageOperator.NAME, new AverageOperator());
        manager.registerFunction(AverageMovingOperator.NAME, new AverageMovingOperator());
        manager.registerFunction(DetrendOperator.NAME, new DetrendOperator());
        manager.registerFunction(InterannualAnomaliesOperator.NAME, new InterannualAnomaliesOperator());
        manager.registerFunction(NetcdfSelectorOperator.NAME, new NetcdfSelectorOperator());
        manager.registerFunction(NormalizeOperator.NAME, new NormalizeOperator());
        manager.registerFunction(ReshapeLeadLagOperator.NAME, new ReshapeLeadLagOperator());
        manager.registerFunction(SeasonMeanOperator.NAME, new SeasonMeanOperator());
        manager.registerFunction(SeasonalCycleOperator.NAME, new SeasonalCycleOperator());
        return manager;
    }

    @Override
    public boolean registerFunction(String name, Processor<?> processor) {
        if (name == null || name.isBlank()) {
            log.error("Cannot register processor with null or blank name");
            return false;
        }
        if (processor == null) {
            log.error("Cannot register null processor for name: {}", name);
            return false;
        }

        Processor<?> existing = functionRegistry.putIfAbsent(name, processor);
        if (existing != null) {
            log.warn("Processor '{}' is already registered, registration rejected.", name);
            return false;
        }

        log.info("Processor '{}' registered successfully. Version: {}",
                name, processor.getMetadata().getVersion());
        return true;
    }

    @Override
    public Processor<?> getFunction(String name) {
        return name == null ? null : functionRegistry.get(name);
    }

    @Override
    public Set<String> getFunctionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(functionRegistry.keySet()));
    }

    @Override
    public List<Processor<?>> getAllFunctions() {
        return new ArrayList<>(functionRegistry.values());
    }

    @Override
    public ValidationResult validateFunction(String name, Map<String, Object> parameters) {
        ValidationResult result = new ValidationResult();

        // 检查算子是否存在
        Processor<?> processor = getFunction(name);
        if (processor == null) {
            result.addError("Processor '" + name + "' is not registered.");
            return result;
        }

        FunctionMetadata metadata = processor.getMetadata();
        if (metadata == null || metadata.getParameterDefinitions() == null) {
            // 算子无参数定义，跳过参数校验
            return result;
        }

        Map<String, Object> params = (parameters != null) ? parameters : Collections.emptyMap();
        validateParameters(name, "", metadata.getParameterDefinitions(), params, result);
        return result;
    }

    private void validateParameters(String name, String prefix, List<ParameterDefinition> definitions,
                                    Map<?, ?> params, ValidationResult result) {
        for (ParameterDefinition def : definitions) {
            String paramName = prefix + def.getName();
            Object value = params.get(def.getName());

            if (def.isRequired() && value == null) {
                result.addError("Required parameter '" + paramName + "' is missing.");
                continue;
            }

            if (value == null) {
                continue; // 可选参数未提供，使用默认值
            }

            // 类型检查与范围校验
            switch (def.getType()) {
                case NUMBER:
                    if (!(value instanceof Number)) {
                        result.addError("Parameter '" + paramName
                                + "' expects NUMBER type, got: " + value.getClass().getSimpleName());
                    } else {
                        double numVal = ((Number) value).doubleValue();
                        if (def.getMinValue() != null && numVal < def.getMinValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " is below minimum " + def.getMinValue());
                        }
                        if (def.getMaxValue() != null && numVal > def.getMaxValue()) {
                            result.addError("Parameter '" + paramName + "' value "
                                    + numVal + " exceeds maximum " + def.getMaxValue());
                        }
                    }
                    break;

                case STRING:
                    if (!(value instanceof String)) {
                        result.addError("Parameter '" + paramName
                                + "' expects STRING type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                case BOOLEAN:
                    if (!(value instanceof Boolean)) {
                        result.addError("Parameter '" + paramName
                                + "' expects BOOLEAN type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                case ENUM:
                    if (!(value instanceof String)) {
                        result.addError("Parameter '" + paramName
                                + "' expects ENUM (String) type, got: " + value.getClass().getSimpleName());
                    } else if (def.getEnumValues() != null
                            && !def.getEnumValues().contains((String) value)) {
                        result.addError("Parameter '" + paramName + "' value '"
                                + value + "' is not in allowed values: " + def.getEnumValues());
                    }
                    break;

                case LIST:
                    if (!(value instanceof String) && !(value instanceof List)) {
                        result.addError("Parameter '" + paramName
                                + "' expects LIST type, got: " + value.getClass().getSimpleName());
                    }
                    break;

                case MAP:
                    if (!(value instanceof Map)) {
                        result.addError("Parameter '" + paramName
                                + "' expects MAP type, got: " + value.getClass().getSimpleName());
                    } else if (def.getChildren() != null) {
                        validateParameters(name, paramName + ".", def.getChildren(), (Map<?, ?>) value, result);
                    }
                    break;

                default:
                    result.addWarning("Unknown parameter type '" + def.getType()
                            + "' for parameter '" + paramName + "', skipping validation.");
            }
        }

        // 检查是否有多余的未定义参数
        Set<String> definedNames = definitions.stream()
                .map(ParameterDefinition::getName)
                .collect(Collectors.toSet());
        for (Object key : params.keySet()) {
            if (!definedNames.contains(String.valueOf(key))) {
                result.addWarning("Parameter '" + prefix + key + "' is not defined in processor '"
                        + name + "' metadata, it will be ignored.");
            }
        }
    }
}
