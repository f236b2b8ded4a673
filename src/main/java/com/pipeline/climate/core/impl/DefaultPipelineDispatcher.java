package com.pipeline.climate.core.impl;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.FunctionManager;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.PipelineDispatcher;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.OperatorSpec;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 管道调度器默认实现。
 *
 * 每个步骤依次经过：解析算子名 → 参数校验 → 对每个选中变量执行。
 * 未注册的算子记录警告后跳过，任何变量处理失败立即终止管道。
 */
public class DefaultPipelineDispatcher implements PipelineDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineDispatcher.class);

    private final FunctionManager functionManager;
    private final AxisResolver axisResolver;

    public DefaultPipelineDispatcher(FunctionManager functionManager, AxisResolver axisResolver) {
        this.functionManager = functionManager;
        this.axisResolver = axisResolver;
    }

    @Override
    public ProcessingResult<LabeledDataset> apply(LabeledDataset dataset,
                                                  LinkedHashMap<String, Map<String, Object>> steps,
                                                  List<String> variables) {
        List<String> selected = selectVariables(dataset, variables);
        for (String name : selected) {
            if (!dataset.hasVariable(name)) {
                return ProcessingResult.failure(FailureReason.VARIABLE_NOT_FOUND,
                        "Variable '" + name + "' not found in dataset, available: " + dataset.variableNames());
            }
        }

        LabeledDataset.Builder start = LabeledDataset.builder().attributes(dataset.getAttributes());
        for (String name : selected) {
            start.variable(dataset.getVariable(name));
        }
        LabeledDataset current = start.build();

        if (steps == null) {
            return ProcessingResult.success(current);
        }

        for (Map.Entry<String, Map<String, Object>> entry : steps.entrySet()) {
            OperatorSpec step = new OperatorSpec(entry.getKey(), entry.getValue());
            Processor<?> processor = functionManager.getFunction(step.getOperatorName());
            if (processor == null) {
                log.warn("Unknown operator '{}' in step '{}', skipped. Known operators: {}",
                        step.getOperatorName(), step.getKey(), functionManager.getFunctionNames());
                continue;
            }

            ValidationResult validation = functionManager.validateFunction(step.getOperatorName(), step.getParameters());
            for (String warning : validation.getWarnings()) {
                log.warn("Step '{}': {}", step.getKey(), warning);
            }
            if (!validation.isValid()) {
                log.warn("Pipeline halted at step '{}': invalid parameters {}", step.getKey(), validation.getErrors());
                return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                        "Step '" + step.getKey() + "' has invalid parameters: " + validation.getErrors());
            }

            OperatorContext context = new DefaultOperatorContext(step, axisResolver);
            LabeledDataset.Builder next = LabeledDataset.builder().attributes(current.getAttributes());
            for (LabeledArray variable : current.getVariables()) {
                log.debug("Step '{}' on {}", step.getKey(), variable);
                ProcessingResult<LabeledArray> processed = run(processor, variable, context);
                if (processed.isFailure()) {
                    log.warn("Pipeline halted at step '{}' on variable '{}': {} {}", step.getKey(),
                            variable.getName(), processed.getReason(), processed.getMessage());
                    return ProcessingResult.failure(processed.getReason(),
                            "Step '" + step.getKey() + "' failed on variable '" + variable.getName() + "': "
                                    + processed.getMessage());
                }
                next.variable(processed.get().withName(variable.getName()));
            }
            current = next.build();
        }
        return ProcessingResult.success(current);
    }

    private static <C> ProcessingResult<LabeledArray> run(Processor<C> processor, LabeledArray variable,
                                                          OperatorContext context) {
        C config = processor.configure(context);
        return processor.process(variable, config, context);
    }

    /**
     * 未指定变量时选取名称中不含 "bound" 与 "bnd" 的全部变量。
     */
    static List<String> selectVariables(LabeledDataset dataset, List<String> variables) {
        if (variables != null && !variables.isEmpty()) {
            return new ArrayList<>(variables);
        }
        List<String> selected = new ArrayList<>();
        for (String name : dataset.variableNames()) {
            if (!name.contains("bound") && !name.contains("bnd")) {
                selected.add(name);
            }
        }
        return selected;
    }
}
