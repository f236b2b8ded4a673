package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.selection.BoundsSelector;

import java.util.Collections;
import java.util.Map;

/**
 * 范围选取算子。
 *
 * 参数：
 * - bounds: 维度（或 T/X/Y）到 [下界, 上界] 的映射 (MAP)；时间边界为日期字符串，空间边界为数值
 */
public class NetcdfSelectorOperator implements Processor<Map<String, Object>> {

    public static final String NAME = "netcdf_selector";

    @Override
    public Map<String, Object> configure(OperatorContext context) {
        return context.getSection("bounds");
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Map<String, Object> bounds,
                                                  OperatorContext context) {
        if (bounds.isEmpty()) {
            return ProcessingResult.success(variable);
        }
        return new BoundsSelector(context.getAxisResolver()).select(variable, bounds);
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "范围选取算子",
                "按时间、经度、纬度范围选取数据，必要时滚动经度。",
                Collections.singletonList(
                        ParameterDefinition.of("bounds", ParameterDefinition.Type.MAP, null, "选取范围")));
    }
}
