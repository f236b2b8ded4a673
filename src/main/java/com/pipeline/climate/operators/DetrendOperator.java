package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.Detrend;

import java.util.Collections;

/**
 * 去趋势算子。逐格点拟合时间轴上的多项式并返回残差。
 *
 * 参数：
 * - deg: 多项式阶数 (NUMBER, >= 0, 默认 1)
 */
public class DetrendOperator implements Processor<Integer> {

    public static final String NAME = "detrend";

    @Override
    public Integer configure(OperatorContext context) {
        return context.getParameter("deg", 1);
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Integer deg, OperatorContext context) {
        return new Detrend(context.getAxisResolver()).removeFit(variable, deg, "T");
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "去趋势算子",
                "沿时间轴去除最小二乘多项式拟合。",
                Collections.singletonList(
                        ParameterDefinition.of("deg", ParameterDefinition.Type.NUMBER, 1, "多项式阶数")
                                .range(0.0, null)));
    }
}
