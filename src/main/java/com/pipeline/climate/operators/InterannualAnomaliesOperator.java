package com.pipeline.climate.operators;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.SeasonalOps;
import com.pipeline.climate.stats.WeightedStatistics;

import java.util.Collections;

/**
 * 年际距平算子。减去按月份求得的平均季节循环。无参数。
 */
public class InterannualAnomaliesOperator implements Processor<Void> {

    public static final String NAME = "interannual_anomalies";

    @Override
    public Void configure(OperatorContext context) {
        return null;
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Void config, OperatorContext context) {
        AxisResolver resolver = context.getAxisResolver();
        return new SeasonalOps(resolver, new WeightedStatistics(resolver)).interannualAnomalies(variable);
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "年际距平算子",
                "减去平均季节循环，得到年际距平。", Collections.emptyList());
    }
}
