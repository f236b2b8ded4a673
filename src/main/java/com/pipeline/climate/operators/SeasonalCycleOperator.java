package com.pipeline.climate.operators;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.SeasonalOps;
import com.pipeline.climate.stats.WeightedStatistics;

import java.util.Arrays;
import java.util.Collections;

/**
 * 季节循环算子。按月份分组求平均，时间轴变为 month 轴（1..12）。
 *
 * 参数：
 * - kwargs_mean.skipna: 跳过缺测 (BOOLEAN, 默认 true)
 * - weighted: 组内按月长度加权 (BOOLEAN, 默认 false)
 */
public class SeasonalCycleOperator implements Processor<SeasonalCycleOperator.Config> {

    public static final String NAME = "seasonal_cycle";

    public static class Config {
        private final boolean skipna;
        private final boolean weighted;

        public Config(boolean skipna, boolean weighted) {
            this.skipna = skipna;
            this.weighted = weighted;
        }

        public boolean isSkipna() { return skipna; }
        public boolean isWeighted() { return weighted; }
    }

    @Override
    public Config configure(OperatorContext context) {
        return new Config(
                context.getSectionParameter("kwargs_mean", "skipna", true),
                context.getParameter("weighted", false));
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        AxisResolver resolver = context.getAxisResolver();
        return new SeasonalOps(resolver, new WeightedStatistics(resolver))
                .seasonalCycle(variable, config.isSkipna(), config.isWeighted());
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "季节循环算子",
                "按月份分组求平均季节循环。",
                Arrays.asList(
                        ParameterDefinition.of("kwargs_mean", ParameterDefinition.Type.MAP, null, "平均参数")
                                .nested(Collections.singletonList(
                                        ParameterDefinition.of("skipna", ParameterDefinition.Type.BOOLEAN, true, "跳过缺测"))),
                        ParameterDefinition.of("weighted", ParameterDefinition.Type.BOOLEAN, false, "按月长度加权")));
    }
}
