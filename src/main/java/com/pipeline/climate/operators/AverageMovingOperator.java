package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.WeightedStatistics;

import java.util.Arrays;

/**
 * 滑动平均算子。
 * 居中窗口，沿时间轴时按月长度加权。
 *
 * 参数：
 * - dim: 维度名 (STRING, 默认 "T")
 * - window: 窗口长度 (NUMBER, >= 1, 默认 3)
 * - min_periods: 窗口内最少有效值个数 (NUMBER, 默认等于窗口长度)
 */
public class AverageMovingOperator implements Processor<AverageMovingOperator.Config> {

    public static final String NAME = "average_moving";

    public static class Config {
        private final String dim;
        private final int window;
        private final Integer minPeriods;

        public Config(String dim, int window, Integer minPeriods) {
            this.dim = dim;
            this.window = window;
            this.minPeriods = minPeriods;
        }

        public String getDim() { return dim; }
        public int getWindow() { return window; }
        public Integer getMinPeriods() { return minPeriods; }
    }

    @Override
    public Config configure(OperatorContext context) {
        Number minPeriods = context.getParameter("min_periods", (Number) null);
        return new Config(
                context.getParameter("dim", "T"),
                context.getParameter("window", 3),
                minPeriods == null ? null : minPeriods.intValue());
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        WeightedStatistics statistics = new WeightedStatistics(context.getAxisResolver());
        return statistics.movingAverage(variable, config.getDim(), config.getWindow(), config.getMinPeriods());
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "滑动平均算子",
                "沿给定维度计算居中滑动平均，时间轴上按月长度加权。",
                Arrays.asList(
                        ParameterDefinition.of("dim", ParameterDefinition.Type.STRING, "T", "滑动的维度"),
                        ParameterDefinition.of("window", ParameterDefinition.Type.NUMBER, 3, "窗口长度")
                                .range(1.0, null),
                        ParameterDefinition.of("min_periods", ParameterDefinition.Type.NUMBER, null, "窗口内最少有效值个数")
                                .range(1.0, null)));
    }
}
