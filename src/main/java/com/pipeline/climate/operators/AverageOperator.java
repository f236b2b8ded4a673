package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.WeightedStatistics;
import com.pipeline.climate.stats.Weights;

import java.util.Arrays;
import java.util.List;

/**
 * 加权平均算子。
 * 沿一个或多个维度求平均，未显式关闭权重时自动选择 cos(纬度) 或月长度权重。
 *
 * 参数：
 * - dim: 维度名或维度名列表 (LIST, 默认 "T")
 * - kwargs_mean_weighted.skipna: 是否跳过缺测 (BOOLEAN, 默认 false)
 * - kwargs_mean_weighted.weights: 是否加权 (BOOLEAN, 默认 true)
 */
public class AverageOperator implements Processor<AverageOperator.Config> {

    public static final String NAME = "average";

    public static class Config {
        private final List<String> dims;
        private final boolean skipna;
        private final boolean weighted;

        public Config(List<String> dims, boolean skipna, boolean weighted) {
            this.dims = dims;
            this.skipna = skipna;
            this.weighted = weighted;
        }

        public List<String> getDims() { return dims; }
        public boolean isSkipna() { return skipna; }
        public boolean isWeighted() { return weighted; }
    }

    @Override
    public Config configure(OperatorContext context) {
        return new Config(
                context.getStringList("dim", List.of("T")),
                context.getSectionParameter("kwargs_mean_weighted", "skipna", false),
                context.getSectionParameter("kwargs_mean_weighted", "weights", true));
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        WeightedStatistics statistics = new WeightedStatistics(context.getAxisResolver());
        return statistics.mean(variable, config.getDims(), Weights.fromFlag(config.isWeighted()), config.isSkipna());
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "加权平均算子",
                "沿给定维度求加权平均，纬度使用 cos(纬度) 权重，时间使用月长度权重。",
                Arrays.asList(
                        ParameterDefinition.of("dim", ParameterDefinition.Type.LIST, "T", "平均的维度"),
                        ParameterDefinition.of("kwargs_mean_weighted", ParameterDefinition.Type.MAP, null, "加权平均参数")
                                .nested(Arrays.asList(
                                        ParameterDefinition.of("skipna", ParameterDefinition.Type.BOOLEAN, false, "跳过缺测"),
                                        ParameterDefinition.of("weights", ParameterDefinition.Type.BOOLEAN, true, "是否加权")))));
    }
}
