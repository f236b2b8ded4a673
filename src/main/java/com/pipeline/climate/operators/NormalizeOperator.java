package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.WeightedStatistics;

import java.util.Arrays;
import java.util.Collections;

/**
 * 标准化算子。除以时间轴上的标准差，存在 units 属性时将其置空。
 *
 * 参数：
 * - kwargs_std.ddof: 自由度修正 (NUMBER, 默认 0)
 * - kwargs_std.skipna: 跳过缺测 (BOOLEAN, 默认 true)
 */
public class NormalizeOperator implements Processor<NormalizeOperator.Config> {

    public static final String NAME = "normalize";

    public static class Config {
        private final int ddof;
        private final boolean skipna;

        public Config(int ddof, boolean skipna) {
            this.ddof = ddof;
            this.skipna = skipna;
        }

        public int getDdof() { return ddof; }
        public boolean isSkipna() { return skipna; }
    }

    @Override
    public Config configure(OperatorContext context) {
        return new Config(
                context.getSectionParameter("kwargs_std", "ddof", 0),
                context.getSectionParameter("kwargs_std", "skipna", true));
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        WeightedStatistics statistics = new WeightedStatistics(context.getAxisResolver());
        return statistics.normalize(variable, config.getDdof(), config.isSkipna());
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "标准化算子",
                "除以时间轴上的标准差。",
                Collections.singletonList(
                        ParameterDefinition.of("kwargs_std", ParameterDefinition.Type.MAP, null, "标准差参数")
                                .nested(Arrays.asList(
                                        ParameterDefinition.of("ddof", ParameterDefinition.Type.NUMBER, 0, "自由度修正")
                                                .range(0.0, null),
                                        ParameterDefinition.of("skipna", ParameterDefinition.Type.BOOLEAN, true, "跳过缺测")))));
    }
}
