package com.pipeline.climate.operators;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.Season;
import com.pipeline.climate.stats.SeasonalOps;
import com.pipeline.climate.stats.WeightedStatistics;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 季节平均算子。三个月滑动平均后取每年的目标季节，时间轴变为 year 轴。
 *
 * 参数：
 * - season: 季节代码 (ENUM: DJF ... NDJ, 默认 NDJ)
 * - kwargs_average_moving.min_periods: 窗口内最少有效值个数 (NUMBER)
 */
public class SeasonMeanOperator implements Processor<SeasonMeanOperator.Config> {

    public static final String NAME = "season_mean";

    public static class Config {
        private final Season season;
        private final Integer minPeriods;

        public Config(Season season, Integer minPeriods) {
            this.season = season;
            this.minPeriods = minPeriods;
        }

        public Season getSeason() { return season; }
        public Integer getMinPeriods() { return minPeriods; }
    }

    @Override
    public Config configure(OperatorContext context) {
        String code = context.getParameter("season", Season.NDJ.name());
        Number minPeriods = context.getSectionParameter("kwargs_average_moving", "min_periods", (Number) null);
        return new Config(
                Season.fromCode(code).orElse(null),
                minPeriods == null ? null : minPeriods.intValue());
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        if (config.getSeason() == null) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                    "Unknown season code for step " + context.getStepKey());
        }
        AxisResolver resolver = context.getAxisResolver();
        return new SeasonalOps(resolver, new WeightedStatistics(resolver))
                .seasonMean(variable, config.getSeason(), config.getMinPeriods());
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "季节平均算子",
                "三个月滑动平均后选取每年的目标季节。",
                Arrays.asList(
                        ParameterDefinition.of("season", ParameterDefinition.Type.ENUM, Season.NDJ.name(), "季节代码")
                                .allowed(Arrays.stream(Season.values()).map(Season::name).collect(Collectors.toList())),
                        ParameterDefinition.of("kwargs_average_moving", ParameterDefinition.Type.MAP, null, "滑动平均参数")
                                .nested(Arrays.asList(
                                        ParameterDefinition.of("min_periods", ParameterDefinition.Type.NUMBER, null,
                                                "窗口内最少有效值个数").range(1.0, 3.0)))));
    }
}
