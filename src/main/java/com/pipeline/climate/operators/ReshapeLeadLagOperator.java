package com.pipeline.climate.operators;

import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ParameterDefinition;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.reshape.LeadLagReshape;

import java.util.Arrays;

/**
 * 超前滞后重排算子。将时间轴切分为重叠窗口，生成（段，段内位置）两个轴。
 *
 * 参数：
 * - delta: 相邻段起点间隔 (NUMBER, >= 1, 默认 12)
 * - window: 段长度 (NUMBER, >= 1, 默认 24)
 */
public class ReshapeLeadLagOperator implements Processor<ReshapeLeadLagOperator.Config> {

    public static final String NAME = "reshape_lead_lag";

    public static class Config {
        private final int delta;
        private final int window;

        public Config(int delta, int window) {
            this.delta = delta;
            this.window = window;
        }

        public int getDelta() { return delta; }
        public int getWindow() { return window; }
    }

    @Override
    public Config configure(OperatorContext context) {
        return new Config(context.getParameter("delta", 12), context.getParameter("window", 24));
    }

    @Override
    public ProcessingResult<LabeledArray> process(LabeledArray variable, Config config, OperatorContext context) {
        return new LeadLagReshape(context.getAxisResolver())
                .reshapeLeadLag(variable, config.getDelta(), config.getWindow(), "T");
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(NAME, "超前滞后重排算子",
                "将时间轴切分为重叠窗口，用于超前滞后分析。",
                Arrays.asList(
                        ParameterDefinition.of("delta", ParameterDefinition.Type.NUMBER, 12, "段起点间隔")
                                .range(1.0, null),
                        ParameterDefinition.of("window", ParameterDefinition.Type.NUMBER, 24, "段长度")
                                .range(1.0, null)));
    }
}
