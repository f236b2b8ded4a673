package com.pipeline.climate.eof;

import com.pipeline.climate.model.LabeledArray;

/**
 * 模态分解服务的输出。
 *
 * components 含 mode 轴和空间轴，scores 含 mode 轴和分解轴，
 * explainedVarianceRatio 为各模态解释方差占比（0-1）。
 */
public class ModeDecomposition {

    public static final String MODE_DIM = "mode";

    private final LabeledArray components;
    private final LabeledArray scores;
    private final double[] explainedVarianceRatio;

    public ModeDecomposition(LabeledArray components, LabeledArray scores, double[] explainedVarianceRatio) {
        if (!components.hasDimension(MODE_DIM) || !scores.hasDimension(MODE_DIM)) {
            throw new IllegalArgumentException("Components and scores must both carry a '" + MODE_DIM + "' dimension");
        }
        this.components = components;
        this.scores = scores;
        this.explainedVarianceRatio = explainedVarianceRatio.clone();
    }

    public LabeledArray getComponents() { return components; }
    public LabeledArray getScores() { return scores; }
    public double[] getExplainedVarianceRatio() { return explainedVarianceRatio.clone(); }
}
