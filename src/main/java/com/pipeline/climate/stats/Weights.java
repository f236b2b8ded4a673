package com.pipeline.climate.stats;

import com.pipeline.climate.model.LabeledArray;

/**
 * 加权平均的权重来源。
 */
public final class Weights {

    enum Kind { NONE, AUTO, EXPLICIT }

    private static final Weights NONE = new Weights(Kind.NONE, null);
    private static final Weights AUTO = new Weights(Kind.AUTO, null);

    private final Kind kind;
    private final LabeledArray array;

    private Weights(Kind kind, LabeledArray array) {
        this.kind = kind;
        this.array = array;
    }

    /** 不加权 */
    public static Weights none() {
        return NONE;
    }

    /** 按归约轴自动推导：纬度用 cos(lat)，时间用月长 */
    public static Weights auto() {
        return AUTO;
    }

    /** 显式权重数组，其轴必须是被平均数组轴的子集 */
    public static Weights of(LabeledArray weights) {
        return new Weights(Kind.EXPLICIT, weights);
    }

    public static Weights fromFlag(boolean weighted) {
        return weighted ? AUTO : NONE;
    }

    Kind kind() { return kind; }
    LabeledArray array() { return array; }

    @Override
    public String toString() {
        return kind == Kind.EXPLICIT ? "Weights{" + array.getName() + "}" : "Weights{" + kind + "}";
    }
}
