package com.pipeline.climate.array;

import com.pipeline.climate.model.LabeledArray;

import java.util.function.DoubleBinaryOperator;

/**
 * 带标签数组之间的逐元素运算，右操作数按轴名广播到左操作数上。
 */
public final class LabeledMath {

    private LabeledMath() {}

    /**
     * 计算 op(left, right)，right 的轴必须是 left 轴的子集。
     * 结果保留 left 的名称、坐标和元数据。
     */
    public static LabeledArray apply(LabeledArray left, LabeledArray right, DoubleBinaryOperator op) {
        double[] lv = left.getValues();
        double[] rv = ArrayOps.broadcast(right.getValues(), right.getDims(), right.getShape(),
                left.getDims(), left.getShape());
        double[] out = new double[lv.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = op.applyAsDouble(lv[i], rv[i]);
        }
        return left.withValues(out);
    }

    public static LabeledArray subtract(LabeledArray left, LabeledArray right) {
        return apply(left, right, (a, b) -> a - b);
    }

    public static LabeledArray divide(LabeledArray left, LabeledArray right) {
        return apply(left, right, (a, b) -> a / b);
    }

    public static LabeledArray multiply(LabeledArray left, LabeledArray right) {
        return apply(left, right, (a, b) -> a * b);
    }
}
