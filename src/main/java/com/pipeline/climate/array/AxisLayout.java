package com.pipeline.climate.array;

/**
 * 行主序多维缓冲区沿某一轴的步长分解。
 *
 * 形状被拆成 outer × length × inner 三段，元素 (o, k, i) 的扁平下标为
 * (o * length + k) * inner + i。沿该轴归约后的结果下标恰为 o * inner + i，
 * 即“线”的编号。
 */
public final class AxisLayout {

    private final int outer;
    private final int length;
    private final int inner;

    private AxisLayout(int outer, int length, int inner) {
        this.outer = outer;
        this.length = length;
        this.inner = inner;
    }

    public static AxisLayout of(int[] shape, int axis) {
        if (axis < 0 || axis >= shape.length) {
            throw new IllegalArgumentException("Axis " + axis + " out of range for rank " + shape.length);
        }
        int outer = 1;
        for (int i = 0; i < axis; i++) {
            outer *= shape[i];
        }
        int inner = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        return new AxisLayout(outer, shape[axis], inner);
    }

    public int getOuter() { return outer; }
    public int getLength() { return length; }
    public int getInner() { return inner; }

    /** 沿轴的线条数，也是归约结果的元素个数 */
    public int lineCount() {
        return outer * inner;
    }

    public int index(int o, int k, int i) {
        return (o * length + k) * inner + i;
    }

    /** 第 line 条线上第 k 个元素的扁平下标 */
    public int lineIndex(int line, int k) {
        return index(line / inner, k, line % inner);
    }

    /** 取出第 line 条线的全部元素 */
    public double[] readLine(double[] values, int line) {
        double[] out = new double[length];
        for (int k = 0; k < length; k++) {
            out[k] = values[lineIndex(line, k)];
        }
        return out;
    }

    public void writeLine(double[] values, int line, double[] lineValues) {
        for (int k = 0; k < length; k++) {
            values[lineIndex(line, k)] = lineValues[k];
        }
    }
}
