package com.pipeline.climate.array;

import java.util.Arrays;
import java.util.List;

/**
 * 行主序 double 缓冲区上的形状操作：取子集、转置、广播和 NaN 感知的求和。
 */
public final class ArrayOps {

    private ArrayOps() {}

    public static int product(int[] shape) {
        int n = 1;
        for (int s : shape) {
            n *= s;
        }
        return n;
    }

    public static int[] strides(int[] shape) {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    /**
     * 沿指定轴按下标取子集，下标可以重复或乱序。
     */
    public static double[] take(double[] values, int[] shape, int axis, int[] indices) {
        AxisLayout layout = AxisLayout.of(shape, axis);
        int n = indices.length;
        double[] out = new double[layout.getOuter() * n * layout.getInner()];
        for (int o = 0; o < layout.getOuter(); o++) {
            for (int k = 0; k < n; k++) {
                int src = layout.index(o, indices[k], 0);
                int dst = (o * n + k) * layout.getInner();
                System.arraycopy(values, src, out, dst, layout.getInner());
            }
        }
        return out;
    }

    /**
     * 按置换 perm 重排轴顺序：结果的第 i 个轴是原来的第 perm[i] 个轴。
     */
    public static double[] permute(double[] values, int[] shape, int[] perm) {
        int rank = shape.length;
        int[] srcStrides = strides(shape);
        int[] newShape = new int[rank];
        for (int i = 0; i < rank; i++) {
            newShape[i] = shape[perm[i]];
        }
        double[] out = new double[values.length];
        int[] counter = new int[rank];
        for (int flat = 0; flat < out.length; flat++) {
            int src = 0;
            for (int i = 0; i < rank; i++) {
                src += counter[i] * srcStrides[perm[i]];
            }
            out[flat] = values[src];
            for (int i = rank - 1; i >= 0; i--) {
                if (++counter[i] < newShape[i]) {
                    break;
                }
                counter[i] = 0;
            }
        }
        return out;
    }

    /**
     * 将 src（轴为 srcDims）广播到目标轴 dstDims 上。srcDims 必须是 dstDims 的子集，
     * 且同名轴长度一致。
     */
    public static double[] broadcast(double[] src, List<String> srcDims, int[] srcShape,
                                     List<String> dstDims, int[] dstShape) {
        int[] srcStrides = strides(srcShape);
        int[] mapped = new int[dstDims.size()];
        for (int i = 0; i < dstDims.size(); i++) {
            int pos = srcDims.indexOf(dstDims.get(i));
            if (pos >= 0 && srcShape[pos] != dstShape[i]) {
                throw new IllegalArgumentException("Cannot broadcast dimension '" + dstDims.get(i)
                        + "': size " + srcShape[pos] + " vs " + dstShape[i]);
            }
            mapped[i] = pos >= 0 ? srcStrides[pos] : 0;
        }
        for (String dim : srcDims) {
            if (!dstDims.contains(dim)) {
                throw new IllegalArgumentException("Dimension '" + dim + "' is not part of target " + dstDims);
            }
        }
        int total = product(dstShape);
        double[] out = new double[total];
        int[] counter = new int[dstShape.length];
        for (int flat = 0; flat < total; flat++) {
            int idx = 0;
            for (int i = 0; i < counter.length; i++) {
                idx += counter[i] * mapped[i];
            }
            out[flat] = src[idx];
            for (int i = counter.length - 1; i >= 0; i--) {
                if (++counter[i] < dstShape[i]) {
                    break;
                }
                counter[i] = 0;
            }
        }
        return out;
    }

    /**
     * 环形平移下标：结果第 k 个元素取原来第 (k - shift) mod n 个。
     */
    public static int[] rollIndices(int n, int shift) {
        int[] idx = new int[n];
        for (int k = 0; k < n; k++) {
            idx[k] = Math.floorMod(k - shift, n);
        }
        return idx;
    }

    public static int[] range(int from, int to) {
        int[] idx = new int[Math.max(0, to - from)];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = from + i;
        }
        return idx;
    }

    public static double[] filled(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }

    /** 非缺失元素之和，全部缺失时返回 0 */
    public static double nanSum(double[] values) {
        double sum = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
            }
        }
        return sum;
    }

    public static int countValid(double[] values) {
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                n++;
            }
        }
        return n;
    }

    /**
     * 均值；skipna 为 false 时遇到缺失值返回 NaN，没有有效值时返回 NaN。
     */
    public static double mean(double[] values, boolean skipna) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                if (!skipna) {
                    return Double.NaN;
                }
                continue;
            }
            sum += v;
            n++;
        }
        return n == 0 ? Double.NaN : sum / n;
    }
}
