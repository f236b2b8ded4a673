package com.pipeline.climate.stats;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.model.RegressionResult;
import org.apache.commons.math3.distribution.TDistribution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 逐格点线性回归 y = slope * x + intercept，附带相关系数、p 值和标准误。
 *
 * 计算过程：
 * 1. 按滞后步数平移 x / y 并去掉平移留下的边缘
 * 2. 沿共有的一维轴做内连接对齐
 * 3. 在回归轴以外的所有轴上向量化计算：
 *    n 为 y 的有效值个数，均值和标准差忽略缺失值（总体标准差），
 *    cov = sum((x - x̄)(y - ȳ)) / n，r = cov / (σx σy)，slope = cov / σx²，
 *    intercept = ȳ - x̄ slope，t = r √(n-2) / √(1-r²)，stderr = slope / t，
 *    p 值取自 n-2 自由度的 Student t 分布
 *
 * 结果的坐标继承自 y。
 */
public class Regression {

    private final AxisResolver resolver;

    public Regression(AxisResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * 以字符串给出备择假设的重载，非法取值返回失败结果。
     */
    public ProcessingResult<RegressionResult> linearRegression(LabeledArray x, LabeledArray y, String dim,
                                                               String alternative, int lagX, int lagY) {
        Optional<Alternative> alt = Alternative.fromLabel(alternative);
        if (alt.isEmpty()) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                    "Unknown alternative hypothesis '" + alternative + "', expected greater, less or two-sided");
        }
        return linearRegression(x, y, dim, alt.get(), lagX, lagY);
    }

    public ProcessingResult<RegressionResult> linearRegression(LabeledArray x, LabeledArray y, String dim,
                                                               Alternative alternative, int lagX, int lagY) {
        Optional<String> dimX = resolver.checkDim(x, dim).filter(x.getDims()::contains);
        Optional<String> dimY = resolver.checkDim(y, dim).filter(y.getDims()::contains);
        if (dimX.isEmpty() || dimY.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Regression dimension '" + dim + "' not found in both '" + x.getName() + "' and '" + y.getName() + "'");
        }
        String regDim = dimY.get();
        LabeledArray xs = x.renameDim(dimX.get(), regDim);
        LabeledArray ys = y;

        if (lagX != 0) {
            Optional<LabeledArray> shifted = shift(xs, regDim, lagX);
            if (shifted.isEmpty()) {
                return lagTooLarge(x, lagX);
            }
            xs = shifted.get();
        }
        if (lagY != 0) {
            Optional<LabeledArray> shifted = shift(ys, regDim, lagY);
            if (shifted.isEmpty()) {
                return lagTooLarge(y, lagY);
            }
            ys = shifted.get();
        }

        for (String shared : sharedDims(xs, ys)) {
            LabeledArray[] aligned = innerJoin(xs, ys, shared);
            xs = aligned[0];
            ys = aligned[1];
            if (xs.sizeOf(shared) == 0) {
                return ProcessingResult.failure(FailureReason.ALIGNMENT_FAILED,
                        "No common '" + shared + "' labels between '" + x.getName() + "' and '" + y.getName() + "'");
            }
        }
        if (!xs.getDims().contains(regDim)) {
            return ProcessingResult.failure(FailureReason.ALIGNMENT_FAILED,
                    "Regression dimension '" + regDim + "' lost during alignment");
        }
        return ProcessingResult.success(compute(xs, ys, regDim, alternative));
    }

    private static ProcessingResult<RegressionResult> lagTooLarge(LabeledArray a, int lag) {
        return ProcessingResult.failure(FailureReason.ALIGNMENT_FAILED,
                "Lag " + lag + " leaves no data in '" + a.getName() + "'");
    }

    /**
     * 沿轴平移 lag 步（正数表示取后面的值放到前面），丢弃平移后无值的边缘。
     */
    static Optional<LabeledArray> shift(LabeledArray a, String dim, int lag) {
        int length = a.sizeOf(dim);
        int kept = length - Math.abs(lag);
        if (kept <= 0) {
            return Optional.empty();
        }
        int[] valueIdx = lag > 0 ? ArrayOps.range(lag, length) : ArrayOps.range(0, kept);
        int[] labelIdx = lag > 0 ? ArrayOps.range(0, kept) : ArrayOps.range(-lag, length);
        Coordinate labels = a.getCoordinate(dim).select(dim, labelIdx);
        LabeledArray moved = a.isel(dim, valueIdx);
        return Optional.of(moved.withCoordinate(labels));
    }

    private static List<String> sharedDims(LabeledArray a, LabeledArray b) {
        List<String> shared = new ArrayList<>();
        for (String d : a.getDims()) {
            if (b.getDims().contains(d)) {
                shared.add(d);
            }
        }
        return shared;
    }

    /**
     * 沿 dim 取两者标签的交集，顺序以 b 为准。
     */
    static LabeledArray[] innerJoin(LabeledArray a, LabeledArray b, String dim) {
        Coordinate ca = a.getCoordinate(dim);
        Coordinate cb = b.getCoordinate(dim);
        Map<Object, Integer> positionsInA = new HashMap<>();
        for (int i = 0; i < ca.size(); i++) {
            positionsInA.putIfAbsent(ca.label(i), i);
        }
        List<Integer> idxA = new ArrayList<>();
        List<Integer> idxB = new ArrayList<>();
        for (int j = 0; j < cb.size(); j++) {
            Integer i = positionsInA.get(cb.label(j));
            if (i != null) {
                idxA.add(i);
                idxB.add(j);
            }
        }
        if (idxA.size() == ca.size() && idxB.size() == cb.size() && isIdentity(idxA) && isIdentity(idxB)) {
            return new LabeledArray[]{a, b};
        }
        return new LabeledArray[]{
                a.isel(dim, idxA.stream().mapToInt(Integer::intValue).toArray()),
                b.isel(dim, idxB.stream().mapToInt(Integer::intValue).toArray())
        };
    }

    private static boolean isIdentity(List<Integer> idx) {
        for (int i = 0; i < idx.size(); i++) {
            if (idx.get(i) != i) {
                return false;
            }
        }
        return true;
    }

    private RegressionResult compute(LabeledArray x, LabeledArray y, String dim, Alternative alternative) {
        // 结果轴：x 的非回归轴，再加上 y 独有的轴
        Set<String> outDimSet = new LinkedHashSet<>();
        for (String d : x.getDims()) {
            if (!d.equals(dim)) outDimSet.add(d);
        }
        for (String d : y.getDims()) {
            if (!d.equals(dim)) outDimSet.add(d);
        }
        List<String> outDims = new ArrayList<>(outDimSet);
        int[] outShape = new int[outDims.size()];
        for (int i = 0; i < outShape.length; i++) {
            String d = outDims.get(i);
            outShape[i] = y.getDims().contains(d) ? y.sizeOf(d) : x.sizeOf(d);
        }
        List<String> full = new ArrayList<>();
        full.add(dim);
        full.addAll(outDims);
        int length = y.sizeOf(dim);
        int[] fullShape = new int[full.size()];
        fullShape[0] = length;
        System.arraycopy(outShape, 0, fullShape, 1, outShape.length);

        double[] xv = ArrayOps.broadcast(x.getValues(), x.getDims(), x.getShape(), full, fullShape);
        double[] yv = ArrayOps.broadcast(y.getValues(), y.getDims(), y.getShape(), full, fullShape);
        int points = ArrayOps.product(outShape);

        double[] slope = new double[points];
        double[] intercept = new double[points];
        double[] rvalue = new double[points];
        double[] pvalue = new double[points];
        double[] stderr = new double[points];
        Map<Integer, TDistribution> distributions = new HashMap<>();
        double[] xs = new double[length];
        double[] ys = new double[length];

        for (int j = 0; j < points; j++) {
            for (int k = 0; k < length; k++) {
                xs[k] = xv[k * points + j];
                ys[k] = yv[k * points + j];
            }
            int n = ArrayOps.countValid(ys);
            double xMean = ArrayOps.mean(xs, true);
            double yMean = ArrayOps.mean(ys, true);
            double xStd = WeightedStatistics.standardDeviation(xs, 0, true);
            double yStd = WeightedStatistics.standardDeviation(ys, 0, true);
            double products = 0;
            for (int k = 0; k < length; k++) {
                double p = (xs[k] - xMean) * (ys[k] - yMean);
                if (!Double.isNaN(p)) {
                    products += p;
                }
            }
            double cov = products / n;
            double r = cov / (xStd * yStd);
            double b = cov / (xStd * xStd);
            double t = Math.abs(r) >= 1 ? Math.copySign(Double.POSITIVE_INFINITY, r)
                    : r * Math.sqrt(n - 2) / Math.sqrt(1 - r * r);
            slope[j] = b;
            intercept[j] = yMean - xMean * b;
            rvalue[j] = r;
            stderr[j] = b / t;
            pvalue[j] = pValue(t, n - 2, alternative, distributions);
        }

        LabeledArray template = template(x, y, outDims, outShape);
        LabeledDataset ds = LabeledDataset.builder()
                .variable(template.toBuilder().name(RegressionResult.SLOPE).values(slope).build())
                .variable(template.toBuilder().name(RegressionResult.INTERCEPT).values(intercept).build())
                .variable(template.toBuilder().name(RegressionResult.RVALUE).values(rvalue).build())
                .variable(template.toBuilder().name(RegressionResult.PVALUE).values(pvalue).build())
                .variable(template.toBuilder().name(RegressionResult.STDERR).values(stderr).build())
                .build();
        return new RegressionResult(ds);
    }

    static double pValue(double t, int df, Alternative alternative, Map<Integer, TDistribution> cache) {
        if (Double.isNaN(t) || df <= 0) {
            return Double.NaN;
        }
        TDistribution dist = cache.computeIfAbsent(df, TDistribution::new);
        switch (alternative) {
            case GREATER:
                return cdf(dist, -t);
            case LESS:
                return cdf(dist, t);
            case TWO_SIDED:
            default:
                return 2 * cdf(dist, -Math.abs(t));
        }
    }

    private static double cdf(TDistribution dist, double t) {
        if (t == Double.POSITIVE_INFINITY) {
            return 1.0;
        }
        if (t == Double.NEGATIVE_INFINITY) {
            return 0.0;
        }
        return dist.cumulativeProbability(t);
    }

    /**
     * 结果变量的骨架：轴为 outDims，坐标优先取自 y，y 没有的轴再取 x 的坐标，不带元数据。
     */
    private static LabeledArray template(LabeledArray x, LabeledArray y, List<String> outDims, int[] outShape) {
        Map<String, Coordinate> coords = new LinkedHashMap<>();
        for (LabeledArray source : List.of(y, x)) {
            for (Coordinate c : source.getCoordinates().values()) {
                if (!c.isPositional() && outDims.containsAll(c.getDims()) && !coords.containsKey(c.getName())) {
                    coords.put(c.getName(), c);
                }
            }
        }
        LabeledArray.Builder b = LabeledArray.builder("template")
                .dims(outDims)
                .shape(outShape)
                .values(new double[ArrayOps.product(outShape)]);
        coords.values().forEach(b::coordinate);
        return b.build();
    }
}
