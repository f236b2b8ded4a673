package com.pipeline.climate.stats;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.array.AxisLayout;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.time.CalendarTime;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 多项式去趋势：逐格点对轴坐标做最小二乘多项式拟合，返回原值减去拟合值的残差。
 *
 * 时间轴的自变量是相对首个时间步的天数（按日历计算）。
 * 每条序列单独跳过缺失值；有效值少于 deg + 1 个的序列结果全部缺失。
 */
public class Detrend {

    private static final Logger log = LoggerFactory.getLogger(Detrend.class);

    private final AxisResolver resolver;

    public Detrend(AxisResolver resolver) {
        this.resolver = resolver;
    }

    public ProcessingResult<LabeledArray> removeFit(LabeledArray da, int deg, String dim) {
        if (deg < 0) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT, "Polynomial degree must be >= 0, got " + deg);
        }
        Optional<String> resolved = resolver.checkDim(da, dim);
        if (resolved.isEmpty() || !da.getDims().contains(resolved.get())) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot detrend '" + da.getName() + "' along '" + dim + "'");
        }
        String fitDim = resolved.get();
        double[] x = abscissa(da.getCoordinate(fitDim));

        AxisLayout layout = AxisLayout.of(da.getShape(), da.axisOf(fitDim));
        double[] values = da.getValues();
        double[] out = new double[values.length];
        for (int line = 0; line < layout.lineCount(); line++) {
            double[] series = layout.readLine(values, line);
            layout.writeLine(out, line, residual(x, series, deg));
        }
        return ProcessingResult.success(da.withValues(out));
    }

    static double[] abscissa(Coordinate coordinate) {
        if (coordinate.isTime()) {
            return CalendarTime.daysSinceStart(coordinate.getDates(), coordinate.getCalendar());
        }
        return coordinate.getValues();
    }

    /**
     * 单条序列的拟合残差。自变量先中心化并缩放到 [-1, 1] 附近以改善条件数。
     */
    static double[] residual(double[] x, double[] y, int deg) {
        int n = ArrayOps.countValid(y);
        double[] out = ArrayOps.filled(y.length, Double.NaN);
        if (n < deg + 1) {
            return out;
        }
        double center = 0;
        for (int i = 0; i < y.length; i++) {
            if (!Double.isNaN(y[i])) {
                center += x[i];
            }
        }
        center /= n;
        double scale = 0;
        for (int i = 0; i < y.length; i++) {
            if (!Double.isNaN(y[i])) {
                scale = Math.max(scale, Math.abs(x[i] - center));
            }
        }
        if (scale == 0) {
            scale = 1;
        }

        double[][] design = new double[n][deg + 1];
        double[] target = new double[n];
        int row = 0;
        for (int i = 0; i < y.length; i++) {
            if (Double.isNaN(y[i])) {
                continue;
            }
            double t = (x[i] - center) / scale;
            double p = 1;
            for (int j = 0; j <= deg; j++) {
                design[row][j] = p;
                p *= t;
            }
            target[row++] = y[i];
        }

        RealVector coefficients;
        try {
            DecompositionSolver solver = new QRDecomposition(new Array2DRowRealMatrix(design, false)).getSolver();
            coefficients = solver.solve(new ArrayRealVector(target, false));
        } catch (SingularMatrixException e) {
            log.debug("Singular design matrix for degree {} fit over {} points, series left missing", deg, n);
            return out;
        }

        for (int i = 0; i < y.length; i++) {
            if (Double.isNaN(y[i])) {
                continue;
            }
            double t = (x[i] - center) / scale;
            double fit = 0;
            for (int j = deg; j >= 0; j--) {
                fit = fit * t + coefficients.getEntry(j);
            }
            out[i] = y[i] - fit;
        }
        return out;
    }
}
