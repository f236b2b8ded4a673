package com.pipeline.climate.selection;

import com.pipeline.climate.array.ArrayOps;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.LabeledArray;

/**
 * 经度环绕：把经度值折算到 [lonMin, lonMin + 360)，再沿经度方向循环平移，
 * 使第一个经度为最小值。数值和坐标一起平移，数据始终对应原来的地理位置。
 */
public final class LongitudeRoller {

    private LongitudeRoller() {}

    /** 规范到 [0, 360) */
    public static LabeledArray normalize(LabeledArray da, String lonName) {
        return roll(da, lonName, 0.0);
    }

    public static LabeledArray roll(LabeledArray da, String lonName, double lonMin) {
        Coordinate lon = da.getCoordinate(lonName);
        double[] wrapped = lon.getValues();
        for (int i = 0; i < wrapped.length; i++) {
            wrapped[i] = wrap(wrapped[i], lonMin);
        }
        LabeledArray relabeled = da.withCoordinate(lon.withValues(wrapped));

        if (!lon.isMultiDimensional()) {
            String dim = lon.getDims().get(0);
            int start = argmin(wrapped);
            return start == 0 ? relabeled : relabeled.isel(dim, ArrayOps.rollIndices(wrapped.length, -start));
        }
        // 曲线网格：按列平均经度确定平移量，沿最后一个网格轴平移
        int[] shape = lon.getShape();
        int rows = shape[0];
        int cols = wrapped.length / rows;
        double[] columnMean = new double[cols];
        for (int c = 0; c < cols; c++) {
            double sum = 0;
            for (int r = 0; r < rows; r++) {
                sum += wrapped[r * cols + c];
            }
            columnMean[c] = sum / rows;
        }
        int start = argmin(columnMean);
        String xDim = lon.getDims().get(lon.getDims().size() - 1);
        return start == 0 ? relabeled : relabeled.isel(xDim, ArrayOps.rollIndices(cols, -start));
    }

    static double wrap(double lon, double lonMin) {
        double offset = (lon - lonMin) % 360.0;
        if (offset < 0) {
            offset += 360.0;
        }
        return lonMin + offset;
    }

    private static int argmin(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best]) {
                best = i;
            }
        }
        return best;
    }
}
