package com.pipeline.climate.stats;

import com.pipeline.climate.array.AxisLayout;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.time.CalendarTime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 季节循环相关运算：气候态、年际距平、季节提取和季节平均。
 */
public class SeasonalOps {

    private final AxisResolver resolver;
    private final WeightedStatistics statistics;

    public SeasonalOps(AxisResolver resolver, WeightedStatistics statistics) {
        this.resolver = resolver;
        this.statistics = statistics;
    }

    /**
     * 按日历月分组求平均，时间轴替换为 month 轴（只包含数据中出现过的月份，升序）。
     *
     * @param skipna   是否忽略缺失值
     * @param weighted 为 true 时组内按月长加权
     */
    public ProcessingResult<LabeledArray> seasonalCycle(LabeledArray da, boolean skipna, boolean weighted) {
        Optional<Coordinate> time = timeCoordinate(da);
        if (time.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot compute seasonal cycle of '" + da.getName() + "' without a dated time axis");
        }
        String timeDim = time.get().getName();
        List<CalendarDate> dates = time.get().getDates();
        double[] monthLength = CalendarTime.daysPerMonth(dates, time.get().getCalendar());
        List<Integer> months = new ArrayList<>(new TreeSet<>(monthsOf(dates)));

        AxisLayout in = AxisLayout.of(da.getShape(), da.axisOf(timeDim));
        int[] outShape = da.getShape();
        outShape[da.axisOf(timeDim)] = months.size();
        AxisLayout out = AxisLayout.of(outShape, da.axisOf(timeDim));
        double[] values = da.getValues();
        double[] result = new double[out.lineCount() * months.size()];
        for (int line = 0; line < in.lineCount(); line++) {
            for (int g = 0; g < months.size(); g++) {
                int month = months.get(g);
                double sum = 0;
                double weightSum = 0;
                boolean missing = false;
                for (int k = 0; k < dates.size(); k++) {
                    if (dates.get(k).getMonth() != month) {
                        continue;
                    }
                    double x = values[in.lineIndex(line, k)];
                    if (Double.isNaN(x)) {
                        if (!skipna) {
                            missing = true;
                            break;
                        }
                        continue;
                    }
                    double w = weighted ? monthLength[k] : 1.0;
                    sum += w * x;
                    weightSum += w;
                }
                result[out.lineIndex(line, g)] = (missing || weightSum == 0) ? Double.NaN : sum / weightSum;
            }
        }
        double[] monthValues = months.stream().mapToDouble(Integer::doubleValue).toArray();
        return ProcessingResult.success(da.replaceDim(timeDim, Coordinate.of("month", monthValues), result));
    }

    /**
     * 年际距平：每个时间步减去其所在月份的气候态值。
     */
    public ProcessingResult<LabeledArray> interannualAnomalies(LabeledArray da) {
        return seasonalCycle(da, true, false).map(cycle -> {
            Coordinate time = timeCoordinate(da).orElseThrow();
            List<CalendarDate> dates = time.getDates();
            double[] cycleMonths = cycle.getCoordinate("month").getValues();
            int axis = da.axisOf(time.getName());
            AxisLayout in = AxisLayout.of(da.getShape(), axis);
            AxisLayout clim = AxisLayout.of(cycle.getShape(), axis);
            double[] values = da.getValues();
            double[] cycleValues = cycle.getValues();
            int[] group = new int[dates.size()];
            for (int k = 0; k < group.length; k++) {
                group[k] = indexOfMonth(cycleMonths, dates.get(k).getMonth());
            }
            for (int line = 0; line < in.lineCount(); line++) {
                for (int k = 0; k < dates.size(); k++) {
                    int idx = in.lineIndex(line, k);
                    values[idx] = values[idx] - cycleValues[clim.lineIndex(line, group[k])];
                }
            }
            return da.withValues(values);
        });
    }

    private static int indexOfMonth(double[] months, int month) {
        for (int i = 0; i < months.length; i++) {
            if ((int) months[i] == month) {
                return i;
            }
        }
        throw new IllegalStateException("Month " + month + " missing from seasonal cycle");
    }

    /**
     * 提取季节：选出中间月份等于该季节中心月的时间步，时间轴改为 year 轴。
     * DJF 的年份加 1（12 月归到下一年的冬季）；随后去掉滑动平均留下的边缘年：
     * DJF 去掉第一年，其余季节去掉最后一年。
     * 调用前应已做过三个月滑动平均。
     */
    public ProcessingResult<LabeledArray> getSeason(LabeledArray da, Season season) {
        Optional<Coordinate> time = timeCoordinate(da);
        if (time.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot extract season from '" + da.getName() + "' without a dated time axis");
        }
        String timeDim = time.get().getName();
        List<CalendarDate> dates = time.get().getDates();
        List<Integer> picked = new ArrayList<>();
        for (int k = 0; k < dates.size(); k++) {
            if (dates.get(k).getMonth() == season.getCenterMonth()) {
                picked.add(k);
            }
        }
        if (picked.size() < 2) {
            return ProcessingResult.failure(FailureReason.EMPTY_SELECTION,
                    "Season " + season + " covers fewer than two years in '" + da.getName() + "'");
        }
        int[] idx = picked.stream().mapToInt(Integer::intValue).toArray();
        LabeledArray selected = da.isel(timeDim, idx);
        double[] years = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            years[i] = dates.get(idx[i]).getYear() + (season == Season.DJF ? 1 : 0);
        }
        LabeledArray byYear = selected.replaceDim(timeDim, Coordinate.of("year", years), selected.getValues());
        return season == Season.DJF
                ? ProcessingResult.success(byYear.slice("year", 1, idx.length))
                : ProcessingResult.success(byYear.slice("year", 0, idx.length - 1));
    }

    /**
     * 季节平均：先做三个月时间加权滑动平均，再提取季节。
     */
    public ProcessingResult<LabeledArray> seasonMean(LabeledArray da, Season season, Integer minPeriods) {
        return statistics.movingAverage(da, AxisTag.TIME.getCode(), 3, minPeriods)
                .flatMap(smoothed -> getSeason(smoothed, season));
    }

    private Optional<Coordinate> timeCoordinate(LabeledArray da) {
        return resolver.resolve(da, AxisTag.TIME)
                .flatMap(da::findCoordinate)
                .filter(Coordinate::isTime)
                .filter(c -> da.getDims().contains(c.getName()));
    }

    private static List<Integer> monthsOf(List<CalendarDate> dates) {
        List<Integer> months = new ArrayList<>(dates.size());
        for (CalendarDate d : dates) {
            months.add(d.getMonth());
        }
        return months;
    }
}
