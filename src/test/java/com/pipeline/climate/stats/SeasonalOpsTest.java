package com.pipeline.climate.stats;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeasonalOpsTest {

    private static final double EPS = 1e-9;

    private SeasonalOps ops;

    @BeforeEach
    void setUp() {
        AxisResolver resolver = new AxisResolver();
        ops = new SeasonalOps(resolver, new WeightedStatistics(resolver));
    }

    /** 值 = 月份 + 10 * (年 - 2000) */
    private static LabeledArray monthAndYear(int years) {
        List<CalendarDate> dates = SyntheticData.monthlyDates(2000, 1, 15, 12 * years);
        double[] values = new double[dates.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = dates.get(i).getMonth() + 10.0 * (dates.get(i).getYear() - 2000);
        }
        return SyntheticData.monthlySeries("nino", dates, values);
    }

    @Nested
    @DisplayName("seasonal cycle and anomalies")
    class Cycle {

        @Test
        @DisplayName("the cycle replaces time with a month axis")
        void seasonalCycle() {
            LabeledArray cycle = ops.seasonalCycle(monthAndYear(2), true, false).get();
            assertEquals(List.of("month"), cycle.getDims());
            assertArrayEquals(SyntheticData.range(1, 1, 12), cycle.getCoordinate("month").getValues());
            assertEquals(6.0, cycle.valueAt(0), EPS);
            assertEquals(17.0, cycle.valueAt(11), EPS);
        }

        @Test
        @DisplayName("only months present in the data appear in the cycle")
        void partialYear() {
            List<CalendarDate> dates = SyntheticData.monthlyDates(2000, 3, 15, 3);
            LabeledArray series = SyntheticData.monthlySeries("nino", dates, new double[]{1, 2, 3});
            LabeledArray cycle = ops.seasonalCycle(series, true, false).get();
            assertArrayEquals(new double[]{3, 4, 5}, cycle.getCoordinate("month").getValues());
        }

        @Test
        @DisplayName("anomalies subtract the cycle of the matching month")
        void anomalies() {
            LabeledArray anomalies = ops.interannualAnomalies(monthAndYear(2)).get();
            double[] v = anomalies.getValues();
            for (int i = 0; i < 12; i++) {
                assertEquals(-5.0, v[i], EPS);
                assertEquals(5.0, v[i + 12], EPS);
            }
            assertEquals(List.of("time"), anomalies.getDims());
        }

        @Test
        @DisplayName("no dated time axis fails with AXIS_NOT_FOUND")
        void noTime() {
            LabeledArray field = SyntheticData.field("v", "lat", new double[]{0}, "lon", new double[]{0},
                    new double[]{1});
            assertEquals(FailureReason.AXIS_NOT_FOUND, ops.seasonalCycle(field, true, false).getReason());
        }
    }

    @Nested
    @DisplayName("seasons")
    class Seasons {

        @Test
        @DisplayName("NDJ is labelled by the December year and drops the last year")
        void ndj() {
            LabeledArray season = ops.getSeason(monthAndYear(3), Season.NDJ).get();
            assertEquals(List.of("year"), season.getDims());
            assertArrayEquals(new double[]{2000, 2001}, season.getCoordinate("year").getValues());
            assertArrayEquals(new double[]{12, 22}, season.getValues(), EPS);
        }

        @Test
        @DisplayName("DJF is labelled by the January year and drops the first year")
        void djf() {
            LabeledArray season = ops.getSeason(monthAndYear(3), Season.DJF).get();
            assertArrayEquals(new double[]{2002, 2003}, season.getCoordinate("year").getValues());
            assertArrayEquals(new double[]{11, 21}, season.getValues(), EPS);
        }

        @Test
        @DisplayName("a single year is not enough")
        void tooShort() {
            ProcessingResult<LabeledArray> result = ops.getSeason(monthAndYear(1), Season.NDJ);
            assertTrue(result.isFailure());
            assertEquals(FailureReason.EMPTY_SELECTION, result.getReason());
        }

        @Test
        @DisplayName("season means of a constant series stay constant")
        void seasonMeanConstant() {
            List<CalendarDate> dates = SyntheticData.monthlyDates(2000, 1, 15, 36);
            double[] values = new double[dates.size()];
            java.util.Arrays.fill(values, 4.0);
            LabeledArray series = SyntheticData.monthlySeries("nino", dates, values);
            LabeledArray season = ops.seasonMean(series, Season.JJA, null).get();
            assertArrayEquals(new double[]{2000, 2001}, season.getCoordinate("year").getValues());
            assertArrayEquals(new double[]{4, 4}, season.getValues(), EPS);
        }

        @Test
        @DisplayName("season codes parse case-insensitively")
        void fromCode() {
            assertEquals(Season.NDJ, Season.fromCode("ndj").orElseThrow());
            assertTrue(Season.fromCode("XYZ").isEmpty());
        }
    }
}
