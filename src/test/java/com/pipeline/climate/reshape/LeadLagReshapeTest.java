package com.pipeline.climate.reshape;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeadLagReshapeTest {

    private LeadLagReshape reshape;

    @BeforeEach
    void setUp() {
        reshape = new LeadLagReshape(new AxisResolver());
    }

    private static LabeledArray tenYears() {
        List<CalendarDate> dates = SyntheticData.monthlyDates(1990, 1, 15, 120);
        return SyntheticData.monthlySeries("nino", dates, SyntheticData.range(0, 1, 120));
    }

    @Nested
    @DisplayName("splice")
    class Splice {

        @Test
        @DisplayName("segment count follows the window arithmetic")
        void segmentCount() {
            assertEquals(9, LeadLagReshape.segmentCount(120, 12, 24));
            assertEquals(9, LeadLagReshape.segmentCount(120, 12, 36));
            assertEquals(0, LeadLagReshape.segmentCount(20, 12, 24));
        }

        @Test
        @DisplayName("windows wider than two deltas are padded with missing values")
        void padding() {
            double[] out = LeadLagReshape.splice(SyntheticData.range(0, 1, 120), 120, 1, 12, 36);
            assertEquals(9 * 36, out.length);
            for (int i = 0; i < 6; i++) {
                assertTrue(Double.isNaN(out[i]));
                assertTrue(Double.isNaN(out[8 * 36 + 30 + i]));
            }
            assertEquals(0.0, out[6]);
            assertEquals(119.0, out[8 * 36 + 29]);
        }

        @Test
        @DisplayName("non-positive arguments are rejected")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> LeadLagReshape.splice(new double[4], 4, 1, 0, 2));
        }
    }

    @Nested
    @DisplayName("reshapeLeadLag")
    class Reshape {

        @Test
        @DisplayName("monthly data with yearly delta gets year and month axes")
        void yearMonthAxes() {
            LabeledArray out = reshape.reshapeLeadLag(tenYears(), 12, 24, "T").get();
            assertEquals(List.of("year", "month"), out.getDims());
            assertArrayEquals(SyntheticData.range(1990, 1, 9), out.getCoordinate("year").getValues());
            assertArrayEquals(SyntheticData.range(0, 1, 24), out.getCoordinate("month").getValues());
            // 第 2 段从第 2 年 1 月开始
            assertEquals(12.0, out.valueAt(24));
            assertEquals(119.0, out.valueAt(9 * 24 - 1));
        }

        @Test
        @DisplayName("other axes get _a and _b index axes and keep remaining dims")
        void genericAxes() {
            LabeledArray a = LabeledArray.builder("v").dims("lon", "lat").shape(2, 10)
                    .values(SyntheticData.range(0, 1, 20))
                    .coordinate(Coordinate.of("lon", 0, 90))
                    .coordinate(Coordinate.of("lat", SyntheticData.range(-45, 10, 10)))
                    .build();
            LabeledArray out = reshape.reshapeLeadLag(a, 2, 4, "lat").get();
            assertEquals(List.of("lat_a", "lat_b", "lon"), out.getDims());
            assertEquals(4, out.sizeOf("lat_a"));
            assertArrayEquals(new double[]{0, 90}, out.getCoordinate("lon").getValues());
            // (lat_a=1, lat_b=0, lon=1) 对应原 lat 下标 2、lon 下标 1
            assertEquals(12.0, out.valueAt((1 * 4 + 0) * 2 + 1));
        }

        @Test
        @DisplayName("too short series fail with EMPTY_SELECTION")
        void tooShort() {
            LabeledArray shortSeries = tenYears().slice("time", 0, 20);
            assertEquals(FailureReason.EMPTY_SELECTION,
                    reshape.reshapeLeadLag(shortSeries, 12, 24, "T").getReason());
        }

        @Test
        @DisplayName("unknown axis fails with AXIS_NOT_FOUND")
        void unknownAxis() {
            assertEquals(FailureReason.AXIS_NOT_FOUND,
                    reshape.reshapeLeadLag(tenYears(), 12, 24, "depth").getReason());
        }
    }
}
