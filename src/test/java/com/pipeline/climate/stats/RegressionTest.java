package com.pipeline.climate.stats;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.model.RegressionResult;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RegressionTest {

    private static final double EPS = 1e-9;

    private Regression regression;
    private List<CalendarDate> dates;
    private double[] x;
    private double[] y;

    @BeforeEach
    void setUp() {
        regression = new Regression(new AxisResolver());
        dates = SyntheticData.monthlyDates(1980, 1, 15, 60);
        Random random = new Random(42);
        x = new double[dates.size()];
        y = new double[dates.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = random.nextGaussian();
            y[i] = 0.7 * x[i] + 0.3 + 0.5 * random.nextGaussian();
        }
    }

    private LabeledArray series(String name, double[] values) {
        return SyntheticData.monthlySeries(name, dates, values);
    }

    @Nested
    @DisplayName("statistics")
    class Statistics {

        @Test
        @DisplayName("matches an ordinary least squares fit")
        void matchesSimpleRegression() {
            SimpleRegression reference = new SimpleRegression();
            for (int i = 0; i < x.length; i++) {
                reference.addData(x[i], y[i]);
            }
            RegressionResult result = regression.linearRegression(series("x", x), series("y", y), "T",
                    Alternative.TWO_SIDED, 0, 0).get();
            assertEquals(reference.getSlope(), result.getSlope().valueAt(0), EPS);
            assertEquals(reference.getIntercept(), result.getIntercept().valueAt(0), EPS);
            assertEquals(reference.getR(), result.getRvalue().valueAt(0), EPS);
            assertEquals(reference.getSlopeStdErr(), result.getStderr().valueAt(0), EPS);
            assertEquals(reference.getSignificance(), result.getPvalue().valueAt(0), 1e-7);
        }

        @Test
        @DisplayName("one-sided p-values split the two-sided one")
        void alternatives() {
            double twoSided = regression.linearRegression(series("x", x), series("y", y), "time", "two-sided", 0, 0)
                    .get().getPvalue().valueAt(0);
            double greater = regression.linearRegression(series("x", x), series("y", y), "time", "greater", 0, 0)
                    .get().getPvalue().valueAt(0);
            double less = regression.linearRegression(series("x", x), series("y", y), "time", "less", 0, 0)
                    .get().getPvalue().valueAt(0);
            assertEquals(twoSided / 2, greater, 1e-12);
            assertEquals(1.0, greater + less, 1e-12);
        }

        @Test
        @DisplayName("a negative slope is significant under the 'less' alternative")
        void negativeSlopeLess() {
            double[] falling = new double[y.length];
            for (int i = 0; i < falling.length; i++) {
                falling[i] = -y[i];
            }
            RegressionResult twoSided = regression.linearRegression(series("x", x), series("y", falling), "T",
                    Alternative.TWO_SIDED, 0, 0).get();
            double less = regression.linearRegression(series("x", x), series("y", falling), "T",
                    Alternative.LESS, 0, 0).get().getPvalue().valueAt(0);
            double greater = regression.linearRegression(series("x", x), series("y", falling), "T",
                    Alternative.GREATER, 0, 0).get().getPvalue().valueAt(0);
            assertTrue(twoSided.getSlope().valueAt(0) < 0);
            assertEquals(twoSided.getPvalue().valueAt(0) / 2, less, 1e-12);
            assertTrue(less < 0.01);
            assertTrue(greater > 0.99);
        }

        @Test
        @DisplayName("an exact line has r of one and p of zero")
        void exactLine() {
            double[] line = new double[x.length];
            for (int i = 0; i < line.length; i++) {
                line[i] = 2 * x[i] + 1;
            }
            RegressionResult result = regression.linearRegression(series("x", x), series("y", line), "T",
                    Alternative.TWO_SIDED, 0, 0).get();
            assertEquals(2.0, result.getSlope().valueAt(0), EPS);
            assertEquals(1.0, result.getIntercept().valueAt(0), EPS);
            assertEquals(1.0, result.getRvalue().valueAt(0), EPS);
            assertEquals(0.0, result.getPvalue().valueAt(0), 1e-12);
        }

        @Test
        @DisplayName("each grid point gets its own fit")
        void gridded() {
            double[] lats = {-10, 10};
            double[] lons = {0};
            LabeledArray field = SyntheticData.grid("sst", dates, "lat", lats, "lon", lons,
                    (t, lat, lon) -> (lat > 0 ? 3 : -1) * x[t]);
            RegressionResult result = regression.linearRegression(series("x", x), field, "T",
                    Alternative.TWO_SIDED, 0, 0).get();
            LabeledArray slope = result.getSlope();
            assertEquals(List.of("lat", "lon"), slope.getDims());
            assertEquals(-1.0, slope.valueAt(0), EPS);
            assertEquals(3.0, slope.valueAt(1), EPS);
            assertArrayEquals(lats, slope.getCoordinate("lat").getValues());
        }
    }

    @Nested
    @DisplayName("lags and alignment")
    class Alignment {

        @Test
        @DisplayName("a lag on x pairs each y with a later x")
        void lagX() {
            double[] led = new double[x.length];
            for (int i = 0; i < led.length - 1; i++) {
                led[i] = 3 * x[i + 1];
            }
            led[led.length - 1] = Double.NaN;
            RegressionResult result = regression.linearRegression(series("x", x), series("y", led), "T",
                    Alternative.TWO_SIDED, 1, 0).get();
            assertEquals(3.0, result.getSlope().valueAt(0), EPS);
        }

        @Test
        @DisplayName("only shared labels are used")
        void innerJoin() {
            LabeledArray shortX = series("x", x).slice("time", 10, 40);
            LabeledArray[] joined = Regression.innerJoin(shortX, series("y", y), "time");
            assertEquals(30, joined[0].sizeOf("time"));
            assertEquals(30, joined[1].sizeOf("time"));
            assertEquals(dates.get(10), joined[1].getCoordinate("time").getDates().get(0));
        }

        @Test
        @DisplayName("disjoint time axes cannot be aligned")
        void disjoint() {
            LabeledArray later = SyntheticData.monthlySeries("y", SyntheticData.monthlyDates(2000, 1, 15, 60), y);
            ProcessingResult<RegressionResult> result = regression.linearRegression(series("x", x), later, "T",
                    Alternative.TWO_SIDED, 0, 0);
            assertEquals(FailureReason.ALIGNMENT_FAILED, result.getReason());
        }

        @Test
        @DisplayName("a lag longer than the series fails")
        void lagTooLarge() {
            ProcessingResult<RegressionResult> result = regression.linearRegression(series("x", x), series("y", y),
                    "T", Alternative.TWO_SIDED, 100, 0);
            assertEquals(FailureReason.ALIGNMENT_FAILED, result.getReason());
        }

        @Test
        @DisplayName("unknown alternative labels are rejected")
        void badAlternative() {
            ProcessingResult<RegressionResult> result = regression.linearRegression(series("x", x), series("y", y),
                    "T", "sideways", 0, 0);
            assertEquals(FailureReason.INVALID_ARGUMENT, result.getReason());
        }
    }
}
