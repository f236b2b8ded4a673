package com.pipeline.climate.eof;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EofAdapterTest {

    private static final double EPS = 1e-12;

    /** 固定输出一个模态的分解服务，记录收到的参数 */
    private static class FixedDecomposition implements ModeDecompositionService {
        final List<String> dims = new ArrayList<>();
        final List<EofOptions> options = new ArrayList<>();

        @Override
        public ModeDecomposition decompose(LabeledArray da, String dim, EofOptions opts) {
            dims.add(dim);
            options.add(opts);
            LabeledArray components = LabeledArray.builder("components")
                    .dims(ModeDecomposition.MODE_DIM, "lat").shape(1, 2).values(new double[]{0.5, -0.5})
                    .coordinate(Coordinate.of("lat", -10, 10))
                    .build();
            LabeledArray scores = LabeledArray.builder("scores")
                    .dims(ModeDecomposition.MODE_DIM, dim).shape(1, da.sizeOf(dim))
                    .values(new double[]{2, -2, 2, -2})
                    .build();
            return new ModeDecomposition(components, scores, new double[]{0.25});
        }
    }

    private static LabeledArray anomalies() {
        List<CalendarDate> dates = SyntheticData.monthlyDates(2000, 1, 15, 4);
        LabeledArray grid = SyntheticData.grid("sst", dates, "lat", new double[]{-10, 10}, "lon", new double[]{0},
                (t, lat, lon) -> t % 2 == 0 ? lat : -lat);
        Coordinate lat = grid.getCoordinate("lat").withAttributes(Map.of("units", "degrees_north"));
        return grid.withCoordinate(lat).reduced(List.of("lon"), grid.getValues());
    }

    @Nested
    @DisplayName("single array")
    class SingleArray {

        @Test
        @DisplayName("patterns are scaled by the score std and carry explained variance in percent")
        void scaledPatterns() {
            FixedDecomposition service = new FixedDecomposition();
            EofAdapter adapter = new EofAdapter(service, new AxisResolver());
            LabeledArray out = adapter.eofs(anomalies(), "T", new EofOptions().setNModes(1)).get();

            assertEquals(List.of("time"), service.dims);
            assertEquals(1, service.options.get(0).getNModes());
            assertEquals("sst", out.getName());
            assertEquals(List.of(ModeDecomposition.MODE_DIM, "lat"), out.getDims());
            assertArrayEquals(new double[]{1.0, -1.0}, out.getValues(), EPS);
            assertEquals(List.of(25.0), out.getAttributes().get(EofAdapter.EXPLAINED_VARIANCE));
            assertEquals("degrees_north", out.getCoordinate("lat").getAttributes().get("units"));
        }

        @Test
        @DisplayName("service errors become DECOMPOSITION_FAILED")
        void serviceFailure() {
            ModeDecompositionService failing = (da, dim, opts) -> {
                throw new IllegalStateException("did not converge");
            };
            ProcessingResult<LabeledArray> result = new EofAdapter(failing, new AxisResolver()).eofs(anomalies(), "T");
            assertTrue(result.isFailure());
            assertEquals(FailureReason.DECOMPOSITION_FAILED, result.getReason());
            assertEquals("did not converge", result.getMessage());
        }

        @Test
        @DisplayName("unknown sample dimension fails with AXIS_NOT_FOUND")
        void unknownDimension() {
            EofAdapter adapter = new EofAdapter(new FixedDecomposition(), new AxisResolver());
            assertEquals(FailureReason.AXIS_NOT_FOUND, adapter.eofs(anomalies(), "depth").getReason());
        }
    }

    @Test
    @DisplayName("datasets skip bounds variables")
    void datasetSkipsBounds() {
        FixedDecomposition service = new FixedDecomposition();
        EofAdapter adapter = new EofAdapter(service, new AxisResolver());
        LabeledArray bounds = LabeledArray.builder("lat_bnds").dims("lat").shape(2).values(new double[]{-15, 15})
                .build();
        LabeledDataset out = adapter.eofs(LabeledDataset.of(anomalies(), bounds), "time", EofOptions.defaults()).get();
        assertEquals(List.of("sst"), out.variableNames());
        assertEquals(1, service.dims.size());
    }
}
