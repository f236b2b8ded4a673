package com.pipeline.climate.storage;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.DatasetStorage;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class DatasetReaderTest {

    /** 内存存储 */
    private static class InMemoryStorage implements DatasetStorage {
        private final Map<String, LabeledDataset> datasets = new TreeMap<>();

        @Override
        public void write(String name, LabeledDataset dataset) {
            datasets.put(name, dataset);
        }

        @Override
        public Optional<LabeledDataset> read(String name) {
            return Optional.ofNullable(datasets.get(name));
        }

        @Override
        public boolean delete(String name) {
            return datasets.remove(name) != null;
        }

        @Override
        public List<String> listDatasets() {
            return new ArrayList<>(datasets.keySet());
        }

        @Override
        public void shutdown() {
        }
    }

    private InMemoryStorage storage;
    private DatasetReader reader;
    private List<CalendarDate> dates;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        reader = new DatasetReader(storage, new AxisResolver());
        dates = SyntheticData.monthlyDates(2000, 1, 15, 24);
        // 纬度降序、经度 -180..90，值编码经度
        LabeledArray sst = SyntheticData.grid("sst", dates, "lat", new double[]{10, 0, -10}, "lon",
                new double[]{-180, -90, 0, 90}, (t, lat, lon) -> t == 0 && lat == 10 && lon == 0 ? -1000 : lon);
        LabeledArray other = sst.withName("t2m");
        storage.write("hadisst", LabeledDataset.builder().variable(sst).variable(other)
                .attribute("source", "synthetic").build());
    }

    @Nested
    @DisplayName("opening")
    class Opening {

        @Test
        @DisplayName("axes are renamed, longitudes normalized and latitudes ascending")
        void canonicalAxes() {
            LabeledDataset ds = reader.read("hadisst", ReaderOptions.defaults()).get();
            LabeledArray sst = ds.getVariable("sst");
            assertEquals(List.of("time", "latitude", "longitude"), sst.getDims());
            assertArrayEquals(new double[]{-10, 0, 10}, sst.getCoordinate("latitude").getValues());
            assertArrayEquals(new double[]{0, 90, 180, 270}, sst.getCoordinate("longitude").getValues());
            // 第一个格点现在是 (lat -10, lon 0)
            assertEquals(0.0, sst.valueAt(0));
            assertEquals(-180.0, sst.valueAt(2));
            assertEquals("synthetic", ds.getAttributes().get("source"));
        }

        @Test
        @DisplayName("the sentinel fill value becomes missing")
        void sentinel() {
            LabeledArray sst = reader.read("hadisst", ReaderOptions.defaults().setSentinel(-1000.0)).get()
                    .getVariable("sst");
            // t = 0, lat 10 (最后一行), lon 0 (第一列)
            assertTrue(Double.isNaN(sst.valueAt(2 * 4)));
            LabeledArray raw = reader.read("hadisst", ReaderOptions.defaults()).get().getVariable("sst");
            assertEquals(-1000.0, raw.valueAt(2 * 4));
        }

        @Test
        @DisplayName("variables can be subset and missing ones fail")
        void variableSubset() {
            LabeledDataset ds = reader.read("hadisst", ReaderOptions.defaults().setVariables(List.of("t2m"))).get();
            assertEquals(List.of("t2m"), ds.variableNames());
            ProcessingResult<LabeledDataset> missing = reader.read("hadisst",
                    ReaderOptions.defaults().setVariables(List.of("precip")));
            assertEquals(FailureReason.VARIABLE_NOT_FOUND, missing.getReason());
        }

        @Test
        @DisplayName("unknown datasets fail with DATASET_NOT_FOUND")
        void missingDataset() {
            assertEquals(FailureReason.DATASET_NOT_FOUND,
                    reader.read("ersst", ReaderOptions.defaults()).getReason());
        }
    }

    @Nested
    @DisplayName("post-processing")
    class PostProcessing {

        @Test
        @DisplayName("bounds are applied in canonical coordinates")
        void bounds() {
            Map<String, Object> bounds = new LinkedHashMap<>();
            bounds.put("T", List.of("2000-01-01", "2000-12-31"));
            bounds.put("X", List.of(-90, 0));
            LabeledArray sst = reader.read("hadisst", ReaderOptions.defaults().setBounds(bounds)).get()
                    .getVariable("sst");
            assertEquals(12, sst.sizeOf("time"));
            assertArrayEquals(new double[]{-90, 0}, sst.getCoordinate("longitude").getValues());
        }

        @Test
        @DisplayName("the regional mean is removed using spatial bounds only")
        void regionalMean() {
            Map<String, Object> region = new LinkedHashMap<>();
            region.put("T", List.of("2000-06-01", "2000-06-30"));
            region.put("X", List.of(0, 180));
            LabeledArray sst = reader.read("hadisst", ReaderOptions.defaults()
                    .setVariables(List.of("t2m")).setRegionalMeanBounds(region)).get().getVariable("t2m");
            // 0..180 的平均为 (0 + 90 + -180) / 3 = -30，时间轴保持完整；取第二个时间步避开填充值
            assertEquals(24, sst.sizeOf("time"));
            assertEquals(30.0, sst.valueAt(12 + 4), 1e-12);
            assertEquals(-150.0, sst.valueAt(12 + 4 + 2), 1e-12);
        }

        @Test
        @DisplayName("constant masks blank points missing at any time")
        void constantMask() {
            LabeledArray sst = reader.read("hadisst", ReaderOptions.defaults()
                    .setSentinel(-1000.0).setEnsureConstantMask(true)).get().getVariable("sst");
            int points = 3 * 4;
            for (int t = 0; t < dates.size(); t++) {
                assertTrue(Double.isNaN(sst.valueAt(t * points + 8)));
                assertFalse(Double.isNaN(sst.valueAt(t * points + 9)));
            }
        }
    }
}
