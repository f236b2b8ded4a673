package com.pipeline.climate.storage;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.time.CalendarType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteDatasetStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteDatasetStorage storage;

    @BeforeEach
    void setUp() {
        storage = new SQLiteDatasetStorage(tempDir.toString());
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private static LabeledDataset sample() {
        List<CalendarDate> dates = List.of(new CalendarDate(2001, 2, 30), new CalendarDate(2001, 3, 30, 12, 0, 0));
        LabeledArray sst = LabeledArray.builder("sst")
                .dims("time", "lat", "lon").shape(2, 2, 1)
                .values(new double[]{1.5, Double.NaN, -3, 4})
                .coordinate(Coordinate.time("time", dates, CalendarType.DAY_360))
                .coordinate(Coordinate.of("lat", -5, 5).withAttributes(Map.of("units", "degrees_north")))
                .coordinate(Coordinate.of("lon", 120))
                .attribute("units", "K")
                .attribute("missing_count", 1)
                .attribute("scale", 0.5)
                .attribute("valid", true)
                .attribute("explained_variance", List.of(60.0, 25.5))
                .build();
        LabeledArray index = LabeledArray.builder("index").dims("ens").shape(3)
                .values(new double[]{7, 8, 9}).build();
        return LabeledDataset.builder()
                .variable(sst).variable(index)
                .attribute("title", "synthetic")
                .build();
    }

    @Nested
    @DisplayName("write and read")
    class WriteRead {

        @Test
        @DisplayName("values, coordinates and calendars survive storage")
        void valuesAndCoordinates() {
            storage.write("sample", sample());
            LabeledDataset ds = storage.read("sample").orElseThrow();

            assertEquals(List.of("sst", "index"), ds.variableNames());
            LabeledArray sst = ds.getVariable("sst");
            assertEquals(List.of("time", "lat", "lon"), sst.getDims());
            assertArrayEquals(new int[]{2, 2, 1}, sst.getShape());
            double[] v = sst.getValues();
            assertEquals(1.5, v[0]);
            assertTrue(Double.isNaN(v[1]));

            Coordinate time = sst.getCoordinate("time");
            assertEquals(CalendarType.DAY_360, time.getCalendar());
            assertEquals(new CalendarDate(2001, 2, 30), time.getDates().get(0));
            assertEquals(new CalendarDate(2001, 3, 30, 12, 0, 0), time.getDates().get(1));
            assertEquals("degrees_north", sst.getCoordinate("lat").getAttributes().get("units"));

            assertTrue(ds.getVariable("index").getCoordinate("ens").isPositional());
        }

        @Test
        @DisplayName("attribute types are restored")
        void attributeTypes() {
            storage.write("sample", sample());
            LabeledDataset ds = storage.read("sample").orElseThrow();
            Map<String, Object> attrs = ds.getVariable("sst").getAttributes();
            assertEquals("K", attrs.get("units"));
            assertEquals(1L, attrs.get("missing_count"));
            assertEquals(0.5, attrs.get("scale"));
            assertEquals(Boolean.TRUE, attrs.get("valid"));
            assertEquals(List.of(60.0, 25.5), attrs.get("explained_variance"));
            assertEquals(List.of("units", "missing_count", "scale", "valid", "explained_variance"),
                    List.copyOf(attrs.keySet()));
            assertEquals("synthetic", ds.getAttributes().get("title"));
        }

        @Test
        @DisplayName("scalar variables are stored without dimensions")
        void scalar() {
            LabeledArray mean = LabeledArray.builder("mean").dims(List.of()).shape().values(new double[]{2.5}).build();
            storage.write("scalar", LabeledDataset.of(mean));
            LabeledArray read = storage.read("scalar").orElseThrow().getVariable("mean");
            assertEquals(0, read.rank());
            assertEquals(2.5, read.valueAt(0));
        }

        @Test
        @DisplayName("writing the same name replaces the dataset")
        void overwrite() {
            storage.write("sample", sample());
            LabeledArray only = SyntheticData.monthlySeries("nino", SyntheticData.monthlyDates(2000, 1, 15, 3),
                    new double[]{1, 2, 3});
            storage.write("sample", LabeledDataset.of(only));
            LabeledDataset ds = storage.read("sample").orElseThrow();
            assertEquals(List.of("nino"), ds.variableNames());
            assertTrue(ds.getAttributes().isEmpty());
        }

        @Test
        @DisplayName("datasets persist across storage instances")
        void persistence() {
            storage.write("sample", sample());
            storage.shutdown();
            SQLiteDatasetStorage reopened = new SQLiteDatasetStorage(tempDir.toString());
            try {
                assertTrue(reopened.read("sample").isPresent());
            } finally {
                reopened.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("management")
    class Management {

        @Test
        @DisplayName("missing datasets read as empty")
        void missing() {
            assertEquals(Optional.empty(), storage.read("nothing"));
        }

        @Test
        @DisplayName("datasets are listed by name and can be deleted")
        void listAndDelete() {
            storage.write("zeta", sample());
            storage.write("alpha", sample());
            assertEquals(List.of("alpha", "zeta"), storage.listDatasets());
            assertTrue(storage.delete("zeta"));
            assertFalse(storage.delete("zeta"));
            assertEquals(List.of("alpha"), storage.listDatasets());
        }

        @Test
        @DisplayName("blank names are rejected")
        void blankName() {
            assertThrows(IllegalArgumentException.class, () -> storage.write(" ", sample()));
        }
    }

    @Test
    @DisplayName("value blobs are little-endian doubles")
    void blobLayout() {
        byte[] bytes = SQLiteDatasetStorage.encode(new double[]{1.0});
        assertEquals(8, bytes.length);
        assertEquals((byte) 0x3f, bytes[7]);
        assertEquals((byte) 0xf0, bytes[6]);
        assertTrue(Double.isNaN(SQLiteDatasetStorage.decode(SQLiteDatasetStorage.encode(new double[]{Double.NaN}))[0]));
    }
}
