package com.pipeline.climate.model;

import com.pipeline.climate.SyntheticData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabeledArrayTest {

    private static LabeledArray sample() {
        return SyntheticData.field("ts", "lat", new double[]{-10, 0, 10}, "lon", new double[]{100, 200},
                new double[]{1, 2, 3, 4, 5, 6});
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("value count must match the shape")
        void shapeMismatch() {
            assertThrows(IllegalArgumentException.class, () -> LabeledArray.builder("x")
                    .dims("a", "b").shape(2, 2).values(new double[3]).build());
        }

        @Test
        @DisplayName("coordinate length must match its dimension")
        void coordinateMismatch() {
            assertThrows(IllegalArgumentException.class, () -> LabeledArray.builder("x")
                    .dims("a").shape(3).values(new double[3])
                    .coordinate(Coordinate.of("a", 1, 2)).build());
        }

        @Test
        @DisplayName("dimensions without a coordinate get positional labels")
        void positionalCoordinates() {
            LabeledArray a = LabeledArray.builder("x").dims("a").shape(3).values(new double[3]).build();
            Coordinate c = a.getCoordinate("a");
            assertTrue(c.isPositional());
            assertArrayEquals(new double[]{0, 1, 2}, c.getValues());
        }

        @Test
        @DisplayName("duplicate variable names are rejected by the dataset builder")
        void duplicateVariables() {
            LabeledArray a = sample();
            assertThrows(IllegalArgumentException.class, () -> LabeledDataset.builder().variable(a).variable(a).build());
        }
    }

    @Nested
    @DisplayName("transforms")
    class Transforms {

        @Test
        @DisplayName("isel picks values and coordinates together")
        void isel() {
            LabeledArray picked = sample().isel("lat", new int[]{2, 0});
            assertArrayEquals(new double[]{5, 6, 1, 2}, picked.getValues());
            assertArrayEquals(new double[]{10, -10}, picked.getCoordinate("lat").getValues());
        }

        @Test
        @DisplayName("transpose moves the listed dimensions first")
        void transpose() {
            LabeledArray t = sample().transpose(List.of("lon"));
            assertEquals(List.of("lon", "lat"), t.getDims());
            assertArrayEquals(new double[]{1, 3, 5, 2, 4, 6}, t.getValues());
        }

        @Test
        @DisplayName("renameDim renames the matching coordinate")
        void renameDim() {
            LabeledArray r = sample().renameDim("lat", "latitude");
            assertEquals(List.of("latitude", "lon"), r.getDims());
            assertTrue(r.findCoordinate("latitude").isPresent());
            assertTrue(r.findCoordinate("lat").isEmpty());
        }

        @Test
        @DisplayName("getValues returns a copy")
        void valuesAreCopied() {
            LabeledArray a = sample();
            double[] values = a.getValues();
            values[0] = 99;
            assertEquals(1.0, a.valueAt(0));
        }
    }
}
