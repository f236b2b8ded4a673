package com.pipeline.climate.selection;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.model.LabeledArray;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LongitudeRollerTest {

    @Test
    @DisplayName("wrap folds values into [lonMin, lonMin + 360)")
    void wrap() {
        assertEquals(350.0, LongitudeRoller.wrap(-10, 0));
        assertEquals(10.0, LongitudeRoller.wrap(370, 0));
        assertEquals(0.0, LongitudeRoller.wrap(360, 0));
        assertEquals(-70.0, LongitudeRoller.wrap(290, -70));
    }

    @Test
    @DisplayName("normalize turns a -180..180 grid into ascending 0..360 with data following")
    void normalize() {
        double[] lons = SyntheticData.range(-180, 90, 4);
        LabeledArray field = SyntheticData.field("v", "lat", new double[]{0}, "lon", lons,
                new double[]{-180, -90, 0, 90});
        LabeledArray out = LongitudeRoller.normalize(field, "lon");
        assertArrayEquals(new double[]{0, 90, 180, 270}, out.getCoordinate("lon").getValues());
        assertArrayEquals(new double[]{0, 90, -180, -90}, out.getValues());
    }

    @Test
    @DisplayName("an already normalized grid is returned as is")
    void alreadyNormalized() {
        LabeledArray field = SyntheticData.field("v", "lat", new double[]{0}, "lon", new double[]{0, 120, 240},
                new double[]{1, 2, 3});
        LabeledArray out = LongitudeRoller.normalize(field, "lon");
        assertArrayEquals(new double[]{1, 2, 3}, out.getValues());
        assertArrayEquals(new double[]{0, 120, 240}, out.getCoordinate("lon").getValues());
    }
}
