package com.pipeline.climate.time;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.model.CalendarDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalendarTimeTest {

    @Nested
    @DisplayName("isLeapYear()")
    class LeapYears {

        @ParameterizedTest(name = "{0} in {1} -> {2}")
        @CsvSource({
                "2000, STANDARD, true",
                "1900, STANDARD, false",
                "1500, STANDARD, true",
                "1500, PROLEPTIC_GREGORIAN, false",
                "1900, JULIAN, true",
                "2000, NOLEAP, false",
                "2001, ALL_LEAP, true",
                "2000, DAY_360, false"
        })
        void leapRule(int year, CalendarType calendar, boolean leap) {
            assertEquals(leap, CalendarTime.isLeapYear(year, calendar));
        }
    }

    @Nested
    @DisplayName("month lengths")
    class MonthLengths {

        @Test
        @DisplayName("February follows the calendar")
        void february() {
            assertEquals(29, CalendarTime.daysInMonth(2000, 2, CalendarType.STANDARD));
            assertEquals(28, CalendarTime.daysInMonth(2000, 2, CalendarType.NOLEAP));
            assertEquals(30, CalendarTime.daysInMonth(2000, 2, CalendarType.DAY_360));
        }

        @Test
        @DisplayName("daysPerMonth gives one weight per time step")
        void daysPerMonth() {
            List<CalendarDate> dates = SyntheticData.monthlyDates(2001, 1, 15, 3);
            assertArrayEquals(new double[]{31, 28, 31}, CalendarTime.daysPerMonth(dates, CalendarType.STANDARD));
        }

        @Test
        @DisplayName("month out of range is rejected")
        void invalidMonth() {
            assertThrows(IllegalArgumentException.class, () -> CalendarTime.daysInMonth(2001, 13, CalendarType.STANDARD));
        }
    }

    @Nested
    @DisplayName("elapsed time")
    class Elapsed {

        @Test
        @DisplayName("daysSince spans a whole year per calendar")
        void daysSinceYear() {
            CalendarDate from = new CalendarDate(2000, 1, 1);
            CalendarDate to = new CalendarDate(2001, 1, 1);
            assertEquals(366.0, CalendarTime.daysSince(from, to, CalendarType.STANDARD), 1e-12);
            assertEquals(365.0, CalendarTime.daysSince(from, to, CalendarType.NOLEAP), 1e-12);
            assertEquals(360.0, CalendarTime.daysSince(from, to, CalendarType.DAY_360), 1e-12);
            assertEquals(-366.0, CalendarTime.daysSince(to, from, CalendarType.STANDARD), 1e-12);
        }

        @Test
        @DisplayName("fractionalYear counts elapsed days within the year")
        void fractionalYear() {
            double[] fy = CalendarTime.fractionalYear(
                    List.of(new CalendarDate(2001, 1, 1), new CalendarDate(2001, 7, 2, 12, 0, 0)),
                    CalendarType.STANDARD);
            assertEquals(2001.0, fy[0], 1e-12);
            assertEquals(2001 + 182.5 / 365, fy[1], 1e-12);
        }

        @Test
        @DisplayName("daysSinceStart is relative to the first step")
        void daysSinceStart() {
            List<CalendarDate> dates = SyntheticData.monthlyDates(2001, 1, 1, 3);
            assertArrayEquals(new double[]{0, 31, 59}, CalendarTime.daysSinceStart(dates, CalendarType.STANDARD), 1e-12);
        }
    }

    @Test
    @DisplayName("unknown calendar name falls back to standard")
    void calendarFromName() {
        assertEquals(CalendarType.NOLEAP, CalendarType.fromName("noleap"));
        assertEquals(CalendarType.DAY_360, CalendarType.fromName("360_day"));
        assertEquals(CalendarType.STANDARD, CalendarType.fromName("martian"));
    }
}
