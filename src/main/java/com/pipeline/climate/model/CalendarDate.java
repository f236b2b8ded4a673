package com.pipeline.climate.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 与日历无关的日期时间值。
 *
 * 只保存年、月、日、时、分、秒六个字段，不做任何日历换算，
 * 因此可以表示 360_day 等非公历日历中的日期（如 2月30日）。
 * 比较按字段从年到秒依次进行。
 */
public final class CalendarDate implements Comparable<CalendarDate>, Serializable {

    private static final Pattern SEPARATORS = Pattern.compile("[- :T]");

    private final int year;
    private final int month;
    private final int day;
    private final int hour;
    private final int minute;
    private final int second;

    public CalendarDate(int year, int month, int day) {
        this(year, month, day, 0, 0, 0);
    }

    public CalendarDate(int year, int month, int day, int hour, int minute, int second) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (day < 1 || day > 31) {
            throw new IllegalArgumentException("Day out of range: " + day);
        }
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
    }

    /**
     * 解析 "YYYY-MM-DD[ hh:mm:ss]" 形式的日期字符串，缺省字段补为起始值。
     */
    public static CalendarDate parse(String text) {
        int[] parsed = parseFields(text);
        int[] full = {0, 1, 1, 0, 0, 0};
        System.arraycopy(parsed, 0, full, 0, Math.min(parsed.length, full.length));
        return new CalendarDate(full[0], full[1], full[2], full[3], full[4], full[5]);
    }

    /**
     * 将日期字符串按 '-'、' '、':' 拆分为数值字段，保留原始精度（字段个数）。
     * 秒字段允许带小数，取整数部分。
     */
    public static int[] parseFields(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Date text must not be blank");
        }
        String trimmed = text.trim();
        // 负年份
        boolean negativeYear = trimmed.startsWith("-");
        if (negativeYear) {
            trimmed = trimmed.substring(1);
        }
        String[] parts = SEPARATORS.split(trimmed);
        int[] fields = new int[Math.min(parts.length, 6)];
        for (int i = 0; i < fields.length; i++) {
            try {
                fields[i] = (int) Math.floor(Double.parseDouble(parts[i]));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Cannot parse date '" + text + "'", e);
            }
        }
        if (negativeYear && fields.length > 0) {
            fields[0] = -fields[0];
        }
        return fields;
    }

    public int getYear() { return year; }
    public int getMonth() { return month; }
    public int getDay() { return day; }
    public int getHour() { return hour; }
    public int getMinute() { return minute; }
    public int getSecond() { return second; }

    public int[] fields() {
        return new int[]{year, month, day, hour, minute, second};
    }

    /**
     * 与一个按字段给出的界限比较，只比较界限所具有的字段。
     * 例如界限 "2014-12" 只比较年和月。
     *
     * @return 负数表示本日期早于界限，0 表示在界限精度内相等，正数表示晚于界限
     */
    public int compareToBound(int[] boundFields) {
        int[] own = fields();
        int n = Math.min(own.length, boundFields.length);
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(own[i], boundFields[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    public CalendarDate withYear(int newYear) {
        return new CalendarDate(newYear, month, day, hour, minute, second);
    }

    @Override
    public int compareTo(CalendarDate other) {
        return compareToBound(other.fields());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalendarDate)) return false;
        return Arrays.equals(fields(), ((CalendarDate) o).fields());
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day, hour, minute, second);
    }

    @Override
    public String toString() {
        String date = String.format("%04d-%02d-%02d", year, month, day);
        if (hour == 0 && minute == 0 && second == 0) {
            return date;
        }
        return date + String.format(" %02d:%02d:%02d", hour, minute, second);
    }
}
