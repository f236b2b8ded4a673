package com.pipeline.climate.time;

import com.pipeline.climate.model.CalendarDate;

import java.util.List;

/**
 * 日历相关的时间换算工具。
 *
 * 提供按日历计算每月天数（月长权重）、年内小数时间以及日期间隔天数的纯函数，
 * 供加权平均、多项式去趋势和绘图时间轴使用。
 */
public final class CalendarTime {

    private static final int[] MONTH_DAYS = {31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};

    /** standard / gregorian 日历从该年起采用格里高利闰年规则 */
    private static final int GREGORIAN_SWITCH_YEAR = 1583;

    private static final double SECONDS_PER_DAY = 86400.0;

    private CalendarTime() {}

    /**
     * 判断给定年份在指定日历中是否为闰年。
     */
    public static boolean isLeapYear(int year, CalendarType calendar) {
        switch (calendar) {
            case NOLEAP:
            case DAY_365:
            case DAY_360:
                return false;
            case ALL_LEAP:
            case DAY_366:
                return true;
            case JULIAN:
                return Math.floorMod(year, 4) == 0;
            case PROLEPTIC_GREGORIAN:
                return gregorianLeap(year);
            case STANDARD:
            case GREGORIAN:
            default:
                return year < GREGORIAN_SWITCH_YEAR ? Math.floorMod(year, 4) == 0 : gregorianLeap(year);
        }
    }

    private static boolean gregorianLeap(int year) {
        return Math.floorMod(year, 4) == 0 && (Math.floorMod(year, 100) != 0 || Math.floorMod(year, 400) == 0);
    }

    /**
     * 指定日历下某年某月的天数。
     */
    public static int daysInMonth(int year, int month, CalendarType calendar) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (calendar == CalendarType.DAY_360) {
            return 30;
        }
        int days = MONTH_DAYS[month - 1];
        if (month == 2 && isLeapYear(year, calendar)) {
            days++;
        }
        return days;
    }

    public static int daysInYear(int year, CalendarType calendar) {
        if (calendar == CalendarType.DAY_360) {
            return 360;
        }
        return isLeapYear(year, calendar) ? 366 : 365;
    }

    /**
     * 时间轴上每个时间步所在月份的天数，用作时间平均的权重。
     *
     * @param dates    时间轴
     * @param calendar 日历类型
     * @return 与时间轴等长的月长数组
     */
    public static double[] daysPerMonth(List<CalendarDate> dates, CalendarType calendar) {
        double[] lengths = new double[dates.size()];
        for (int i = 0; i < lengths.length; i++) {
            CalendarDate d = dates.get(i);
            lengths[i] = daysInMonth(d.getYear(), d.getMonth(), calendar);
        }
        return lengths;
    }

    /**
     * 年内序日（从0开始），含日内小数部分。
     */
    public static double dayOfYear(CalendarDate date, CalendarType calendar) {
        double days = 0;
        for (int m = 1; m < date.getMonth(); m++) {
            days += daysInMonth(date.getYear(), m, calendar);
        }
        days += date.getDay() - 1;
        days += (date.getHour() * 3600.0 + date.getMinute() * 60.0 + date.getSecond()) / SECONDS_PER_DAY;
        return days;
    }

    /**
     * 将时间轴转换为“年 + 年内已过时间比例”的小数年，用于绘图横轴。
     */
    public static double[] fractionalYear(List<CalendarDate> dates, CalendarType calendar) {
        double[] result = new double[dates.size()];
        for (int i = 0; i < result.length; i++) {
            CalendarDate d = dates.get(i);
            result[i] = d.getYear() + dayOfYear(d, calendar) / daysInYear(d.getYear(), calendar);
        }
        return result;
    }

    /**
     * 计算从参考日期到目标日期经过的天数（可为负，含日内小数）。
     */
    public static double daysSince(CalendarDate reference, CalendarDate date, CalendarType calendar) {
        double days = dayOfYear(date, calendar) - dayOfYear(reference, calendar);
        int from = Math.min(reference.getYear(), date.getYear());
        int to = Math.max(reference.getYear(), date.getYear());
        double between = 0;
        for (int y = from; y < to; y++) {
            between += daysInYear(y, calendar);
        }
        return date.getYear() >= reference.getYear() ? days + between : days - between;
    }

    /**
     * 整条时间轴相对首个时间步的天数。
     */
    public static double[] daysSinceStart(List<CalendarDate> dates, CalendarType calendar) {
        double[] result = new double[dates.size()];
        if (dates.isEmpty()) {
            return result;
        }
        CalendarDate origin = dates.get(0);
        for (int i = 0; i < result.length; i++) {
            result[i] = daysSince(origin, dates.get(i), calendar);
        }
        return result;
    }
}
