package com.pipeline.climate.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CF 约定中的日历类型。
 *
 * 日历决定每月天数和闰年规则，进而影响按月长加权的时间平均。
 */
public enum CalendarType {
    STANDARD("standard"),
    GREGORIAN("gregorian"),
    PROLEPTIC_GREGORIAN("proleptic_gregorian"),
    JULIAN("julian"),
    NOLEAP("noleap"),
    DAY_365("365_day"),
    ALL_LEAP("all_leap"),
    DAY_366("366_day"),
    DAY_360("360_day");

    private static final Logger log = LoggerFactory.getLogger(CalendarType.class);

    private final String cfName;

    CalendarType(String cfName) {
        this.cfName = cfName;
    }

    public String getCfName() { return cfName; }

    /**
     * 按 CF 名称解析日历，大小写不敏感。
     * 无法识别的名称按 standard 处理并记录警告。
     */
    public static CalendarType fromName(String name) {
        if (name == null || name.isBlank()) {
            return STANDARD;
        }
        String normalized = name.trim().toLowerCase();
        for (CalendarType type : values()) {
            if (type.cfName.equals(normalized)) {
                return type;
            }
        }
        log.warn("Unknown calendar '{}', falling back to '{}'", name, STANDARD.cfName);
        return STANDARD;
    }

    @Override
    public String toString() {
        return cfName;
    }
}
