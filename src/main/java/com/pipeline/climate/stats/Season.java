package com.pipeline.climate.stats;

import java.util.Optional;

/**
 * 三个月组成的季节，以中间月份标识。
 */
public enum Season {
    DJF(1), JFM(2), FMA(3), MAM(4), AMJ(5), MJJ(6), JJA(7), JAS(8), ASO(9), SON(10), OND(11), NDJ(12);

    private final int centerMonth;

    Season(int centerMonth) {
        this.centerMonth = centerMonth;
    }

    /** 三个月滑动平均后代表该季节的中间月份 */
    public int getCenterMonth() { return centerMonth; }

    public static Optional<Season> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (Season s : values()) {
            if (s.name().equalsIgnoreCase(code.trim())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
