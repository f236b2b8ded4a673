package com.pipeline.climate.stats;

import java.util.Optional;

/**
 * 回归斜率显著性检验的备择假设。
 */
public enum Alternative {
    /** 斜率大于零 */
    GREATER("greater"),
    /** 斜率小于零 */
    LESS("less"),
    /** 斜率不为零 */
    TWO_SIDED("two-sided");

    private final String label;

    Alternative(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static Optional<Alternative> fromLabel(String label) {
        for (Alternative a : values()) {
            if (a.label.equals(label)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }
}
