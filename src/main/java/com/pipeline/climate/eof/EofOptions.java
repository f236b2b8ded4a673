package com.pipeline.climate.eof;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 经验正交函数分解的选项。extra 中的键值原样转交给分解服务。
 */
public class EofOptions {
    private int nModes = 1;
    private boolean useCoslat = true;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    public EofOptions() {}

    public static EofOptions defaults() {
        return new EofOptions();
    }

    public int getNModes() { return nModes; }
    public EofOptions setNModes(int nModes) { this.nModes = nModes; return this; }
    public boolean isUseCoslat() { return useCoslat; }
    public EofOptions setUseCoslat(boolean useCoslat) { this.useCoslat = useCoslat; return this; }
    public Map<String, Object> getExtra() { return Collections.unmodifiableMap(extra); }
    public EofOptions putExtra(String key, Object value) { this.extra.put(key, value); return this; }

    @Override
    public String toString() {
        return "EofOptions{nModes=" + nModes + ", useCoslat=" + useCoslat + ", extra=" + extra + "}";
    }
}
