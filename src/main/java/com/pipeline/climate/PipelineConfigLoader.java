package com.pipeline.climate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 把 pipeline.* 配置项解析为有序步骤表。
 *
 * pipeline.steps 给出步骤键及其顺序，
 * pipeline.step.&lt;键&gt;.&lt;参数&gt;[.&lt;子参数&gt;] 给出各步骤参数，点号分隔的子键生成嵌套参数表。
 * 取值按字面推断类型：true/false、整数、小数、逗号分隔列表，其余为字符串。
 */
public class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    static final String STEPS_KEY = "pipeline.steps";
    static final String STEP_PREFIX = "pipeline.step.";

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    public LinkedHashMap<String, Map<String, Object>> load(Properties props) {
        LinkedHashMap<String, Map<String, Object>> steps = new LinkedHashMap<>();
        for (String key : AppConfig.splitList(props.getProperty(STEPS_KEY, ""))) {
            steps.put(key, new LinkedHashMap<>());
        }

        // 排序后遍历，保证嵌套表的键顺序稳定
        for (String name : new TreeSet<>(props.stringPropertyNames())) {
            if (!name.startsWith(STEP_PREFIX)) {
                continue;
            }
            String rest = name.substring(STEP_PREFIX.length());
            String stepKey = matchStep(steps, rest);
            if (stepKey == null) {
                log.warn("Property '{}' does not belong to any step listed in {}, ignored.", name, STEPS_KEY);
                continue;
            }
            String path = rest.substring(stepKey.length() + 1);
            put(steps.get(stepKey), path.split("\\."), parseValue(props.getProperty(name)));
        }
        return steps;
    }

    /** 步骤键本身可能含点号，取最长匹配 */
    private static String matchStep(Map<String, ?> steps, String rest) {
        String best = null;
        for (String key : steps.keySet()) {
            if (rest.startsWith(key + ".") && (best == null || key.length() > best.length())) {
                best = key;
            }
        }
        return best;
    }

    @SuppressWarnings("unchecked")
    private static void put(Map<String, Object> target, String[] path, Object value) {
        Map<String, Object> current = target;
        for (int i = 0; i < path.length - 1; i++) {
            Object child = current.get(path[i]);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                current.put(path[i], child);
            }
            current = (Map<String, Object>) child;
        }
        current.put(path[path.length - 1], value);
    }

    static Object parseValue(String raw) {
        String text = raw.trim();
        if (text.contains(",")) {
            List<Object> items = new ArrayList<>();
            for (String part : text.split(",")) {
                items.add(parseScalar(part.trim()));
            }
            return items;
        }
        return parseScalar(text);
    }

    private static Object parseScalar(String text) {
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.valueOf(text);
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Integer.valueOf(text);
            } catch (NumberFormatException e) {
                return Long.valueOf(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        return text;
    }
}
