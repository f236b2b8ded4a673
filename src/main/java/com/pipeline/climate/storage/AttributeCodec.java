package com.pipeline.climate.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * 属性值与 (类型, 文本) 之间的转换。数值列表以逗号分隔，其他对象按字符串保存。
 */
final class AttributeCodec {

    static final String STRING = "string";
    static final String INTEGER = "integer";
    static final String NUMBER = "number";
    static final String BOOLEAN = "boolean";
    static final String NUMBERS = "numbers";

    private AttributeCodec() {}

    static String typeOf(Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof List && ((List<?>) value).stream().allMatch(v -> v instanceof Number)) {
            return NUMBERS;
        }
        return STRING;
    }

    static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (NUMBERS.equals(typeOf(value))) {
            StringBuilder sb = new StringBuilder();
            for (Object item : (List<?>) value) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(((Number) item).doubleValue());
            }
            return sb.toString();
        }
        return String.valueOf(value);
    }

    static Object parse(String type, String text) {
        if (text == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return Long.parseLong(text);
            case NUMBER:
                return Double.parseDouble(text);
            case BOOLEAN:
                return Boolean.parseBoolean(text);
            case NUMBERS:
                List<Double> values = new ArrayList<>();
                if (!text.isEmpty()) {
                    for (String part : text.split(",")) {
                        values.add(Double.parseDouble(part));
                    }
                }
                return values;
            default:
                return text;
        }
    }
}
