package com.pipeline.climate.core;

import com.pipeline.climate.axis.AxisResolver;

import java.util.List;
import java.util.Map;

/**
 * 算子上下文接口 —— 算子与系统交互的唯一桥梁。
 *
 * 为算子提供步骤参数和共享服务，算子无需感知配置来源或注册表。
 */
public interface OperatorContext {

    /** 步骤键，例如 "3--season_mean" */
    String getStepKey();

    /** 注册的算子名 */
    String getOperatorName();

    /**
     * 获取指定名称的算子参数，支持泛型类型安全转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在时的默认值，同时用于推断返回类型
     * @param <T>          参数值类型
     * @return 参数值；参数不存在或类型不匹配时返回defaultValue
     */
    <T> T getParameter(String paramName, T defaultValue);

    /**
     * 获取字符串列表参数。单个字符串视为单元素列表。
     */
    List<String> getStringList(String paramName, List<String> defaultValue);

    /**
     * 获取嵌套参数表（例如 kwargs_mean_weighted），不存在时返回空表。
     */
    Map<String, Object> getSection(String paramName);

    /**
     * 获取嵌套参数表中的参数，类型转换规则同 {@link #getParameter}。
     */
    <T> T getSectionParameter(String sectionName, String paramName, T defaultValue);

    /** 共享的轴解析器 */
    AxisResolver getAxisResolver();
}
