package com.pipeline.climate.core;

import com.pipeline.climate.model.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 算子管理器接口 —— 系统的算子注册表。
 *
 * 负责算子的注册、查询和参数验证。注册在管道运行前完成，运行期间注册表只读。
 */
public interface FunctionManager {

    /**
     * 注册一个算子。重复注册将返回false。
     *
     * @param name      算子注册名
     * @param processor 算子实例
     * @return 注册是否成功
     */
    boolean registerFunction(String name, Processor<?> processor);

    /**
     * 获取指定算子实例。
     *
     * @param name 算子注册名
     * @return 算子实例；未找到返回null
     */
    Processor<?> getFunction(String name);

    /**
     * 获取全部已注册的算子名，按字典序排列。
     */
    Set<String> getFunctionNames();

    /**
     * 获取所有已注册的算子。
     */
    List<Processor<?>> getAllFunctions();

    /**
     * 验证指定算子是否已注册及其参数是否合规。
     *
     * 校验内容包括：
     * - 算子是否已注册
     * - 必选参数是否缺失
     * - 参数类型是否匹配
     * - 数值参数是否在合法范围内
     * - 枚举参数是否为合法选项
     * - 嵌套参数表递归校验
     *
     * @param name       算子注册名
     * @param parameters 待验证的参数集合
     * @return 详细的验证结果
     */
    ValidationResult validateFunction(String name, Map<String, Object> parameters);
}
