package com.pipeline.climate.core;

import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.ProcessingResult;

/**
 * 统一算子接口 —— 所有气候数据处理算子的基础契约。
 *
 * 算子是处理逻辑的最小执行单元，作用于数据集中的单个变量。
 * 多个算子按配置顺序串联组成处理管道，每个选中的变量依次流经各算子。
 *
 * 算子生命周期：
 *   configure → process（每个变量一次）
 *
 * 实现约定：
 * - 算子实例在注册表中共享，不得持有可变状态，所有步骤参数放在配置对象 C 中
 * - 可恢复的失败以 {@link ProcessingResult#failure} 返回，不抛出异常
 *
 * @param <C> 算子的类型化配置
 */
public interface Processor<C> {

    /**
     * 返回算子的元数据信息，用于参数校验和算子发现。
     */
    FunctionMetadata getMetadata();

    /**
     * 从步骤参数中解析出类型化配置，缺失的参数取默认值。
     */
    C configure(OperatorContext context);

    /**
     * 对单个变量执行处理。
     *
     * @param variable 输入变量
     * @param config   {@link #configure} 返回的配置
     * @param context  算子上下文
     * @return 处理后的变量，或携带失败原因的结果
     */
    ProcessingResult<LabeledArray> process(LabeledArray variable, C config, OperatorContext context);
}
