package com.pipeline.climate.model;

/**
 * 软失败原因。算子无法继续时返回带原因的失败结果，而不是抛出异常。
 */
public enum FailureReason {
    /** 所需的轴在数据中无法解析 */
    AXIS_NOT_FOUND,
    /** 参数非法（类型错误、取值越界、未知枚举值） */
    INVALID_ARGUMENT,
    /** 两个数组沿回归轴对齐后没有公共部分 */
    ALIGNMENT_FAILED,
    /** 请求的变量不在数据集中 */
    VARIABLE_NOT_FOUND,
    /** 存储中没有请求的数据集 */
    DATASET_NOT_FOUND,
    /** 选择结果为空 */
    EMPTY_SELECTION,
    /** 外部模态分解服务失败 */
    DECOMPOSITION_FAILED
}
