package com.pipeline.climate.eof;

import com.pipeline.climate.model.LabeledArray;

/**
 * 外部模态分解能力（经验正交函数）。
 *
 * 数值求解不在本项目内实现，由调用方注入具体实现。
 * 实现在无法完成分解时抛出运行时异常。
 */
public interface ModeDecompositionService {

    /**
     * 沿 dim 对数组做模态分解。
     *
     * @param da      输入数组
     * @param dim     样本轴（通常为时间轴）的实际名称
     * @param options 模态数、是否按 cos(纬度) 加权及附加参数
     * @return 分解结果
     */
    ModeDecomposition decompose(LabeledArray da, String dim, EofOptions options);
}
