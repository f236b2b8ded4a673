package com.pipeline.climate.core;

import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 管道调度器接口。按插入顺序对数据集的选中变量依次执行各步骤。
 */
public interface PipelineDispatcher {

    /**
     * 执行处理管道。
     *
     * @param dataset   输入数据集
     * @param steps     有序步骤表："&lt;顺序标记&gt;--&lt;算子名&gt;" → 参数表
     * @param variables 要处理的变量；null 或空表示除边界变量外的全部变量
     * @return 只包含选中变量的输出数据集；首个失败的步骤终止管道
     */
    ProcessingResult<LabeledDataset> apply(LabeledDataset dataset,
                                           LinkedHashMap<String, Map<String, Object>> steps,
                                           List<String> variables);
}
