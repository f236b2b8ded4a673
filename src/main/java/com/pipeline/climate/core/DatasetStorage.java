package com.pipeline.climate.core;

import com.pipeline.climate.model.LabeledDataset;

import java.util.List;
import java.util.Optional;

/**
 * 数据集存储接口 —— 处理管道的输入与输出落地层。
 */
public interface DatasetStorage {

    /**
     * 写入数据集，同名数据集被整体替换。
     *
     * @param name    数据集名称
     * @param dataset 数据集
     */
    void write(String name, LabeledDataset dataset);

    /**
     * 读取数据集。
     *
     * @param name 数据集名称
     * @return 数据集；不存在或读取失败时返回空
     */
    Optional<LabeledDataset> read(String name);

    /**
     * 删除数据集。
     *
     * @return 是否删除了已存在的数据集
     */
    boolean delete(String name);

    /** 已存储的数据集名称，按字典序排列 */
    List<String> listDatasets();

    /** 关闭存储，释放连接 */
    void shutdown();
}
