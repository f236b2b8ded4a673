package com.pipeline.climate.model;

import java.util.List;
import java.util.Optional;

/**
 * 带坐标标签的数据对象（单个数组或数据集）的公共视图，供轴解析使用。
 */
public interface Labeled {

    /** 全部坐标名称，按登记顺序 */
    List<String> coordinateNames();

    /** 全部轴名称，按出现顺序 */
    List<String> dimensionNames();

    Optional<Coordinate> findCoordinate(String name);

    default boolean hasDimension(String dim) {
        return dimensionNames().contains(dim);
    }
}
