package com.pipeline.climate.storage;

import com.pipeline.climate.array.LabeledMath;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.DatasetStorage;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.selection.BoundsSelector;
import com.pipeline.climate.selection.LongitudeRoller;
import com.pipeline.climate.stats.WeightedStatistics;
import com.pipeline.climate.stats.Weights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 规范化读取路径。
 *
 * 读取顺序：
 *   变量筛选 → 轴重命名为 time/longitude/latitude → 经度规范到 [0, 360)
 *   → 纬度升序 → 填充值置缺测 → 去除区域平均 → 范围选取 → 恒定掩码
 */
public class DatasetReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetReader.class);

    private static final Map<AxisTag, String> CANONICAL_NAMES = new EnumMap<>(AxisTag.class);

    static {
        CANONICAL_NAMES.put(AxisTag.TIME, "time");
        CANONICAL_NAMES.put(AxisTag.LONGITUDE, "longitude");
        CANONICAL_NAMES.put(AxisTag.LATITUDE, "latitude");
    }

    private final DatasetStorage storage;
    private final AxisResolver resolver;
    private final BoundsSelector selector;
    private final WeightedStatistics statistics;

    public DatasetReader(DatasetStorage storage, AxisResolver resolver) {
        this.storage = storage;
        this.resolver = resolver;
        this.selector = new BoundsSelector(resolver);
        this.statistics = new WeightedStatistics(resolver);
    }

    public ProcessingResult<LabeledDataset> read(String name, ReaderOptions options) {
        Optional<LabeledDataset> stored = storage.read(name);
        if (stored.isEmpty()) {
            return ProcessingResult.failure(FailureReason.DATASET_NOT_FOUND, "Dataset '" + name + "' not found");
        }
        LabeledDataset dataset = stored.get();

        if (!options.getVariables().isEmpty()) {
            LabeledDataset.Builder subset = LabeledDataset.builder().attributes(dataset.getAttributes());
            for (String variable : options.getVariables()) {
                if (!dataset.hasVariable(variable)) {
                    return ProcessingResult.failure(FailureReason.VARIABLE_NOT_FOUND,
                            "Variable '" + variable + "' not found in dataset '" + name + "'");
                }
                subset.variable(dataset.getVariable(variable));
            }
            dataset = subset.build();
        }

        LabeledDataset.Builder canonical = LabeledDataset.builder().attributes(dataset.getAttributes());
        for (LabeledArray variable : dataset.getVariables()) {
            canonical.variable(canonicalize(variable, options.getSentinel()));
        }
        dataset = canonical.build();
        log.info("Dataset '{}' opened: {}", name, dataset.variableNames());

        if (!options.getRegionalMeanBounds().isEmpty()) {
            ProcessingResult<LabeledDataset> removed = removeRegionalMean(dataset,
                    options.getRegionalMeanBounds(), options.isRegionalMeanSkipna());
            if (removed.isFailure()) {
                return removed;
            }
            dataset = removed.get();
        }

        if (!options.getBounds().isEmpty()) {
            ProcessingResult<LabeledDataset> selected = selector.select(dataset, options.getBounds());
            if (selected.isFailure()) {
                return selected;
            }
            dataset = selected.get();
        }

        if (options.isEnsureConstantMask()) {
            dataset = dataset.mapVariables(statistics::constantMask);
        }
        return ProcessingResult.success(dataset);
    }

    /**
     * 轴重命名、经度规范化、纬度升序和填充值处理。
     */
    LabeledArray canonicalize(LabeledArray variable, Double sentinel) {
        LabeledArray out = variable;
        for (Map.Entry<AxisTag, String> entry : CANONICAL_NAMES.entrySet()) {
            Optional<String> found = resolver.resolve(out, entry.getKey());
            if (found.isEmpty() || found.get().equals(entry.getValue())) {
                continue;
            }
            Coordinate coordinate = out.getCoordinate(found.get());
            // 只重命名与轴同名的一维坐标，曲线网格的二维坐标保持原名
            if (!coordinate.isMultiDimensional() && out.getDims().contains(found.get())
                    && out.findCoordinate(entry.getValue()).isEmpty()) {
                out = out.renameDim(found.get(), entry.getValue());
            }
        }

        Optional<String> lon = resolver.resolve(out, AxisTag.LONGITUDE);
        if (lon.isPresent()) {
            out = LongitudeRoller.normalize(out, lon.get());
        }

        Optional<String> lat = resolver.resolve(out, AxisTag.LATITUDE);
        if (lat.isPresent()) {
            Coordinate latitude = out.getCoordinate(lat.get());
            if (!latitude.isMultiDimensional() && latitude.size() > 1
                    && latitude.value(0) > latitude.value(latitude.size() - 1)) {
                int n = latitude.size();
                int[] reversed = new int[n];
                for (int i = 0; i < n; i++) {
                    reversed[i] = n - 1 - i;
                }
                out = out.isel(latitude.getDims().get(0), reversed);
            }
        }

        if (sentinel != null) {
            double fill = sentinel;
            out = out.map(v -> v == fill ? Double.NaN : v);
        }
        return out;
    }

    /**
     * 减去区域加权平均。区域范围只使用空间项，时间项被忽略。
     */
    ProcessingResult<LabeledDataset> removeRegionalMean(LabeledDataset dataset, Map<String, Object> bounds,
                                                        boolean skipna) {
        Map<String, Object> spatial = new LinkedHashMap<>(bounds);
        spatial.keySet().removeIf(key -> AxisTag.TIME.getCode().equals(key)
                || AxisTag.TIME.getCandidates().contains(key));

        LabeledDataset.Builder builder = LabeledDataset.builder().attributes(dataset.getAttributes());
        for (LabeledArray variable : dataset.getVariables()) {
            ProcessingResult<LabeledArray> region = selector.select(variable, spatial);
            if (region.isFailure()) {
                return ProcessingResult.failure(region.getReason(), region.getMessage());
            }
            ProcessingResult<LabeledArray> mean = statistics.mean(region.get(),
                    List.of(AxisTag.LONGITUDE.getCode(), AxisTag.LATITUDE.getCode()), Weights.auto(), skipna);
            if (mean.isFailure()) {
                return ProcessingResult.failure(mean.getReason(), mean.getMessage());
            }
            log.debug("Removing regional mean of '{}' over {}", variable.getName(), spatial);
            builder.variable(LabeledMath.subtract(variable, mean.get()).withName(variable.getName()));
        }
        return ProcessingResult.success(builder.build());
    }
}
