package com.pipeline.climate.eof;

import com.pipeline.climate.array.LabeledMath;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.model.AxisTag;
import com.pipeline.climate.model.Coordinate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.stats.WeightedStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 经验正交函数适配器。
 *
 * 调用外部分解服务，再把每个模态的空间型乘以对应时间系数的标准差，
 * 使空间型带有物理单位；各模态解释方差（百分比列表）写入元数据 explained_variance。
 */
public class EofAdapter {

    private static final Logger log = LoggerFactory.getLogger(EofAdapter.class);

    public static final String EXPLAINED_VARIANCE = "explained_variance";

    private final ModeDecompositionService service;
    private final AxisResolver resolver;
    private final WeightedStatistics statistics;

    public EofAdapter(ModeDecompositionService service, AxisResolver resolver) {
        this.service = service;
        this.resolver = resolver;
        this.statistics = new WeightedStatistics(resolver);
    }

    public ProcessingResult<LabeledArray> eofs(LabeledArray da, String dim) {
        return eofs(da, dim, EofOptions.defaults());
    }

    public ProcessingResult<LabeledArray> eofs(LabeledArray da, String dim, EofOptions options) {
        Optional<String> resolved = AxisTag.fromCode(dim).isPresent()
                ? resolver.resolve(da, AxisTag.fromCode(dim).get())
                : Optional.ofNullable(dim).filter(da.getDims()::contains);
        if (resolved.isEmpty()) {
            return ProcessingResult.failure(FailureReason.AXIS_NOT_FOUND,
                    "Cannot decompose '" + da.getName() + "' along '" + dim + "'");
        }
        String sampleDim = resolved.get();

        ModeDecomposition decomposition;
        try {
            decomposition = service.decompose(da, sampleDim, options);
        } catch (RuntimeException e) {
            log.error("Mode decomposition of '{}' along '{}' failed: {}", da.getName(), sampleDim, e.getMessage(), e);
            return ProcessingResult.failure(FailureReason.DECOMPOSITION_FAILED, e.getMessage());
        }

        return statistics.std(decomposition.getScores(), sampleDim, 0, true).map(scoresStd -> {
            LabeledArray scaled = LabeledMath.multiply(decomposition.getComponents(), scoresStd);
            List<Double> percent = new ArrayList<>();
            for (double ratio : decomposition.getExplainedVarianceRatio()) {
                percent.add(ratio * 100);
            }
            Map<String, Object> attrs = new LinkedHashMap<>(scaled.getAttributes());
            attrs.put(EXPLAINED_VARIANCE, percent);
            LabeledArray out = scaled.withName(da.getName()).withAttributes(attrs);
            // 与输入同名的轴坐标沿用输入坐标的元数据
            for (String d : da.getDims()) {
                Optional<Coordinate> target = out.findCoordinate(d);
                Optional<Coordinate> source = da.findCoordinate(d);
                if (target.isPresent() && source.isPresent() && !source.get().getAttributes().isEmpty()) {
                    Map<String, Object> merged = new LinkedHashMap<>(target.get().getAttributes());
                    merged.putAll(source.get().getAttributes());
                    out = out.withCoordinate(target.get().withAttributes(merged));
                }
            }
            return out;
        });
    }

    /**
     * 对数据集的每个变量分解，名称含 _bounds / _bnds 的变量跳过。
     */
    public ProcessingResult<LabeledDataset> eofs(LabeledDataset ds, String dim, EofOptions options) {
        LabeledDataset.Builder out = LabeledDataset.builder().attributes(ds.getAttributes());
        for (LabeledArray variable : ds.getVariables()) {
            if (variable.getName().contains("_bounds") || variable.getName().contains("_bnds")) {
                continue;
            }
            ProcessingResult<LabeledArray> result = eofs(variable, dim, options);
            if (result.isFailure()) {
                return ProcessingResult.failure(result.getReason(), result.getMessage());
            }
            out.variable(result.get());
        }
        return ProcessingResult.success(out.build());
    }
}
