package com.pipeline.climate;

import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.PipelineDispatcher;
import com.pipeline.climate.core.impl.DefaultFunctionManager;
import com.pipeline.climate.core.impl.DefaultPipelineDispatcher;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.storage.DatasetReader;
import com.pipeline.climate.storage.ReaderOptions;
import com.pipeline.climate.storage.SQLiteDatasetStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 系统启动引导类。
 * 创建存储、注册算子、读取输入数据集、执行处理管道并写出结果。
 *
 * 用法：java -jar climate-processing.jar [配置文件路径]
 */
public class ProcessingApplication {

    private static final Logger log = LoggerFactory.getLogger(ProcessingApplication.class);

    private AppConfig config;
    private SQLiteDatasetStorage storage;
    private DatasetReader reader;
    private PipelineDispatcher dispatcher;

    public void start(AppConfig config) {
        log.info("=== Climate Data Processing ===");
        log.info("Starting with config: {}", config);
        this.config = config;

        // 1. 初始化存储层
        storage = new SQLiteDatasetStorage(config.getStorageRoot(), config.getDefaultCalendar());

        // 2. 轴解析与读取路径
        AxisResolver resolver = new AxisResolver(config.getAxisSeverity());
        reader = new DatasetReader(storage, resolver);

        // 3. 注册预置算子并组装调度器
        DefaultFunctionManager functionManager = DefaultFunctionManager.builtin();
        log.info("Registered {} built-in operators.", functionManager.getAllFunctions().size());
        dispatcher = new DefaultPipelineDispatcher(functionManager, resolver);
    }

    /**
     * 读取输入数据集，执行配置的管道，写出输出数据集。
     */
    public ProcessingResult<LabeledDataset> run() {
        if (config.getPipelineInput() == null || config.getPipelineOutput() == null) {
            return ProcessingResult.failure(FailureReason.INVALID_ARGUMENT,
                    "pipeline.input and pipeline.output must be configured");
        }
        ReaderOptions options = ReaderOptions.defaults()
                .setVariables(config.getPipelineVariables())
                .setSentinel(config.getSentinel(config.getPipelineInput()))
                .setEnsureConstantMask(config.isEnsureConstantMask());
        ProcessingResult<LabeledDataset> input = reader.read(config.getPipelineInput(), options);
        if (input.isFailure()) {
            log.error("Cannot read input dataset '{}': {}", config.getPipelineInput(), input.getMessage());
            return input;
        }

        LinkedHashMap<String, Map<String, Object>> steps = new PipelineConfigLoader().load(config.getProperties());
        log.info("Applying {} step(s) to '{}': {}", steps.size(), config.getPipelineInput(), steps.keySet());
        ProcessingResult<LabeledDataset> output = dispatcher.apply(input.get(), steps, config.getPipelineVariables());
        if (output.isFailure()) {
            log.error("Pipeline failed: {} {}", output.getReason(), output.getMessage());
            return output;
        }

        storage.write(config.getPipelineOutput(), output.get());
        log.info("Output dataset '{}' written: {}", config.getPipelineOutput(), output.get().variableNames());
        return output;
    }

    public void shutdown() {
        if (storage != null) {
            storage.shutdown();
            storage = null;
        }
        log.info("=== Climate Data Processing shut down ===");
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/application.properties";

        AppConfig config = AppConfig.load(configPath);
        ProcessingApplication app = new ProcessingApplication();
        try {
            app.start(config);
            app.run();
        } finally {
            app.shutdown();
        }
    }
}
