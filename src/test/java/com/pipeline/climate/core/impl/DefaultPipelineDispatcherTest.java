package com.pipeline.climate.core.impl;

import com.pipeline.climate.SyntheticData;
import com.pipeline.climate.axis.AxisResolver;
import com.pipeline.climate.core.OperatorContext;
import com.pipeline.climate.core.Processor;
import com.pipeline.climate.model.CalendarDate;
import com.pipeline.climate.model.FailureReason;
import com.pipeline.climate.model.FunctionMetadata;
import com.pipeline.climate.model.LabeledArray;
import com.pipeline.climate.model.LabeledDataset;
import com.pipeline.climate.model.ProcessingResult;
import com.pipeline.climate.time.CalendarTime;
import com.pipeline.climate.time.CalendarType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultPipelineDispatcherTest {

    private DefaultFunctionManager manager;
    private DefaultPipelineDispatcher dispatcher;
    private LabeledDataset dataset;

    @BeforeEach
    void setUp() {
        manager = DefaultFunctionManager.builtin();
        dispatcher = new DefaultPipelineDispatcher(manager, new AxisResolver());

        List<CalendarDate> dates = SyntheticData.monthlyDates(2000, 1, 15, 36);
        double[] days = CalendarTime.daysSinceStart(dates, CalendarType.STANDARD);
        double[] sstValues = new double[days.length];
        double[] t2mValues = new double[days.length];
        for (int i = 0; i < days.length; i++) {
            sstValues[i] = 290 + 0.01 * days[i];
            t2mValues[i] = -0.02 * days[i];
        }
        LabeledArray sst = SyntheticData.monthlySeries("sst", dates, sstValues).withAttribute("units", "K");
        LabeledArray t2m = SyntheticData.monthlySeries("t2m", dates, t2mValues);
        LabeledArray bounds = LabeledArray.builder("time_bnds").dims("time", "nv").shape(36, 2)
                .values(new double[72]).build();
        dataset = LabeledDataset.builder()
                .variable(sst).variable(t2m).variable(bounds)
                .attribute("source", "synthetic")
                .build();
    }

    private static LinkedHashMap<String, Map<String, Object>> steps(Object... keysAndParams) {
        LinkedHashMap<String, Map<String, Object>> steps = new LinkedHashMap<>();
        for (int i = 0; i < keysAndParams.length; i += 2) {
            @SuppressWarnings("unchecked")
            Map<String, Object> params = (Map<String, Object>) keysAndParams[i + 1];
            steps.put((String) keysAndParams[i], params);
        }
        return steps;
    }

    @Nested
    @DisplayName("variable selection")
    class VariableSelection {

        @Test
        @DisplayName("bounds variables are left out by default")
        void defaultSelection() {
            assertEquals(List.of("sst", "t2m"), DefaultPipelineDispatcher.selectVariables(dataset, null));
            assertEquals(List.of("t2m"), DefaultPipelineDispatcher.selectVariables(dataset, List.of("t2m")));
        }

        @Test
        @DisplayName("no steps returns the selected variables with dataset attributes")
        void noSteps() {
            LabeledDataset out = dispatcher.apply(dataset, null, List.of("sst")).get();
            assertEquals(List.of("sst"), out.variableNames());
            assertEquals("synthetic", out.getAttributes().get("source"));
        }

        @Test
        @DisplayName("missing variables fail with VARIABLE_NOT_FOUND")
        void missingVariable() {
            ProcessingResult<LabeledDataset> result = dispatcher.apply(dataset, steps(), List.of("precip"));
            assertEquals(FailureReason.VARIABLE_NOT_FOUND, result.getReason());
        }
    }

    @Nested
    @DisplayName("steps")
    class Steps {

        @Test
        @DisplayName("steps run in order on every variable and keep variable names")
        void orderedSteps() {
            LabeledDataset out = dispatcher.apply(dataset, steps(
                    "01--netcdf_selector", Map.of("bounds", Map.of("T", List.of("2000-01-01", "2001-12-31"))),
                    "02--detrend", Map.of("deg", 1),
                    "03--average", Map.of("dim", "T")), null).get();
            assertEquals(List.of("sst", "t2m"), out.variableNames());
            for (LabeledArray variable : out.getVariables()) {
                assertEquals(0, variable.rank());
                assertEquals(0.0, variable.valueAt(0), 1e-6);
            }
            assertEquals("K", out.getVariable("sst").getAttributes().get("units"));
        }

        @Test
        @DisplayName("unknown operators are skipped")
        void unknownOperatorSkipped() {
            LabeledDataset out = dispatcher.apply(dataset, steps(
                    "01--smooth_everything", Map.of(),
                    "02--average", Map.of("dim", "T")), List.of("t2m")).get();
            assertEquals(0, out.getVariable("t2m").rank());
        }

        @Test
        @DisplayName("invalid parameters halt with INVALID_ARGUMENT")
        void invalidParameters() {
            ProcessingResult<LabeledDataset> result = dispatcher.apply(dataset, steps(
                    "season_mean", Map.of("season", "XYZ")), null);
            assertEquals(FailureReason.INVALID_ARGUMENT, result.getReason());
        }

        @Test
        @DisplayName("the first failing step halts with its own reason")
        void haltsOnFailure() {
            List<String> seen = new ArrayList<>();
            manager.registerFunction("record", new Processor<Void>() {
                @Override
                public FunctionMetadata getMetadata() {
                    return new FunctionMetadata("record", "record", "records calls", Collections.emptyList());
                }

                @Override
                public Void configure(OperatorContext context) {
                    return null;
                }

                @Override
                public ProcessingResult<LabeledArray> process(LabeledArray variable, Void config,
                                                              OperatorContext context) {
                    seen.add(variable.getName());
                    return ProcessingResult.success(variable);
                }
            });
            ProcessingResult<LabeledDataset> result = dispatcher.apply(dataset, steps(
                    "01--netcdf_selector", Map.of("bounds", Map.of("T", List.of("1900-01-01", "1901-12-31"))),
                    "02--record", Map.of()), null);
            assertTrue(result.isFailure());
            assertEquals(FailureReason.EMPTY_SELECTION, result.getReason());
            assertTrue(seen.isEmpty());
        }
    }
}
