package com.di.extractflow.pipeline;

import com.di.extractflow.reference.ReferenceKind;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.step.ImagingRequest;
import com.di.extractflow.step.ParameterSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineTemplates Tests")
class PipelineTemplatesTest {

    private static final RunContext RUN = new RunContext("r1");

    @Test
    @DisplayName("Rebinning then a three-stage calibration step")
    void testStandardSteps() {
        List<PipelineStep> steps = PipelineTemplates.standardSteps(RUN, "extract", ReferencePath.input("extract", "partitions/x"));

        assertEquals(List.of("rebinning", "calibration"), steps.stream().map(PipelineStep::name).toList());
        assertEquals(List.of("calibration", "subtraction", "apply-calibration"),
                steps.get(1).parameterSets().stream().map(ParameterSet::getName).toList());
    }

    @Test
    @DisplayName("Every written key lives under the run scope")
    void testRunScope() {
        for (PipelineStep step : PipelineTemplates.standardSteps(RUN, "extract", ReferencePath.input("extract", "p"))) {
            for (ParameterSet ps : step.parameterSets()) {
                ps.references().stream()
                        .filter(ReferencePath::isOutput)
                        .forEach(out -> assertTrue(out.getKey().startsWith("r1/"), out.toString()));
                assertTrue(ps.getLogOutput().getKey().startsWith("r1/"));
            }
        }
    }

    @Test
    @DisplayName("Calibration solutions are read back per partition")
    void testDynamicH5() {
        ParameterSet apply = PipelineTemplates.applyCalibration(RUN, "extract");

        ReferencePath parmdb = (ReferencePath) apply.getValues().get("apply.parmdb");
        assertEquals(ReferenceKind.DYNAMIC_INPUT, parmdb.getKind());
        assertEquals("r1/" + PipelineTemplates.H5_KEY, parmdb.getKey());

        ParameterSet resolved = apply.resolveFor("r1/applycal_out/ms/partition_2.ms.zip");
        assertEquals("r1/applycal_out/cal/h5/partition_2.h5",
                ((ReferencePath) resolved.getValues().get("apply.parmdb")).fullKey());
    }

    @Test
    @DisplayName("Imaging names its output under the run scope")
    void testImaging() {
        ImagingRequest request = PipelineTemplates.imaging(RUN, "extract");

        List<String> args = request.getArguments();
        assertEquals("r1/" + PipelineTemplates.IMAGE_KEY, args.get(args.indexOf("-name") + 1));
        assertEquals("r1/" + PipelineTemplates.MS_KEY, request.getInput().getKey());
    }
}
