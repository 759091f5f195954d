package com.di.extractflow.pipeline;

import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.step.ImagingRequest;
import com.di.extractflow.step.ParameterSet;

import java.util.List;

/**
 * The standard radio-interferometry chain: rebinning, then calibration, subtraction and
 * apply-calibration in a single step, then imaging.
 *
 * <p>All intermediates live under the run's scope. The measurement sets are rewritten in place
 * under {@code <run>/applycal_out/ms}; calibration writes one h5parm per partition, which
 * subtraction and apply-calibration read back through a dynamic input.
 */
public final class PipelineTemplates {

    public static final String MS_KEY = "applycal_out/ms";
    public static final String H5_KEY = "applycal_out/cal/h5";
    public static final String IMAGE_KEY = "applycal_out/image/image";

    private static final String STRATEGY = "parameters/rebinning/STEP1-NenuFAR64C1S.lua";
    private static final String SOURCEDB = "parameters/calibration/STEP2A-apparent.sourcedb";

    private PipelineTemplates() {}

    /** Flagging and averaging; reads the partitions from {@code partitions}. */
    public static ParameterSet rebinning(RunContext run, String container, ReferencePath partitions) {
        return ParameterSet.builder()
                .name("rebinning")
                .value("msin", partitions)
                .value("steps", "[aoflag, avg, count]")
                .value("aoflag.type", "aoflagger")
                .value("aoflag.strategy", ReferencePath.input(container, STRATEGY))
                .value("avg.type", "averager")
                .value("avg.freqstep", 4)
                .value("avg.timestep", 8)
                .value("msout", measurementSets(run, container))
                .value("numthreads", 4)
                .logOutput(ReferencePath.output(container, run.scopedKey("rebinning_out/logs"), "log"))
                .build();
    }

    public static ParameterSet calibration(RunContext run, String container) {
        return ParameterSet.builder()
                .name("calibration")
                .value("msin", ReferencePath.input(container, run.scopedKey(MS_KEY)))
                .value("msin.datacolumn", "DATA")
                .value("steps", "[cal]")
                .value("cal.type", "ddecal")
                .value("cal.mode", "diagonal")
                .value("cal.sourcedb", ReferencePath.input(container, SOURCEDB))
                .value("cal.h5parm", ReferencePath.output(container, run.scopedKey(H5_KEY), "h5"))
                .value("cal.solint", 4)
                .value("cal.nchan", 4)
                .value("cal.maxiter", 50)
                .value("cal.uvlambdamin", 5)
                .value("cal.smoothnessconstraint", 2e6)
                .value("numthreads", 4)
                .value("msout", measurementSets(run, container))
                .logOutput(ReferencePath.output(container, run.scopedKey("applycal_out/cal/logs"), "log"))
                .build();
    }

    public static ParameterSet subtraction(RunContext run, String container) {
        return ParameterSet.builder()
                .name("subtraction")
                .value("msin", ReferencePath.input(container, run.scopedKey(MS_KEY)))
                .value("msin.datacolumn", "DATA")
                .value("msout.datacolumn", "SUBTRACTED_DATA")
                .value("steps", "[sub]")
                .value("sub.type", "h5parmpredict")
                .value("sub.sourcedb", ReferencePath.input(container, SOURCEDB))
                .value("sub.directions", "[[CygA],[CasA]]")
                .value("sub.operation", "subtract")
                .value("sub.applycal.parmdb", ReferencePath.dynamicInput(container, run.scopedKey(H5_KEY), "h5"))
                .value("sub.applycal.steps", "[sub_apply_amp,sub_apply_phase]")
                .value("sub.applycal.correction", "fulljones")
                .value("sub.applycal.sub_apply_amp.correction", "amplitude000")
                .value("sub.applycal.sub_apply_phase.correction", "phase000")
                .value("msout", measurementSets(run, container))
                .logOutput(ReferencePath.output(container, run.scopedKey("applycal_out/substract/logs"), "log"))
                .build();
    }

    public static ParameterSet applyCalibration(RunContext run, String container) {
        return ParameterSet.builder()
                .name("apply-calibration")
                .value("msin", ReferencePath.input(container, run.scopedKey(MS_KEY)))
                .value("msin.datacolumn", "SUBTRACTED_DATA")
                .value("msout", measurementSets(run, container))
                .value("msout.datacolumn", "CORRECTED_DATA")
                .value("steps", "[apply]")
                .value("apply.type", "applycal")
                .value("apply.steps", "[apply_amp,apply_phase]")
                .value("apply.apply_amp.correction", "amplitude000")
                .value("apply.apply_phase.correction", "phase000")
                .value("apply.direction", "[Main]")
                .value("apply.parmdb", ReferencePath.dynamicInput(container, run.scopedKey(H5_KEY), "h5"))
                .logOutput(ReferencePath.output(container, run.scopedKey("applycal_out/apply/logs"), "log"))
                .build();
    }

    /** Rebinning as its own step, then the three calibration stages as one step. */
    public static List<PipelineStep> standardSteps(RunContext run, String container, ReferencePath partitions) {
        return List.of(
                new PipelineStep("rebinning", List.of(rebinning(run, container, partitions))),
                new PipelineStep("calibration", List.of(
                        calibration(run, container), subtraction(run, container), applyCalibration(run, container))));
    }

    public static ImagingRequest imaging(RunContext run, String container) {
        return ImagingRequest.builder()
                .input(ReferencePath.input(container, run.scopedKey(MS_KEY)))
                .outputContainer(container)
                .argument("-size").argument("1024").argument("1024")
                .argument("-pol").argument("I")
                .argument("-scale").argument("5arcmin")
                .argument("-niter").argument("100000")
                .argument("-gain").argument("0.1")
                .argument("-mgain").argument("0.6")
                .argument("-auto-mask").argument("5")
                .argument("-local-rms")
                .argument("-multiscale")
                .argument("-no-update-model-required")
                .argument("-make-psf")
                .argument("-auto-threshold").argument("3")
                .argument("-weight").argument("briggs").argument("0")
                .argument("-data-column").argument("CORRECTED_DATA")
                .argument("-nmiter").argument("0")
                .argument("-name").argument(run.scopedKey(IMAGE_KEY))
                .build();
    }

    private static ReferencePath measurementSets(RunContext run, String container) {
        return ReferencePath.output(container, run.scopedKey(MS_KEY), "ms");
    }
}
