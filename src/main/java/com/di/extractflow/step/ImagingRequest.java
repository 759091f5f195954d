package com.di.extractflow.step;

import com.di.extractflow.reference.ReferencePath;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A single-invocation imaging run over every partition under {@link #input}.
 *
 * <p>{@link #arguments} must contain {@code -name <key>}; the key is relative to
 * {@link #outputContainer} and is rewritten to a local path before the binary runs.
 */
@Value
@Builder
public class ImagingRequest {

    @Builder.Default
    String stepName = "imaging";

    @Builder.Default
    String binary = "wsclean";

    ReferencePath input;

    String outputContainer;

    @Singular
    List<String> arguments;
}
