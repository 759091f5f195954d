package com.di.extractflow.step;

import com.di.extractflow.exception.MissingParameterException;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.reference.ReferenceResolver;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative configuration of one stage: which binary to run and the ordered parameter map it is
 * given. Values are literals, {@link ReferencePath}s, or nested groups ({@code Map<String, Object>})
 * that serialize as {@code [section]} blocks.
 */
@Value
@Builder(toBuilder = true)
public class ParameterSet {

    String name;

    /** Executable invoked as {@code binary <parset> [override=value ...]}. */
    @Builder.Default
    String binary = "DP3";

    /** Parameter holding the designated input; the step lists its partitions from there. */
    @Builder.Default
    String inputName = "msin";

    @Singular("value")
    Map<String, Object> values;

    /** Where captured stdout/stderr is uploaded; null keeps it in the worker log only. */
    ReferencePath logOutput;

    @Singular
    List<String> overrides;

    public ReferencePath designatedInput() {
        Object value = values.get(inputName);
        if (value instanceof ReferencePath ref && ref.isInput()) {
            return ref;
        }
        throw new MissingParameterException(name, inputName);
    }

    public List<ReferencePath> references() {
        return ReferenceResolver.references(values);
    }

    /** This parameter set with every reference resolved for the partition stored at {@code partitionKey}. */
    public ParameterSet resolveFor(String partitionKey) {
        ParameterSet.ParameterSetBuilder builder = toBuilder()
                .clearValues()
                .values(ReferenceResolver.resolveValues(values, inputName, partitionKey));
        if (logOutput != null) {
            builder.logOutput(ReferenceResolver.rekey(logOutput, ReferenceResolver.baseName(partitionKey)));
        }
        return builder.build();
    }

    /** Same parameters reading their designated input from {@code input}. */
    public ParameterSet withDesignatedInput(ReferencePath input) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(inputName, input);
        return withValues(copy);
    }

    /** Same parameters with the given values replaced. */
    public ParameterSet withValues(Map<String, Object> newValues) {
        return toBuilder().clearValues().values(newValues).build();
    }
}
