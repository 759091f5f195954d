package com.di.extractflow.step;

import com.di.extractflow.exception.ObjectStorageException;
import com.di.extractflow.exception.OutputKeyCollisionException;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.reference.ReferenceResolver;
import com.di.extractflow.storage.ObjectHead;
import com.di.extractflow.storage.ObjectStorageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands declarative parameter sets into one {@link ExecutionPlan} per listed partition.
 */
@Slf4j
@RequiredArgsConstructor
public class ExecutionPlanner {

    private final ObjectStorageClient storage;

    /**
     * Lists the partition objects under the first parameter set's designated input, directory
     * markers dropped, optionally capped at {@code limit}.
     */
    public ListedInputs listInputs(List<ParameterSet> parameterSets, Integer limit) {
        if (parameterSets.isEmpty()) throw new IllegalArgumentException("At least one parameter set is required");
        return listInputs(parameterSets.get(0).designatedInput(), limit);
    }

    /** Lists the objects directly addressed by {@code input} as a prefix. */
    public ListedInputs listInputs(ReferencePath input, Integer limit) {
        String prefix = ReferenceResolver.stripTrailingSlash(input.fullKey()) + "/";
        List<String> keys = storage.listKeys(input.getContainer(), prefix).stream()
                .filter(k -> !k.endsWith("/"))
                .toList();
        if (limit != null && limit > 0 && keys.size() > limit) {
            keys = keys.subList(0, limit);
        }
        if (keys.isEmpty()) {
            throw new ObjectStorageException("No inputs listed under " + input.getContainer() + "/" + prefix);
        }

        List<ObjectHead> heads = new ArrayList<>(keys.size());
        for (String key : keys) {
            heads.add(storage.head(input.getContainer(), key)
                    .orElseThrow(() -> new ObjectStorageException("Listed object vanished: " + key)));
        }
        log.info("[PLAN] listed {} input(s) under {}/{}", heads.size(), input.getContainer(), prefix);
        return new ListedInputs(input.getContainer(), prefix, heads);
    }

    /**
     * Builds one plan per partition key. Pure apart from the uniqueness check.
     *
     * @throws OutputKeyCollisionException when two partitions would upload to the same key
     */
    public List<ExecutionPlan> plan(List<ParameterSet> parameterSets, List<String> partitionKeys) {
        List<ExecutionPlan> plans = new ArrayList<>(partitionKeys.size());
        Map<String, String> ownerByOutput = new HashMap<>();

        for (int i = 0; i < partitionKeys.size(); i++) {
            String partitionKey = partitionKeys.get(i);
            List<ParameterSet> resolved = new ArrayList<>(parameterSets.size());
            for (ParameterSet ps : parameterSets) {
                ParameterSet r = ps.resolveFor(partitionKey);
                for (ReferencePath out : outputsOf(r)) {
                    String target = out.getContainer() + "/" + ReferenceResolver.uploadKey(out, false);
                    String previous = ownerByOutput.putIfAbsent(target, partitionKey);
                    if (previous != null && !previous.equals(partitionKey)) {
                        throw new OutputKeyCollisionException(target, previous, partitionKey);
                    }
                }
                resolved.add(r);
            }
            plans.add(new ExecutionPlan(i, partitionKey, ReferenceResolver.baseName(partitionKey), List.copyOf(resolved)));
        }
        log.debug("[PLAN] {} plan(s) × {} parameter set(s)", plans.size(), parameterSets.size());
        return plans;
    }

    private static List<ReferencePath> outputsOf(ParameterSet ps) {
        List<ReferencePath> outputs = new ArrayList<>();
        for (ReferencePath ref : ps.references()) {
            if (ref.isOutput()) outputs.add(ref);
        }
        if (ps.getLogOutput() != null) outputs.add(ps.getLogOutput());
        return outputs;
    }
}
