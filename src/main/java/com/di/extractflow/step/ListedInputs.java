package com.di.extractflow.step;

import com.di.extractflow.storage.ObjectHead;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The partition objects a step was invoked over, with their sizes at listing time.
 */
public record ListedInputs(String container, String prefix, List<ObjectHead> objects) {

    public List<String> keys() {
        return objects.stream().map(ObjectHead::key).toList();
    }

    public Map<String, Long> sizes() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        objects.forEach(o -> sizes.put(o.key(), o.sizeBytes()));
        return sizes;
    }

    public long totalBytes() {
        return objects.stream().mapToLong(ObjectHead::sizeBytes).sum();
    }
}
