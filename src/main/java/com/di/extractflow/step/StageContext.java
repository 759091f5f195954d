package com.di.extractflow.step;

import com.di.extractflow.profiling.FunctionTimer;
import com.di.extractflow.profiling.ProcessScope;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Worker-local state shared by the stages of one partition.
 *
 * <p>Artifacts uploaded by an earlier stage are remembered by {@code container/key}, so a later
 * stage that reads them gets the local copy instead of downloading it again.
 */
@Getter
public class StageContext {

    private final Path workDir;
    private final Map<String, String> env;
    private final ProcessScope scope;
    private final List<FunctionTimer> timers = new ArrayList<>();
    private final Map<String, Path> artifacts = new HashMap<>();

    public StageContext(Path workDir, Map<String, String> env, ProcessScope scope) {
        this.workDir = workDir;
        this.env = env;
        this.scope = scope;
    }

    public void rememberArtifact(String container, String key, Path local) {
        artifacts.put(container + "/" + key, local);
    }

    public Optional<Path> artifact(String container, String key) {
        return Optional.ofNullable(artifacts.get(container + "/" + key));
    }
}
