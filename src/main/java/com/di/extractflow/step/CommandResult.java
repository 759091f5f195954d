package com.di.extractflow.step;

public record CommandResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
