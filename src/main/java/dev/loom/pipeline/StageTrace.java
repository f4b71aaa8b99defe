package dev.loom.pipeline;

/**
 * Counts and timing of one pipeline stage.
 *
 * @param stage stage name, e.g. {@code threshold}
 * @param inputCount candidates entering the stage
 * @param outputCount candidates leaving the stage
 * @param millis wall-clock time spent in the stage
 */
public record StageTrace(String stage, int inputCount, int outputCount, long millis) {}
