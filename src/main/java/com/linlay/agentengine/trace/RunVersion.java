package com.linlay.agentengine.trace;

/**
 * Versioning metadata of a run: the prompt version it ran with, the ordinal of the memory
 * snapshot it produced and that snapshot's hash, composed as {@code prompt.memory.hash}.
 */
public record RunVersion(
        Integer promptVersion,
        Integer memoryNumber,
        String memoryHash,
        String agentVersion
) {

    public static RunVersion ofPrompt(Integer promptVersion) {
        return new RunVersion(promptVersion, null, null, null);
    }
}
