package com.linlay.agentengine.tool;

/**
 * Outcome of one tool dispatch. A failed tool is a normal result, not an exception; the loop
 * feeds it back to the model as an observation.
 */
public record ToolResult(
        boolean success,
        String output,
        Object data,
        String error,
        long executionTimeMs
) {

    public ToolResult {
        output = output == null ? "" : output;
    }

    public static ToolResult success(String output) {
        return new ToolResult(true, output, null, null, 0L);
    }

    public static ToolResult success(String output, Object data) {
        return new ToolResult(true, output, data, null, 0L);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, "", null, error, 0L);
    }

    public static ToolResult failure(String output, String error) {
        return new ToolResult(false, output, null, error, 0L);
    }

    public ToolResult withExecutionTime(long millis) {
        return new ToolResult(success, output, data, error, millis);
    }

    /**
     * Text handed back to the model as the tool message.
     */
    public String observation() {
        if (success) {
            return output;
        }
        return "Error: " + (error != null ? error : output);
    }
}
