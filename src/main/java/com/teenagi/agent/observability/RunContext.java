package com.teenagi.agent.observability;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run measurements: token usage, and latency of each function call.
 * Created at the start of a {@code respond} call and only logged at the end.
 *
 * Kept apart from AgentContext, which holds the conversation itself.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<FunctionCallRecord> functionCallRecords = new ArrayList<>();

    private int promptTokens;
    private int completionTokens;

    public void recordFunctionCall(String functionName, long latencyMs, boolean failed) {
        functionCallRecords.add(new FunctionCallRecord(functionName, latencyMs, failed));
    }

    public void addTokens(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public long failedCalls() {
        return functionCallRecords.stream().filter(FunctionCallRecord::failed).count();
    }

    public record FunctionCallRecord(
            String functionName,
            long latencyMs,
            boolean failed
    ) {}
}
