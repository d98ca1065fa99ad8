package com.growpad.core.llm;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.growpad.core.model.StageId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-run record of every generation call, written as {@code generation-trace.json} at export.
 */
public class GenerationTrace {

    private static final int SUMMARY_LIMIT = 240;

    private final List<Call> calls = new ArrayList<>();

    public synchronized void record(String function, StageId stage, String argsSummary,
                                    String responseSummary, long latencyMs, String error) {
        calls.add(new Call("call_" + (calls.size() + 1), Instant.now(), function, stage,
                abbreviate(argsSummary), abbreviate(responseSummary), latencyMs, error));
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    static String abbreviate(String text) {
        if (text == null) {
            return null;
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= SUMMARY_LIMIT ? flat : flat.substring(0, SUMMARY_LIMIT - 3) + "...";
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Call(
        String id,
        Instant timestamp,
        String function,
        StageId stage,
        String argsSummary,
        String responseSummary,
        long latencyMs,
        String error
    ) {}
}
