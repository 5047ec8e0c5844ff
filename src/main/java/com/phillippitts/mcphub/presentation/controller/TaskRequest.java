package com.phillippitts.mcphub.presentation.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * Body of {@code POST /api/tasks} and {@code POST /api/tasks/run}.
 *
 * @param kind      {@code graph:<name>}, {@code component:<name>} or {@code capability:<name>}
 * @param payload   task input, may be omitted
 * @param timeoutMs synchronous runs only; defaults to {@code mcp.tasks.default-sync-timeout-ms}
 */
record TaskRequest(@NotBlank String kind, Map<String, Object> payload, @Positive Long timeoutMs) {

    Map<String, Object> payloadOrEmpty() {
        return payload == null ? Map.of() : payload;
    }
}
