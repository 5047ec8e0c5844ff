package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.CompletionRequest;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.domain.SearchRequest;
import com.phillippitts.mcphub.domain.TranscriptionRequest;
import com.phillippitts.mcphub.exception.MissingStateKeyException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Converts a JSON-style task payload into the typed input of a capability.
 * Capabilities without a typed input receive the payload map as is.
 */
final class CapabilityPayloads {

    private CapabilityPayloads() {
    }

    static Object toInput(String capability, Map<String, Object> payload) {
        return switch (capability) {
            case Capabilities.TRANSCRIBE_AUDIO -> new TranscriptionRequest(
                    Path.of(required(payload, "audioPath")), optional(payload, "language", null));
            case Capabilities.LLM_GENERATE -> new CompletionRequest(
                    required(payload, "prompt"),
                    intValue(payload, "maxTokens", 1024),
                    doubleValue(payload, "temperature", 0.2));
            case Capabilities.VECTOR_SEARCH -> new SearchRequest(
                    required(payload, "query"), intValue(payload, "topK", 4));
            case Capabilities.MAIL_SYNC -> new MailSyncRequest(
                    optional(payload, "mailbox", "INBOX"), intValue(payload, "maxMessages", 10));
            default -> payload;
        };
    }

    private static String required(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        if (v == null || v.toString().isBlank()) {
            throw new MissingStateKeyException(key);
        }
        return v.toString();
    }

    private static String optional(Map<String, Object> payload, String key, String dflt) {
        Object v = payload.get(key);
        return v == null || v.toString().isBlank() ? dflt : v.toString();
    }

    private static int intValue(Map<String, Object> payload, String key, int dflt) {
        Object v = payload.get(key);
        if (v == null) {
            return dflt;
        }
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString().strip());
    }

    private static double doubleValue(Map<String, Object> payload, String key, double dflt) {
        Object v = payload.get(key);
        if (v == null) {
            return dflt;
        }
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString().strip());
    }
}
