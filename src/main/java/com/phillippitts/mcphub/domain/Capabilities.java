package com.phillippitts.mcphub.domain;

/**
 * Names of the logical capabilities known to the hub.
 */
public final class Capabilities {

    public static final String TRANSCRIBE_AUDIO = "transcribe-audio";
    public static final String LLM_GENERATE = "llm-generate";
    public static final String VECTOR_SEARCH = "vector-search";
    public static final String MAIL_SYNC = "mail-sync";

    private Capabilities() {
    }
}
