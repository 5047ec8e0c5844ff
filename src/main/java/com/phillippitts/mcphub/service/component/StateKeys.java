package com.phillippitts.mcphub.service.component;

/**
 * Pipeline state keys shared by the built-in components and graph configuration.
 */
public final class StateKeys {

    public static final String AUDIO_PATH = "meeting.audio_path";
    public static final String LANGUAGE = "meeting.language";
    public static final String TRANSCRIPT = "meeting.transcript";
    public static final String SUMMARY = "meeting.summary";
    public static final String ACTION_ITEMS = "meeting.action_items";
    public static final String PARTICIPANTS = "meeting.participants";
    public static final String HAS_ACTION_ITEMS = "meeting.has_action_items";
    public static final String FOLLOWUP_DRAFT = "meeting.followup_draft";

    public static final String MAILBOX = "email.mailbox";
    public static final String MAX_MESSAGES = "email.max_messages";
    public static final String MESSAGES = "email.messages";
    public static final String HAS_MESSAGES = "email.has_messages";
    public static final String REPLY_DRAFT = "email.reply_draft";

    public static final String RETRIEVAL_QUERY = "retrieval.query";
    public static final String TOP_K = "retrieval.top_k";
    public static final String CONTEXT_HITS = "context.hits";
    public static final String HAS_CONTEXT = "context.has_hits";

    public static final String QUESTION = "chat.question";
    public static final String ANSWER = "chat.answer";

    private StateKeys() {
    }
}
