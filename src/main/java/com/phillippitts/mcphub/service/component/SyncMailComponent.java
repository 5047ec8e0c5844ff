package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.MailBatch;
import com.phillippitts.mcphub.domain.MailMessage;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.service.graph.ExecutionContext;
import com.phillippitts.mcphub.service.graph.PipelineState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fetches recent mail. When a message is found, seeds {@code retrieval.query} from the newest
 * one so a later retrieval step can look up related context.
 */
@Component
public class SyncMailComponent extends AbstractComponent {

    public static final String NAME = "sync_mail";

    static final String DEFAULT_MAILBOX = "INBOX";
    static final int DEFAULT_MAX_MESSAGES = 10;

    public SyncMailComponent() {
        super(NAME, Set.of(StateKeys.MESSAGES, StateKeys.HAS_MESSAGES), Set.of(Capabilities.MAIL_SYNC));
    }

    @Override
    public Map<String, Object> run(PipelineState state, ExecutionContext ctx) {
        String mailbox = optionalString(state, StateKeys.MAILBOX, DEFAULT_MAILBOX);
        int max = optionalInt(state, StateKeys.MAX_MESSAGES, DEFAULT_MAX_MESSAGES);
        MailBatch batch = ctx.<MailBatch>invoke(Capabilities.MAIL_SYNC, new MailSyncRequest(mailbox, max)).output();
        List<MailMessage> messages = batch.messages();

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(StateKeys.MESSAGES, messages);
        update.put(StateKeys.HAS_MESSAGES, !messages.isEmpty());
        if (!messages.isEmpty() && !state.contains(StateKeys.RETRIEVAL_QUERY)) {
            MailMessage newest = messages.get(0);
            update.put(StateKeys.RETRIEVAL_QUERY, newest.subject() + "\n" + nullToEmpty(newest.body()));
        }
        return update;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
