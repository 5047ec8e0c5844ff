package com.phillippitts.mcphub.domain;

import java.util.List;

/**
 * Output of the {@code mail-sync} capability, newest message first.
 */
public record MailBatch(List<MailMessage> messages) {

    public MailBatch {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
