package com.phillippitts.mcphub.domain;

import java.util.Objects;

/**
 * Input of the {@code mail-sync} capability.
 *
 * @param mailbox     mailbox or label to read, e.g. {@code INBOX}
 * @param maxMessages maximum number of messages to fetch
 */
public record MailSyncRequest(String mailbox, int maxMessages) {

    public MailSyncRequest {
        Objects.requireNonNull(mailbox, "mailbox must not be null");
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive, got: " + maxMessages);
        }
    }
}
