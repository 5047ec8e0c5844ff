package com.phillippitts.mcphub.domain;

import java.time.Instant;

/**
 * A fetched mail message.
 */
public record MailMessage(String id, String from, String subject, String body, Instant receivedAt) {
}
