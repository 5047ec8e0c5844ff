package com.phillippitts.mcphub.service.backend.mail;

import com.phillippitts.mcphub.domain.MailMessage;

import java.io.IOException;
import java.util.List;

/**
 * Narrow interface to an authenticated mail provider.
 *
 * <p>The OAuth credential exchange lives outside the hub; a deployment that has completed it
 * contributes an implementation of this interface as a bean.
 */
public interface MailboxClient {

    /**
     * @return true if credentials are present and not expired
     */
    boolean isAuthorized();

    /**
     * Fetches the newest messages from a mailbox.
     *
     * @param mailbox     mailbox or label name
     * @param maxMessages upper bound on returned messages
     * @return messages, newest first
     * @throws IOException if the provider cannot be reached
     */
    List<MailMessage> fetchRecent(String mailbox, int maxMessages) throws IOException;
}
