package com.phillippitts.mcphub.service.backend.mail;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.MailBatch;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.exception.BackendExceptionBuilder;
import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * {@code mail-sync} backend delegating to an optional {@link MailboxClient}.
 * Reports unhealthy when no client is configured or it is not authorized.
 */
@Component
public class MailboxSyncBackend implements BackendAdapter<MailSyncRequest, MailBatch> {

    public static final String NAME = "mailbox-sync";

    private static final Logger LOG = LogManager.getLogger(MailboxSyncBackend.class);

    private final ObjectProvider<MailboxClient> clientProvider;

    public MailboxSyncBackend(ObjectProvider<MailboxClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String capability() {
        return Capabilities.MAIL_SYNC;
    }

    @Override
    public boolean health() {
        MailboxClient client = clientProvider.getIfAvailable();
        return client != null && client.isAuthorized();
    }

    @Override
    public MailBatch invoke(MailSyncRequest input) {
        MailboxClient client = clientProvider.getIfAvailable();
        if (client == null) {
            throw BackendExceptionBuilder.create("No mailbox client configured")
                    .backend(NAME)
                    .kind(ErrorKind.BACKEND_UNHEALTHY)
                    .build();
        }
        try {
            MailBatch batch = new MailBatch(client.fetchRecent(input.mailbox(), input.maxMessages()));
            LOG.debug("Fetched {} message(s) from mailbox {}", batch.messages().size(), input.mailbox());
            return batch;
        } catch (IOException e) {
            throw BackendExceptionBuilder.create("Mailbox fetch failed")
                    .backend(NAME)
                    .metadata("mailbox", input.mailbox())
                    .cause(e)
                    .build();
        }
    }
}
