package com.phillippitts.mcphub.service.backend.mock;

import com.phillippitts.mcphub.domain.Capabilities;
import com.phillippitts.mcphub.domain.MailBatch;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.service.backend.BackendAdapter;
import org.springframework.stereotype.Component;

import java.util.List;

/** Always-available mail fallback returning an empty mailbox. */
@Component
public class MockMailBackend implements BackendAdapter<MailSyncRequest, MailBatch> {

    public static final String NAME = "mock-mail";

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
        return true;
    }

    @Override
    public MailBatch invoke(MailSyncRequest input) {
        return new MailBatch(List.of());
    }
}
