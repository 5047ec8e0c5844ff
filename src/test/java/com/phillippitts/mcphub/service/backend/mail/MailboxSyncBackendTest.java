package com.phillippitts.mcphub.service.backend.mail;

import com.phillippitts.mcphub.domain.MailBatch;
import com.phillippitts.mcphub.domain.MailMessage;
import com.phillippitts.mcphub.domain.MailSyncRequest;
import com.phillippitts.mcphub.exception.BackendException;
import com.phillippitts.mcphub.exception.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MailboxSyncBackendTest {

    @SuppressWarnings("unchecked")
    private static MailboxSyncBackend backendWith(MailboxClient client) {
        ObjectProvider<MailboxClient> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(client);
        return new MailboxSyncBackend(provider);
    }

    @Test
    void unhealthyWithoutClient() {
        MailboxSyncBackend backend = backendWith(null);

        assertThat(backend.health()).isFalse();
        assertThatThrownBy(() -> backend.invoke(new MailSyncRequest("INBOX", 5)))
                .isInstanceOf(BackendException.class)
                .extracting(e -> ((BackendException) e).getKind())
                .isEqualTo(ErrorKind.BACKEND_UNHEALTHY);
    }

    @Test
    void healthFollowsAuthorization() {
        MailboxClient client = mock(MailboxClient.class);
        when(client.isAuthorized()).thenReturn(false, true);
        MailboxSyncBackend backend = backendWith(client);

        assertThat(backend.health()).isFalse();
        assertThat(backend.health()).isTrue();
    }

    @Test
    void invokeWrapsFetchedMessages() throws IOException {
        MailMessage m = new MailMessage("1", "ann@example.com", "Hi", "body", Instant.parse("2026-01-01T00:00:00Z"));
        MailboxClient client = mock(MailboxClient.class);
        when(client.fetchRecent("Work", 3)).thenReturn(List.of(m));

        MailBatch batch = backendWith(client).invoke(new MailSyncRequest("Work", 3));

        assertThat(batch.messages()).containsExactly(m);
    }

    @Test
    void fetchFailureBecomesBackendException() throws IOException {
        MailboxClient client = mock(MailboxClient.class);
        when(client.fetchRecent("INBOX", 10)).thenThrow(new IOException("token expired"));

        assertThatThrownBy(() -> backendWith(client).invoke(new MailSyncRequest("INBOX", 10)))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("Mailbox fetch failed")
                .hasMessageContaining("mailbox=INBOX")
                .hasCauseInstanceOf(IOException.class);
    }
}
