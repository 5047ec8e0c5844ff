package com.phillippitts.mcphub.service.task;

import com.phillippitts.mcphub.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskReaperTest {

    @Test
    void reapsTasksOlderThanRetention() {
        TaskManager manager = mock(TaskManager.class);
        Instant now = Instant.parse("2026-02-01T08:00:00Z");
        Instant cutoff = now.minus(Duration.ofMinutes(60));
        when(manager.reap(cutoff)).thenReturn(3);
        TaskReaper reaper = new TaskReaper(manager, Duration.ofMinutes(60), new MutableClock(now));

        assertThat(reaper.reap()).isEqualTo(3);
        verify(manager).reap(cutoff);
    }
}
