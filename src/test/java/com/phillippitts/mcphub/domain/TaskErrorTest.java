package com.phillippitts.mcphub.domain;

import com.phillippitts.mcphub.exception.ErrorKind;
import com.phillippitts.mcphub.exception.MissingStateKeyException;
import com.phillippitts.mcphub.exception.TaskCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskErrorTest {

    @Test
    void applicationExceptionsKeepTheirKind() {
        TaskError error = TaskError.from(new MissingStateKeyException("meeting.transcript", "summarize"));

        assertThat(error.kind()).isEqualTo(ErrorKind.MISSING_STATE_KEY);
        assertThat(error.message()).contains("meeting.transcript").contains("summarize");
    }

    @Test
    void otherExceptionsAreExecutionErrors() {
        assertThat(TaskError.from(new IllegalArgumentException("bad input")))
                .isEqualTo(new TaskError(ErrorKind.EXECUTION_ERROR, "bad input"));
        assertThat(TaskError.from(new NullPointerException()).message()).isEqualTo("NullPointerException");
    }

    @Test
    void cancellationMapsToCancelled() {
        assertThat(TaskError.from(new TaskCancelledException("t-1")).kind()).isEqualTo(ErrorKind.CANCELLED);
    }

    @Test
    void nullMessageDefaultsToKindName() {
        assertThat(new TaskError(ErrorKind.TIMEOUT, null).message()).isEqualTo("TIMEOUT");
    }

    @Test
    void snapshotRejectsResultTogetherWithError() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");

        assertThatThrownBy(() -> new TaskSnapshot("t", "graph:x", Map.of(), TaskStatus.FAILED, "r",
                new TaskError(ErrorKind.EXECUTION_ERROR, "x"), now, now, now))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new TaskSnapshot("t", "graph:x", null, TaskStatus.PENDING, null, null, now, null, null).payload())
                .isEmpty();
    }

    @Test
    void noneTokenNeverCancels() {
        CancellationToken.NONE.throwIfCancelled();

        assertThat(CancellationToken.NONE.isCancellationRequested()).isFalse();
    }
}
