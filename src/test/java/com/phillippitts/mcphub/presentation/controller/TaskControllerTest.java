package com.phillippitts.mcphub.presentation.controller;

import com.phillippitts.mcphub.domain.TaskSnapshot;
import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.exception.AllBackendsFailedException;
import com.phillippitts.mcphub.exception.TaskNotFoundException;
import com.phillippitts.mcphub.exception.TaskTimeoutException;
import com.phillippitts.mcphub.exception.UnknownTaskKindException;
import com.phillippitts.mcphub.service.task.TaskManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    private static final Instant CREATED = Instant.parse("2026-04-01T10:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private TaskManager taskManager;

    private static TaskSnapshot snapshot(String id, TaskStatus status) {
        return new TaskSnapshot(id, "graph:knowledge-qa", Map.of(), status, null, null, CREATED, null, null);
    }

    @Test
    void submitReturns202WithTaskId() throws Exception {
        when(taskManager.submit(eq("graph:knowledge-qa"), anyMap())).thenReturn("t-42");

        mvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"graph:knowledge-qa\",\"payload\":{\"chat.question\":\"Who owns billing?\"}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value("t-42"))
                .andExpect(header().exists("X-Request-ID"));

        verify(taskManager).submit("graph:knowledge-qa", Map.of("chat.question", "Who owns billing?"));
    }

    @Test
    void submitWithoutPayloadUsesEmptyMap() throws Exception {
        when(taskManager.submit("capability:mail-sync", Map.of())).thenReturn("t-1");

        mvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"capability:mail-sync\"}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void blankKindIsBadRequest() throws Exception {
        mvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BadRequest"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Malformed request body"));
    }

    @Test
    void unknownKindIsBadRequest() throws Exception {
        when(taskManager.submit(eq("graph:nope"), anyMap())).thenThrow(new UnknownTaskKindException("graph:nope"));

        mvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"graph:nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_TASK_KIND"));
    }

    @Test
    void statusReturnsSnapshot() throws Exception {
        when(taskManager.getStatus("t-7")).thenReturn(snapshot("t-7", TaskStatus.RUNNING));

        mvc.perform(get("/api/tasks/t-7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("t-7"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.kind").value("graph:knowledge-qa"));
    }

    @Test
    void unknownTaskIs404() throws Exception {
        when(taskManager.getStatus("missing")).thenThrow(new TaskNotFoundException("missing"));

        mvc.perform(get("/api/tasks/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("TASK_NOT_FOUND"));
    }

    @Test
    void listCapsLimitAndFiltersByStatus() throws Exception {
        when(taskManager.list(TaskStatus.FAILED, 500)).thenReturn(List.of(snapshot("t-1", TaskStatus.FAILED)));

        mvc.perform(get("/api/tasks").param("status", "FAILED").param("limit", "10000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("t-1"));
    }

    @Test
    void listRejectsUnknownStatus() throws Exception {
        mvc.perform(get("/api/tasks").param("status", "SLEEPING"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancelReturnsStatus() throws Exception {
        when(taskManager.cancel("t-3")).thenReturn(snapshot("t-3", TaskStatus.CANCELLED));

        mvc.perform(post("/api/tasks/t-3/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value("t-3"))
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void runUsesRequestTimeout() throws Exception {
        when(taskManager.runSync(eq("capability:llm-generate"), anyMap(), eq(Duration.ofMillis(1500))))
                .thenReturn(Map.of("backend", "mock-llm"));

        mvc.perform(post("/api/tasks/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"capability:llm-generate\",\"payload\":{\"prompt\":\"hi\"},\"timeoutMs\":1500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kind").value("capability:llm-generate"))
                .andExpect(jsonPath("$.result.backend").value("mock-llm"));
    }

    @Test
    void runTimeoutIs504() throws Exception {
        when(taskManager.runSync(any(), anyMap(), any()))
                .thenThrow(new TaskTimeoutException("t-9", Duration.ofSeconds(120)));

        mvc.perform(post("/api/tasks/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"graph:knowledge-qa\"}"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void runWithEveryBackendDownIs503() throws Exception {
        when(taskManager.runSync(any(), anyMap(), any()))
                .thenThrow(new AllBackendsFailedException("llm-generate", List.of()));

        mvc.perform(post("/api/tasks/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"capability:llm-generate\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("ALL_BACKENDS_FAILED"));
    }

    @Test
    void nonPositiveTimeoutIsBadRequest() throws Exception {
        mvc.perform(post("/api/tasks/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"graph:knowledge-qa\",\"timeoutMs\":0}"))
                .andExpect(status().isBadRequest());
    }
}
