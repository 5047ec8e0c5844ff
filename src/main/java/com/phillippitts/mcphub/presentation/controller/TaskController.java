package com.phillippitts.mcphub.presentation.controller;

import com.phillippitts.mcphub.config.properties.TaskProperties;
import com.phillippitts.mcphub.domain.TaskSnapshot;
import com.phillippitts.mcphub.domain.TaskStatus;
import com.phillippitts.mcphub.service.task.TaskManager;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP transport for the task manager.
 */
@RestController
@RequestMapping("/api/tasks")
class TaskController {

    private static final Logger LOG = LogManager.getLogger(TaskController.class);
    private static final int MAX_LIST_LIMIT = 500;

    private final TaskManager taskManager;
    private final TaskProperties taskProperties;

    TaskController(TaskManager taskManager, TaskProperties taskProperties) {
        this.taskManager = taskManager;
        this.taskProperties = taskProperties;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody TaskRequest request) {
        String taskId = taskManager.submit(request.kind(), request.payloadOrEmpty());
        LOG.debug("Accepted task {} kind={}", taskId, request.kind());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", taskId));
    }

    @GetMapping("/{taskId}")
    TaskSnapshot status(@PathVariable String taskId) {
        return taskManager.getStatus(taskId);
    }

    @GetMapping
    List<TaskSnapshot> list(@RequestParam(required = false) TaskStatus status,
                            @RequestParam(defaultValue = "50") int limit) {
        return taskManager.list(status, Math.min(limit, MAX_LIST_LIMIT));
    }

    @PostMapping("/{taskId}/cancel")
    Map<String, Object> cancel(@PathVariable String taskId) {
        TaskSnapshot s = taskManager.cancel(taskId);
        return Map.of("taskId", s.id(), "status", s.status());
    }

    @PostMapping("/run")
    Map<String, Object> run(@Valid @RequestBody TaskRequest request) {
        long timeoutMs = request.timeoutMs() != null
                ? request.timeoutMs()
                : taskProperties.getDefaultSyncTimeoutMs();
        Object result = taskManager.runSync(request.kind(), request.payloadOrEmpty(), Duration.ofMillis(timeoutMs));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", request.kind());
        body.put("result", result);
        return body;
    }
}
