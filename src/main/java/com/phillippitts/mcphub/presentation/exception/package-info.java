/**
 * Maps domain exceptions to HTTP responses.
 *
 * <ul>
 *   <li>{@code TASK_NOT_FOUND} → 404</li>
 *   <li>{@code UNKNOWN_TASK_KIND}, invalid request bodies → 400</li>
 *   <li>{@code TIMEOUT} → 504</li>
 *   <li>{@code ALL_BACKENDS_FAILED}, {@code CONFIGURATION_ERROR}, registry not ready → 503</li>
 *   <li>anything else → 500</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "UNKNOWN_TASK_KIND",
 *   "message": "Unknown task kind",
 *   "details": "Unknown task kind: graph:missing",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.mcphub.presentation.exception;
