/**
 * Log correlation.
 *
 * <p>ThreadContext keys:
 * <ul>
 *   <li>{@code requestId}: per HTTP request, set by {@link com.phillippitts.mcphub.config.logging.MdcFilter}</li>
 *   <li>{@code taskId}, {@code taskKind}: set by the task worker while a task runs</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2026-10-17 15:42:32.529 [task-worker-1] [requestId] [taskId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.mcphub.config.logging;
