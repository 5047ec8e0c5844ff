/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.mcphub.exception.McpHubException}, which
 * carries an {@link com.phillippitts.mcphub.exception.ErrorKind}. The kind is what a failed task
 * reports and what the REST layer maps to an HTTP status.
 *
 * <ul>
 *   <li>Backend-local: {@link com.phillippitts.mcphub.exception.BackendException}
 *       (unhealthy, timeout, invocation error), recovered by the capability resolver</li>
 *   <li>Resolution: {@link com.phillippitts.mcphub.exception.AllBackendsFailedException}</li>
 *   <li>Graph execution: {@link com.phillippitts.mcphub.exception.MissingStateKeyException},
 *       {@link com.phillippitts.mcphub.exception.NoMatchingEdgeException}</li>
 *   <li>Registration: {@link com.phillippitts.mcphub.exception.ConfigurationException},
 *       {@link com.phillippitts.mcphub.exception.GraphCycleException}</li>
 *   <li>Task lifecycle: {@link com.phillippitts.mcphub.exception.UnknownTaskKindException},
 *       {@link com.phillippitts.mcphub.exception.TaskNotFoundException},
 *       {@link com.phillippitts.mcphub.exception.TaskTimeoutException},
 *       {@link com.phillippitts.mcphub.exception.TaskCancelledException}</li>
 * </ul>
 *
 * @see com.phillippitts.mcphub.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mcphub.exception;
