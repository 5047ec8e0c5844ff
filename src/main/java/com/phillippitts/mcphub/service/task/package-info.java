/**
 * Task lifecycle: submission, bounded execution, polling, cancellation, synchronous runs
 * and reaping.
 *
 * <p>{@link com.phillippitts.mcphub.service.task.DefaultTaskManager} is the only writer of
 * task status. Transitions are serialized per task and only move forward.
 */
package com.phillippitts.mcphub.service.task;
