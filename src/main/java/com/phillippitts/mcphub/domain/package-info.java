/**
 * Immutable data shared across the hub.
 *
 * <ul>
 *   <li>Task lifecycle views: {@link com.phillippitts.mcphub.domain.TaskStatus},
 *       {@link com.phillippitts.mcphub.domain.TaskSnapshot},
 *       {@link com.phillippitts.mcphub.domain.TaskError}</li>
 *   <li>Capability resolution: {@link com.phillippitts.mcphub.domain.CapabilityResult},
 *       {@link com.phillippitts.mcphub.domain.BackendFailure}</li>
 *   <li>Capability inputs and outputs, one pair per entry in
 *       {@link com.phillippitts.mcphub.domain.Capabilities}</li>
 * </ul>
 */
package com.phillippitts.mcphub.domain;
