/**
 * Backend adapter contract and fallback-chain descriptors.
 *
 * <p>Concrete adapters live in sub-packages, one per provider: {@code whisper} (local
 * subprocess), {@code anythingllm} (remote HTTP), {@code mail} (delegating to an optional
 * mailbox client) and {@code mock} (always-available degraded fallbacks).
 */
package com.phillippitts.mcphub.service.backend;
