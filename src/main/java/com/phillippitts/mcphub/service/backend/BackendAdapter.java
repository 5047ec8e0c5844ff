package com.phillippitts.mcphub.service.backend;

/**
 * Contract for one concrete capability provider (a local binary, a remote API, a mock).
 *
 * <p>Adapters are registered as Spring beans and referenced from configuration by
 * {@link #name()}. The capability resolver decides when to call them; adapters never retry
 * or fall back on their own.
 *
 * <p>Thread Safety: implementations must be safe for concurrent calls from different tasks.
 *
 * @param <I> capability input type
 * @param <O> capability output type
 */
public interface BackendAdapter<I, O> {

    /**
     * Unique adapter name used in configuration, logs and metrics (e.g. "whisper-cli").
     */
    String name();

    /**
     * Logical capability this adapter serves, one of
     * {@link com.phillippitts.mcphub.domain.Capabilities}.
     */
    String capability();

    /**
     * Quick availability probe. Called with a short timeout by the resolver; may be slow or
     * throw, both of which count as unhealthy.
     *
     * @return true if the provider can currently serve requests
     */
    boolean health();

    /**
     * Performs the capability call.
     *
     * @param input capability input
     * @return capability output, never null
     * @throws com.phillippitts.mcphub.exception.BackendException if the provider fails
     */
    O invoke(I input);
}
