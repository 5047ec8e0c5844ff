package com.phillippitts.mcphub.service.backend.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so process-based backends can be tested with fake
 * processes that have controlled stdout, stderr and exit behavior.
 */
public interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory, may be null
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
