package com.phillippitts.mathscrap.service.ocr.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts recognizer processes. Tests substitute a factory returning a fake {@link Process}
 * with scripted output and exit behavior.
 */
public interface ProcessFactory {

    /**
     * @param command    executable followed by its arguments
     * @param workingDir working directory, or null to inherit
     * @throws IOException when the executable cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
