package com.chatty.synth.service.seat;

import java.io.IOException;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the seat runner can be tested with fake processes.
 */
interface ProcessFactory {

    /**
     * @param command full command line, executable first
     * @return started process with separate stdout and stderr
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command) throws IOException;
}
