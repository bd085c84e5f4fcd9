package com.chatty.synth.service.seat;

import java.io.IOException;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
