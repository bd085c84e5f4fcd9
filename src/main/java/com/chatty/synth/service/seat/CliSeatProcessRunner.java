package com.chatty.synth.service.seat;

import com.chatty.synth.config.properties.FallbackProperties;
import com.chatty.synth.domain.DelegatedReply;
import com.chatty.synth.exception.InvalidSeatOutputException;
import com.chatty.synth.exception.SeatProcessException;
import com.chatty.synth.util.ProcessTimeouts;
import com.chatty.synth.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code <cli-path> --once --json --seat <seat>} for one prompt.
 *
 * <p>Protocol: the request {@code {"prompt": ..., "seat": ...}} is written to stdin and stdin is
 * closed; the process prints one JSON object to stdout and exits 0. stdout and stderr are read
 * concurrently by gobbler threads; stdout is capped at {@code synth.fallback.max-stdout-bytes}.
 * A process still running after {@code synth.fallback.timeout-seconds} is destroyed.
 *
 * <p>All state is per call; concurrent requests each get their own process.
 */
@Component
public final class CliSeatProcessRunner implements SeatProcessRunner {

    private static final Logger LOG = LogManager.getLogger(CliSeatProcessRunner.class);
    static final int STDERR_MAX_BYTES = 64 * 1024;

    private final ProcessFactory processFactory;
    private final FallbackProperties props;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    @Autowired
    public CliSeatProcessRunner(FallbackProperties props) {
        this(new DefaultProcessFactory(), props);
    }

    CliSeatProcessRunner(ProcessFactory processFactory, FallbackProperties props) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public DelegatedReply runOnce(String prompt, String seat) {
        Objects.requireNonNull(seat, "seat");
        List<String> command = buildCommand(seat);
        long startTime = System.nanoTime();
        LOG.info("Running seat process for seat={}", seat);

        ProcessExecution exec = null;
        try {
            exec = start(command);
            writeRequest(exec.process(), prompt, seat);
            boolean finished = exec.process().waitFor(props.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw new SeatProcessException("Timeout after " + props.timeoutSeconds() + "s", seat, null,
                        exec.stderr().toString());
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            long durationMs = TimeUtils.elapsedMillis(startTime);
            if (exitCode != 0) {
                LOG.warn("Seat process for seat={} exited {} after {}ms", seat, exitCode, durationMs);
                throw new SeatProcessException("Non-zero exit: " + exitCode, seat, exitCode,
                        exec.stderr().toString());
            }
            LOG.debug("Seat process for seat={} finished in {}ms, stdout={} chars", seat, durationMs,
                    exec.stdout().length());
            return new DelegatedReply(seat, parse(exec.stdout().toString()));
        } catch (IOException e) {
            throw new SeatProcessException("I/O failure: " + e.getMessage(), seat, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeatProcessException("Interrupted", seat, e);
        } finally {
            if (exec != null && exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
        }
    }

    List<String> buildCommand(String seat) {
        Path cli = Path.of(props.cliPath());
        if (!cli.isAbsolute()) {
            cli = Path.of(".").toAbsolutePath().normalize().resolve(cli).normalize();
        }
        return List.of(cli.toString(), "--once", "--json", "--seat", seat);
    }

    private ProcessExecution start(List<String> command) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = processFactory.start(command);
        Thread out = startGobbler(process.getInputStream(), stdout, "seat-out", props.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "seat-err", STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private static void writeRequest(Process process, String prompt, String seat) throws IOException {
        String payload = new JSONObject()
                .put("prompt", prompt == null ? "" : prompt)
                .put("seat", seat)
                .toString();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }
    }

    static Map<String, Object> parse(String stdout) {
        try {
            return new JSONObject(stdout.trim()).toMap();
        } catch (JSONException e) {
            throw new InvalidSeatOutputException(e);
        }
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Copies lines into a bounded buffer. Past the cap the stream is still drained so the child
     * never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line.length() > available ? line.substring(0, available) : line);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Seat process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying seat process");
        }
    }
}
