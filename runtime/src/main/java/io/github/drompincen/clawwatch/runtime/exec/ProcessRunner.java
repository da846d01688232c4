package io.github.drompincen.clawwatch.runtime.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command with a hard timeout. A process that outlives its timeout is
 * killed, so a hung source tool cannot stall a poll cycle.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long DRAIN_JOIN_MS = 1000;

    public ProcessResult run(List<String> command, Duration timeout) {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            log.debug("Failed to start {}: {}", command.get(0), e.getMessage());
            return ProcessResult.failedToStart("Failed to start process: " + e.getMessage());
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", command.get(0), e.getMessage());
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutThread = drain(process.getInputStream(), stdout, command.get(0) + "-stdout");
        Thread stderrThread = drain(process.getErrorStream(), stderr, command.get(0) + "-stderr");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                stdoutThread.join(DRAIN_JOIN_MS);
                log.warn("{} timed out after {}s and was killed", command.get(0), timeout.toSeconds());
                return ProcessResult.timeout(snapshot(stdout), timeout.toSeconds());
            }
            stdoutThread.join(DRAIN_JOIN_MS);
            stderrThread.join(DRAIN_JOIN_MS);
            return new ProcessResult(process.exitValue(), snapshot(stdout), snapshot(stderr), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProcessResult.failedToStart("Interrupted while waiting for " + command.get(0));
        }
    }

    private Thread drain(InputStream in, StringBuilder sink, String name) {
        Thread t = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                // stream closes under us when a timed-out process is killed
                log.trace("Stream {} closed: {}", name, e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString().trim();
        }
    }
}
