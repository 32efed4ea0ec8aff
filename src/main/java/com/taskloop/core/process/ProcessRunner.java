package com.taskloop.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands via {@link ProcessBuilder} with a hard timeout.
 * <p>
 * Output is drained and stdin is written on separate threads, so neither a chatty child nor
 * one that never reads its input can hold the caller past the timeout.
 * On timeout the process and all of its descendants are killed.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    public static final int DEFAULT_MAX_OUTPUT_CHARS = 20_000;

    private final int maxOutputChars;

    public ProcessRunner() {
        this(DEFAULT_MAX_OUTPUT_CHARS);
    }

    public ProcessRunner(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
    }

    /**
     * @param command  argv, first element is the executable
     * @param workDir  working directory, null for the current one
     * @param stdin    text written to the child's stdin, null to close it immediately
     * @param timeout  hard limit on wall-clock time
     * @throws IOException if the executable cannot be started
     */
    public ProcessOutcome run(List<String> command, Path workDir, String stdin, Duration timeout)
            throws IOException, InterruptedException {
        long start = System.nanoTime();
        var builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        Process process = builder.start();
        CompletableFuture<byte[]> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));

        Thread writer = new Thread(() -> writeStdin(process, stdin), "process-stdin");
        writer.setDaemon(true);
        writer.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            log.warn("Command timed out after {}s: {}", timeout.toSeconds(), command.get(0));
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }
        String text = collect(output);
        long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        int exitCode = finished ? process.exitValue() : -1;
        return new ProcessOutcome(exitCode, !finished, truncate(text), durationMs);
    }

    private void writeStdin(Process process, String stdin) {
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
                in.flush();
            }
        } catch (IOException e) {
            // child closed its stdin early; its exit status tells the rest
            log.debug("Could not write stdin: {}", e.getMessage());
        }
    }

    private String collect(CompletableFuture<byte[]> output) throws InterruptedException {
        try {
            return new String(output.get(5, TimeUnit.SECONDS), StandardCharsets.UTF_8);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output not fully captured: {}", e.getMessage());
            return "";
        }
    }

    private static byte[] drain(InputStream stream) {
        var buffer = new ByteArrayOutputStream();
        try (stream) {
            stream.transferTo(buffer);
        } catch (IOException e) {
            log.debug("Output stream closed: {}", e.getMessage());
        }
        return buffer.toByteArray();
    }

    String truncate(String text) {
        if (text.length() <= maxOutputChars) {
            return text;
        }
        return "...[truncated]\n" + text.substring(text.length() - maxOutputChars);
    }
}
