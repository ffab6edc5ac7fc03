package io.feedloom.ai;

import io.feedloom.task.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a local command (for example {@code claude -p}) with the prompt on stdin and takes its
 * standard output as the generated text.
 */
public final class ScriptAiProvider implements AiProvider {
    private static final Logger log = LoggerFactory.getLogger(ScriptAiProvider.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final String model;

    public ScriptAiProvider(String id, List<String> command, String model) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script provider id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script provider command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.model = model == null ? "" : model.trim();
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * True if the executable exists, either as a path or somewhere on {@code PATH}.
     */
    @Override
    public boolean isAvailable() {
        String executable = command.get(0);
        if (executable.contains("/") || executable.contains("\\")) {
            return Files.isExecutable(Paths.get(executable));
        }
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, executable);
            if (Files.isExecutable(candidate) || Files.isExecutable(Paths.get(dir, executable + ".exe"))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public AiResult generate(String prompt, Duration timeout, CancellationSignal signal) {
        List<String> argv = new ArrayList<>(command);
        if (!model.isEmpty()) {
            argv.add("--model");
            argv.add(model);
        }
        Path output;
        try {
            output = Files.createTempFile("feedloom-ai-", ".out");
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "cannot create output file: " + e.getMessage());
        }
        try {
            return runProcess(argv, prompt, timeout, signal, output);
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.debug("Could not delete {}", output, e);
            }
        }
    }

    private AiResult runProcess(List<String> argv, String prompt, Duration timeout, CancellationSignal signal, Path output) {
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectErrorStream(true);
        pb.redirectOutput(output.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return AiResult.fail(AiFailure.Kind.UNAVAILABLE, "script spawn failed: " + e.getMessage());
        }
        if (signal != null) {
            signal.onCancel(process::destroyForcibly);
        }

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write((prompt == null ? "" : prompt).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                // the command may exit without reading stdin; its exit status tells the rest
                log.debug("{} closed stdin early: {}", id, e.getMessage());
            }

            long timeoutMs = Math.max(1L, timeout.toMillis());
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return AiResult.fail(AiFailure.Kind.TIMEOUT, "script timeout after " + Duration.ofMillis(timeoutMs));
            }
            if (signal != null && signal.isCancelled()) {
                return AiResult.fail(AiFailure.Kind.CANCELED, "script canceled");
            }

            String combined = Files.readString(output, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                return AiResult.fail(AiFailure.Kind.TRANSIENT,
                        "script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            String text = combined.strip();
            if (text.isEmpty()) {
                return AiResult.fail(AiFailure.Kind.TRANSIENT, "script produced no output");
            }
            return AiResult.ok(text);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return AiResult.fail(AiFailure.Kind.CANCELED, "script interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return AiResult.fail(AiFailure.Kind.TRANSIENT, "script execution failed: " + e.getMessage());
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
