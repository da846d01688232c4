package io.github.drompincen.clawwatch.runtime.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scripting bridge to macOS applications (Calendar, Mail, Reminders) via {@code osascript}.
 */
public class AppleScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(AppleScriptRunner.class);

    private static final List<String> PERMISSION_PATTERNS = List.of(
            "not allowed assistive access",
            "is not allowed to send keystrokes",
            "not authorized to send apple events",
            "execution error: not authorized",
            "commandprocess completed with a non-zero exit code",
            "assistive access");

    private final ProcessRunner processRunner;

    public AppleScriptRunner(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    /**
     * Runs a script with the given timeout.
     *
     * @return the process result, or empty when macOS denied automation permission
     */
    public Optional<ProcessResult> runScript(String script, int timeoutSeconds) {
        Path scriptFile = null;
        try {
            scriptFile = Files.createTempFile("clawwatch_as_", ".applescript");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);
            ProcessResult result = processRunner.run(
                    List.of("osascript", scriptFile.toString()), Duration.ofSeconds(timeoutSeconds));
            if (isPermissionError(result)) {
                log.warn("osascript was denied automation permission");
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (IOException e) {
            log.warn("Failed to stage AppleScript: {}", e.getMessage());
            return Optional.of(ProcessResult.failedToStart(e.getMessage()));
        } finally {
            deleteQuietly(scriptFile);
        }
    }

    /**
     * Only a failed run's stderr counts; stdout carries user data such as mail subjects.
     */
    public boolean isPermissionError(ProcessResult result) {
        if (result.exitCode() == 0) {
            return false;
        }
        String stderr = result.stderr().toLowerCase(Locale.ROOT);
        return PERMISSION_PATTERNS.stream().anyMatch(stderr::contains);
    }

    /**
     * Escapes a value for embedding inside an AppleScript double-quoted string literal.
     */
    public String escape(String value) {
        if (value == null) return "";
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Splits tab-separated script output into rows keyed by {@code fields}.
     * Blank lines are skipped and missing trailing columns become empty strings.
     */
    public List<Map<String, String>> parseTsv(String output, List<String> fields) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (output == null || output.isBlank()) return rows;
        for (String line : output.split("\\R")) {
            if (line.isBlank()) continue;
            String[] parts = line.split("\t", -1);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i), i < parts.length ? parts[i].trim() : "");
            }
            rows.add(row);
        }
        return rows;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }
}
