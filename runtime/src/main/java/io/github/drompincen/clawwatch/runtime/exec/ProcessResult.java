package io.github.drompincen.clawwatch.runtime.exec;

public record ProcessResult(
        int exitCode,
        String stdout,
        String stderr,
        boolean timedOut
) {
    public static final int TIMEOUT_EXIT_CODE = 124;

    public static ProcessResult timeout(String stdout, long seconds) {
        return new ProcessResult(TIMEOUT_EXIT_CODE, stdout, "Command timed out after " + seconds + " seconds", true);
    }

    public static ProcessResult failedToStart(String message) {
        return new ProcessResult(-1, "", message, false);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
