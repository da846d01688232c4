package io.github.drompincen.clawwatch.runtime.tools;

import org.slf4j.Logger;

public interface ToolStream {

    void stdoutDelta(String text);

    void stderrDelta(String text);

    void progress(int percent, String message);

    /** A stream that forwards everything to {@code log} at debug level. */
    static ToolStream logging(Logger log) {
        return new ToolStream() {
            @Override
            public void stdoutDelta(String text) {
                log.debug("tool stdout: {}", text);
            }

            @Override
            public void stderrDelta(String text) {
                log.debug("tool stderr: {}", text);
            }

            @Override
            public void progress(int percent, String message) {
                log.debug("tool progress {}%: {}", percent, message);
            }
        };
    }
}
