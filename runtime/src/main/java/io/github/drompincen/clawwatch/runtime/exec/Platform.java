package io.github.drompincen.clawwatch.runtime.exec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class Platform {

    private Platform() {}

    public static boolean isMacOS() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("mac");
    }

    /** True if an executable named {@code binary} is found on the PATH. */
    public static boolean isOnPath(String binary) {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, binary);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return true;
            }
        }
        return false;
    }
}
