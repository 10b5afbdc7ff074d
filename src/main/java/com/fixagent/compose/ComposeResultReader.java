package com.fixagent.compose;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the flat result files a compose task's verifier container writes.
 */
public final class ComposeResultReader {

    static final Path RESULT_DIR = Path.of("logs", "verifier");
    static final String RESULT_FILE = "result.txt";
    static final String EXIT_CODE_FILE = "exit_code.txt";
    static final String TIMESTAMP_FILE = "timestamp.txt";

    private ComposeResultReader() {}

    public static ComposeTaskResult read(Path taskDir) {
        Path resultDir = taskDir.resolve(RESULT_DIR);
        String result = readTrimmed(resultDir.resolve(RESULT_FILE));
        ComposeTaskStatus status = result == null
                ? ComposeTaskStatus.NOT_RUN
                : "1".equals(result) ? ComposeTaskStatus.VERIFIED : ComposeTaskStatus.FAILED;

        return new ComposeTaskResult(
                taskDir.getFileName().toString(),
                status,
                parseExitCode(readTrimmed(resultDir.resolve(EXIT_CODE_FILE))),
                readTrimmed(resultDir.resolve(TIMESTAMP_FILE)),
                resultDir);
    }

    public static ComposeTaskStatus status(Path taskDir) {
        return read(taskDir).status();
    }

    private static Integer parseExitCode(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String readTrimmed(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }
}
