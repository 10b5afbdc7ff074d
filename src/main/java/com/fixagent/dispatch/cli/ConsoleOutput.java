package com.fixagent.dispatch.cli;

import com.fixagent.compose.ComposeTaskStatus;
import com.fixagent.core.model.ExceptionInfo;
import com.fixagent.core.model.TrialResult;
import com.fixagent.core.model.VerificationResult;
import com.fixagent.core.scheduler.BatchSummary;
import picocli.CommandLine;

import java.util.Arrays;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the verifier CLI.
 */
public class ConsoleOutput {

    static final int OUTPUT_TAIL_LINES = 50;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner(String subtitle) {
        System.out.println(ansi("@|bold,fg(blue) FIXAGENT VERIFIER v0.1.0|@"));
        System.out.println(subtitle);
        System.out.println("──────────────────────────────────");
    }

    public static void step(int number, String message) {
        System.out.println();
        System.out.println(ansi("@|bold " + number + ". " + message + "|@"));
    }

    public static void detail(String message) {
        System.out.println("   " + message);
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [VERIFIER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(ansi("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    /**
     * Prints the outcome of a trial, telling a verified build failure apart
     * from an infrastructure exception.
     */
    public static void trialResult(TrialResult result) {
        System.out.println();
        if (result.isSuccess()) {
            System.out.println(ansi("@|fg(green),bold Verification PASSED|@"));
        } else if (result.getExceptionInfo() != null) {
            System.out.println(ansi("@|fg(red),bold Verification ERROR|@ (infrastructure failure, build not verified)"));
        } else {
            System.out.println(ansi("@|fg(red),bold Verification FAILED|@"));
        }

        VerificationResult verification = result.getVerificationResult();
        row("PR Number", "#" + result.getPrNumber());
        row("Success", result.isSuccess() ? "yes" : "no");
        if (verification != null) {
            row("Duration", String.format("%.1fs", verification.durationSec()));
            row("Tasks Run", verification.tasksRun().isEmpty() ? "N/A" : String.join(", ", verification.tasksRun()));
        }
        if (result.getDurationSec() != null) {
            row("Total Duration", formatDuration((long) (result.getDurationSec() * 1000)));
        }
        row("Output Directory", String.valueOf(result.getTrialDir()));

        ExceptionInfo info = result.getExceptionInfo();
        if (info != null) {
            System.out.println();
            System.out.println(ansi("@|bold,fg(red) Exception [" + info.kind() + "]:|@"));
            detail(info.exceptionType() + ": " + info.exceptionMessage());
        }
        if (verification != null && !verification.success()) {
            System.out.println();
            System.out.println(ansi("@|bold,fg(yellow) Compilation Output (last " + OUTPUT_TAIL_LINES + " lines):|@"));
            if (verification.errorMessage() != null) {
                detail(verification.errorMessage());
            }
            for (String line : tail(verification.compilationOutput(), OUTPUT_TAIL_LINES)) {
                detail(line);
            }
        }
        System.out.println();
        System.out.println(ansi("@|bold Full logs saved to:|@ " + result.getTrialDir()));
    }

    public static void batchSummary(BatchSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(ansi("@|bold Summary|@"));
        detail("Total: " + summary.total());
        System.out.println(ansi("   @|fg(green) Success: " + summary.succeeded() + "|@"));
        System.out.println(ansi("   @|fg(red) Failed: " + summary.failed() + "|@"));
        if (!summary.failedKeys().isEmpty()) {
            System.out.println();
            System.out.println(ansi("@|bold Failed:|@"));
            for (String key : summary.failedKeys()) {
                TrialResult result = summary.trialResults().get(key);
                String reason = result == null ? ""
                        : result.getExceptionInfo() != null
                        ? " (" + result.getExceptionInfo().kind() + ": " + result.getExceptionInfo().exceptionType() + ")"
                        : " (build failed)";
                detail("- " + key + reason);
            }
        }
    }

    public static void unitOutcome(String key, boolean passed) {
        String status = passed ? "@|fg(green) PASSED|@" : "@|fg(red) FAILED|@";
        System.out.println(ansi("  " + status + " " + key));
    }

    public static String statusLabel(ComposeTaskStatus status) {
        return switch (status) {
            case VERIFIED -> ansi("@|fg(green) Passed|@");
            case FAILED -> ansi("@|fg(red) Failed|@");
            case NOT_RUN -> ansi("@|fg(yellow) Not run|@");
        };
    }

    /** The last {@code n} lines of {@code text}. */
    static List<String> tail(String text, int n) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = Arrays.asList(text.split("\n", -1));
        return lines.subList(Math.max(0, lines.size() - n), lines.size());
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static void row(String metric, String value) {
        System.out.println(ansi(String.format("   @|fg(cyan) %-18s|@ %s", metric, value)));
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
