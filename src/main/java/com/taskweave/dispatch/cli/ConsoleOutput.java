package com.taskweave.dispatch.cli;

import com.taskweave.jobs.digest.DocumentDigest;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Taskweave CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKWEAVE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKWEAVE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void jobStarted(int totalTasks) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [JOB]|@ decomposed into " +
                totalTasks + " sub-task" + (totalTasks != 1 ? "s" : "")));
    }

    public static void subTaskStarted(String name, int index, int total) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) ->|@ [" + (index + 1) + "/" + total + "] " + name));
    }

    public static void subTaskProgress(String name, boolean passed, String detail) {
        String status = passed ? "@|fg(green) DONE|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + name + (detail != null && !detail.isBlank() ? " : " + detail : "")));
    }

    public static void digest(DocumentDigest digest) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + digest.title() + "|@"));
        System.out.println();
        System.out.println(digest.summary());
        if (!digest.keyPoints().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Key points|@"));
            for (String point : digest.keyPoints()) {
                System.out.println("  - " + point);
            }
        }
        System.out.println();
        String coverage = "Chunks: " + digest.chunksCovered() + "/" + digest.chunksTotal();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(digest.complete()
                ? "@|fg(green) " + coverage + "|@"
                : "@|fg(yellow) " + coverage + " (partial)|@"));
    }
}
