package com.hotpreview.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the HotPreview CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HOTPREVIEW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HOTPREVIEW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(String status) {
        String color = switch (status) {
            case "ready" -> "fg(green)";
            case "error" -> "fg(red)";
            default -> "fg(yellow)";
        };
        System.out.print(CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@"));
    }

    /**
     * Prints one channel message as received from an event stream.
     */
    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "project-state", "projects-list" -> "@|fg(cyan) [STATE]|@";
            case "project-added" -> "@|fg(green) [ADDED]|@";
            case "project-removed" -> "@|fg(magenta) [REMOVED]|@";
            case "file-change" -> "@|fg(blue) [CHANGE]|@";
            case "rebuild-started" -> "@|fg(yellow) [REBUILD]|@";
            case "rebuild-complete" -> "@|fg(green),bold [REBUILT]|@";
            case "rebuild-error" -> "@|fg(red),bold [BUILD FAILED]|@";
            case "watcher-error" -> "@|fg(red),bold [WATCHER]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }
}
