package com.baton.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Baton CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BATON v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BATON]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void phase(String from, String to) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) [PHASE]|@ " + from + " -> @|bold " + to + "|@"));
    }

    /** One line per violation; block-level ones in red. */
    public static void violations(JsonNode violations) {
        for (JsonNode v : violations) {
            String level = v.path("level").asText();
            String color = switch (level) {
                case "BLOCK" -> "fg(red),bold";
                case "WARNING" -> "fg(yellow)";
                default -> "fg(white)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|" + color + " [" + level + "]|@ " + v.path("kind").asText()
                            + " by " + v.path("actor").asText()
                            + " (" + v.path("occurrences").asInt() + "x)"));
        }
    }

    public static void wave(JsonNode wave) {
        String marker = wave.path("active").asBoolean() ? "@|bold,fg(yellow) >|@" : " ";
        String gate = wave.path("enterable").asBoolean() ? "@|fg(green) open|@" : "@|fg(red) waiting|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("%s %-6s %d/%d completed  %s",
                marker, wave.path("wave").asText(), wave.path("completed").asInt(), wave.path("total").asInt(),
                gate)));
    }
}
