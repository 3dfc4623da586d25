package com.teamsmith.dispatch.cli;

import com.teamsmith.core.model.TaskAssignment;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Teamsmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TEAMSMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    /** Goes to stderr so it never ends up in piped YAML. */
    public static void warn(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void assignment(TaskAssignment assignment) {
        String name = assignment.task().name();
        int count = assignment.teams().size();
        var cheapestOpt = assignment.cheapest();
        if (cheapestOpt.isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) x|@ " + name + ": no team covers " + assignment.task().skills()));
            return;
        }
        var cheapest = cheapestOpt.get();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) +|@ " + name + ": " + count + " team" + (count != 1 ? "s" : "") +
                ", cheapest " + String.join(", ", cheapest.memberNames()) +
                " @|bold (" + cheapest.price().toPlainString() + ")|@"));
    }
}
