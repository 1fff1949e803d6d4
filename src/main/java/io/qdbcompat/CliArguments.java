package io.qdbcompat;

import io.qdbcompat.config.Defaults;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * <pre>
 * list [-n COUNT]
 * run [--last-n N | --versions V...] [--continue-on-failure] [--fail-fast-probe]
 *     [--scenario NAME]... [--unittest-help]
 * </pre>
 * Without a command, {@code run} is assumed.
 */
final class CliArguments {

    enum Command {
        LIST,
        RUN,
        HELP
    }

    private Command command = Command.RUN;
    private int listCount = Defaults.LIST_COUNT;
    private Integer lastN;
    private final List<String> versions = new ArrayList<>();
    private final List<String> scenarios = new ArrayList<>();
    private boolean continueOnFailure;
    private boolean failFastProbe;
    private boolean suiteHelp;

    private CliArguments() {
    }

    /**
     * Parses arguments.
     *
     * @throws IllegalArgumentException on a usage error
     */
    static CliArguments parse(String[] args) {
        CliArguments parsed = new CliArguments();
        int i = 0;
        if (args.length > 0 && !args[0].startsWith("-")) {
            switch (args[0]) {
                case "list":
                    parsed.command = Command.LIST;
                    break;
                case "run":
                    parsed.command = Command.RUN;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
            i = 1;
        }

        for (; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-h") || arg.equals("--help")) {
                parsed.command = Command.HELP;
                return parsed;
            }
            if (parsed.command == Command.LIST) {
                if (arg.equals("-n")) {
                    parsed.listCount = positiveInt(arg, value(args, ++i, arg));
                    continue;
                }
                throw new IllegalArgumentException("Unknown option for list: " + arg);
            }
            switch (arg) {
                case "--last-n":
                    parsed.lastN = positiveInt(arg, value(args, ++i, arg));
                    break;
                case "--versions":
                    while (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        parsed.versions.add(args[++i]);
                    }
                    if (parsed.versions.isEmpty()) {
                        throw new IllegalArgumentException("--versions needs at least one version");
                    }
                    break;
                case "--scenario":
                    parsed.scenarios.add(value(args, ++i, arg));
                    break;
                case "--continue-on-failure":
                    parsed.continueOnFailure = true;
                    break;
                case "--fail-fast-probe":
                    parsed.failFastProbe = true;
                    break;
                case "--unittest-help":
                    parsed.suiteHelp = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option for run: " + arg);
            }
        }

        if (parsed.lastN != null && !parsed.versions.isEmpty()) {
            throw new IllegalArgumentException("--last-n and --versions are mutually exclusive");
        }
        return parsed;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    private static int positiveInt(String option, String value) {
        int number;
        try {
            number = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " expects a number, got " + value, e);
        }
        if (number < 1) {
            throw new IllegalArgumentException(option + " must be at least 1, got " + value);
        }
        return number;
    }

    static String usage() {
        return String.join("\n",
                "Usage: questdb-ilp-compat [list|run] [options]",
                "",
                "  list [-n COUNT]              list the latest COUNT releases (default " + Defaults.LIST_COUNT + ")",
                "  run                          run the ingestion suite (default command)",
                "      --last-n N               test the last N releases (default " + Defaults.LAST_N + ")",
                "      --versions V...          test the listed versions, e.g. 6.1.2",
                "      --continue-on-failure    keep testing after a version fails",
                "      --fail-fast-probe        stop waiting on query errors other than a missing table",
                "      --scenario NAME          run only this scenario, may be repeated",
                "      --unittest-help          describe the suite options and scenarios",
                "  -h, --help                   show this help");
    }

    Command getCommand() {
        return command;
    }

    int getListCount() {
        return listCount;
    }

    /**
     * Gets the requested number of releases, or {@code null} if not given.
     */
    Integer getLastN() {
        return lastN;
    }

    List<String> getVersions() {
        return versions;
    }

    List<String> getScenarios() {
        return scenarios;
    }

    boolean isContinueOnFailure() {
        return continueOnFailure;
    }

    boolean isFailFastProbe() {
        return failFastProbe;
    }

    boolean isSuiteHelp() {
        return suiteHelp;
    }
}
