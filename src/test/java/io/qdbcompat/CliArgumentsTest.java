package io.qdbcompat;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CliArgumentsTest {

    @Test
    void runIsTheDefaultCommand() {
        CliArguments arguments = CliArguments.parse(new String[0]);

        Assertions.assertEquals(CliArguments.Command.RUN, arguments.getCommand());
        Assertions.assertNull(arguments.getLastN());
        Assertions.assertTrue(arguments.getVersions().isEmpty());
    }

    @Test
    void parsesListCount() {
        CliArguments arguments = CliArguments.parse(new String[] {"list", "-n", "5"});

        Assertions.assertEquals(CliArguments.Command.LIST, arguments.getCommand());
        Assertions.assertEquals(5, arguments.getListCount());
    }

    @Test
    void versionsConsumeUntilNextOption() {
        CliArguments arguments = CliArguments.parse(
                new String[] {"run", "--versions", "6.1.2", "7.4.2", "--continue-on-failure", "--scenario", "funky_chars"});

        Assertions.assertEquals(List.of("6.1.2", "7.4.2"), arguments.getVersions());
        Assertions.assertTrue(arguments.isContinueOnFailure());
        Assertions.assertFalse(arguments.isFailFastProbe());
        Assertions.assertEquals(List.of("funky_chars"), arguments.getScenarios());
    }

    @Test
    void parsesLastNAndProbeFlags() {
        CliArguments arguments = CliArguments.parse(new String[] {"--last-n", "3", "--fail-fast-probe", "--unittest-help"});

        Assertions.assertEquals(3, arguments.getLastN());
        Assertions.assertTrue(arguments.isFailFastProbe());
        Assertions.assertTrue(arguments.isSuiteHelp());
    }

    @Test
    void helpWinsOverEverythingElse() {
        Assertions.assertEquals(CliArguments.Command.HELP,
                CliArguments.parse(new String[] {"run", "--last-n", "2", "--help"}).getCommand());
    }

    @Test
    void rejectsUsageErrors() {
        List<String[]> invalid = List.of(
                new String[] {"deploy"},
                new String[] {"list", "--versions", "7.4.2"},
                new String[] {"run", "--last-n"},
                new String[] {"run", "--last-n", "zero"},
                new String[] {"run", "--last-n", "0"},
                new String[] {"run", "--versions"},
                new String[] {"run", "--last-n", "2", "--versions", "7.4.2"},
                new String[] {"run", "--verbose"});
        for (String[] args : invalid) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(args), String.join(" ", args));
        }
    }
}
