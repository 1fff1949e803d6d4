package io.qdbcompat;

import io.qdbcompat.config.Defaults;
import io.qdbcompat.config.HarnessSettings;
import io.qdbcompat.fixture.FixtureFactory;
import io.qdbcompat.fixture.QuestDbFixture;
import io.qdbcompat.poll.FailurePolicy;
import io.qdbcompat.run.CompatibilityRunner;
import io.qdbcompat.run.MatrixPolicy;
import io.qdbcompat.run.RunReport;
import io.qdbcompat.suite.BehaviorSuite;
import io.qdbcompat.suite.Scenario;
import io.qdbcompat.version.CatalogException;
import io.qdbcompat.version.GitHubReleaseCatalog;
import io.qdbcompat.version.ReleaseArtifact;
import io.qdbcompat.version.ReleaseCatalog;
import io.qdbcompat.version.UnknownVersionException;
import io.qdbcompat.version.Version;
import io.qdbcompat.version.VersionMatrix;
import io.qdbcompat.version.VersionSelector;
import java.io.PrintStream;
import java.util.Map;
import java.util.function.Function;

/**
 * Command line entry point: lists QuestDB releases or runs the ingestion suite across them.
 *
 * <p>Exit status is 0 when every tested version passed, 1 when a version failed or could not be
 * resolved, and 2 on a usage error.
 */
public final class QuestDbCompat {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final HarnessSettings settings;
    private final ReleaseCatalog catalog;
    private final Function<HarnessSettings, FixtureFactory> fixtureFactories;
    private final PrintStream out;
    private final PrintStream err;

    QuestDbCompat(HarnessSettings settings, ReleaseCatalog catalog,
            Function<HarnessSettings, FixtureFactory> fixtureFactories, PrintStream out, PrintStream err) {
        this.settings = settings;
        this.catalog = catalog;
        this.fixtureFactories = fixtureFactories;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) throws InterruptedException {
        HarnessSettings settings;
        try {
            settings = HarnessSettings.fromSystemProperties();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        ReleaseCatalog catalog = new GitHubReleaseCatalog(
                settings.getReleasesApi(),
                settings.getReleasesRepository(),
                settings.getImageRepository(),
                settings.getGithubToken(),
                settings.getCatalogTimeout());
        QuestDbCompat app = new QuestDbCompat(settings, catalog,
                s -> artifact -> new QuestDbFixture(artifact, s), System.out, System.err);
        System.exit(app.execute(args));
    }

    int execute(String[] args) throws InterruptedException {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            err.println(CliArguments.usage());
            return EXIT_USAGE;
        }

        try {
            switch (arguments.getCommand()) {
                case HELP:
                    out.println(CliArguments.usage());
                    return EXIT_OK;
                case LIST:
                    return list(arguments.getListCount());
                default:
                    return run(arguments);
            }
        } catch (CatalogException e) {
            err.println("Could not read the release catalog: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int list(int count) throws InterruptedException {
        out.println("List of releases:");
        for (ReleaseArtifact artifact : catalog.latest(count)) {
            out.println("    " + artifact.getVersion());
        }
        return EXIT_OK;
    }

    private int run(CliArguments arguments) throws InterruptedException {
        BehaviorSuite suite;
        try {
            suite = BehaviorSuite.ingestion().select(arguments.getScenarios());
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (arguments.isSuiteHelp()) {
            printSuiteHelp(suite);
            return EXIT_OK;
        }

        HarnessSettings.Builder runSettings = settings.toBuilder();
        if (arguments.isContinueOnFailure()) {
            runSettings.matrixPolicy(MatrixPolicy.CONTINUE);
        }
        if (arguments.isFailFastProbe()) {
            runSettings.failurePolicy(FailurePolicy.FAIL_FAST);
        }
        HarnessSettings effective = runSettings.build();

        VersionSelector selector;
        try {
            selector = arguments.getVersions().isEmpty()
                    ? VersionSelector.lastN(arguments.getLastN() == null ? Defaults.LAST_N : arguments.getLastN())
                    : VersionSelector.explicit(arguments.getVersions());
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            return EXIT_USAGE;
        }

        Map<Version, ReleaseArtifact> matrix;
        try {
            matrix = new VersionMatrix(catalog, effective.getExplicitVersionWindow()).resolve(selector);
        } catch (UnknownVersionException e) {
            err.println(e.getMessage());
            return EXIT_FAILED;
        }

        CompatibilityRunner runner =
                new CompatibilityRunner(fixtureFactories.apply(effective), suite, effective);
        RunReport report = runner.run(matrix);
        out.print(report.render());
        return report.exitStatus();
    }

    private void printSuiteHelp(BehaviorSuite suite) {
        out.println("Scenarios (select with --scenario NAME):");
        for (Scenario scenario : suite.getScenarios()) {
            out.println("    " + scenario.getName() + " [" + scenario.getGate() + "]");
        }
        out.println("Settings are read from system properties prefixed " + HarnessSettings.PREFIX);
    }
}
