package io.qdbcompat.fixture;

import io.qdbcompat.config.HarnessSettings;
import io.qdbcompat.testutil.TestConstants;
import io.qdbcompat.version.ReleaseArtifact;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * State checks that never reach Docker.
 */
class QuestDbFixtureTest {

    private final QuestDbFixture fixture = new QuestDbFixture(
            ReleaseArtifact.forTag(TestConstants.IMAGE_REPOSITORY, TestConstants.PINNED_RELEASE),
            HarnessSettings.defaults());

    @Test
    void startsUninstalled() {
        Assertions.assertEquals(FixtureState.UNINSTALLED, fixture.getState());
        Assertions.assertEquals("questdb/questdb:7.4.2", fixture.getArtifact().toString());
    }

    @Test
    void cannotStartBeforeInstall() {
        Assertions.assertThrows(IllegalStateException.class, fixture::start);
        Assertions.assertEquals(FixtureState.UNINSTALLED, fixture.getState());
    }

    @Test
    void accessorsRequireRunningInstance() {
        Assertions.assertThrows(IllegalStateException.class, fixture::getVersion);
        Assertions.assertThrows(IllegalStateException.class, fixture::getIlpAddress);
        Assertions.assertThrows(IllegalStateException.class, fixture::getHttpAddress);
    }

    @Test
    void stopIsSafeInAnyStateAndIdempotent() {
        fixture.stop();
        fixture.close();

        Assertions.assertEquals(FixtureState.STOPPED, fixture.getState());
    }

    @Test
    void stoppedFixtureCannotBeReinstalled() {
        fixture.stop();

        Assertions.assertThrows(IllegalStateException.class, fixture::install);
    }
}
