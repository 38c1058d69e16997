package io.upgradejourney;

import io.upgradejourney.config.UpgradeJourneyConfig;
import io.upgradejourney.models.RunResult;
import io.upgradejourney.runner.RunCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Runs the configured upgrade journey once at startup and exposes its outcome as the process exit code.
 */
@Slf4j
public class UpgradeJourneyRunner implements CommandLineRunner, ExitCodeGenerator {

    private final UpgradeJourneyConfig config;
    private final RunCoordinator runCoordinator;
    private RunResult result;

    public UpgradeJourneyRunner(UpgradeJourneyConfig config, RunCoordinator runCoordinator) {
        this.config = config;
        this.runCoordinator = runCoordinator;
    }

    @Override
    public void run(String... args) {
        result = runCoordinator.run(config.getVersions());
        if (result.isSuccess()) {
            log.info("Upgrade journey passed: {}", result.describe());
        } else {
            log.error("Upgrade journey failed: {}", result.describe());
        }
    }

    public RunResult getResult() {
        return result;
    }

    @Override
    public int getExitCode() {
        // not run yet counts as failure
        return result != null ? result.exitCode() : 1;
    }
}
