package com.taskweave.dispatch.cli;

import com.taskweave.core.engine.JobOrchestrator;
import com.taskweave.core.llm.ExecutionProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskweave profiles
 * <p>
 * Lists the configured execution profiles and the default job settings.
 */
@Command(name = "profiles", mixinStandardHelpOptions = true, description = "List execution profiles")
@Component
public class ProfilesCommand implements Runnable {

    private final ExecutionProperties executionProperties;
    private final JobOrchestrator orchestrator;

    public ProfilesCommand(ExecutionProperties executionProperties, JobOrchestrator orchestrator) {
        this.executionProperties = executionProperties;
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var defaults = orchestrator.defaultConfig();
        var profiles = executionProperties.getProfiles();
        if (profiles.isEmpty()) {
            ConsoleOutput.error("No execution profiles configured (taskweave.execution.profiles)");
        }
        for (var entry : profiles.entrySet()) {
            var profile = entry.getValue();
            String marker = entry.getKey().equals(defaults.executionProfile()) ? " (default)" : "";
            System.out.printf("  %-10s model=%s temperature=%s%s%n",
                    entry.getKey(),
                    profile.hasModel() ? profile.getModel() : "<provider default>",
                    profile.getTemperature() != null ? profile.getTemperature() : "<provider default>",
                    marker);
        }
        System.out.println();
        ConsoleOutput.info(String.format("Defaults: concurrency=%d, retries=%d, continueOnError=%s",
                defaults.concurrencyLimit(), defaults.retryBudget(), defaults.continueOnError()));
    }
}
