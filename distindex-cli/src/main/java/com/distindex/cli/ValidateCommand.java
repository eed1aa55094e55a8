package com.distindex.cli;

import com.distindex.core.config.ConfigLoader;
import com.distindex.core.config.IndexConfig;
import com.distindex.core.extract.Extract;
import com.distindex.core.extract.ExtractSet;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Command to validate the configuration and the availability of its extracts.
 *
 * <p>Exits with 1 when the configuration file is missing or a required extract
 * is unavailable. Missing optional extracts are reported but tolerated.
 */
@Command(
    name = "validate",
    description = "Validate configuration file and extract availability",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        if (!Files.isRegularFile(configFile)) {
            System.err.println("✗ Configuration file not found: " + configFile);
            return 1;
        }

        IndexConfig config = ConfigLoader.load(configFile);
        ExtractSet extracts = ExtractSet.fromConfig(
            config.extractsOrEmpty(), configFile.toAbsolutePath().getParent(), Clock.systemUTC());

        try {
            config.settings();
        } catch (IllegalArgumentException e) {
            System.err.println("✗ Invalid settings: " + e.getMessage());
            return 1;
        }

        boolean valid = true;
        System.out.println("Required extracts:");
        for (Extract<?> extract : extracts.required()) {
            valid &= report(extract, true);
        }
        System.out.println("Optional extracts:");
        for (Extract<?> extract : extracts.optional()) {
            report(extract, false);
        }

        System.out.println();
        if (valid) {
            System.out.println("✓ Configuration is valid");
            return 0;
        }
        System.err.println("✗ Required extracts are missing");
        return 1;
    }

    private boolean report(Extract<?> extract, boolean required) {
        if (extract.isAvailable()) {
            System.out.printf("  ✓ %s (age = %s)%n", extract.name(), extract.freshness().describe());
            return true;
        }
        System.out.printf("  %s %s not available%n", required ? "✗" : "⚠", extract.name());
        return false;
    }
}
