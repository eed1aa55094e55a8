package com.distindex.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.distindex.core.GenerationReport;
import com.distindex.core.IndexGenerationException;
import com.distindex.core.IndexGenerator;
import com.distindex.core.config.ConfigLoader;
import com.distindex.core.config.IndexConfig;
import com.distindex.core.config.PipelineSettings;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.model.CoverageReport;
import com.distindex.core.stage.StageResult;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.Callable;

/**
 * Command to generate the index database.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Resolve the configured extracts</li>
 *   <li>Run every stage against a fresh store file</li>
 *   <li>Print per-stage row counts, warnings and coverage</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Generate using distindex.yaml
 * distindex generate
 *
 * # Override output file and batch size
 * distindex generate -o cpandb.sqlite --batch-size 500
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate the index database from the configured extracts",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: distindex.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output database file (overrides config)"
    )
    private Path outputFile;

    @Option(
        names = {"--batch-size"},
        description = "Rows per committed batch (overrides config)"
    )
    private Integer batchSize;

    @Option(
        names = {"--keep-staging"},
        description = "Keep the t_* staging tables"
    )
    private boolean keepStaging;

    @Override
    public Integer call() {
        try {
            IndexConfig config = ConfigLoader.load(configPath);
            PipelineSettings settings = settings(config);
            Path baseDir = configPath.toAbsolutePath().getParent();
            Path target = outputFile != null ? outputFile : baseDir.resolve(config.storePath());
            ExtractSet extracts = ExtractSet.fromConfig(config.extractsOrEmpty(), baseDir, Clock.systemUTC());

            System.out.println("Generating index: " + target.toAbsolutePath());
            System.out.println();

            GenerationReport report = new IndexGenerator().generate(target, extracts, settings);
            printReport(report);
            return 0;

        } catch (IndexGenerationException e) {
            log.error("Generation failed in stage {}", e.getStageId(), e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private PipelineSettings settings(IndexConfig config) {
        PipelineSettings settings = config.settings();
        if (batchSize != null) {
            settings = settings.withBatchSize(batchSize);
        }
        if (keepStaging) {
            settings = settings.withKeepStagingTables(true);
        }
        log.debug("Effective settings: {}", settings);
        return settings;
    }

    private void printReport(GenerationReport report) {
        for (StageResult result : report.stages()) {
            System.out.printf("✓ %-22s %6d ms  %s%n",
                result.stageId(), result.elapsed().toMillis(), result.rowCounts());
        }

        if (report.hasWarnings()) {
            System.out.println();
            System.out.println("Warnings:");
            report.warnings().forEach(warning -> System.out.println("  ⚠ " + warning));
        }

        CoverageReport coverage = report.coverage();
        System.out.println();
        System.out.println("Coverage:");
        System.out.println("  " + coverage.getFormattedCoverage("uploaded", coverage.uploaded()));
        System.out.println("  " + coverage.getFormattedCoverage("meta", coverage.meta()));
        System.out.println("  " + coverage.getFormattedCoverage("rating", coverage.rated()));
        System.out.println("  " + coverage.getFormattedCoverage("tested", coverage.tested()));
        System.out.println();
        System.out.printf("✓ Index generated in %d s%n", report.elapsed().toSeconds());
    }
}
