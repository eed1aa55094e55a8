package com.distindex.core;

import com.distindex.core.config.PipelineSettings;
import com.distindex.core.extract.ExtractSet;
import com.distindex.core.stage.Stage;
import com.distindex.core.stage.StageContext;
import com.distindex.core.stage.StageException;
import com.distindex.core.stage.StageResult;
import com.distindex.core.stage.impl.DependencyResolver;
import com.distindex.core.stage.impl.EntityMerger;
import com.distindex.core.stage.impl.FieldCleaner;
import com.distindex.core.stage.impl.GraphMetricsStage;
import com.distindex.core.stage.impl.IndexingStage;
import com.distindex.core.stage.impl.Normalizer;
import com.distindex.core.store.IndexStore;
import com.distindex.core.store.StoreException;
import com.distindex.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the index generation pipeline.
 *
 * <p>Stages run synchronously in a fixed order, each against the same store:
 * <ol>
 *   <li>{@link Normalizer}: extracts into staging tables</li>
 *   <li>{@link FieldCleaner}: version and core repairs</li>
 *   <li>{@link EntityMerger}: author, distribution, module and ticket tables</li>
 *   <li>{@link DependencyResolver}: dependency and requires tables</li>
 *   <li>{@link GraphMetricsStage}: weight and volatility</li>
 *   <li>{@link IndexingStage}: indexes, coverage, cleanup</li>
 * </ol>
 *
 * <p>A run either completes or fails. The first stage failure or store failure
 * stops the run and is rethrown as an {@link IndexGenerationException} naming
 * the stage.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * IndexConfig config = ConfigLoader.load(Path.of("distindex.yaml"));
 * ExtractSet extracts = ExtractSet.fromConfig(config.extractsOrEmpty(), baseDir, Clock.systemUTC());
 * GenerationReport report = new IndexGenerator()
 *     .generate(Path.of(config.storePath()), extracts, config.settings());
 * }</pre>
 */
public class IndexGenerator {

    private static final Logger log = LoggerFactory.getLogger(IndexGenerator.class);

    static final String PREPARE_STAGE_ID = "prepare";

    private final List<Stage> stages;

    /**
     * Creates a generator with the standard stage order.
     */
    public IndexGenerator() {
        this(defaultStages());
    }

    /**
     * Creates a generator with a custom stage list.
     *
     * @param stages stages in execution order
     */
    public IndexGenerator(List<Stage> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        this.stages = List.copyOf(stages);
    }

    /**
     * Returns the standard stages in execution order.
     *
     * @return new stage instances
     */
    public static List<Stage> defaultStages() {
        return List.of(
            new Normalizer(),
            new FieldCleaner(),
            new EntityMerger(),
            new DependencyResolver(),
            new GraphMetricsStage(),
            new IndexingStage()
        );
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * Generates a fresh index file at {@code target}, replacing any existing file.
     *
     * @param target store file to create
     * @param extracts source extracts
     * @param settings runtime settings
     * @return report of the completed run
     * @throws IndexGenerationException if the target cannot be prepared or a stage fails
     */
    public GenerationReport generate(Path target, ExtractSet extracts, PipelineSettings settings) {
        Objects.requireNonNull(target, "target must not be null");
        try {
            FileUtils.prepareTarget(target);
        } catch (IOException e) {
            throw new IndexGenerationException(PREPARE_STAGE_ID, e.getMessage(), e);
        }

        try (IndexStore store = openStore(target)) {
            return generate(store, extracts, settings);
        }
    }

    private static IndexStore openStore(Path target) {
        try {
            return IndexStore.open(target);
        } catch (StoreException e) {
            throw new IndexGenerationException(PREPARE_STAGE_ID, e.getMessage(), e);
        }
    }

    /**
     * Runs every stage against an already open, empty store.
     *
     * @param store target store; left open
     * @param extracts source extracts
     * @param settings runtime settings
     * @return report of the completed run
     * @throws IndexGenerationException if the store cannot be prepared or a stage fails
     */
    public GenerationReport generate(IndexStore store, ExtractSet extracts, PipelineSettings settings) {
        Objects.requireNonNull(store, "store must not be null");
        long start = System.nanoTime();
        StageContext context = new StageContext(store, extracts, settings, null);
        try {
            store.setCacheSize(context.settings().cacheSize());
        } catch (StoreException e) {
            log.error("Failed to prepare store {}: {}", store.location(), e.getMessage());
            throw new IndexGenerationException(PREPARE_STAGE_ID, e.getMessage(), e);
        }

        List<StageResult> results = new ArrayList<>();
        for (Stage stage : stages) {
            log.info("Running stage {} ({})", stage.getDisplayName(), stage.getId());
            StageResult result;
            try {
                result = stage.execute(context);
            } catch (StageException e) {
                log.error("Stage {} failed: {}", e.getStageId(), e.getMessage());
                throw new IndexGenerationException(e.getStageId(), e.getMessage(), e);
            } catch (StoreException e) {
                log.error("Stage {} failed: {}", stage.getId(), e.getMessage());
                throw new IndexGenerationException(stage.getId(), e.getMessage(), e);
            }
            log.debug("Stage {} finished in {} ms: {}", stage.getId(), result.elapsed().toMillis(), result.rowCounts());
            results.add(result);
            context = context.withResult(result);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        GenerationReport report = GenerationReport.of(store.location(), results, elapsed);
        log.info("Generated index at {} in {} s ({} warning(s))",
            store.location(), elapsed.toSeconds(), report.warnings().size());
        return report;
    }
}
