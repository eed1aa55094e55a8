package com.distindex.core.stage;

/**
 * One step of the index generation pipeline.
 *
 * <p>Stages run in a fixed order, each building on the tables the previous ones
 * left in the store:
 * <ol>
 *   <li>{@code normalize} - load extracts into uniformly keyed staging tables</li>
 *   <li>{@code clean-fields} - repair malformed versions in dependency declarations</li>
 *   <li>{@code merge-entities} - build the author, distribution, module and ticket tables</li>
 *   <li>{@code resolve-dependencies} - collapse module declarations into distribution edges</li>
 *   <li>{@code graph-metrics} - compute weight and volatility</li>
 *   <li>{@code index} - index final tables and clean up</li>
 * </ol>
 *
 * <p>A stage returns a {@link StageResult} when it completes, possibly carrying
 * warnings for degraded but acceptable conditions such as a missing optional
 * extract. Conditions that would leave the index incomplete are thrown as
 * {@link StageException}.
 *
 * @see StageContext
 * @see StageResult
 */
public interface Stage {

    /**
     * Returns the unique, kebab-case identifier of this stage (e.g. "normalize").
     *
     * @return stage identifier
     */
    String getId();

    /**
     * Returns a human-readable name used in logs and CLI output.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Runs the stage.
     *
     * @param context store, extracts, settings and earlier results
     * @return stage result
     * @throws StageException if the stage cannot complete
     */
    StageResult execute(StageContext context);
}
