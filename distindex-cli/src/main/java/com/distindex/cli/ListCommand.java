package com.distindex.cli;

import com.distindex.core.IndexGenerator;
import com.distindex.core.stage.Stage;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the pipeline stages in execution order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * distindex list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List the pipeline stages in execution order",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Pipeline Stages:");
        System.out.println();

        List<Stage> stages = new IndexGenerator().stages();
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            System.out.printf("  %d. %s (ID: %s)%n", i + 1, stage.getDisplayName(), stage.getId());
        }
        return 0;
    }
}
