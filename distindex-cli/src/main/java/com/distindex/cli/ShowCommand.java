package com.distindex.cli;

import com.distindex.core.config.IndexConfig;
import com.distindex.core.model.DependencyEdge;
import com.distindex.core.model.Distribution;
import com.distindex.core.model.Ticket;
import com.distindex.core.store.IndexQueries;
import com.distindex.core.store.IndexStore;
import com.distindex.core.store.StoreException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to show one distribution of a generated index.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * distindex show Test-Simple --db cpandb.sqlite
 * }</pre>
 */
@Command(
    name = "show",
    description = "Show a distribution, its dependencies and open tickets",
    mixinStandardHelpOptions = true
)
public class ShowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShowCommand.class);

    @Parameters(index = "0", description = "Distribution name")
    private String distribution;

    @Option(names = {"--db"}, description = "Index database (default: cpandb.sqlite)")
    private Path database = Paths.get(IndexConfig.DEFAULT_STORE_PATH);

    @Override
    public Integer call() {
        if (!Files.isRegularFile(database)) {
            System.err.println("✗ Index database not found: " + database);
            return 1;
        }
        try (IndexStore store = IndexStore.open(database)) {
            IndexQueries queries = new IndexQueries(store);
            Optional<Distribution> found = queries.distribution(distribution);
            if (found.isEmpty()) {
                System.err.println("✗ Unknown distribution: " + distribution);
                return 1;
            }
            print(found.get(), queries.dependencies(distribution), queries.tickets(distribution));
            return 0;
        } catch (StoreException e) {
            log.error("Failed to read index {}", database, e);
            System.err.println("✗ Failed to read index: " + e.getMessage());
            return 1;
        }
    }

    private void print(Distribution d, List<DependencyEdge> dependencies, List<Ticket> tickets) {
        System.out.println(d.distribution() + " " + (d.version() == null ? "" : d.version()));
        System.out.println("  Author:     " + d.author());
        System.out.println("  Release:    " + d.release());
        System.out.println("  Uploaded:   " + valueOrDash(d.uploaded()));
        System.out.println("  License:    " + valueOrDash(d.license()));
        System.out.println("  Rating:     " + valueOrDash(d.rating()) + " (" + d.ratings() + " review(s))");
        if (d.hasTestResults()) {
            System.out.printf("  Testers:    pass=%s fail=%s unknown=%s na=%s%n", d.pass(), d.fail(), d.unknown(), d.na());
        }
        System.out.println("  Weight:     " + d.weight());
        System.out.println("  Volatility: " + d.volatility());

        System.out.println();
        System.out.println("Dependencies (" + dependencies.size() + "):");
        dependencies.forEach(edge -> System.out.printf("  • %s [%s]%n", edge.dependency(), edge.phase()));

        System.out.println();
        System.out.println("Open tickets (" + tickets.size() + "):");
        tickets.forEach(ticket -> System.out.printf("  • #%d %s (%s, %s)%n",
            ticket.id(), valueOrDash(ticket.subject()), ticket.status(), ticket.severity()));
    }

    private static String valueOrDash(String value) {
        return value == null ? "-" : value;
    }
}
