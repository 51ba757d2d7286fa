/* (C)2026 */
package com.ammann.timegraph.health;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.cache.TableGeneration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check reporting whether a table is loaded and queryable.
 *
 * <p>Reports DOWN until the first table has been published. Exposes the generation,
 * row and column counts and the time column as health check data.
 */
@Readiness
@ApplicationScoped
public class DatasetHealthCheck implements HealthCheck {

    static final String NAME = "dataset-health";

    private final ColumnCache columnCache;

    @Inject
    public DatasetHealthCheck(ColumnCache columnCache) {
        this.columnCache = columnCache;
    }

    @Override
    public HealthCheckResponse call() {
        Optional<TableGeneration> snapshot = columnCache.snapshot();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME);
        if (snapshot.isEmpty()) {
            return builder.down().withData("table-loaded", false).build();
        }

        TableGeneration generation = snapshot.get();
        return builder.up()
                .withData("table-loaded", true)
                .withData("generation", generation.number())
                .withData("rows", generation.rowCount())
                .withData("columns", generation.table().columnCount())
                .withData("time-column", generation.timeColumn())
                .withData("cached-statistics", generation.statistics().size())
                .build();
    }
}
