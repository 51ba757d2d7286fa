/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.dto.FilterResultDTO;
import com.ammann.timegraph.dto.SkippedConditionDTO;
import com.ammann.timegraph.dto.TimeSpanDTO;
import com.ammann.timegraph.enumeration.SkipReason;
import com.ammann.timegraph.model.CancellationToken;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.FilterCondition;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.Segment;
import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Evaluates range conditions over the loaded table and returns the matching segments.
 *
 * <p>Clauses of one condition are OR-combined, conditions are AND-combined. A condition
 * whose parameter is missing or not numeric matches no row and is reported as skipped,
 * so the overall result is empty in that case. Each parameter column is read once per
 * condition; the cancellation token is checked once per block of rows.
 */
@ApplicationScoped
public class FilterService {

    private static final Logger LOG = Logger.getLogger(FilterService.class);

    static final int DEFAULT_BLOCK_SIZE = 65_536;
    static final String OPERATION = "Filter evaluation";

    @ConfigProperty(name = EngineProperties.Filter.BLOCK_SIZE, defaultValue = "65536")
    int blockSize = DEFAULT_BLOCK_SIZE;

    public FilterResultDTO evaluate(ColumnCache cache, List<FilterCondition> conditions, CancellationToken token) {
        return evaluate(cache.current(), conditions, token);
    }

    /**
     * @param generation table snapshot to evaluate against
     * @param conditions AND-combined conditions; empty selects the whole table
     * @param token      cancellation flag, checked per row block
     * @return segments, matched row count and skipped conditions
     * @throws com.ammann.timegraph.exception.OperationCancelledException if cancelled
     */
    public FilterResultDTO evaluate(
            TableGeneration generation, List<FilterCondition> conditions, CancellationToken token) {
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();
        int rows = generation.rowCount();
        int block = Math.max(1, blockSize);

        boolean[] mask = new boolean[rows];
        Arrays.fill(mask, true);
        List<SkippedConditionDTO> skipped = new ArrayList<>();

        for (FilterCondition condition : conditions) {
            effectiveToken.throwIfCancelled(OPERATION);

            Optional<SkipReason> problem = checkParameter(generation, condition.parameter());
            if (problem.isPresent()) {
                LOG.warnf("Filter condition on '%s' skipped: %s", condition.parameter(), problem.get());
                skipped.add(new SkippedConditionDTO(condition.parameter(), problem.get()));
                Arrays.fill(mask, false);
                continue;
            }

            NumericBuffer buffer = generation.getBuffer(condition.parameter());
            for (int from = 0; from < rows; from += block) {
                effectiveToken.throwIfCancelled(OPERATION);
                int to = Math.min(rows, from + block);
                for (int i = from; i < to; i++) {
                    if (mask[i] && !condition.test(buffer.get(i))) {
                        mask[i] = false;
                    }
                }
            }
        }

        List<Segment> segments = SegmentExtractor.extract(mask);
        long matched = 0;
        for (Segment segment : segments) {
            matched += segment.length();
        }

        LOG.debugf("Filter with %d conditions matched %d of %d rows in %d segments",
                conditions.size(), matched, rows, segments.size());
        return new FilterResultDTO(segments, matched, rows, skipped, List.of());
    }

    /**
     * Projects each segment onto the time axis.
     */
    public List<TimeSpanDTO> toTimeSpans(TableGeneration generation, List<Segment> segments) {
        NumericBuffer time = generation.timeBuffer();
        List<TimeSpanDTO> spans = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            spans.add(TimeSpanDTO.of(segment, time));
        }
        return spans;
    }

    private static Optional<SkipReason> checkParameter(TableGeneration generation, String parameter) {
        Optional<Column> column = generation.table().column(parameter);
        if (column.isEmpty()) {
            return Optional.of(SkipReason.MISSING_COLUMN);
        }
        if (!column.get().kind().isNumeric()) {
            return Optional.of(SkipReason.NON_NUMERIC_COLUMN);
        }
        return Optional.empty();
    }
}
