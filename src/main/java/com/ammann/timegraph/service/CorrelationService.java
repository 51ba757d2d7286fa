/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.dto.CorrelationEntryDTO;
import com.ammann.timegraph.dto.CorrelationMatrixDTO;
import com.ammann.timegraph.enumeration.SkipReason;
import com.ammann.timegraph.exception.ValidationException;
import com.ammann.timegraph.model.CancellationToken;
import com.ammann.timegraph.model.Column;
import com.ammann.timegraph.model.CorrelationOutcome;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.properties.EngineProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Pearson correlation between numeric signals.
 *
 * <p>Only rows where both inputs are finite take part. Fewer than two such rows, or a
 * constant input, yield a skip reason instead of a coefficient. Batch operations never
 * abort on a bad pair; they record its skip reason and carry on. The cancellation token
 * is checked before each pair and once per block of rows inside a pair.
 */
@ApplicationScoped
public class CorrelationService {

    private static final Logger LOG = Logger.getLogger(CorrelationService.class);

    static final int DEFAULT_BLOCK_SIZE = 65_536;
    static final String OPERATION = "Correlation";

    @ConfigProperty(name = EngineProperties.Correlation.BLOCK_SIZE, defaultValue = "65536")
    int blockSize = DEFAULT_BLOCK_SIZE;

    public CorrelationOutcome correlate(NumericBuffer a, NumericBuffer b) {
        return correlate(a, b, CancellationToken.none());
    }

    /**
     * Correlates two buffers over their common prefix.
     *
     * <p>Uses Welford's online update for numerical stability.
     *
     * @param token cancellation flag, checked per row block
     * @throws com.ammann.timegraph.exception.OperationCancelledException if cancelled
     */
    public CorrelationOutcome correlate(NumericBuffer a, NumericBuffer b, CancellationToken token) {
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();
        int length = Math.min(a.length(), b.length());
        int block = Math.max(1, blockSize);

        long n = 0;
        double meanA = 0.0;
        double meanB = 0.0;
        double m2A = 0.0;
        double m2B = 0.0;
        double covAB = 0.0;

        for (int i = 0; i < length; i++) {
            if (i % block == 0) {
                effectiveToken.throwIfCancelled(OPERATION);
            }
            double x = a.get(i);
            double y = b.get(i);
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                continue;
            }
            n++;
            double dA = x - meanA;
            double dB = y - meanB;
            meanA += dA / n;
            meanB += dB / n;
            m2A += dA * (x - meanA);
            m2B += dB * (y - meanB);
            covAB += dA * (y - meanB);
        }

        if (n < 2) {
            return CorrelationOutcome.skipped(SkipReason.INSUFFICIENT_DATA);
        }
        if (!(m2A > 0.0) || !(m2B > 0.0)) {
            return CorrelationOutcome.skipped(SkipReason.ZERO_VARIANCE);
        }

        double r = covAB / Math.sqrt(m2A * m2B);
        return CorrelationOutcome.correlated(Math.max(-1.0, Math.min(1.0, r)), (int) n);
    }

    public CorrelationMatrixDTO matrix(ColumnCache cache, List<String> signals, CancellationToken token) {
        return matrix(cache.current(), signals, token);
    }

    /**
     * Correlates every unordered pair of {@code signals}.
     */
    public CorrelationMatrixDTO matrix(TableGeneration generation, List<String> signals, CancellationToken token) {
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();
        List<CorrelationEntryDTO> entries = new ArrayList<>();

        for (int i = 0; i < signals.size(); i++) {
            for (int j = i + 1; j < signals.size(); j++) {
                effectiveToken.throwIfCancelled(OPERATION);
                String first = signals.get(i);
                String second = signals.get(j);
                entries.add(CorrelationEntryDTO.from(
                        first, second, correlatePair(generation, first, second, effectiveToken)));
            }
        }

        CorrelationMatrixDTO matrix = new CorrelationMatrixDTO(signals, entries);
        LOG.debugf("Correlated %d pairs of %d signals (%d skipped)",
                entries.size(), signals.size(), matrix.skippedCount());
        return matrix;
    }

    public List<CorrelationEntryDTO> rankAgainst(
            ColumnCache cache, String target, List<String> others, int limit, CancellationToken token) {
        return rankAgainst(cache.current(), target, others, limit, token);
    }

    /**
     * Correlates {@code target} with each of {@code others} and orders the results by
     * descending absolute coefficient. Skipped pairs follow the correlated ones in input
     * order.
     *
     * @param limit maximum entries returned, at least 1
     */
    public List<CorrelationEntryDTO> rankAgainst(
            TableGeneration generation,
            String target,
            List<String> others,
            int limit,
            CancellationToken token) {
        if (limit < 1) {
            throw ValidationException.invalidParameter("limit", limit, "a value of at least 1");
        }
        CancellationToken effectiveToken = token != null ? token : CancellationToken.none();

        List<CorrelationEntryDTO> correlated = new ArrayList<>();
        List<CorrelationEntryDTO> skipped = new ArrayList<>();
        for (String other : others) {
            if (other.equals(target)) {
                continue;
            }
            effectiveToken.throwIfCancelled(OPERATION);
            CorrelationEntryDTO entry = CorrelationEntryDTO.from(
                    target, other, correlatePair(generation, target, other, effectiveToken));
            if (entry.skipped()) {
                skipped.add(entry);
            } else {
                correlated.add(entry);
            }
        }

        correlated.sort(Comparator.comparingDouble((CorrelationEntryDTO e) -> Math.abs(e.coefficient())).reversed());
        List<CorrelationEntryDTO> ranked = new ArrayList<>(correlated);
        ranked.addAll(skipped);
        return List.copyOf(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    private CorrelationOutcome correlatePair(
            TableGeneration generation, String first, String second, CancellationToken token) {
        Optional<SkipReason> problem = checkSignal(generation, first)
                .or(() -> checkSignal(generation, second));
        if (problem.isPresent()) {
            LOG.debugf("Correlation %s/%s skipped: %s", first, second, problem.get());
            return CorrelationOutcome.skipped(problem.get());
        }
        return correlate(generation.getBuffer(first), generation.getBuffer(second), token);
    }

    private static Optional<SkipReason> checkSignal(TableGeneration generation, String name) {
        Optional<Column> column = generation.table().column(name);
        if (column.isEmpty()) {
            return Optional.of(SkipReason.MISSING_COLUMN);
        }
        if (!column.get().kind().isNumeric()) {
            return Optional.of(SkipReason.NON_NUMERIC_COLUMN);
        }
        return Optional.empty();
    }
}
