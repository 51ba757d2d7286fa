/* (C)2026 */
package com.ammann.timegraph.service;

import com.ammann.timegraph.cache.ColumnCache;
import com.ammann.timegraph.cache.TableGeneration;
import com.ammann.timegraph.dto.CorrelationEntryDTO;
import com.ammann.timegraph.dto.CorrelationMatrixDTO;
import com.ammann.timegraph.dto.FilterResultDTO;
import com.ammann.timegraph.dto.LoadDiagnosticsDTO;
import com.ammann.timegraph.dto.LoadResultDTO;
import com.ammann.timegraph.enumeration.NormalizationMethod;
import com.ammann.timegraph.enumeration.ThresholdMode;
import com.ammann.timegraph.enumeration.TimeMode;
import com.ammann.timegraph.model.CancellationToken;
import com.ammann.timegraph.model.DownsampledSeries;
import com.ammann.timegraph.model.FilterCondition;
import com.ammann.timegraph.model.ImportConfiguration;
import com.ammann.timegraph.model.NumericBuffer;
import com.ammann.timegraph.model.RawTable;
import com.ammann.timegraph.model.RowRange;
import com.ammann.timegraph.model.SeriesView;
import com.ammann.timegraph.model.StatisticsSnapshot;
import com.ammann.timegraph.properties.EngineProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Entry point of the engine: loads tables and answers series, filter, statistics and
 * correlation queries against the published table.
 *
 * <p>Holds the current {@link CancellationToken}. Starting a load or calling
 * {@link #changeSelection()} cancels the work that was started under the previous token;
 * that work stops at its next block boundary with an
 * {@link com.ammann.timegraph.exception.OperationCancelledException}. A cancelled load
 * never publishes its table.
 *
 * <p>The {@code *Async} variants run on the {@code timegraph-engine-executor} and never
 * block the caller.
 */
@ApplicationScoped
public class SignalEngineService {

    private static final Logger LOG = Logger.getLogger(SignalEngineService.class);

    static final String LOAD_OPERATION = "Table load";

    private final TypeNormalizationService normalizationService;
    private final TimeAxisService timeAxisService;
    private final DownsamplingService downsamplingService;
    private final FilterService filterService;
    private final CorrelationService correlationService;
    private final SignalStatisticsService statisticsService;
    private final SignalNormalizationService signalNormalizationService;
    private final SignalLookupService lookupService;
    private final ColumnCache columnCache;
    private final Event<LoadDiagnosticsDTO> diagnosticsEvent;
    private final ManagedExecutor executor;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<CancellationToken> currentToken =
            new AtomicReference<>(CancellationToken.create());
    private final Object publishLock = new Object();

    private Counter loadCounter;
    private Counter skippedRowCounter;

    @Inject
    public SignalEngineService(
            TypeNormalizationService normalizationService,
            TimeAxisService timeAxisService,
            DownsamplingService downsamplingService,
            FilterService filterService,
            CorrelationService correlationService,
            SignalStatisticsService statisticsService,
            SignalNormalizationService signalNormalizationService,
            SignalLookupService lookupService,
            ColumnCache columnCache,
            Event<LoadDiagnosticsDTO> diagnosticsEvent,
            @Named(EngineProperties.EXECUTOR_NAME) ManagedExecutor executor,
            MeterRegistry meterRegistry) {
        this.normalizationService = normalizationService;
        this.timeAxisService = timeAxisService;
        this.downsamplingService = downsamplingService;
        this.filterService = filterService;
        this.correlationService = correlationService;
        this.statisticsService = statisticsService;
        this.signalNormalizationService = signalNormalizationService;
        this.lookupService = lookupService;
        this.columnCache = columnCache;
        this.diagnosticsEvent = diagnosticsEvent;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    void initMetrics() {
        if (meterRegistry != null && loadCounter == null) {
            loadCounter = Counter.builder("timegraph_loads_total")
                    .description("Tables published by the engine")
                    .register(meterRegistry);
            skippedRowCounter = Counter.builder("timegraph_skipped_rows_total")
                    .description("Rows dropped during normalization or time resolution")
                    .register(meterRegistry);
        }
    }

    /**
     * Normalizes {@code raw}, resolves its time axis and publishes it as a new generation.
     *
     * @throws com.ammann.timegraph.exception.IngestionException          if the table is unusable
     * @throws com.ammann.timegraph.exception.ValidationException         if the configuration is invalid
     * @throws com.ammann.timegraph.exception.OperationCancelledException if a newer load started meanwhile
     */
    public LoadResultDTO load(RawTable raw, ImportConfiguration config) {
        initMetrics();
        CancellationToken token = changeSelection();
        long startTime = System.nanoTime();

        TypeNormalizationService.NormalizationResult normalized =
                normalizationService.normalize(raw, designatedTimeColumn(config));
        token.throwIfCancelled(LOAD_OPERATION);

        TimeAxisService.TimeResolution resolution = timeAxisService.resolve(normalized.table(), config);
        LoadDiagnosticsDTO diagnostics =
                normalized.diagnostics().withTimeAxis(resolution.report(), resolution.notes());

        TableGeneration generation;
        synchronized (publishLock) {
            token.throwIfCancelled(LOAD_OPERATION);
            generation = columnCache.replaceTable(resolution.table(), resolution.timeColumn());
        }

        if (loadCounter != null) {
            loadCounter.increment();
            skippedRowCounter.increment(diagnostics.skippedRows() + resolution.report().droppedRows());
        }
        diagnosticsEvent.fire(diagnostics);

        LOG.infof("Loaded generation %d in %.2fms: %d rows, %d columns, time column '%s'",
                generation.number(),
                (System.nanoTime() - startTime) / 1_000_000.0,
                generation.rowCount(),
                generation.table().columnCount(),
                generation.timeColumn());

        return new LoadResultDTO(
                generation.number(),
                generation.table().columnNames(),
                generation.timeColumn(),
                generation.rowCount(),
                diagnostics);
    }

    public Uni<LoadResultDTO> loadAsync(RawTable raw, ImportConfiguration config) {
        return Uni.createFrom().item(() -> load(raw, config)).runSubscriptionOn(executor);
    }

    /**
     * Cancels in-flight queries and returns the token new work will run under.
     */
    public CancellationToken changeSelection() {
        synchronized (publishLock) {
            CancellationToken next = CancellationToken.create();
            currentToken.getAndSet(next).cancel();
            return next;
        }
    }

    /** Drops the published table and cancels running work. */
    public void reset() {
        changeSelection();
        columnCache.reset();
    }

    public boolean isLoaded() {
        return columnCache.isLoaded();
    }

    public List<String> columnNames() {
        return columnCache.current().table().columnNames();
    }

    /**
     * Display series of {@code signal}: downsampled values with their times.
     *
     * @param maxPoints upper bound on returned points; {@code null} for the configured default
     */
    public SeriesView series(String signal, Integer maxPoints) {
        TableGeneration generation = columnCache.current();
        int limit = maxPoints != null ? maxPoints : downsamplingService.defaultMaxPoints();
        DownsampledSeries reduced = downsamplingService.reduce(generation.getBuffer(signal), limit);
        return toView(signal, generation.timeBuffer(), reduced);
    }

    /**
     * Display series of a normalized copy of {@code signal}.
     */
    public SeriesView normalizedSeries(String signal, NormalizationMethod method, Integer maxPoints) {
        TableGeneration generation = columnCache.current();
        int limit = maxPoints != null ? maxPoints : downsamplingService.defaultMaxPoints();
        NumericBuffer normalized = signalNormalizationService.normalize(generation, signal, method);
        return toView(signal, generation.timeBuffer(), downsamplingService.reduce(normalized, limit));
    }

    public FilterResultDTO filter(List<FilterCondition> conditions) {
        TableGeneration generation = columnCache.current();
        FilterResultDTO result = filterService.evaluate(generation, conditions, currentToken.get());
        return result.withTimeSpans(filterService.toTimeSpans(generation, result.segments()));
    }

    public Uni<FilterResultDTO> filterAsync(List<FilterCondition> conditions) {
        return Uni.createFrom().item(() -> filter(conditions)).runSubscriptionOn(executor);
    }

    public Optional<StatisticsSnapshot> statistics(
            String signal, RowRange range, ThresholdMode mode, double thresholdValue, boolean percentiles) {
        return statisticsService.statistics(
                columnCache.current(), signal, range, mode, thresholdValue, percentiles);
    }

    public Optional<StatisticsSnapshot> statisticsBetween(
            String signal,
            double startSeconds,
            double endSeconds,
            ThresholdMode mode,
            double thresholdValue,
            boolean percentiles) {
        return statisticsService.statisticsForTimeRange(
                columnCache.current(), signal, startSeconds, endSeconds, mode, thresholdValue, percentiles);
    }

    public CorrelationMatrixDTO correlationMatrix(List<String> signals) {
        return correlationService.matrix(columnCache.current(), signals, currentToken.get());
    }

    public Uni<CorrelationMatrixDTO> correlationMatrixAsync(List<String> signals) {
        return Uni.createFrom().item(() -> correlationMatrix(signals)).runSubscriptionOn(executor);
    }

    public List<CorrelationEntryDTO> rankCorrelations(String target, List<String> others, int limit) {
        return correlationService.rankAgainst(
                columnCache.current(), target, others, limit, currentToken.get());
    }

    public Optional<Double> valueAt(String signal, double timeSeconds) {
        return lookupService.valueAt(columnCache.current(), signal, timeSeconds);
    }

    public Optional<RowRange> rangeOf(String signal, double startSeconds, double endSeconds) {
        return lookupService.rangeOf(columnCache.current(), signal, startSeconds, endSeconds);
    }

    private static String designatedTimeColumn(ImportConfiguration config) {
        if (config == null || config.timeMode() != TimeMode.EXISTING) {
            return null;
        }
        return config.timeColumn();
    }

    private static SeriesView toView(String signal, NumericBuffer time, DownsampledSeries reduced) {
        int[] indices = reduced.indices();
        double[] times = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            times[i] = time.get(indices[i]);
        }
        return new SeriesView(signal, indices, times, reduced.values());
    }
}
