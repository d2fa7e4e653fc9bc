package com.funnelduck.funnel;

import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.cohort.CohortLookup;
import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.generator.SQLCompiler;
import com.funnelduck.query.SelectNode;
import com.funnelduck.runtime.EngineConfig;
import com.funnelduck.runtime.EventStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs funnel requests against an {@link EventStore}.
 *
 * <p>A request is validated, compiled and executed as:
 * <ul>
 *   <li>one query without a breakdown;</li>
 *   <li>two queries with a property breakdown: the broken-down query and one
 *       without breakdown for the aggregate steps;</li>
 *   <li>one query per cohort with a cohort breakdown, executed concurrently
 *       on a pool of {@link EngineConfig#breakdownParallelism()} threads.
 *       The first failing group fails the request.</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try (FunnelService service = new FunnelService(store, lookup, EngineConfig.fromSystemProperties())) {
 *       FunnelResult result = service.run(new FunnelRequestParser().parse(json));
 *   }
 * </pre>
 */
public class FunnelService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FunnelService.class);

    private final EventStore store;
    private final CohortLookup lookup;
    private final EngineConfig config;
    private final SQLCompiler compiler = new SQLCompiler();
    private final ExecutorService breakdownExecutor;

    public FunnelService(EventStore store, CohortLookup lookup, EngineConfig config) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.lookup = lookup != null ? lookup : CohortLookup.materializedOnly();
        this.config = Objects.requireNonNull(config, "config must not be null");
        AtomicInteger threadCounter = new AtomicInteger();
        this.breakdownExecutor = Executors.newFixedThreadPool(config.breakdownParallelism(), r -> {
            Thread t = new Thread(r, "funnel-breakdown-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public FunnelService(EventStore store) {
        this(store, null, EngineConfig.defaults());
    }

    /**
     * Validates the request and resolves its window.
     */
    FunnelScope scopeOf(FunnelRequest request) {
        long windowSeconds = ConversionWindow.resolveWindowSeconds(request.conversionWindowDays(),
            request.conversionWindowValue(), request.conversionWindowUnit(), config.windowMaxSeconds());
        FunnelExclusions.validate(request.exclusions(), request.steps());
        if (request.orderType() == FunnelOrderType.UNORDERED) {
            FunnelSteps.validateUnorderedSteps(request.steps());
        }
        return FunnelScope.of(request, windowSeconds, lookup);
    }

    /**
     * Runs a funnel.
     *
     * @throws com.funnelduck.exception.BadRequestException if the request is invalid
     * @throws QueryExecutionException if a query fails
     */
    public FunnelResult run(FunnelRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        FunnelScope scope = scopeOf(request);
        logger.debug("Running {}, window {} s", request, scope.windowSeconds());

        if (request.hasCohortBreakdown()) {
            return runCohortBreakdown(scope);
        }
        if (request.hasPropertyBreakdown()) {
            return runPropertyBreakdown(scope);
        }
        CompiledQuery compiled = compile(FunnelQueryBuilder.buildFunnelQuery(scope));
        List<FunnelStepResult> steps = FunnelResults.computeStepResults(store.query(compiled),
            request.steps(), request.displayMode());
        return new FunnelResult(false, null, steps, null, false, request.samplingFactor(), List.of(compiled));
    }

    /**
     * Time from {@code fromStep} to {@code toStep} (0-based) for people who
     * reached {@code toStep}.
     */
    public TimeToConvertResult timeToConvert(FunnelRequest request, int fromStep, int toStep) {
        Objects.requireNonNull(request, "request must not be null");
        TimeToConvert.validateSteps(request.numSteps(), fromStep, toStep);
        FunnelScope scope = scopeOf(request);
        CompiledQuery compiled = compile(TimeToConvert.buildQuery(scope, fromStep, toStep));
        return TimeToConvert.parseRows(store.query(compiled), fromStep, toStep);
    }

    // ==================== Breakdowns ====================

    private FunnelResult runPropertyBreakdown(FunnelScope scope) {
        FunnelRequest request = scope.request();
        int limit = request.breakdownLimit() != null ? request.breakdownLimit() : config.breakdownLimit();

        CompiledQuery breakdownQuery = compile(
            FunnelQueryBuilder.buildPropertyBreakdownQuery(scope, request.breakdownProperty(), limit));
        CompiledQuery aggregateQuery = compile(FunnelQueryBuilder.buildFunnelQuery(scope));

        List<Map<String, Object>> rows = store.query(breakdownQuery);
        List<FunnelStepResult> steps = FunnelResults.computePropertyBreakdownResults(rows,
            request.steps(), request.displayMode());
        long distinctValues = FunnelResults.totalBreakdownCount(rows);
        boolean truncated = distinctValues > limit;
        if (truncated) {
            logger.warn("Breakdown by {} truncated to {} of {} values", request.breakdownProperty(),
                limit, distinctValues);
        }

        List<FunnelStepResult> aggregate = FunnelResults.computeStepResults(store.query(aggregateQuery),
            request.steps(), request.displayMode());
        return new FunnelResult(true, request.breakdownProperty(), steps, aggregate, truncated,
            request.samplingFactor(), List.of(breakdownQuery, aggregateQuery));
    }

    private FunnelResult runCohortBreakdown(FunnelScope scope) {
        FunnelRequest request = scope.request();
        List<CohortFilterInput> cohorts = request.breakdownCohorts();

        List<CompiledQuery> compiled = new ArrayList<>(cohorts.size());
        for (int i = 0; i < cohorts.size(); i++) {
            compiled.add(compile(FunnelQueryBuilder.buildCohortBreakdownQuery(scope, cohorts.get(i), i)));
        }

        List<CompletableFuture<List<Map<String, Object>>>> futures = new ArrayList<>(cohorts.size());
        for (int i = 0; i < cohorts.size(); i++) {
            CompiledQuery query = compiled.get(i);
            CohortFilterInput cohort = cohorts.get(i);
            futures.add(CompletableFuture
                .supplyAsync(() -> store.query(query), breakdownExecutor)
                .whenComplete((rows, error) -> {
                    if (error != null) {
                        logger.error("Breakdown group for cohort {} failed", cohort.cohortId(), error);
                    }
                }));
        }

        List<List<FunnelStepResult>> groups = new ArrayList<>(cohorts.size());
        for (int i = 0; i < futures.size(); i++) {
            List<Map<String, Object>> rows = join(futures.get(i), futures);
            groups.add(FunnelResults.computeCohortBreakdownResults(rows, request.steps(),
                request.displayMode(), cohorts.get(i).name()));
        }

        List<FunnelStepResult> steps = FunnelResults.sortGroups(groups);
        List<FunnelStepResult> aggregate = FunnelResults.computeAggregateSteps(steps, request.steps(),
            request.displayMode());
        return new FunnelResult(true, "$cohort", steps, aggregate, false, request.samplingFactor(), compiled);
    }

    private static <T> T join(CompletableFuture<T> future, List<? extends CompletableFuture<?>> all) {
        try {
            return future.join();
        } catch (CompletionException e) {
            all.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new QueryExecutionException("Breakdown query failed: " + cause.getMessage(), cause, null);
        }
    }

    private CompiledQuery compile(SelectNode node) {
        CompiledQuery compiled = compiler.compile(node);
        if (logger.isDebugEnabled()) {
            logger.debug("Compiled funnel query ({} params):\n{}", compiled.params().size(), compiled.sql());
        }
        return compiled;
    }

    @Override
    public void close() {
        breakdownExecutor.shutdown();
        try {
            if (!breakdownExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                breakdownExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            breakdownExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
