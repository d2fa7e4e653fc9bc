package com.funnelduck.funnel;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the rows of the funnel queries into {@link FunnelStepResult}s.
 *
 * <p>Rows hold {@code step_num} (1-based), {@code entered}, {@code next_step}
 * and {@code avg_time_seconds}, plus {@code breakdown_value} and
 * {@code total_bd_count} for property breakdowns. Drivers return numbers as
 * numeric types or as strings; both are accepted.
 */
public final class FunnelResults {

    /** Group label for people without a breakdown value. */
    public static final String NONE_LABEL = "(none)";

    private FunnelResults() {
    }

    /**
     * One result per step; N zero steps when there are no rows.
     */
    public static List<FunnelStepResult> computeStepResults(List<Map<String, Object>> rows,
                                                            List<FunnelStep> steps, StepDisplayMode mode) {
        int n = steps.size();
        long[] counts = new long[n];
        Double[] avgTimes = new Double[n];
        for (Map<String, Object> row : rows) {
            int idx = (int) toLong(row.get("step_num")) - 1;
            if (idx < 0 || idx >= n) {
                continue;
            }
            counts[idx] = toLong(row.get("entered"));
            avgTimes[idx] = toDouble(row.get("avg_time_seconds"));
        }
        return buildSteps(counts, avgTimes, steps, mode);
    }

    /**
     * Groups rows by {@code breakdown_value}, computes each group's steps and
     * concatenates the groups by step-1 count descending, {@value #NONE_LABEL}
     * last. Empty values are labeled {@value #NONE_LABEL}.
     */
    public static List<FunnelStepResult> computePropertyBreakdownResults(List<Map<String, Object>> rows,
                                                                         List<FunnelStep> steps,
                                                                         StepDisplayMode mode) {
        Map<String, List<Map<String, Object>>> grouped = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Object raw = row.get("breakdown_value");
            String value = raw == null || raw.toString().isEmpty() ? NONE_LABEL : raw.toString();
            grouped.computeIfAbsent(value, k -> new ArrayList<>()).add(row);
        }
        List<List<FunnelStepResult>> groups = new ArrayList<>();
        for (Map.Entry<String, List<Map<String, Object>>> e : grouped.entrySet()) {
            List<FunnelStepResult> group = new ArrayList<>();
            for (FunnelStepResult r : computeStepResults(e.getValue(), steps, mode)) {
                group.add(r.withBreakdownValue(e.getKey()));
            }
            groups.add(group);
        }
        return sortGroups(groups);
    }

    /**
     * Steps of one cohort group, labeled with the cohort name.
     */
    public static List<FunnelStepResult> computeCohortBreakdownResults(List<Map<String, Object>> rows,
                                                                       List<FunnelStep> steps,
                                                                       StepDisplayMode mode, String label) {
        List<FunnelStepResult> group = new ArrayList<>();
        for (FunnelStepResult r : computeStepResults(rows, steps, mode)) {
            group.add(r.withBreakdownValue(label));
        }
        return group;
    }

    /**
     * Sums the counts of several groups per step. Times cannot be summed, so
     * the aggregate carries none.
     */
    public static List<FunnelStepResult> computeAggregateSteps(List<FunnelStepResult> groupSteps,
                                                               List<FunnelStep> steps, StepDisplayMode mode) {
        int n = steps.size();
        long[] counts = new long[n];
        for (FunnelStepResult r : groupSteps) {
            int idx = r.step() - 1;
            if (idx >= 0 && idx < n) {
                counts[idx] += r.count();
            }
        }
        return buildSteps(counts, new Double[n], steps, mode);
    }

    /**
     * Orders flattened groups by their first step's count descending with
     * {@value #NONE_LABEL} last, and flattens them again.
     */
    public static List<FunnelStepResult> sortGroups(List<List<FunnelStepResult>> groups) {
        List<List<FunnelStepResult>> sorted = new ArrayList<>(groups);
        sorted.sort(Comparator
            .comparing((List<FunnelStepResult> g) -> NONE_LABEL.equals(g.get(0).breakdownValue()))
            .thenComparing(g -> g.get(0).count(), Comparator.reverseOrder()));
        List<FunnelStepResult> flat = new ArrayList<>();
        sorted.forEach(flat::addAll);
        return flat;
    }

    /**
     * Number of distinct non-empty breakdown values before the top-N cut.
     */
    public static long totalBreakdownCount(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? 0 : toLong(rows.get(0).get("total_bd_count"));
    }

    // ==================== Arithmetic ====================

    private static List<FunnelStepResult> buildSteps(long[] counts, Double[] avgTimes,
                                                     List<FunnelStep> steps, StepDisplayMode mode) {
        List<FunnelStepResult> results = new ArrayList<>(steps.size());
        long first = counts[0];
        for (int i = 0; i < steps.size(); i++) {
            long count = counts[i];
            double rate;
            long dropOff;
            double dropOffRate;
            Long avg;
            if (i == 0) {
                rate = count > 0 ? 1.0 : 0.0;
                dropOff = 0;
                dropOffRate = 0.0;
                avg = null;
            } else {
                long previous = counts[i - 1];
                long base = mode == StepDisplayMode.RELATIVE ? previous : first;
                rate = ratio(count, base);
                dropOff = previous - count;
                dropOffRate = ratio(dropOff, previous);
                avg = avgTimes[i] == null || avgTimes[i].isNaN() || avgTimes[i] < 0
                    ? null
                    : Math.round(avgTimes[i]);
            }
            FunnelStep step = steps.get(i);
            results.add(new FunnelStepResult(i + 1, step.label(), step.eventName(), count, rate,
                dropOff, dropOffRate, avg, null));
        }
        return results;
    }

    static double ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(numerator)
            .divide(BigDecimal.valueOf(denominator), 4, RoundingMode.HALF_UP)
            .doubleValue();
    }

    static long toLong(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String s = value.toString();
        return s.isEmpty() ? 0 : new BigDecimal(s).longValue();
    }

    static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String s = value.toString();
        if (s.isEmpty() || s.equalsIgnoreCase("nan")) {
            return null;
        }
        return Double.parseDouble(s);
    }
}
