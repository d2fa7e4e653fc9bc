package com.funnelduck.funnel;

import static com.funnelduck.generator.Functions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.expression.Expression;
import com.funnelduck.query.SelectBuilder;
import com.funnelduck.query.SelectNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Time from one funnel step to a later one for the people who made it.
 *
 * <p>The query reuses the per-user CTEs of the funnel and returns a single
 * row with {@code avg_seconds}, {@code sample_size}, {@code min_seconds},
 * {@code max_seconds} and the raw {@code durations}. People without a
 * timestamp for either step are skipped and durations outside
 * {@code [0, window]} are ignored. The median and the histogram are computed
 * here from the durations.
 */
public final class TimeToConvert {

    public static final int MAX_BINS = 60;

    private TimeToConvert() {
    }

    /**
     * @throws BadRequestException unless {@code 0 <= fromStep < toStep < numSteps}
     */
    public static void validateSteps(int numSteps, int fromStep, int toStep) {
        if (fromStep < 0 || fromStep >= toStep) {
            throw new BadRequestException("from_step must be non-negative and strictly less than to_step, got "
                + fromStep + " -> " + toStep);
        }
        if (toStep >= numSteps) {
            throw new BadRequestException("to_step " + toStep + " out of range (max " + (numSteps - 1) + ")");
        }
    }

    public static SelectNode buildQuery(FunnelScope scope, int fromStep, int toStep) {
        validateSteps(scope.steps().size(), fromStep, toStep);
        FunnelCtes chain = FunnelCtes.build(scope);

        SelectNode converted = SelectBuilder.select(
                div(sub(col(FunnelCtes.stepMs(toStep)), col(FunnelCtes.stepMs(fromStep))), literal(1000.0))
                    .as("duration_seconds"))
            .from(FunnelCtes.PER_USER)
            .where(gte(col("max_step"), named("to_step_num", "UInt64", (long) toStep + 1)),
                gt(col(FunnelCtes.stepMs(fromStep)), literal(0)),
                gt(col(FunnelCtes.stepMs(toStep)), literal(0)))
            .where(FunnelExclusions.notExcluded(scope.exclusions()))
            .build();

        Expression d = col("duration_seconds");
        Expression inWindow = and(gte(d, literal(0)),
            lte(d, named("window_seconds", "Float64", (double) scope.windowSeconds())));
        return SelectBuilder.select(
                avgIf(d, inWindow).as("avg_seconds"),
                toInt64(countIf(inWindow)).as("sample_size"),
                minIf(d, inWindow).as("min_seconds"),
                maxIf(d, inWindow).as("max_seconds"),
                groupArrayIf(d, inWindow).as("durations"))
            .withAll(chain.ctes())
            .with("converted", converted)
            .from("converted")
            .build();
    }

    /**
     * Reduces the single result row.
     */
    public static TimeToConvertResult parseRows(List<Map<String, Object>> rows, int fromStep, int toStep) {
        if (rows.isEmpty()) {
            return TimeToConvertResult.empty(fromStep, toStep);
        }
        Map<String, Object> row = rows.get(0);
        long sampleSize = FunnelResults.toLong(row.get("sample_size"));
        List<Double> durations = durations(row.get("durations"));
        if (sampleSize == 0 || durations.isEmpty()) {
            return TimeToConvertResult.empty(fromStep, toStep);
        }
        Collections.sort(durations);

        Double avg = FunnelResults.toDouble(row.get("avg_seconds"));
        Long averageSeconds = avg == null || avg.isNaN() ? null : Math.round(avg);
        Long medianSeconds = Math.round(median(durations));

        Double min = FunnelResults.toDouble(row.get("min_seconds"));
        Double max = FunnelResults.toDouble(row.get("max_seconds"));
        double minVal = min != null ? min : durations.get(0);
        double maxVal = max != null ? max : durations.get(durations.size() - 1);

        return new TimeToConvertResult(fromStep, toStep, averageSeconds, medianSeconds, sampleSize,
            histogram(durations, minVal, maxVal, sampleSize));
    }

    /**
     * Exact median of sorted values; the mean of the two middle values for
     * an even count.
     */
    static double median(List<Double> sorted) {
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Equal-width bins: {@code min(60, ceil(cbrt(n)))} of them, at least one
     * second wide. A zero range gives the single bin {@code [v, v + 1]}.
     */
    static List<TimeToConvertResult.Bin> histogram(List<Double> durations, double minVal, double maxVal,
                                                   long sampleSize) {
        double range = maxVal - minVal;
        if (range == 0) {
            long point = Math.round(minVal);
            return List.of(new TimeToConvertResult.Bin(point, point + 1, sampleSize));
        }
        int binCount = (int) Math.max(1, Math.min(MAX_BINS, Math.ceil(Math.cbrt(sampleSize))));
        long binWidth = (long) Math.max(1, Math.ceil(range / binCount));

        long[] counts = new long[binCount];
        for (double d : durations) {
            int idx = (int) Math.max(0, Math.min(binCount - 1, Math.floor((d - minVal) / binWidth)));
            counts[idx]++;
        }
        List<TimeToConvertResult.Bin> bins = new ArrayList<>(binCount);
        long maxRounded = Math.round(maxVal);
        for (int i = 0; i < binCount; i++) {
            long from = Math.round(minVal + (double) i * binWidth);
            long to = i == binCount - 1 ? maxRounded : Math.round(minVal + (double) (i + 1) * binWidth);
            bins.add(new TimeToConvertResult.Bin(from, to, counts[i]));
        }
        return bins;
    }

    private static List<Double> durations(Object value) {
        List<Double> out = new ArrayList<>();
        if (value == null) {
            return out;
        }
        Object source = value;
        Iterable<?> items;
        if (source instanceof Object[]) {
            items = Arrays.asList((Object[]) source);
        } else if (source instanceof double[]) {
            List<Double> boxed = new ArrayList<>();
            for (double d : (double[]) source) {
                boxed.add(d);
            }
            items = boxed;
        } else if (source instanceof Iterable) {
            items = (Iterable<?>) source;
        } else {
            throw new IllegalStateException("Unexpected durations value: " + source.getClass().getName());
        }
        for (Object item : items) {
            Double d = FunnelResults.toDouble(item);
            if (d != null) {
                out.add(d);
            }
        }
        return out;
    }
}
