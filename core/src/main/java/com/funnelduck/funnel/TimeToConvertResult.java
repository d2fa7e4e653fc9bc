package com.funnelduck.funnel;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Distribution of the time people took from one funnel step to a later one.
 */
public final class TimeToConvertResult {

    /**
     * Histogram bin {@code [fromSeconds, toSeconds)}; the last bin is closed.
     */
    public static final class Bin {
        private final long fromSeconds;
        private final long toSeconds;
        private final long count;

        public Bin(long fromSeconds, long toSeconds, long count) {
            this.fromSeconds = fromSeconds;
            this.toSeconds = toSeconds;
            this.count = count;
        }

        @JsonProperty("from_seconds")
        public long fromSeconds() {
            return fromSeconds;
        }

        @JsonProperty("to_seconds")
        public long toSeconds() {
            return toSeconds;
        }

        @JsonProperty("count")
        public long count() {
            return count;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Bin)) return false;
            Bin that = (Bin) obj;
            return fromSeconds == that.fromSeconds && toSeconds == that.toSeconds && count == that.count;
        }

        @Override
        public int hashCode() {
            return Objects.hash(fromSeconds, toSeconds, count);
        }

        @Override
        public String toString() {
            return "[" + fromSeconds + ", " + toSeconds + "): " + count;
        }
    }

    private final int fromStep;
    private final int toStep;
    private final Long averageSeconds;
    private final Long medianSeconds;
    private final long sampleSize;
    private final List<Bin> bins;

    public TimeToConvertResult(int fromStep, int toStep, Long averageSeconds, Long medianSeconds,
                               long sampleSize, List<Bin> bins) {
        this.fromStep = fromStep;
        this.toStep = toStep;
        this.averageSeconds = averageSeconds;
        this.medianSeconds = medianSeconds;
        this.sampleSize = sampleSize;
        this.bins = List.copyOf(bins);
    }

    public static TimeToConvertResult empty(int fromStep, int toStep) {
        return new TimeToConvertResult(fromStep, toStep, null, null, 0, List.of());
    }

    @JsonProperty("from_step")
    public int fromStep() {
        return fromStep;
    }

    @JsonProperty("to_step")
    public int toStep() {
        return toStep;
    }

    @JsonProperty("average_seconds")
    public Long averageSeconds() {
        return averageSeconds;
    }

    @JsonProperty("median_seconds")
    public Long medianSeconds() {
        return medianSeconds;
    }

    @JsonProperty("sample_size")
    public long sampleSize() {
        return sampleSize;
    }

    @JsonProperty("bins")
    public List<Bin> bins() {
        return bins;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimeToConvertResult)) return false;
        TimeToConvertResult that = (TimeToConvertResult) obj;
        return fromStep == that.fromStep && toStep == that.toStep && sampleSize == that.sampleSize
            && Objects.equals(averageSeconds, that.averageSeconds)
            && Objects.equals(medianSeconds, that.medianSeconds) && bins.equals(that.bins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromStep, toStep, averageSeconds, medianSeconds, sampleSize, bins);
    }

    @Override
    public String toString() {
        return "TimeToConvertResult(" + fromStep + " -> " + toStep + ", n=" + sampleSize
            + ", avg=" + averageSeconds + ", median=" + medianSeconds + ")";
    }
}
