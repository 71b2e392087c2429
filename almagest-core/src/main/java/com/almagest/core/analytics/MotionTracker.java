package com.almagest.core.analytics;

import com.almagest.core.exception.InsufficientDataException;
import com.almagest.core.exception.NonMonotonicInputException;
import com.almagest.core.geometry.CircularGeometry;
import com.almagest.core.model.Body;
import com.almagest.core.model.LongitudeSample;
import com.almagest.core.model.MotionDirection;
import com.almagest.core.model.MotionSample;
import com.almagest.core.model.Position;
import com.almagest.core.model.RetrogradeInterval;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Classifies the apparent motion of one body along the ecliptic, step by step.
 *
 * <p>Each step compares a sample with its predecessor through
 * {@link CircularGeometry#signedDelta(double, double)}: positive is direct, negative is
 * retrograde, zero is stationary. The first sample has nothing to compare with and is
 * {@link MotionDirection#UNKNOWN}.</p>
 *
 * <p><b>Sampling precondition:</b> the true travel between consecutive samples must stay below
 * half a circle. The shortest-rotation rule cannot tell a 200° forward step from a 160° backward
 * one, so sampling too coarsely (the Moon moves ~13°/day) silently yields wrong directions.
 * Choosing the cadence is up to the caller.</p>
 */
public final class MotionTracker {

    private MotionTracker() {} // Utility class

    /**
     * Classify a chronological sequence of longitudes.
     *
     * <p>The ordering is checked immediately; the classification itself is computed lazily and
     * the returned sequence can be iterated any number of times, always in input order.</p>
     *
     * @throws NonMonotonicInputException if instants are not strictly increasing
     */
    public static Iterable<MotionSample> classify(List<LongitudeSample> samples) {
        List<LongitudeSample> snapshot = List.copyOf(samples);
        requireStrictlyIncreasing(snapshot);
        return () -> new ClassifyingIterator(snapshot);
    }

    /**
     * Classify positions of a single body.
     *
     * @throws IllegalArgumentException   if the positions belong to more than one body
     * @throws NonMonotonicInputException if instants are not strictly increasing
     */
    public static Iterable<MotionSample> classifyPositions(List<Position> positions) {
        return classify(toSamples(positions));
    }

    /**
     * Direction of a single step.
     */
    public static MotionDirection directionOf(double previousLongitude, double currentLongitude) {
        double d = CircularGeometry.signedDelta(previousLongitude, currentLongitude);
        if (d > 0) return MotionDirection.DIRECT;
        if (d < 0) return MotionDirection.RETROGRADE;
        return MotionDirection.STATIONARY;
    }

    /**
     * Direction of the last step in the sequence.
     *
     * @throws InsufficientDataException if fewer than two samples are given
     */
    public static MotionDirection latestDirection(List<LongitudeSample> samples) {
        if (samples.size() < 2) {
            throw new InsufficientDataException("Direction of motion", 2, samples.size());
        }
        requireStrictlyIncreasing(samples);
        int n = samples.size();
        return directionOf(samples.get(n - 2).longitude(), samples.get(n - 1).longitude());
    }

    /**
     * Contiguous runs of retrograde steps. Each interval starts at the sample preceding the
     * first retrograde step and ends at the last retrograde sample, so it spans the whole
     * observed backward travel.
     *
     * @throws NonMonotonicInputException if instants are not strictly increasing
     */
    public static List<RetrogradeInterval> retrogradeIntervals(List<LongitudeSample> samples) {
        List<RetrogradeInterval> intervals = new ArrayList<>();

        MotionSample previous = null;
        MotionSample runStart = null;
        MotionSample runEnd = null;

        for (MotionSample sample : classify(samples)) {
            if (sample.direction() == MotionDirection.RETROGRADE) {
                if (runStart == null) {
                    runStart = previous;
                }
                runEnd = sample;
            } else if (runStart != null) {
                intervals.add(toInterval(runStart, runEnd));
                runStart = null;
            }
            previous = sample;
        }
        if (runStart != null) {
            intervals.add(toInterval(runStart, runEnd));
        }
        return intervals;
    }

    static List<LongitudeSample> toSamples(List<Position> positions) {
        List<LongitudeSample> samples = new ArrayList<>(positions.size());
        Body body = null;
        for (Position p : positions) {
            if (body == null) {
                body = p.body();
            } else if (!body.equals(p.body())) {
                throw new IllegalArgumentException(
                    "Motion is tracked per body, got " + body + " and " + p.body());
            }
            samples.add(LongitudeSample.of(p));
        }
        return samples;
    }

    private static RetrogradeInterval toInterval(MotionSample start, MotionSample end) {
        return new RetrogradeInterval(start.at(), end.at(), start.longitude(), end.longitude());
    }

    private static void requireStrictlyIncreasing(List<LongitudeSample> samples) {
        for (int i = 1; i < samples.size(); i++) {
            LongitudeSample prev = samples.get(i - 1);
            LongitudeSample cur = samples.get(i);
            if (!cur.at().isAfter(prev.at())) {
                throw new NonMonotonicInputException(i, prev.at(), cur.at());
            }
        }
    }

    private static final class ClassifyingIterator implements Iterator<MotionSample> {

        private final List<LongitudeSample> samples;
        private int index;

        ClassifyingIterator(List<LongitudeSample> samples) {
            this.samples = samples;
        }

        @Override
        public boolean hasNext() {
            return index < samples.size();
        }

        @Override
        public MotionSample next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            LongitudeSample current = samples.get(index);
            MotionDirection direction = index == 0
                ? MotionDirection.UNKNOWN
                : directionOf(samples.get(index - 1).longitude(), current.longitude());
            index++;
            return new MotionSample(current.at(), current.longitude(), direction);
        }
    }
}
