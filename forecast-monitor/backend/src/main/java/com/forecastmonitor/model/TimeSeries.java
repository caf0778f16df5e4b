package com.forecastmonitor.model;

import com.forecastmonitor.exception.InvalidSeriesException;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, date-ordered sequence of observations.
 *
 * <p>Dates are strictly increasing and every value is finite. An empty series is allowed here;
 * callers that need data reject it themselves.
 */
public final class TimeSeries implements Iterable<SeriesPoint> {

    private static final TimeSeries EMPTY = new TimeSeries(List.of());

    private final List<SeriesPoint> points;

    private TimeSeries(List<SeriesPoint> points) {
        this.points = points;
    }

    public static TimeSeries of(List<SeriesPoint> points) {
        if (points == null || points.isEmpty()) {
            return EMPTY;
        }
        List<SeriesPoint> copy = List.copyOf(points);
        SeriesPoint previous = null;
        for (int i = 0; i < copy.size(); i++) {
            SeriesPoint point = copy.get(i);
            if (point.date() == null) {
                throw new InvalidSeriesException("Point " + i + " has no date.");
            }
            if (!Double.isFinite(point.value())) {
                throw new InvalidSeriesException("Point " + i + " has a non-finite value.");
            }
            if (previous != null && !point.date().isAfter(previous.date())) {
                throw new InvalidSeriesException(
                    "Dates must be strictly increasing: " + point.date() + " follows " + previous.date() + ".");
            }
            previous = point;
        }
        return new TimeSeries(copy);
    }

    public static TimeSeries empty() {
        return EMPTY;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SeriesPoint get(int index) {
        return points.get(index);
    }

    public SeriesPoint last() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Series is empty");
        }
        return points.get(points.size() - 1);
    }

    public double[] values() {
        return points.stream().mapToDouble(SeriesPoint::value).toArray();
    }

    public List<SeriesPoint> points() {
        return points;
    }

    @Override
    public Iterator<SeriesPoint> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points);
    }

    @Override
    public String toString() {
        return "TimeSeries" + points;
    }
}
