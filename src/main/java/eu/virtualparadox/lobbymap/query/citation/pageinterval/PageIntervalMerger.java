package eu.virtualparadox.lobbymap.query.citation.pageinterval;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Merges overlapping or adjacent page intervals into a minimal sorted set.
 * <p>
 * Example: {@code [1..3], [2..5], [7..7], [8..10]} becomes {@code [1..5], [7..10]}.
 * Null or empty input yields an empty list.
 */
@Component
public class PageIntervalMerger {

    /**
     * @param intervals intervals to merge; may be {@code null} or empty
     * @return merged intervals sorted by start page, never {@code null}
     * @throws IllegalArgumentException if any interval has {@code fromPage > toPage}
     */
    public List<PageInterval> merge(final List<PageInterval> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            return new ArrayList<>();
        }

        final List<PageInterval> sorted = new ArrayList<>(intervals.size());
        for (final PageInterval interval : intervals) {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.fromPage() > interval.toPage()) {
                throw new IllegalArgumentException("Invalid interval: fromPage (" + interval.fromPage()
                        + ") cannot be greater than toPage (" + interval.toPage() + ")");
            }
            sorted.add(interval);
        }
        sorted.sort(Comparator.comparingInt(PageInterval::fromPage).thenComparingInt(PageInterval::toPage));

        final List<PageInterval> merged = new ArrayList<>();
        PageInterval current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            final PageInterval next = sorted.get(i);
            if (current.toPage() + 1 >= next.fromPage()) {
                current = new PageInterval(current.fromPage(), Math.max(current.toPage(), next.toPage()));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }
}
