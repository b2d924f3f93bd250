package net.gridcollate.service.collate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.gridcollate.model.image.ImageRecord;
import org.springframework.stereotype.Component;

/**
 * Orders a candidate pool by visual weight and slices it into full grid batches.
 *
 * <p>Sort key, in priority order:
 * <ol>
 *   <li>blackness, descending (dark images first)</li>
 *   <li>whiteness, ascending</li>
 *   <li>distance of the dominant colour from mid-gray, ascending</li>
 *   <li>filename, then fingerprint, as tie-breakers</li>
 * </ol>
 * The comparator is a total order, so the output depends only on the multiset of
 * records, never on the order they arrived in.</p>
 */
@Component
public class BatchGrouper {

    static final Comparator<ImageRecord> GRID_ORDER = Comparator
        .comparingDouble(ImageRecord::blackness).reversed()
        .thenComparingDouble(ImageRecord::whiteness)
        .thenComparingDouble(ImageRecord::colorDistanceFromGray)
        .thenComparing(ImageRecord::filename)
        .thenComparing(ImageRecord::fingerprint);

    /**
     * Full batches plus whatever did not fill another one.
     *
     * @param batches ordered slices of exactly the grid capacity
     * @param remainder records left over; the untouched input when it was below capacity
     */
    public record Grouping(List<List<ImageRecord>> batches, List<ImageRecord> remainder) {

        public Grouping {
            batches = batches.stream().map(List::copyOf).toList();
            remainder = List.copyOf(remainder);
        }
    }

    /**
     * Sorts {@code pool} and cuts it into slices of {@code capacity}.
     * Pools smaller than {@code capacity} are returned unchanged as the remainder.
     */
    public Grouping group(List<ImageRecord> pool, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (pool.size() < capacity) {
            return new Grouping(List.of(), pool);
        }

        List<ImageRecord> ordered = sort(pool);
        int fullBatches = ordered.size() / capacity;
        List<List<ImageRecord>> batches = new ArrayList<>(fullBatches);
        for (int b = 0; b < fullBatches; b++) {
            batches.add(ordered.subList(b * capacity, (b + 1) * capacity));
        }
        return new Grouping(batches, ordered.subList(fullBatches * capacity, ordered.size()));
    }

    /** Returns a sorted copy of {@code pool} in grid order. */
    public List<ImageRecord> sort(List<ImageRecord> pool) {
        List<ImageRecord> ordered = new ArrayList<>(pool);
        ordered.sort(GRID_ORDER);
        return ordered;
    }
}
