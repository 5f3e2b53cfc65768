package villagecompute.scheduler.data;

import java.util.List;
import java.util.function.Function;

/**
 * One page of query results plus the total match count.
 *
 * @param items
 *            rows on this page
 * @param total
 *            rows matching the filter across all pages
 * @param skip
 *            rows skipped
 * @param limit
 *            page size
 */
public record Page<T>(List<T> items, long total, int skip, int limit) {

    /**
     * 1-indexed page number.
     */
    public int page() {
        return limit > 0 ? (skip / limit) + 1 : 1;
    }

    public long pages() {
        return limit > 0 ? (total + limit - 1) / limit : 1;
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(items.stream().map(mapper).toList(), total, skip, limit);
    }
}
