package villagecompute.scheduler.api.types;

import java.util.List;

/**
 * Paginated list envelope.
 *
 * @param items
 *            current page
 * @param total
 *            rows matching the filter
 * @param skip
 *            rows skipped
 * @param limit
 *            page size
 * @param page
 *            1-indexed page number
 * @param pages
 *            total page count
 */
public record PageType<T>(List<T> items, long total, int skip, int limit, int page, long pages) {
}
