package villagecompute.scheduler.data;

/**
 * Skip/limit pagination with a single sort key.
 *
 * @param skip
 *            rows to skip
 * @param limit
 *            maximum rows to return
 * @param sortBy
 *            entity attribute to sort on
 * @param ascending
 *            sort direction
 */
public record PageRequest(int skip, int limit, String sortBy, boolean ascending) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public PageRequest {
        skip = Math.max(skip, 0);
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    public static PageRequest of(int skip, int limit, String sortBy, boolean ascending) {
        return new PageRequest(skip, limit, sortBy, ascending);
    }
}
