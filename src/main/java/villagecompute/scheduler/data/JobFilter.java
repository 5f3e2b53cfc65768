package villagecompute.scheduler.data;

import java.util.Set;

/**
 * Equality filters for listing job definitions. Null members are not applied.
 *
 * @param enabled
 *            enabled flag
 * @param templateTypes
 *            matches any of these template types
 */
public record JobFilter(Boolean enabled, Set<String> templateTypes) {

    public JobFilter {
        templateTypes = templateTypes == null ? Set.of() : Set.copyOf(templateTypes);
    }

    public static JobFilter all() {
        return new JobFilter(null, Set.of());
    }
}
