package villagecompute.scheduler.data.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Recipients notified when an execution finishes.
 *
 * @param onSuccess
 *            recipients for {@code success}
 * @param onFailure
 *            recipients for {@code failed} and {@code timeout}
 */
public record NotificationTargets(@JsonProperty("on_success") List<String> onSuccess,
        @JsonProperty("on_failure") List<String> onFailure) {

    public NotificationTargets {
        onSuccess = onSuccess == null ? List.of() : List.copyOf(onSuccess);
        onFailure = onFailure == null ? List.of() : List.copyOf(onFailure);
    }

    public static NotificationTargets none() {
        return new NotificationTargets(List.of(), List.of());
    }

    /**
     * Selects the recipient list matching a final execution status. Cancelled and orphaned runs notify nobody.
     *
     * @param status
     *            terminal execution status
     * @return recipients, possibly empty
     */
    public List<String> recipientsFor(ExecutionStatus status) {
        if (status == ExecutionStatus.SUCCESS) {
            return onSuccess;
        }
        if (status != null && status.isFailure()) {
            return onFailure;
        }
        return List.of();
    }
}
