package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Acknowledgement of an asynchronous "run now" request.
 */
public record JobTriggerType(@JsonProperty("job_id") UUID jobId, String status,
        @JsonProperty("triggered_by") String triggeredBy) {
}
