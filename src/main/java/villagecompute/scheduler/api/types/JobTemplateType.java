package villagecompute.scheduler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Template catalogue entry for API responses.
 */
public record JobTemplateType(String type, String name, String description, String category,
        @JsonProperty("estimated_duration") String estimatedDuration,
        @JsonProperty("resource_usage") String resourceUsage, @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("parameters_schema") Map<String, Object> parametersSchema,
        @JsonProperty("default_parameters") Map<String, Object> defaultParameters) {
}
