package villagecompute.scheduler.jobs;

import java.util.Map;

/**
 * Descriptive metadata of a registered template, surfaced to admin tooling.
 */
public record TemplateMetadata(String type, String name, String description, String category,
        String estimatedDuration, String resourceUsage, String riskLevel, Map<String, Object> parametersSchema,
        Map<String, Object> defaultParameters) {
}
