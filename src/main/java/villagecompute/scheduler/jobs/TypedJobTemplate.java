package villagecompute.scheduler.jobs;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base class for templates whose parameters bind to a typed record.
 *
 * <p>
 * The raw parameter map is merged over {@link #getDefaultParams()} and converted with Jackson, so unknown keys and type
 * mismatches are rejected before {@link #validate(Object)} sees a fully typed value.
 *
 * @param <P>
 *            parameter type, usually a record with snake_case {@code @JsonProperty} names
 */
public abstract class TypedJobTemplate<P> implements JobTemplate {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final Class<P> parameterType;

    protected TypedJobTemplate(Class<P> parameterType) {
        this.parameterType = parameterType;
    }

    /**
     * Validates the typed parameters. Called only after binding succeeded.
     */
    protected abstract ParameterValidation validate(P params);

    protected abstract JobResult execute(JobExecutionContext context, P params) throws Exception;

    @Override
    public final ParameterValidation validateParams(Map<String, Object> params) {
        P typed;
        try {
            typed = bind(params);
        } catch (IllegalArgumentException e) {
            return ParameterValidation.invalid(describeBindingFailure(e));
        }
        return validate(typed);
    }

    @Override
    public final JobResult execute(JobExecutionContext context) throws Exception {
        return execute(context, bind(context.parameters()));
    }

    /**
     * Converts a parameter map into {@code P}, filling absent keys from the defaults.
     *
     * @throws IllegalArgumentException
     *             when the map does not bind
     */
    public P bind(Map<String, Object> params) {
        Map<String, Object> merged = new LinkedHashMap<>(getDefaultParams());
        if (params != null) {
            merged.putAll(params);
        }
        return MAPPER.convertValue(merged, parameterType);
    }

    private static String describeBindingFailure(IllegalArgumentException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UnrecognizedPropertyException unknown) {
            return "Unknown parameter '" + unknown.getPropertyName() + "'";
        }
        if (cause instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            String path = mapping.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
            return "Invalid value for parameter '" + path + "'";
        }
        return "Invalid parameters: " + (cause != null ? cause.getMessage() : e.getMessage());
    }
}
