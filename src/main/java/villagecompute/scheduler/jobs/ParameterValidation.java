package villagecompute.scheduler.jobs;

/**
 * Outcome of {@link JobTemplate#validateParams}.
 *
 * @param valid
 *            whether the parameters are acceptable
 * @param error
 *            validator message when invalid, null otherwise
 */
public record ParameterValidation(boolean valid, String error) {

    private static final ParameterValidation VALID = new ParameterValidation(true, null);

    public static ParameterValidation ok() {
        return VALID;
    }

    public static ParameterValidation invalid(String error) {
        return new ParameterValidation(false, error);
    }
}
