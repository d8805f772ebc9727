package co.fanki.flowengine.shared;

/**
 * Argument checks shared by the flow model and the layout engine.
 *
 * <p>Every check throws {@link IllegalArgumentException}: a failing
 * precondition is a programming error in the caller, not a structural
 * problem of the flow.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a dimension is a finite, strictly positive number.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is zero, negative, NaN or
     *         infinite
     */
    public static double requirePositive(final double value,
            final String message) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a spacing is a finite, non-negative number.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative, NaN or
     *         infinite
     */
    public static double requireNonNegative(final double value,
            final String message) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
