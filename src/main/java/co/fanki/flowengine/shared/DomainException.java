package co.fanki.flowengine.shared;

/**
 * Base exception for flow engine domain errors.
 *
 * <p>Raised when an input that reaches the engine cannot be turned into a
 * flow at all, for example a stored node array that names an unknown
 * question type. Structural problems of a well-formed flow are never
 * thrown: the validator reports them as data.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error code for stored node/edge JSON that cannot be decoded. */
    public static final String INVALID_FLOW_JSON = "INVALID_FLOW_JSON";

    /** Error code for a generated outline that cannot become a flow. */
    public static final String INVALID_OUTLINE = "INVALID_OUTLINE";

    /** Error code for layout settings that cannot be understood. */
    public static final String INVALID_LAYOUT = "INVALID_LAYOUT";

    /** Error code for a request missing a required field. */
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    private final String errorCode;

    /**
     * Creates a new domain exception with the generic error code.
     *
     * @param message the error message
     */
    public DomainException(final String message) {
        this(message, "DOMAIN_ERROR");
    }

    /**
     * Creates a new domain exception with a message and error code.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     */
    public DomainException(final String message, final String theErrorCode) {
        super(message);
        this.errorCode = theErrorCode;
    }

    /**
     * Creates a new domain exception with message, error code, and cause.
     *
     * @param message the error message
     * @param theErrorCode the specific error code
     * @param cause the underlying cause
     */
    public DomainException(final String message, final String theErrorCode,
            final Throwable cause) {
        super(message, cause);
        this.errorCode = theErrorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }

}
