package pt.raidline.outcome.exception;

/**
 * Thrown when a {@link pt.raidline.outcome.Result} is unwrapped as the variant it is not.
 * <p>
 * Messages follow the {@code "<context>: <payload type>"} shape, where the context is either a
 * fixed phrase or the message handed to {@code expect} / {@code expectErr}.
 */
public class UnwrapException extends RuntimeException {

    public UnwrapException(String message) {
        super(message);
    }

    public static UnwrapException fromUnwrapFailure(Object error) {
        return new UnwrapException("Called unwrap on a Failure value: " + typeName(error));
    }

    public static UnwrapException fromUnwrapErrOnSuccess(Object value) {
        return new UnwrapException("Called unwrapErr on a Success value: " + typeName(value));
    }

    public static UnwrapException fromExpect(String message, Object error) {
        return new UnwrapException(message + ": " + typeName(error));
    }

    public static UnwrapException fromExpectErr(String message, Object value) {
        return new UnwrapException(message + ": " + typeName(value));
    }

    /**
     * Runtime type name of a payload, {@code "null"} when there is none.
     *
     * @param payload the success value or failure error
     * @return the fully qualified class name of the payload
     */
    public static String typeName(Object payload) {
        return payload == null ? "null" : payload.getClass().getName();
    }
}
