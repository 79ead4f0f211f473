package work.optiframe.kernel.optimizer;

/**
 * Thrown by validation tasks when the data describing a problem instance is invalid.
 */
public class ValidationException extends Exception {
    public ValidationException(String message) {
        super(message);
    }

    /**
     * Fails with {@code message} unless {@code condition} holds.
     */
    public static void check(boolean condition, String message) throws ValidationException {
        if (!condition) {
            throw new ValidationException(message);
        }
    }
}
