package work.optiframe.kernel.api;

import java.util.Locale;

/**
 * What a step does when more than one of its tasks produces the same type.
 */
public enum DuplicateOutputPolicy {
    /** The value of whichever producer ran last in schedule order is kept. */
    LAST_WRITE_WINS,
    /** The step fails before running any task. */
    REJECT;

    public static DuplicateOutputPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return LAST_WRITE_WINS;
        }
        try {
            return DuplicateOutputPolicy.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported duplicate output policy: " + value);
        }
    }
}
