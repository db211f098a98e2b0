package at.sv.energy.api;

import lombok.Getter;

/**
 * Signals a local validation failure. Thrown before any request is sent to the device.
 */
@Getter
public final class InvalidArgumentException extends IllegalArgumentException {

    public static final String NO_FIELDS_PROVIDED = "no fields provided";

    private final String field;
    private final String reason;
    /**
     * Optional suggestion on how to fix the input, or null.
     */
    private final String hint;

    public InvalidArgumentException(String field, String reason) {
        this(field, reason, null);
    }

    public InvalidArgumentException(String field, String reason, String hint) {
        super(createMessage(field, reason, hint));
        this.field = field;
        this.reason = reason;
        this.hint = hint;
    }

    public static InvalidArgumentException noFieldsProvided(String field) {
        return new InvalidArgumentException(field, NO_FIELDS_PROVIDED);
    }

    public boolean isNoFieldsProvided() {
        return NO_FIELDS_PROVIDED.equals(reason);
    }

    private static String createMessage(String field, String reason, String hint) {
        String message = "Invalid " + field + ": " + reason;
        if (hint != null) {
            return message + ". " + hint;
        }
        return message;
    }
}
