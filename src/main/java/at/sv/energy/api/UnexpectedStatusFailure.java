package at.sv.energy.api;

import lombok.Getter;

/**
 * Exception to signal any status code other than 200 or 403.
 */
@Getter
public final class UnexpectedStatusFailure extends RuntimeException {

    private final int statusCode;

    public UnexpectedStatusFailure(int statusCode, String body) {
        super("API request error (" + statusCode + "): " + body);
        this.statusCode = statusCode;
    }
}
