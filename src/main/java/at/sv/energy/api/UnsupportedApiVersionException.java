package at.sv.energy.api;

import lombok.Getter;

@Getter
public final class UnsupportedApiVersionException extends RuntimeException {

    private final String expected;
    private final String actual;

    public UnsupportedApiVersionException(String expected, String actual) {
        super("Unsupported API version '" + actual + "', expected version '" + expected + "'");
        this.expected = expected;
        this.actual = actual;
    }
}
