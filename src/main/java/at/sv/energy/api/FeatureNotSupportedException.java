package at.sv.energy.api;

import lombok.Getter;

@Getter
public final class FeatureNotSupportedException extends RuntimeException {

    private final String operation;

    public FeatureNotSupportedException(String operation, String message) {
        super(message);
        this.operation = operation;
    }
}
