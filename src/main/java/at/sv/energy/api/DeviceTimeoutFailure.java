package at.sv.energy.api;

/**
 * Exception to signal that the device did not answer within the configured timeout. The in-flight call has been
 * cancelled; it is safe to retry.
 */
public final class DeviceTimeoutFailure extends RuntimeException {

    public DeviceTimeoutFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
