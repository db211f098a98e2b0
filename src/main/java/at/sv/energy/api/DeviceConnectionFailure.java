package at.sv.energy.api;

/**
 * Exception to signal a connection failure to the device: refused or reset connections, unknown hosts, or a response
 * that could not be read. The call may be retried.
 */
public final class DeviceConnectionFailure extends RuntimeException {

    public DeviceConnectionFailure(String message) {
        super(message);
    }

    public DeviceConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
