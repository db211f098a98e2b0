package at.sv.energy.api;

/**
 * The device answered with 403: its local API is turned off.
 */
public final class ApiDisabledFailure extends RuntimeException {
    public ApiDisabledFailure() {
        super("Local API is disabled. Enable it in the settings of the device's app");
    }
}
