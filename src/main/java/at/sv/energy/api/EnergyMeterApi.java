package at.sv.energy.api;

import java.util.Optional;

/**
 * Client for the local API of a single energy meter device.
 * <p>
 * All network calls may throw {@link DeviceTimeoutFailure}, {@link DeviceConnectionFailure},
 * {@link ApiDisabledFailure} or {@link UnexpectedStatusFailure}. Operations that need a specific feature throw
 * {@link FeatureNotSupportedException} before any request is sent, if the device doesn't support it.
 */
public interface EnergyMeterApi extends AutoCloseable {

    String SUPPORTED_API_VERSION = "v1";

    String getHost();

    /**
     * Fetches the device information and refreshes the cached device and its features.
     *
     * @throws UnsupportedApiVersionException if the device reports an api version other than
     *                                        {@link #SUPPORTED_API_VERSION}
     */
    Device fetchDevice();

    /**
     * @return the features of the device. Fetches the device information on first use.
     */
    FeatureSet getFeatures();

    MeteredData fetchMeteredData();

    /**
     * @return the switch state, or empty if the device has no switchable state
     */
    Optional<SwitchState> fetchSwitchState();

    /**
     * Updates the switch state. Only non-null fields are sent.
     *
     * @throws InvalidArgumentException if no field is set
     */
    void setSwitchState(SwitchState state);

    /**
     * @throws InvalidArgumentException if all parameters are null
     */
    void setSwitchState(Boolean powerOn, Boolean switchLock, Integer brightness);

    SystemSettings fetchSystemSettings();

    /**
     * @throws InvalidArgumentException if {@code cloudEnabled} is null
     */
    void setSystemSettings(Boolean cloudEnabled);

    /**
     * Lets the status light of the device blink.
     */
    void identify();

    DecryptionStatus fetchDecryptionStatus();

    /**
     * @param key 32 hexadecimal characters, or null to leave it unchanged
     * @param aad 34 hexadecimal characters, or null to leave it unchanged
     * @throws InvalidArgumentException if both are null or one of them is malformed
     */
    void setDecryptionKeys(String key, String aad);

    void resetDecryptionKeys(boolean key, boolean aad);

    /**
     * Releases the http client, if it was created by this api.
     */
    @Override
    void close();
}
