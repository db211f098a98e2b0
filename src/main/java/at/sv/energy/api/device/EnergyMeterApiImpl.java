package at.sv.energy.api.device;

import at.sv.energy.api.DecryptionStatus;
import at.sv.energy.api.Device;
import at.sv.energy.api.EnergyMeterApi;
import at.sv.energy.api.FeatureNotSupportedException;
import at.sv.energy.api.FeatureSet;
import at.sv.energy.api.HttpResourceProvider;
import at.sv.energy.api.HttpResourceProviderImpl;
import at.sv.energy.api.InvalidArgumentException;
import at.sv.energy.api.InvalidConnectionException;
import at.sv.energy.api.MeteredData;
import at.sv.energy.api.SwitchState;
import at.sv.energy.api.SystemSettings;
import at.sv.energy.api.UnsupportedApiVersionException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

@Slf4j
public final class EnergyMeterApiImpl implements EnergyMeterApi {

    private static final String DEVICE_PATH = "api";
    private static final String DATA_PATH = "api/v1/data";
    private static final String STATE_PATH = "api/v1/state";
    private static final String SYSTEM_PATH = "api/v1/system";
    private static final String IDENTIFY_PATH = "api/v1/identify";
    private static final String DECRYPTION_PATH = "api/v1/decryption";

    private final HttpResourceProvider resourceProvider;
    private final String host;
    private final String baseUrl;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final DeviceCache deviceCache;

    public EnergyMeterApiImpl(HttpResourceProvider resourceProvider, String host, Duration timeout) {
        assertValidHost(host);
        assertValidTimeout(timeout);
        this.resourceProvider = resourceProvider;
        this.host = host;
        this.timeout = timeout;
        baseUrl = "http://" + host + "/";
        mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        deviceCache = new DeviceCache();
    }

    /**
     * Creates an api with its own http client, which is released on {@link #close()}.
     */
    public static EnergyMeterApiImpl create(String host, Duration timeout) {
        return new EnergyMeterApiImpl(new HttpResourceProviderImpl(), host, timeout);
    }

    /**
     * Creates an api using an externally owned http client, which stays open on {@link #close()}.
     */
    public static EnergyMeterApiImpl create(String host, OkHttpClient httpClient, Duration timeout) {
        return new EnergyMeterApiImpl(new HttpResourceProviderImpl(httpClient), host, timeout);
    }

    private static void assertValidHost(String host) {
        if (host == null || host.isBlank()) {
            throw new InvalidConnectionException("No device host provided");
        }
        if (host.toLowerCase(Locale.ROOT).startsWith("http")) {
            throw new InvalidConnectionException("Invalid host provided. Device host can't contain a scheme: " + host);
        }
    }

    private static void assertValidTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new InvalidConnectionException("Invalid timeout provided. Must be positive: " + timeout);
        }
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public Device fetchDevice() {
        Device device = PayloadDecoder.decodeDevice(get(DEVICE_PATH));
        if (!SUPPORTED_API_VERSION.equals(device.getApiVersion())) {
            throw new UnsupportedApiVersionException(SUPPORTED_API_VERSION, device.getApiVersion());
        }
        deviceCache.update(device);
        log.debug("Fetched device {} ({}), firmware {}", device.getProductType(), device.getSerial(),
                device.getFirmwareVersion());
        return device;
    }

    @Override
    public FeatureSet getFeatures() {
        return deviceCache.getFeatures(this::fetchDevice);
    }

    @Override
    public MeteredData fetchMeteredData() {
        return PayloadDecoder.decodeMeteredData(get(DATA_PATH));
    }

    @Override
    public Optional<SwitchState> fetchSwitchState() {
        if (!getFeatures().hasState()) {
            log.trace("Device at {} has no switchable state", host);
            return Optional.empty();
        }
        return Optional.of(PayloadDecoder.decodeSwitchState(get(STATE_PATH)));
    }

    @Override
    public void setSwitchState(SwitchState state) {
        assertSupported(FeatureSet::hasState, "setSwitchState", "Setting state is not supported with this device");
        if (state == null || state.isEmpty()) {
            throw InvalidArgumentException.noFieldsProvided("switch state");
        }
        put(STATE_PATH, new StateUpdate(state.getPowerOn(), state.getSwitchLock(), state.getBrightness()));
    }

    @Override
    public void setSwitchState(Boolean powerOn, Boolean switchLock, Integer brightness) {
        setSwitchState(SwitchState.builder()
                                  .powerOn(powerOn)
                                  .switchLock(switchLock)
                                  .brightness(brightness)
                                  .build());
    }

    @Override
    public SystemSettings fetchSystemSettings() {
        return PayloadDecoder.decodeSystemSettings(get(SYSTEM_PATH));
    }

    @Override
    public void setSystemSettings(Boolean cloudEnabled) {
        assertSupported(FeatureSet::hasSystem, "setSystemSettings", "Setting system is not supported with this device");
        if (cloudEnabled == null) {
            throw InvalidArgumentException.noFieldsProvided("system settings");
        }
        put(SYSTEM_PATH, new SystemUpdate(cloudEnabled));
    }

    @Override
    public void identify() {
        assertSupported(FeatureSet::hasIdentify, "identify", "Identify is not supported with this device");
        resourceProvider.putResource(createUrl(IDENTIFY_PATH), null, timeout);
    }

    @Override
    public DecryptionStatus fetchDecryptionStatus() {
        return PayloadDecoder.decodeDecryptionStatus(get(DECRYPTION_PATH));
    }

    @Override
    public void setDecryptionKeys(String key, String aad) {
        assertSupported(FeatureSet::hasDecryption, "setDecryptionKeys",
                "Setting decryption is not supported with this device");
        DecryptionKeyValidator.assertValid(key, aad);
        put(DECRYPTION_PATH, new DecryptionKeysUpdate(key, aad));
    }

    @Override
    public void resetDecryptionKeys(boolean key, boolean aad) {
        assertSupported(FeatureSet::hasDecryption, "resetDecryptionKeys",
                "Resetting decryption is not supported with this device");
        resourceProvider.deleteResource(createUrl(DECRYPTION_PATH), getBody(new DecryptionReset(key, aad)), timeout);
    }

    @Override
    public void close() {
        resourceProvider.close();
    }

    private void assertSupported(Predicate<FeatureSet> feature, String operation, String message) {
        if (!feature.test(getFeatures())) {
            throw new FeatureNotSupportedException(operation, message);
        }
    }

    private JsonNode get(String path) {
        return resourceProvider.getResource(createUrl(path), timeout).getJson();
    }

    private void put(String path, Object body) {
        resourceProvider.putResource(createUrl(path), getBody(body), timeout);
    }

    private String getBody(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to create body", e);
        }
    }

    private URL createUrl(String path) {
        try {
            return new URI(baseUrl + path).toURL();
        } catch (MalformedURLException | URISyntaxException | IllegalArgumentException e) {
            throw new InvalidConnectionException("Failed to construct API url for host '" + host + "': " +
                                                 e.getLocalizedMessage());
        }
    }
}
