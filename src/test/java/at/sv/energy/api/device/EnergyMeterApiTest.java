package at.sv.energy.api.device;

import at.sv.energy.api.ApiDisabledFailure;
import at.sv.energy.api.DecryptionStatus;
import at.sv.energy.api.Device;
import at.sv.energy.api.DeviceConnectionFailure;
import at.sv.energy.api.DeviceTimeoutFailure;
import at.sv.energy.api.ExternalDeviceType;
import at.sv.energy.api.FeatureNotSupportedException;
import at.sv.energy.api.FeatureSet;
import at.sv.energy.api.HttpResourceProvider;
import at.sv.energy.api.InvalidArgumentException;
import at.sv.energy.api.InvalidConnectionException;
import at.sv.energy.api.MeteredData;
import at.sv.energy.api.RawResult;
import at.sv.energy.api.SwitchState;
import at.sv.energy.api.SystemSettings;
import at.sv.energy.api.UnexpectedStatusFailure;
import at.sv.energy.api.UnsupportedApiVersionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.io.InterruptedIOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EnergyMeterApiTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(3);
    private static final String KEY = "00112233445566778899AABBCCDDEEFF";
    private static final String AAD = "3000112233445566778899aabbccddeeff";

    private final ObjectMapper mapper = new ObjectMapper();
    private EnergyMeterApiImpl api;
    private String baseUrl;
    private HttpResourceProvider resourceProviderMock;

    @BeforeEach
    void setUp() {
        String host = "localhost";
        resourceProviderMock = Mockito.mock(HttpResourceProvider.class);
        api = new EnergyMeterApiImpl(resourceProviderMock, host, TIMEOUT);
        baseUrl = "http://" + host + "/";
    }

    @Test
    void invalidHost_cantUseScheme_exception() {
        assertThrows(InvalidConnectionException.class,
                () -> new EnergyMeterApiImpl(resourceProviderMock, "hTtp://localhost", TIMEOUT));
    }

    @Test
    void invalidHost_blank_exception() {
        assertThrows(InvalidConnectionException.class, () -> new EnergyMeterApiImpl(resourceProviderMock, " ", TIMEOUT));
    }

    @Test
    void invalidTimeout_exception() {
        assertThrows(InvalidConnectionException.class,
                () -> new EnergyMeterApiImpl(resourceProviderMock, "localhost", Duration.ZERO));
    }

    @Test
    void getHost_returnsHost() {
        assertThat(api.getHost()).isEqualTo("localhost");
    }

    @Test
    void fetchDevice_returnsDevice() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        Device device = api.fetchDevice();

        assertThat(device).isEqualTo(new Device("P1 meter", "HWE-P1", "3c39e7aabbcc", "v1", "4.19"));
    }

    @Test
    void fetchDevice_otherApiVersion_unsupportedApiVersion() {
        setDeviceResponse("HWE-P1", "4.19", "v2");

        assertThatThrownBy(() -> api.fetchDevice())
                .isInstanceOfSatisfying(UnsupportedApiVersionException.class, e -> {
                    assertThat(e.getExpected()).isEqualTo("v1");
                    assertThat(e.getActual()).isEqualTo("v2");
                });
    }

    @Test
    void fetchDevice_missingApiVersion_unsupportedApiVersion() {
        setGetResponse("api", "{\"product_type\": \"HWE-P1\"}");

        assertThatThrownBy(() -> api.fetchDevice())
                .isInstanceOfSatisfying(UnsupportedApiVersionException.class,
                        e -> assertThat(e.getActual()).isNull());
    }

    @Test
    void otherApiVersion_featuresNotCached_failsAgainOnNextUse() {
        setDeviceResponse("HWE-SKT", "3.03", "v2");

        assertThrows(UnsupportedApiVersionException.class, () -> api.setSwitchState(true, null, null));
        assertThrows(UnsupportedApiVersionException.class, () -> api.getFeatures());

        verify(resourceProviderMock, times(2)).getResource(getUrl("api"), TIMEOUT);
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void getFeatures_fetchesDeviceOnlyOnce() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");

        FeatureSet first = api.getFeatures();
        FeatureSet second = api.getFeatures();

        assertThat(first).isSameAs(second);
        assertThat(first.hasState()).isTrue();
        verify(resourceProviderMock, times(1)).getResource(getUrl("api"), TIMEOUT);
    }

    @Test
    void fetchDevice_refreshesCachedFeatures() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");
        assertThat(api.getFeatures().hasState()).isTrue();

        setDeviceResponse("HWE-P1", "4.19", "v1");
        api.fetchDevice();

        assertThat(api.getFeatures().hasState()).isFalse();
        assertThat(api.getFeatures().hasDecryption()).isTrue();
    }

    @Test
    void getFeatures_connectionFailure_rethrown_nothingCached() {
        when(resourceProviderMock.getResource(getUrl("api"), TIMEOUT))
                .thenThrow(new DeviceConnectionFailure("Failed"))
                .thenReturn(json(deviceJson("HWE-SKT", "3.03", "v1")));

        assertThrows(DeviceConnectionFailure.class, () -> api.getFeatures());
        assertThat(api.getFeatures().hasState()).isTrue();
    }

    @Test
    void fetchMeteredData_decodesResponse() {
        setGetResponse("api/v1/data", """
                {
                  "active_power_w": 1457.277,
                  "total_power_import_t1_kwh": 30.511,
                  "external": [
                    {"unique_id": "1", "type": "heat_meter", "value": 7.5, "unit": "GJ", "timestamp": 230125220957}
                  ]
                }
                """);

        MeteredData data = api.fetchMeteredData();

        assertThat(data.getActivePowerW()).isEqualTo(1457.277);
        assertThat(data.getTotalPowerImportT1Kwh()).isEqualTo(30.511);
        assertThat(data.getExternalDevices()).hasSize(1);
        assertThat(data.getExternalDevices().get(0).getType()).isEqualTo(ExternalDeviceType.HEAT_METER);
    }

    @Test
    void fetchMeteredData_doesNotNeedFeatures() {
        setGetResponse("api/v1/data", "{}");

        api.fetchMeteredData();

        verify(resourceProviderMock, never()).getResource(getUrl("api"), TIMEOUT);
    }

    @Test
    void fetchMeteredData_textResponse_connectionFailure() {
        when(resourceProviderMock.getResource(getUrl("api/v1/data"), TIMEOUT)).thenReturn(RawResult.text("Not JSON"));

        assertThrows(DeviceConnectionFailure.class, () -> api.fetchMeteredData());
    }

    @Test
    void fetchMeteredData_apiDisabled_propagated() {
        when(resourceProviderMock.getResource(any(), any())).thenThrow(new ApiDisabledFailure());

        assertThrows(ApiDisabledFailure.class, () -> api.fetchMeteredData());
    }

    @Test
    void fetchMeteredData_timeout_propagated() {
        when(resourceProviderMock.getResource(any(), any()))
                .thenThrow(new DeviceTimeoutFailure("Timeout", new InterruptedIOException("timeout")));

        assertThrows(DeviceTimeoutFailure.class, () -> api.fetchMeteredData());
    }

    @Test
    void fetchMeteredData_unexpectedStatus_propagated() {
        when(resourceProviderMock.getResource(any(), any())).thenThrow(new UnexpectedStatusFailure(500, ""));

        assertThatThrownBy(() -> api.fetchMeteredData()).isInstanceOf(UnexpectedStatusFailure.class);
    }

    @Test
    void fetchSwitchState_energySocket_returnsState() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");
        setGetResponse("api/v1/state", "{\"power_on\": true, \"switch_lock\": false, \"brightness\": 127}");

        Optional<SwitchState> state = api.fetchSwitchState();

        assertThat(state).contains(new SwitchState(true, false, 127));
    }

    @Test
    void fetchSwitchState_noStateFeature_emptyWithoutRequest() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        Optional<SwitchState> state = api.fetchSwitchState();

        assertThat(state).isEmpty();
        verify(resourceProviderMock, never()).getResource(getUrl("api/v1/state"), TIMEOUT);
    }

    @Test
    void setSwitchState_noFields_invalidArgument_noRequest() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");
        api.getFeatures();
        clearInvocations(resourceProviderMock);

        assertThatThrownBy(() -> api.setSwitchState(null, null, null))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.isNoFieldsProvided()).isTrue());
        assertThatThrownBy(() -> api.setSwitchState(SwitchState.builder().build()))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> api.setSwitchState(null))
                .isInstanceOf(InvalidArgumentException.class);

        verifyNoInteractions(resourceProviderMock);
    }

    @Test
    void setSwitchState_noStateFeature_unsupported_noRequest() {
        setDeviceResponse("HWE-P1", "4.19", "v1");
        api.getFeatures();
        clearInvocations(resourceProviderMock);

        assertThatThrownBy(() -> api.setSwitchState(true, null, null))
                .isInstanceOfSatisfying(FeatureNotSupportedException.class,
                        e -> assertThat(e.getOperation()).isEqualTo("setSwitchState"));

        verifyNoInteractions(resourceProviderMock);
    }

    @Test
    void setSwitchState_powerOn_onlyPowerOnSent() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");

        api.setSwitchState(true, null, null);

        assertPutBody("api/v1/state", "{\"power_on\": true}");
    }

    @Test
    void setSwitchState_allFields() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");

        api.setSwitchState(SwitchState.builder().powerOn(false).switchLock(true).brightness(0).build());

        assertPutBody("api/v1/state", "{\"power_on\": false, \"switch_lock\": true, \"brightness\": 0}");
    }

    @Test
    void fetchSystemSettings_decodesResponse() {
        setGetResponse("api/v1/system", "{\"cloud_enabled\": true}");

        SystemSettings settings = api.fetchSystemSettings();

        assertThat(settings.getCloudEnabled()).isTrue();
    }

    @Test
    void setSystemSettings_sendsCloudEnabled() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.setSystemSettings(false);

        assertPutBody("api/v1/system", "{\"cloud_enabled\": false}");
    }

    @Test
    void setSystemSettings_noFields_invalidArgument() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setSystemSettings(null))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.isNoFieldsProvided()).isTrue());
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void setSystemSettings_unknownDevice_unsupported() {
        setDeviceResponse("HWE-NEW", "9.0", "v1");

        assertThrows(FeatureNotSupportedException.class, () -> api.setSystemSettings(true));
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void identify_supported_putWithoutBody() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.identify();

        verify(resourceProviderMock).putResource(eq(getUrl("api/v1/identify")), isNull(), eq(TIMEOUT));
    }

    @Test
    void identify_oldFirmware_unsupported() {
        setDeviceResponse("HWE-P1", "3.05", "v1");

        assertThatThrownBy(() -> api.identify())
                .isInstanceOfSatisfying(FeatureNotSupportedException.class,
                        e -> assertThat(e.getOperation()).isEqualTo("identify"));
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void fetchDecryptionStatus_decodesResponse() {
        setGetResponse("api/v1/decryption", "{\"key\": true, \"aad\": false}");

        DecryptionStatus status = api.fetchDecryptionStatus();

        assertThat(status.getKeySet()).isTrue();
        assertThat(status.getAadSet()).isFalse();
    }

    @Test
    void setDecryptionKeys_keyAndAad_forwardedVerbatim() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.setDecryptionKeys(KEY, AAD);

        assertPutBody("api/v1/decryption", "{\"key\": \"" + KEY + "\", \"aad\": \"" + AAD + "\"}");
    }

    @Test
    void setDecryptionKeys_onlyAad_34Characters() {
        setDeviceResponse("HWE-P1", "4.19", "v1");
        String aad = "30" + "0".repeat(32);

        api.setDecryptionKeys(null, aad);

        assertPutBody("api/v1/decryption", "{\"aad\": \"" + aad + "\"}");
    }

    @Test
    void setDecryptionKeys_onlyKey() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.setDecryptionKeys(KEY.toLowerCase(), null);

        assertPutBody("api/v1/decryption", "{\"key\": \"" + KEY.toLowerCase() + "\"}");
    }

    @Test
    void setDecryptionKeys_aadWith32Characters_hintToPrefix30() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys(null, "01234567890123456789012345678901"))
                .isInstanceOfSatisfying(InvalidArgumentException.class, e -> {
                    assertThat(e.getField()).isEqualTo("aad");
                    assertThat(e.getHint()).contains("'30'");
                })
                .hasMessageContaining("34");
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void setDecryptionKeys_aadOtherLength_noHint() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys(null, "0123456789012345678901234567890"))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.getHint()).isNull());
    }

    @Test
    void setDecryptionKeys_aadNotHex_invalidArgument() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys(null, "30" + "g".repeat(32)))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.getField()).isEqualTo("aad"))
                .hasMessageContaining("hexadecimal");
    }

    @Test
    void setDecryptionKeys_keyWrongLength_invalidArgument() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys(KEY + "0", null))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.getField()).isEqualTo("key"))
                .hasMessageContaining("32");
    }

    @Test
    void setDecryptionKeys_keyNotHex_invalidArgument() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys("Z".repeat(32), AAD))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.getField()).isEqualTo("key"));
        verify(resourceProviderMock, never()).putResource(any(), any(), any());
    }

    @Test
    void setDecryptionKeys_none_invalidArgument() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        assertThatThrownBy(() -> api.setDecryptionKeys(null, null))
                .isInstanceOfSatisfying(InvalidArgumentException.class,
                        e -> assertThat(e.isNoFieldsProvided()).isTrue());
    }

    @Test
    void setDecryptionKeys_energySocket_unsupported_beforeValidation() {
        setDeviceResponse("HWE-SKT", "3.03", "v1");

        assertThrows(FeatureNotSupportedException.class, () -> api.setDecryptionKeys("invalid", null));
    }

    @Test
    void resetDecryptionKeys_sendsFlags() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.resetDecryptionKeys(true, false);

        assertDeleteBody("{\"key\": true, \"aad\": false}");
    }

    @Test
    void resetDecryptionKeys_bothFalse_stillSent() {
        setDeviceResponse("HWE-P1", "4.19", "v1");

        api.resetDecryptionKeys(false, false);

        assertDeleteBody("{\"key\": false, \"aad\": false}");
    }

    @Test
    void resetDecryptionKeys_unsupported() {
        setDeviceResponse("HWE-P1", "4.10", "v1");

        assertThatThrownBy(() -> api.resetDecryptionKeys(true, true))
                .isInstanceOfSatisfying(FeatureNotSupportedException.class,
                        e -> assertThat(e.getOperation()).isEqualTo("resetDecryptionKeys"));
        verify(resourceProviderMock, never()).deleteResource(any(), any(), any());
    }

    @Test
    void close_closesResourceProvider() {
        api.close();

        verify(resourceProviderMock).close();
    }

    private void assertPutBody(String path, @Language("JSON") String expected) {
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(resourceProviderMock).putResource(eq(getUrl(path)), body.capture(), eq(TIMEOUT));
        assertThat(readTree(body.getValue())).isEqualTo(readTree(expected));
    }

    private void assertDeleteBody(@Language("JSON") String expected) {
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(resourceProviderMock).deleteResource(eq(getUrl("api/v1/decryption")), body.capture(), eq(TIMEOUT));
        assertThat(readTree(body.getValue())).isEqualTo(readTree(expected));
    }

    private void setDeviceResponse(String productType, String firmwareVersion, String apiVersion) {
        setGetResponse("api", deviceJson(productType, firmwareVersion, apiVersion));
    }

    private static String deviceJson(String productType, String firmwareVersion, String apiVersion) {
        return """
                {
                  "product_type": "%s",
                  "product_name": "P1 meter",
                  "serial": "3c39e7aabbcc",
                  "firmware_version": "%s",
                  "api_version": "%s"
                }
                """.formatted(productType, firmwareVersion, apiVersion);
    }

    private void setGetResponse(String path, @Language("JSON") String response) {
        when(resourceProviderMock.getResource(getUrl(path), TIMEOUT)).thenReturn(json(response));
    }

    private RawResult json(String json) {
        return RawResult.json(readTree(json));
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private URL getUrl(String path) {
        try {
            return new URI(baseUrl + path).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
