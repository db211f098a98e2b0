package at.sv.energy.api.device;

import at.sv.energy.api.DecryptionStatus;
import at.sv.energy.api.Device;
import at.sv.energy.api.ExternalDevice;
import at.sv.energy.api.ExternalDeviceType;
import at.sv.energy.api.MeteredData;
import at.sv.energy.api.SwitchState;
import at.sv.energy.api.SystemSettings;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps the JSON payloads of the device to the api types. Every recognized key is listed explicitly; missing keys, nulls
 * and values of an unexpected type are mapped to null.
 */
@Slf4j
final class PayloadDecoder {

    private PayloadDecoder() {
    }

    static Device decodeDevice(JsonNode node) {
        return Device.builder()
                     .productName(getText(node, "product_name"))
                     .productType(getText(node, "product_type"))
                     .serial(getText(node, "serial"))
                     .apiVersion(getText(node, "api_version"))
                     .firmwareVersion(getText(node, "firmware_version"))
                     .build();
    }

    static MeteredData decodeMeteredData(JsonNode node) {
        return MeteredData.builder()
                          .wifiSsid(getText(node, "wifi_ssid"))
                          .wifiStrength(getInteger(node, "wifi_strength"))
                          .smrVersion(getInteger(node, "smr_version"))
                          .meterModel(getText(node, "meter_model"))
                          .uniqueMeterId(getText(node, "unique_id"))
                          .activeTariff(getInteger(node, "active_tariff"))
                          .totalPowerImportKwh(getDouble(node, "total_power_import_kwh"))
                          .totalPowerImportT1Kwh(getDouble(node, "total_power_import_t1_kwh"))
                          .totalPowerImportT2Kwh(getDouble(node, "total_power_import_t2_kwh"))
                          .totalPowerImportT3Kwh(getDouble(node, "total_power_import_t3_kwh"))
                          .totalPowerImportT4Kwh(getDouble(node, "total_power_import_t4_kwh"))
                          .totalPowerExportKwh(getDouble(node, "total_power_export_kwh"))
                          .totalPowerExportT1Kwh(getDouble(node, "total_power_export_t1_kwh"))
                          .totalPowerExportT2Kwh(getDouble(node, "total_power_export_t2_kwh"))
                          .totalPowerExportT3Kwh(getDouble(node, "total_power_export_t3_kwh"))
                          .totalPowerExportT4Kwh(getDouble(node, "total_power_export_t4_kwh"))
                          .activePowerW(getDouble(node, "active_power_w"))
                          .activePowerL1W(getDouble(node, "active_power_l1_w"))
                          .activePowerL2W(getDouble(node, "active_power_l2_w"))
                          .activePowerL3W(getDouble(node, "active_power_l3_w"))
                          .activeVoltageL1V(getDouble(node, "active_voltage_l1_v"))
                          .activeVoltageL2V(getDouble(node, "active_voltage_l2_v"))
                          .activeVoltageL3V(getDouble(node, "active_voltage_l3_v"))
                          .activeCurrentL1A(getDouble(node, "active_current_l1_a"))
                          .activeCurrentL2A(getDouble(node, "active_current_l2_a"))
                          .activeCurrentL3A(getDouble(node, "active_current_l3_a"))
                          .activeFrequencyHz(getDouble(node, "active_frequency_hz"))
                          .voltageSagL1Count(getInteger(node, "voltage_sag_l1_count"))
                          .voltageSagL2Count(getInteger(node, "voltage_sag_l2_count"))
                          .voltageSagL3Count(getInteger(node, "voltage_sag_l3_count"))
                          .voltageSwellL1Count(getInteger(node, "voltage_swell_l1_count"))
                          .voltageSwellL2Count(getInteger(node, "voltage_swell_l2_count"))
                          .voltageSwellL3Count(getInteger(node, "voltage_swell_l3_count"))
                          .anyPowerFailCount(getInteger(node, "any_power_fail_count"))
                          .longPowerFailCount(getInteger(node, "long_power_fail_count"))
                          .activePowerAverageW(getDouble(node, "active_power_average_w"))
                          // sic: the device spells it "montly"
                          .monthlyPowerPeakW(getDouble(node, "montly_power_peak_w"))
                          .monthlyPowerPeakTimestamp(getTimestamp(node, "montly_power_peak_timestamp"))
                          .totalGasM3(getDouble(node, "total_gas_m3"))
                          .gasTimestamp(getTimestamp(node, "gas_timestamp"))
                          .gasUniqueId(getText(node, "gas_unique_id"))
                          .activeLiterLpm(getDouble(node, "active_liter_lpm"))
                          .totalLiterM3(getDouble(node, "total_liter_m3"))
                          .externalDevices(getExternalDevices(node.path("external")))
                          .build();
    }

    private static List<ExternalDevice> getExternalDevices(JsonNode external) {
        if (!external.isArray()) {
            return List.of();
        }
        List<ExternalDevice> devices = new ArrayList<>();
        for (JsonNode entry : external) {
            devices.add(decodeExternalDevice(entry));
        }
        return List.copyOf(devices);
    }

    static ExternalDevice decodeExternalDevice(JsonNode node) {
        String type = getText(node, "type");
        ExternalDeviceType deviceType = ExternalDeviceType.fromValue(type);
        if (deviceType == ExternalDeviceType.UNKNOWN && type != null) {
            log.debug("Unknown external device type '{}'", type);
        }
        return ExternalDevice.builder()
                             .uniqueId(getText(node, "unique_id"))
                             .type(deviceType)
                             .value(getDouble(node, "value"))
                             .unit(getText(node, "unit"))
                             .timestamp(getTimestamp(node, "timestamp"))
                             .build();
    }

    static SwitchState decodeSwitchState(JsonNode node) {
        return SwitchState.builder()
                          .powerOn(getBoolean(node, "power_on"))
                          .switchLock(getBoolean(node, "switch_lock"))
                          .brightness(getInteger(node, "brightness"))
                          .build();
    }

    static SystemSettings decodeSystemSettings(JsonNode node) {
        return SystemSettings.builder()
                             .cloudEnabled(getBoolean(node, "cloud_enabled"))
                             .build();
    }

    static DecryptionStatus decodeDecryptionStatus(JsonNode node) {
        return DecryptionStatus.builder()
                               .keySet(getBoolean(node, "key"))
                               .aadSet(getBoolean(node, "aad"))
                               .build();
    }

    private static String getText(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Integer getInteger(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (!value.isNumber() || !value.canConvertToInt()) {
            return null;
        }
        return value.intValue();
    }

    private static Double getDouble(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (!value.isNumber()) {
            return null;
        }
        return value.doubleValue();
    }

    private static Boolean getBoolean(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (!value.isBoolean()) {
            return null;
        }
        return value.booleanValue();
    }

    private static LocalDateTime getTimestamp(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (!value.isTextual() && !value.isIntegralNumber()) {
            return null;
        }
        return MeterTimestamps.parse(value.asText());
    }
}
