package at.sv.energy.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Readings of the {@code api/v1/data} endpoint. Which fields are present depends on the device type and the connected
 * meter; absent readings are null.
 */
@Data
@AllArgsConstructor
@Builder
public final class MeteredData {
    private final String wifiSsid;
    private final Integer wifiStrength;

    private final Integer smrVersion;
    private final String meterModel;
    private final String uniqueMeterId;

    private final Integer activeTariff;

    private final Double totalPowerImportKwh;
    private final Double totalPowerImportT1Kwh;
    private final Double totalPowerImportT2Kwh;
    private final Double totalPowerImportT3Kwh;
    private final Double totalPowerImportT4Kwh;
    private final Double totalPowerExportKwh;
    private final Double totalPowerExportT1Kwh;
    private final Double totalPowerExportT2Kwh;
    private final Double totalPowerExportT3Kwh;
    private final Double totalPowerExportT4Kwh;

    private final Double activePowerW;
    private final Double activePowerL1W;
    private final Double activePowerL2W;
    private final Double activePowerL3W;

    private final Double activeVoltageL1V;
    private final Double activeVoltageL2V;
    private final Double activeVoltageL3V;

    private final Double activeCurrentL1A;
    private final Double activeCurrentL2A;
    private final Double activeCurrentL3A;

    private final Double activeFrequencyHz;

    private final Integer voltageSagL1Count;
    private final Integer voltageSagL2Count;
    private final Integer voltageSagL3Count;

    private final Integer voltageSwellL1Count;
    private final Integer voltageSwellL2Count;
    private final Integer voltageSwellL3Count;

    private final Integer anyPowerFailCount;
    private final Integer longPowerFailCount;

    private final Double activePowerAverageW;
    private final Double monthlyPowerPeakW;
    private final LocalDateTime monthlyPowerPeakTimestamp;

    private final Double totalGasM3;
    private final LocalDateTime gasTimestamp;
    private final String gasUniqueId;

    private final Double activeLiterLpm;
    private final Double totalLiterM3;

    /**
     * In the order reported by the device. Empty if none are connected, never null.
     */
    @Builder.Default
    private final List<ExternalDevice> externalDevices = List.of();
}
