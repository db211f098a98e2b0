package at.sv.energy.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * A sub-meter reading relayed through the device.
 */
@Data
@AllArgsConstructor
@Builder
public final class ExternalDevice {
    private final String uniqueId;
    @Builder.Default
    private final ExternalDeviceType type = ExternalDeviceType.UNKNOWN;
    private final Double value;
    private final String unit;
    private final LocalDateTime timestamp;
}
