package at.sv.energy.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Identity of the device, as reported by the {@code api} endpoint.
 */
@Data
@AllArgsConstructor
@Builder
public final class Device {
    private final String productName;
    private final String productType;
    private final String serial;
    private final String apiVersion;
    private final String firmwareVersion;
}
