package at.sv.energy.api;

import lombok.Getter;

/**
 * Kinds of sub-meters that can be relayed by a P1 meter. The codes follow the OMS device type allocation
 * (OMS Specification Volume 2, Table 2).
 */
@Getter
public enum ExternalDeviceType {
    GAS_METER("gas_meter", 3),
    HEAT_METER("heat_meter", 4),
    WARM_WATER_METER("warm_water_meter", 6),
    WATER_METER("water_meter", 7),
    INLET_HEAT_METER("inlet_heat_meter", 12),
    UNKNOWN(null, -1);

    private final String value;
    private final int omsCode;

    ExternalDeviceType(String value, int omsCode) {
        this.value = value;
        this.omsCode = omsCode;
    }

    /**
     * @return the matching type, or {@link #UNKNOWN} for null or unrecognized values. Never null.
     */
    public static ExternalDeviceType fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ExternalDeviceType type : values()) {
            if (value.equals(type.value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
