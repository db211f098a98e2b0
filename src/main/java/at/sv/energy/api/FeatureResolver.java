package at.sv.energy.api;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Static lookup of the features a product type supports, optionally gated by a minimum firmware version.
 * <p>
 * Firmware versions are compared component by component on their dot-separated numeric parts, missing trailing parts
 * count as zero. Unknown product types get no features, and a firmware version that can't be parsed disables all
 * firmware gated features.
 */
@Slf4j
public final class FeatureResolver {

    private static final String ANY_FIRMWARE = "0";
    private static final Map<Feature, Map<String, String>> MINIMUM_FIRMWARE = createFeatureTable();

    private FeatureResolver() {
    }

    private static Map<Feature, Map<String, String>> createFeatureTable() {
        Map<Feature, Map<String, String>> table = new EnumMap<>(Feature.class);
        table.put(Feature.STATE, Map.of(
                "HWE-SKT", ANY_FIRMWARE));
        table.put(Feature.SYSTEM, Map.of(
                "HWE-P1", "3.0",
                "HWE-SKT", "3.0",
                "HWE-WTR", "2.0",
                "HWE-KWH1", "3.0",
                "HWE-KWH3", "3.0",
                "SDM230-wifi", "3.0",
                "SDM630-wifi", "3.0"));
        table.put(Feature.IDENTIFY, Map.of(
                "HWE-P1", "4.0",
                "HWE-SKT", "3.0",
                "HWE-WTR", "2.0"));
        table.put(Feature.DECRYPTION, Map.of(
                "HWE-P1", "4.19"));
        return table;
    }

    public static FeatureSet resolve(String productType, String firmwareVersion) {
        if (productType == null) {
            return FeatureSet.NO_FEATURES;
        }
        EnumSet<Feature> features = EnumSet.noneOf(Feature.class);
        MINIMUM_FIRMWARE.forEach((feature, productTypes) -> {
            String minimumFirmware = productTypes.get(productType);
            if (minimumFirmware != null && isSupported(minimumFirmware, firmwareVersion)) {
                features.add(feature);
            }
        });
        return FeatureSet.of(features);
    }

    private static boolean isSupported(String minimumFirmware, String firmwareVersion) {
        if (ANY_FIRMWARE.equals(minimumFirmware)) {
            return true;
        }
        int[] actual = parseVersion(firmwareVersion);
        if (actual == null) {
            log.debug("Unparsable firmware version '{}'", firmwareVersion);
            return false;
        }
        return compareVersions(actual, parseVersion(minimumFirmware)) >= 0;
    }

    /**
     * @return the numeric components of the version, or null if it is missing or contains non-numeric parts
     */
    static int[] parseVersion(String version) {
        if (version == null || version.isBlank()) {
            return null;
        }
        String[] parts = version.trim().split("\\.", -1);
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            if (!parts[i].matches("\\d{1,9}")) {
                return null;
            }
            components[i] = Integer.parseInt(parts[i]);
        }
        return components;
    }

    static int compareVersions(int[] first, int[] second) {
        int length = Math.max(first.length, second.length);
        for (int i = 0; i < length; i++) {
            int a = i < first.length ? first[i] : 0;
            int b = i < second.length ? second[i] : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }
}
