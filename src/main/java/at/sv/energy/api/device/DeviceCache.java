package at.sv.energy.api.device;

import at.sv.energy.api.Device;
import at.sv.energy.api.FeatureResolver;
import at.sv.energy.api.FeatureSet;

/**
 * Holds the features resolved from the last fetched device, for the lifetime of one api instance. Only replaced by an
 * explicit {@link #update(Device)}.
 */
final class DeviceCache {

    private final Object lock = new Object();
    private FeatureSet features;

    /**
     * Returns the cached features, running {@code refresh} first if nothing is cached yet. The refresh is expected to
     * call {@link #update(Device)}.
     */
    FeatureSet getFeatures(Runnable refresh) {
        synchronized (lock) {
            if (features == null) {
                refresh.run();
            }
            if (features == null) {
                throw new IllegalStateException("Device features could not be resolved");
            }
            return features;
        }
    }

    void update(Device device) {
        FeatureSet resolved = FeatureResolver.resolve(device.getProductType(), device.getFirmwareVersion());
        synchronized (lock) {
            this.features = resolved;
        }
    }
}
