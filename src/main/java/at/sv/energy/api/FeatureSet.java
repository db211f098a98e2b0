package at.sv.energy.api;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.EnumSet;
import java.util.Set;

/**
 * The operations a specific device model and firmware exposes besides the always available reads.
 */
@EqualsAndHashCode
@ToString
public final class FeatureSet {

    public static final FeatureSet NO_FEATURES = new FeatureSet(EnumSet.noneOf(Feature.class));

    private final EnumSet<Feature> features;

    private FeatureSet(EnumSet<Feature> features) {
        this.features = features;
    }

    public static FeatureSet of(Set<Feature> features) {
        if (features.isEmpty()) {
            return NO_FEATURES;
        }
        return new FeatureSet(EnumSet.copyOf(features));
    }

    public boolean hasState() {
        return features.contains(Feature.STATE);
    }

    public boolean hasSystem() {
        return features.contains(Feature.SYSTEM);
    }

    public boolean hasIdentify() {
        return features.contains(Feature.IDENTIFY);
    }

    public boolean hasDecryption() {
        return features.contains(Feature.DECRYPTION);
    }

    public Set<Feature> getFeatures() {
        return EnumSet.copyOf(features);
    }
}
