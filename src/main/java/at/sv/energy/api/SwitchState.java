package at.sv.energy.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * State of a switchable device. Used both as the result of a state lookup and as a partial update, where only the
 * non-null fields are sent.
 */
@Data
@AllArgsConstructor
@Builder
public final class SwitchState {
    private final Boolean powerOn;
    private final Boolean switchLock;
    /**
     * Brightness of the status LED [0-255].
     */
    private final Integer brightness;

    public boolean isEmpty() {
        return Stream.of(powerOn, switchLock, brightness).allMatch(Objects::isNull);
    }

    public boolean isOn() {
        return Boolean.TRUE.equals(powerOn);
    }

    public boolean isOff() {
        return Boolean.FALSE.equals(powerOn);
    }
}
