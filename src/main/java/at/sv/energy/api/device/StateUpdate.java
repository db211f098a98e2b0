package at.sv.energy.api.device;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
final class StateUpdate {
    Boolean power_on;
    Boolean switch_lock;
    Integer brightness;
}
