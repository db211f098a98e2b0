package at.sv.energy.api.device;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
final class SystemUpdate {
    Boolean cloud_enabled;
}
