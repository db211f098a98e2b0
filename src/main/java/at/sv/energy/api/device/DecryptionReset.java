package at.sv.energy.api.device;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the decryption DELETE call, flagging which keys to clear.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
final class DecryptionReset {
    boolean key;
    boolean aad;
}
