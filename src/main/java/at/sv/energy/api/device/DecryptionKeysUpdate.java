package at.sv.energy.api.device;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the decryption PUT call. Keys left null are not sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
final class DecryptionKeysUpdate {
    String key;
    String aad;
}
