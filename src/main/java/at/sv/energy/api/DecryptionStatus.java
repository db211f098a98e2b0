package at.sv.energy.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Whether the decryption key and the additional authenticated data (AAD) for encrypted meter telegrams are configured.
 */
@Data
@AllArgsConstructor
@Builder
public final class DecryptionStatus {
    private final Boolean keySet;
    private final Boolean aadSet;
}
