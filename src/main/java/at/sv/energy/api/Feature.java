package at.sv.energy.api;

public enum Feature {
    STATE,
    SYSTEM,
    IDENTIFY,
    DECRYPTION
}
