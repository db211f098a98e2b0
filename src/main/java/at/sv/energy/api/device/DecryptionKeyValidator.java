package at.sv.energy.api.device;

import at.sv.energy.api.InvalidArgumentException;

import java.util.regex.Pattern;

final class DecryptionKeyValidator {

    static final int KEY_LENGTH = 32;
    static final int AAD_LENGTH = 34;
    static final String AAD_PREFIX = "30";

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]*");

    private DecryptionKeyValidator() {
    }

    /**
     * @throws InvalidArgumentException if both values are null, or one of them has the wrong length or contains
     *                                  non-hexadecimal characters
     */
    static void assertValid(String key, String aad) {
        if (key == null && aad == null) {
            throw InvalidArgumentException.noFieldsProvided("decryption keys");
        }
        if (key != null) {
            assertKeyValid(key);
        }
        if (aad != null) {
            assertAadValid(aad);
        }
    }

    private static void assertKeyValid(String key) {
        if (key.length() != KEY_LENGTH) {
            throw new InvalidArgumentException("key", "length should be " + KEY_LENGTH + " characters, but was " +
                                                      key.length());
        }
        assertHex("key", key);
    }

    private static void assertAadValid(String aad) {
        if (aad.length() != AAD_LENGTH) {
            String hint = null;
            if (aad.length() == KEY_LENGTH) {
                hint = "Hint: Try prefixing AAD with '" + AAD_PREFIX + "', e.g. '" + AAD_PREFIX + "<AAD>'";
            }
            throw new InvalidArgumentException("aad", "length should be " + AAD_LENGTH + " characters, but was " +
                                                      aad.length(), hint);
        }
        assertHex("aad", aad);
    }

    private static void assertHex(String field, String value) {
        if (!HEX.matcher(value).matches()) {
            throw new InvalidArgumentException(field, "should only contain hexadecimal characters (0-9/a-f)");
        }
    }
}
