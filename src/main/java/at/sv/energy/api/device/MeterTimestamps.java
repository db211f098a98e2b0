package at.sv.energy.api.device;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Converts the compact {@code yyMMddHHmmss} timestamps reported by smart meters.
 */
public final class MeterTimestamps {

    private static final Pattern TWELVE_DIGITS = Pattern.compile("\\d{12}");
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("uuMMddHHmmss")
                                                                        .withResolverStyle(ResolverStyle.STRICT);

    private MeterTimestamps() {
    }

    /**
     * @return the parsed timestamp, or null if the value is null, not exactly twelve digits or not a valid date
     */
    public static LocalDateTime parse(String value) {
        if (value == null || !TWELVE_DIGITS.matcher(value).matches()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, FORMATTER);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String format(LocalDateTime timestamp) {
        return FORMATTER.format(timestamp);
    }
}
