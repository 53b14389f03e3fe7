package dao.gaszero.relayer.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Conversions between display amounts ("99.5") and integer base units.
 */
public final class TokenAmounts {

    private static final Pattern DECIMAL = Pattern.compile("^[0-9]+(\\.[0-9]+)?$");

    private TokenAmounts() {}

    /**
     * @throws IllegalArgumentException when the value is not a plain positive decimal or carries
     *                                  more fractional digits than the token supports
     */
    public static BigInteger toBaseUnits(String display, int decimals) {
        if (display == null || display.isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        String value = display.trim();
        if (!DECIMAL.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid amount format: " + value);
        }
        BigDecimal parsed = new BigDecimal(value);
        if (parsed.stripTrailingZeros().scale() > decimals) {
            throw new IllegalArgumentException("Amount " + value + " has more than " + decimals + " decimals");
        }
        BigInteger units = parsed.movePointRight(decimals).toBigIntegerExact();
        if (units.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        return units;
    }

    public static String toDisplay(BigInteger units, int decimals) {
        if (units == null) return null;
        return new BigDecimal(units, decimals).stripTrailingZeros().toPlainString();
    }
}
