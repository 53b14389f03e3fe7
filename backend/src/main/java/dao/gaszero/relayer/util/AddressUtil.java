package dao.gaszero.relayer.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class AddressUtil {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private AddressUtil() {}

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }

    /**
     * 0x1234...abcd form for logs.
     */
    public static String shorten(String address) {
        if (address == null || address.length() < 12) return address;
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }
}
