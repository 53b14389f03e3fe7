package dao.gaszero.relayer.model;

import java.util.Arrays;
import java.util.Optional;

public enum SupportedChain {

    ETH_SEPOLIA("eth-sepolia"),
    ARB_SEPOLIA("arb-sepolia"),
    BASE_SEPOLIA("base-sepolia");

    private final String id;

    SupportedChain(String id) {
        this.id = id;
    }

    /** Identifier used on the wire and as configuration key. */
    public String id() {
        return id;
    }

    public static Optional<SupportedChain> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(c -> c.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
