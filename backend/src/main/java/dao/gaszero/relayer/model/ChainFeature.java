package dao.gaszero.relayer.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Relay operation kinds a chain can enable.
 */
public enum ChainFeature {

    TRANSFER("transfer"),
    SWAP("swap");

    private final String id;

    ChainFeature(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ChainFeature> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(f -> f.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
