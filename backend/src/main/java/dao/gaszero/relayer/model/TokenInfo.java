package dao.gaszero.relayer.model;

public record TokenInfo(
        String symbol,
        String address,
        int decimals,
        boolean stablecoin,
        boolean wrappedNative
) {}
