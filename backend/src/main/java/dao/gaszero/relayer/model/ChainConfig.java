package dao.gaszero.relayer.model;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-chain configuration, built once at startup by the chain registry.
 */
public record ChainConfig(
        SupportedChain chain,
        long chainId,
        String name,
        String rpcUrl,
        String explorerUrl,
        Map<String, TokenInfo> tokens,
        String routerAddress,
        BigInteger nativeGasThresholdWei,
        Set<ChainFeature> features,
        long tokenTransferGasLimit
) {

    public ChainConfig {
        tokens = Map.copyOf(tokens);
        features = Set.copyOf(features);
    }

    public boolean supports(ChainFeature feature) {
        return features.contains(feature);
    }

    public Optional<TokenInfo> token(String symbol) {
        if (symbol == null) return Optional.empty();
        return Optional.ofNullable(tokens.get(symbol.trim().toUpperCase(Locale.ROOT)));
    }

    public Optional<TokenInfo> wrappedNative() {
        return tokens.values().stream().filter(TokenInfo::wrappedNative).findFirst();
    }

    public String explorerTxUrl(String txHash) {
        if (explorerUrl == null || explorerUrl.isBlank() || txHash == null) return null;
        return explorerUrl + "/tx/" + txHash;
    }
}
