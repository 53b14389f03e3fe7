package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.ChainProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.ChainFeature;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-chain configuration table, built once from {@code chain.networks.*}.
 * Malformed entries fail startup; chains without an entry are simply not served.
 */
@Slf4j
@Component
public class ChainRegistry {

    private final Map<SupportedChain, ChainConfig> configs;

    public ChainRegistry(ChainProperties chainProps) {
        Map<SupportedChain, ChainConfig> built = new EnumMap<>(SupportedChain.class);
        chainProps.getNetworks().forEach((id, network) -> {
            SupportedChain chain = SupportedChain.fromId(id)
                    .orElseThrow(() -> new IllegalStateException("Unknown chain in configuration: " + id));
            built.put(chain, build(chain, network));
        });
        this.configs = Collections.unmodifiableMap(built);
        log.info("ChainRegistry initialized: chains={}", configs.keySet());
    }

    public Optional<ChainConfig> find(SupportedChain chain) {
        return Optional.ofNullable(configs.get(chain));
    }

    public ChainConfig require(SupportedChain chain) {
        return find(chain).orElseThrow(() ->
                new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE, "Chain not configured: " + chain));
    }

    public Collection<ChainConfig> all() {
        return configs.values();
    }

    private static ChainConfig build(SupportedChain chain, ChainProperties.Network network) {
        if (network.getChainId() == null) {
            throw new IllegalStateException("chain.networks." + chain.id() + ".chain-id is required");
        }
        if (network.getRpcUrl() == null || network.getRpcUrl().isBlank()) {
            throw new IllegalStateException("chain.networks." + chain.id() + ".rpc-url is required");
        }

        Map<String, TokenInfo> tokens = new LinkedHashMap<>();
        network.getTokens().forEach((symbol, token) -> {
            String sym = symbol.trim().toUpperCase(Locale.ROOT);
            if (!AddressUtil.isValid(token.getAddress())) {
                throw new IllegalStateException("Invalid address for token " + sym + " on " + chain.id()
                        + ": " + token.getAddress());
            }
            tokens.put(sym, new TokenInfo(sym, token.getAddress().trim(), token.getDecimals(),
                    token.isStablecoin(), token.isWrappedNative()));
        });

        Set<ChainFeature> features = EnumSet.noneOf(ChainFeature.class);
        for (String f : network.getFeatures()) {
            features.add(ChainFeature.fromId(f)
                    .orElseThrow(() -> new IllegalStateException("Unknown feature '" + f + "' on " + chain.id())));
        }

        String router = network.getRouterAddress();
        if (features.contains(ChainFeature.SWAP)) {
            if (!AddressUtil.isValid(router)) {
                throw new IllegalStateException("Swap enabled on " + chain.id() + " without a valid router-address");
            }
            if (tokens.values().stream().noneMatch(TokenInfo::wrappedNative)) {
                throw new IllegalStateException("Swap enabled on " + chain.id() + " without a wrapped-native token");
            }
        }

        String explorer = network.getExplorerUrl();
        if (explorer != null && explorer.endsWith("/")) {
            explorer = explorer.substring(0, explorer.length() - 1);
        }

        return new ChainConfig(
                chain,
                network.getChainId(),
                network.getName() != null ? network.getName() : chain.id(),
                network.getRpcUrl().trim(),
                explorer,
                tokens,
                router != null && !router.isBlank() ? router.trim() : null,
                network.getNativeGasThresholdWei(),
                features,
                network.getTokenTransferGasLimit()
        );
    }
}
