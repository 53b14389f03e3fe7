package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.Web3jChainClient;
import dao.gaszero.relayer.config.ChainProperties;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SupportedChain;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class RelayerAccountRegistry {

    private final Map<SupportedChain, RelayerAccount> accounts;

    @Autowired
    public RelayerAccountRegistry(ChainRegistry chainRegistry,
                                  ChainProperties chainProps,
                                  RelayProperties relayProps) {
        Map<SupportedChain, RelayerAccount> built = new EnumMap<>(SupportedChain.class);
        for (ChainConfig config : chainRegistry.all()) {
            ChainProperties.Network network = chainProps.getNetworks().get(config.chain().id());
            String privateKey = network != null ? network.getPrivateKey() : null;
            if (privateKey == null || privateKey.isBlank()) {
                log.warn("No relayer key configured for {}. Requests for this chain will be rejected.", config.chain());
                continue;
            }
            if (!WalletUtils.isValidPrivateKey(privateKey.trim())) {
                log.warn("Relayer key for {} is not a valid secp256k1 key. Requests for this chain will be rejected.",
                        config.chain());
                continue;
            }
            Web3jChainClient client = new Web3jChainClient(config, privateKey,
                    relayProps.getConfirmation().getPollInitialMs(),
                    relayProps.getConfirmation().getPollMaxMs());
            built.put(config.chain(), new RelayerAccount(config, client, new ChainExecutionQueue(config.chain().id())));
            log.info("Relayer ready: chain={}, chainId={}, address={}", config.chain(), config.chainId(), client.getAddress());
        }
        this.accounts = Collections.unmodifiableMap(built);
    }

    RelayerAccountRegistry(List<RelayerAccount> accounts) {
        Map<SupportedChain, RelayerAccount> built = new EnumMap<>(SupportedChain.class);
        accounts.forEach(a -> built.put(a.config().chain(), a));
        this.accounts = Collections.unmodifiableMap(built);
    }

    public static RelayerAccountRegistry of(RelayerAccount... accounts) {
        return new RelayerAccountRegistry(List.of(accounts));
    }

    public Optional<RelayerAccount> find(SupportedChain chain) {
        return Optional.ofNullable(accounts.get(chain));
    }

    public RelayerAccount require(SupportedChain chain) {
        return find(chain).orElseThrow(() ->
                new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE, "No relayer for chain " + chain));
    }

    public Collection<RelayerAccount> all() {
        return accounts.values();
    }

    @PreDestroy
    public void shutdown() {
        accounts.values().forEach(a -> a.queue().shutdown());
    }
}
