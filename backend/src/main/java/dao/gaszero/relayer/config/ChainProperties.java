package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Networks keyed by chain id string (eth-sepolia, arb-sepolia, base-sepolia).
     */
    private Map<String, Network> networks = new LinkedHashMap<>();

    @Data
    public static class Network {

        /**
         * EVM chain id
         * Sepolia: 11155111
         * Arbitrum Sepolia: 421614
         * Base Sepolia: 84532
         */
        private Long chainId;

        /**
         * Human readable name, used in logs and error details
         */
        private String name;

        /**
         * JSON-RPC endpoint
         */
        private String rpcUrl;

        /**
         * Block explorer base URL (without trailing slash)
         * Example: https://sepolia.etherscan.io
         */
        private String explorerUrl;

        /**
         * Relayer private key (hex, with or without 0x prefix).
         * Left empty the chain has no relayer and every request for it is rejected.
         */
        private String privateKey;

        /**
         * Uniswap V3 SwapRouter02 address. Required when features contain "swap".
         */
        private String routerAddress;

        /**
         * Below this native balance (wei) a user is considered unable to pay for an approval.
         * Default: 0.001 ETH
         */
        private BigInteger nativeGasThresholdWei = new BigInteger("1000000000000000");

        /**
         * Gas limit for ERC20 transfer/transferFrom issued by the relayer.
         */
        private long tokenTransferGasLimit = 150_000L;

        /**
         * Enabled operations: transfer, swap
         */
        private List<String> features = new ArrayList<>();

        /**
         * Tokens keyed by symbol (USDC, USDT, ETH)
         */
        private Map<String, Token> tokens = new LinkedHashMap<>();
    }

    @Data
    public static class Token {

        /**
         * ERC20 contract address (0x hex)
         */
        private String address;

        private int decimals;

        /**
         * Fees are only charged in stablecoin legs.
         */
        private boolean stablecoin;

        /**
         * Marks the wrapped native token (WETH). Its symbol stands for the native currency in swaps.
         */
        private boolean wrappedNative;
    }
}
