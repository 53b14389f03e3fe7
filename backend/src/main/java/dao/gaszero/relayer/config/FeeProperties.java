package dao.gaszero.relayer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

@Configuration
@ConfigurationProperties(prefix = "fee")
@Data
public class FeeProperties {

    /**
     * Same-chain fee rate in basis points
     * Default: 50 (0.5%)
     */
    private int sameChainBasisPoints = 50;

    /**
     * Cross-chain fee rate in basis points
     * Default: 150 (1.5%)
     */
    private int crossChainBasisPoints = 150;

    /**
     * Minimum fee in the fee token's smallest unit
     * Default: 500000 (0.5 of a 6-decimal stablecoin)
     */
    private BigInteger minFee = BigInteger.valueOf(500_000L);

    /**
     * Maximum fee in the fee token's smallest unit
     * Default: 10000000 (10 of a 6-decimal stablecoin)
     */
    private BigInteger maxFee = BigInteger.valueOf(10_000_000L);
}
