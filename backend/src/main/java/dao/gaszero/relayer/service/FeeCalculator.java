package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.FeeProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class FeeCalculator {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000L);

    private final FeeProperties feeProps;

    public FeeCalculator(FeeProperties feeProps) {
        this.feeProps = feeProps;
    }

    /**
     * Fee in the same unit as {@code amount}: {@code amount * bps / 10000} (truncated),
     * clamped to [minFee, maxFee].
     */
    public BigInteger fee(BigInteger amount, boolean crossChain) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        int bps = crossChain ? feeProps.getCrossChainBasisPoints() : feeProps.getSameChainBasisPoints();
        BigInteger raw = amount.multiply(BigInteger.valueOf(bps)).divide(BPS_DENOMINATOR);
        return raw.max(feeProps.getMinFee()).min(feeProps.getMaxFee());
    }
}
