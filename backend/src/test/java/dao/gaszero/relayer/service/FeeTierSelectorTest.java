package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ChainConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FeeTierSelectorTest {

    private final ChainConfig sepolia = TestChains.sepolia();
    private final FeeTierSelector selector = new FeeTierSelector(new RelayProperties());

    @Test
    @DisplayName("Stablecoin pairs use the 0.01% pool")
    void stablePairUsesLowestTier() {
        assertEquals(100, selector.select(TestChains.token(sepolia, "USDC"), TestChains.token(sepolia, "USDT")));
    }

    @Test
    @DisplayName("Wrapped native against a stablecoin uses the 0.3% pool")
    void nativePairUsesDefaultTier() {
        assertEquals(3000, selector.select(TestChains.token(sepolia, "ETH"), TestChains.token(sepolia, "USDC")));
        assertEquals(3000, selector.select(TestChains.token(sepolia, "USDC"), TestChains.token(sepolia, "ETH")));
    }
}
