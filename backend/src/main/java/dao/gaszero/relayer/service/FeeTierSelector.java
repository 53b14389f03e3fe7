package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.TokenInfo;
import org.springframework.stereotype.Component;

/**
 * Picks the Uniswap V3 pool fee tier for a token pair.
 */
@Component
public class FeeTierSelector {

    private final RelayProperties relayProps;

    public FeeTierSelector(RelayProperties relayProps) {
        this.relayProps = relayProps;
    }

    public int select(TokenInfo tokenIn, TokenInfo tokenOut) {
        if (tokenIn.stablecoin() && tokenOut.stablecoin()) {
            return relayProps.getSwap().getStableFeeTier();
        }
        return relayProps.getSwap().getDefaultFeeTier();
    }
}
