package dao.gaszero.relayer.model;

import java.util.Map;

/**
 * @param minAmountOut integer string in the smallest unit of {@code toToken}
 * @param routeData    externally sourced route hints, logged only
 */
public record SwapRequest(
        SupportedChain chain,
        String fromAddress,
        String fromToken,
        String toToken,
        String amount,
        String minAmountOut,
        Map<String, Object> routeData,
        String signature,
        Long nonce,
        Long deadline,
        Long timestamp
) implements RelayRequest {

    @Override
    public ChainFeature kind() {
        return ChainFeature.SWAP;
    }
}
