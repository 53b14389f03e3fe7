package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TokenInfo;

import java.math.BigInteger;
import java.time.Instant;

/**
 * @param nativeInput  the user pays in native currency previously deposited to the relayer
 * @param nativeOutput the user receives native currency (the router delivers the wrapped token to the relayer)
 */
public record ValidatedSwap(
        SwapRequest request,
        ChainConfig config,
        TokenInfo tokenIn,
        TokenInfo tokenOut,
        BigInteger amountIn,
        BigInteger minAmountOut,
        boolean nativeInput,
        boolean nativeOutput,
        Instant deadline
) implements ValidatedRelay {}
