package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayRequest;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.model.TransferRequest;
import dao.gaszero.relayer.util.AddressUtil;
import dao.gaszero.relayer.util.TokenAmounts;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Static checks of a relay request. Makes no chain calls and keeps no state, so validating
 * the same request twice gives the same answer.
 */
@Component
public class RelayRequestValidator {

    private final ChainRegistry chainRegistry;
    private final FeeCalculator feeCalculator;
    private final RelayProperties relayProps;
    private final Clock clock;

    public RelayRequestValidator(ChainRegistry chainRegistry, FeeCalculator feeCalculator,
                                 RelayProperties relayProps, Clock clock) {
        this.chainRegistry = chainRegistry;
        this.feeCalculator = feeCalculator;
        this.relayProps = relayProps;
        this.clock = clock;
    }

    /**
     * @throws RelayException VALIDATION_ERROR or UNSUPPORTED_FEATURE
     */
    public ValidatedRelay validate(RelayRequest request) {
        if (request.chain() == null) {
            throw invalid("Chain is required");
        }
        ChainConfig config = chainRegistry.require(request.chain());
        if (!config.supports(request.kind())) {
            throw new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE,
                    capitalize(request.kind().id()) + " is not supported on " + config.name());
        }
        if (!AddressUtil.isValid(request.fromAddress())) {
            throw invalid("Invalid sender address");
        }
        if (request.signature() == null || request.signature().isBlank()) {
            throw invalid("Signature is required");
        }
        Instant deadline = effectiveDeadline(request);
        ensureNotExpired(deadline);

        if (request instanceof TransferRequest) {
            return validateTransfer((TransferRequest) request, config, deadline);
        }
        return validateSwap((SwapRequest) request, config, deadline);
    }

    public void ensureNotExpired(Instant deadline) {
        if (clock.instant().getEpochSecond() > deadline.getEpochSecond()) {
            throw invalid("Request expired");
        }
    }

    Instant effectiveDeadline(RelayRequest request) {
        if (request.deadline() != null) {
            return Instant.ofEpochSecond(request.deadline());
        }
        if (request.timestamp() != null) {
            return Instant.ofEpochSecond(request.timestamp() + relayProps.getDefaultDeadlineSeconds());
        }
        throw invalid("Either deadline or timestamp is required");
    }

    private ValidatedTransfer validateTransfer(TransferRequest request, ChainConfig config, Instant deadline) {
        if (!AddressUtil.isValid(request.toAddress())) {
            throw invalid("Invalid recipient address");
        }
        TokenInfo token = requireToken(config, request.token());
        if (!token.stablecoin()) {
            throw new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE,
                    "Only stablecoin transfers are relayed, got " + token.symbol());
        }
        BigInteger amount = parseAmount(request.amount(), token);
        ensureAboveFee(amount, token);
        return new ValidatedTransfer(request, config, token, amount, deadline);
    }

    private ValidatedSwap validateSwap(SwapRequest request, ChainConfig config, Instant deadline) {
        TokenInfo tokenIn = requireToken(config, request.fromToken());
        TokenInfo tokenOut = requireToken(config, request.toToken());
        if (tokenIn.symbol().equals(tokenOut.symbol())) {
            throw invalid("Cannot swap " + tokenIn.symbol() + " to itself");
        }
        BigInteger amountIn = parseAmount(request.amount(), tokenIn);
        BigInteger minAmountOut = parseMinAmountOut(request.minAmountOut());

        boolean nativeInput = tokenIn.wrappedNative();
        boolean nativeOutput = tokenOut.wrappedNative();
        if (nativeInput) {
            if (!tokenOut.stablecoin()) {
                throw new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE,
                        "Swaps from " + tokenIn.symbol() + " must output a stablecoin");
            }
            if (minAmountOut.compareTo(feeCalculator.fee(minAmountOut, false)) <= 0) {
                throw invalid("Minimum output amount does not cover the service fee");
            }
        } else {
            if (!tokenIn.stablecoin()) {
                throw new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE,
                        "Swaps are relayed from stablecoins or " + config.wrappedNative().map(TokenInfo::symbol).orElse("native")
                                + " only, got " + tokenIn.symbol());
            }
            ensureAboveFee(amountIn, tokenIn);
        }
        return new ValidatedSwap(request, config, tokenIn, tokenOut, amountIn, minAmountOut,
                nativeInput, nativeOutput, deadline);
    }

    private void ensureAboveFee(BigInteger amount, TokenInfo token) {
        BigInteger fee = feeCalculator.fee(amount, false);
        if (amount.compareTo(fee) <= 0) {
            throw invalid("Amount " + TokenAmounts.toDisplay(amount, token.decimals()) + " " + token.symbol()
                    + " does not exceed the fee of " + TokenAmounts.toDisplay(fee, token.decimals()));
        }
    }

    private static TokenInfo requireToken(ChainConfig config, String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw invalid("Token is required");
        }
        return config.token(symbol)
                .orElseThrow(() -> invalid("Unsupported token " + symbol.trim() + " on " + config.name()));
    }

    private static BigInteger parseAmount(String amount, TokenInfo token) {
        try {
            return TokenAmounts.toBaseUnits(amount, token.decimals());
        } catch (IllegalArgumentException e) {
            throw invalid(e.getMessage());
        }
    }

    private static BigInteger parseMinAmountOut(String minAmountOut) {
        if (minAmountOut == null || minAmountOut.isBlank()) {
            throw invalid("Missing minimum output amount");
        }
        BigInteger value;
        try {
            value = new BigInteger(minAmountOut.trim());
        } catch (NumberFormatException e) {
            throw invalid("Invalid minimum output amount format");
        }
        if (value.signum() <= 0) {
            throw invalid("Minimum output amount must be positive");
        }
        return value;
    }

    private static RelayException invalid(String detail) {
        return new RelayException(RelayErrorKind.VALIDATION_ERROR, detail);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
