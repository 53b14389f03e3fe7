package dao.gaszero.relayer.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * User funds left in a relayer account after a flow failed half way.
 */
public record ReconciliationRecord(
        SupportedChain chain,
        String userAddress,
        String tokenSymbol,
        BigInteger amountHeld,
        String pullTxHash,
        String failedStep,
        RelayErrorKind errorKind,
        String detail,
        Instant recordedAt
) {}
