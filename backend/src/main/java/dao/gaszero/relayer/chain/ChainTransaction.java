package dao.gaszero.relayer.chain;

import java.math.BigInteger;

/**
 * Minimal view of a mined or pending transaction.
 */
public record ChainTransaction(
        String hash,
        String from,
        String to,
        BigInteger value,
        BigInteger blockNumber
) {}
