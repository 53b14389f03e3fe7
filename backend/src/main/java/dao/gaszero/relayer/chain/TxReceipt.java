package dao.gaszero.relayer.chain;

import java.math.BigInteger;

public record TxReceipt(
        String transactionHash,
        boolean success,
        BigInteger blockNumber,
        BigInteger gasUsed,
        String revertReason
) {}
