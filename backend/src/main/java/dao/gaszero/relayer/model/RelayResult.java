package dao.gaszero.relayer.model;

import java.math.BigInteger;

/**
 * Outcome of one relay request. Fee and net amount are expressed in the same token.
 */
public record RelayResult(
        RelayStatus status,
        String transactionHash,
        BigInteger feeCharged,
        BigInteger netAmount,
        String tokenSymbol,
        int tokenDecimals,
        String explorerUrl,
        RelayErrorKind errorKind,
        String detail,
        String fundingTransactionHash,
        boolean reconciliationRequired
) {

    public static RelayResult success(String txHash, BigInteger fee, BigInteger net,
                                      TokenInfo token, String explorerUrl) {
        return new RelayResult(RelayStatus.SUCCESS, txHash, fee, net,
                token.symbol(), token.decimals(), explorerUrl, null, null, null, false);
    }

    public static RelayResult approvalFunded(String fundingTxHash, String detail) {
        return new RelayResult(RelayStatus.APPROVAL_FUNDED, null, null, null, null, 0, null,
                RelayErrorKind.APPROVAL_FUNDED, detail, fundingTxHash, false);
    }

    public static RelayResult failure(RelayErrorKind kind, String detail) {
        return new RelayResult(RelayStatus.FAILED, null, null, null, null, 0, null,
                kind, detail, null, false);
    }

    public static RelayResult failure(RelayErrorKind kind, String detail, String txHash) {
        return new RelayResult(RelayStatus.FAILED, txHash, null, null, null, 0, null,
                kind, detail, null, false);
    }

    public static RelayResult partialFailure(RelayErrorKind kind, String detail, String txHash) {
        return new RelayResult(RelayStatus.FAILED, txHash, null, null, null, 0, null,
                kind, detail, null, true);
    }

    public boolean isSuccess() {
        return status == RelayStatus.SUCCESS;
    }
}
