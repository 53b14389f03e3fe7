package dao.gaszero.relayer.chain;

import java.util.Locale;

/**
 * The node refused to accept a signed transaction.
 */
public class TransactionSubmissionException extends ChainClientException {

    public TransactionSubmissionException(String message) {
        super(message);
    }

    public boolean isInsufficientFunds() {
        String msg = getMessage();
        return msg != null && msg.toLowerCase(Locale.ROOT).contains("insufficient funds");
    }
}
