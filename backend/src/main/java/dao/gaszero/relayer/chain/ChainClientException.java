package dao.gaszero.relayer.chain;

/**
 * Retryable I/O failure talking to a chain node.
 */
public class ChainClientException extends RuntimeException {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
