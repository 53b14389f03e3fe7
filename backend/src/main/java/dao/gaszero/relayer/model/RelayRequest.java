package dao.gaszero.relayer.model;

/**
 * A signed relay intent, tagged by {@link #kind()}.
 */
public interface RelayRequest {

    ChainFeature kind();

    SupportedChain chain();

    String fromAddress();

    String signature();

    /** Advisory only, never checked for replay. */
    Long nonce();

    /** Unix seconds, may be null when the intent only carries a timestamp. */
    Long deadline();

    /** Intent creation time in unix seconds. */
    Long timestamp();

    /** Amount in display units of the input token. */
    String amount();
}
