package dao.gaszero.relayer.chain;

import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Narrow view of one chain as seen by one relayer account.
 * <p>
 * Every method is a blocking call. I/O failures surface as {@link ChainClientException};
 * a node refusing a transaction surfaces as {@link TransactionSubmissionException}.
 */
public interface ChainClient {

    /** Address of the signing relayer account. */
    String getAddress();

    BigInteger getBalance(String address);

    BigInteger getGasPrice();

    @SuppressWarnings("rawtypes")
    List<Type> readContract(String contractAddress, Function function);

    /**
     * Signs and broadcasts a transaction from the relayer account.
     *
     * @return transaction hash
     */
    String sendTransaction(String to, String data, BigInteger value, BigInteger gasLimit);

    /**
     * Polls for the receipt until it exists or the timeout elapses.
     *
     * @return empty when no receipt appeared in time
     */
    Optional<TxReceipt> waitForReceipt(String txHash, Duration timeout);

    Optional<ChainTransaction> getTransaction(String txHash);
}
