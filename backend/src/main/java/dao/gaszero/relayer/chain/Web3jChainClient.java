package dao.gaszero.relayer.chain;

import dao.gaszero.relayer.model.ChainConfig;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetBalance;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * JSON-RPC chain client signing with one relayer key.
 * <p>
 * The nonce is read from the node (pending) for every transaction, which is only safe because
 * callers never have two transactions of this account in flight.
 */
@Slf4j
public class Web3jChainClient implements ChainClient {

    private final Web3j web3j;
    private final Credentials credentials;
    private final RawTransactionManager txManager;
    private final String label;
    private final long pollInitialMs;
    private final long pollMaxMs;

    public Web3jChainClient(ChainConfig config, String privateKey, long pollInitialMs, long pollMaxMs) {
        this(Web3j.build(new HttpService(config.rpcUrl())), config, privateKey, pollInitialMs, pollMaxMs);
    }

    Web3jChainClient(Web3j web3j, ChainConfig config, String privateKey, long pollInitialMs, long pollMaxMs) {
        this.web3j = web3j;
        this.credentials = Credentials.create(privateKey.trim());
        this.txManager = new RawTransactionManager(web3j, credentials, config.chainId());
        this.label = config.chain().id();
        this.pollInitialMs = pollInitialMs;
        this.pollMaxMs = pollMaxMs;
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }

    @Override
    public BigInteger getBalance(String address) {
        try {
            EthGetBalance resp = web3j.ethGetBalance(address, DefaultBlockParameterName.LATEST).send();
            if (resp.hasError()) {
                throw new ChainClientException("[" + label + "] eth_getBalance failed: " + resp.getError().getMessage());
            }
            return resp.getBalance();
        } catch (IOException e) {
            throw new ChainClientException("[" + label + "] eth_getBalance failed: " + e.getMessage(), e);
        }
    }

    @Override
    public BigInteger getGasPrice() {
        try {
            EthGasPrice resp = web3j.ethGasPrice().send();
            if (resp.hasError()) {
                throw new ChainClientException("[" + label + "] eth_gasPrice failed: " + resp.getError().getMessage());
            }
            return resp.getGasPrice();
        } catch (IOException e) {
            throw new ChainClientException("[" + label + "] eth_gasPrice failed: " + e.getMessage(), e);
        }
    }

    @Override
    @SuppressWarnings("rawtypes")
    public List<Type> readContract(String contractAddress, Function function) {
        String encoded = FunctionEncoder.encode(function);
        try {
            EthCall resp = web3j.ethCall(
                    Transaction.createEthCallTransaction(getAddress(), contractAddress, encoded),
                    DefaultBlockParameterName.LATEST
            ).send();
            if (resp.hasError()) {
                throw new ChainClientException("[" + label + "] eth_call " + function.getName()
                        + " failed: " + resp.getError().getMessage());
            }
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters());
            if (decoded.size() != function.getOutputParameters().size()) {
                throw new ChainClientException("[" + label + "] eth_call " + function.getName()
                        + " returned " + decoded.size() + " values on " + contractAddress);
            }
            return decoded;
        } catch (IOException e) {
            throw new ChainClientException("[" + label + "] eth_call " + function.getName()
                    + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String sendTransaction(String to, String data, BigInteger value, BigInteger gasLimit) {
        try {
            BigInteger gasPrice = getGasPrice();
            EthSendTransaction sent = txManager.sendTransaction(gasPrice, gasLimit, to, data, value);
            if (sent.hasError()) {
                throw new TransactionSubmissionException(sent.getError().getMessage());
            }
            String txHash = sent.getTransactionHash();
            if (txHash == null || txHash.isBlank()) {
                throw new ChainClientException("[" + label + "] node returned an empty tx hash");
            }
            return txHash;
        } catch (IOException e) {
            throw new ChainClientException("[" + label + "] eth_sendRawTransaction failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<TxReceipt> waitForReceipt(String txHash, Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitialMs);
        long maxSleepMs = Math.max(sleepMs, pollMaxMs);
        while (System.currentTimeMillis() < deadline) {
            try {
                EthGetTransactionReceipt resp = web3j.ethGetTransactionReceipt(txHash).send();
                Optional<TransactionReceipt> receipt = resp.getTransactionReceipt();
                if (receipt.isPresent()) {
                    return Optional.of(toReceipt(receipt.get()));
                }
            } catch (IOException e) {
                log.debug("[{}] receipt not available yet for {}: {}", label, txHash, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(Math.min(sleepMs + jitter, Math.max(1, deadline - System.currentTimeMillis())));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return Optional.empty();
    }

    @Override
    public Optional<ChainTransaction> getTransaction(String txHash) {
        try {
            EthTransaction resp = web3j.ethGetTransactionByHash(txHash).send();
            if (resp.hasError()) {
                throw new ChainClientException("[" + label + "] eth_getTransactionByHash failed: "
                        + resp.getError().getMessage());
            }
            return resp.getTransaction().map(tx -> new ChainTransaction(
                    tx.getHash(),
                    tx.getFrom(),
                    tx.getTo(),
                    tx.getValue(),
                    tx.getBlockNumberRaw() != null ? Numeric.decodeQuantity(tx.getBlockNumberRaw()) : null
            ));
        } catch (IOException e) {
            throw new ChainClientException("[" + label + "] eth_getTransactionByHash failed: " + e.getMessage(), e);
        }
    }

    private static TxReceipt toReceipt(TransactionReceipt r) {
        return new TxReceipt(
                r.getTransactionHash(),
                r.isStatusOK(),
                r.getBlockNumberRaw() != null ? r.getBlockNumber() : null,
                r.getGasUsedRaw() != null ? r.getGasUsed() : null,
                r.getRevertReason()
        );
    }
}
