package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.repository.NativeCreditRepository;
import dao.gaszero.relayer.util.AddressUtil;
import dao.gaszero.relayer.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * First phase of native-to-token swaps: users send native currency to the relayer and
 * register the transaction here; swaps later consume the resulting credit.
 */
@Slf4j
@Service
public class NativeDepositService {

    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final RelayerAccountRegistry accounts;
    private final NativeCreditRepository credits;
    private final ConfirmationTracker tracker;

    public NativeDepositService(RelayerAccountRegistry accounts, NativeCreditRepository credits,
                                ConfirmationTracker tracker) {
        this.accounts = accounts;
        this.credits = credits;
        this.tracker = tracker;
    }

    public record DepositCredit(SupportedChain chain, String user, String txHash, BigInteger credited,
                                BigInteger available) {}

    /**
     * Verifies a mined deposit (sender, relayer as recipient, success) and credits it once.
     */
    public DepositCredit register(String chainId, String from, String txHash) {
        SupportedChain chain = SupportedChain.fromId(chainId)
                .orElseThrow(() -> invalid("Unsupported chain: " + chainId));
        if (!AddressUtil.isValid(from)) {
            throw invalid("Invalid sender address");
        }
        if (txHash == null || !TX_HASH.matcher(txHash.trim()).matches()) {
            throw invalid("Invalid transaction hash");
        }
        String hash = txHash.trim();
        RelayerAccount account = accounts.require(chain);
        ChainClient client = account.client();

        Optional<ChainTransaction> tx = client.getTransaction(hash);
        if (tx.isEmpty()) {
            throw invalid("Deposit transaction not found");
        }
        ChainTransaction deposit = tx.get();
        if (!AddressUtil.same(deposit.to(), client.getAddress())) {
            throw invalid("Deposit was not sent to the relayer " + client.getAddress());
        }
        if (!AddressUtil.same(deposit.from(), from)) {
            throw invalid("Deposit was not sent by " + from);
        }
        if (deposit.value() == null || deposit.value().signum() <= 0) {
            throw invalid("Deposit carries no value");
        }

        Optional<TxReceipt> receipt = client.waitForReceipt(hash, tracker.defaultTimeout());
        if (receipt.isEmpty()) {
            throw new RelayException(RelayErrorKind.CONFIRMATION_TIMEOUT, "Deposit not confirmed yet", hash);
        }
        if (!receipt.get().success()) {
            throw new RelayException(RelayErrorKind.TRANSACTION_REVERTED, "Deposit transaction failed", hash);
        }

        String key = creditKey(chain, from);
        if (!credits.credit(key, hash, deposit.value())) {
            throw invalid("Deposit already credited");
        }
        BigInteger available = credits.balanceOf(key);
        log.info("Native deposit credited: chain={}, user={}, amount={} wei, tx={}, available={} wei",
                chain, AddressUtil.shorten(from), deposit.value(), hash, available);
        return new DepositCredit(chain, from, hash, deposit.value(), available);
    }

    BigInteger available(SupportedChain chain, String user) {
        return credits.balanceOf(creditKey(chain, user));
    }

    /**
     * @throws RelayException INSUFFICIENT_BALANCE when the user's credit is lower than {@code amount}
     */
    public void consume(SupportedChain chain, String user, BigInteger amount) {
        String key = creditKey(chain, user);
        if (!credits.debit(key, amount)) {
            throw new RelayException(RelayErrorKind.INSUFFICIENT_BALANCE,
                    "Insufficient balance. Have: " + TokenAmounts.toDisplay(credits.balanceOf(key), 18)
                            + " ETH deposited, Need: " + TokenAmounts.toDisplay(amount, 18) + " ETH");
        }
    }

    public void restore(SupportedChain chain, String user, BigInteger amount) {
        credits.restore(creditKey(chain, user), amount);
        log.info("Native credit restored: chain={}, user={}, amount={} wei", chain, AddressUtil.shorten(user), amount);
    }

    private static String creditKey(SupportedChain chain, String user) {
        return chain.id() + ":" + AddressUtil.normalize(user);
    }

    private static RelayException invalid(String detail) {
        return new RelayException(RelayErrorKind.VALIDATION_ERROR, detail);
    }
}
