package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.chain.ContractFunctions;
import dao.gaszero.relayer.chain.PreparedTransaction;
import dao.gaszero.relayer.chain.TxReceipt;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.model.TransferRequest;
import dao.gaszero.relayer.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Pull-then-push transfer: the relayer takes the full amount from the user, keeps the fee
 * and forwards the rest to the recipient.
 */
@Slf4j
@Component
public class TransferExecutor {

    private final UserFundsCheck fundsCheck;
    private final ConfirmationTracker tracker;
    private final FeeCalculator feeCalculator;
    private final ReconciliationAlerts alerts;

    public TransferExecutor(UserFundsCheck fundsCheck, ConfirmationTracker tracker,
                            FeeCalculator feeCalculator, ReconciliationAlerts alerts) {
        this.fundsCheck = fundsCheck;
        this.tracker = tracker;
        this.feeCalculator = feeCalculator;
        this.alerts = alerts;
    }

    public RelayResult execute(RelayerAccount account, ValidatedTransfer transfer) {
        TransferRequest req = transfer.request();
        ChainConfig config = transfer.config();
        TokenInfo token = transfer.token();
        BigInteger amount = transfer.amount();
        ChainClient client = account.client();
        String relayer = client.getAddress();

        log.info("Transfer start: chain={}, from={}, to={}, amount={} {}", config.chain(),
                AddressUtil.shorten(req.fromAddress()), AddressUtil.shorten(req.toAddress()), amount, token.symbol());

        TxReceipt pull;
        try {
            Optional<RelayResult> blocked = fundsCheck.verify(account, token, req.fromAddress(), amount);
            if (blocked.isPresent()) {
                return blocked.get();
            }
            pull = tracker.submitAndWait(client, PreparedTransaction.call("pull", token.address(),
                    ContractFunctions.transferFrom(req.fromAddress(), relayer, amount), config.tokenTransferGasLimit()));
        } catch (RelayException e) {
            return RelayResult.failure(e.getKind(), e.getMessage(), e.getTxHash());
        } catch (ChainClientException e) {
            return RelayResult.failure(RelayErrorKind.CHAIN_UNAVAILABLE, e.getMessage());
        }

        BigInteger fee = feeCalculator.fee(amount, false);
        BigInteger net = amount.subtract(fee);

        TxReceipt push;
        try {
            push = tracker.submitAndWait(client, PreparedTransaction.call("push", token.address(),
                    ContractFunctions.transfer(req.toAddress(), net), config.tokenTransferGasLimit()));
        } catch (RelayException e) {
            return heldAfterPull(config, req, token, amount, pull, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            RelayErrorKind kind = e instanceof ChainClientException
                    ? RelayErrorKind.CHAIN_UNAVAILABLE : RelayErrorKind.INTERNAL_ERROR;
            return heldAfterPull(config, req, token, amount, pull, kind, e.getMessage());
        }

        log.info("Transfer done: chain={}, pull={}, push={}, fee={}, net={}", config.chain(),
                pull.transactionHash(), push.transactionHash(), fee, net);
        return RelayResult.success(push.transactionHash(), fee, net, token, config.explorerTxUrl(push.transactionHash()));
    }

    private RelayResult heldAfterPull(ChainConfig config, TransferRequest req, TokenInfo token, BigInteger amount,
                                      TxReceipt pull, RelayErrorKind kind, String detail) {
        alerts.raise(config.chain(), req.fromAddress(), token.symbol(), amount,
                pull.transactionHash(), "push", kind, detail);
        return RelayResult.partialFailure(kind,
                "Tokens were collected but forwarding failed: " + detail + ". Refund pending review",
                pull.transactionHash());
    }
}
