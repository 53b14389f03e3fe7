package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClientException;
import dao.gaszero.relayer.config.RelayProperties;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayRequest;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of every relay: validation, rate limiting, signature policy, then execution on the
 * chain's serial queue. Never throws; every outcome is a {@link RelayResult}.
 */
@Slf4j
@Service
public class RelayEngine {

    private final RelayRequestValidator validator;
    private final RateLimiter rateLimiter;
    private final IntentMessageEncoder messageEncoder;
    private final SignatureVerifier signatureVerifier;
    private final RelayerAccountRegistry accounts;
    private final TransferExecutor transferExecutor;
    private final SwapExecutor swapExecutor;
    private final RelayProperties relayProps;

    public RelayEngine(RelayRequestValidator validator,
                       RateLimiter rateLimiter,
                       IntentMessageEncoder messageEncoder,
                       SignatureVerifier signatureVerifier,
                       RelayerAccountRegistry accounts,
                       TransferExecutor transferExecutor,
                       SwapExecutor swapExecutor,
                       RelayProperties relayProps) {
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.messageEncoder = messageEncoder;
        this.signatureVerifier = signatureVerifier;
        this.accounts = accounts;
        this.transferExecutor = transferExecutor;
        this.swapExecutor = swapExecutor;
        this.relayProps = relayProps;
    }

    /**
     * @param requesterKey rate limit key (client IP)
     */
    public RelayResult relay(RelayRequest request, String requesterKey) {
        try {
            ValidatedRelay validated = validator.validate(request);

            if (!rateLimiter.allow(requesterKey)) {
                log.warn("Rate limited: requester={}, from={}", requesterKey, AddressUtil.shorten(request.fromAddress()));
                return RelayResult.failure(RelayErrorKind.RATE_LIMITED, "Rate limit exceeded. Try again later");
            }

            String message = messageEncoder.encode(request);
            if (!signatureVerifier.verify(message, request.signature(), request.fromAddress())) {
                if (relayProps.isRequireValidSignature()) {
                    log.warn("Rejected {} request: signature does not match {}", request.kind().id(),
                            AddressUtil.shorten(request.fromAddress()));
                    return RelayResult.failure(RelayErrorKind.INVALID_SIGNATURE, "Invalid signature");
                }
                log.warn("Signature does not match {}; proceeding because relay.require-valid-signature=false",
                        AddressUtil.shorten(request.fromAddress()));
            }

            RelayerAccount account = accounts.require(request.chain());
            return account.queue().run(() -> dispatch(account, validated));
        } catch (RelayException e) {
            log.info("Relay rejected: chain={}, kind={}, detail={}", request.chain(), e.getKind(), e.getMessage());
            return RelayResult.failure(e.getKind(), e.getMessage(), e.getTxHash());
        } catch (ChainClientException e) {
            log.warn("Chain unavailable: chain={}, error={}", request.chain(), e.getMessage());
            return RelayResult.failure(RelayErrorKind.CHAIN_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected relay failure: chain={}", request.chain(), e);
            return RelayResult.failure(RelayErrorKind.INTERNAL_ERROR, "Internal error");
        }
    }

    private RelayResult dispatch(RelayerAccount account, ValidatedRelay validated) {
        // Queue wait may have outlived the deadline.
        validator.ensureNotExpired(validated.deadline());
        if (validated instanceof ValidatedTransfer) {
            return transferExecutor.execute(account, (ValidatedTransfer) validated);
        }
        return swapExecutor.execute(account, (ValidatedSwap) validated);
    }
}
