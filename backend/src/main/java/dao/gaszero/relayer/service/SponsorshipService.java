package dao.gaszero.relayer.service;

import dao.gaszero.relayer.config.SponsorshipProperties;
import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.SponsorshipRequest;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.util.AddressUtil;
import dao.gaszero.relayer.util.TokenAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standalone approval funding, for clients that want gas before building a relay intent.
 */
@Slf4j
@Service
public class SponsorshipService {

    static final String APPROVAL_NEEDED = "approval_needed";

    private final RelayerAccountRegistry accounts;
    private final GasSponsorshipFunder funder;
    private final SponsorshipProperties props;

    public SponsorshipService(RelayerAccountRegistry accounts, GasSponsorshipFunder funder,
                              SponsorshipProperties props) {
        this.accounts = accounts;
        this.funder = funder;
        this.props = props;
    }

    /**
     * @throws RelayException VALIDATION_ERROR, UNSUPPORTED_FEATURE, RATE_LIMITED (cooldown)
     *                        or any funding transaction failure
     */
    public Map<String, Object> fund(SponsorshipRequest req) {
        if (!APPROVAL_NEEDED.equals(req.getReason())) {
            throw new RelayException(RelayErrorKind.VALIDATION_ERROR, "Invalid funding reason");
        }
        if (!props.isEnabled()) {
            throw new RelayException(RelayErrorKind.UNSUPPORTED_FEATURE, "Gas sponsorship is disabled");
        }
        SupportedChain chain = SupportedChain.fromId(req.getChain())
                .orElseThrow(() -> new RelayException(RelayErrorKind.VALIDATION_ERROR, "Unsupported chain: " + req.getChain()));
        if (!AddressUtil.isValid(req.getUserAddress())) {
            throw new RelayException(RelayErrorKind.VALIDATION_ERROR, "Invalid user address");
        }
        RelayerAccount account = accounts.require(chain);
        ChainConfig config = account.config();
        TokenInfo token = config.token(req.getToken())
                .orElseThrow(() -> new RelayException(RelayErrorKind.VALIDATION_ERROR,
                        "Unsupported token " + req.getToken() + " on " + config.name()));
        BigInteger amount;
        try {
            amount = TokenAmounts.toBaseUnits(req.getAmount(), token.decimals());
        } catch (IllegalArgumentException e) {
            throw new RelayException(RelayErrorKind.VALIDATION_ERROR, e.getMessage());
        }

        SponsorshipDecision decision = account.queue().run(() ->
                funder.ensureAllowance(account, token, req.getUserAddress().trim(), amount));

        Map<String, Object> body = new LinkedHashMap<>();
        switch (decision.state()) {
            case FUNDED:
                body.put("success", true);
                body.put("funded", true);
                body.put("hash", decision.fundingTxHash());
                body.put("amount", TokenAmounts.toDisplay(props.getFundingAmountWei(), 18));
                body.put("explorerUrl", config.explorerTxUrl(decision.fundingTxHash()));
                body.put("message", decision.detail());
                return body;
            case READY:
                body.put("success", true);
                body.put("funded", false);
                body.put("message", "Allowance already sufficient");
                return body;
            case AWAITING_APPROVAL:
                body.put("success", true);
                body.put("funded", false);
                body.put("message", "User already has sufficient ETH for the approval");
                return body;
            default:
                throw new RelayException(RelayErrorKind.RATE_LIMITED, decision.detail());
        }
    }

    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("message", "Gas sponsorship service ready");
        body.putAll(funder.stats());
        return body;
    }
}
