package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.model.TokenInfo;
import dao.gaszero.relayer.util.TokenAmounts;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Balance and allowance preconditions of every pull from a user.
 */
@Component
public class UserFundsCheck {

    private final BalanceAllowanceOracle oracle;
    private final GasSponsorshipFunder sponsorshipFunder;

    public UserFundsCheck(BalanceAllowanceOracle oracle, GasSponsorshipFunder sponsorshipFunder) {
        this.oracle = oracle;
        this.sponsorshipFunder = sponsorshipFunder;
    }

    /**
     * @return the result ending the flow (approval funded or allowance missing), empty when the pull may go ahead
     * @throws RelayException INSUFFICIENT_BALANCE when the user holds less than {@code amount}
     */
    public Optional<RelayResult> verify(RelayerAccount account, TokenInfo token, String user, BigInteger amount) {
        BigInteger balance = oracle.tokenBalance(account.client(), token, user);
        if (balance.compareTo(amount) < 0) {
            throw new RelayException(RelayErrorKind.INSUFFICIENT_BALANCE,
                    "Insufficient balance. Have: " + TokenAmounts.toDisplay(balance, token.decimals())
                            + " " + token.symbol() + ", Need: " + TokenAmounts.toDisplay(amount, token.decimals())
                            + " " + token.symbol());
        }
        return sponsorshipFunder.ensureAllowance(account, token, user, amount).toBlockingResult();
    }
}
