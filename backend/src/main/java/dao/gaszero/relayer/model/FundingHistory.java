package dao.gaszero.relayer.model;

import java.time.Instant;

/**
 * @param previousFundedAt funding before the last one, null after the first funding
 */
public record FundingHistory(Instant lastFundedAt, Instant previousFundedAt, int fundingCount) {

    public static FundingHistory first(Instant fundedAt) {
        return new FundingHistory(fundedAt, null, 1);
    }

    public FundingHistory next(Instant fundedAt) {
        return new FundingHistory(fundedAt, lastFundedAt, fundingCount + 1);
    }
}
