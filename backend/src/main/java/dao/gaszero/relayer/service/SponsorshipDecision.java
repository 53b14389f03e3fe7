package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;

import java.util.Optional;

public record SponsorshipDecision(SponsorshipState state, String fundingTxHash, String detail) {

    public static SponsorshipDecision ready() {
        return new SponsorshipDecision(SponsorshipState.READY, null, null);
    }

    /**
     * Maps a non-ready decision to the result that ends the relay flow.
     * Empty when the flow may continue.
     */
    public Optional<RelayResult> toBlockingResult() {
        switch (state) {
            case READY:
                return Optional.empty();
            case FUNDED:
                return Optional.of(RelayResult.approvalFunded(fundingTxHash, detail));
            default:
                return Optional.of(RelayResult.failure(RelayErrorKind.INSUFFICIENT_ALLOWANCE, detail));
        }
    }
}
