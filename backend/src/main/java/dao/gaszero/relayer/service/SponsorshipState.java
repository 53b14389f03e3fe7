package dao.gaszero.relayer.service;

/**
 * Where a user stands with respect to the allowance a relay flow needs.
 */
public enum SponsorshipState {
    /** Allowance already covers the amount. */
    READY,
    /** Allowance is short and the user cannot pay for an approval, but funding is blocked (cooldown or disabled). */
    NEEDS_FUNDING,
    /** Native currency was just sent; the user must approve and retry. */
    FUNDED,
    /** Allowance is short but the user already holds gas for the approval. */
    AWAITING_APPROVAL
}
