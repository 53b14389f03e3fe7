package dao.gaszero.relayer.model;

public enum RelayErrorKind {
    VALIDATION_ERROR,
    INVALID_SIGNATURE,
    RATE_LIMITED,
    INSUFFICIENT_BALANCE,
    INSUFFICIENT_ALLOWANCE,
    APPROVAL_FUNDED,
    RELAYER_INSUFFICIENT_GAS,
    TRANSACTION_REVERTED,
    CONFIRMATION_TIMEOUT,
    UNSUPPORTED_FEATURE,
    CHAIN_UNAVAILABLE,
    INTERNAL_ERROR
}
