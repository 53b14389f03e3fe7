package dao.gaszero.relayer.model;

public enum RelayStatus {
    SUCCESS,
    /** Not an error: the user was funded and must approve, then retry. */
    APPROVAL_FUNDED,
    FAILED
}
