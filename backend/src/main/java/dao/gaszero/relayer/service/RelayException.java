package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.RelayErrorKind;
import lombok.Getter;

/**
 * Business failure of a relay flow. The message is the user-facing detail.
 */
@Getter
public class RelayException extends RuntimeException {

    private final RelayErrorKind kind;
    private final String txHash;

    public RelayException(RelayErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public RelayException(RelayErrorKind kind, String detail, String txHash) {
        super(detail);
        this.kind = kind;
        this.txHash = txHash;
    }
}
