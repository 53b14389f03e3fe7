package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.ChainConfig;
import dao.gaszero.relayer.model.RelayRequest;

import java.time.Instant;

/**
 * A request that passed every static check, with its amounts resolved to base units.
 */
public interface ValidatedRelay {

    RelayRequest request();

    ChainConfig config();

    Instant deadline();
}
