package dao.gaszero.relayer.service;

import dao.gaszero.relayer.chain.ChainClient;
import dao.gaszero.relayer.model.ChainConfig;

/**
 * The signing account serving one chain for the process lifetime, with its serial queue.
 */
public record RelayerAccount(ChainConfig config, ChainClient client, ChainExecutionQueue queue) {

    public String address() {
        return client.getAddress();
    }
}
