package dao.gaszero.relayer.model;

public record TransferRequest(
        SupportedChain chain,
        String fromAddress,
        String toAddress,
        String token,
        String amount,
        String signature,
        Long nonce,
        Long deadline,
        Long timestamp
) implements RelayRequest {

    @Override
    public ChainFeature kind() {
        return ChainFeature.TRANSFER;
    }
}
