package dao.gaszero.relayer.service;

import dao.gaszero.relayer.model.ChainFeature;
import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayIntentRequest;
import dao.gaszero.relayer.model.RelayRequest;
import dao.gaszero.relayer.model.SupportedChain;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TransferRequest;
import org.springframework.stereotype.Component;

/**
 * Turns the HTTP body into a typed {@link RelayRequest}.
 */
@Component
public class RelayRequestMapper {

    public RelayRequest toRelayRequest(RelayIntentRequest body) {
        SupportedChain chain = SupportedChain.fromId(body.getChain())
                .orElseThrow(() -> new RelayException(RelayErrorKind.VALIDATION_ERROR,
                        "Unsupported chain: " + body.getChain()));
        ChainFeature kind = ChainFeature.fromId(body.getType())
                .orElseThrow(() -> new RelayException(RelayErrorKind.VALIDATION_ERROR,
                        "Unsupported request type: " + body.getType()));

        if (kind == ChainFeature.TRANSFER) {
            if (body.getTo() == null || body.getTo().isBlank()) {
                throw new RelayException(RelayErrorKind.VALIDATION_ERROR, "Missing recipient address");
            }
            return new TransferRequest(chain, trim(body.getFrom()), trim(body.getTo()), body.getToken(),
                    body.getAmount(), body.getSignature(), body.getNonce(), body.getDeadline(), body.getTimestamp());
        }
        return new SwapRequest(chain, trim(body.getFrom()), body.getFromToken(), body.getToToken(),
                body.getAmount(), body.getMinAmountOut(), body.getRouteData(), body.getSignature(),
                body.getNonce(), body.getDeadline(), body.getTimestamp());
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }
}
