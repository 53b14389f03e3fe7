package dao.gaszero.relayer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.gaszero.relayer.model.RelayRequest;
import dao.gaszero.relayer.model.SwapRequest;
import dao.gaszero.relayer.model.TransferRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the exact text a wallet signs for an intent: compact JSON with the keys
 * chain, type, from, to, token, fromToken, toToken, amount, minAmountOut, nonce, timestamp,
 * deadline in that order; absent keys are left out.
 */
@Component
public class IntentMessageEncoder {

    private final ObjectMapper objectMapper;

    public IntentMessageEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(RelayRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        put(fields, "chain", request.chain() != null ? request.chain().id() : null);
        put(fields, "type", request.kind().id());
        put(fields, "from", request.fromAddress());
        if (request instanceof TransferRequest) {
            TransferRequest t = (TransferRequest) request;
            put(fields, "to", t.toAddress());
            put(fields, "token", t.token());
        }
        if (request instanceof SwapRequest) {
            SwapRequest s = (SwapRequest) request;
            put(fields, "fromToken", s.fromToken());
            put(fields, "toToken", s.toToken());
        }
        put(fields, "amount", request.amount());
        if (request instanceof SwapRequest) {
            put(fields, "minAmountOut", ((SwapRequest) request).minAmountOut());
        }
        put(fields, "nonce", request.nonce());
        put(fields, "timestamp", request.timestamp());
        put(fields, "deadline", request.deadline());
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode intent message", e);
        }
    }

    private static void put(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
