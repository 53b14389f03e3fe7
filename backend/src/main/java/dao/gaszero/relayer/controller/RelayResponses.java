package dao.gaszero.relayer.controller;

import dao.gaszero.relayer.model.RelayErrorKind;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.model.RelayStatus;
import dao.gaszero.relayer.util.TokenAmounts;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON bodies and status codes shared by the relay endpoints and the exception handler.
 */
final class RelayResponses {

    private RelayResponses() {}

    static HttpStatus statusOf(RelayErrorKind kind) {
        switch (kind) {
            case VALIDATION_ERROR:
            case INSUFFICIENT_BALANCE:
            case INSUFFICIENT_ALLOWANCE:
            case UNSUPPORTED_FEATURE:
                return HttpStatus.BAD_REQUEST;
            case INVALID_SIGNATURE:
                return HttpStatus.UNAUTHORIZED;
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case TRANSACTION_REVERTED:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case APPROVAL_FUNDED:
                return HttpStatus.ACCEPTED;
            case RELAYER_INSUFFICIENT_GAS:
            case CHAIN_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case CONFIRMATION_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    static ResponseEntity<Map<String, Object>> of(RelayResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.status() == RelayStatus.SUCCESS) {
            body.put("success", true);
            body.put("hash", result.transactionHash());
            body.put("fee", TokenAmounts.toDisplay(result.feeCharged(), result.tokenDecimals()));
            body.put("netAmount", TokenAmounts.toDisplay(result.netAmount(), result.tokenDecimals()));
            body.put("token", result.tokenSymbol());
            body.put("explorerUrl", result.explorerUrl());
            return ResponseEntity.ok(body);
        }
        if (result.status() == RelayStatus.APPROVAL_FUNDED) {
            body.put("success", false);
            body.put("status", RelayStatus.APPROVAL_FUNDED.name());
            body.put("fundingHash", result.fundingTransactionHash());
            body.put("error", result.detail());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("success", false);
        body.put("error", result.detail());
        body.put("kind", result.errorKind().name());
        if (result.transactionHash() != null) {
            body.put("hash", result.transactionHash());
        }
        if (result.reconciliationRequired()) {
            body.put("reconciliationRequired", true);
        }
        return ResponseEntity.status(statusOf(result.errorKind())).body(body);
    }

    static ResponseEntity<Map<String, Object>> error(RelayErrorKind kind, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", detail);
        body.put("kind", kind.name());
        return ResponseEntity.status(statusOf(kind)).body(body);
    }
}
