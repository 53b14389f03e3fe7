package dao.gaszero.relayer.controller;

import dao.gaszero.relayer.model.NativeDepositRequest;
import dao.gaszero.relayer.model.RelayIntentRequest;
import dao.gaszero.relayer.model.RelayRequest;
import dao.gaszero.relayer.model.RelayResult;
import dao.gaszero.relayer.service.NativeDepositService;
import dao.gaszero.relayer.service.RelayEngine;
import dao.gaszero.relayer.service.RelayHealthService;
import dao.gaszero.relayer.service.RelayRequestMapper;
import dao.gaszero.relayer.util.TokenAmounts;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/relay")
public class RelayController {

    private final RelayEngine relayEngine;
    private final RelayRequestMapper requestMapper;
    private final RelayHealthService healthService;
    private final NativeDepositService depositService;

    public RelayController(RelayEngine relayEngine,
                           RelayRequestMapper requestMapper,
                           RelayHealthService healthService,
                           NativeDepositService depositService) {
        this.relayEngine = relayEngine;
        this.requestMapper = requestMapper;
        this.healthService = healthService;
        this.depositService = depositService;
    }

    /**
     * POST /api/relay
     * Executes a signed transfer or swap intent.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> relay(@Valid @RequestBody RelayIntentRequest body,
                                                     HttpServletRequest http) {
        RelayRequest request = requestMapper.toRelayRequest(body);
        RelayResult result = relayEngine.relay(request, requesterKey(http));
        return RelayResponses.of(result);
    }

    /**
     * GET /api/relay
     * Relayer balances, alerts and open reconciliations.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(healthService.snapshot());
    }

    /**
     * POST /api/relay/deposits
     * Credits a native deposit for a later native-to-token swap.
     */
    @PostMapping("/deposits")
    public ResponseEntity<Map<String, Object>> registerDeposit(@Valid @RequestBody NativeDepositRequest body) {
        NativeDepositService.DepositCredit credit = depositService.register(body.getChain(), body.getFrom(), body.getTxHash());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("chain", credit.chain().id());
        response.put("txHash", credit.txHash());
        response.put("credited", TokenAmounts.toDisplay(credit.credited(), 18));
        response.put("available", TokenAmounts.toDisplay(credit.available(), 18));
        return ResponseEntity.ok(response);
    }

    static String requesterKey(HttpServletRequest http) {
        String forwarded = http.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return http.getRemoteAddr() != null ? http.getRemoteAddr() : "unknown";
    }
}
