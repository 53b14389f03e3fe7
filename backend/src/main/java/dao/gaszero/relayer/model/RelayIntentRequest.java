package dao.gaszero.relayer.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class RelayIntentRequest {

    @NotBlank
    private String chain;

    @NotBlank
    private String type;            // transfer | swap

    @NotBlank
    private String from;

    private String to;              // transfer recipient

    private String token;           // transfer token symbol

    private String fromToken;

    private String toToken;

    @NotBlank
    private String amount;          // string decimal, display units

    private String minAmountOut;    // swap only, smallest unit of toToken

    @NotBlank
    private String signature;

    private Long nonce;

    private Long deadline;          // unix seconds

    private Long timestamp;         // unix seconds

    private Map<String, Object> routeData;
}
