package dao.gaszero.relayer.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SponsorshipRequest {

    @NotBlank
    private String chain;

    @NotBlank
    private String userAddress;

    @NotBlank
    private String token;

    @NotBlank
    private String amount;          // display units the user wants to approve

    @NotBlank
    private String reason;          // must be approval_needed
}
