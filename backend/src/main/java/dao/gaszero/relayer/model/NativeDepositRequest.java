package dao.gaszero.relayer.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class NativeDepositRequest {

    @NotBlank
    private String chain;

    @NotBlank
    private String from;

    @NotBlank
    private String txHash;
}
