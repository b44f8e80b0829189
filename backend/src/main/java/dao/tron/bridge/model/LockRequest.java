package dao.tron.bridge.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LockRequest {

    @NotBlank
    private String amount;       // string decimal, base units

    @NotBlank
    private String destination;  // recipient on the destination ledger
}
