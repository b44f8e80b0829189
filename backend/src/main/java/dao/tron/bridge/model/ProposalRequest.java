package dao.tron.bridge.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ProposalRequest {

    @NotNull
    private ProposalKind kind;

    private String target;

    private String value;      // string decimal

    @NotBlank
    private String rationale;
}
