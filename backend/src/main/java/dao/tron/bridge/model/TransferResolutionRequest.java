package dao.tron.bridge.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TransferResolutionRequest {

    @NotNull
    private Boolean landed;     // whether the asset movement actually happened
}
