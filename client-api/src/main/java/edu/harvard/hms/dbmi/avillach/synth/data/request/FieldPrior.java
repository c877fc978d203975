package edu.harvard.hms.dbmi.avillach.synth.data.request;

import com.google.common.base.Preconditions;
import io.swagger.v3.oas.annotations.media.Schema;

public record FieldPrior(
    @Schema(description = "Mean of the normal distribution, in clinical units") double mean,
    @Schema(description = "Standard deviation of the normal distribution, must be positive") double std
) {

    public FieldPrior {
        Preconditions.checkArgument(Double.isFinite(mean), "Prior mean must be finite");
        Preconditions.checkArgument(Double.isFinite(std) && std > 0, "Prior std must be positive, was %s", std);
    }
}
