package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;

public record ArmStatistics(
    @JsonProperty("arm") TreatmentArm arm, @JsonProperty("n") int n, @JsonProperty("mean") double mean, @JsonProperty("std") double std,
    @JsonProperty("standard_error") double standardError
) {
}
