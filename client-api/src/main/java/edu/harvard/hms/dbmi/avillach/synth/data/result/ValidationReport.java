package edu.harvard.hms.dbmi.avillach.synth.data.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

public record ValidationReport(
    @JsonProperty("rows") int rows, @JsonProperty("checks") List<ValidationCheck> checks,
    @JsonProperty("endpoint_effect") Double endpointEffect
) {

    public ValidationReport {
        checks = List.copyOf(checks);
    }

    @JsonIgnore
    public boolean allPassed() {
        return checks.stream().allMatch(ValidationCheck::passed);
    }

    public Optional<ValidationCheck> check(String name) {
        return checks.stream().filter(check -> check.name().equals(name)).findFirst();
    }
}
