package edu.harvard.hms.dbmi.avillach.synth.data.result;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Distribution of nearest-neighbour Euclidean distances from reference rows to synthetic rows")
public record DistanceSummary(double mean, double median, double min, double max, double std) {
}
