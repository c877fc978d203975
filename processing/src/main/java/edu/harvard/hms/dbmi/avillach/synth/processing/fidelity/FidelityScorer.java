package edu.harvard.hms.dbmi.avillach.synth.processing.fidelity;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.synth.data.result.DistanceSummary;
import edu.harvard.hms.dbmi.avillach.synth.data.result.QualityLevel;
import edu.harvard.hms.dbmi.avillach.synth.data.result.QualityReport;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.processing.util.VitalsMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores how closely a synthetic dataset reproduces a reference dataset. Fully deterministic: the same inputs always
 * give the same report.
 */
@Component
public class FidelityScorer {

    private static final Logger log = LoggerFactory.getLogger(FidelityScorer.class);

    private static final double COMPONENT_WEIGHT = 0.25;
    private static final double WASSERSTEIN_SCALE = 5.0;
    private static final double RMSE_SCALE = 10.0;

    private final KnnImputationScorer knnScorer;

    @Autowired
    public FidelityScorer(
        @Value("${synth.fidelity.withheld-fraction:0.1}") double withheldFraction,
        @Value("${synth.fidelity.max-withheld-cells:500}") int maxWithheldCells
    ) {
        this.knnScorer = new KnnImputationScorer(withheldFraction, maxWithheldCells);
    }

    /**
     * @throws IllegalArgumentException when {@code k < 1}
     * @throws InsufficientDataException when either dataset has fewer than {@code k} rows
     */
    public QualityReport score(List<VitalsRecord> reference, List<VitalsRecord> synthetic, int k) {
        Preconditions.checkArgument(k >= 1, "k must be at least 1, was %s", k);
        Map<String, List<String>> shortfalls = new LinkedHashMap<>();
        if (reference.size() < k) {
            shortfalls.put("original_data", List.of(reference.size() + " rows, k=" + k + " required"));
        }
        if (synthetic.size() < k) {
            shortfalls.put("synthetic_data", List.of(synthetic.size() + " rows, k=" + k + " required"));
        }
        if (!shortfalls.isEmpty()) {
            throw new InsufficientDataException("Not enough rows to score fidelity", shortfalls);
        }

        Map<String, Double> wasserstein = new LinkedHashMap<>();
        Map<String, Double> rmse = new LinkedHashMap<>();
        for (VitalField field : VitalField.columns()) {
            double[] expected = VitalsMatrix.column(reference, field);
            double[] observed = VitalsMatrix.column(synthetic, field);
            wasserstein.put(field.columnName(), WassersteinDistance.between(expected, observed));
            double meanDiff = VitalsMatrix.mean(expected) - VitalsMatrix.mean(observed);
            double stdDiff = VitalsMatrix.populationStd(expected) - VitalsMatrix.populationStd(observed);
            rmse.put(field.columnName(), Math.sqrt(meanDiff * meanDiff + stdDiff * stdDiff));
        }

        double[][] referenceRows = VitalsMatrix.rows(reference);
        double[][] syntheticRows = VitalsMatrix.rows(synthetic);
        double correlation = CorrelationPreservation.score(referenceRows, syntheticRows);
        double knn = knnScorer.score(referenceRows, syntheticRows, k);
        DistanceSummary distances = NearestNeighbourDistances.summarize(referenceRows, syntheticRows);

        double meanWasserstein = wasserstein.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double meanRmse = rmse.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double overall = COMPONENT_WEIGHT * (1.0 / (1.0 + meanWasserstein / WASSERSTEIN_SCALE))
            + COMPONENT_WEIGHT * (1.0 / (1.0 + meanRmse / RMSE_SCALE)) + COMPONENT_WEIGHT * correlation + COMPONENT_WEIGHT * knn;
        overall = Math.max(0.0, Math.min(1.0, overall));

        QualityLevel level = QualityLevel.classify(overall);
        log.info(
            "Scored {} synthetic rows against {} reference rows: overall {} ({}), correlation {}, knn {}", synthetic.size(), reference.size(),
            overall, level, correlation, knn
        );
        return new QualityReport(wasserstein, correlation, rmse, knn, overall, level, level.summarize(overall), distances);
    }
}
