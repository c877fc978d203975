package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.Stratum;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import edu.harvard.hms.dbmi.avillach.synth.processing.util.VitalsMatrix;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits a multivariate normal to each (visit, arm) stratum of the reference and samples from it, so correlations
 * between the four vitals are kept. Sparse strata fall back to the default priors.
 */
@Component
public class MvnGenerator implements GenerationStrategy {

    private static final Logger log = LoggerFactory.getLogger(MvnGenerator.class);

    static final double INITIAL_RIDGE = 1e-6;
    private static final int MAX_RIDGE_STEPS = 20;

    private final int minStratumRows;
    private final ConstraintEnforcer enforcer;

    @Autowired
    public MvnGenerator(@Value("${synth.mvn.min-stratum-rows:8}") int minStratumRows, ConstraintEnforcer enforcer) {
        this.minStratumRows = Math.max(2, minStratumRows);
        this.enforcer = enforcer;
    }

    @Override
    public GenerationMethod method() {
        return GenerationMethod.MVN;
    }

    @Override
    public List<VitalsRecord> generate(GenerationRequest request, ReferenceDataset reference) {
        if (reference.isEmpty()) {
            throw new InsufficientDataException(
                "The mvn method needs reference data", Map.of("reference", List.of("0 records, at least 1 required"))
            );
        }
        ImmutableListMultimap<Stratum, VitalsRecord> strata = Stratum.index(reference.records());
        Map<Stratum, StratumModel> models = new HashMap<>();
        for (Stratum stratum : Stratum.all()) {
            models.put(stratum, fit(stratum, strata.get(stratum)));
        }

        RandomGenerator random = RandomSources.forRequest(request);
        ImmutableList.Builder<VitalsRecord> records = ImmutableList.builder();
        SubjectRoster.forEachSlot(request.nPerArm(), (subjectId, visit, arm) -> {
            double[] values = models.get(new Stratum(visit, arm)).sample(random);
            records.add(enforcer.enforce(VitalsRecord.fromValues(subjectId, visit, arm, values)));
        });
        return records.build();
    }

    private StratumModel fit(Stratum stratum, List<VitalsRecord> rows) {
        double[] means;
        double[][] covariance;
        if (rows.size() < minStratumRows) {
            log.warn("Stratum {} has {} reference rows, fewer than {}; using default priors", stratum, rows.size(), minStratumRows);
            means = VitalPriors.means();
            covariance = VitalPriors.diagonalCovariance();
        } else {
            double[][] data = VitalsMatrix.rows(rows);
            means = new double[data[0].length];
            for (int column = 0; column < means.length; column++) {
                double[] values = new double[data.length];
                for (int row = 0; row < data.length; row++) {
                    values[row] = data[row][column];
                }
                means[column] = VitalsMatrix.mean(values);
            }
            covariance = new Covariance(data).getCovarianceMatrix().getData();
        }
        return new StratumModel(means, cholesky(stratum, new Array2DRowRealMatrix(covariance)));
    }

    /**
     * Lower Cholesky factor of {@code covariance}, adding a growing diagonal ridge when the matrix does not factor.
     */
    static RealMatrix cholesky(Stratum stratum, RealMatrix covariance) {
        double ridge = 0.0;
        for (int step = 0; step <= MAX_RIDGE_STEPS; step++) {
            RealMatrix candidate = covariance.copy();
            for (int i = 0; i < candidate.getRowDimension(); i++) {
                candidate.addToEntry(i, i, ridge);
            }
            try {
                return new CholeskyDecomposition(candidate).getL();
            } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
                ridge = ridge == 0.0 ? INITIAL_RIDGE : ridge * 10;
                log.debug("Covariance for stratum {} did not factor, retrying with ridge {}", stratum, ridge);
            }
        }
        throw new InsufficientDataException(
            "Covariance could not be regularised", Map.of(String.valueOf(stratum), List.of("no Cholesky factor after ridge " + ridge))
        );
    }

    private record StratumModel(double[] means, RealMatrix lower) {

        double[] sample(RandomGenerator random) {
            int size = means.length;
            double[] normals = new double[size];
            for (int i = 0; i < size; i++) {
                normals[i] = random.nextGaussian();
            }
            double[] values = lower.operate(normals);
            for (int i = 0; i < size; i++) {
                values[i] += means[i];
            }
            return values;
        }
    }
}
