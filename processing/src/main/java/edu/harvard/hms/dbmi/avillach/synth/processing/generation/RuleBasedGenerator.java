package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.request.FieldPrior;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws from normal priors and ignores the reference, so this works with no data at all. Systolic pressure is drawn
 * around a per-subject baseline taken from the systolic prior, which keeps a subject's visits correlated. The other
 * fields are drawn independently for every record.
 */
@Component
public class RuleBasedGenerator implements GenerationStrategy {

    /**
     * Visit-to-visit standard deviation of systolic pressure around the subject baseline, mmHg.
     */
    public static final double VISIT_SYSTOLIC_STD = 6.0;

    private final ConstraintEnforcer enforcer;

    @Autowired
    public RuleBasedGenerator(ConstraintEnforcer enforcer) {
        this.enforcer = enforcer;
    }

    @Override
    public GenerationMethod method() {
        return GenerationMethod.RULES;
    }

    @Override
    public List<VitalsRecord> generate(GenerationRequest request, ReferenceDataset reference) {
        Map<VitalField, FieldPrior> priors = VitalPriors.withOverrides(request.priorOverrides());
        List<VitalField> fields = VitalField.columns();
        RandomGenerator random = RandomSources.forRequest(request);
        FieldPrior systolic = priors.get(VitalField.SYSTOLIC_BP);
        Map<String, Double> baselines = new HashMap<>();
        ImmutableList.Builder<VitalsRecord> records = ImmutableList.builder();
        SubjectRoster.forEachSlot(request.nPerArm(), (subjectId, visit, arm) -> {
            double baseline = baselines.computeIfAbsent(subjectId, id -> systolic.mean() + random.nextGaussian() * systolic.std());
            double[] values = new double[fields.size()];
            for (VitalField field : fields) {
                if (field == VitalField.SYSTOLIC_BP) {
                    values[field.ordinal()] = baseline + random.nextGaussian() * VISIT_SYSTOLIC_STD;
                } else {
                    FieldPrior prior = priors.get(field);
                    values[field.ordinal()] = prior.mean() + random.nextGaussian() * prior.std();
                }
            }
            records.add(enforcer.enforce(VitalsRecord.fromValues(subjectId, visit, arm, values)));
        });
        return records.build();
    }
}
