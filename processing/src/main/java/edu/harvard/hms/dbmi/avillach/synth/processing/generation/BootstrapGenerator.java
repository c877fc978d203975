package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.Stratum;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import edu.harvard.hms.dbmi.avillach.synth.processing.util.VitalsMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resamples reference rows with replacement within each (visit, arm) stratum and adds a small Gaussian jitter scaled
 * to each column's spread across the whole reference.
 */
@Component
public class BootstrapGenerator implements GenerationStrategy {

    private final ConstraintEnforcer enforcer;

    @Autowired
    public BootstrapGenerator(ConstraintEnforcer enforcer) {
        this.enforcer = enforcer;
    }

    @Override
    public GenerationMethod method() {
        return GenerationMethod.BOOTSTRAP;
    }

    @Override
    public List<VitalsRecord> generate(GenerationRequest request, ReferenceDataset reference) {
        ImmutableListMultimap<Stratum, VitalsRecord> strata = Stratum.index(reference.records());
        Map<String, List<String>> empty = new LinkedHashMap<>();
        for (Stratum stratum : Stratum.all()) {
            if (strata.get(stratum).isEmpty()) {
                empty.put(stratum.toString(), List.of("no reference rows to resample"));
            }
        }
        if (!empty.isEmpty()) {
            throw new InsufficientDataException("The bootstrap method needs reference rows in every stratum", empty);
        }

        List<VitalField> fields = VitalField.columns();
        double[] jitterStd = new double[fields.size()];
        for (VitalField field : fields) {
            jitterStd[field.ordinal()] = request.jitterFrac() * VitalsMatrix.sampleStd(VitalsMatrix.column(reference.records(), field));
        }

        RandomGenerator random = RandomSources.forRequest(request);
        ImmutableList.Builder<VitalsRecord> records = ImmutableList.builder();
        SubjectRoster.forEachSlot(request.nPerArm(), (subjectId, visit, arm) -> {
            List<VitalsRecord> pool = strata.get(new Stratum(visit, arm));
            double[] values = pool.get(random.nextInt(pool.size())).numericValues();
            for (int i = 0; i < values.length; i++) {
                values[i] += random.nextGaussian() * jitterStd[i];
            }
            records.add(enforcer.enforce(VitalsRecord.fromValues(subjectId, visit, arm, values)));
        });
        return records.build();
    }
}
