package edu.harvard.hms.dbmi.avillach.synth.processing;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import edu.harvard.hms.dbmi.avillach.synth.processing.effect.TreatmentEffectInjector;
import edu.harvard.hms.dbmi.avillach.synth.processing.generation.GenerationStrategy;
import edu.harvard.hms.dbmi.avillach.synth.processing.generation.SubjectRoster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a request through its generator, constraint enforcement and effect injection, then checks the invariants every
 * output must hold.
 */
@Service
public class GenerationPipeline {

    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private final Map<GenerationMethod, GenerationStrategy> strategies;
    private final ConstraintEnforcer enforcer;
    private final TreatmentEffectInjector injector;

    @Autowired
    public GenerationPipeline(List<GenerationStrategy> strategies, ConstraintEnforcer enforcer, TreatmentEffectInjector injector) {
        this.strategies = new EnumMap<>(GenerationMethod.class);
        for (GenerationStrategy strategy : strategies) {
            GenerationStrategy previous = this.strategies.put(strategy.method(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Two generators registered for method " + strategy.method().key());
            }
        }
        this.enforcer = enforcer;
        this.injector = injector;
    }

    public List<VitalsRecord> generate(GenerationRequest request, ReferenceDataset reference) {
        GenerationStrategy strategy = strategies.get(request.method());
        if (strategy == null) {
            throw new IllegalArgumentException("No generator registered for method " + request.method().key());
        }
        long start = System.currentTimeMillis();

        List<VitalsRecord> records = enforcer.enforce(strategy.generate(request, reference));
        records = injector.injectEffect(records, request.targetEffect(), VisitName.endpoint());
        records = enforcer.enforce(records);
        enforcer.verify(records);

        int expected = SubjectRoster.expectedRecords(request.nPerArm());
        if (records.size() != expected) {
            throw new IllegalStateException(
                "Generator " + request.method().key() + " produced " + records.size() + " records, expected " + expected
            );
        }
        log.info(
            "Generated {} records with {} for {} subjects per arm in {} ms", records.size(), request.method().key(), request.nPerArm(),
            System.currentTimeMillis() - start
        );
        return ImmutableList.copyOf(records);
    }
}
