package edu.harvard.hms.dbmi.avillach.synth.service;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairReport;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.request.QualityAssessmentRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.request.TreatmentEffectRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.result.QualityReport;
import edu.harvard.hms.dbmi.avillach.synth.data.result.TreatmentEffectResult;
import edu.harvard.hms.dbmi.avillach.synth.data.result.ValidationReport;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.processing.GenerationPipeline;
import edu.harvard.hms.dbmi.avillach.synth.processing.fidelity.FidelityScorer;
import edu.harvard.hms.dbmi.avillach.synth.processing.stats.TreatmentEffectAnalyzer;
import edu.harvard.hms.dbmi.avillach.synth.processing.validation.VitalsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers: generate a study, score it against reference data, analyse the treatment effect and
 * validate an output set. All operations are synchronous and share no mutable state.
 */
@Service
public class SyntheticVitalsService {

    private static final Logger log = LoggerFactory.getLogger(SyntheticVitalsService.class);

    private final ReferenceDatasetProvider referenceProvider;
    private final GenerationPipeline pipeline;
    private final FidelityScorer fidelityScorer;
    private final TreatmentEffectAnalyzer effectAnalyzer;
    private final VitalsValidator validator;

    @Autowired
    public SyntheticVitalsService(
        ReferenceDatasetProvider referenceProvider, GenerationPipeline pipeline, FidelityScorer fidelityScorer,
        TreatmentEffectAnalyzer effectAnalyzer, VitalsValidator validator
    ) {
        this.referenceProvider = referenceProvider;
        this.pipeline = pipeline;
        this.fidelityScorer = fidelityScorer;
        this.effectAnalyzer = effectAnalyzer;
        this.validator = validator;
    }

    public List<VitalsRecord> generate(GenerationRequest request) {
        log.debug("Generation requested: {}", request);
        return pipeline.generate(request, referenceProvider.getReference());
    }

    public QualityReport assessQuality(QualityAssessmentRequest request) {
        return fidelityScorer.score(request.originalData(), request.syntheticData(), request.k());
    }

    public TreatmentEffectResult analyzeTreatmentEffect(TreatmentEffectRequest request) {
        return effectAnalyzer.weekNEffect(request.vitalsData(), request.visit(), request.field());
    }

    public ValidationReport validate(List<VitalsRecord> records, double targetEffect) {
        return validator.validate(records, targetEffect, VisitName.endpoint());
    }

    public List<VitalsRecord> getReferenceRecords() {
        return referenceProvider.getReference().records();
    }

    public RepairReport getReferenceRepairReport() {
        return referenceProvider.getReference().repairReport();
    }
}
