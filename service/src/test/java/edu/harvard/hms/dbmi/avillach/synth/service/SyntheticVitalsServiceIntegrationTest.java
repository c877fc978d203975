package edu.harvard.hms.dbmi.avillach.synth.service;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairReport;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.RepairType;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.request.QualityAssessmentRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.request.TreatmentEffectRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.result.QualityReport;
import edu.harvard.hms.dbmi.avillach.synth.data.result.TreatmentEffectResult;
import edu.harvard.hms.dbmi.avillach.synth.data.result.ValidationReport;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.exception.SchemaException;
import edu.harvard.hms.dbmi.avillach.synth.processing.validation.VitalsValidator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.stream.Collectors;

@SpringBootTest(classes = SyntheticVitalsApplication.class, properties = "synth.reference.path=src/test/resources/reference_vitals.csv")
public class SyntheticVitalsServiceIntegrationTest {

    @Autowired
    private SyntheticVitalsService service;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    public void shouldLoadAndRepairReference() {
        List<VitalsRecord> reference = service.getReferenceRecords();
        RepairReport report = service.getReferenceRepairReport();

        Assertions.assertEquals(120, reference.size());
        Assertions.assertEquals(1, report.find(RepairType.REMOVE_DUPLICATES).orElseThrow().count());
        Assertions.assertEquals(VitalField.HEART_RATE, report.find(RepairType.IMPUTE_MISSING).orElseThrow().field());
        Assertions.assertTrue(reference.stream().allMatch(record -> record.systolicBp() <= 200));
        Assertions.assertEquals(
            reference.size(), reference.stream().map(record -> record.subjectId() + record.visitName()).collect(Collectors.toSet()).size()
        );
    }

    @Test
    public void shouldGenerateScoreAndAnalyse() {
        GenerationRequest request = GenerationRequest.builder().nPerArm(50).targetEffect(-5.0).seed(123L).method(GenerationMethod.MVN).build();

        List<VitalsRecord> generated = service.generate(request);

        Assertions.assertEquals(400, generated.size());
        Assertions.assertEquals(generated, service.generate(request));

        QualityReport quality = service.assessQuality(new QualityAssessmentRequest(service.getReferenceRecords(), generated, null));
        Assertions.assertTrue(quality.overallQualityScore() > 0.0 && quality.overallQualityScore() <= 1.0);
        Assertions.assertEquals(4, quality.wassersteinDistances().size());

        TreatmentEffectResult effect = service.analyzeTreatmentEffect(new TreatmentEffectRequest(generated));
        Assertions.assertEquals(VisitName.WEEK_12, effect.visit());
        Assertions.assertTrue(effect.difference() < 0.0);

        ValidationReport validation = service.validate(generated, -5.0);
        Assertions.assertTrue(validation.check(VitalsValidator.RANGES_OK).orElseThrow().passed());
        Assertions.assertTrue(validation.check(VitalsValidator.BP_DIFFERENTIAL_OK).orElseThrow().passed());
        Assertions.assertTrue(validation.check(VitalsValidator.COMPLETE_VISIT_SEQUENCES).orElseThrow().passed());
        Assertions.assertTrue(validation.check(VitalsValidator.CONSISTENT_TREATMENT_ARMS).orElseThrow().passed());
    }

    @Test
    public void shouldServeEveryMethodFromReference() {
        for (GenerationMethod method : GenerationMethod.values()) {
            List<VitalsRecord> generated = service.generate(GenerationRequest.builder().nPerArm(4).seed(9L).method(method).build());

            Assertions.assertEquals(32, generated.size(), method.key());
        }
    }

    @Test
    public void shouldRejectTooFewRowsForScoring() {
        QualityAssessmentRequest request = new QualityAssessmentRequest(service.getReferenceRecords(), service.getReferenceRecords().subList(0, 2), 5);

        Assertions.assertThrows(InsufficientDataException.class, () -> service.assessQuality(request));
    }

    @Test
    public void shouldReadRequestsAsJson() throws Exception {
        String json = """
            {"n_per_arm": 3, "target_effect": -4.0, "seed": 77, "method": "bootstrap"}
            """;

        GenerationRequest request = objectMapper.readValue(json, GenerationRequest.class);
        List<VitalsRecord> generated = service.generate(request);
        String output = objectMapper.writeValueAsString(generated.get(0));

        Assertions.assertEquals(GenerationRequest.DEFAULT_JITTER_FRACTION, request.jitterFrac());
        Assertions.assertEquals(24, generated.size());
        Assertions.assertTrue(output.startsWith("{\"SubjectID\":\"RA001-001\",\"VisitName\":\"Screening\",\"TreatmentArm\":\"Active\""), output);
    }

    @Test
    public void shouldRejectJsonRecordsMissingRequiredFields() {
        String json = """
            {"vitals_data": [
              {"SubjectID": "S1", "VisitName": "Week 12", "TreatmentArm": "Active", "SystolicBP": 130, "DiastolicBP": 80, "HeartRate": 70, "Temperature": 36.8},
              {"SubjectID": "S2", "VisitName": "Week 12", "TreatmentArm": "Active", "DiastolicBP": 82, "HeartRate": 72, "Temperature": 36.9},
              {"SubjectID": "S3", "VisitName": "Week 12", "TreatmentArm": "Placebo", "SystolicBP": 134, "DiastolicBP": 81, "HeartRate": 71, "Temperature": 36.7},
              {"SubjectID": "S4", "VisitName": "Week 12", "TreatmentArm": "Placebo", "SystolicBP": 136, "DiastolicBP": 83, "HeartRate": 73, "Temperature": 36.6}
            ]}
            """;

        JsonMappingException exception = Assertions.assertThrows(
            JsonMappingException.class, () -> objectMapper.readValue(json, TreatmentEffectRequest.class)
        );

        SchemaException cause = Assertions.assertInstanceOf(SchemaException.class, Throwables.getRootCause(exception));
        Assertions.assertEquals(List.of("SystolicBP is missing"), cause.getDetails().get("S2"));
        Assertions.assertTrue(exception.getPath().stream().anyMatch(reference -> "vitals_data".equals(reference.getFieldName())));
        Assertions.assertTrue(exception.getPath().stream().anyMatch(reference -> reference.getIndex() == 1), exception.getPathReference());
    }
}
