package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.Stratum;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.exception.InsufficientDataException;
import edu.harvard.hms.dbmi.avillach.synth.processing.ReferenceFixtures;
import edu.harvard.hms.dbmi.avillach.synth.processing.constraint.ConstraintEnforcer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

class BootstrapGeneratorTest {

    private final BootstrapGenerator generator = new BootstrapGenerator(new ConstraintEnforcer());

    private final ReferenceDataset reference = ReferenceFixtures.reference(6, 11L);

    @Test
    void shouldGenerateCompleteStudyInRange() {
        List<VitalsRecord> records = generator.generate(request(8, 99L, null), reference);

        GeneratedRecordAssertions.assertValidStudy(records, 8);
    }

    @Test
    void shouldResampleStratumRowsWithoutJitter() {
        List<VitalsRecord> records = generator.generate(request(10, 3L, 0.0), reference);

        for (VitalsRecord record : records) {
            List<double[]> stratumRows = reference.records().stream().filter(row -> Stratum.of(row).equals(Stratum.of(record)))
                .map(VitalsRecord::numericValues).collect(Collectors.toList());
            Assertions.assertTrue(
                stratumRows.stream().anyMatch(row -> Arrays.equals(row, record.numericValues())), record + " is not a resampled row"
            );
        }
    }

    @Test
    void shouldBeDeterministicForSeed() {
        Assertions.assertEquals(generator.generate(request(5, 8L, 0.1), reference), generator.generate(request(5, 8L, 0.1), reference));
    }

    @Test
    void shouldNameEmptyStratum() {
        List<VitalsRecord> withoutActiveEndpoint = reference.records().stream()
            .filter(record -> !(record.treatmentArm() == TreatmentArm.ACTIVE && record.visitName() == VisitName.WEEK_12))
            .collect(Collectors.toList());

        InsufficientDataException exception = Assertions.assertThrows(
            InsufficientDataException.class, () -> generator.generate(request(5, 1L, null), ReferenceDataset.of(withoutActiveEndpoint))
        );

        Assertions.assertEquals(1, exception.getDetails().size());
        Assertions.assertTrue(exception.getDetails().containsKey("Week 12/Active"));
    }

    private static GenerationRequest request(int nPerArm, long seed, Double jitter) {
        return GenerationRequest.builder().nPerArm(nPerArm).seed(seed).method(GenerationMethod.BOOTSTRAP).jitterFrac(jitter).build();
    }
}
