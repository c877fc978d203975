package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationMethod;
import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;

import java.util.List;

/**
 * A way of producing synthetic vitals. Implementations return exactly {@code nPerArm * 2 * visits} records, one per
 * subject and canonical visit, already inside the clinical ranges. Given a seed, the same request and reference always
 * produce the same records.
 */
public interface GenerationStrategy {

    GenerationMethod method();

    List<VitalsRecord> generate(GenerationRequest request, ReferenceDataset reference);
}
