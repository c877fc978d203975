package edu.harvard.hms.dbmi.avillach.synth.data.reference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;

import java.util.List;

/**
 * A (visit, arm) cell. Generators fit and sample each stratum separately.
 */
public record Stratum(VisitName visit, TreatmentArm arm) {

    private static final List<Stratum> ALL;

    static {
        ImmutableList.Builder<Stratum> builder = ImmutableList.builder();
        for (TreatmentArm arm : TreatmentArm.values()) {
            for (VisitName visit : VisitName.sequence()) {
                builder.add(new Stratum(visit, arm));
            }
        }
        ALL = builder.build();
    }

    public static Stratum of(VitalsRecord record) {
        return new Stratum(record.visitName(), record.treatmentArm());
    }

    public static List<Stratum> all() {
        return ALL;
    }

    /**
     * Groups records by stratum, keeping their original order within each stratum.
     */
    public static ImmutableListMultimap<Stratum, VitalsRecord> index(List<VitalsRecord> records) {
        return Multimaps.index(records, Stratum::of);
    }

    @Override
    public String toString() {
        return visit.label() + "/" + arm.label();
    }
}
