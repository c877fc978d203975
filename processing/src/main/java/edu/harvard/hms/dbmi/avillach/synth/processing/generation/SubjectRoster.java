package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.TreatmentArm;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VisitName;

import java.util.Locale;

/**
 * Subject numbering for generated studies. Active subjects are numbered 1..n and Placebo subjects n+1..2n, so the
 * output is ordered by arm, then subject, then visit.
 */
public final class SubjectRoster {

    public static final String STUDY_PREFIX = "RA001";

    private SubjectRoster() {
    }

    public static String subjectId(TreatmentArm arm, int subjectIndex, int nPerArm) {
        int number = arm == TreatmentArm.ACTIVE ? subjectIndex + 1 : nPerArm + subjectIndex + 1;
        return String.format(Locale.ROOT, "%s-%03d", STUDY_PREFIX, number);
    }

    public static int expectedRecords(int nPerArm) {
        return nPerArm * TreatmentArm.values().length * VisitName.sequence().size();
    }

    /**
     * Walks every (arm, subject, visit) slot in output order.
     */
    public static void forEachSlot(int nPerArm, SlotConsumer consumer) {
        for (TreatmentArm arm : TreatmentArm.values()) {
            for (int i = 0; i < nPerArm; i++) {
                String subjectId = subjectId(arm, i, nPerArm);
                for (VisitName visit : VisitName.sequence()) {
                    consumer.accept(subjectId, visit, arm);
                }
            }
        }
    }

    @FunctionalInterface
    public interface SlotConsumer {
        void accept(String subjectId, VisitName visit, TreatmentArm arm);
    }
}
