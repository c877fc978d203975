package edu.harvard.hms.dbmi.avillach.synth.data.reference;

import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;

import java.util.List;

/**
 * Clean, read-only reference records together with the report of what repair changed to produce them. Safe to share
 * between concurrent generation and scoring calls.
 */
public record ReferenceDataset(List<VitalsRecord> records, RepairReport repairReport) {

    public static final ReferenceDataset EMPTY = new ReferenceDataset(List.of(), RepairReport.EMPTY);

    public ReferenceDataset {
        records = ImmutableList.copyOf(records);
        repairReport = repairReport == null ? RepairReport.EMPTY : repairReport;
    }

    public static ReferenceDataset of(List<VitalsRecord> records) {
        return new ReferenceDataset(records, RepairReport.EMPTY);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
