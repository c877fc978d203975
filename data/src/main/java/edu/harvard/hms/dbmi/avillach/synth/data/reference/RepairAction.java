package edu.harvard.hms.dbmi.avillach.synth.data.reference;

import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;

import javax.annotation.Nullable;

/**
 * One kind of fix applied during repair. {@code count} is the number of rows (or subjects, for arm fixes) affected;
 * {@code field} is set for fixes that apply to a single column.
 */
public record RepairAction(RepairType type, @Nullable VitalField field, int count, String description) {
}
