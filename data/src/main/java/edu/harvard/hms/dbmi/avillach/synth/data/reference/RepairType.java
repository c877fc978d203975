package edu.harvard.hms.dbmi.avillach.synth.data.reference;

public enum RepairType {
    ROUND_TO_PRECISION, REMOVE_DUPLICATES, FIX_TREATMENT_ARM, IMPUTE_MISSING, CLIP_TO_RANGE, SWAP_BP_VALUES, ADJUST_BP_DIFFERENTIAL
}
