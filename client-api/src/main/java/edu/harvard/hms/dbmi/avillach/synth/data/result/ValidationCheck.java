package edu.harvard.hms.dbmi.avillach.synth.data.result;

public record ValidationCheck(String name, boolean passed, String detail) {

    public static ValidationCheck of(String name, boolean passed) {
        return new ValidationCheck(name, passed, null);
    }
}
