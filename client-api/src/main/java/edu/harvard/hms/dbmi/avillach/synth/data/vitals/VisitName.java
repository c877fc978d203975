package edu.harvard.hms.dbmi.avillach.synth.data.vitals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The canonical visit sequence of the study. Declaration order is visit order; {@link #index()} is the position in
 * that sequence and the last visit is the study endpoint.
 */
@Schema(description = "Study visit, serialized with its display label", example = "Week 12")
public enum VisitName {
    SCREENING("Screening"), DAY_1("Day 1"), WEEK_4("Week 4"), WEEK_12("Week 12");

    private static final List<VisitName> SEQUENCE = List.of(values());

    private final String label;

    VisitName(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int index() {
        return ordinal();
    }

    public static List<VisitName> sequence() {
        return SEQUENCE;
    }

    public static VisitName endpoint() {
        return SEQUENCE.get(SEQUENCE.size() - 1);
    }

    /**
     * Accepts the display label ("Day 1"), the compact form ("Day1") or the constant name ("DAY_1"), ignoring case.
     */
    public static Optional<VisitName> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = normalize(raw);
        return Arrays.stream(values()).filter(visit -> normalize(visit.label).equals(key) || normalize(visit.name()).equals(key))
            .findFirst();
    }

    @JsonCreator
    public static VisitName fromLabel(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown visit name: " + raw));
    }

    private static String normalize(String raw) {
        return raw.replaceAll("[\\s_]", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}
