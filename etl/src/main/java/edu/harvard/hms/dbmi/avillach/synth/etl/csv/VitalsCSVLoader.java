package edu.harvard.hms.dbmi.avillach.synth.etl.csv;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.RawVitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalField;
import edu.harvard.hms.dbmi.avillach.synth.exception.SchemaException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Reads vitals extracts with a header row. Column order does not matter, but every column in {@link #COLUMNS} must be
 * present. Numeric cells that are blank or cannot be parsed become missing values for the repairer to fill; a row
 * that stops before the last column is a schema error.
 */
public class VitalsCSVLoader {

    private static final Logger log = LoggerFactory.getLogger(VitalsCSVLoader.class);

    public static final String SUBJECT_ID = "SubjectID";
    public static final String VISIT_NAME = "VisitName";
    public static final String TREATMENT_ARM = "TreatmentArm";

    public static final List<String> COLUMNS = List.of(
        SUBJECT_ID, VISIT_NAME, TREATMENT_ARM, VitalField.SYSTOLIC_BP.columnName(), VitalField.DIASTOLIC_BP.columnName(),
        VitalField.HEART_RATE.columnName(), VitalField.TEMPERATURE.columnName()
    );

    public List<RawVitalsRecord> load(Path csv) {
        log.info("Loading vitals from {}", csv.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            List<RawVitalsRecord> records = load(reader);
            log.info("Loaded {} rows from {}", records.size(), csv.getFileName());
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read vitals CSV " + csv.toAbsolutePath(), e);
        }
    }

    public List<RawVitalsRecord> load(Reader reader) throws IOException {
        CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim().parse(new BufferedReader(reader));
        Set<String> missing = new TreeSet<>(COLUMNS);
        missing.removeAll(parser.getHeaderMap().keySet());
        if (!missing.isEmpty()) {
            throw new SchemaException("Vitals CSV is missing required columns", Map.of("columns", List.copyOf(missing)));
        }

        List<RawVitalsRecord> records = new ArrayList<>();
        Map<String, List<String>> shortRows = new LinkedHashMap<>();
        for (CSVRecord row : parser) {
            List<String> absent = COLUMNS.stream().filter(column -> !row.isSet(column)).collect(Collectors.toList());
            if (!absent.isEmpty()) {
                shortRows.put("line " + (row.getRecordNumber() + 1), List.of(row.size() + " of " + COLUMNS.size() + " cells, no " + absent));
                continue;
            }
            records.add(
                new RawVitalsRecord(
                    text(row.get(SUBJECT_ID)), text(row.get(VISIT_NAME)), text(row.get(TREATMENT_ARM)), number(row, VitalField.SYSTOLIC_BP),
                    number(row, VitalField.DIASTOLIC_BP), number(row, VitalField.HEART_RATE), number(row, VitalField.TEMPERATURE)
                )
            );
        }
        if (!shortRows.isEmpty()) {
            throw new SchemaException("Vitals CSV has rows with fewer cells than the header", shortRows);
        }
        return records;
    }

    private static @Nullable String text(@Nullable String cell) {
        return cell == null || cell.isBlank() ? null : cell.trim();
    }

    private static @Nullable Double number(CSVRecord row, VitalField field) {
        String cell = text(row.get(field.columnName()));
        if (cell == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(cell);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            log.warn("Line {}: {} value '{}' is not numeric, treating it as missing", row.getRecordNumber() + 1, field.columnName(), cell);
            return null;
        }
    }
}
