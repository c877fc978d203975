package edu.harvard.hms.dbmi.avillach.synth.etl.csv;

import de.siegmar.fastcsv.writer.CsvWriter;
import edu.harvard.hms.dbmi.avillach.synth.data.vitals.VitalsRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes records with a header in the stable column order SubjectID, VisitName, TreatmentArm, SystolicBP, DiastolicBP,
 * HeartRate, Temperature.
 */
public class VitalsCSVWriter {

    private final CsvWriter csvWriter = new CsvWriter();

    public void write(Path csv, List<VitalsRecord> records) {
        try (Writer writer = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
            write(writer, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write vitals CSV " + csv.toAbsolutePath(), e);
        }
    }

    public void write(Writer writer, List<VitalsRecord> records) throws IOException {
        List<String[]> rows = new ArrayList<>(records.size() + 1);
        rows.add(VitalsCSVLoader.COLUMNS.toArray(new String[0]));
        for (VitalsRecord record : records) {
            rows.add(
                new String[] {record.subjectId(), record.visitName().label(), record.treatmentArm().label(), String.valueOf(record.systolicBp()),
                    String.valueOf(record.diastolicBp()), String.valueOf(record.heartRate()), String.valueOf(record.temperature())}
            );
        }
        csvWriter.write(writer, rows);
        writer.flush();
    }
}
