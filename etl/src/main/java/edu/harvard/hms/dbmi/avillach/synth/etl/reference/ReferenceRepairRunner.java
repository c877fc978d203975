package edu.harvard.hms.dbmi.avillach.synth.etl.reference;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.RawVitalsRecord;
import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.etl.csv.VitalsCSVLoader;
import edu.harvard.hms.dbmi.avillach.synth.etl.csv.VitalsCSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

public class ReferenceRepairRunner {

    private static final Logger log = LoggerFactory.getLogger(ReferenceRepairRunner.class);

    /**
     * args[0]: raw vitals CSV
     * args[1]: path the repaired CSV is written to
     */
    public static void main(String[] args) {
        if (args.length != 2) {
            throw new IllegalArgumentException("Two arguments must be provided: input CSV, output CSV");
        }
        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);

        List<RawVitalsRecord> raw = new VitalsCSVLoader().load(input);
        ReferenceDataset dataset = new ReferenceRepairer().repair(raw);
        new VitalsCSVWriter().write(output, dataset.records());
        log.info("Wrote {} repaired records to {}", dataset.size(), output.toAbsolutePath());
    }
}
