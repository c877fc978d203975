package edu.harvard.hms.dbmi.avillach.synth.service;

import edu.harvard.hms.dbmi.avillach.synth.data.reference.ReferenceDataset;
import edu.harvard.hms.dbmi.avillach.synth.etl.csv.VitalsCSVLoader;
import edu.harvard.hms.dbmi.avillach.synth.etl.reference.ReferenceRepairer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads and repairs the reference extract once at startup. With no path configured the reference is empty and only
 * the rules method can generate.
 */
@Component
public class ReferenceDatasetProvider {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDatasetProvider.class);

    private final ReferenceDataset reference;

    @Autowired
    public ReferenceDatasetProvider(@Value("${synth.reference.path:}") String referencePath) {
        this(referencePath, new VitalsCSVLoader(), new ReferenceRepairer());
    }

    public ReferenceDatasetProvider(String referencePath, VitalsCSVLoader loader, ReferenceRepairer repairer) {
        if (referencePath == null || referencePath.isBlank()) {
            log.info("synth.reference.path is not set, starting without reference data");
            this.reference = ReferenceDataset.EMPTY;
        } else {
            this.reference = repairer.repair(loader.load(Path.of(referencePath.trim())));
            log.info("Reference data ready: {} records, {} repair actions", reference.size(), reference.repairReport().actions().size());
        }
    }

    public ReferenceDataset getReference() {
        return reference;
    }
}
