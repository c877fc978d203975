package edu.harvard.hms.dbmi.avillach.synth.processing.generation;

import edu.harvard.hms.dbmi.avillach.synth.data.request.GenerationRequest;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds the random source for a single generation call. Nothing random is shared between calls.
 */
public final class RandomSources {

    private static final Logger log = LoggerFactory.getLogger(RandomSources.class);

    private RandomSources() {
    }

    public static RandomGenerator forRequest(GenerationRequest request) {
        long seed;
        if (request.seed() != null) {
            seed = request.seed();
        } else {
            seed = ThreadLocalRandom.current().nextLong();
            log.debug("No seed requested for {} generation, using {}", request.method().key(), seed);
        }
        return new Well19937c(seed);
    }
}
