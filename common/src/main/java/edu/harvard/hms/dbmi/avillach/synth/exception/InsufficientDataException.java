package edu.harvard.hms.dbmi.avillach.synth.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a computation needs more rows than it was given, e.g. a t-test with a single subject in one arm or a
 * nearest-neighbour step with fewer rows than k.
 */
public class InsufficientDataException extends VitalsDataException {

	private static final long serialVersionUID = 1923412236771054093L;

	public InsufficientDataException(String message, Map<String, List<String>> details) {
		super(message, details);
	}

	public InsufficientDataException(String message) {
		super(message, Map.of());
	}
}
