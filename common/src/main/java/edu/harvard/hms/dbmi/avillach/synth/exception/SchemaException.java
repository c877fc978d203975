package edu.harvard.hms.dbmi.avillach.synth.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when input records are malformed: a required field is absent, or a categorical field holds a value
 * outside its vocabulary.
 */
public class SchemaException extends VitalsDataException {

	private static final long serialVersionUID = -6314522360815471207L;

	public SchemaException(String message, Map<String, List<String>> details) {
		super(message, details);
	}

	public SchemaException(String message) {
		super(message, Map.of());
	}
}
