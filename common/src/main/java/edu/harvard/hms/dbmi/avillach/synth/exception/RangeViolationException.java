package edu.harvard.hms.dbmi.avillach.synth.exception;

import java.util.List;
import java.util.Map;

/**
 * Signals a record that still breaks a range or the blood pressure differential after constraint enforcement ran.
 * This indicates a logic defect, not bad input.
 */
public class RangeViolationException extends VitalsDataException {

	private static final long serialVersionUID = -2785914600128379342L;

	public RangeViolationException(Map<String, List<String>> details) {
		super("Records violate vitals constraints after enforcement", details);
	}
}
