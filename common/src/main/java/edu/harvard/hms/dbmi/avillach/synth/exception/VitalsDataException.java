package edu.harvard.hms.dbmi.avillach.synth.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base type for failures caused by the content of a vitals record set. The details map is keyed by a record or
 * stratum description and lists the offending fields or conditions for that key, so a caller can report exactly
 * which rows triggered the failure.
 */
public abstract class VitalsDataException extends RuntimeException {

	private static final long serialVersionUID = 4087331046470871236L;

	private final Map<String, List<String>> details;

	protected VitalsDataException(String message, Map<String, List<String>> details) {
		super(message + describe(details));
		this.details = details == null ? Map.of() : copyOf(details);
	}

	public Map<String, List<String>> getDetails() {
		return details;
	}

	private static Map<String, List<String>> copyOf(Map<String, List<String>> details) {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		details.forEach((key, value) -> copy.put(key, List.copyOf(value)));
		return Collections.unmodifiableMap(copy);
	}

	private static String describe(Map<String, List<String>> details) {
		if (details == null || details.isEmpty()) {
			return "";
		}
		StringBuilder builder = new StringBuilder(":");
		int shown = 0;
		for (Map.Entry<String, List<String>> entry : details.entrySet()) {
			if (shown == 10) {
				builder.append(" ... (").append(details.size() - shown).append(" more)");
				break;
			}
			builder.append(" ").append(entry.getKey()).append(" ").append(entry.getValue()).append(";");
			shown++;
		}
		return builder.toString();
	}
}
