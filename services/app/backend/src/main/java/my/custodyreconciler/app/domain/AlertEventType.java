package my.custodyreconciler.app.domain;

import java.util.Locale;

public enum AlertEventType {
	ALLOCATION_BREACH("allocation_breach", "warning"),
	UNAUTHORIZED_OVERDRAFT("unauthorized_overdraft", "critical");

	private final String code;
	private final String severity;

	AlertEventType(String code, String severity) {
		this.code = code;
		this.severity = severity;
	}

	public String code() {
		return code;
	}

	public String severity() {
		return severity;
	}

	public static AlertEventType fromCode(String value) {
		String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
		for (AlertEventType type : values()) {
			if (type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown alert event type: " + value);
	}
}
