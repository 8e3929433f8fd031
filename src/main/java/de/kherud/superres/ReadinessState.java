package de.kherud.superres;

/**
 * Stable readiness vocabulary exposed to callers, independent of provider wording.
 */
public enum ReadinessState {
	READY("Ready"),
	NOT_READY("NotReady"),
	DISABLED_BY_USER("DisabledByUser"),
	UNSUPPORTED("Unsupported"),
	UNKNOWN("Unknown");

	private final String displayName;

	ReadinessState(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the caller facing name, e.g. "NotReady"
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * Terminal states are not retried automatically; user or platform action is required.
	 */
	public boolean isTerminal() {
		return this == DISABLED_BY_USER || this == UNSUPPORTED;
	}
}
