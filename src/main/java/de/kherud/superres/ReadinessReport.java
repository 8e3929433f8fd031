package de.kherud.superres;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Result of a readiness query: the state plus, for provider faults, a diagnostic.
 */
public final class ReadinessReport {

	private final ReadinessState state;
	private final String diagnostic;

	private ReadinessReport(ReadinessState state, String diagnostic) {
		this.state = Objects.requireNonNull(state, "State cannot be null");
		this.diagnostic = diagnostic;
	}

	public static ReadinessReport of(ReadinessState state) {
		return new ReadinessReport(state, null);
	}

	/**
	 * A query that could not be answered because the provider faulted.
	 */
	public static ReadinessReport fault(String diagnostic) {
		return new ReadinessReport(ReadinessState.UNKNOWN, diagnostic == null ? "" : diagnostic);
	}

	public ReadinessState getState() {
		return state;
	}

	/**
	 * @return the provider diagnostic, or null unless {@link #isFault()}
	 */
	@Nullable
	public String getDiagnostic() {
		return diagnostic;
	}

	public boolean isFault() {
		return diagnostic != null;
	}

	public boolean isReady() {
		return state == ReadinessState.READY;
	}

	/**
	 * Caller facing rendering: the state name, or {@code "Error: <detail>"} for a fault.
	 */
	public String describe() {
		return isFault() ? "Error: " + diagnostic : state.getDisplayName();
	}

	@Override
	public String toString() {
		return isFault()
			? String.format("ReadinessReport{state=%s, diagnostic='%s'}", state, diagnostic)
			: String.format("ReadinessReport{state=%s}", state);
	}
}
