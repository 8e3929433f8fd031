package de.kherud.superres;

import java.util.Optional;

/**
 * Outcome of {@link ReadinessController#ensureReady()}: either ready, or a {@link ReadyFailure}.
 */
public final class ReadyResult {

	private static final ReadyResult READY = new ReadyResult(null);

	private final ReadyFailure failure;

	private ReadyResult(ReadyFailure failure) {
		this.failure = failure;
	}

	public static ReadyResult ready() {
		return READY;
	}

	public static ReadyResult failed(ReadyFailure failure) {
		if (failure == null) {
			throw new IllegalArgumentException("Failure cannot be null");
		}
		return new ReadyResult(failure);
	}

	public boolean isReady() {
		return failure == null;
	}

	public Optional<ReadyFailure> getFailure() {
		return Optional.ofNullable(failure);
	}

	/**
	 * Caller facing rendering: {@code "Ready"} or {@code "Error: <message>"}.
	 */
	public String describe() {
		return isReady() ? ReadinessState.READY.getDisplayName() : "Error: " + failure.getMessage();
	}

	@Override
	public String toString() {
		return isReady() ? "ReadyResult{ready}" : "ReadyResult{" + failure + "}";
	}
}
