package de.kherud.superres;

/**
 * Closed taxonomy of failures surfaced by the readiness controller and the scaling service.
 */
public enum FailureKind {
	/** Bad request, e.g. a scale factor outside 1..8. Never reaches the provider. */
	VALIDATION_ERROR,
	/** Hardware or platform lacks the capability. Terminal. */
	NOT_SUPPORTED,
	/** Disabled by user or policy. Terminal. */
	DISABLED_BY_USER,
	/** Model could not be brought to ready. Safe to retry later. */
	PROVISIONING_FAILED,
	/** The host application lacks a capability or permission the provider needs. */
	MISSING_CAPABILITY,
	/** Unexpected provider exception during a state query or a transform. */
	PROVIDER_FAULT,
	/** Input decode or output write failure. */
	IO_FAILURE,
	/** The caller gave up waiting (timeout or interrupt). */
	CANCELLED
}
