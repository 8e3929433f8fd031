package de.kherud.superres.provider;

/**
 * Readiness values as reported by a capability provider.
 *
 * These mirror the vendor vocabulary and are translated into
 * {@link de.kherud.superres.ReadinessState} by the readiness controller.
 * {@link #UNRECOGNIZED} covers values a newer provider may report that this
 * library does not know about.
 */
public enum ProviderState {
	READY,
	NOT_READY,
	DISABLED_BY_USER,
	NOT_SUPPORTED_ON_CURRENT_SYSTEM,
	UNRECOGNIZED
}
