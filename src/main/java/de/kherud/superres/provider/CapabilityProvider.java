package de.kherud.superres.provider;

import java.util.concurrent.CompletableFuture;

/**
 * Service Provider Interface for the inference backend performing super resolution.
 *
 * <p>The backend is opaque: its model execution, latency and error wording are
 * outside the control of this library. Every call may fail, and the
 * asynchronous calls may take an unbounded amount of time. Implementations do
 * not need to impose a timeout; callers cancel the returned futures instead.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * selected by {@link CapabilityProviders}:
 * <ol>
 *   <li>Implement this interface with a public no-arg constructor</li>
 *   <li>Register in {@code META-INF/services/de.kherud.superres.provider.CapabilityProvider}</li>
 *   <li>Return an appropriate priority</li>
 * </ol>
 */
public interface CapabilityProvider {

	/**
	 * @return the provider name used for configuration and logging (e.g. "bicubic")
	 */
	String name();

	/**
	 * Higher values are preferred when several providers are available.
	 */
	default int priority() {
		return 0;
	}

	/**
	 * Whether this provider can be used in the current environment at all.
	 * Unavailable providers are skipped during discovery.
	 */
	default boolean isAvailable() {
		return true;
	}

	/**
	 * Synchronous, side-effect free readiness query.
	 *
	 * @return the current provider state
	 * @throws RuntimeException when the provider cannot be reached
	 */
	ProviderState getState();

	/**
	 * Bring the model to a ready state (download, compile, warm up).
	 *
	 * @return a future completing with the terminal provisioning outcome
	 */
	CompletableFuture<ProvisionResult> provision();

	/**
	 * Create a transform handle bound to the ready model.
	 *
	 * @return a future completing with a handle the caller must close
	 */
	CompletableFuture<TransformHandle> createTransform();
}
