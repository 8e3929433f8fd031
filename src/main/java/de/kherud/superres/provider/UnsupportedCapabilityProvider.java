package de.kherud.superres.provider;

import java.util.concurrent.CompletableFuture;

/**
 * Stand-in used when no usable provider is installed. Always reports
 * {@link ProviderState#NOT_SUPPORTED_ON_CURRENT_SYSTEM}.
 */
public class UnsupportedCapabilityProvider implements CapabilityProvider {

	public static final String NAME = "unsupported";

	private static final String REASON = "Image Super Resolution is not supported on this system";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public int priority() {
		return Integer.MIN_VALUE;
	}

	@Override
	public ProviderState getState() {
		return ProviderState.NOT_SUPPORTED_ON_CURRENT_SYSTEM;
	}

	@Override
	public CompletableFuture<ProvisionResult> provision() {
		return CompletableFuture.completedFuture(ProvisionResult.failure(REASON));
	}

	@Override
	public CompletableFuture<TransformHandle> createTransform() {
		return CompletableFuture.failedFuture(new UnsupportedOperationException(REASON));
	}
}
