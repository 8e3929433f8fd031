package de.kherud.superres;

import de.kherud.superres.provider.CapabilityProvider;
import de.kherud.superres.provider.ProviderState;
import de.kherud.superres.provider.ProvisionResult;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Owns the readiness state machine of a {@link CapabilityProvider}.
 *
 * <p>State is never cached: every query asks the provider again. The only
 * shared mutable state is the in-flight provisioning slot, which makes sure at
 * most one {@link CapabilityProvider#provision()} call is outstanding. Concurrent
 * {@link #ensureReady()} callers await the same outcome, each through its own
 * copy of the shared future, so cancelling one caller's future does not cancel
 * the provisioning the others are waiting on. When the last waiting caller
 * cancels, the provider's provisioning future is cancelled and the next
 * {@link #ensureReady()} starts a fresh attempt.
 *
 * <p>No timeout is imposed here. Cancellations and timeouts coming out of the
 * provider complete the returned future exceptionally instead of being mapped
 * to a {@link ReadyFailure}.
 */
public class ReadinessController {
	private static final System.Logger logger = System.getLogger(ReadinessController.class.getName());

	private final CapabilityProvider provider;
	private final AtomicReference<Provisioning> inFlight = new AtomicReference<>();

	public ReadinessController(CapabilityProvider provider) {
		this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
	}

	public CapabilityProvider getProvider() {
		return provider;
	}

	/**
	 * Ask the provider for its current state. Not-ready and unsupported are
	 * ordinary answers; only a provider fault yields {@link ReadinessState#UNKNOWN}
	 * with a diagnostic. A fault recognised as an unsupported device is
	 * reported as {@link ReadinessState#UNSUPPORTED}.
	 */
	public ReadinessReport queryState() {
		ProviderState raw;
		try {
			raw = provider.getState();
		} catch (RuntimeException | LinkageError e) {
			FailureKind kind = ProviderFaultClassifier.classify(e);
			if (kind == FailureKind.NOT_SUPPORTED) {
				logger.log(DEBUG, "Provider " + provider.name() + " fault classified as unsupported: " + e.getMessage());
				return ReadinessReport.of(ReadinessState.UNSUPPORTED);
			}
			logger.log(WARNING, "Readiness query failed on provider " + provider.name(), e);
			return ReadinessReport.fault(ProviderFaultClassifier.describe(e));
		}
		ReadinessState state = toReadinessState(raw);
		logger.log(DEBUG, "Provider " + provider.name() + " reports " + raw + " -> " + state.getDisplayName());
		return ReadinessReport.of(state);
	}

	/**
	 * @return true when the capability is usable now or after provisioning
	 */
	public boolean isAvailable() {
		ReadinessReport report = queryState();
		return !report.isFault()
			&& (report.getState() == ReadinessState.READY || report.getState() == ReadinessState.NOT_READY);
	}

	/**
	 * Bring the provider to ready. Idempotent when already ready, immediate
	 * failure for terminal states, otherwise provisions once.
	 */
	public CompletableFuture<ReadyResult> ensureReady() {
		return ensureReady(queryState());
	}

	/**
	 * Same as {@link #ensureReady()} but starting from a state the caller has
	 * just queried, so the provider is not asked twice.
	 */
	public CompletableFuture<ReadyResult> ensureReady(ReadinessReport current) {
		Objects.requireNonNull(current, "Readiness report cannot be null");
		if (current.isFault()) {
			ReadyFailure failure = ReadyFailure.fromFault(
				ProviderFaultClassifier.classifyMessage(current.getDiagnostic()), current.getDiagnostic());
			return CompletableFuture.completedFuture(ReadyResult.failed(failure));
		}
		switch (current.getState()) {
			case READY:
				return CompletableFuture.completedFuture(ReadyResult.ready());
			case DISABLED_BY_USER:
				return CompletableFuture.completedFuture(ReadyResult.failed(ReadyFailure.disabledByUser()));
			case UNSUPPORTED:
				return CompletableFuture.completedFuture(ReadyResult.failed(ReadyFailure.unsupported()));
			case NOT_READY:
				return provisionOnce();
			default:
				return CompletableFuture.completedFuture(ReadyResult.failed(
					ReadyFailure.providerFault("Provider reported an unrecognized readiness state")));
		}
	}

	/**
	 * @return true while a provisioning call is outstanding
	 */
	public boolean isProvisioning() {
		return inFlight.get() != null;
	}

	private CompletableFuture<ReadyResult> provisionOnce() {
		while (true) {
			Provisioning current = inFlight.get();
			if (current != null) {
				if (current.tryJoin()) {
					logger.log(DEBUG, "Joining in-flight provisioning of " + provider.name());
					return waitFor(current);
				}
				// abandoned by its last caller, clear it and start over
				inFlight.compareAndSet(current, null);
				continue;
			}
			Provisioning created = new Provisioning();
			if (inFlight.compareAndSet(null, created)) {
				created.tryJoin();
				startProvisioning(created);
				return waitFor(created);
			}
		}
	}

	/**
	 * Hand out a private view of the shared outcome. Cancelling the view
	 * releases the caller; once every caller has cancelled, the provider's
	 * provisioning future is cancelled and the slot is freed.
	 */
	private CompletableFuture<ReadyResult> waitFor(Provisioning provisioning) {
		CompletableFuture<ReadyResult> view = provisioning.outcome.copy();
		view.whenComplete((result, error) -> {
			if (view.isCancelled() && provisioning.leave()) {
				abandon(provisioning);
			}
		});
		return view;
	}

	private void abandon(Provisioning provisioning) {
		inFlight.compareAndSet(provisioning, null);
		if (provisioning.outcome.isDone()) {
			return;
		}
		logger.log(DEBUG, "All callers gave up waiting, cancelling provisioning of " + provider.name());
		CompletableFuture<ProvisionResult> pending = provisioning.pending;
		if (pending != null) {
			pending.cancel(true);
		}
		provisioning.outcome.completeExceptionally(new CancellationException("Provisioning cancelled by its callers"));
	}

	private void startProvisioning(Provisioning provisioning) {
		logger.log(DEBUG, "Provisioning " + provider.name());
		CompletableFuture<ProvisionResult> pending;
		try {
			pending = provider.provision();
		} catch (RuntimeException | LinkageError e) {
			finish(provisioning, null, e);
			return;
		}
		if (pending == null) {
			finish(provisioning, null, new IllegalStateException("Provider returned no provisioning future"));
			return;
		}
		provisioning.pending = pending;
		pending.whenComplete((result, error) -> finish(provisioning, result, error));
	}

	private void finish(Provisioning provisioning, ProvisionResult result, Throwable error) {
		// free the slot first so a caller arriving after completion starts a new attempt
		inFlight.compareAndSet(provisioning, null);
		CompletableFuture<ReadyResult> slot = provisioning.outcome;

		if (error != null) {
			if (ProviderFaultClassifier.isCancellation(error)) {
				logger.log(DEBUG, "Provisioning of " + provider.name() + " was cancelled");
				slot.completeExceptionally(ProviderFaultClassifier.unwrap(error));
				return;
			}
			ReadyFailure failure = ProviderFaultClassifier.toReadyFailure(error);
			logger.log(WARNING, "Provisioning of " + provider.name() + " faulted, classified as " + failure.getReason(), error);
			slot.complete(ReadyResult.failed(failure));
			return;
		}
		if (result == null) {
			slot.complete(ReadyResult.failed(ReadyFailure.providerFault("Provider returned no provisioning result")));
			return;
		}
		if (result.isSuccess()) {
			logger.log(DEBUG, "Provider " + provider.name() + " is ready");
			slot.complete(ReadyResult.ready());
			return;
		}
		String detail = result.getErrorDisplayText();
		if (detail.isBlank() && result.getExtendedError() != null) {
			detail = ProviderFaultClassifier.describe(result.getExtendedError());
		}
		logger.log(DEBUG, "Provisioning of " + provider.name() + " failed: " + detail);
		slot.complete(ReadyResult.failed(ReadyFailure.provisioningFailed(detail)));
	}

	/**
	 * Translate a provider state into the stable vocabulary.
	 */
	static ReadinessState toReadinessState(ProviderState raw) {
		if (raw == null) {
			return ReadinessState.UNKNOWN;
		}
		switch (raw) {
			case READY:
				return ReadinessState.READY;
			case NOT_READY:
				return ReadinessState.NOT_READY;
			case DISABLED_BY_USER:
				return ReadinessState.DISABLED_BY_USER;
			case NOT_SUPPORTED_ON_CURRENT_SYSTEM:
				return ReadinessState.UNSUPPORTED;
			default:
				return ReadinessState.UNKNOWN;
		}
	}

	/**
	 * One provisioning attempt shared by every caller that joined it.
	 */
	private static final class Provisioning {
		final CompletableFuture<ReadyResult> outcome = new CompletableFuture<>();
		// negative once the last caller has left
		private final AtomicInteger waiters = new AtomicInteger();
		volatile CompletableFuture<ProvisionResult> pending;

		boolean tryJoin() {
			while (true) {
				int n = waiters.get();
				if (n < 0) {
					return false;
				}
				if (waiters.compareAndSet(n, n + 1)) {
					return true;
				}
			}
		}

		/**
		 * @return true if this was the last caller
		 */
		boolean leave() {
			return waiters.decrementAndGet() == 0 && waiters.compareAndSet(0, -1);
		}
	}
}
