package de.kherud.superres;

import de.kherud.superres.provider.ProviderState;
import de.kherud.superres.provider.ProvisionResult;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Tests for the readiness state machine.
 */
public class ReadinessControllerTest {

	private FakeCapabilityProvider provider;
	private ReadinessController controller;

	@Before
	public void setUp() {
		provider = new FakeCapabilityProvider();
		controller = new ReadinessController(provider);
	}

	@Test
	public void testProviderStatesMapToStableVocabulary() {
		assertEquals(ReadinessState.READY, ReadinessController.toReadinessState(ProviderState.READY));
		assertEquals(ReadinessState.NOT_READY, ReadinessController.toReadinessState(ProviderState.NOT_READY));
		assertEquals(ReadinessState.DISABLED_BY_USER, ReadinessController.toReadinessState(ProviderState.DISABLED_BY_USER));
		assertEquals(ReadinessState.UNSUPPORTED, ReadinessController.toReadinessState(ProviderState.NOT_SUPPORTED_ON_CURRENT_SYSTEM));
		assertEquals(ReadinessState.UNKNOWN, ReadinessController.toReadinessState(ProviderState.UNRECOGNIZED));
		assertEquals(ReadinessState.UNKNOWN, ReadinessController.toReadinessState(null));
	}

	@Test
	public void testQueryStateAsksProviderEveryTime() {
		provider.withState(ProviderState.NOT_READY);
		assertEquals(ReadinessState.NOT_READY, controller.queryState().getState());

		provider.withState(ProviderState.READY);
		assertEquals(ReadinessState.READY, controller.queryState().getState());
		assertEquals(2, provider.getStateCalls.get());
	}

	@Test
	public void testNotReadyAndUnsupportedAreNotFaults() {
		provider.withState(ProviderState.NOT_SUPPORTED_ON_CURRENT_SYSTEM);
		ReadinessReport report = controller.queryState();
		assertFalse(report.isFault());
		assertNull(report.getDiagnostic());
		assertEquals("Unsupported", report.describe());
	}

	@Test
	public void testProviderFaultYieldsUnknownWithDiagnostic() {
		provider.failingStateQuery(new IllegalStateException("service unreachable"));
		ReadinessReport report = controller.queryState();
		assertEquals(ReadinessState.UNKNOWN, report.getState());
		assertTrue(report.isFault());
		assertEquals("service unreachable", report.getDiagnostic());
		assertEquals("Error: service unreachable", report.describe());
	}

	@Test
	public void testNotSupportedFaultReportsUnsupported() {
		provider.failingStateQuery(new RuntimeException("Class not registered (0x80070032)"));
		ReadinessReport report = controller.queryState();
		assertEquals(ReadinessState.UNSUPPORTED, report.getState());
		assertFalse(report.isFault());
	}

	@Test
	public void testAvailability() {
		provider.withState(ProviderState.READY);
		assertTrue(controller.isAvailable());
		provider.withState(ProviderState.NOT_READY);
		assertTrue(controller.isAvailable());
		provider.withState(ProviderState.DISABLED_BY_USER);
		assertFalse(controller.isAvailable());
		provider.withState(ProviderState.NOT_SUPPORTED_ON_CURRENT_SYSTEM);
		assertFalse(controller.isAvailable());
		provider.failingStateQuery(new RuntimeException("gone"));
		assertFalse(controller.isAvailable());
	}

	@Test
	public void testEnsureReadyIsIdempotentWhenReady() {
		provider.withState(ProviderState.READY);
		assertTrue(controller.ensureReady().join().isReady());
		assertTrue(controller.ensureReady().join().isReady());
		assertEquals("No provisioning when already ready", 0, provider.provisionCalls.get());
		assertEquals(0, provider.createTransformCalls.get());
	}

	@Test
	public void testDisabledByUserFailsWithoutProvisioning() {
		provider.withState(ProviderState.DISABLED_BY_USER);
		ReadyResult result = controller.ensureReady().join();
		assertFalse(result.isReady());
		assertEquals(FailureKind.DISABLED_BY_USER, result.getFailure().get().getReason());
		assertEquals(0, provider.provisionCalls.get());
	}

	@Test
	public void testUnsupportedFailsWithNpuRequirement() {
		provider.withState(ProviderState.NOT_SUPPORTED_ON_CURRENT_SYSTEM);
		ReadyResult result = controller.ensureReady().join();
		assertEquals(FailureKind.NOT_SUPPORTED, result.getFailure().get().getReason());
		assertTrue(result.describe().startsWith("Error: "));
		assertTrue(result.describe().contains("Copilot+ PC"));
		assertTrue(result.describe().contains("NPU"));
		assertEquals(0, provider.provisionCalls.get());
	}

	@Test
	public void testNotReadyProvisionsToReady() {
		provider.withState(ProviderState.NOT_READY);
		ReadyResult result = controller.ensureReady().join();
		assertTrue(result.isReady());
		assertEquals("Ready", result.describe());
		assertEquals(1, provider.provisionCalls.get());
		assertEquals(ReadinessState.READY, controller.queryState().getState());

		controller.ensureReady().join();
		assertEquals("Second call finds the provider ready", 1, provider.provisionCalls.get());
	}

	@Test
	public void testProvisioningFailureCarriesDetail() {
		provider.withState(ProviderState.NOT_READY)
			.provisioningResult(ProvisionResult.failure("Model download interrupted"));
		ReadyResult result = controller.ensureReady().join();
		ReadyFailure failure = result.getFailure().get();
		assertEquals(FailureKind.PROVISIONING_FAILED, failure.getReason());
		assertEquals("Model download interrupted", failure.getDetail());
		assertTrue(failure.getMessage().contains("Model download interrupted"));
		assertEquals(ReadinessState.NOT_READY, controller.queryState().getState());
	}

	@Test
	public void testProvisioningFailureUsesExtendedErrorWhenTextMissing() {
		provider.withState(ProviderState.NOT_READY)
			.provisioningResult(ProvisionResult.failure("", new RuntimeException("disk full")));
		ReadyFailure failure = controller.ensureReady().join().getFailure().get();
		assertEquals("disk full", failure.getDetail());
	}

	@Test
	public void testProvisioningFaultsAreReclassified() {
		provider.withState(ProviderState.NOT_READY)
			.failingProvisioning(new RuntimeException("HRESULT 0x80070032"));
		ReadyFailure failure = controller.ensureReady().join().getFailure().get();
		assertEquals(FailureKind.NOT_SUPPORTED, failure.getReason());
		assertFalse(failure.getMessage().contains("HRESULT"));

		provider.failingProvisioning(new SecurityException("missing capability"));
		assertEquals(FailureKind.MISSING_CAPABILITY, controller.ensureReady().join().getFailure().get().getReason());

		provider.failingProvisioning(new RuntimeException("something odd"));
		assertEquals(FailureKind.PROVIDER_FAULT, controller.ensureReady().join().getFailure().get().getReason());
		assertFalse(controller.isProvisioning());
	}

	@Test
	public void testAsyncProvisioningFaultIsReclassified() {
		provider.withState(ProviderState.NOT_READY);
		CompletableFuture<ProvisionResult> pending = provider.manualProvisioning();
		CompletableFuture<ReadyResult> result = controller.ensureReady();
		pending.completeExceptionally(new RuntimeException("feature not supported"));
		assertEquals(FailureKind.NOT_SUPPORTED, result.join().getFailure().get().getReason());
	}

	@Test
	public void testQueryFaultFailsEnsureReady() {
		provider.failingStateQuery(new RuntimeException("service unreachable"));
		ReadyResult result = controller.ensureReady().join();
		assertEquals(FailureKind.PROVIDER_FAULT, result.getFailure().get().getReason());
		assertEquals("Error: service unreachable", result.describe());
		assertEquals(0, provider.provisionCalls.get());
	}

	@Test
	public void testUnrecognizedStateIsNotTreatedAsReady() {
		provider.withState(ProviderState.UNRECOGNIZED);
		ReadyResult result = controller.ensureReady().join();
		assertFalse(result.isReady());
		assertEquals(0, provider.provisionCalls.get());
	}

	@Test
	public void testConcurrentCallersShareOneProvisioning() throws Exception {
		provider.withState(ProviderState.NOT_READY);
		CompletableFuture<ProvisionResult> pending = provider.manualProvisioning();

		int callers = 8;
		ExecutorService pool = Executors.newFixedThreadPool(callers);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<CompletableFuture<ReadyResult>>> submitted = new ArrayList<>();
		try {
			for (int i = 0; i < callers; i++) {
				submitted.add(pool.submit(() -> {
					start.await();
					return controller.ensureReady();
				}));
			}
			start.countDown();
			List<CompletableFuture<ReadyResult>> results = new ArrayList<>();
			for (Future<CompletableFuture<ReadyResult>> f : submitted) {
				results.add(f.get(5, TimeUnit.SECONDS));
			}

			assertEquals("Only one provisioning call may be outstanding", 1, provider.provisionCalls.get());
			assertTrue(controller.isProvisioning());
			for (CompletableFuture<ReadyResult> r : results) {
				assertFalse(r.isDone());
			}

			pending.complete(ProvisionResult.success());
			for (CompletableFuture<ReadyResult> r : results) {
				assertTrue(r.get(5, TimeUnit.SECONDS).isReady());
			}
			assertFalse(controller.isProvisioning());
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	public void testCancellingOneCallerDoesNotCancelOthers() {
		provider.withState(ProviderState.NOT_READY);
		CompletableFuture<ProvisionResult> pending = provider.manualProvisioning();

		CompletableFuture<ReadyResult> first = controller.ensureReady();
		CompletableFuture<ReadyResult> second = controller.ensureReady();
		first.cancel(true);
		assertFalse("Other callers still wait on the provider", provider.lastProvision.isCancelled());
		assertTrue(controller.isProvisioning());

		pending.complete(ProvisionResult.success());
		assertTrue(first.isCancelled());
		assertTrue(second.join().isReady());
		assertEquals(1, provider.provisionCalls.get());
	}

	@Test
	public void testProvisioningCancellationPropagatesAndFreesSlot() {
		provider.withState(ProviderState.NOT_READY);
		CompletableFuture<ProvisionResult> pending = provider.manualProvisioning();
		CompletableFuture<ReadyResult> result = controller.ensureReady();

		pending.cancel(true);
		try {
			result.join();
			fail("Cancellation must not be mapped to a ready failure");
		} catch (CancellationException | CompletionException e) {
			assertTrue(ProviderFaultClassifier.isCancellation(e));
		}
		assertFalse(controller.isProvisioning());

		provider.manualProvisioning().complete(ProvisionResult.success());
		assertTrue(controller.ensureReady().join().isReady());
		assertEquals(2, provider.provisionCalls.get());
	}

	@Test
	public void testLastCallerCancellingAbandonsProvisioning() {
		provider.withState(ProviderState.NOT_READY);
		provider.manualProvisioning();
		CompletableFuture<ReadyResult> first = controller.ensureReady();
		CompletableFuture<ReadyResult> second = controller.ensureReady();

		first.cancel(true);
		second.cancel(true);
		assertTrue("Provider provisioning must be cancelled", provider.lastProvision.isCancelled());
		assertFalse(controller.isProvisioning());

		provider.immediateProvisioning();
		assertTrue(controller.ensureReady().join().isReady());
		assertEquals("A fresh attempt is started", 2, provider.provisionCalls.get());
	}

	@Test
	public void testHungProvisioningRecoversAfterCallerTimeout() throws Exception {
		provider.withState(ProviderState.NOT_READY);
		provider.manualProvisioning();
		CompletableFuture<ReadyResult> waiting = controller.ensureReady();
		try {
			waiting.get(50, TimeUnit.MILLISECONDS);
			fail("Provisioning never completes");
		} catch (TimeoutException expected) {
			waiting.cancel(true);
		}
		assertTrue(provider.lastProvision.isCancelled());

		provider.immediateProvisioning();
		assertTrue(controller.ensureReady().get(5, TimeUnit.SECONDS).isReady());
	}

	@Test
	public void testLinkageErrorDuringQueryIsFault() {
		provider.failingStateQuery(new UnsatisfiedLinkError("no superres_npu in java.library.path"));
		ReadinessReport report = controller.queryState();
		assertEquals(ReadinessState.UNKNOWN, report.getState());
		assertEquals("no superres_npu in java.library.path", report.getDiagnostic());
		assertFalse(controller.isAvailable());

		ReadyFailure failure = controller.ensureReady().join().getFailure().get();
		assertEquals(FailureKind.PROVIDER_FAULT, failure.getReason());
	}

	@Test
	public void testLinkageErrorDuringProvisioningIsFault() {
		provider.withState(ProviderState.NOT_READY)
			.failingProvisioning(new NoClassDefFoundError("com/vendor/npu/ImageScaler"));
		ReadyFailure failure = controller.ensureReady().join().getFailure().get();
		assertEquals(FailureKind.PROVIDER_FAULT, failure.getReason());
		assertFalse(controller.isProvisioning());
	}

	@Test
	public void testProvisioningTimeoutIsSurfacedAsCancellation() {
		provider.withState(ProviderState.NOT_READY);
		CompletableFuture<ProvisionResult> pending = provider.manualProvisioning();
		CompletableFuture<ReadyResult> result = controller.ensureReady();

		pending.completeExceptionally(new TimeoutException("deadline"));
		try {
			result.join();
			fail("Timeout must not be mapped to a ready failure");
		} catch (CompletionException e) {
			assertTrue(e.getCause() instanceof TimeoutException);
		}
	}

	@Test
	public void testEnsureReadyFromKnownStateSkipsQuery() {
		ReadyResult result = controller.ensureReady(ReadinessReport.of(ReadinessState.UNSUPPORTED)).join();
		assertFalse(result.isReady());
		assertEquals(0, provider.getStateCalls.get());
	}
}
