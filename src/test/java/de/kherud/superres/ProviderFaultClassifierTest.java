package de.kherud.superres;

import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ProviderFaultClassifierTest {

	@Test
	public void testHresultMeansNotSupported() {
		RuntimeException fault = new RuntimeException("Operation failed with HRESULT 0x80070032");
		assertEquals(FailureKind.NOT_SUPPORTED, ProviderFaultClassifier.classify(fault));
	}

	@Test
	public void testNotSupportedTextIsCaseInsensitive() {
		assertEquals(FailureKind.NOT_SUPPORTED, ProviderFaultClassifier.classifyMessage("Feature NOT SUPPORTED on this device"));
		assertEquals(FailureKind.NOT_SUPPORTED, ProviderFaultClassifier.classifyMessage("request is not supported"));
	}

	@Test
	public void testCapabilityMeansMissingCapability() {
		RuntimeException fault = new SecurityException("Access denied: the systemAIModels capability is not declared");
		assertEquals(FailureKind.MISSING_CAPABILITY, ProviderFaultClassifier.classify(fault));
	}

	@Test
	public void testNotSupportedWinsOverCapability() {
		assertEquals(FailureKind.NOT_SUPPORTED,
			ProviderFaultClassifier.classifyMessage("capability not supported (0x80070032)"));
	}

	@Test
	public void testUnmatchedFaultIsProviderFault() {
		assertEquals(FailureKind.PROVIDER_FAULT, ProviderFaultClassifier.classify(new IllegalStateException("device lost")));
		assertEquals(FailureKind.PROVIDER_FAULT, ProviderFaultClassifier.classify(new NullPointerException()));
		assertEquals(FailureKind.PROVIDER_FAULT, ProviderFaultClassifier.classifyMessage(null));
		assertEquals(FailureKind.PROVIDER_FAULT, ProviderFaultClassifier.classifyMessage(""));
	}

	@Test
	public void testWrappersAreUnwrapped() {
		RuntimeException root = new RuntimeException("0x80070032");
		assertEquals(FailureKind.NOT_SUPPORTED, ProviderFaultClassifier.classify(new CompletionException(root)));
		assertEquals(FailureKind.NOT_SUPPORTED, ProviderFaultClassifier.classify(new ExecutionException(root)));
		assertSame(root, ProviderFaultClassifier.unwrap(new CompletionException(new ExecutionException(root))));
	}

	@Test
	public void testCauseChainIsSearched() {
		RuntimeException fault = new RuntimeException("Model initialization failed",
			new IOException("required capability missing"));
		assertEquals(FailureKind.MISSING_CAPABILITY, ProviderFaultClassifier.classify(fault));
	}

	@Test
	public void testClassificationIsDeterministic() {
		RuntimeException fault = new RuntimeException("driver reported: not supported");
		FailureKind first = ProviderFaultClassifier.classify(fault);
		for (int i = 0; i < 10; i++) {
			assertEquals(first, ProviderFaultClassifier.classify(fault));
		}
	}

	@Test
	public void testCancellationDetection() {
		assertTrue(ProviderFaultClassifier.isCancellation(new CancellationException()));
		assertTrue(ProviderFaultClassifier.isCancellation(new CompletionException(new TimeoutException())));
		assertFalse(ProviderFaultClassifier.isCancellation(new RuntimeException("timeout")));
	}

	@Test
	public void testReadyFailureUsesStableText() {
		ReadyFailure unsupported = ProviderFaultClassifier.toReadyFailure(new RuntimeException("vendor text 0x80070032"));
		assertEquals(FailureKind.NOT_SUPPORTED, unsupported.getReason());
		assertTrue(unsupported.getMessage().contains("Copilot+ PC"));
		assertFalse("Raw provider text must not leak into the message",
			unsupported.getMessage().contains("vendor text"));
		assertEquals("vendor text 0x80070032", unsupported.getDetail());

		ReadyFailure fault = ProviderFaultClassifier.toReadyFailure(new RuntimeException("device lost"));
		assertEquals(FailureKind.PROVIDER_FAULT, fault.getReason());
		assertEquals("device lost", fault.getMessage());
	}

	@Test
	public void testDescribeFallsBackToType() {
		assertEquals("IllegalStateException", ProviderFaultClassifier.describe(new IllegalStateException()));
		assertEquals("boom", ProviderFaultClassifier.describe(new CompletionException(new RuntimeException("boom"))));
	}
}
