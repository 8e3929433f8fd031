package de.kherud.superres;

import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps untyped provider faults onto the closed {@link FailureKind} taxonomy.
 *
 * Providers report errors as free text with embedded status codes, so matching
 * is best-effort on known substrings. Anything not recognised is a
 * {@link FailureKind#PROVIDER_FAULT}; no category is guessed.
 * The mapping is pure and deterministic for a given throwable.
 */
public final class ProviderFaultClassifier {

	/** HRESULT for ERROR_NOT_SUPPORTED as embedded in vendor messages. */
	static final String NOT_SUPPORTED_CODE = "0x80070032";

	private ProviderFaultClassifier() {
	}

	/**
	 * Classify a provider fault. Wrappers from futures are unwrapped first and
	 * the whole cause chain is searched, outermost message first.
	 *
	 * @param fault the throwable raised or completed by the provider
	 * @return {@link FailureKind#NOT_SUPPORTED}, {@link FailureKind#MISSING_CAPABILITY}
	 * or {@link FailureKind#PROVIDER_FAULT}
	 */
	public static FailureKind classify(Throwable fault) {
		for (Throwable t = unwrap(fault); t != null; t = t.getCause()) {
			FailureKind kind = classifyMessage(t.getMessage());
			if (kind != FailureKind.PROVIDER_FAULT) {
				return kind;
			}
			if (t.getCause() == t) {
				break;
			}
		}
		return FailureKind.PROVIDER_FAULT;
	}

	/**
	 * Classify a single provider message.
	 */
	public static FailureKind classifyMessage(String message) {
		if (message == null || message.isEmpty()) {
			return FailureKind.PROVIDER_FAULT;
		}
		String lower = message.toLowerCase(Locale.ROOT);
		if (lower.contains(NOT_SUPPORTED_CODE) || lower.contains("not supported")) {
			return FailureKind.NOT_SUPPORTED;
		}
		if (lower.contains("capability")) {
			return FailureKind.MISSING_CAPABILITY;
		}
		return FailureKind.PROVIDER_FAULT;
	}

	/**
	 * Translate a fault into a {@link ReadyFailure} with stable text.
	 */
	public static ReadyFailure toReadyFailure(Throwable fault) {
		return ReadyFailure.fromFault(classify(fault), describe(fault));
	}

	/**
	 * Cancellations and timeouts belong to the caller and are never classified.
	 */
	public static boolean isCancellation(Throwable fault) {
		Throwable t = unwrap(fault);
		return t instanceof CancellationException || t instanceof TimeoutException;
	}

	/**
	 * Strip {@link CompletionException} and {@link ExecutionException} wrappers.
	 */
	public static Throwable unwrap(Throwable fault) {
		Throwable t = fault;
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
			t = t.getCause();
		}
		return t;
	}

	/**
	 * Diagnostic text for a fault: its message, or its type when there is none.
	 */
	public static String describe(Throwable fault) {
		Throwable t = unwrap(fault);
		if (t == null) {
			return "Unknown provider error";
		}
		String message = t.getMessage();
		return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
	}
}
