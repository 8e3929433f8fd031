package de.kherud.superres;

import de.kherud.superres.provider.CapabilityProvider;
import de.kherud.superres.provider.CapabilityProviders;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Caller facing entry point for on-device image super resolution.
 *
 * Blocking methods never throw: every failure comes back as a failed
 * {@link ScaleResult} or an {@code "Error: ..."} string. The asynchronous
 * variants expose the core futures for callers that impose their own deadlines.
 *
 * Usage examples:
 * <pre>{@code
 * try (SuperResolution superRes = SuperResolution.create()) {
 *     if (superRes.isAvailable() && "Ready".equals(superRes.ensureModelReady())) {
 *         ScaleResult result = superRes.scaleImage("in.jpg", "out.png", 2);
 *         System.out.println(result.getMessage());
 *     }
 * }
 *
 * // Bounded wait, explicit provider
 * SuperResolution superRes = SuperResolution.create(SuperResolutionConfig.builder()
 *     .providerName("bicubic")
 *     .timeout(Duration.ofSeconds(30))
 *     .build());
 * }</pre>
 */
public class SuperResolution implements AutoCloseable {
	private static final System.Logger logger = System.getLogger(SuperResolution.class.getName());

	private final SuperResolutionConfig config;
	private final ReadinessController controller;
	private final ScalingService service;

	private SuperResolution(SuperResolutionConfig config, CapabilityProvider provider) {
		this.config = config;
		this.controller = new ReadinessController(provider);
		this.service = ScalingService.withOwnExecutor(controller, config.getCodec(),
			config.getThreads(), config.isAutoProvision());
		logger.log(DEBUG, "Created " + config);
	}

	public static SuperResolution create() {
		return create(SuperResolutionConfig.defaults());
	}

	public static SuperResolution create(SuperResolutionConfig config) {
		if (config == null) {
			throw new IllegalArgumentException("Config cannot be null");
		}
		CapabilityProvider provider = config.getProvider() != null
			? config.getProvider()
			: CapabilityProviders.discover(config.getProviderName());
		return new SuperResolution(config, provider);
	}

	public SuperResolutionConfig getConfig() {
		return config;
	}

	public String getProviderName() {
		return controller.getProvider().name();
	}

	/**
	 * @return true if the model is ready or can be made ready; false on any fault
	 */
	public boolean isAvailable() {
		try {
			return controller.isAvailable();
		} catch (RuntimeException | LinkageError e) {
			logger.log(WARNING, "Availability check failed", e);
			return false;
		}
	}

	/**
	 * @return "Ready", "NotReady", "DisabledByUser", "Unsupported", "Unknown" or "Error: &lt;detail&gt;"
	 */
	public String getReadyState() {
		try {
			return controller.queryState().describe();
		} catch (RuntimeException | LinkageError e) {
			return "Error: " + ProviderFaultClassifier.describe(e);
		}
	}

	/**
	 * Bring the model to ready, provisioning it if needed.
	 *
	 * @return "Ready" or "Error: &lt;message&gt;"
	 */
	public String ensureModelReady() {
		CompletableFuture<ReadyResult> pending;
		try {
			pending = controller.ensureReady();
		} catch (RuntimeException | LinkageError e) {
			return "Error: " + ProviderFaultClassifier.toReadyFailure(e).getMessage();
		}
		try {
			return await(pending).describe();
		} catch (OperationCancelled e) {
			return "Error: " + e.getMessage();
		}
	}

	public CompletableFuture<ReadyResult> ensureModelReadyAsync() {
		return controller.ensureReady();
	}

	/**
	 * Scale an image by a whole factor between 1 and 8 and write it to {@code outputPath}.
	 */
	public ScaleResult scaleImage(String inputPath, String outputPath, int scaleFactor) {
		if (inputPath == null || outputPath == null) {
			return ScaleResult.failure(FailureKind.VALIDATION_ERROR, "Input and output paths are required");
		}
		return awaitResult(() -> service.scale(new ScaleRequest(inputPath, outputPath, scaleFactor)));
	}

	/**
	 * Sharpen an image keeping its dimensions.
	 */
	public ScaleResult sharpenImage(String inputPath, String outputPath) {
		if (inputPath == null || outputPath == null) {
			return ScaleResult.failure(FailureKind.VALIDATION_ERROR, "Input and output paths are required");
		}
		return awaitResult(() -> service.sharpen(inputPath, outputPath));
	}

	public CompletableFuture<ScaleResult> scaleImageAsync(ScaleRequest request) {
		return service.scale(request);
	}

	private ScaleResult awaitResult(ScaleCall call) {
		CompletableFuture<ScaleResult> pending;
		try {
			pending = call.start();
		} catch (RuntimeException | LinkageError e) {
			logger.log(WARNING, "Scale request could not be started", e);
			return ScaleResult.failure(ProviderFaultClassifier.classify(e),
				"Error scaling image: " + ProviderFaultClassifier.describe(e));
		}
		try {
			return await(pending);
		} catch (OperationCancelled e) {
			return ScaleResult.failure(FailureKind.CANCELLED, e.getMessage());
		}
	}

	private <T> T await(CompletableFuture<T> future) throws OperationCancelled {
		try {
			return config.hasTimeout()
				? future.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS)
				: future.get();
		} catch (TimeoutException e) {
			future.cancel(true);
			throw new OperationCancelled("timed out after " + config.getTimeout().toMillis() + " ms");
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new OperationCancelled("interrupted");
		} catch (CancellationException e) {
			throw new OperationCancelled("cancelled");
		} catch (ExecutionException e) {
			// the core only completes exceptionally on cancellation
			throw new OperationCancelled(ProviderFaultClassifier.describe(e));
		}
	}

	@Override
	public void close() {
		service.close();
	}

	@FunctionalInterface
	private interface ScaleCall {
		CompletableFuture<ScaleResult> start();
	}

	private static final class OperationCancelled extends Exception {
		OperationCancelled(String reason) {
			super("Operation cancelled: " + reason);
		}
	}
}
