package de.kherud.superres;

import de.kherud.superres.image.ImageCodec;
import de.kherud.superres.image.ImageIoCodec;
import de.kherud.superres.provider.TransformHandle;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;

/**
 * Validates scale requests, drives the {@link ReadinessController} and runs the
 * provider transform, shaping every outcome into a {@link ScaleResult}.
 *
 * <p>Failures never escape as exceptions: validation, readiness, provider and
 * I/O problems all complete the returned future with a failed result. The one
 * exception is cancellation. A cancelled or timed out provider call completes the
 * future exceptionally so callers can tell it apart from a real failure.
 *
 * <p>Nothing is retried. Decoding, applying the transform and encoding run on
 * the service executor; the decoded image is in memory before the provider is
 * awaited, so no file stays open across provider calls.
 */
public class ScalingService implements AutoCloseable {
	private static final System.Logger logger = System.getLogger(ScalingService.class.getName());

	public static final String INVALID_SCALE_FACTOR_MESSAGE = "Scale factor must be between 1 and 8";

	static final String CLOSED_MESSAGE = "scaling service is closed";

	private final ReadinessController controller;
	private final ImageCodec codec;
	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final boolean autoProvision;

	/**
	 * Create a service with an ImageIO codec, auto-provisioning and its own worker pool.
	 */
	public ScalingService(ReadinessController controller) {
		this(controller, new ImageIoCodec(), createExecutor(defaultThreadCount()), true, true);
	}

	/**
	 * Create a service on a caller supplied executor, which the service does not shut down.
	 */
	public ScalingService(ReadinessController controller, ImageCodec codec, ExecutorService executor, boolean autoProvision) {
		this(controller, codec, executor, false, autoProvision);
	}

	/**
	 * Create a service with a worker pool of {@code threads} threads that {@link #close()} shuts down.
	 */
	static ScalingService withOwnExecutor(ReadinessController controller, ImageCodec codec, int threads,
										  boolean autoProvision) {
		return new ScalingService(controller, codec, createExecutor(threads), true, autoProvision);
	}

	private ScalingService(ReadinessController controller, ImageCodec codec, ExecutorService executor,
						   boolean ownsExecutor, boolean autoProvision) {
		this.controller = Objects.requireNonNull(controller, "Readiness controller cannot be null");
		this.codec = Objects.requireNonNull(codec, "Image codec cannot be null");
		this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
		this.ownsExecutor = ownsExecutor;
		this.autoProvision = autoProvision;
	}

	static ExecutorService createExecutor(int threadCount) {
		ThreadFactory threadFactory = new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);
			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r);
				thread.setName("superres-worker-" + counter.getAndIncrement());
				thread.setDaemon(true);
				return thread;
			}
		};
		return Executors.newFixedThreadPool(Math.max(1, threadCount), threadFactory);
	}

	static int defaultThreadCount() {
		return Math.min(4, Runtime.getRuntime().availableProcessors());
	}

	public ReadinessController getController() {
		return controller;
	}

	public boolean isAutoProvision() {
		return autoProvision;
	}

	/**
	 * Scale an image by a whole factor between 1 and 8.
	 *
	 * @param request input, output and factor
	 * @return a future completing with the result; exceptional only on cancellation
	 */
	public CompletableFuture<ScaleResult> scale(ScaleRequest request) {
		Objects.requireNonNull(request, "Scale request cannot be null");
		if (!request.hasValidScaleFactor()) {
			logger.log(DEBUG, "Rejected " + request + ": invalid scale factor");
			return CompletableFuture.completedFuture(
				ScaleResult.failure(FailureKind.VALIDATION_ERROR, INVALID_SCALE_FACTOR_MESSAGE));
		}

		ReadinessReport report = controller.queryState();
		if (report.isReady()) {
			return transform(request);
		}
		if (report.getState() == ReadinessState.NOT_READY && !report.isFault() && !autoProvision) {
			return CompletableFuture.completedFuture(ScaleResult.failure(FailureKind.PROVISIONING_FAILED,
				"Image Super Resolution not available: " + report.getState().getDisplayName()));
		}
		CompletableFuture<ReadyResult> readiness = controller.ensureReady(report);
		CompletableFuture<ScaleResult> result = readiness.thenCompose(ready -> ready.isReady()
			? transform(request)
			: CompletableFuture.completedFuture(notReady(report, ready.getFailure().orElseThrow())));
		// a caller giving up on the result also gives up its wait for provisioning
		result.whenComplete((r, e) -> {
			if (result.isCancelled()) {
				readiness.cancel(true);
			}
		});
		return result;
	}

	/**
	 * Sharpen an image without changing its dimensions; {@code scale} with factor 1.
	 */
	public CompletableFuture<ScaleResult> sharpen(String inputLocator, String outputLocator) {
		return scale(ScaleRequest.sharpen(inputLocator, outputLocator));
	}

	private ScaleResult notReady(ReadinessReport report, ReadyFailure failure) {
		String message = report.getState() == ReadinessState.NOT_READY && !report.isFault()
			? "Failed to initialize model: " + failure.getMessage()
			: "Image Super Resolution not available: " + report.getState().getDisplayName() + ". " + failure.getMessage();
		logger.log(DEBUG, message);
		return ScaleResult.failure(failure.getReason(), message);
	}

	private CompletableFuture<ScaleResult> transform(ScaleRequest request) {
		CompletableFuture<Source> decoded;
		try {
			decoded = CompletableFuture.supplyAsync(() -> decode(request), executor);
		} catch (RejectedExecutionException e) {
			logger.log(ERROR, "Scaling rejected for " + request + ", service is closed", e);
			return CompletableFuture.completedFuture(
				ScaleResult.failure(FailureKind.PROVIDER_FAULT, "Error scaling image: " + CLOSED_MESSAGE));
		}
		return decoded
			.thenCompose(source -> createTransform()
				.thenApplyAsync(handle -> applyAndWrite(handle, source, request), executor))
			.handle((result, error) -> {
				if (error == null) {
					return result;
				}
				Throwable cause = ProviderFaultClassifier.unwrap(error);
				if (ProviderFaultClassifier.isCancellation(cause)) {
					throw new CompletionException(cause);
				}
				return toFailure(request, cause);
			});
	}

	private CompletableFuture<TransformHandle> createTransform() {
		CompletableFuture<TransformHandle> handle = controller.getProvider().createTransform();
		if (handle == null) {
			throw new IllegalStateException("Provider returned no transform future");
		}
		return handle;
	}

	private Source decode(ScaleRequest request) {
		Path input;
		Path output;
		try {
			input = Paths.get(request.getInputLocator());
			output = Paths.get(request.getOutputLocator());
		} catch (InvalidPathException e) {
			throw new StepFailure(FailureKind.IO_FAILURE, e);
		}

		BufferedImage image;
		try {
			image = codec.read(input);
		} catch (IOException | RuntimeException e) {
			// decoders signal corrupt data with runtime exceptions too
			throw new StepFailure(FailureKind.IO_FAILURE, e);
		}

		try {
			return new Source(image, output, request.scaled(image.getWidth()), request.scaled(image.getHeight()));
		} catch (ArithmeticException e) {
			throw new StepFailure(FailureKind.VALIDATION_ERROR,
				new IllegalArgumentException("Target size exceeds the supported range", e));
		}
	}

	private ScaleResult applyAndWrite(TransformHandle handle, Source source, ScaleRequest request) {
		BufferedImage scaled;
		try (TransformHandle h = handle) {
			scaled = h.apply(source.image, source.targetWidth, source.targetHeight);
		}
		if (scaled == null) {
			throw new IllegalStateException("Provider returned no image");
		}
		if (scaled.getWidth() != source.targetWidth || scaled.getHeight() != source.targetHeight) {
			throw new IllegalStateException(String.format("Provider returned %dx%d, expected %dx%d",
				scaled.getWidth(), scaled.getHeight(), source.targetWidth, source.targetHeight));
		}

		try {
			codec.write(scaled, source.output);
		} catch (IOException e) {
			throw new StepFailure(FailureKind.IO_FAILURE, e);
		}

		ScaleResult result = ScaleResult.success(request.getOutputLocator(),
			source.image.getWidth(), source.image.getHeight(), source.targetWidth, source.targetHeight);
		logger.log(DEBUG, result.getMessage() + " -> " + request.getOutputLocator());
		return result;
	}

	private ScaleResult toFailure(ScaleRequest request, Throwable cause) {
		FailureKind kind;
		Throwable reported = cause;
		if (cause instanceof StepFailure) {
			kind = ((StepFailure) cause).kind;
			reported = cause.getCause();
		} else {
			kind = ProviderFaultClassifier.classify(cause);
		}
		String message = "Error scaling image: " + ProviderFaultClassifier.describe(reported);
		logger.log(ERROR, "Scaling failed for " + request + " (" + kind + ")", reported);
		return ScaleResult.failure(kind, message);
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			executor.shutdown();
		}
	}

	private static final class Source {
		final BufferedImage image;
		final Path output;
		final int targetWidth;
		final int targetHeight;

		Source(BufferedImage image, Path output, int targetWidth, int targetHeight) {
			this.image = image;
			this.output = output;
			this.targetWidth = targetWidth;
			this.targetHeight = targetHeight;
		}
	}

	/**
	 * Carries the failure category of a pipeline step through the future chain.
	 */
	private static final class StepFailure extends RuntimeException {
		final FailureKind kind;

		StepFailure(FailureKind kind, Throwable cause) {
			super(cause);
			this.kind = kind;
		}
	}
}
