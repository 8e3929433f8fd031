package de.kherud.superres.provider;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Pure Java2D capability provider: bicubic resampling followed by a 3x3
 * sharpening convolution.
 *
 * It has no hardware requirement and serves as the portable default. Like a
 * model backed provider it starts out {@link ProviderState#NOT_READY} and has to
 * be provisioned; provisioning warms up the Java2D pipeline with a small image.
 */
public class BicubicCapabilityProvider implements CapabilityProvider {
	private static final System.Logger logger = System.getLogger(BicubicCapabilityProvider.class.getName());

	public static final String NAME = "bicubic";
	public static final float DEFAULT_SHARPEN_AMOUNT = 0.5f;

	private static final int WARM_UP_SIZE = 8;

	private final AtomicReference<ProviderState> state = new AtomicReference<>(ProviderState.NOT_READY);
	private final Executor executor;
	private final float sharpenAmount;

	public BicubicCapabilityProvider() {
		this(ForkJoinPool.commonPool(), DEFAULT_SHARPEN_AMOUNT);
	}

	/**
	 * @param executor runs provisioning
	 * @param sharpenAmount strength of the sharpening pass, 0 disables it
	 */
	public BicubicCapabilityProvider(Executor executor, float sharpenAmount) {
		if (executor == null) {
			throw new IllegalArgumentException("Executor cannot be null");
		}
		if (sharpenAmount < 0.0f || sharpenAmount > 2.0f) {
			throw new IllegalArgumentException("Sharpen amount must be between 0 and 2");
		}
		this.executor = executor;
		this.sharpenAmount = sharpenAmount;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public ProviderState getState() {
		return state.get();
	}

	@Override
	public CompletableFuture<ProvisionResult> provision() {
		if (state.get() == ProviderState.READY) {
			return CompletableFuture.completedFuture(ProvisionResult.success());
		}
		return CompletableFuture.supplyAsync(() -> {
			try {
				BufferedImage probe = new BufferedImage(WARM_UP_SIZE, WARM_UP_SIZE, BufferedImage.TYPE_INT_ARGB);
				new BicubicTransform(sharpenAmount).apply(probe, WARM_UP_SIZE * 2, WARM_UP_SIZE * 2);
				state.set(ProviderState.READY);
				logger.log(DEBUG, "Bicubic provider warmed up");
				return ProvisionResult.success();
			} catch (RuntimeException e) {
				return ProvisionResult.failure("Warm-up failed: " + e.getMessage(), e);
			}
		}, executor);
	}

	@Override
	public CompletableFuture<TransformHandle> createTransform() {
		if (state.get() != ProviderState.READY) {
			return CompletableFuture.failedFuture(
				new IllegalStateException("Bicubic provider is not ready; provision it first"));
		}
		return CompletableFuture.completedFuture(new BicubicTransform(sharpenAmount));
	}

	static final class BicubicTransform implements TransformHandle {
		private final float sharpenAmount;

		BicubicTransform(float sharpenAmount) {
			this.sharpenAmount = sharpenAmount;
		}

		@Override
		public BufferedImage apply(BufferedImage image, int targetWidth, int targetHeight) {
			if (image == null) {
				throw new IllegalArgumentException("Image cannot be null");
			}
			if (targetWidth <= 0 || targetHeight <= 0) {
				throw new IllegalArgumentException("Target dimensions must be positive");
			}
			BufferedImage resized = resize(image, targetWidth, targetHeight);
			return sharpenAmount > 0.0f ? sharpen(resized) : resized;
		}

		private BufferedImage resize(BufferedImage original, int width, int height) {
			BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
			Graphics2D g2d = resized.createGraphics();
			try {
				g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
				g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
				g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
				g2d.drawImage(original, 0, 0, width, height, null);
			} finally {
				g2d.dispose();
			}
			return resized;
		}

		private BufferedImage sharpen(BufferedImage image) {
			float a = sharpenAmount;
			// kernel sums to 1 so flat regions keep their value
			float[] weights = {
				0f, -a, 0f,
				-a, 1f + 4f * a, -a,
				0f, -a, 0f
			};
			ConvolveOp op = new ConvolveOp(new Kernel(3, 3, weights), ConvolveOp.EDGE_NO_OP, null);
			return op.filter(image, null);
		}
	}
}
