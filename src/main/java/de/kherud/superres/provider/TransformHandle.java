package de.kherud.superres.provider;

import java.awt.image.BufferedImage;

/**
 * A provider issued object able to scale or sharpen one image at a time.
 *
 * {@link #apply} is synchronous and CPU/NPU bound. Implementations must not
 * retry internally; a failure is reported by throwing.
 */
public interface TransformHandle extends AutoCloseable {

	/**
	 * Produce a scaled copy of {@code image} sized exactly {@code targetWidth} x {@code targetHeight}.
	 *
	 * @param image decoded source image
	 * @param targetWidth width of the result in pixels
	 * @param targetHeight height of the result in pixels
	 * @return the scaled image
	 */
	BufferedImage apply(BufferedImage image, int targetWidth, int targetHeight);

	@Override
	default void close() {
	}
}
