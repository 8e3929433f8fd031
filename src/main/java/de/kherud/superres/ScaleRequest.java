package de.kherud.superres;

import java.util.Objects;

/**
 * A request to scale (or sharpen) one image.
 *
 * Locators are opaque to this type and resolved by the scaling service. The
 * scale factor is a whole number; fractional factors are not supported. A
 * request may be built with an out-of-range factor: it is rejected by
 * {@link ScalingService#scale(ScaleRequest)} before any provider interaction.
 */
public final class ScaleRequest {

	public static final int MIN_SCALE_FACTOR = 1;
	public static final int MAX_SCALE_FACTOR = 8;

	/** Factor 1 keeps the dimensions and only sharpens. */
	public static final int SHARPEN_ONLY = 1;

	private final String inputLocator;
	private final String outputLocator;
	private final int scaleFactor;

	public ScaleRequest(String inputLocator, String outputLocator, int scaleFactor) {
		this.inputLocator = Objects.requireNonNull(inputLocator, "Input locator cannot be null");
		this.outputLocator = Objects.requireNonNull(outputLocator, "Output locator cannot be null");
		this.scaleFactor = scaleFactor;
	}

	public static ScaleRequest sharpen(String inputLocator, String outputLocator) {
		return new ScaleRequest(inputLocator, outputLocator, SHARPEN_ONLY);
	}

	public String getInputLocator() {
		return inputLocator;
	}

	public String getOutputLocator() {
		return outputLocator;
	}

	public int getScaleFactor() {
		return scaleFactor;
	}

	public boolean hasValidScaleFactor() {
		return scaleFactor >= MIN_SCALE_FACTOR && scaleFactor <= MAX_SCALE_FACTOR;
	}

	/**
	 * Target size along one axis. Integer multiplication, exact for whole factors.
	 */
	public int scaled(int originalSize) {
		return Math.multiplyExact(originalSize, scaleFactor);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ScaleRequest)) return false;
		ScaleRequest that = (ScaleRequest) o;
		return scaleFactor == that.scaleFactor
			&& inputLocator.equals(that.inputLocator)
			&& outputLocator.equals(that.outputLocator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inputLocator, outputLocator, scaleFactor);
	}

	@Override
	public String toString() {
		return String.format("ScaleRequest{input='%s', output='%s', factor=%d}", inputLocator, outputLocator, scaleFactor);
	}
}
