package de.kherud.superres;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Result of a scale or sharpen operation.
 *
 * On success the output path is the requested output locator and the scaled
 * dimensions are the original ones times the scale factor. On failure the
 * output path is empty, all dimensions are zero and the message carries the
 * reason.
 */
@JsonPropertyOrder({"success", "message", "outputPath", "originalWidth", "originalHeight",
	"scaledWidth", "scaledHeight", "failureKind"})
public final class ScaleResult {

	private final boolean success;
	private final String message;
	private final String outputPath;
	private final int originalWidth;
	private final int originalHeight;
	private final int scaledWidth;
	private final int scaledHeight;
	private final FailureKind failureKind;

	private ScaleResult(boolean success, String message, String outputPath, int originalWidth, int originalHeight,
						int scaledWidth, int scaledHeight, FailureKind failureKind) {
		this.success = success;
		this.message = message == null ? "" : message;
		this.outputPath = outputPath;
		this.originalWidth = originalWidth;
		this.originalHeight = originalHeight;
		this.scaledWidth = scaledWidth;
		this.scaledHeight = scaledHeight;
		this.failureKind = failureKind;
	}

	/**
	 * Create a successful result with the standard summary message.
	 *
	 * @param outputPath where the scaled image was written, must not be empty
	 * @param originalWidth decoded input width
	 * @param originalHeight decoded input height
	 * @param scaledWidth written output width
	 * @param scaledHeight written output height
	 * @return successful ScaleResult
	 */
	public static ScaleResult success(String outputPath, int originalWidth, int originalHeight,
									  int scaledWidth, int scaledHeight) {
		if (outputPath == null || outputPath.isEmpty()) {
			throw new IllegalArgumentException("Output path cannot be empty for a successful result");
		}
		String message = String.format("Image scaled successfully from %dx%d to %dx%d",
			originalWidth, originalHeight, scaledWidth, scaledHeight);
		return new ScaleResult(true, message, outputPath, originalWidth, originalHeight,
			scaledWidth, scaledHeight, null);
	}

	/**
	 * Create a failed result.
	 *
	 * @param kind failure category
	 * @param message failure reason
	 * @return failed ScaleResult with empty output path and zero dimensions
	 */
	public static ScaleResult failure(FailureKind kind, String message) {
		return new ScaleResult(false, message, "", 0, 0, 0, 0,
			Objects.requireNonNull(kind, "Failure kind cannot be null"));
	}

	@JsonProperty("success")
	public boolean isSuccess() {
		return success;
	}

	@JsonProperty("message")
	public String getMessage() {
		return message;
	}

	/**
	 * @return the written file, or an empty string if the operation failed
	 */
	@JsonProperty("outputPath")
	public String getOutputPath() {
		return outputPath;
	}

	@JsonProperty("originalWidth")
	public int getOriginalWidth() {
		return originalWidth;
	}

	@JsonProperty("originalHeight")
	public int getOriginalHeight() {
		return originalHeight;
	}

	@JsonProperty("scaledWidth")
	public int getScaledWidth() {
		return scaledWidth;
	}

	@JsonProperty("scaledHeight")
	public int getScaledHeight() {
		return scaledHeight;
	}

	/**
	 * @return the failure category, or null on success
	 */
	@Nullable
	@JsonProperty("failureKind")
	public FailureKind getFailureKind() {
		return failureKind;
	}

	@JsonIgnore
	public boolean isFailure() {
		return !success;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ScaleResult)) return false;
		ScaleResult that = (ScaleResult) o;
		return success == that.success
			&& originalWidth == that.originalWidth
			&& originalHeight == that.originalHeight
			&& scaledWidth == that.scaledWidth
			&& scaledHeight == that.scaledHeight
			&& message.equals(that.message)
			&& outputPath.equals(that.outputPath)
			&& failureKind == that.failureKind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(success, message, outputPath, originalWidth, originalHeight,
			scaledWidth, scaledHeight, failureKind);
	}

	@Override
	public String toString() {
		if (success) {
			return String.format("ScaleResult{success=%s, original=%dx%d, scaled=%dx%d, output='%s'}",
				success, originalWidth, originalHeight, scaledWidth, scaledHeight, outputPath);
		} else {
			return String.format("ScaleResult{success=%s, kind=%s, error='%s'}", success, failureKind, message);
		}
	}
}
