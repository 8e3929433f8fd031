package de.kherud.superres.provider;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Terminal outcome of a provider provisioning attempt.
 */
public final class ProvisionResult {

	public enum Status {
		SUCCESS,
		FAILURE
	}

	private final Status status;
	private final String errorDisplayText;
	private final Throwable extendedError;

	private ProvisionResult(Status status, String errorDisplayText, Throwable extendedError) {
		this.status = Objects.requireNonNull(status, "Status cannot be null");
		this.errorDisplayText = errorDisplayText == null ? "" : errorDisplayText;
		this.extendedError = extendedError;
	}

	public static ProvisionResult success() {
		return new ProvisionResult(Status.SUCCESS, "", null);
	}

	public static ProvisionResult failure(String errorDisplayText) {
		return new ProvisionResult(Status.FAILURE, errorDisplayText, null);
	}

	public static ProvisionResult failure(String errorDisplayText, Throwable extendedError) {
		return new ProvisionResult(Status.FAILURE, errorDisplayText, extendedError);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}

	/**
	 * Provider supplied text describing the failure, empty on success.
	 */
	public String getErrorDisplayText() {
		return errorDisplayText;
	}

	@Nullable
	public Throwable getExtendedError() {
		return extendedError;
	}

	@Override
	public String toString() {
		if (isSuccess()) {
			return "ProvisionResult{status=SUCCESS}";
		}
		return String.format("ProvisionResult{status=%s, error='%s'}", status, errorDisplayText);
	}
}
