package de.kherud.superres;

import java.util.Objects;

/**
 * Why the model could not be brought to a ready state.
 *
 * The {@link #getMessage() message} is stable text suitable for end users; the
 * {@link #getDetail() detail} carries whatever the provider reported.
 */
public final class ReadyFailure {

	static final String NPU_REQUIRED = "A Copilot+ PC with a Neural Processing Unit (NPU) is required.";

	private final FailureKind reason;
	private final String detail;
	private final String message;

	private ReadyFailure(FailureKind reason, String detail, String message) {
		this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
		this.detail = detail == null ? "" : detail;
		this.message = message;
	}

	public static ReadyFailure disabledByUser() {
		return new ReadyFailure(FailureKind.DISABLED_BY_USER, "",
			"AI features are disabled by the user in system settings.");
	}

	/**
	 * The provider reported itself unsupported through its state.
	 */
	public static ReadyFailure unsupported() {
		return new ReadyFailure(FailureKind.NOT_SUPPORTED, "",
			"Image Super Resolution is not supported on this system. A Copilot+ PC with NPU is required.");
	}

	/**
	 * A provider fault was recognised as an unsupported device.
	 */
	public static ReadyFailure unsupportedDevice(String detail) {
		return new ReadyFailure(FailureKind.NOT_SUPPORTED, detail,
			"This device does not support Image Super Resolution. " + NPU_REQUIRED);
	}

	public static ReadyFailure missingCapability(String detail) {
		return new ReadyFailure(FailureKind.MISSING_CAPABILITY, detail,
			"Missing required capability. Ensure the app has the 'systemAIModels' capability in its manifest.");
	}

	public static ReadyFailure provisioningFailed(String detail) {
		String shown = detail == null || detail.isBlank() ? "no detail reported" : detail;
		return new ReadyFailure(FailureKind.PROVISIONING_FAILED, detail,
			"The AI model failed to initialize: " + shown
				+ ". This feature requires a Copilot+ PC with a Neural Processing Unit (NPU).");
	}

	public static ReadyFailure providerFault(String detail) {
		String shown = detail == null || detail.isBlank() ? "Unknown provider error" : detail;
		return new ReadyFailure(FailureKind.PROVIDER_FAULT, detail, shown);
	}

	/**
	 * Build the failure matching a fault category produced by {@link ProviderFaultClassifier}.
	 */
	public static ReadyFailure fromFault(FailureKind kind, String detail) {
		switch (kind) {
			case NOT_SUPPORTED:
				return unsupportedDevice(detail);
			case MISSING_CAPABILITY:
				return missingCapability(detail);
			case DISABLED_BY_USER:
				return disabledByUser();
			case PROVISIONING_FAILED:
				return provisioningFailed(detail);
			default:
				return providerFault(detail);
		}
	}

	public FailureKind getReason() {
		return reason;
	}

	public String getDetail() {
		return detail;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return String.format("ReadyFailure{reason=%s, message='%s'}", reason, message);
	}
}
