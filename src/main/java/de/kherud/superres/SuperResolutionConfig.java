package de.kherud.superres;

import de.kherud.superres.image.ImageCodec;
import de.kherud.superres.image.ImageIoCodec;
import de.kherud.superres.provider.CapabilityProvider;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Properties;

/**
 * Configuration of a {@link SuperResolution} instance.
 *
 * Defaults come from system properties so that embedding applications can
 * configure the library without code changes:
 * <ul>
 *   <li>{@value #PROVIDER_PROPERTY}: provider name, unset for automatic selection</li>
 *   <li>{@value #AUTO_PROVISION_PROPERTY}: provision a not-ready model on first use (default true)</li>
 *   <li>{@value #TIMEOUT_PROPERTY}: blocking timeout in milliseconds, 0 waits indefinitely (default 0)</li>
 *   <li>{@value #THREADS_PROPERTY}: worker threads for decode, transform and encode</li>
 * </ul>
 */
public final class SuperResolutionConfig {

	public static final String PROVIDER_PROPERTY = "de.kherud.superres.provider";
	public static final String AUTO_PROVISION_PROPERTY = "de.kherud.superres.autoProvision";
	public static final String TIMEOUT_PROPERTY = "de.kherud.superres.timeoutMillis";
	public static final String THREADS_PROPERTY = "de.kherud.superres.threads";

	private final String providerName;
	private final CapabilityProvider provider;
	private final boolean autoProvision;
	private final Duration timeout;
	private final int threads;
	private final ImageCodec codec;

	private SuperResolutionConfig(Builder builder) {
		this.providerName = builder.providerName;
		this.provider = builder.provider;
		this.autoProvision = builder.autoProvision;
		this.timeout = builder.timeout;
		this.threads = builder.threads;
		this.codec = builder.codec;
	}

	/**
	 * A builder seeded from the current system properties.
	 */
	public static Builder builder() {
		return builder(System.getProperties());
	}

	/**
	 * A builder seeded from the given properties.
	 *
	 * @throws IllegalArgumentException if a property holds an invalid value
	 */
	public static Builder builder(Properties properties) {
		Builder builder = new Builder();
		String name = properties.getProperty(PROVIDER_PROPERTY);
		if (name != null && !name.isBlank()) {
			builder.providerName(name.trim());
		}
		String auto = properties.getProperty(AUTO_PROVISION_PROPERTY);
		if (auto != null && !auto.isBlank()) {
			builder.autoProvision(parseBoolean(AUTO_PROVISION_PROPERTY, auto.trim()));
		}
		String timeout = properties.getProperty(TIMEOUT_PROPERTY);
		if (timeout != null && !timeout.isBlank()) {
			builder.timeout(Duration.ofMillis(parseInt(TIMEOUT_PROPERTY, timeout.trim())));
		}
		String threads = properties.getProperty(THREADS_PROPERTY);
		if (threads != null && !threads.isBlank()) {
			builder.threads(parseInt(THREADS_PROPERTY, threads.trim()));
		}
		return builder;
	}

	public static SuperResolutionConfig defaults() {
		return builder().build();
	}

	private static boolean parseBoolean(String key, String value) {
		if ("true".equalsIgnoreCase(value)) {
			return true;
		}
		if ("false".equalsIgnoreCase(value)) {
			return false;
		}
		throw new IllegalArgumentException(key + " must be true or false, got '" + value + "'");
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
		}
	}

	@Nullable
	public String getProviderName() {
		return providerName;
	}

	/**
	 * @return an explicitly supplied provider instance, which takes precedence over the name
	 */
	@Nullable
	public CapabilityProvider getProvider() {
		return provider;
	}

	public boolean isAutoProvision() {
		return autoProvision;
	}

	/**
	 * @return how long blocking calls wait, {@link Duration#ZERO} for no limit
	 */
	public Duration getTimeout() {
		return timeout;
	}

	public boolean hasTimeout() {
		return !timeout.isZero();
	}

	public int getThreads() {
		return threads;
	}

	public ImageCodec getCodec() {
		return codec;
	}

	@Override
	public String toString() {
		return String.format("SuperResolutionConfig{provider=%s, autoProvision=%s, timeout=%s, threads=%d}",
			provider != null ? provider.name() : providerName, autoProvision, timeout, threads);
	}

	public static class Builder {
		private String providerName;
		private CapabilityProvider provider;
		private boolean autoProvision = true;
		private Duration timeout = Duration.ZERO;
		private int threads = ScalingService.defaultThreadCount();
		private ImageCodec codec = new ImageIoCodec();

		public Builder providerName(String providerName) {
			this.providerName = providerName;
			return this;
		}

		public Builder provider(CapabilityProvider provider) {
			this.provider = provider;
			return this;
		}

		public Builder autoProvision(boolean autoProvision) {
			this.autoProvision = autoProvision;
			return this;
		}

		public Builder timeout(Duration timeout) {
			if (timeout == null || timeout.isNegative()) {
				throw new IllegalArgumentException("Timeout must be zero or positive");
			}
			this.timeout = timeout;
			return this;
		}

		public Builder threads(int threads) {
			if (threads <= 0) {
				throw new IllegalArgumentException("Thread count must be positive");
			}
			this.threads = threads;
			return this;
		}

		public Builder codec(ImageCodec codec) {
			if (codec == null) {
				throw new IllegalArgumentException("Codec cannot be null");
			}
			this.codec = codec;
			return this;
		}

		public SuperResolutionConfig build() {
			return new SuperResolutionConfig(this);
		}
	}
}
