package de.kherud.superres.provider;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Discovers {@link CapabilityProvider} implementations through {@link ServiceLoader}.
 */
public final class CapabilityProviders {
	private static final System.Logger logger = System.getLogger(CapabilityProviders.class.getName());

	private CapabilityProviders() {
	}

	/**
	 * All registered providers that report themselves available, highest priority first.
	 */
	public static List<CapabilityProvider> available() {
		return available(load());
	}

	static List<CapabilityProvider> available(Iterable<CapabilityProvider> candidates) {
		List<CapabilityProvider> result = new ArrayList<>();
		for (CapabilityProvider candidate : candidates) {
			if (probe(candidate)) {
				result.add(candidate);
			} else {
				logger.log(DEBUG, "Skipping unavailable provider " + candidate.name());
			}
		}
		result.sort(Comparator.comparingInt(CapabilityProvider::priority).reversed());
		return result;
	}

	private static boolean probe(CapabilityProvider candidate) {
		try {
			return candidate.isAvailable();
		} catch (RuntimeException | LinkageError e) {
			logger.log(WARNING, "Availability probe of provider " + candidate.name() + " failed", e);
			return false;
		}
	}

	/**
	 * Find an available provider by name.
	 */
	public static Optional<CapabilityProvider> find(String name) {
		return find(load(), name);
	}

	static Optional<CapabilityProvider> find(Iterable<CapabilityProvider> candidates, String name) {
		if (UnsupportedCapabilityProvider.NAME.equals(name)) {
			return Optional.of(new UnsupportedCapabilityProvider());
		}
		return available(candidates).stream()
			.filter(p -> p.name().equals(name))
			.findFirst();
	}

	/**
	 * Select a provider: the named one if given, otherwise the highest priority
	 * available one. Falls back to {@link UnsupportedCapabilityProvider} so callers
	 * always get an answer.
	 *
	 * @param preferredName provider name, or null for automatic selection
	 */
	public static CapabilityProvider discover(@Nullable String preferredName) {
		return select(load(), preferredName);
	}

	static CapabilityProvider select(Iterable<CapabilityProvider> candidates, @Nullable String preferredName) {
		if (preferredName != null && !preferredName.isBlank()) {
			Optional<CapabilityProvider> named = find(candidates, preferredName.trim());
			if (named.isPresent()) {
				logger.log(DEBUG, "Using configured provider " + preferredName);
				return named.get();
			}
			logger.log(WARNING, "Configured provider '" + preferredName + "' is not available");
			return new UnsupportedCapabilityProvider();
		}
		List<CapabilityProvider> ranked = available(candidates);
		if (ranked.isEmpty()) {
			logger.log(WARNING, "No capability provider installed");
			return new UnsupportedCapabilityProvider();
		}
		CapabilityProvider chosen = ranked.get(0);
		logger.log(DEBUG, "Using provider " + chosen.name() + " (priority " + chosen.priority() + ")");
		return chosen;
	}

	private static List<CapabilityProvider> load() {
		List<CapabilityProvider> loaded = new ArrayList<>();
		Iterator<CapabilityProvider> it = ServiceLoader.load(CapabilityProvider.class).iterator();
		while (true) {
			try {
				if (!it.hasNext()) {
					break;
				}
				loaded.add(it.next());
			} catch (ServiceConfigurationError e) {
				logger.log(WARNING, "Failed to load capability provider", e);
			}
		}
		return loaded;
	}
}
