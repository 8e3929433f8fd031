package de.kherud.superres.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.kherud.superres.ScaleResult;
import de.kherud.superres.SuperResolution;
import de.kherud.superres.SuperResolutionConfig;
import de.kherud.superres.provider.CapabilityProvider;
import de.kherud.superres.provider.CapabilityProviders;
import de.kherud.superres.util.CliRunner;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command line front end for image super resolution.
 */
public final class SuperResolutionCli {

	static final int DEFAULT_SCALE_FACTOR = 2;

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private SuperResolutionCli() {
	}

	public static void main(String[] args) {
		CliRunner.runWithExit(SuperResolutionCli::runCli, args);
	}

	/**
	 * CLI runner that can be tested without System.exit
	 */
	public static void runCli(String[] args) throws Exception {
		run(args, System.out);
	}

	static void run(String[] args, PrintStream out) throws Exception {
		Options options = parse(args);
		if (options.help) {
			printUsage(out);
			return;
		}

		try (SuperResolution superRes = SuperResolution.create(options.toConfig())) {
			switch (options.command) {
				case "status":
					status(superRes, options, out);
					break;
				case "ensure":
					ensure(superRes, options, out);
					break;
				case "scale":
					report(superRes.scaleImage(options.input, options.output, options.factor), options, out);
					break;
				case "sharpen":
					report(superRes.sharpenImage(options.input, options.output), options, out);
					break;
				default:
					throw new IllegalArgumentException("Unknown command: " + options.command);
			}
		}
	}

	private static void status(SuperResolution superRes, Options options, PrintStream out) throws IOException {
		Map<String, Object> status = new LinkedHashMap<>();
		status.put("provider", superRes.getProviderName());
		status.put("available", superRes.isAvailable());
		status.put("state", superRes.getReadyState());
		if (options.json) {
			out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(status));
		} else {
			out.println("Provider:  " + status.get("provider"));
			out.println("Available: " + status.get("available"));
			out.println("State:     " + status.get("state"));
		}
	}

	private static void ensure(SuperResolution superRes, Options options, PrintStream out) throws Exception {
		String result = superRes.ensureModelReady();
		if (options.json) {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("provider", superRes.getProviderName());
			body.put("result", result);
			out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(body));
		} else {
			out.println(result);
		}
		if (!"Ready".equals(result)) {
			throw new CliRunner.CliFailure(result);
		}
	}

	private static void report(ScaleResult result, Options options, PrintStream out) throws Exception {
		if (options.json) {
			out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
		} else {
			out.println(result.getMessage());
			if (result.isSuccess()) {
				out.println("Output: " + result.getOutputPath());
			}
		}
		if (!result.isSuccess()) {
			throw new CliRunner.CliFailure(result.getMessage());
		}
	}

	static Options parse(String[] args) {
		Options options = new Options();
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			switch (args[i]) {
				case "--provider":
					options.provider = requireValue(args, ++i, "--provider");
					break;
				case "--timeout":
					options.timeoutMillis = parseInt(requireValue(args, ++i, "--timeout"), "--timeout");
					if (options.timeoutMillis < 0) {
						throw new IllegalArgumentException("--timeout must not be negative");
					}
					break;
				case "--factor":
				case "-f":
					options.factor = parseInt(requireValue(args, ++i, "--factor"), "--factor");
					break;
				case "--no-auto-provision":
					options.autoProvision = false;
					break;
				case "--json":
					options.json = true;
					break;
				case "--help":
				case "-h":
					options.help = true;
					return options;
				default:
					if (args[i].startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + args[i]);
					}
					positional.add(args[i]);
			}
		}

		if (positional.isEmpty()) {
			throw new IllegalArgumentException("No command specified, see --help");
		}
		options.command = positional.get(0);
		List<String> operands = positional.subList(1, positional.size());
		switch (options.command) {
			case "status":
			case "ensure":
				if (!operands.isEmpty()) {
					throw new IllegalArgumentException(options.command + " takes no arguments");
				}
				break;
			case "scale":
			case "sharpen":
				if (operands.size() != 2) {
					throw new IllegalArgumentException(options.command + " requires <input> and <output>");
				}
				options.input = operands.get(0);
				options.output = operands.get(1);
				break;
			default:
				throw new IllegalArgumentException("Unknown command: " + options.command);
		}

		if (options.provider != null && CapabilityProviders.find(options.provider).isEmpty()) {
			String known = CapabilityProviders.available().stream()
				.map(CapabilityProvider::name)
				.collect(Collectors.joining(", "));
			throw new IllegalArgumentException("Unknown provider: " + options.provider + " (available: " + known + ")");
		}
		return options;
	}

	private static String requireValue(String[] args, int index, String option) {
		if (index >= args.length) {
			throw new IllegalArgumentException(option + " requires a value");
		}
		return args[index];
	}

	private static int parseInt(String value, String option) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " must be an integer, got '" + value + "'");
		}
	}

	private static void printUsage(PrintStream out) {
		out.println("Usage: SuperResolutionCli [options] <command> [arguments]");
		out.println();
		out.println("Upscale and sharpen images with an on-device super resolution model.");
		out.println();
		out.println("Commands:");
		out.println("  status                   Show provider, availability and readiness state");
		out.println("  ensure                   Provision the model if it is not ready yet");
		out.println("  scale <input> <output>   Scale an image (factor 1-8, default " + DEFAULT_SCALE_FACTOR + ")");
		out.println("  sharpen <input> <output> Sharpen an image without resizing it");
		out.println();
		out.println("Options:");
		out.println("  --factor, -f <n>         Scale factor for 'scale'");
		out.println("  --provider <name>        Capability provider to use (default: best available)");
		out.println("  --timeout <ms>           Give up after this many milliseconds (default: wait)");
		out.println("  --no-auto-provision      Fail instead of provisioning a not-ready model");
		out.println("  --json                   Output in JSON format");
		out.println("  --help, -h               Show this help");
		out.println();
		out.println("Examples:");
		out.println("  SuperResolutionCli status");
		out.println("  SuperResolutionCli scale --factor 4 photo.jpg photo-4x.png");
		out.println("  SuperResolutionCli --json sharpen scan.png scan-sharp.png");
	}

	static final class Options {
		String command;
		String input;
		String output;
		int factor = DEFAULT_SCALE_FACTOR;
		String provider;
		int timeoutMillis = -1;
		boolean autoProvision = true;
		boolean json;
		boolean help;

		SuperResolutionConfig toConfig() {
			SuperResolutionConfig.Builder builder = SuperResolutionConfig.builder();
			if (provider != null) {
				builder.providerName(provider);
			}
			if (timeoutMillis >= 0) {
				builder.timeout(Duration.ofMillis(timeoutMillis));
			}
			if (!autoProvision) {
				builder.autoProvision(false);
			}
			return builder.build();
		}
	}
}
