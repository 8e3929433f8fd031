package de.kherud.superres.util;

/**
 * Runs command line applications with consistent exit codes.
 *
 * Applications throw instead of calling {@link System#exit}, which keeps their
 * entry points testable:
 * <ul>
 *   <li>0: success</li>
 *   <li>1: invalid arguments, or an operation that completed with a failed result</li>
 *   <li>2: unexpected error</li>
 * </ul>
 */
public final class CliRunner {

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_FATAL = 2;

	private CliRunner() {
	}

	/**
	 * Interface for CLI applications that can throw exceptions.
	 */
	@FunctionalInterface
	public interface CliApplication {
		void run(String[] args) throws Exception;
	}

	/**
	 * Signals a handled failure whose outcome has already been reported to the user.
	 */
	public static class CliFailure extends Exception {
		private final int exitCode;

		public CliFailure(String message) {
			this(message, EXIT_FAILURE);
		}

		public CliFailure(String message, int exitCode) {
			super(message);
			this.exitCode = exitCode;
		}

		public int getExitCode() {
			return exitCode;
		}
	}

	/**
	 * Run the application and terminate the JVM with its exit code.
	 */
	public static void runWithExit(CliApplication app, String[] args) {
		int code = runWithoutExit(app, args);
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}

	/**
	 * Run the application without terminating the JVM.
	 *
	 * @return the exit code
	 */
	public static int runWithoutExit(CliApplication app, String[] args) {
		try {
			app.run(args);
			return EXIT_OK;
		} catch (CliFailure e) {
			return e.getExitCode();
		} catch (IllegalArgumentException e) {
			System.err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (Exception e) {
			System.err.println("Fatal error: " + e.getMessage());
			e.printStackTrace();
			return EXIT_FATAL;
		}
	}
}
