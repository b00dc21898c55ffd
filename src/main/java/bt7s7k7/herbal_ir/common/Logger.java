package bt7s7k7.herbal_ir.common;

public final class Logger {
	private Logger() {}

	private static volatile boolean verbose = false;

	public static void setVerbose(boolean value) {
		verbose = value;
	}

	public static void text(String msg) {
		System.out.println(msg);
	}

	/** Only printed when verbose output is enabled in the settings. */
	public static void debug(String msg) {
		if (!verbose) return;
		System.out.println("\u001b[2m" + msg + "\u001b[0m");
	}

	public static void success(String msg) {
		System.out.println("\u001b[92m" + msg + "\u001b[0m");
	}

	public static void info(String msg) {
		System.out.println("\u001b[36m" + msg + "\u001b[0m");
	}

	public static void warn(String msg) {
		System.out.println("\u001b[93m" + msg + "\u001b[0m");
	}

	public static void error(String msg) {
		System.err.println("\u001b[91m" + msg + "\u001b[0m");
	}
}
