package bt7s7k7.herbal_ir.common;

import java.io.IOException;
import java.util.function.Function;

public final class Support {
	private Support() {}

	@FunctionalInterface
	public interface UnsafeFunction<T, R> {
		public R apply(T value) throws Exception;
	}

	public static <T, R> Function<T, R> makeSafe(UnsafeFunction<T, R> unsafeFunction) {
		return value -> {
			try {
				return unsafeFunction.apply(value);
			} catch (Exception e) {
				if (e instanceof RuntimeException runtimeException) throw runtimeException;
				throw new RuntimeException(e);
			}
		};
	}

	/** Parses a TSV integer column, reporting the file and line on failure. */
	public static int parseInt(String value, String file, int line) throws IOException {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException error) {
			throw new IOException("Invalid integer \"" + value + "\" in " + file + " at line " + line, error);
		}
	}

	/** Parses a TSV floating point column, reporting the file and line on failure. */
	public static double parseDouble(String value, String file, int line) throws IOException {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException error) {
			throw new IOException("Invalid number \"" + value + "\" in " + file + " at line " + line, error);
		}
	}
}
