package bt7s7k7.herbal_ir.common;

import java.time.Duration;
import java.time.Instant;

/** Logs the start of a build phase and, when closed, how long it took. */
public class Stopwatch implements AutoCloseable {
	protected final String name;
	protected final Instant start;

	public Stopwatch(String name) {
		this.name = name;
		Logger.info(name + "...");
		this.start = Instant.now();
	}

	public Duration elapsed() {
		return Duration.between(this.start, Instant.now());
	}

	@Override
	public void close() {
		Logger.success("Done. " + this.name + " took: " + this.elapsed());
	}
}
