package velab;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ElaborationOptions {
	public static final String VERSION = "0.1.0";

	public static final int DEFAULT_MAX_INSTANCE_DEPTH = 64;
	public static final int DEFAULT_MAX_LOOP_ITERATIONS = 4096;

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print every drain cycle. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "Elaborate without running the type checker")
	public boolean noTypecheck = false;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	// fields extracted from the JSON configuration file
	private boolean typecheck = true;
	private int maxInstanceDepth = DEFAULT_MAX_INSTANCE_DEPTH;
	private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;

	private final Options plumeOptions;
	private final String[] remainingArgs;

	/**
	 * Default options, as if no flags and no configuration file had been given.
	 */
	public ElaborationOptions() {
		this(new String[0]);
	}

	public ElaborationOptions(String[] args) {
		plumeOptions = new Options("velab [options] file...", this);
		remainingArgs = plumeOptions.parse(true, args);
	}

	/**
	 * Prints the version or the usage message if either was asked for.
	 *
	 * @return true if something was printed and there is nothing left to do
	 */
	public boolean printInformation(PrintStream out) {
		if (version) {
			out.println("velab version " + VERSION);
			return true;
		}
		if (help) {
			plumeOptions.printUsage(out);
			return true;
		}
		return false;
	}

	public void parse() throws ElaborationOptionException {
		if (printInformation(System.out)) {
			System.exit(0);
		}

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new ElaborationOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new ElaborationOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}

		typecheck = config.optBoolean("typecheck", true);
		JSONObject limits = config.optJSONObject("limits");
		if (limits != null) {
			maxInstanceDepth = limits.optInt("max_instance_depth", DEFAULT_MAX_INSTANCE_DEPTH);
			maxLoopIterations = limits.optInt("max_loop_iterations", DEFAULT_MAX_LOOP_ITERATIONS);
		}
		if (maxInstanceDepth < 1) {
			throw new ElaborationOptionException(configFilePath + ": limits.max_instance_depth must be positive");
		}
		if (maxLoopIterations < 0) {
			throw new ElaborationOptionException(configFilePath + ": limits.max_loop_iterations must not be negative");
		}
	}

	/**
	 * Sets the logger's level from the command line: quiet wins over verbose.
	 */
	public void configureLogging(Logger logger) {
		if (logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
	}

	public boolean isTypecheck() {
		return typecheck && !noTypecheck;
	}

	public int getMaxInstanceDepth() {
		return maxInstanceDepth;
	}

	public int getMaxLoopIterations() {
		return maxLoopIterations;
	}

	public String[] getRemainingArgs() {
		return remainingArgs.clone();
	}
}
