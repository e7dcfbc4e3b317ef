package org.dssketch;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.dssketch.config.DssOptions;
import org.dssketch.io.DssParseException;
import org.dssketch.io.ValidationPolicy;

/** Command-line converter between DSSketch and designspace files */
public class DSSketchMain {
	private static final String USAGE = String.join(System.lineSeparator(), //
		"Usage: dssketch <input.dssketch|input.dss|input.designspace> [options]", //
		"  -o, --output <file>   The file to write (default: the input with the other extension)", //
		"  --no-validation       Do not check that source files exist", //
		"  --matrix | --linear   How avar2 mappings are written (default: matrix)", //
		"  --novars | --vars N   Extract avar2 values used N times into variables (default: 3)", //
		"  --strict | --lenient  Abort on any error, or only on structural and semantic ones (default: strict)", //
		"  --quiet | --verbose   Log only errors, or everything");

	/** @param args The command-line arguments */
	public static void main(String... args) {
		System.exit(run(System.out, System.err, args));
	}

	/**
	 * @param out The stream to print results to
	 * @param err The stream to print problems to
	 * @param args The command-line arguments
	 * @return The exit code: 0 on success, 1 on failure
	 */
	public static int run(PrintStream out, PrintStream err, String... args) {
		Path input = null;
		Path output = null;
		DssOptions options = DssOptions.DEFAULT;
		try {
			for (int i = 0; i < args.length; i++) {
				switch (args[i]) {
				case "-o":
				case "--output":
					output = Paths.get(next(args, ++i, args[i - 1]));
					break;
				case "--no-validation":
					options = options.withSourceValidation(false);
					break;
				case "--matrix":
					options = options.withAvar2Format(DssOptions.Avar2Format.MATRIX);
					break;
				case "--linear":
					options = options.withAvar2Format(DssOptions.Avar2Format.LINEAR);
					break;
				case "--novars":
					options = options.withVariableThreshold(0);
					break;
				case "--vars":
					String count = next(args, ++i, "--vars");
					try {
						options = options.withVariableThreshold(Integer.parseInt(count));
					} catch (NumberFormatException e) {
						throw new IllegalArgumentException("--vars requires a count, not '" + count + "'", e);
					}
					break;
				case "--strict":
					options = options.withPolicy(ValidationPolicy.STRICT);
					break;
				case "--lenient":
					options = options.withPolicy(ValidationPolicy.LENIENT);
					break;
				case "--quiet":
					Logger.getLogger("org.dssketch").setLevel(Level.ERROR);
					break;
				case "--verbose":
					Logger.getLogger("org.dssketch").setLevel(Level.DEBUG);
					break;
				case "-h":
				case "--help":
					out.println(USAGE);
					return 0;
				default:
					if (args[i].startsWith("-"))
						throw new IllegalArgumentException("Unrecognized option: " + args[i]);
					else if (input != null)
						throw new IllegalArgumentException("Only one input file may be given");
					input = Paths.get(args[i]);
				}
			}
			if (input == null)
				throw new IllegalArgumentException("No input file given");
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println(USAGE);
			return 1;
		}

		if (!Files.isRegularFile(input)) {
			err.println("Input file not found: " + input);
			return 1;
		}
		try {
			Path written = DSSketch.convertFile(input, output, options);
			out.println("Wrote " + written);
			return 0;
		} catch (DssParseException e) {
			err.println(e.getMessage());
			return 1;
		} catch (IOException e) {
			err.println("Conversion failed: " + e.getMessage());
			return 1;
		}
	}

	private static String next(String[] args, int index, String option) {
		if (index >= args.length)
			throw new IllegalArgumentException(option + " requires a value");
		return args[index];
	}
}
