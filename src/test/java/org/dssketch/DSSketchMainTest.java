package org.dssketch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Tests the exit codes and output of {@link DSSketchMain} */
public class DSSketchMainTest {
	/** The directory the files are written to */
	@Rule
	public TemporaryFolder theFolder = new TemporaryFolder();

	private final ByteArrayOutputStream theOut = new ByteArrayOutputStream();
	private final ByteArrayOutputStream theErr = new ByteArrayOutputStream();

	private int run(String... args) {
		try (PrintStream out = new PrintStream(theOut, true); PrintStream err = new PrintStream(theErr, true)) {
			return DSSketchMain.run(out, err, args);
		}
	}

	private String out() {
		return new String(theOut.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(theErr.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testHelp() {
		Assert.assertEquals(0, run("--help"));
		assertThat(out(), containsString("Usage: dssketch"));
	}

	@Test
	public void testBadArguments() {
		Assert.assertEquals(1, run());
		assertThat(err(), containsString("No input file given"));
		Assert.assertEquals(1, run("--bogus", "a.dss"));
		assertThat(err(), containsString("Unrecognized option: --bogus"));
		Assert.assertEquals(1, run("a.dss", "--vars", "many"));
		assertThat(err(), containsString("--vars requires a count, not 'many'"));
		Assert.assertEquals(1, run("a.dss", "-o"));
		assertThat(err(), containsString("-o requires a value"));
		Assert.assertEquals(1, run("a.dss", "b.dss"));
		assertThat(err(), containsString("Only one input file may be given"));
	}

	@Test
	public void testMissingInput() {
		Assert.assertEquals(1, run(theFolder.getRoot().toPath().resolve("Nothing.dssketch").toString()));
		assertThat(err(), containsString("Input file not found"));
	}

	/** @throws IOException If the input cannot be written */
	@Test
	public void testConvert() throws IOException {
		Path input = theFolder.getRoot().toPath().resolve("Cli.dss");
		Files.write(input, String.join("\n", //
			"family Cli", //
			"axes", //
			"    wght 100:400:900", //
			"sources", //
			"    Cli-Regular [400] @base", //
			"").getBytes(StandardCharsets.UTF_8));
		Path output = input.resolveSibling("Out.designspace");
		Assert.assertEquals(0, run(input.toString(), "--no-validation", "--lenient", "-o", output.toString()));
		assertThat(out(), containsString("Wrote " + output));
		assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8), containsString("<designspace format=\"5.0\">"));

		// The source is missing
		Assert.assertEquals(1, run(input.toString(), "--strict"));
		assertThat(err(), containsString("Source file not found: Cli-Regular.ufo"));
	}

	/** @throws IOException If the input cannot be written */
	@Test
	public void testInvalidInput() throws IOException {
		Path input = theFolder.getRoot().toPath().resolve("Bad.dssketch");
		Files.write(input, "family Bad\nsources\n    Bad-Regular [400] @base\n".getBytes(StandardCharsets.UTF_8));
		Assert.assertEquals(1, run(input.toString(), "--quiet"));
		assertThat(err(), containsString("Missing 'axes' section"));
	}
}
