package org.dssketch;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.dssketch.config.DssOptions;
import org.dssketch.io.DssParseException;
import org.dssketch.model.Axis;
import org.dssketch.model.DssDocument;
import org.dssketch.model.InstanceMode;
import org.dssketch.ufo.UfoFixtures;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.io.ByteStreams;

/** Tests {@link DSSketch} */
public class DSSketchTest {
	private static final String FAMILYLESS = String.join("\n", //
		"path masters", //
		"axes", //
		"    wght 100:400:900", //
		"        Thin > 100", //
		"        Regular > 400 @elidable", //
		"        Black > 900", //
		"sources", //
		"    Ufo-Regular [Regular] @base", //
		"    Ufo-Black [Black]", //
		"rules", //
		"    dollar* > .rvrn (weight >= 700)", //
		"");

	/** The directory the files are written to */
	@Rule
	public TemporaryFolder theFolder = new TemporaryFolder();

	private Path theDir;

	/** @throws IOException If the files cannot be written */
	@Before
	public void createSources() throws IOException {
		theDir = theFolder.getRoot().toPath();
		UfoFixtures.createUfo(theDir.resolve("masters/Ufo-Regular.ufo"), "Ufo Sans", "A", "cent", "dollar", "dollar.rvrn");
		UfoFixtures.createUfo(theDir.resolve("masters/Ufo-Black.ufo"), null, "A", "dollar", "dollar.rvrn");
	}

	private Path write(String fileName, String text) throws IOException {
		Path file = theDir.resolve(fileName);
		Files.write(file, text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static String read(Path file) throws IOException {
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

	/**
	 * Converts a file to designspace and back, reading the family name and glyph names from the UFO sources
	 *
	 * @throws IOException If a file cannot be read or written
	 * @throws DssParseException If a file is rejected
	 */
	@Test
	public void testConvertFile() throws IOException, DssParseException {
		Path dss = write("Ufo.dssketch", FAMILYLESS);
		Path designspace = DSSketch.convertFile(dss, null, DssOptions.DEFAULT);
		Assert.assertEquals(theDir.resolve("Ufo.designspace"), designspace);
		String xml = read(designspace);
		assertThat(xml, containsString("familyname=\"Ufo Sans\""));
		assertThat(xml, containsString("<sub name=\"dollar\" with=\"dollar.rvrn\" />"));
		assertThat(xml, containsString("filename=\"masters/Ufo-Black.ufo\""));

		Path back = DSSketch.convertFile(designspace, theDir.resolve("Back.dss"), DssOptions.DEFAULT);
		Assert.assertEquals(theDir.resolve("Back.dss"), back);
		String text = read(back);
		assertThat(text, containsString("family \"Ufo Sans\"\n"));
		assertThat(text, containsString("path masters\n"));
		assertThat(text, containsString(".rvrn (weight >= 700)"));
		assertThat(text, not(containsString("dollar.rvrn")));
	}

	/**
	 * Missing sources are fatal only while sources are validated
	 *
	 * @throws IOException If a file cannot be read or written
	 * @throws DssParseException If the file is rejected without source validation
	 */
	@Test
	public void testSourceValidation() throws IOException, DssParseException {
		Path dss = write("Missing.dss", "family Missing\n" + FAMILYLESS.replace("Ufo-Black", "Ufo-Bold"));
		try {
			DSSketch.convertFile(dss, null, DssOptions.DEFAULT);
			Assert.fail("A missing source must be rejected while sources are validated");
		} catch (DssParseException e) {
			assertThat(e.getMessage(), containsString("Source file not found: masters/Ufo-Bold.ufo"));
		}
		Path designspace = DSSketch.convertFile(dss, null, DssOptions.DEFAULT.withSourceValidation(false));
		Assert.assertEquals("Missing.designspace", designspace.getFileName().toString());
	}

	@Test
	public void testUnknownExtension() throws IOException, DssParseException {
		Path txt = write("Ufo.txt", FAMILYLESS);
		try {
			DSSketch.convertFile(txt, null, DssOptions.DEFAULT);
			Assert.fail("Files of unknown type must be rejected");
		} catch (IOException e) {
			assertThat(e.getMessage(), containsString("Unrecognized file type"));
		}
	}

	/**
	 * Tests the text-level conversions, which do not touch the file system
	 *
	 * @throws DssParseException If the document is rejected
	 */
	@Test
	public void testTextConversion() throws DssParseException {
		DssDocument doc = DSSketch.parseDss("family Text\n" + FAMILYLESS.replace("dollar*", "dollar"), DssOptions.DEFAULT);
		String xml = DSSketch.toDesignSpace(doc, null, DssOptions.DEFAULT);
		DssDocument read = DSSketch.fromDesignSpace(xml, DssOptions.DEFAULT);
		Assert.assertEquals(doc.getAxes(), read.getAxes());
		Assert.assertEquals(doc.getSources(), read.getSources());
		Assert.assertEquals(InstanceMode.AUTO, read.getInstanceMode());

		String text = DSSketch.writeDss(read, DssOptions.DEFAULT);
		assertThat(text, containsString("    dollar > .rvrn (weight >= 700)\n"));
		Assert.assertEquals(doc.getSources(), DSSketch.parseDss(text, DssOptions.DEFAULT).getSources());
	}

	/**
	 * Tests that the fixture family survives conversion to designspace XML and back, and that writing it is stable
	 *
	 * @throws IOException If the fixture cannot be read
	 * @throws DssParseException If the fixture or a converted form is rejected
	 */
	@Test
	public void testFixtureRoundTrip() throws IOException, DssParseException {
		String fixture;
		try (InputStream in = DSSketchTest.class.getResourceAsStream("FixtureSans.dssketch")) {
			Assert.assertNotNull("Missing fixture", in);
			fixture = new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
		}
		DssDocument doc = DSSketch.parseDss(fixture, DssOptions.DEFAULT);
		Assert.assertEquals(3, doc.getAxes().size());
		Assert.assertEquals("XOPQ", doc.getHiddenAxes().get(0).getTag());

		DssDocument read = DSSketch.fromDesignSpace(DSSketch.toDesignSpace(doc, null, DssOptions.DEFAULT), DssOptions.DEFAULT);
		Assert.assertEquals(doc.getAxes().size(), read.getAxes().size());
		for (int i = 0; i < doc.getAxes().size(); i++) {
			Axis axis = doc.getAxes().get(i);
			Assert.assertEquals(axis.getTag(), axis.getMappings(), read.getAxes().get(i).getMappings());
		}
		Assert.assertEquals(doc.getHiddenAxes(), read.getHiddenAxes());
		Assert.assertEquals(doc.getSources(), read.getSources());
		Assert.assertEquals(doc.getAvar2Mappings(), read.getAvar2Mappings());

		String written = DSSketch.writeDss(read, DssOptions.DEFAULT);
		DssDocument reparsed = DSSketch.parseDss(written, DssOptions.DEFAULT);
		Assert.assertEquals(written, DSSketch.writeDss(reparsed, DssOptions.DEFAULT));
		Assert.assertEquals(doc.getSources(), reparsed.getSources());
		Assert.assertEquals(doc.getAxes(), reparsed.getAxes());
	}
}
