package org.dssketch.ufo;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.input.sax.XMLReaderSAX2Factory;

/** Reads the top-level dictionary of an XML property list, as found in UFO font sources */
public class PlistReader {
	private static final String LOAD_DTD_FEATURE = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

	private static final ThreadLocal<SAXBuilder> SAX_BUILDERS = ThreadLocal.withInitial(() -> {
		SAXBuilder builder = new SAXBuilder(new XMLReaderSAX2Factory(false));
		// Plists name an Apple DTD that must not be fetched
		builder.setFeature(LOAD_DTD_FEATURE, false);
		return builder;
	});

	private PlistReader() {
	}

	/**
	 * @param file The property list file
	 * @return The entries of the top-level dictionary, in file order, keyed by their key text
	 * @throws IOException If the file cannot be read or is not a property list with a top-level dictionary
	 */
	public static Map<String, Element> readDict(Path file) throws IOException {
		Element root;
		try (InputStream in = Files.newInputStream(file)) {
			root = SAX_BUILDERS.get().build(in).getRootElement();
		} catch (JDOMException e) {
			throw new IOException("Could not read XML file " + file, e);
		}
		Element dict = root.getName().equals("dict") ? root : root.getChild("dict");
		if (dict == null)
			throw new IOException("Property list " + file + " has no top-level dict");
		Map<String, Element> entries = new LinkedHashMap<>();
		List<Element> children = dict.getChildren();
		for (int i = 0; i + 1 < children.size(); i += 2) {
			Element key = children.get(i);
			if (!key.getName().equals("key"))
				throw new IOException("Malformed property list " + file + ": expected <key>, found <" + key.getName() + ">");
			entries.put(key.getTextTrim(), children.get(i + 1));
		}
		return entries;
	}

	/**
	 * @param entries The dictionary entries
	 * @param key The key to get
	 * @return The text of the value under the given key, or null if there is none or it is not a string
	 */
	public static String getString(Map<String, Element> entries, String key) {
		Element value = entries.get(key);
		if (value == null || !value.getName().equals("string"))
			return null;
		return value.getText();
	}
}
