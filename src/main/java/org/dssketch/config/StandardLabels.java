package org.dssketch.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.dssketch.model.AxisKind;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The standard label vocabularies: weight and width label names with their user-space values, and the labels of the registered
 * discrete axes. The built-in tables are merged with the user's override files once, when the tables are loaded, and are read-only
 * afterward.
 */
public class StandardLabels {
	private static final Logger log = Logger.getLogger(StandardLabels.class);

	/** The name of the weight and width table file */
	public static final String MAPPINGS_FILE = "unified-mappings.json";
	/** The name of the discrete axis label file */
	public static final String DISCRETE_FILE = "discrete-axis-labels.json";
	/** The environment variable that overrides the user data directory */
	public static final String DATA_DIR_ENV = "DSSKETCH_DATA_DIR";
	/** The system property that overrides the user data directory */
	public static final String DATA_DIR_PROPERTY = "dssketch.data.dir";

	private static class Holder {
		static final StandardLabels INSTANCE = load(getUserDataDir());
	}

	/** One entry of a standard vocabulary */
	public static class StandardLabel {
		/** The canonical name of the label */
		public final String name;
		/** The user-space value of the label */
		public final double userValue;
		/** The OS/2 class value of the label */
		public final int os2Value;

		StandardLabel(String name, double userValue, int os2Value) {
			this.name = name;
			this.userValue = userValue;
			this.os2Value = os2Value;
		}

		@Override
		public String toString() {
			return name + "=" + userValue;
		}
	}

	private final ImmutableMap<AxisKind, ImmutableMap<String, StandardLabel>> theLabels;
	private final ImmutableMap<String, ImmutableMap<Integer, ImmutableList<String>>> theDiscreteLabels;

	private StandardLabels(ImmutableMap<AxisKind, ImmutableMap<String, StandardLabel>> labels,
		ImmutableMap<String, ImmutableMap<Integer, ImmutableList<String>>> discreteLabels) {
		theLabels = labels;
		theDiscreteLabels = discreteLabels;
	}

	/** @return The standard labels for this process, loaded on first use */
	public static StandardLabels get() {
		return Holder.INSTANCE;
	}

	/**
	 * @return The directory the user's override files are read from: the {@value #DATA_DIR_PROPERTY} system property, the
	 *         {@value #DATA_DIR_ENV} environment variable, or <code>dssketch</code> under the user's configuration directory
	 */
	public static Path getUserDataDir() {
		String custom = System.getProperty(DATA_DIR_PROPERTY);
		if (custom == null || custom.isEmpty())
			custom = System.getenv(DATA_DIR_ENV);
		if (custom != null && !custom.isEmpty())
			return Paths.get(custom.replaceFirst("^~", System.getProperty("user.home")));
		String xdg = System.getenv("XDG_CONFIG_HOME");
		if (xdg != null && !xdg.isEmpty())
			return Paths.get(xdg, "dssketch");
		return Paths.get(System.getProperty("user.home"), ".config", "dssketch");
	}

	/**
	 * Loads the built-in tables, merged with any override files in the given directory
	 *
	 * @param userDataDir The directory to look for override files in, or null for none
	 * @return The loaded labels
	 */
	public static StandardLabels load(Path userDataDir) {
		JSONObject mappings = readResource(MAPPINGS_FILE);
		JSONObject discrete = readResource(DISCRETE_FILE);
		if (userDataDir != null) {
			JSONObject userMappings = readUserFile(userDataDir.resolve(MAPPINGS_FILE));
			if (userMappings != null)
				merge(mappings, userMappings);
			JSONObject userDiscrete = readUserFile(userDataDir.resolve(DISCRETE_FILE));
			if (userDiscrete != null)
				merge(discrete, userDiscrete);
		}
		ImmutableMap.Builder<AxisKind, ImmutableMap<String, StandardLabel>> labels = ImmutableMap.builder();
		labels.put(AxisKind.WEIGHT, parseVocabulary((JSONObject) mappings.get(AxisKind.WEIGHT.standardName)));
		labels.put(AxisKind.WIDTH, parseVocabulary((JSONObject) mappings.get(AxisKind.WIDTH.standardName)));
		return new StandardLabels(labels.build(), parseDiscrete(discrete));
	}

	private static JSONObject readResource(String name) {
		try (InputStream in = StandardLabels.class.getResourceAsStream(name)) {
			if (in == null)
				throw new IllegalStateException("Missing built-in label table " + name);
			return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (IOException | ParseException e) {
			throw new IllegalStateException("Could not read built-in label table " + name, e);
		}
	}

	private static JSONObject readUserFile(Path file) {
		if (!Files.isRegularFile(file))
			return null;
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			JSONObject json = parse(reader);
			log.info("Using label overrides from " + file);
			return json;
		} catch (IOException | ParseException | ClassCastException e) {
			log.warn("Could not read label overrides from " + file + ", using built-in labels", e);
			return null;
		}
	}

	private static JSONObject parse(Reader reader) throws IOException, ParseException {
		return (JSONObject) new JSONParser().parse(reader);
	}

	/** Overlays the user's entries onto the built-in ones, one level deep */
	@SuppressWarnings("unchecked")
	private static void merge(JSONObject builtIn, JSONObject user) {
		for (Object key : user.keySet()) {
			Object userValue = user.get(key);
			Object builtInValue = builtIn.get(key);
			if (userValue instanceof JSONObject && builtInValue instanceof JSONObject)
				((JSONObject) builtInValue).putAll((JSONObject) userValue);
			else
				builtIn.put(key, userValue);
		}
	}

	private static ImmutableMap<String, StandardLabel> parseVocabulary(JSONObject json) {
		Map<String, StandardLabel> labels = new LinkedHashMap<>();
		if (json == null)
			return ImmutableMap.of();
		List<String> aliases = new ArrayList<>();
		for (Object key : json.keySet()) {
			JSONObject entry = (JSONObject) json.get(key);
			if (entry.containsKey("alias_of"))
				aliases.add((String) key);
			else {
				Number user = (Number) entry.get("user_space");
				Number os2 = (Number) entry.get("os2");
				labels.put((String) key, new StandardLabel((String) key, user.doubleValue(), os2 == null ? 0 : os2.intValue()));
			}
		}
		Collections.sort(aliases);
		for (String alias : aliases) {
			String target = (String) ((JSONObject) json.get(alias)).get("alias_of");
			StandardLabel resolved = labels.get(target);
			if (resolved == null)
				log.warn("Label alias " + alias + " refers to unknown label " + target);
			else
				labels.put(alias, resolved);
		}
		return ImmutableMap.copyOf(labels);
	}

	private static ImmutableMap<String, ImmutableMap<Integer, ImmutableList<String>>> parseDiscrete(JSONObject json) {
		ImmutableMap.Builder<String, ImmutableMap<Integer, ImmutableList<String>>> discrete = ImmutableMap.builder();
		for (Object tag : json.keySet()) {
			JSONObject values = (JSONObject) json.get(tag);
			ImmutableMap.Builder<Integer, ImmutableList<String>> byValue = ImmutableMap.builder();
			for (Object value : values.keySet()) {
				ImmutableList.Builder<String> names = ImmutableList.builder();
				for (Object name : (JSONArray) values.get(value))
					names.add((String) name);
				byValue.put(Integer.valueOf(value.toString()), names.build());
			}
			discrete.put((String) tag, byValue.build());
		}
		return discrete.build();
	}

	/**
	 * @param kind The axis kind
	 * @param label The label, canonical or alias
	 * @return The standard user-space value of the label, or null if the label is not in the kind's vocabulary
	 */
	public Double getUserValue(AxisKind kind, String label) {
		StandardLabel standard = getLabel(kind, label);
		return standard == null ? null : standard.userValue;
	}

	/**
	 * @param kind The axis kind
	 * @param label The label, canonical or alias
	 * @return The vocabulary entry for the label, or null
	 */
	public StandardLabel getLabel(AxisKind kind, String label) {
		ImmutableMap<String, StandardLabel> vocab = theLabels.get(kind);
		return vocab == null ? null : vocab.get(label);
	}

	/**
	 * @param kind The axis kind
	 * @param userValue The user-space value
	 * @return The canonical label with the given standard value, or null
	 */
	public String getLabelName(AxisKind kind, double userValue) {
		ImmutableMap<String, StandardLabel> vocab = theLabels.get(kind);
		if (vocab == null)
			return null;
		for (Map.Entry<String, StandardLabel> entry : vocab.entrySet()) {
			if (entry.getKey().equals(entry.getValue().name) && entry.getValue().userValue == userValue)
				return entry.getKey();
		}
		return null;
	}

	/**
	 * @param kind The axis kind
	 * @return All labels, canonical and alias, in the kind's vocabulary
	 */
	public Set<String> getLabelNames(AxisKind kind) {
		ImmutableMap<String, StandardLabel> vocab = theLabels.get(kind);
		return vocab == null ? Collections.emptySet() : vocab.keySet();
	}

	/**
	 * @param axisTag The tag of a discrete axis
	 * @param label The label of a point on the axis
	 * @return The value of the labeled point in the discrete table, or null if the label is not known for the axis
	 */
	public Integer getDiscreteValue(String axisTag, String label) {
		ImmutableMap<Integer, ImmutableList<String>> values = theDiscreteLabels.get(axisTag);
		if (values == null)
			return null;
		for (Map.Entry<Integer, ImmutableList<String>> entry : values.entrySet()) {
			if (entry.getValue().contains(label))
				return entry.getKey();
		}
		return null;
	}

	/**
	 * @param axisTag The tag of an axis
	 * @return Whether the discrete table has labels for the axis
	 */
	public boolean hasDiscreteLabels(String axisTag) {
		return theDiscreteLabels.containsKey(axisTag);
	}
}
