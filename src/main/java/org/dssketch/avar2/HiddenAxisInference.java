package org.dssketch.avar2;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.dssketch.model.Avar2Mapping;

/**
 * Classifies axes as hidden or visible from the avar2 mappings that use them. An axis which only ever appears among mapping
 * outputs is hidden. An axis used as an input anywhere, or not used by avar2 at all, is visible.
 */
public class HiddenAxisInference {
	private HiddenAxisInference() {
	}

	/**
	 * @param mappings The avar2 mappings
	 * @return The tags of the axes that appear only as outputs, in order of first appearance
	 */
	public static Set<String> inferHidden(List<Avar2Mapping> mappings) {
		Set<String> inputs = new LinkedHashSet<>();
		for (Avar2Mapping mapping : mappings)
			inputs.addAll(mapping.getInput().keySet());
		Set<String> hidden = new LinkedHashSet<>();
		for (Avar2Mapping mapping : mappings) {
			for (String tag : mapping.getOutput().keySet()) {
				if (!inputs.contains(tag))
					hidden.add(tag);
			}
		}
		return hidden;
	}
}
