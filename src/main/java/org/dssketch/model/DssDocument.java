package org.dssketch.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * The complete model of a design space: axes, sources, rules, instances and avar2 mappings. Documents are immutable. They are
 * assembled by a {@link Builder}, which seals itself when the document is built.
 */
public class DssDocument {
	private final String theFamily;
	private final String thePath;
	private final String theSuffix;
	private final ImmutableList<Axis> theAxes;
	private final ImmutableList<Axis> theHiddenAxes;
	private final ImmutableList<String> theSourceAxisOrder;
	private final ImmutableList<Source> theSources;
	private final ImmutableList<Rule> theRules;
	private final InstanceMode theInstanceMode;
	private final ImmutableList<Instance> theInstances;
	private final ImmutableList<String> theSkips;
	private final ImmutableList<Avar2Variable> theVariables;
	private final ImmutableList<Avar2Mapping> theAvar2Mappings;

	private DssDocument(Builder builder) {
		theFamily = builder.theFamily;
		thePath = builder.thePath;
		theSuffix = builder.theSuffix;
		theAxes = ImmutableList.copyOf(builder.theAxes);
		theHiddenAxes = ImmutableList.copyOf(builder.theHiddenAxes);
		theSourceAxisOrder = ImmutableList.copyOf(builder.theSourceAxisOrder);
		theSources = ImmutableList.copyOf(builder.theSources);
		theRules = ImmutableList.copyOf(builder.theRules);
		theInstanceMode = builder.theInstanceMode;
		theInstances = ImmutableList.copyOf(builder.theInstances);
		theSkips = ImmutableList.copyOf(builder.theSkips);
		theVariables = ImmutableList.copyOf(builder.theVariables);
		theAvar2Mappings = ImmutableList.copyOf(builder.theAvar2Mappings);
	}

	/** @return The family name, or null if it has not been given or resolved */
	public String getFamily() {
		return theFamily;
	}

	/** @return The directory containing the sources, or null */
	public String getPath() {
		return thePath;
	}

	/** @return The glyph suffix for the document, or null */
	public String getSuffix() {
		return theSuffix;
	}

	/** @return The visible axes, in declaration order */
	public List<Axis> getAxes() {
		return theAxes;
	}

	/** @return The hidden axes, in declaration order */
	public List<Axis> getHiddenAxes() {
		return theHiddenAxes;
	}

	/** @return The visible axes followed by the hidden axes */
	public List<Axis> getAllAxes() {
		return ImmutableList.<Axis> builder().addAll(theAxes).addAll(theHiddenAxes).build();
	}

	/**
	 * @param tagOrName The tag or name of the axis
	 * @return The visible or hidden axis with the given tag or name, or null
	 */
	public Axis getAxis(String tagOrName) {
		for (Axis axis : theAxes) {
			if (axis.getTag().equals(tagOrName))
				return axis;
		}
		for (Axis axis : theHiddenAxes) {
			if (axis.getTag().equals(tagOrName))
				return axis;
		}
		for (Axis axis : theAxes) {
			if (axis.isIdentifiedBy(tagOrName))
				return axis;
		}
		for (Axis axis : theHiddenAxes) {
			if (axis.isIdentifiedBy(tagOrName))
				return axis;
		}
		return null;
	}

	/**
	 * @param label The mapping label to look for
	 * @return The axis that has a mapping with the given label, or null
	 */
	public Axis getAxisForLabel(String label) {
		for (Axis axis : getAllAxes()) {
			if (axis.getMapping(label) != null)
				return axis;
		}
		return null;
	}

	/** @return The tags of the axes in the order positional source coordinates are given */
	public List<String> getSourceAxisOrder() {
		if (!theSourceAxisOrder.isEmpty())
			return theSourceAxisOrder;
		List<String> tags = new ArrayList<>(theAxes.size());
		for (Axis axis : theAxes)
			tags.add(axis.getTag());
		return tags;
	}

	/** @return Whether the positional source axis order was declared explicitly */
	public boolean hasExplicitSourceAxisOrder() {
		return !theSourceAxisOrder.isEmpty();
	}

	/** @return The sources of the document */
	public List<Source> getSources() {
		return theSources;
	}

	/** @return The base source, or null if there is none */
	public Source getBaseSource() {
		for (Source source : theSources) {
			if (source.isBase())
				return source;
		}
		return null;
	}

	/** @return The glyph substitution rules */
	public List<Rule> getRules() {
		return theRules;
	}

	/** @return How the instances are determined */
	public InstanceMode getInstanceMode() {
		return theInstanceMode;
	}

	/** @return The explicitly declared instances */
	public List<Instance> getInstances() {
		return theInstances;
	}

	/** @return The style names to leave out of automatically generated instances */
	public List<String> getSkips() {
		return theSkips;
	}

	/** @return The avar2 variables */
	public List<Avar2Variable> getVariables() {
		return theVariables;
	}

	/**
	 * @param name The name of the variable, without '$'
	 * @return The variable with the given name, or null
	 */
	public Avar2Variable getVariable(String name) {
		for (Avar2Variable variable : theVariables) {
			if (variable.getName().equals(name))
				return variable;
		}
		return null;
	}

	/** @return The avar2 mappings */
	public List<Avar2Mapping> getAvar2Mappings() {
		return theAvar2Mappings;
	}

	/** @return A new, unsealed builder initialized with this document's content */
	public Builder toBuilder() {
		Builder builder = new Builder();
		builder.theFamily = theFamily;
		builder.thePath = thePath;
		builder.theSuffix = theSuffix;
		builder.theAxes.addAll(theAxes);
		builder.theHiddenAxes.addAll(theHiddenAxes);
		builder.theSourceAxisOrder.addAll(theSourceAxisOrder);
		builder.theSources.addAll(theSources);
		builder.theRules.addAll(theRules);
		builder.theInstanceMode = theInstanceMode;
		builder.theInstances.addAll(theInstances);
		builder.theSkips.addAll(theSkips);
		builder.theVariables.addAll(theVariables);
		builder.theAvar2Mappings.addAll(theAvar2Mappings);
		return builder;
	}

	/** @return A new, empty document builder */
	public static Builder build() {
		return new Builder();
	}

	@Override
	public int hashCode() {
		return Objects.hash(theFamily, theAxes, theHiddenAxes, theSources, theRules, theAvar2Mappings);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof DssDocument))
			return false;
		DssDocument other = (DssDocument) obj;
		return Objects.equals(theFamily, other.theFamily) && Objects.equals(thePath, other.thePath)
			&& Objects.equals(theSuffix, other.theSuffix) && theAxes.equals(other.theAxes) && theHiddenAxes.equals(other.theHiddenAxes)
			&& theSourceAxisOrder.equals(other.theSourceAxisOrder) && theSources.equals(other.theSources)
			&& theRules.equals(other.theRules) && theInstanceMode == other.theInstanceMode && theInstances.equals(other.theInstances)
			&& theSkips.equals(other.theSkips) && theVariables.equals(other.theVariables)
			&& theAvar2Mappings.equals(other.theAvar2Mappings);
	}

	@Override
	public String toString() {
		return "DSSketch document " + theFamily + " (" + theAxes.size() + " axes, " + theHiddenAxes.size() + " hidden, "
			+ theSources.size() + " sources)";
	}

	/** Assembles a {@link DssDocument}. A builder can only be used once: after {@link #build()}, it rejects modification. */
	public static class Builder {
		private String theFamily;
		private String thePath;
		private String theSuffix;
		private final List<Axis> theAxes = new ArrayList<>();
		private final List<Axis> theHiddenAxes = new ArrayList<>();
		private final List<String> theSourceAxisOrder = new ArrayList<>();
		private final List<Source> theSources = new ArrayList<>();
		private final List<Rule> theRules = new ArrayList<>();
		private InstanceMode theInstanceMode = InstanceMode.AUTO;
		private final List<Instance> theInstances = new ArrayList<>();
		private final List<String> theSkips = new ArrayList<>();
		private final List<Avar2Variable> theVariables = new ArrayList<>();
		private final List<Avar2Mapping> theAvar2Mappings = new ArrayList<>();
		private boolean isSealed;

		Builder() {
		}

		/** @return Whether {@link #build()} has been called on this builder */
		public boolean isSealed() {
			return isSealed;
		}

		private void checkSealed() {
			if (isSealed)
				throw new IllegalStateException("This document has already been built and cannot be modified");
		}

		/**
		 * @param family The family name
		 * @return This builder
		 */
		public Builder withFamily(String family) {
			checkSealed();
			theFamily = family;
			return this;
		}

		/** @return The family name set so far */
		public String getFamily() {
			return theFamily;
		}

		/**
		 * @param path The directory containing the sources
		 * @return This builder
		 */
		public Builder withPath(String path) {
			checkSealed();
			thePath = path;
			return this;
		}

		/**
		 * @param suffix The glyph suffix for the document
		 * @return This builder
		 */
		public Builder withSuffix(String suffix) {
			checkSealed();
			theSuffix = suffix;
			return this;
		}

		/**
		 * @param axis The axis to add, to the hidden axes if it is {@link Axis#isHidden() hidden}
		 * @return This builder
		 */
		public Builder withAxis(Axis axis) {
			checkSealed();
			if (axis.isHidden())
				theHiddenAxes.add(axis);
			else
				theAxes.add(axis);
			return this;
		}

		/**
		 * @param index The index of the axis to replace among all axes, visible then hidden
		 * @param axis The replacement axis
		 * @return This builder
		 */
		public Builder replaceAxis(int index, Axis axis) {
			checkSealed();
			if (index < theAxes.size())
				theAxes.set(index, axis);
			else
				theHiddenAxes.set(index - theAxes.size(), axis);
			return this;
		}

		/** @return The visible axes added so far */
		public List<Axis> getAxes() {
			return theAxes;
		}

		/** @return The hidden axes added so far */
		public List<Axis> getHiddenAxes() {
			return theHiddenAxes;
		}

		/**
		 * Moves every axis whose tag is in the given collection to the hidden axes, and every other axis to the visible ones
		 *
		 * @param hiddenTags The tags of the axes that should be hidden
		 * @return This builder
		 */
		public Builder withHiddenTags(Collection<String> hiddenTags) {
			checkSealed();
			List<Axis> all = new ArrayList<>(theAxes);
			all.addAll(theHiddenAxes);
			theAxes.clear();
			theHiddenAxes.clear();
			for (Axis axis : all)
				withAxis(axis.withHidden(hiddenTags.contains(axis.getTag())));
			return this;
		}

		/**
		 * @param tags The tags of the axes in the order positional source coordinates are given
		 * @return This builder
		 */
		public Builder withSourceAxisOrder(List<String> tags) {
			checkSealed();
			theSourceAxisOrder.clear();
			theSourceAxisOrder.addAll(tags);
			return this;
		}

		/** @return The declared positional axis order, or the tags of the visible axes if none was declared */
		public List<String> getSourceAxisOrder() {
			if (!theSourceAxisOrder.isEmpty())
				return theSourceAxisOrder;
			List<String> tags = new ArrayList<>(theAxes.size());
			for (Axis axis : theAxes)
				tags.add(axis.getTag());
			return tags;
		}

		/**
		 * @param source The source to add
		 * @return This builder
		 */
		public Builder withSource(Source source) {
			checkSealed();
			theSources.add(source);
			return this;
		}

		/** @return The sources added so far */
		public List<Source> getSources() {
			return theSources;
		}

		/**
		 * @param rule The rule to add
		 * @return This builder
		 */
		public Builder withRule(Rule rule) {
			checkSealed();
			theRules.add(rule);
			return this;
		}

		/** @return The rules added so far */
		public List<Rule> getRules() {
			return theRules;
		}

		/**
		 * @param rules The rules to use instead of the ones added so far
		 * @return This builder
		 */
		public Builder withRules(List<Rule> rules) {
			checkSealed();
			theRules.clear();
			theRules.addAll(rules);
			return this;
		}

		/**
		 * @param mode How the instances are determined
		 * @return This builder
		 */
		public Builder withInstanceMode(InstanceMode mode) {
			checkSealed();
			theInstanceMode = mode;
			return this;
		}

		/**
		 * @param instance The explicit instance to add
		 * @return This builder
		 */
		public Builder withInstance(Instance instance) {
			checkSealed();
			theInstances.add(instance);
			return this;
		}

		/**
		 * @param skip The style name to leave out of automatically generated instances
		 * @return This builder
		 */
		public Builder withSkip(String skip) {
			checkSealed();
			theSkips.add(skip);
			return this;
		}

		/**
		 * @param variable The avar2 variable to add
		 * @return This builder
		 */
		public Builder withVariable(Avar2Variable variable) {
			checkSealed();
			theVariables.add(variable);
			return this;
		}

		/** @return The avar2 variables added so far */
		public List<Avar2Variable> getVariables() {
			return theVariables;
		}

		/**
		 * @param mapping The avar2 mapping to add
		 * @return This builder
		 */
		public Builder withAvar2Mapping(Avar2Mapping mapping) {
			checkSealed();
			theAvar2Mappings.add(mapping);
			return this;
		}

		/** @return The avar2 mappings added so far */
		public List<Avar2Mapping> getAvar2Mappings() {
			return theAvar2Mappings;
		}

		/** @return The document, after which this builder is sealed */
		public DssDocument build() {
			checkSealed();
			isSealed = true;
			return new DssDocument(this);
		}
	}
}
