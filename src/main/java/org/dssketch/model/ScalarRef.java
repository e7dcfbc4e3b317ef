package org.dssketch.model;

import java.util.function.Function;

import org.dssketch.io.DssText;

/** A value in DSSketch text which is either a numeric literal or a label to be resolved against an axis */
public abstract class ScalarRef {
	private ScalarRef() {
	}

	/** @return Whether this value is a label rather than a number */
	public abstract boolean isLabel();

	/**
	 * @param labels Resolves a label to its value, returning null for an unknown label
	 * @return The numeric value, or null if this is a label the resolver does not know
	 */
	public abstract Double resolve(Function<String, Double> labels);

	/**
	 * @param token The token to interpret
	 * @return A literal if the token is numeric, otherwise a label
	 */
	public static ScalarRef parse(String token) {
		Double value = DssText.parseNumber(token);
		if (value != null)
			return new Literal(value);
		return new Label(DssText.unquote(token));
	}

	/** A numeric value */
	public static final class Literal extends ScalarRef {
		private final double theValue;

		/** @param value The value */
		public Literal(double value) {
			theValue = value;
		}

		/** @return The value */
		public double getValue() {
			return theValue;
		}

		@Override
		public boolean isLabel() {
			return false;
		}

		@Override
		public Double resolve(Function<String, Double> labels) {
			return theValue;
		}

		@Override
		public String toString() {
			return DssText.formatNumber(theValue);
		}
	}

	/** A label, resolved through an axis's mappings */
	public static final class Label extends ScalarRef {
		private final String theLabel;

		/** @param label The label */
		public Label(String label) {
			theLabel = label;
		}

		/** @return The label */
		public String getLabel() {
			return theLabel;
		}

		@Override
		public boolean isLabel() {
			return true;
		}

		@Override
		public Double resolve(Function<String, Double> labels) {
			return labels.apply(theLabel);
		}

		@Override
		public String toString() {
			return theLabel;
		}
	}
}
