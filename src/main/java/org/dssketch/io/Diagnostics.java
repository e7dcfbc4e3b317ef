package org.dssketch.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Collects the errors and warnings found while building or converting a document. Each reported issue is checked against a
 * {@link ValidationPolicy}, and a {@link DssParseException} is thrown as soon as an issue the policy considers fatal arrives.
 */
public class Diagnostics {
	private static final Logger log = Logger.getLogger(Diagnostics.class);

	/** Severity of a reported issue */
	public enum Severity {
		/** Something suspicious which does not keep the document from being produced */
		WARNING,
		/** Something wrong with the document */
		ERROR
	}

	/** What kind of problem an issue describes */
	public enum Category {
		/** Missing required sections, missing or duplicate base source, unrecognizable keywords */
		STRUCTURAL(true),
		/** Label or axis resolution failures, out-of-range values, duplicate labels */
		SEMANTIC(true),
		/** Typos, malformed values, bracket mismatches and the like */
		CONTENT(false),
		/** Hints which are not problems in themselves, like unused skip entries */
		ADVISORY(false);

		private final boolean isAlwaysFatal;

		private Category(boolean alwaysFatal) {
			isAlwaysFatal = alwaysFatal;
		}

		/** @return Whether errors of this category stop processing regardless of the validation mode */
		public boolean isAlwaysFatal() {
			return isAlwaysFatal;
		}
	}

	/** A reported issue */
	public static class Issue {
		/** Where in the text the issue was found, or null */
		public final SourcePosition position;
		/** The severity of this issue */
		public final Severity severity;
		/** The kind of this issue */
		public final Category category;
		/** The message for this issue */
		public final String message;
		/** A correction to offer the user, or null */
		public final String suggestion;

		/**
		 * @param position Where in the text the issue was found, or null
		 * @param severity The severity of this issue
		 * @param category The kind of this issue
		 * @param message The message for this issue
		 * @param suggestion A correction to offer the user, or null
		 */
		public Issue(SourcePosition position, Severity severity, Category category, String message, String suggestion) {
			this.position = position;
			this.severity = severity;
			this.category = category;
			this.message = message;
			this.suggestion = suggestion;
		}

		@Override
		public String toString() {
			StringBuilder str = new StringBuilder();
			str.append(severity).append(": ");
			if (position != null && position.isKnown())
				str.append(position).append(' ');
			str.append(message);
			if (suggestion != null)
				str.append(" (did you mean '").append(suggestion).append("'?)");
			return str.toString();
		}
	}

	private final ValidationPolicy thePolicy;
	private final List<Issue> theIssues;

	/** @param policy The policy deciding which issues abort processing */
	public Diagnostics(ValidationPolicy policy) {
		thePolicy = policy;
		theIssues = new ArrayList<>();
	}

	/** @return The policy deciding which issues abort processing */
	public ValidationPolicy getPolicy() {
		return thePolicy;
	}

	/**
	 * @param issue The issue to report
	 * @return This diagnostics collector
	 * @throws DssParseException If the policy considers the issue fatal
	 */
	public Diagnostics report(Issue issue) throws DssParseException {
		theIssues.add(issue);
		if (thePolicy.isFatal(issue))
			throw DssParseException.forIssues("Invalid document", issue, theIssues);
		if (issue.severity == Severity.WARNING)
			log.warn(issue);
		else
			log.error(issue);
		return this;
	}

	/**
	 * @param category The kind of the error
	 * @param position Where the error was found
	 * @param message The error message
	 * @return This diagnostics collector
	 * @throws DssParseException If the policy considers the error fatal
	 */
	public Diagnostics error(Category category, SourcePosition position, String message) throws DssParseException {
		return report(new Issue(position, Severity.ERROR, category, message, null));
	}

	/**
	 * @param category The kind of the error
	 * @param position Where the error was found
	 * @param message The error message
	 * @param suggestion A suggested correction, or null
	 * @return This diagnostics collector
	 * @throws DssParseException If the policy considers the error fatal
	 */
	public Diagnostics error(Category category, SourcePosition position, String message, String suggestion)
		throws DssParseException {
		return report(new Issue(position, Severity.ERROR, category, message, suggestion));
	}

	/**
	 * @param category The kind of the warning
	 * @param position Where the warning was found
	 * @param message The warning message
	 * @return This diagnostics collector
	 * @throws DssParseException If the policy considers the warning fatal
	 */
	public Diagnostics warn(Category category, SourcePosition position, String message) throws DssParseException {
		return report(new Issue(position, Severity.WARNING, category, message, null));
	}

	/** @return All issues reported so far, in report order */
	public List<Issue> getIssues() {
		return Collections.unmodifiableList(theIssues);
	}

	/** @return All errors reported so far */
	public List<Issue> getErrors() {
		return filter(Severity.ERROR);
	}

	/** @return All warnings reported so far */
	public List<Issue> getWarnings() {
		return filter(Severity.WARNING);
	}

	/** @return Whether any error has been reported */
	public boolean hasErrors() {
		for (Issue issue : theIssues) {
			if (issue.severity == Severity.ERROR)
				return true;
		}
		return false;
	}

	private List<Issue> filter(Severity severity) {
		List<Issue> found = new ArrayList<>();
		for (Issue issue : theIssues) {
			if (issue.severity == severity)
				found.add(issue);
		}
		return Collections.unmodifiableList(found);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		for (Issue issue : theIssues) {
			if (str.length() > 0)
				str.append('\n');
			str.append(issue);
		}
		return str.toString();
	}
}
