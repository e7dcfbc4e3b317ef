package org.dssketch.io;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.text.ParseException;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** Thrown when DSSketch text or a designspace document cannot be turned into a valid document */
public class DssParseException extends ParseException {
	private final ImmutableList<Diagnostics.Issue> theIssues;

	/**
	 * @param message The message for the exception
	 * @param position The position of the error, or null if unknown
	 */
	public DssParseException(String message, SourcePosition position) {
		this(message, position, null);
	}

	/**
	 * @param message The message for the exception
	 * @param position The position of the error, or null if unknown
	 * @param cause The cause of the exception
	 */
	public DssParseException(String message, SourcePosition position, Throwable cause) {
		super(message, position == null ? 0 : position.getLineNumber());
		if (cause != null)
			initCause(cause);
		theIssues = ImmutableList.of(new Diagnostics.Issue(position, Diagnostics.Severity.ERROR,
			Diagnostics.Category.STRUCTURAL, message, null));
	}

	private DssParseException(String message, List<Diagnostics.Issue> issues, int lineNumber) {
		super(message, lineNumber);
		theIssues = ImmutableList.copyOf(issues);
	}

	/** @return All issues reported up to and including the one that caused this exception */
	public List<Diagnostics.Issue> getIssues() {
		return theIssues;
	}

	/** @return The line number of the fatal issue, or zero if it is not tied to a line */
	public int getLineNumber() {
		return getErrorOffset();
	}

	@Override
	public void printStackTrace(PrintStream s) {
		s.println(getMessage());
		if (getCause() != null) {
			s.print("Caused by: ");
			getCause().printStackTrace(s);
		}
	}

	@Override
	public void printStackTrace(PrintWriter s) {
		s.println(getMessage());
		if (getCause() != null) {
			s.print("Caused by: ");
			getCause().printStackTrace(s);
		}
	}

	/**
	 * @param message The root message for the exception
	 * @param fatal The issue that stopped processing
	 * @param issues All issues reported so far, including the fatal one
	 * @return The exception to throw
	 */
	public static DssParseException forIssues(String message, Diagnostics.Issue fatal, List<Diagnostics.Issue> issues) {
		StringBuilder str = new StringBuilder(message);
		str.append(": ").append(fatal);
		int others = 0;
		for (Diagnostics.Issue issue : issues) {
			if (issue != fatal && issue.severity == Diagnostics.Severity.ERROR)
				others++;
		}
		if (others > 0) {
			str.append("\nOther errors:");
			for (Diagnostics.Issue issue : issues) {
				if (issue != fatal && issue.severity == Diagnostics.Severity.ERROR)
					str.append("\n\t").append(issue);
			}
		}
		int line = fatal.position == null ? 0 : fatal.position.getLineNumber();
		return new DssParseException(str.toString(), issues, line);
	}
}
