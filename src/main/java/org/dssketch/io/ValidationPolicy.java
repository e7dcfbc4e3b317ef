package org.dssketch.io;

/** Decides which reported {@link Diagnostics.Issue issues} abort processing */
public interface ValidationPolicy {
	/** Aborts on any error */
	ValidationPolicy STRICT = new ValidationPolicy() {
		@Override
		public boolean isFatal(Diagnostics.Issue issue) {
			return issue.severity == Diagnostics.Severity.ERROR;
		}

		@Override
		public String toString() {
			return "strict";
		}
	};

	/** Aborts only on structural and semantic errors, collecting everything else */
	ValidationPolicy LENIENT = new ValidationPolicy() {
		@Override
		public boolean isFatal(Diagnostics.Issue issue) {
			return issue.severity == Diagnostics.Severity.ERROR && issue.category.isAlwaysFatal();
		}

		@Override
		public String toString() {
			return "lenient";
		}
	};

	/**
	 * @param issue The issue just reported
	 * @return Whether processing must stop because of the issue
	 */
	boolean isFatal(Diagnostics.Issue issue);
}
