package org.snomed.eclcuration.core.util;

import com.google.common.base.Strings;

public class TermCleaner {

	/**
	 * @return the term trimmed and without its trailing semantic tag, or null when nothing is left.
	 */
	public static String clean(String term) {
		if (Strings.isNullOrEmpty(term)) {
			return null;
		}
		String cleaned = ConceptTokenHelper.stripSemanticTag(term.trim()).trim();
		return cleaned.isEmpty() ? null : cleaned;
	}

	public static String cleanOrDefault(String term, String defaultTerm) {
		String cleaned = clean(term);
		return cleaned != null ? cleaned : defaultTerm;
	}

	/**
	 * Removes every trailing semantic tag, "Finding (context) (finding)" becomes "Finding".
	 * Text without a trailing parenthesised group is returned unchanged.
	 */
	public static String stripAllSemanticTags(String term) {
		String current = term;
		String stripped = ConceptTokenHelper.stripSemanticTag(current);
		while (stripped != null && !stripped.equals(current)) {
			current = stripped;
			stripped = ConceptTokenHelper.stripSemanticTag(current);
		}
		return current;
	}

}
