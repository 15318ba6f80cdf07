package org.snomed.eclcuration.core.util;

import java.util.Optional;

import static org.snomed.eclcuration.core.data.domain.Concepts.MAX_SCTID_LENGTH;
import static org.snomed.eclcuration.core.data.domain.Concepts.MIN_SCTID_LENGTH;

/**
 * Character level helpers for the tokens found in value set text.
 * None of these use regular expressions.
 */
public class ConceptTokenHelper {

	/**
	 * @return true if the token is made of ASCII digits only and has the length of a SNOMED CT identifier.
	 * Shorter or longer numbers are not treated as concept identifiers.
	 */
	public static boolean isConceptId(String token) {
		if (token == null || token.length() < MIN_SCTID_LENGTH || token.length() > MAX_SCTID_LENGTH) {
			return false;
		}
		for (int i = 0; i < token.length(); i++) {
			char c = token.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the content of the first |...| pair in the text, or empty if there is no complete non-blank pair.
	 */
	public static Optional<String> extractPipedTerm(String text) {
		if (text == null) {
			return Optional.empty();
		}
		int open = text.indexOf('|');
		if (open == -1) {
			return Optional.empty();
		}
		int close = text.indexOf('|', open + 1);
		if (close == -1) {
			return Optional.empty();
		}
		String term = text.substring(open + 1, close);
		return term.isBlank() ? Optional.empty() : Optional.of(term);
	}

	/**
	 * Removes a trailing semantic tag, "Procedure (procedure)" becomes "Procedure".
	 * Text without a trailing parenthesised group is returned unchanged.
	 */
	public static String stripSemanticTag(String term) {
		if (term == null) {
			return null;
		}
		String trimmed = term.stripTrailing();
		if (!trimmed.endsWith(")")) {
			return term;
		}
		int open = trimmed.lastIndexOf('(');
		int close = trimmed.length() - 1;
		if (open == -1 || close - open < 2 || trimmed.indexOf(')', open) != close) {
			return term;
		}
		return trimmed.substring(0, open).trim();
	}

}
