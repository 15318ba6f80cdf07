package org.snomed.eclcuration.ecl;

import org.snomed.eclcuration.core.util.TermCleaner;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites ECL text into the single spelling stored as snomedECL.
 * Only keyword case, spacing and term semantic tags change, the constraint itself is untouched.
 * canonicalize(canonicalize(x)) equals canonicalize(x).
 */
public class ECLCanonicalizer {

	// Whole words with whitespace on both sides, the whitespace itself is not consumed
	private static final Pattern LOGICAL_KEYWORD = Pattern.compile("(?<=\\s)(or|and|minus)(?=\\s)", Pattern.CASE_INSENSITIVE);

	private static final Pattern DESCENDANT_OPERATOR = Pattern.compile("\\s*<{1,2}\\s*");
	private static final Pattern ANCESTOR_OPERATOR = Pattern.compile("\\s*>{1,2}\\s*");
	private static final Pattern MEMBER_OF_OPERATOR = Pattern.compile("\\s*\\^\\s*");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final char TERM_DELIMITER = '|';

	public static String canonicalize(String ecl) {
		if (ecl == null) {
			return "";
		}
		String canonical = ecl.trim();

		// Must run before operator spacing
		canonical = stripTermSemanticTags(canonical);

		canonical = uppercaseKeywords(canonical);

		// One space after each operator, none before
		canonical = normaliseOperator(canonical, DESCENDANT_OPERATOR);
		canonical = normaliseOperator(canonical, ANCESTOR_OPERATOR);
		canonical = normaliseOperator(canonical, MEMBER_OF_OPERATOR);

		// Operator spacing can separate a keyword, as in "<<or 73211009"
		canonical = uppercaseKeywords(canonical);

		return WHITESPACE.matcher(canonical).replaceAll(" ").trim();
	}

	private static String uppercaseKeywords(String ecl) {
		return LOGICAL_KEYWORD.matcher(ecl).replaceAll(result -> result.group(1).toUpperCase(Locale.ROOT));
	}

	private static String normaliseOperator(String ecl, Pattern operatorPattern) {
		return operatorPattern.matcher(ecl).replaceAll(result -> Matcher.quoteReplacement(WHITESPACE.matcher(result.group()).replaceAll("") + " "));
	}

	// Pipes pair up left to right, each pair encloses one term
	private static String stripTermSemanticTags(String ecl) {
		StringBuilder builder = new StringBuilder(ecl.length());
		int index = 0;
		while (index < ecl.length()) {
			int open = ecl.indexOf(TERM_DELIMITER, index);
			int close = open == -1 ? -1 : ecl.indexOf(TERM_DELIMITER, open + 1);
			if (close == -1) {
				builder.append(ecl, index, ecl.length());
				break;
			}
			builder.append(ecl, index, open + 1)
					.append(TermCleaner.stripAllSemanticTags(ecl.substring(open + 1, close)))
					.append(TERM_DELIMITER);
			index = close + 1;
		}
		return builder.toString();
	}

}
