package org.snomed.eclcuration.ecl.validation;

import java.util.regex.Pattern;

/**
 * Acceptance check for the text captured after a "SNOMED CT:" style label.
 * This is a heuristic, not an ECL grammar. Changing what it accepts changes which descriptors are kept
 * as complex expressions and which fall through to the single concept recognizers.
 */
public class ComplexExpressionValidator {

	static final int MIN_UNSTRUCTURED_LENGTH = 20;

	private static final Pattern ECL_OPERATOR_OR_KEYWORD = Pattern.compile("[<>^]|AND|OR|MINUS", Pattern.CASE_INSENSITIVE);
	private static final Pattern CONCEPT_ID_RUN = Pattern.compile("\\d{6,18}");
	private static final Pattern LOGICAL_JOIN = Pattern.compile("\\s+(or|and|minus)\\s+", Pattern.CASE_INSENSITIVE);
	private static final Pattern OPERATOR_BEFORE_ID = Pattern.compile("<{1,2}\\s*\\d|>{1,2}\\s*\\d|\\^\\s*\\d");

	public static boolean isPlausibleComplexExpression(String expression) {
		if (expression == null) {
			return false;
		}
		boolean hasEclOperators = ECL_OPERATOR_OR_KEYWORD.matcher(expression).find();
		boolean hasConceptIds = CONCEPT_ID_RUN.matcher(expression).find();
		boolean hasLogicalStructure = LOGICAL_JOIN.matcher(expression).find() || OPERATOR_BEFORE_ID.matcher(expression).find();

		return hasEclOperators && hasConceptIds && (hasLogicalStructure || expression.length() > MIN_UNSTRUCTURED_LENGTH);
	}

}
