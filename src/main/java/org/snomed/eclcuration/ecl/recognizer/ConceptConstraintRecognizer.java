package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.core.util.ConceptTokenHelper;
import org.snomed.eclcuration.core.util.TermCleaner;
import org.snomed.eclcuration.ecl.domain.ConceptReference;
import org.snomed.eclcuration.ecl.domain.EclExpression;
import org.snomed.eclcuration.ecl.domain.EclOperator;
import org.snomed.eclcuration.ecl.domain.SubExpressionConstraint;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.snomed.eclcuration.core.data.domain.Concepts.DEFAULT_CONCEPT_TERM;
import static org.snomed.eclcuration.ecl.recognizer.SnomedPatterns.*;

/**
 * A single SNOMED CT concept under a SNOMED label with a fixed operator.
 * Group 1 of the pattern is the concept id, group 2 the optional |term|.
 */
public class ConceptConstraintRecognizer extends PatternRecognizer {

	private final EclOperator operator;

	private ConceptConstraintRecognizer(String name, Pattern pattern, EclOperator operator) {
		super(name, pattern);
		this.operator = operator;
	}

	/**
	 * "SNOMED CT: 22298006 |Myocardial infarction| only", also "(exact)" or "self". No operator in the output.
	 */
	public static ConceptConstraintRecognizer exact() {
		return new ConceptConstraintRecognizer("SNOMED exact concept",
				compile(SNOMED_LABEL + "\\s*:?\\s*" + CONCEPT_ID + "\\s*" + PIPED_TERM + "\\s*(?:\\(exact\\)|\\bonly\\b|\\bself\\b)"),
				EclOperator.self);
	}

	/**
	 * "SNOMED CT: <<71388002 |Procedure|" and the other hierarchy operators.
	 */
	public static ConceptConstraintRecognizer withOperator(String name, EclOperator operator) {
		return new ConceptConstraintRecognizer(name,
				compile(SNOMED_PREFIX + Pattern.quote(operator.getText()) + "\\s*" + CONCEPT_ID + "\\s*" + PIPED_TERM),
				operator);
	}

	/**
	 * "SNOMED CT: 71388002", no operator and no term. Descendants are assumed.
	 */
	public static ConceptConstraintRecognizer bareConcept() {
		return new ConceptConstraintRecognizer("SNOMED concept id",
				compile(SNOMED_LABEL + "\\s*:?\\s*" + CONCEPT_ID + "()"),
				EclOperator.descendantof);
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		String term = TermCleaner.cleanOrDefault(ConceptTokenHelper.extractPipedTerm(matcher.group(2)).orElse(null), DEFAULT_CONCEPT_TERM);
		return Optional.of(new SubExpressionConstraint(operator, new ConceptReference(matcher.group(1), term)));
	}
}
