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
 * Last resort, a concept id anywhere in the text with an optional hierarchy operator and term.
 * Text that is only a list of numbers is left alone.
 */
public class StandaloneConceptRecognizer extends PatternRecognizer {

	private static final Pattern NUMBER_LIST = Pattern.compile("^[\\d\\s,]+$");

	public StandaloneConceptRecognizer() {
		super("standalone concept", compile("(<<|<|>>|>)?\\s*" + CONCEPT_ID + "\\s*" + PIPED_TERM));
	}

	@Override
	public Optional<EclExpression> recognize(String valueSet) {
		if (NUMBER_LIST.matcher(valueSet).matches()) {
			return Optional.empty();
		}
		return super.recognize(valueSet);
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		EclOperator operator = matcher.group(1) != null ? EclOperator.textLookup(matcher.group(1)) : EclOperator.descendantof;
		String term = TermCleaner.cleanOrDefault(ConceptTokenHelper.extractPipedTerm(matcher.group(3)).orElse(null), DEFAULT_CONCEPT_TERM);
		return Optional.of(new SubExpressionConstraint(operator, new ConceptReference(matcher.group(2), term)));
	}
}
