package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.core.util.ConceptTokenHelper;
import org.snomed.eclcuration.ecl.domain.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

import static org.snomed.eclcuration.core.data.domain.Concepts.DEFAULT_CONCEPT_TERM;

/**
 * Comma or space separated concept ids after a SNOMED label, "SNOMED codes: 22298006, 73211009".
 * Each id becomes a descendant constraint, more than one are joined with OR.
 */
public class ConceptListRecognizer extends PatternRecognizer {

	public ConceptListRecognizer() {
		super("SNOMED concept list", SnomedPatterns.compile("SNOMED[^:]*:\\s*([\\d\\s,]+)"));
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		List<SubExpressionConstraint> constraints = Arrays.stream(matcher.group(1).split("[\\s,]+"))
				.filter(ConceptTokenHelper::isConceptId)
				.map(conceptId -> new SubExpressionConstraint(EclOperator.descendantof, new ConceptReference(conceptId, DEFAULT_CONCEPT_TERM)))
				.collect(Collectors.toList());

		if (constraints.isEmpty()) {
			return Optional.empty();
		}
		if (constraints.size() == 1) {
			return Optional.of(constraints.get(0));
		}
		return Optional.of(CompoundExpressionConstraint.disjunction(constraints));
	}
}
