package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.ecl.domain.CanonicalExpression;
import org.snomed.eclcuration.ecl.domain.EclExpression;
import org.snomed.eclcuration.ecl.domain.EclOperator;

import java.util.Optional;
import java.util.regex.Matcher;

import static org.snomed.eclcuration.core.data.domain.Concepts.DMD_CONCEPT_TERM;

/**
 * UK Dictionary of Medicines and Devices code, "dm+d: 123456".
 */
public class DmdCodeRecognizer extends PatternRecognizer {

	public DmdCodeRecognizer() {
		super("dm+d code", SnomedPatterns.compile("dm\\+d:\\s*(\\d+)"));
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		// Rendered as text, dm+d codes are not held to the SNOMED CT identifier length
		String code = matcher.group(1);
		return Optional.of(new CanonicalExpression(EclOperator.descendantof.getText() + " " + code + " |" + DMD_CONCEPT_TERM + "|"));
	}
}
