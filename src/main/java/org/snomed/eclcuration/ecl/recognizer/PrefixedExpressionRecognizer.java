package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.ecl.ECLCanonicalizer;
import org.snomed.eclcuration.ecl.domain.CanonicalExpression;
import org.snomed.eclcuration.ecl.domain.EclExpression;
import org.snomed.eclcuration.ecl.validation.ComplexExpressionValidator;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Takes everything after a SNOMED label as an ECL expression, keeping it whole rather than reducing it
 * to one operator and concept. The captured text must pass {@link ComplexExpressionValidator}.
 */
public class PrefixedExpressionRecognizer extends PatternRecognizer {

	private final Pattern deferTo;

	/**
	 * @param pattern group 1 captures the expression.
	 * @param deferTo if this pattern is found in the text the recognizer does not run, may be null.
	 */
	public PrefixedExpressionRecognizer(String name, Pattern pattern, Pattern deferTo) {
		super(name, pattern);
		this.deferTo = deferTo;
	}

	@Override
	public Optional<EclExpression> recognize(String valueSet) {
		if (deferTo != null && deferTo.matcher(valueSet).find()) {
			return Optional.empty();
		}
		return super.recognize(valueSet);
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		String expression = matcher.group(1).trim();
		if (!ComplexExpressionValidator.isPlausibleComplexExpression(expression)) {
			return Optional.empty();
		}
		String ecl = ECLCanonicalizer.canonicalize(expression);
		return ecl.isEmpty() ? Optional.empty() : Optional.of(new CanonicalExpression(ecl));
	}
}
