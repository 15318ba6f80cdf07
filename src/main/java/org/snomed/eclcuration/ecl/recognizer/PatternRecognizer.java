package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.ecl.domain.EclExpression;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizer made of a pattern that must be found in the text and an extractor run against the match.
 */
public abstract class PatternRecognizer implements ValueSetRecognizer {

	private final String name;
	private final Pattern pattern;

	protected PatternRecognizer(String name, Pattern pattern) {
		this.name = name;
		this.pattern = pattern;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public Optional<EclExpression> recognize(String valueSet) {
		Matcher matcher = pattern.matcher(valueSet);
		if (!matcher.find()) {
			return Optional.empty();
		}
		return extract(matcher, valueSet);
	}

	protected abstract Optional<EclExpression> extract(Matcher matcher, String valueSet);

	@Override
	public String toString() {
		return name;
	}
}
