package org.snomed.eclcuration.ecl;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.snomed.eclcuration.ecl.domain.EclExpression;
import org.snomed.eclcuration.ecl.recognizer.RecognitionResult;
import org.snomed.eclcuration.ecl.recognizer.ValueSetRecognizer;
import org.snomed.eclcuration.ecl.recognizer.ValueSetRecognizers;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Converts a value set descriptor into canonical ECL.
 * Stateless, the same instance can be shared between threads.
 */
@Service
public class ValueSetEclConverter {

	private final List<ValueSetRecognizer> recognizers;

	public ValueSetEclConverter() {
		this(ValueSetRecognizers.defaultOrder());
	}

	public ValueSetEclConverter(List<ValueSetRecognizer> recognizers) {
		this.recognizers = ImmutableList.copyOf(recognizers);
	}

	/**
	 * @return canonical ECL, or empty when the descriptor is null, blank or does not reference SNOMED CT.
	 */
	public Optional<String> convert(String valueSet) {
		return recognize(valueSet).map(RecognitionResult::getEcl);
	}

	public Optional<RecognitionResult> recognize(String valueSet) {
		if (Strings.isNullOrEmpty(valueSet) || valueSet.isBlank()) {
			return Optional.empty();
		}
		String descriptor = valueSet.trim();
		for (ValueSetRecognizer recognizer : recognizers) {
			Optional<EclExpression> expression = recognizer.recognize(descriptor);
			if (expression.isPresent() && !expression.get().toEcl().isEmpty()) {
				return Optional.of(new RecognitionResult(recognizer.getName(), expression.get()));
			}
		}
		return Optional.empty();
	}

	public List<ValueSetRecognizer> getRecognizers() {
		return recognizers;
	}
}
