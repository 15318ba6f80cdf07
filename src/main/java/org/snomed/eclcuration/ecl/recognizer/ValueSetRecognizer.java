package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.ecl.domain.EclExpression;

import java.util.Optional;

/**
 * Interprets value set text written in one specific convention.
 */
public interface ValueSetRecognizer {

	/**
	 * @return stable name used in logs.
	 */
	String getName();

	/**
	 * @param valueSet trimmed, non-empty value set descriptor.
	 * @return the expression if the text follows this recognizer's convention, otherwise empty.
	 */
	Optional<EclExpression> recognize(String valueSet);

}
