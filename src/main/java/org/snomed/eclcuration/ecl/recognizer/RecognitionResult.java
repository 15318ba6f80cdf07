package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.ecl.domain.EclExpression;

public class RecognitionResult {

	private final String recognizerName;
	private final EclExpression expression;

	public RecognitionResult(String recognizerName, EclExpression expression) {
		this.recognizerName = recognizerName;
		this.expression = expression;
	}

	public String getRecognizerName() {
		return recognizerName;
	}

	public EclExpression getExpression() {
		return expression;
	}

	public String getEcl() {
		return expression.toEcl();
	}

	@Override
	public String toString() {
		return recognizerName + ": " + getEcl();
	}
}
