package org.snomed.eclcuration.ecl.domain;

public enum EclOperator {

	self(""), descendantof("<"), descendantorselfof("<<"), ancestorof(">"), ancestororselfof(">>"), memberOf("^");

	private final String text;

	EclOperator(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public static EclOperator textLookup(String text) {
		for (EclOperator operator : values()) {
			if (operator.text.equals(text)) return operator;
		}
		return null;
	}
}
