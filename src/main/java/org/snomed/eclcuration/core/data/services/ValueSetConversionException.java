package org.snomed.eclcuration.core.data.services;

public class ValueSetConversionException extends RuntimeException {

	public ValueSetConversionException(String message) {
		super(message);
	}

	public ValueSetConversionException(String message, Throwable cause) {
		super(message, cause);
	}
}
