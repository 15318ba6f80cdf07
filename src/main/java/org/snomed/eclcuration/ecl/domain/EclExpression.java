package org.snomed.eclcuration.ecl.domain;

/**
 * Expression constraint produced from a value set descriptor.
 */
public interface EclExpression {

	/**
	 * @return the canonical ECL rendering.
	 */
	String toEcl();

}
