package org.snomed.eclcuration.ecl.domain;

import java.util.Objects;

/**
 * Free text ECL that has already been through the canonicalizer.
 * Used where the source expression is kept as written rather than reduced to a single operator and concept.
 */
public class CanonicalExpression implements EclExpression {

	private final String ecl;

	public CanonicalExpression(String ecl) {
		this.ecl = Objects.requireNonNull(ecl, "ecl");
	}

	@Override
	public String toEcl() {
		return ecl;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return ecl.equals(((CanonicalExpression) o).ecl);
	}

	@Override
	public int hashCode() {
		return ecl.hashCode();
	}

	@Override
	public String toString() {
		return ecl;
	}
}
