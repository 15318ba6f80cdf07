package org.snomed.eclcuration.ecl.domain;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A single operator applied to a single concept or reference set, rendered as {@code OP ID |TERM|}.
 */
public class SubExpressionConstraint implements EclExpression {

	private final EclOperator operator;
	private final ComponentReference reference;

	public SubExpressionConstraint(EclOperator operator, ConceptReference concept) {
		this(operator, (ComponentReference) concept);
		Preconditions.checkArgument(operator != EclOperator.memberOf, "memberOf requires a reference set.");
	}

	public SubExpressionConstraint(RefsetReference refset) {
		this(EclOperator.memberOf, refset);
	}

	private SubExpressionConstraint(EclOperator operator, ComponentReference reference) {
		this.operator = Objects.requireNonNull(operator, "operator");
		this.reference = Objects.requireNonNull(reference, "reference");
	}

	public EclOperator getOperator() {
		return operator;
	}

	public ComponentReference getReference() {
		return reference;
	}

	@Override
	public String toEcl() {
		if (operator == EclOperator.self) {
			return reference.toEcl();
		}
		return operator.getText() + " " + reference.toEcl();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SubExpressionConstraint that = (SubExpressionConstraint) o;
		return operator == that.operator && reference.equals(that.reference);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, reference);
	}

	@Override
	public String toString() {
		return toEcl();
	}
}
