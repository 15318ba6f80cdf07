package org.snomed.eclcuration.ecl.domain;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sub expressions joined by a single logical operator.
 */
public class CompoundExpressionConstraint implements EclExpression {

	public static final String OR = "OR";

	private final List<SubExpressionConstraint> subExpressionConstraints;
	private final String logicalOperator;

	private CompoundExpressionConstraint(List<SubExpressionConstraint> subExpressionConstraints, String logicalOperator) {
		Preconditions.checkArgument(!subExpressionConstraints.isEmpty(), "At least one sub expression is required.");
		this.subExpressionConstraints = ImmutableList.copyOf(subExpressionConstraints);
		this.logicalOperator = logicalOperator;
	}

	public static CompoundExpressionConstraint disjunction(List<SubExpressionConstraint> subExpressionConstraints) {
		return new CompoundExpressionConstraint(subExpressionConstraints, OR);
	}

	public List<SubExpressionConstraint> getSubExpressionConstraints() {
		return subExpressionConstraints;
	}

	public String getLogicalOperator() {
		return logicalOperator;
	}

	@Override
	public String toEcl() {
		return subExpressionConstraints.stream()
				.map(SubExpressionConstraint::toEcl)
				.collect(Collectors.joining(" " + logicalOperator + " "));
	}

	@Override
	public String toString() {
		return toEcl();
	}
}
