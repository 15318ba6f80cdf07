package org.snomed.eclcuration.ecl.recognizer;

import com.google.common.collect.ImmutableList;
import org.snomed.eclcuration.ecl.domain.EclOperator;

import java.util.List;
import java.util.regex.Pattern;

import static org.snomed.eclcuration.ecl.recognizer.SnomedPatterns.SNOMED_LABEL;
import static org.snomed.eclcuration.ecl.recognizer.SnomedPatterns.compile;

/**
 * The recognizers in evaluation order. The first one to produce an expression wins,
 * so where two conventions overlap the earlier entry decides the result.
 */
public class ValueSetRecognizers {

	// "SNOMED CT: - <71388002 |Procedure| or << 1066171000000108" the colon is required here
	static final Pattern COMPLEX_EXPRESSION = compile(SNOMED_LABEL + "\\s*:\\s*-?\\s*(.+)");

	// "SCT: << 73211009", never part of a URL path such as /sct?fhir_vs
	static final Pattern ALTERNATE_PREFIX_EXPRESSION = compile("(?<![\\w./])(?:SCT|SNOMEDCT)\\b(?:\\s*\\(UK\\))?\\s*:\\s*-?\\s*(.+)");

	private static final List<ValueSetRecognizer> DEFAULT_ORDER = ImmutableList.of(
			new PrefixedExpressionRecognizer("SNOMED complex expression", COMPLEX_EXPRESSION, null),
			new PrefixedExpressionRecognizer("alternative SNOMED prefix", ALTERNATE_PREFIX_EXPRESSION, COMPLEX_EXPRESSION),
			new DmdCodeRecognizer(),
			RefsetRecognizer.prefixed(),
			ConceptConstraintRecognizer.exact(),
			ConceptConstraintRecognizer.withOperator("SNOMED descendants or self", EclOperator.descendantorselfof),
			ConceptConstraintRecognizer.withOperator("SNOMED descendants", EclOperator.descendantof),
			ConceptConstraintRecognizer.withOperator("SNOMED ancestors or self", EclOperator.ancestororselfof),
			ConceptConstraintRecognizer.withOperator("SNOMED ancestors", EclOperator.ancestorof),
			new FhirEclValueSetRecognizer(),
			RefsetRecognizer.fhirImplicitValueSet(),
			ConceptConstraintRecognizer.bareConcept(),
			new ConceptListRecognizer(),
			RefsetRecognizer.standalone(),
			new StandaloneConceptRecognizer()
	);

	public static List<ValueSetRecognizer> defaultOrder() {
		return DEFAULT_ORDER;
	}

}
