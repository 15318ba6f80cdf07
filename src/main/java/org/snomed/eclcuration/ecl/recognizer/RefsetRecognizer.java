package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.core.util.ConceptTokenHelper;
import org.snomed.eclcuration.ecl.domain.EclExpression;
import org.snomed.eclcuration.ecl.domain.RefsetReference;
import org.snomed.eclcuration.ecl.domain.SubExpressionConstraint;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.snomed.eclcuration.core.data.domain.Concepts.DEFAULT_REFSET_TERM;
import static org.snomed.eclcuration.ecl.recognizer.SnomedPatterns.*;

/**
 * Reference set membership, rendered as {@code ^ ID |TERM|}.
 */
public class RefsetRecognizer extends PatternRecognizer {

	private RefsetRecognizer(String name, Pattern pattern) {
		super(name, pattern);
	}

	/**
	 * "SNOMED CT: ^999000011000000103 |UK Drug Extension refset|"
	 */
	public static RefsetRecognizer prefixed() {
		return new RefsetRecognizer("SNOMED reference set", compile(SNOMED_PREFIX + "\\^\\s*" + CONCEPT_ID + "\\s*" + PIPED_TERM));
	}

	/**
	 * "^999000011000000103" at the start of the text, no SNOMED label.
	 */
	public static RefsetRecognizer standalone() {
		return new RefsetRecognizer("standalone reference set", compile("^\\^\\s*" + CONCEPT_ID + "\\s*" + PIPED_TERM));
	}

	/**
	 * "http://snomed.info/sct?fhir_vs=refset/999000011000000103", the FHIR implicit value set for a reference set.
	 */
	public static RefsetRecognizer fhirImplicitValueSet() {
		return new RefsetRecognizer("FHIR reference set URL", compile(IMPLICIT_VALUE_SET_URL + "refset/" + CONCEPT_ID + "()"));
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		String term = ConceptTokenHelper.extractPipedTerm(matcher.group(2)).map(String::trim).orElse(null);
		String refsetTerm = term == null || term.isEmpty() ? DEFAULT_REFSET_TERM : term;
		return Optional.of(new SubExpressionConstraint(new RefsetReference(matcher.group(1), refsetTerm)));
	}
}
