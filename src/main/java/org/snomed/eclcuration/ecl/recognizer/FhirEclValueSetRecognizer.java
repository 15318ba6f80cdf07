package org.snomed.eclcuration.ecl.recognizer;

import org.snomed.eclcuration.core.data.services.ValueSetConversionException;
import org.snomed.eclcuration.ecl.ECLCanonicalizer;
import org.snomed.eclcuration.ecl.domain.CanonicalExpression;
import org.snomed.eclcuration.ecl.domain.EclExpression;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;

import static org.snomed.eclcuration.ecl.recognizer.SnomedPatterns.IMPLICIT_VALUE_SET_URL;

/**
 * FHIR implicit value set defined by ECL, "http://snomed.info/sct?fhir_vs=ecl/%3C%3C73211009".
 * See https://www.hl7.org/fhir/snomedct.html#implicit
 */
public class FhirEclValueSetRecognizer extends PatternRecognizer {

	public FhirEclValueSetRecognizer() {
		super("FHIR ECL URL", SnomedPatterns.compile(IMPLICIT_VALUE_SET_URL + "ecl/(.+)"));
	}

	@Override
	protected Optional<EclExpression> extract(Matcher matcher, String valueSet) {
		String ecl = ECLCanonicalizer.canonicalize(decode(matcher.group(1)));
		return ecl.isEmpty() ? Optional.empty() : Optional.of(new CanonicalExpression(ecl));
	}

	static String decode(String encodedEcl) {
		try {
			// A literal plus is not a space in a URL path
			return URLDecoder.decode(encodedEcl.replace("+", "%2B"), StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new ValueSetConversionException("Failed to decode ECL from FHIR value set URL: " + encodedEcl, e);
		}
	}
}
