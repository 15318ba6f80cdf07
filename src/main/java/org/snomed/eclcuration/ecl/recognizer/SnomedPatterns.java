package org.snomed.eclcuration.ecl.recognizer;

import java.util.regex.Pattern;

final class SnomedPatterns {

	// "SNOMED CT", "SNOMED-CT", "SNOMEDCT" with an optional "(UK)" edition marker
	static final String SNOMED_LABEL = "SNOMED[\\s\\-]*CT(?:\\s*\\(UK\\))?";

	// Label followed by an optional colon and an optional dash, as in "SNOMED CT: - "
	static final String SNOMED_PREFIX = SNOMED_LABEL + "\\s*:?\\s*-?\\s*";

	static final String CONCEPT_ID = "(?<!\\d)(\\d{6,18})(?!\\d)";

	static final String PIPED_TERM = "(\\|[^|]+\\|)?";

	// Versioned edition URIs such as http://snomed.info/sct/1234000008/version/20190731 are accepted
	static final String IMPLICIT_VALUE_SET_URL = "snomed\\.info/sct(?:/\\d+(?:/version/\\d+)?)?\\?fhir_vs=";

	private SnomedPatterns() {
	}

	static Pattern compile(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

}
