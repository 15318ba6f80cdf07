package org.snomed.eclcuration.core.data.domain;

public class Concepts {

	// Display terms used when the value set text carries no term of its own
	public static final String DEFAULT_CONCEPT_TERM = "SNOMED CT concept";
	public static final String DEFAULT_REFSET_TERM = "SNOMED CT reference set";
	public static final String DMD_CONCEPT_TERM = "dm+d concept";

	public static final int MIN_SCTID_LENGTH = 6;
	public static final int MAX_SCTID_LENGTH = 18;

}
