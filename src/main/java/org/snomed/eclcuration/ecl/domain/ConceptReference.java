package org.snomed.eclcuration.ecl.domain;

public class ConceptReference extends ComponentReference {

	public ConceptReference(String id, String term) {
		super(id, term);
	}

}
