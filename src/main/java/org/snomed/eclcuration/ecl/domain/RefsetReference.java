package org.snomed.eclcuration.ecl.domain;

public class RefsetReference extends ComponentReference {

	public RefsetReference(String id, String term) {
		super(id, term);
	}

}
