package org.snomed.eclcuration.ecl.domain;

import com.google.common.base.Preconditions;
import org.snomed.eclcuration.core.util.ConceptTokenHelper;

import java.util.Objects;

/**
 * SNOMED CT identifier with an optional display term.
 */
public abstract class ComponentReference {

	private final String id;
	private final String term;

	protected ComponentReference(String id, String term) {
		Preconditions.checkArgument(ConceptTokenHelper.isConceptId(id), "Not a SNOMED CT identifier: %s", id);
		this.id = id;
		this.term = term;
	}

	public String getId() {
		return id;
	}

	public String getTerm() {
		return term;
	}

	public String toEcl() {
		return term != null ? id + " |" + term + "|" : id;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ComponentReference that = (ComponentReference) o;
		return id.equals(that.id) && Objects.equals(term, that.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, term);
	}

	@Override
	public String toString() {
		return toEcl();
	}
}
