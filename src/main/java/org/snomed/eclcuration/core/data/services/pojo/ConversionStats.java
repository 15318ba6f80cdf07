package org.snomed.eclcuration.core.data.services.pojo;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Counters for one curation run. Owned by a single thread, separate workers each keep their own and {@link #merge} at the end.
 */
@JsonPropertyOrder({"elementsProcessed", "conversionsPerformed", "existingEclSkipped", "nonSnomedSkipped", "errors"})
public class ConversionStats {

	private int elementsProcessed;
	private int conversionsPerformed;
	private int existingEclSkipped;
	private int nonSnomedSkipped;
	private int errors;

	public void incrementElementsProcessed() {
		elementsProcessed++;
	}

	public void incrementConversionsPerformed() {
		conversionsPerformed++;
	}

	public void incrementExistingEclSkipped() {
		existingEclSkipped++;
	}

	public void incrementNonSnomedSkipped() {
		nonSnomedSkipped++;
	}

	public void incrementErrors() {
		errors++;
	}

	public ConversionStats merge(ConversionStats other) {
		elementsProcessed += other.elementsProcessed;
		conversionsPerformed += other.conversionsPerformed;
		existingEclSkipped += other.existingEclSkipped;
		nonSnomedSkipped += other.nonSnomedSkipped;
		errors += other.errors;
		return this;
	}

	public boolean hasErrors() {
		return errors > 0;
	}

	public int getElementsProcessed() {
		return elementsProcessed;
	}

	public int getConversionsPerformed() {
		return conversionsPerformed;
	}

	public int getExistingEclSkipped() {
		return existingEclSkipped;
	}

	public int getNonSnomedSkipped() {
		return nonSnomedSkipped;
	}

	public int getErrors() {
		return errors;
	}

	@Override
	public String toString() {
		return "ConversionStats{" +
				"elementsProcessed=" + elementsProcessed +
				", conversionsPerformed=" + conversionsPerformed +
				", existingEclSkipped=" + existingEclSkipped +
				", nonSnomedSkipped=" + nonSnomedSkipped +
				", errors=" + errors +
				'}';
	}
}
