package org.snomed.eclcuration.core.data.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import static org.snomed.eclcuration.core.data.domain.DataElementMetadataKeys.*;

public class ConversionRecord {

	public static final String ECL_SOURCE_VALUE_SETS = "Converted from valueSets";
	public static final DateTimeFormatter CONVERSION_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

	private final String elementName;
	private final String canonicalEcl;
	private final String source;
	private final LocalDate convertedOn;

	public ConversionRecord(String elementName, String canonicalEcl, LocalDate convertedOn) {
		this.elementName = elementName;
		this.canonicalEcl = Objects.requireNonNull(canonicalEcl, "canonicalEcl");
		this.source = ECL_SOURCE_VALUE_SETS;
		this.convertedOn = Objects.requireNonNull(convertedOn, "convertedOn");
	}

	public void applyTo(DataElement element) {
		element.setTaggedValue(SNOMED_ECL, canonicalEcl);
		element.setTaggedValue(ECL_SOURCE, source);
		element.setTaggedValue(ECL_CONVERSION_DATE, getConversionDate());
	}

	public String getElementName() {
		return elementName;
	}

	public String getCanonicalEcl() {
		return canonicalEcl;
	}

	public String getSource() {
		return source;
	}

	public LocalDate getConvertedOn() {
		return convertedOn;
	}

	public String getConversionDate() {
		return CONVERSION_DATE_FORMAT.format(convertedOn);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ConversionRecord that = (ConversionRecord) o;
		return Objects.equals(elementName, that.elementName) &&
				canonicalEcl.equals(that.canonicalEcl) &&
				convertedOn.equals(that.convertedOn);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elementName, canonicalEcl, convertedOn);
	}

	@Override
	public String toString() {
		return "ConversionRecord{" +
				"elementName='" + elementName + '\'' +
				", canonicalEcl='" + canonicalEcl + '\'' +
				", source='" + source + '\'' +
				", convertedOn=" + getConversionDate() +
				'}';
	}
}
