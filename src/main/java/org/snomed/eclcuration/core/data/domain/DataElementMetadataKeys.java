package org.snomed.eclcuration.core.data.domain;

public interface DataElementMetadataKeys {
	String VALUE_SETS = "valueSets";
	String SNOMED_ECL = "snomedECL";
	String ECL_SOURCE = "eclSource";
	String ECL_CONVERSION_DATE = "eclConversionDate";
}
