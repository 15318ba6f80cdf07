package org.snomed.eclcuration.core.data.domain;

/**
 * A data element held in the clinical model store.
 * Tagged values are string metadata fields addressed by name, see {@link DataElementMetadataKeys}.
 */
public interface DataElement {

	String getName();

	/**
	 * @param key name of the tagged value.
	 * @return the value, or null if the element does not carry the tagged value.
	 */
	String getTaggedValue(String key);

	/**
	 * Creates the tagged value or replaces the existing value.
	 */
	void setTaggedValue(String key, String value);

}
