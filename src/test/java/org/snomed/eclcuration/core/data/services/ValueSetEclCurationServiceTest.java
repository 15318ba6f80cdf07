package org.snomed.eclcuration.core.data.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.snomed.eclcuration.config.EclConversionProperties;
import org.snomed.eclcuration.core.data.domain.ConversionRecord;
import org.snomed.eclcuration.core.data.domain.DataElement;
import org.snomed.eclcuration.core.data.domain.TestDataElement;
import org.snomed.eclcuration.core.data.services.pojo.ConversionStats;
import org.snomed.eclcuration.ecl.ValueSetEclConverter;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.snomed.eclcuration.core.data.domain.DataElementMetadataKeys.*;

class ValueSetEclCurationServiceTest {

	private static final LocalDate TODAY = LocalDate.of(2024, 12, 19);

	private EclConversionProperties properties;
	private ValueSetEclCurationService service;

	@BeforeEach
	void setup() {
		properties = new EclConversionProperties();
		Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC);
		service = new ValueSetEclCurationService(new ValueSetEclConverter(), properties, clock);
	}

	@Test
	void convertsSnomedValueSet() {
		TestDataElement element = TestDataElement.withValueSets("Procedure performed", "SNOMED CT: - <71388002 |Procedure (procedure)|");

		ConversionStats stats = new ConversionStats();
		Optional<ConversionRecord> conversionRecord = service.curate(element, stats);

		assertTrue(conversionRecord.isPresent());
		assertEquals("Procedure performed", conversionRecord.get().getElementName());
		assertEquals("< 71388002 |Procedure|", element.getTaggedValue(SNOMED_ECL));
		assertEquals("Converted from valueSets", element.getTaggedValue(ECL_SOURCE));
		assertEquals("2024-12-19", element.getTaggedValue(ECL_CONVERSION_DATE));
		assertEquals("SNOMED CT: - <71388002 |Procedure (procedure)|", element.getTaggedValue(VALUE_SETS));
		assertEquals(3, element.getWrites());
		assertEquals(1, stats.getElementsProcessed());
		assertEquals(1, stats.getConversionsPerformed());
		assertFalse(stats.hasErrors());
	}

	@Test
	void nonSnomedValueSetsLeftAlone() {
		TestDataElement local = TestDataElement.withValueSets("Local code", "Local procedure codes");
		TestDataElement blank = TestDataElement.withValueSets("Blank", "   ");
		TestDataElement none = new TestDataElement("No valueSets");

		ConversionStats stats = service.curate(List.of(local, blank, none));

		assertEquals(3, stats.getElementsProcessed());
		assertEquals(3, stats.getNonSnomedSkipped());
		assertEquals(0, stats.getConversionsPerformed());
		assertEquals(0, stats.getErrors());
		assertEquals(0, local.getWrites() + blank.getWrites() + none.getWrites());
		assertNull(local.getTaggedValue(SNOMED_ECL));
	}

	@Test
	void existingEclSkipped() {
		TestDataElement element = TestDataElement.withValueSets("Diabetes", "SNOMED CT: <<73211009")
				.withTaggedValue(SNOMED_ECL, "<< 46635009 |Type 1 diabetes mellitus|");

		ConversionStats stats = service.curate(List.of(element));

		assertEquals(1, stats.getExistingEclSkipped());
		assertEquals(0, stats.getConversionsPerformed());
		assertEquals(0, element.getWrites());
		assertEquals("<< 46635009 |Type 1 diabetes mellitus|", element.getTaggedValue(SNOMED_ECL));
	}

	@Test
	void secondRunWritesNothing() {
		List<TestDataElement> elements = List.of(
				TestDataElement.withValueSets("Procedure", "SNOMED CT: - <71388002 |Procedure (procedure)|"),
				TestDataElement.withValueSets("Drug", "SNOMED CT: ^999000011000000103 |UK Drug Extension refset|"),
				TestDataElement.withValueSets("Local", "Local procedure codes"));

		ConversionStats firstRun = service.curate(elements);
		assertEquals(2, firstRun.getConversionsPerformed());
		assertEquals(1, firstRun.getNonSnomedSkipped());
		int writesAfterFirstRun = elements.stream().mapToInt(TestDataElement::getWrites).sum();
		assertEquals(6, writesAfterFirstRun);

		ConversionStats secondRun = service.curate(elements);
		assertEquals(3, secondRun.getElementsProcessed());
		assertEquals(0, secondRun.getConversionsPerformed());
		assertEquals(2, secondRun.getExistingEclSkipped());
		assertEquals(1, secondRun.getNonSnomedSkipped());
		assertEquals(writesAfterFirstRun, elements.stream().mapToInt(TestDataElement::getWrites).sum());
	}

	@Test
	void existingEclOverwrittenWhenNotSkipping() {
		properties.setSkipExistingEcl(false);
		TestDataElement element = TestDataElement.withValueSets("Diabetes", "SNOMED CT: <<73211009")
				.withTaggedValue(SNOMED_ECL, "<< 46635009 |Type 1 diabetes mellitus|");

		ConversionStats stats = service.curate(List.of(element));

		assertEquals(1, stats.getConversionsPerformed());
		assertEquals(0, stats.getExistingEclSkipped());
		assertEquals("<< 73211009", element.getTaggedValue(SNOMED_ECL));
	}

	@Test
	void existingEclKeptWhenNothingRecognized() {
		properties.setSkipExistingEcl(false);
		TestDataElement element = TestDataElement.withValueSets("Local", "Local procedure codes")
				.withTaggedValue(SNOMED_ECL, "<< 46635009");

		ConversionStats stats = service.curate(List.of(element));

		assertEquals(1, stats.getNonSnomedSkipped());
		assertEquals("<< 46635009", element.getTaggedValue(SNOMED_ECL));
		assertEquals(0, element.getWrites());
	}

	@Test
	void failingElementCountedAndRunContinues() {
		DataElement broken = mock(DataElement.class);
		when(broken.getName()).thenReturn("Broken");
		when(broken.getTaggedValue(anyString())).thenThrow(new IllegalStateException("Tagged value store unavailable"));
		TestDataElement badUrl = TestDataElement.withValueSets("Bad URL", "http://snomed.info/sct?fhir_vs=ecl/%3C%ZZ73211009");
		TestDataElement good = TestDataElement.withValueSets("Good", "dm+d: 123456");

		ConversionStats stats = service.curate(Arrays.asList(broken, badUrl, null, good));

		assertEquals(4, stats.getElementsProcessed());
		assertEquals(3, stats.getErrors());
		assertEquals(1, stats.getConversionsPerformed());
		assertTrue(stats.hasErrors());
		assertEquals("< 123456 |dm+d concept|", good.getTaggedValue(SNOMED_ECL));
		assertEquals(0, badUrl.getWrites());
		verify(broken, never()).setTaggedValue(anyString(), anyString());
	}

	@Test
	void statsAccumulateAcrossElements() {
		ConversionStats stats = new ConversionStats();
		service.curate(TestDataElement.withValueSets("One", "dm+d: 123456"), stats);
		service.curate(TestDataElement.withValueSets("Two", "^999000011000000103"), stats);
		service.curate(TestDataElement.withValueSets("Three", "ICD-10: I21.9"), stats);

		assertEquals(3, stats.getElementsProcessed());
		assertEquals(2, stats.getConversionsPerformed());
		assertEquals(1, stats.getNonSnomedSkipped());
	}

}
