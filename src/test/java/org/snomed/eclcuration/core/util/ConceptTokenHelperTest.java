package org.snomed.eclcuration.core.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConceptTokenHelperTest {

	@Test
	void isConceptId() {
		assertTrue(ConceptTokenHelper.isConceptId("123456"));
		assertTrue(ConceptTokenHelper.isConceptId("71388002"));
		assertTrue(ConceptTokenHelper.isConceptId("999000011000000103"));
		assertTrue(ConceptTokenHelper.isConceptId("123456789012345678"));

		// Length is what separates a concept id from any other number
		assertFalse(ConceptTokenHelper.isConceptId("12345"));
		assertFalse(ConceptTokenHelper.isConceptId("1234567890123456789"));

		assertFalse(ConceptTokenHelper.isConceptId(null));
		assertFalse(ConceptTokenHelper.isConceptId(""));
		assertFalse(ConceptTokenHelper.isConceptId(" 123456"));
		assertFalse(ConceptTokenHelper.isConceptId("12345a"));
		assertFalse(ConceptTokenHelper.isConceptId("-123456"));
		assertFalse(ConceptTokenHelper.isConceptId("１２３４５６"));
	}

	@Test
	void extractPipedTerm() {
		assertEquals(Optional.of("Procedure (procedure)"), ConceptTokenHelper.extractPipedTerm("< 71388002 |Procedure (procedure)|"));
		assertEquals(Optional.of("First"), ConceptTokenHelper.extractPipedTerm("|First| OR |Second|"));
		assertEquals(Optional.of(" spaced "), ConceptTokenHelper.extractPipedTerm("123456 | spaced |"));

		assertEquals(Optional.empty(), ConceptTokenHelper.extractPipedTerm("71388002"));
		assertEquals(Optional.empty(), ConceptTokenHelper.extractPipedTerm("71388002 |unclosed"));
		assertEquals(Optional.empty(), ConceptTokenHelper.extractPipedTerm("71388002 | |"));
		assertEquals(Optional.empty(), ConceptTokenHelper.extractPipedTerm(null));
	}

	@Test
	void stripSemanticTag() {
		assertEquals("Procedure", ConceptTokenHelper.stripSemanticTag("Procedure (procedure)"));
		assertEquals("Procedure", ConceptTokenHelper.stripSemanticTag("Procedure (procedure)  "));
		assertEquals("Myocardial infarction", ConceptTokenHelper.stripSemanticTag("Myocardial infarction(disorder)"));

		// Only the last group goes
		assertEquals("Finding (context)", ConceptTokenHelper.stripSemanticTag("Finding (context) (finding)"));

		assertEquals("Procedure", ConceptTokenHelper.stripSemanticTag("Procedure"));
		assertEquals("Hip (left) replacement", ConceptTokenHelper.stripSemanticTag("Hip (left) replacement"));
		assertEquals("Empty ()", ConceptTokenHelper.stripSemanticTag("Empty ()"));
		assertEquals("", ConceptTokenHelper.stripSemanticTag("(procedure)"));
		assertNull(ConceptTokenHelper.stripSemanticTag(null));
	}

}
