package org.snomed.eclcuration.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermCleanerTest {

	@Test
	void clean() {
		assertEquals("Procedure", TermCleaner.clean("  Procedure (procedure) "));
		assertEquals("Seasonal influenza vaccination", TermCleaner.clean("Seasonal influenza vaccination"));
		assertNull(TermCleaner.clean(null));
		assertNull(TermCleaner.clean(""));
		assertNull(TermCleaner.clean("   "));
		assertNull(TermCleaner.clean("(procedure)"));
	}

	@Test
	void cleanOrDefault() {
		assertEquals("Diabetes mellitus", TermCleaner.cleanOrDefault("Diabetes mellitus (disorder)", "SNOMED CT concept"));
		assertEquals("SNOMED CT concept", TermCleaner.cleanOrDefault(null, "SNOMED CT concept"));
		assertEquals("SNOMED CT concept", TermCleaner.cleanOrDefault(" (disorder) ", "SNOMED CT concept"));
	}

	@Test
	void stripAllSemanticTags() {
		assertEquals("Finding", TermCleaner.stripAllSemanticTags("Finding (context) (finding)"));
		assertEquals("Finding", TermCleaner.stripAllSemanticTags("Finding"));
		assertEquals(" untouched ", TermCleaner.stripAllSemanticTags(" untouched "));
		assertEquals("", TermCleaner.stripAllSemanticTags(""));
	}

}
