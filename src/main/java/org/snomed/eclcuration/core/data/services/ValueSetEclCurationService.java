package org.snomed.eclcuration.core.data.services;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snomed.eclcuration.config.EclConversionProperties;
import org.snomed.eclcuration.core.data.domain.ConversionRecord;
import org.snomed.eclcuration.core.data.domain.DataElement;
import org.snomed.eclcuration.core.data.services.pojo.ConversionStats;
import org.snomed.eclcuration.ecl.ValueSetEclConverter;
import org.snomed.eclcuration.ecl.recognizer.RecognitionResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

import static org.snomed.eclcuration.core.data.domain.DataElementMetadataKeys.SNOMED_ECL;
import static org.snomed.eclcuration.core.data.domain.DataElementMetadataKeys.VALUE_SETS;

/**
 * Populates the snomedECL tagged value of data elements from their valueSets tagged value.
 * Elements without a SNOMED CT value set are left as they are.
 */
@Service
public class ValueSetEclCurationService {

	private final ValueSetEclConverter valueSetEclConverter;
	private final EclConversionProperties properties;
	private final Clock clock;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public ValueSetEclCurationService(ValueSetEclConverter valueSetEclConverter, EclConversionProperties properties, Clock clock) {
		this.valueSetEclConverter = valueSetEclConverter;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Converts each element in turn. A failure on one element is counted and the run carries on.
	 * @return counters for this run only.
	 */
	public ConversionStats curate(Iterable<? extends DataElement> dataElements) {
		logger.info("Converting SNOMED valueSets to ECL, {}", properties);
		ConversionStats stats = new ConversionStats();
		for (DataElement dataElement : dataElements) {
			curate(dataElement, stats);
		}
		logSummary(stats);
		return stats;
	}

	/**
	 * @param stats accumulator owned by the caller.
	 * @return the record written to the element, empty if nothing was written.
	 */
	public Optional<ConversionRecord> curate(DataElement dataElement, ConversionStats stats) {
		stats.incrementElementsProcessed();
		String elementName = null;
		try {
			elementName = dataElement.getName();
			trace("Examining DataElement {}", elementName);

			String existingEcl = dataElement.getTaggedValue(SNOMED_ECL);
			if (!isBlank(existingEcl)) {
				if (properties.isSkipExistingEcl()) {
					logger.info("Skipping {}, already has snomedECL: {}", elementName, existingEcl);
					stats.incrementExistingEclSkipped();
					return Optional.empty();
				}
				logger.info("Existing snomedECL of {} will be updated: {}", elementName, existingEcl);
			}

			String valueSets = dataElement.getTaggedValue(VALUE_SETS);
			if (isBlank(valueSets)) {
				logNonSnomed("No valueSets found on {}, skipping", elementName);
				stats.incrementNonSnomedSkipped();
				return Optional.empty();
			}
			trace("Found valueSets on {}: {}", elementName, valueSets);

			Optional<RecognitionResult> result = valueSetEclConverter.recognize(valueSets);
			if (result.isEmpty()) {
				trace("No SNOMED pattern matched for {}", elementName);
				logNonSnomed("No SNOMED expression found in valueSets of {}, skipping", elementName);
				stats.incrementNonSnomedSkipped();
				return Optional.empty();
			}
			trace("Matched {} on {}", result.get().getRecognizerName(), elementName);

			ConversionRecord conversionRecord = new ConversionRecord(elementName, result.get().getEcl(), LocalDate.now(clock));
			conversionRecord.applyTo(dataElement);
			stats.incrementConversionsPerformed();
			logger.info("Added snomedECL to {}: {}", elementName, conversionRecord.getCanonicalEcl());
			return Optional.of(conversionRecord);
		} catch (RuntimeException e) {
			logger.error("Error processing DataElement {}", elementName, e);
			stats.incrementErrors();
			return Optional.empty();
		}
	}

	public void logSummary(ConversionStats stats) {
		logger.info("SNOMED valueSet to ECL conversion summary. " +
						"Elements processed: {}, converted to ECL: {}, existing ECL skipped: {}, without SNOMED valueSets skipped: {}, errors: {}",
				stats.getElementsProcessed(), stats.getConversionsPerformed(), stats.getExistingEclSkipped(), stats.getNonSnomedSkipped(), stats.getErrors());
		if (stats.hasErrors()) {
			logger.warn("Conversion completed with {} errors.", stats.getErrors());
		} else if (stats.getConversionsPerformed() > 0) {
			logger.info("Conversion completed successfully, converted {} SNOMED valueSets to ECL.", stats.getConversionsPerformed());
		} else {
			logger.info("Conversion completed successfully, no SNOMED valueSets needed conversion.");
		}
	}

	private void trace(String message, Object... arguments) {
		if (properties.isDebugMode()) {
			logger.info(message, arguments);
		} else {
			logger.debug(message, arguments);
		}
	}

	private void logNonSnomed(String message, Object... arguments) {
		if (properties.isLogNonSnomedElements()) {
			logger.info(message, arguments);
		} else {
			logger.debug(message, arguments);
		}
	}

	private static boolean isBlank(String value) {
		return Strings.isNullOrEmpty(value) || value.isBlank();
	}

}
