package org.snomed.eclcuration.config;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;

/**
 * Base Spring configuration. The application hosting the model store extends this class.
 */
@SpringBootApplication(scanBasePackages = "org.snomed.eclcuration")
@EnableConfigurationProperties
@PropertySource(value = "classpath:application.properties", encoding = "UTF-8")
public abstract class Config {

	@Bean
	@ConfigurationProperties(prefix = "ecl.conversion")
	public EclConversionProperties eclConversionProperties() {
		return new EclConversionProperties();
	}

	@Bean
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

}
