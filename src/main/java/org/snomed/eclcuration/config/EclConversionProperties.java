package org.snomed.eclcuration.config;

public class EclConversionProperties {

	// Leave elements that already have snomedECL untouched, set to false to update existing values
	private boolean skipExistingEcl = true;

	// Per element trace at INFO rather than DEBUG
	private boolean debugMode;

	// Log elements that have no SNOMED value set at INFO
	private boolean logNonSnomedElements;

	public boolean isSkipExistingEcl() {
		return skipExistingEcl;
	}

	public void setSkipExistingEcl(boolean skipExistingEcl) {
		this.skipExistingEcl = skipExistingEcl;
	}

	public boolean isDebugMode() {
		return debugMode;
	}

	public void setDebugMode(boolean debugMode) {
		this.debugMode = debugMode;
	}

	public boolean isLogNonSnomedElements() {
		return logNonSnomedElements;
	}

	public void setLogNonSnomedElements(boolean logNonSnomedElements) {
		this.logNonSnomedElements = logNonSnomedElements;
	}

	@Override
	public String toString() {
		return "EclConversionProperties{" +
				"skipExistingEcl=" + skipExistingEcl +
				", debugMode=" + debugMode +
				", logNonSnomedElements=" + logNonSnomedElements +
				'}';
	}
}
