package org.javai.result.ops;

/**
 * Settings for misuse reporting. Each setting is read from a system property, then an environment
 * variable, and otherwise takes its built-in default.
 */
public final class OpsConfig {

	public static final String MISUSE_LOGGER_PROPERTY = "result.misuse.logger";
	public static final String MISUSE_LOGGER_ENV = "RESULT_MISUSE_LOGGER";
	public static final String DEFAULT_MISUSE_LOGGER = "org.javai.result.Misuse";

	private OpsConfig() {
	}

	/**
	 * @return the trimmed property value, else the trimmed environment value, else {@code defaultValue}
	 * @throws IllegalArgumentException if {@code sysProp} or {@code envVar} is blank
	 */
	public static String resolve(String sysProp, String envVar, String defaultValue) {
		if (sysProp == null || sysProp.isBlank() || envVar == null || envVar.isBlank()) {
			throw new IllegalArgumentException("sysProp and envVar must be named, got [" + sysProp + "], [" + envVar + "]");
		}
		String fromProperty = System.getProperty(sysProp);
		if (fromProperty != null && !fromProperty.isBlank()) {
			return fromProperty.trim();
		}
		String fromEnv = System.getenv(envVar);
		if (fromEnv != null && !fromEnv.isBlank()) {
			return fromEnv.trim();
		}
		return defaultValue;
	}

	public static String misuseLoggerName() {
		return resolve(MISUSE_LOGGER_PROPERTY, MISUSE_LOGGER_ENV, DEFAULT_MISUSE_LOGGER);
	}
}
