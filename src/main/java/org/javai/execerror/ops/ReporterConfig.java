package org.javai.execerror.ops;

/**
 * Resolves reporter settings from system properties and environment variables.
 * A system property wins over an environment variable of the same setting.
 */
public final class ReporterConfig {

	private ReporterConfig() {
		// Utility class
	}

	/**
	 * Resolves a setting, falling back to {@code defaultValue} when neither source
	 * has a non-blank value.
	 */
	public static String resolve(String sysProp, String envVar, String defaultValue) {
		String value = lookup(sysProp, envVar);
		return value != null ? value : defaultValue;
	}

	/**
	 * Resolves a mandatory setting.
	 *
	 * @throws IllegalStateException if neither source has a non-blank value
	 */
	public static String require(String sysProp, String envVar) {
		String value = lookup(sysProp, envVar);
		if (value == null) {
			throw new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"
			);
		}
		return value;
	}

	private static String lookup(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		return value == null || value.isBlank() ? null : value;
	}
}
