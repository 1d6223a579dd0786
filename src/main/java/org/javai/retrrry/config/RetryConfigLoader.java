package org.javai.retrrry.config;

import org.javai.retrrry.Retrier;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Builds a {@link Retrier.Builder} from options keyed by their configuration names.
 *
 * <p>Three sources are supported:
 * <ul>
 *   <li>a map of option name to value, accepting every option including predicates and hooks;</li>
 *   <li>{@link Properties} with keys {@code <prefix>.<option>}, e.g. {@code retrrry.wait_fixed=200};</li>
 *   <li>system properties, falling back to environment variables such as {@code RETRRRY_WAIT_FIXED}.</li>
 * </ul>
 * The returned builder can be refined further before building.
 */
public final class RetryConfigLoader {

	public static final String DEFAULT_PREFIX = "retrrry";

	private RetryConfigLoader() {
		// Utility class
	}

	/**
	 * Applies every entry of the map to a fresh builder.
	 *
	 * @param options option name to value
	 * @return a builder carrying the options
	 * @throws IllegalArgumentException on an unknown option name or an invalid value
	 */
	public static Retrier.Builder fromOptions(Map<String, ?> options) {
		Objects.requireNonNull(options, "options must not be null");
		Retrier.Builder builder = Retrier.builder();
		for (Map.Entry<String, ?> entry : options.entrySet()) {
			RetryOption.fromName(entry.getKey()).apply(builder, entry.getValue());
		}
		return builder;
	}

	public static Retrier.Builder fromProperties(Properties properties) {
		return fromProperties(properties, DEFAULT_PREFIX);
	}

	/**
	 * Reads the textual options under the given prefix.
	 *
	 * @throws IllegalArgumentException if a key under the prefix names no textual option, or a value is invalid
	 */
	public static Retrier.Builder fromProperties(Properties properties, String prefix) {
		Objects.requireNonNull(properties, "properties must not be null");
		String keyPrefix = requireNonEmpty(prefix, "prefix") + ".";

		Retrier.Builder builder = Retrier.builder();
		for (String key : properties.stringPropertyNames()) {
			if (!key.startsWith(keyPrefix)) {
				continue;
			}
			RetryOption option = RetryOption.fromName(key.substring(keyPrefix.length()));
			if (!option.isTextual()) {
				throw new IllegalArgumentException("Option '" + option.optionName() + "' cannot be set from text");
			}
			option.apply(builder, properties.getProperty(key));
		}
		return builder;
	}

	/**
	 * Reads the textual options from system properties ({@code retrrry.wait_fixed}) or, when a
	 * property is absent, environment variables ({@code RETRRRY_WAIT_FIXED}).
	 */
	public static Retrier.Builder fromEnvironment() {
		return fromEnvironment(DEFAULT_PREFIX, System::getProperty, System::getenv);
	}

	static Retrier.Builder fromEnvironment(
			String prefix,
			UnaryOperator<String> systemProperties,
			UnaryOperator<String> environment
	) {
		requireNonEmpty(prefix, "prefix");
		Retrier.Builder builder = Retrier.builder();
		for (RetryOption option : RetryOption.values()) {
			if (!option.isTextual()) {
				continue;
			}
			String sysProp = prefix + "." + option.optionName();
			String envVar = (prefix + "_" + option.optionName()).toUpperCase(Locale.ROOT);
			String value = resolveConfig(sysProp, envVar, systemProperties, environment);
			if (value != null) {
				option.apply(builder, value);
			}
		}
		return builder;
	}

	/**
	 * Resolves a value from a system property, falling back to an environment variable.
	 *
	 * @return the value, or null if neither is set
	 */
	static String resolveConfig(
			String sysProp,
			String envVar,
			UnaryOperator<String> systemProperties,
			UnaryOperator<String> environment
	) {
		String value = systemProperties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value;
	}

	private static String requireNonEmpty(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be null or empty");
		}
		return value;
	}
}
