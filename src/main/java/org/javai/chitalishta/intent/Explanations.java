package org.javai.chitalishta.intent;

import java.util.Locale;

final class Explanations {

	private Explanations() {
	}

	/**
	 * Formats a confidence as a percentage with two decimals, e.g. {@code 0.8 -> "80.00%"}.
	 */
	static String percent(double confidence) {
		return String.format(Locale.ROOT, "%.2f%%", confidence * 100.0);
	}
}
