package org.javai.chitalishta.intent;

import java.util.Objects;

/**
 * Outcome of constructing an external classifier: either a ready classifier or the reason
 * none could be built. Callers decide explicitly what to substitute.
 */
public sealed interface ClassifierCreation permits ClassifierCreation.Created, ClassifierCreation.Unavailable {

	/**
	 * Returns the created classifier, or the given fallback wrapped in a
	 * {@link FallbackIntentClassifier} when creation failed.
	 */
	IntentClassifier orFallback(IntentClassifier fallback);

	boolean isAvailable();

	record Created(IntentClassifier classifier) implements ClassifierCreation {

		public Created {
			Objects.requireNonNull(classifier, "classifier must not be null");
		}

		@Override
		public IntentClassifier orFallback(IntentClassifier fallback) {
			return classifier;
		}

		@Override
		public boolean isAvailable() {
			return true;
		}
	}

	record Unavailable(String reason) implements ClassifierCreation {

		@Override
		public IntentClassifier orFallback(IntentClassifier fallback) {
			return new FallbackIntentClassifier(fallback);
		}

		@Override
		public boolean isAvailable() {
			return false;
		}
	}
}
