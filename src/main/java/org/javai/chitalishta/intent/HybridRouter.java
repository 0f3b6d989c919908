package org.javai.chitalishta.intent;

import static org.javai.chitalishta.intent.Explanations.percent;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a query by fusing a rule-based classification with an external (LLM-backed) one.
 *
 * <p>Both classifiers are asked for every query; the fusion rules are evaluated in a fixed
 * order and the first one that applies decides:</p>
 *
 * <ol>
 *   <li><b>agreement</b> - same intent: {@code min(0.95, rule*0.4 + llm*0.6)}</li>
 *   <li><b>hybrid vote</b> - either says HYBRID: HYBRID, weighted toward whoever said it, capped at 0.9</li>
 *   <li><b>high/low split</b> - one above 0.8, the other below 0.5: the confident one wins at {@code conf*0.9}</li>
 *   <li><b>moderate disagreement</b> - both below 0.7: HYBRID at {@code min(0.75, average)}</li>
 *   <li><b>weighted pick</b> - the more confident one wins at {@code (w*0.7 + l*0.3)*0.85}, capped at 0.85</li>
 * </ol>
 *
 * <p>The router holds no per-call state. A failure of the external classifier propagates to
 * the caller; substituting a degraded classifier is the job of whoever wires the router
 * (see {@link IntentClassifiers}).</p>
 */
public class HybridRouter {

	private static final Logger logger = LoggerFactory.getLogger(HybridRouter.class);

	static final double AGREEMENT_CAP = 0.95;
	static final double HYBRID_CAP = 0.9;
	static final double HIGH_CONFIDENCE = 0.8;
	static final double LOW_CONFIDENCE = 0.5;
	static final double SPLIT_PENALTY = 0.9;
	static final double MODERATE_CONFIDENCE = 0.7;
	static final double MODERATE_CAP = 0.75;
	static final double DISAGREEMENT_PENALTY = 0.85;
	static final double DISAGREEMENT_CAP = 0.85;

	/**
	 * Fusion rule that produced a decision. Its tag prefixes every explanation.
	 */
	public enum Branch {
		AGREEMENT("agreement"),
		HYBRID_VOTE("hybrid-vote"),
		HIGH_LOW_SPLIT("high-low-split"),
		MODERATE_DISAGREEMENT("moderate-disagreement"),
		WEIGHTED_PICK("weighted-pick");

		private final String tag;

		Branch(String tag) {
			this.tag = tag;
		}

		public String tag() {
			return "[" + tag + "]";
		}
	}

	private final IntentClassifier ruleClassifier;
	private final IntentClassifier externalClassifier;

	public HybridRouter(IntentClassifier ruleClassifier, IntentClassifier externalClassifier) {
		this.ruleClassifier = Objects.requireNonNull(ruleClassifier, "ruleClassifier must not be null");
		this.externalClassifier = Objects.requireNonNull(externalClassifier, "externalClassifier must not be null");
	}

	/**
	 * Classifies the query with both classifiers and returns the fused routing decision.
	 *
	 * @param query the user query (never null)
	 * @return the routing decision
	 */
	public ClassificationResult route(String query) {
		Objects.requireNonNull(query, "query must not be null");
		ClassificationResult rule = ruleClassifier.classify(query);
		ClassificationResult llm = externalClassifier.classify(query);
		ClassificationResult decision = fuse(rule, llm);
		logger.debug("Routed query: rule={}({}) llm={}({}) -> {}({})",
				rule.intent(), rule.confidence(), llm.intent(), llm.confidence(),
				decision.intent(), decision.confidence());
		return decision;
	}

	/**
	 * Fuses two classifications into one decision. Pure: the same inputs always produce the
	 * same output.
	 *
	 * @param rule the rule-based classification
	 * @param llm the external classification
	 * @return the fused decision; matched signals are taken from the rule-based result
	 */
	public ClassificationResult fuse(ClassificationResult rule, ClassificationResult llm) {
		Objects.requireNonNull(rule, "rule must not be null");
		Objects.requireNonNull(llm, "llm must not be null");

		QueryIntent ruleIntent = rule.intent();
		QueryIntent llmIntent = llm.intent();
		double ruleConf = rule.confidence();
		double llmConf = llm.confidence();

		if (ruleIntent == llmIntent) {
			double confidence = Math.min(AGREEMENT_CAP, ruleConf * 0.4 + llmConf * 0.6);
			return decision(rule, ruleIntent, confidence, Branch.AGREEMENT,
					"И двата класификатора са съгласни за '%s'. Rule-based увереност: %s, LLM увереност: %s. Комбинирана увереност: %s."
							.formatted(ruleIntent.value(), percent(ruleConf), percent(llmConf), percent(confidence)));
		}

		if (ruleIntent == QueryIntent.HYBRID || llmIntent == QueryIntent.HYBRID) {
			return hybridVote(rule, llm);
		}

		if (ruleConf > HIGH_CONFIDENCE && llmConf < LOW_CONFIDENCE) {
			double confidence = ruleConf * SPLIT_PENALTY;
			return decision(rule, ruleIntent, confidence, Branch.HIGH_LOW_SPLIT,
					"Rule-based класификаторът има висока увереност (%s) за '%s', докато LLM има ниска увереност (%s) за '%s'. Използва се решението на rule-based класификатора."
							.formatted(percent(ruleConf), ruleIntent.value(), percent(llmConf), llmIntent.value()));
		}

		if (llmConf > HIGH_CONFIDENCE && ruleConf < LOW_CONFIDENCE) {
			double confidence = llmConf * SPLIT_PENALTY;
			return decision(rule, llmIntent, confidence, Branch.HIGH_LOW_SPLIT,
					"LLM класификаторът има висока увереност (%s) за '%s', докато rule-based има ниска увереност (%s) за '%s'. Използва се решението на LLM класификатора."
							.formatted(percent(llmConf), llmIntent.value(), percent(ruleConf), ruleIntent.value()));
		}

		if (ruleConf < MODERATE_CONFIDENCE && llmConf < MODERATE_CONFIDENCE) {
			double confidence = Math.min(MODERATE_CAP, (ruleConf + llmConf) / 2);
			return decision(rule, QueryIntent.HYBRID, confidence, Branch.MODERATE_DISAGREEMENT,
					"И двата класификатора имат умерена увереност и не са съгласни. Rule-based: '%s' (%s), LLM: '%s' (%s). Използва се хибриден режим като безопасен избор. Комбинирана увереност: %s."
							.formatted(ruleIntent.value(), percent(ruleConf), llmIntent.value(), percent(llmConf),
									percent(confidence)));
		}

		return weightedPick(rule, llm);
	}

	private ClassificationResult hybridVote(ClassificationResult rule, ClassificationResult llm) {
		double ruleConf = rule.confidence();
		double llmConf = llm.confidence();
		double confidence;
		String explanation;
		if (rule.intent() == QueryIntent.HYBRID && llm.intent() == QueryIntent.HYBRID) {
			confidence = (ruleConf + llmConf) / 2;
			explanation = "И двата класификатора са идентифицирали хибридна заявка. Rule-based увереност: %s, LLM увереност: %s."
					.formatted(percent(ruleConf), percent(llmConf));
		} else if (rule.intent() == QueryIntent.HYBRID) {
			confidence = ruleConf * 0.6 + llmConf * 0.4;
			explanation = "Rule-based класификаторът идентифицира хибридна заявка (%s). LLM класификаторът предложи '%s' (%s). Използва се хибриден режим като безопасен избор."
					.formatted(percent(ruleConf), llm.intent().value(), percent(llmConf));
		} else {
			confidence = ruleConf * 0.4 + llmConf * 0.6;
			explanation = "LLM класификаторът идентифицира хибридна заявка (%s). Rule-based класификаторът предложи '%s' (%s). Използва се хибриден режим като безопасен избор."
					.formatted(percent(llmConf), rule.intent().value(), percent(ruleConf));
		}
		confidence = Math.min(confidence, HYBRID_CAP);
		return decision(rule, QueryIntent.HYBRID, confidence, Branch.HYBRID_VOTE,
				explanation + " Комбинирана увереност: %s.".formatted(percent(confidence)));
	}

	private ClassificationResult weightedPick(ClassificationResult rule, ClassificationResult llm) {
		boolean ruleWins = rule.confidence() > llm.confidence();
		ClassificationResult winner = ruleWins ? rule : llm;
		ClassificationResult loser = ruleWins ? llm : rule;
		double confidence = Math.min(DISAGREEMENT_CAP,
				(winner.confidence() * 0.7 + loser.confidence() * 0.3) * DISAGREEMENT_PENALTY);
		String winnerName = ruleWins ? "Rule-based" : "LLM";
		String loserName = ruleWins ? "LLM" : "rule-based";
		return decision(rule, winner.intent(), confidence, Branch.WEIGHTED_PICK,
				"%s класификаторът предложи '%s' с увереност %s, %s предложи '%s' с увереност %s. Използва се '%s' поради по-висока увереност, с намалена увереност поради несъгласие. Финална увереност: %s."
						.formatted(winnerName, winner.intent().value(), percent(winner.confidence()),
								loserName, loser.intent().value(), percent(loser.confidence()),
								winner.intent().value(), percent(confidence)));
	}

	private static ClassificationResult decision(ClassificationResult rule, QueryIntent intent, double confidence,
			Branch branch, String explanation) {
		return new ClassificationResult(intent, confidence, rule.matchedSignals(), branch.tag() + " " + explanation);
	}
}
