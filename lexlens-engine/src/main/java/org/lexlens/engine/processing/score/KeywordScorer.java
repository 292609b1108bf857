package org.lexlens.engine.processing.score;

/*
 * This file is part of LexLens.
 *
 * Copyright (C) 2025 LexLens contributors
 *
 * LexLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LexLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LexLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.lexlens.engine.conf.ScoringProfile;
import org.lexlens.engine.om.FactorType;
import org.lexlens.engine.om.PredictionResult;
import org.lexlens.engine.om.ScoringFactor;
import org.lexlens.engine.om.SuccessProbability;
import org.lexlens.engine.om.Verdict;

/**
 * Six-factor rule engine producing a favorability verdict.
 * <p>
 * Lexical polarity is (favorable - unfavorable) / total over whole-word
 * vocabulary hits, in [-1,1]; it is left out of the breakdown when neither
 * vocabulary occurs. The five presence factors add fixed points per marker
 * found and are clipped to [0,1]. The weighted sum is clamped to [-1,1].
 * <p>
 * Stateless and thread-safe; all patterns are compiled once.
 */
public final class KeywordScorer {

	private static final String B = "(?<![\\p{L}\\p{N}])";
	private static final String E = "(?![\\p{L}\\p{N}])";
	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

	private static final Pattern FAVORABLE = word(
			"procedente|estimamos|accedemos|concedemos|reconocemos|favorable|justificad[oa]|acreditad[oa]"
					+ "|confirmad[oa]|establecid[oa]|fundada|procede|accede|concede|reconoce");

	/** Negated forms come first so "no procedente" wins over "procedente". */
	private static final Pattern UNFAVORABLE = word(
			"no\\s+procedente|no\\s+acreditad[oa]|desestimamos|infundada|rechazamos|denegamos|desfavorable"
					+ "|insuficiente|negligencia|culpabilidad|desestima|rechaza|deniega");

	/** One scored marker: fires when every pattern is found somewhere in the text. */
	private static final class Marker {
		final String label;
		final double points;
		final Pattern[] allOf;

		Marker(String label, double points, Pattern... allOf) {
			this.label = label;
			this.points = points;
			this.allOf = allOf;
		}

		boolean foundIn(String text) {
			for (Pattern p : allOf) {
				if (!p.matcher(text).find()) return false;
			}
			return true;
		}
	}

	private static final Map<FactorType, List<Marker>> MARKERS = Map.of(
			FactorType.STRUCTURE, List.of(
					new Marker("argumentos/fundamentos", 0.3, word("argumentos|fundamentos")),
					new Marker("conclusiones/resolución", 0.3, word("conclusiones|resoluci[oó]n")),
					new Marker("hechos/antecedentes", 0.2, word("hechos|antecedentes")),
					new Marker("solicitud/petitum", 0.2, word("solicitud|petitum"))),
			FactorType.MEDICAL_EVIDENCE, List.of(
					new Marker("informe médico/dictamen pericial", 0.4, word("informe\\s+m[eé]dico|dictamen\\s+pericial")),
					new Marker("lesiones graves/permanentes", 0.3, word("lesiones"), stem("grave|permanente")),
					new Marker("accidente laboral", 0.2, word("accidente\\s+laboral")),
					new Marker("secuelas", 0.1, word("secuelas"))),
			FactorType.PROCEDURE, List.of(
					new Marker("reclamación administrativa previa", 0.4,
							word("reclamaci[oó]n\\s+administrativa\\s+previa")),
					new Marker("trámites cumplidos", 0.3, stem("tr[aá]mite"), stem("cumplid")),
					new Marker("plazos respetados", 0.3, stem("plazo"), word("dentro")),
					new Marker("notificaciones", 0.1, stem("notificaci[oó]n"))),
			FactorType.CONTEXT, List.of(
					new Marker("accidente durante jornada", 0.3, word("durante"), word("jornada")),
					new Marker("accidente en lugar de trabajo", 0.3, word("lugar\\s+de\\s+trabajo")),
					new Marker("medidas de seguridad", 0.2, word("medidas\\s+de\\s+seguridad")),
					new Marker("responsabilidad empresarial", 0.2, word("empresa"), word("responsabilidad"))),
			FactorType.TERMINOLOGY, terminology(
					"actor", "demandado", "procedimiento", "instancia", "resolución", "recurso", "fundamento",
					"considerando"));

	private final ScoringProfile profile;

	public KeywordScorer() {
		this(ScoringProfile.defaults());
	}

	public KeywordScorer(ScoringProfile profile) {
		this.profile = profile;
	}

	public ScoringProfile getProfile() {
		return profile;
	}

	public PredictionResult score(String text) {
		String t = text == null ? "" : text;
		List<ScoringFactor> factors = new ArrayList<>(FactorType.values().length);

		ScoringFactor lexical = lexicalFactor(t);
		if (lexical != null) {
			factors.add(lexical);
		}
		for (FactorType type : new FactorType[] { FactorType.STRUCTURE, FactorType.MEDICAL_EVIDENCE,
				FactorType.PROCEDURE, FactorType.CONTEXT, FactorType.TERMINOLOGY }) {
			factors.add(presenceFactor(type, t));
		}

		double total = 0;
		for (ScoringFactor f : factors) {
			total += f.getWeightedScore();
		}
		total = clamp(total, -1, 1);

		boolean favorable = total > 0;
		double confidence = clamp(Math.abs(total), profile.getConfidenceFloor(), profile.getConfidenceCeiling());

		return PredictionResult.builder()
				.favorable(favorable)
				.confidence(confidence)
				.verdict(verdictFor(favorable, confidence))
				.score(total)
				.factors(factors)
				.successProbability(successProbability(confidence, factors))
				.method(PredictionResult.Method.RULES)
				.build();
	}

	public Verdict verdictFor(boolean favorable, double confidence) {
		return Verdict.of(favorable, confidence, profile.getStrongThreshold(), profile.getModerateThreshold());
	}

	/**
	 * (confidence + mean factor score) / 2, plus a bonus for each of the
	 * evidence, procedure and structure factors above the bonus threshold.
	 */
	public SuccessProbability successProbability(double confidence, List<ScoringFactor> factors) {
		double mean = factors.stream().mapToDouble(ScoringFactor::getScore).average().orElse(0);
		double bonus = 0;
		for (ScoringFactor f : factors) {
			if (f.getScore() < profile.getBonusThreshold()) continue;
			switch (f.getType()) {
			case MEDICAL_EVIDENCE:
				bonus += profile.getEvidenceBonus();
				break;
			case PROCEDURE:
				bonus += profile.getProcedureBonus();
				break;
			case STRUCTURE:
				bonus += profile.getStructureBonus();
				break;
			default:
				break;
			}
		}
		double p = Math.min(profile.getSuccessCeiling(), (confidence + mean) / 2 + bonus);
		return new SuccessProbability(p, mean, bonus, SuccessProbability.Band.of(p));
	}

	// ---- Factors -------------------------------------------------------------

	private ScoringFactor lexicalFactor(String text) {
		List<int[]> negative = spans(UNFAVORABLE, text);
		int unfavorable = negative.size();
		int favorable = 0;
		Matcher m = FAVORABLE.matcher(text);
		while (m.find()) {
			if (!inside(negative, m.start(), m.end())) favorable++;
		}
		int hits = favorable + unfavorable;
		if (hits == 0) return null;

		double score = (favorable - unfavorable) / (double) hits;
		return ScoringFactor.builder()
				.type(FactorType.LEXICAL)
				.score(score)
				.weight(profile.weight(FactorType.LEXICAL))
				.detectedElement("favorables: " + favorable)
				.detectedElement("desfavorables: " + unfavorable)
				.advice(lexicalAdvice(favorable, unfavorable))
				.build();
	}

	private ScoringFactor presenceFactor(FactorType type, String text) {
		double score = 0;
		List<String> found = new ArrayList<>();
		for (Marker marker : MARKERS.get(type)) {
			if (marker.foundIn(text)) {
				score += marker.points;
				found.add(marker.label);
			}
		}
		score = Math.min(1.0, score);
		return ScoringFactor.builder()
				.type(type)
				.score(score)
				.weight(profile.weight(type))
				.detectedElements(found)
				.advice(FactorAdvice.forScore(type, score))
				.build();
	}

	private static String lexicalAdvice(int favorable, int unfavorable) {
		if (favorable > unfavorable) {
			if (favorable >= 5) return "Excelente uso de terminología favorable.";
			if (favorable >= 3) return "Buen uso de terminología favorable; considere términos como 'justificado' o 'acreditado'.";
			return "Uso limitado de terminología favorable; añada términos como 'procedente' o 'estimamos'.";
		}
		if (unfavorable >= 5) return "Uso excesivo de terminología desfavorable; reformule en positivo.";
		if (unfavorable >= 3) return "Uso moderado de terminología desfavorable; revise las frases negativas.";
		return "Se detectan términos desfavorables; revise su contexto.";
	}

	// ---- Helpers -------------------------------------------------------------

	private static List<int[]> spans(Pattern p, String text) {
		List<int[]> out = new ArrayList<>();
		Matcher m = p.matcher(text);
		while (m.find()) {
			out.add(new int[] { m.start(), m.end() });
		}
		return out;
	}

	private static boolean inside(List<int[]> spans, int start, int end) {
		for (int[] s : spans) {
			if (start >= s[0] && end <= s[1]) return true;
		}
		return false;
	}

	private static List<Marker> terminology(String... terms) {
		List<Marker> out = new ArrayList<>(terms.length);
		for (String term : terms) {
			out.add(new Marker(term, 1.0 / terms.length, word(Pattern.quote(term))));
		}
		return List.copyOf(out);
	}

	private static Pattern word(String alternatives) {
		return Pattern.compile(B + "(?:" + alternatives + ")" + E, FLAGS);
	}

	/** Word start only, so "grave" also finds "graves" and "gravemente". */
	private static Pattern stem(String alternatives) {
		return Pattern.compile(B + "(?:" + alternatives + ")", FLAGS);
	}

	static double clamp(double v, double lo, double hi) {
		return Math.max(lo, Math.min(hi, v));
	}
}
