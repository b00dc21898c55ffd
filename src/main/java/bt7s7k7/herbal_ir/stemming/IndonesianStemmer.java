package bt7s7k7.herbal_ir.stemming;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Stemmer for Indonesian, following the Porter-style rule set described by Fadillah Z. Tala in
 * <i>A Study of Stemming Effects on Information Retrieval in Bahasa Indonesia</i> (2003).
 * <p>
 * Every affix of the rule set contains exactly one vowel, so the number of vowels (the
 * <i>measure</i>) is used as a syllable count. An affix is only removed while the measure is
 * greater than two, which keeps short roots intact.
 * <p>
 * Deviations from the published rules: the nasal prefixes are recoded to the initial consonant of
 * the root ({@code meny-}/{@code peny-} to {@code s}, {@code mem-}/{@code pem-} to {@code p},
 * {@code men-}/{@code pen-} to {@code t} when followed by a vowel). When a {@link RootDictionary}
 * is supplied, the derivation is repeated with the nasal kept instead, and the first produced form
 * that is a known root is returned. If no form is a known root, the word is returned unchanged.
 */
public class IndonesianStemmer implements Stemmer {
	public static final int MIN_WORD_LENGTH = 3;
	public static final int MIN_MEASURE = 2;

	protected enum Prefix {
		DI, MENG, TER, KE, PENG, BER, PE, PER
	}

	protected final RootDictionary dictionary;

	public IndonesianStemmer() {
		this(RootDictionary.EMPTY);
	}

	public IndonesianStemmer(RootDictionary dictionary) {
		this.dictionary = dictionary;
	}

	public RootDictionary getDictionary() {
		return this.dictionary;
	}

	/** Progress of stemming a single word. Not shared between calls. */
	protected static class State {
		protected String word;
		protected int measure;
		protected final EnumSet<Prefix> removed = EnumSet.noneOf(Prefix.class);
		/** Every form the word went through, in order of removal. */
		protected final List<String> forms = new ArrayList<>();
		/** Keep the nasal of a prefix instead of recoding it, e.g. menikah becomes nikah, not tikah. */
		protected final boolean keepNasal;

		protected State(String word, boolean keepNasal) {
			this.word = word;
			this.measure = countVowels(word);
			this.keepNasal = keepNasal;
		}

		protected boolean canRemove() {
			return this.measure > MIN_MEASURE;
		}

		protected void replace(String next) {
			this.word = next;
			this.measure = countVowels(next);
			this.forms.add(next);
		}

		protected void removeStart(int count) {
			this.replace(this.word.substring(count));
		}

		protected void removeEnd(int count) {
			this.replace(this.word.substring(0, this.word.length() - count));
		}

		/** Replaces the first {@code count} characters with {@code consonant}. */
		protected void recode(int count, String consonant) {
			this.replace(consonant + this.word.substring(count));
		}
	}

	@Override
	public String stem(String word) {
		if (word == null || word.length() < MIN_WORD_LENGTH) return word;
		if (countVowels(word) <= MIN_MEASURE) return word;

		if (this.dictionary.isEmpty()) {
			return this.derive(word, false).word;
		}

		if (this.dictionary.contains(word)) return word;

		for (var keepNasal : new boolean[] { false, true }) {
			var state = this.derive(word, keepNasal);
			for (var form : state.forms) {
				if (this.dictionary.contains(form)) return form;
			}
		}

		// No removal produced a known root, so the affixes are probably part of the word
		return word;
	}

	protected State derive(String word, boolean keepNasal) {
		var state = new State(word, keepNasal);

		if (state.canRemove()) removeParticle(state);
		if (state.canRemove()) removePossessivePronoun(state);

		if (state.canRemove()) {
			if (removeFirstOrderPrefix(state)) {
				if (state.canRemove() && removeSuffix(state)) {
					if (state.canRemove()) removeSecondOrderPrefix(state);
				}
			} else {
				if (state.canRemove()) removeSecondOrderPrefix(state);
				if (state.canRemove()) removeSuffix(state);
			}
		}

		return state;
	}

	protected static boolean removeParticle(State state) {
		var word = state.word;
		if (word.endsWith("kah") || word.endsWith("lah") || word.endsWith("pun")) {
			state.removeEnd(3);
			return true;
		}
		return false;
	}

	protected static boolean removePossessivePronoun(State state) {
		var word = state.word;
		if (word.endsWith("ku") || word.endsWith("mu")) {
			state.removeEnd(2);
			return true;
		}
		if (word.endsWith("nya")) {
			state.removeEnd(3);
			return true;
		}
		return false;
	}

	protected static boolean removeFirstOrderPrefix(State state) {
		var word = state.word;

		if (word.startsWith("meng")) {
			state.removed.add(Prefix.MENG);
			state.removeStart(4);
			return true;
		}

		if (word.startsWith("meny") && followedByVowel(word, 4)) {
			state.removed.add(Prefix.MENG);
			if (state.keepNasal) state.recode(4, "ny");
			else state.recode(4, "s");
			return true;
		}

		if (word.startsWith("men")) {
			state.removed.add(Prefix.MENG);
			if (followedByVowel(word, 3)) {
				if (state.keepNasal) state.recode(3, "n");
				else state.recode(3, "t");
			} else {
				state.removeStart(3);
			}
			return true;
		}

		if (word.startsWith("mem")) {
			state.removed.add(Prefix.MENG);
			if (followedByVowel(word, 3)) {
				if (state.keepNasal) state.recode(3, "m");
				else state.recode(3, "p");
			} else {
				state.removeStart(3);
			}
			return true;
		}

		if (word.startsWith("me")) {
			state.removed.add(Prefix.MENG);
			state.removeStart(2);
			return true;
		}

		if (word.startsWith("peng")) {
			state.removed.add(Prefix.PENG);
			state.removeStart(4);
			return true;
		}

		if (word.startsWith("peny")) {
			state.removed.add(Prefix.PENG);
			if (followedByVowel(word, 4)) {
				if (state.keepNasal) state.recode(4, "ny");
				else state.recode(4, "s");
			} else {
				state.removeStart(4);
			}
			return true;
		}

		if (word.startsWith("pen")) {
			state.removed.add(Prefix.PENG);
			if (followedByVowel(word, 3)) {
				if (state.keepNasal) state.recode(3, "n");
				else state.recode(3, "t");
			} else {
				state.removeStart(3);
			}
			return true;
		}

		if (word.startsWith("pem")) {
			state.removed.add(Prefix.PENG);
			if (followedByVowel(word, 3)) {
				if (state.keepNasal) state.recode(3, "m");
				else state.recode(3, "p");
			} else {
				state.removeStart(3);
			}
			return true;
		}

		if (word.startsWith("di")) {
			state.removed.add(Prefix.DI);
			state.removeStart(2);
			return true;
		}

		if (word.startsWith("ter")) {
			state.removed.add(Prefix.TER);
			state.removeStart(3);
			return true;
		}

		if (word.startsWith("ke")) {
			state.removed.add(Prefix.KE);
			state.removeStart(2);
			return true;
		}

		return false;
	}

	protected static boolean removeSecondOrderPrefix(State state) {
		var word = state.word;

		if (word.startsWith("ber")) {
			state.removed.add(Prefix.BER);
			state.removeStart(3);
			return true;
		}

		if (word.startsWith("belajar")) {
			state.removed.add(Prefix.BER);
			state.removeStart(3);
			return true;
		}

		// be + consonant + er, as in bekerja
		if (word.startsWith("be") && word.length() > 4 && !isVowel(word.charAt(2)) && word.startsWith("er", 3)) {
			state.removed.add(Prefix.BER);
			state.removeStart(2);
			return true;
		}

		if (word.startsWith("per")) {
			state.removed.add(Prefix.PER);
			state.removeStart(3);
			return true;
		}

		// The only root where pe- is followed by an l
		if (word.startsWith("pelajar")) {
			state.removeStart(3);
			return true;
		}

		if (word.startsWith("pe")) {
			state.removed.add(Prefix.PE);
			state.removeStart(2);
			return true;
		}

		return false;
	}

	protected static boolean removeSuffix(State state) {
		var word = state.word;
		var removed = state.removed;

		if (word.endsWith("kan")
				&& !removed.contains(Prefix.KE)
				&& !removed.contains(Prefix.PENG)
				&& !removed.contains(Prefix.PE)) {
			state.removeEnd(3);
			return true;
		}

		if (word.endsWith("an")
				&& !removed.contains(Prefix.DI)
				&& !removed.contains(Prefix.MENG)
				&& !removed.contains(Prefix.TER)) {
			state.removeEnd(2);
			return true;
		}

		if (word.endsWith("i")
				&& !word.endsWith("si")
				&& !removed.contains(Prefix.BER)
				&& !removed.contains(Prefix.KE)
				&& !removed.contains(Prefix.PENG)) {
			state.removeEnd(1);
			return true;
		}

		return false;
	}

	protected static boolean followedByVowel(String word, int index) {
		return word.length() > index && isVowel(word.charAt(index));
	}

	protected static boolean isVowel(char ch) {
		return switch (ch) {
			case 'a', 'e', 'i', 'o', 'u' -> true;
			default -> false;
		};
	}

	protected static int countVowels(String word) {
		var count = 0;
		for (var i = 0; i < word.length(); i++) {
			if (isVowel(word.charAt(i))) count++;
		}
		return count;
	}
}
