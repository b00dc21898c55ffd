package bt7s7k7.herbal_ir.stemming;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces words to their root form. Implementations must never throw, and must return the input
 * unchanged when no rule applies.
 */
public interface Stemmer {
	public String stem(String word);

	/**
	 * Stems every word of the list. The result has the same length as the input, and the root at
	 * position {@code i} belongs to the word at position {@code i}.
	 */
	public default List<String> stemAll(List<String> words) {
		var result = new ArrayList<String>(words.size());
		for (var word : words) {
			result.add(this.stem(word));
		}
		return result;
	}
}
