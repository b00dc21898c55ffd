package bt7s7k7.herbal_ir.ranking;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Immutable vector over the vocabulary that only stores non-zero weights. Entries are ordered by
 * term index, so the dot product is a merge of two sorted lists.
 */
public final class SparseVector {
	public static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

	private final int[] terms;
	private final double[] weights;
	private final double norm;

	private SparseVector(int[] terms, double[] weights) {
		this.terms = terms;
		this.weights = weights;

		var sum = 0.0;
		for (var weight : weights) {
			sum += weight * weight;
		}
		this.norm = Math.sqrt(sum);
	}

	/** Creates a vector from term weights. Zero weights are dropped. */
	public static SparseVector of(Map<Integer, Double> weights) {
		var sorted = new TreeMap<Integer, Double>();
		for (var kv : weights.entrySet()) {
			if (kv.getValue() != 0.0) sorted.put(kv.getKey(), kv.getValue());
		}

		var terms = new int[sorted.size()];
		var values = new double[sorted.size()];
		var i = 0;
		for (var kv : sorted.entrySet()) {
			terms[i] = kv.getKey();
			values[i] = kv.getValue();
			i++;
		}

		return new SparseVector(terms, values);
	}

	public int size() {
		return this.terms.length;
	}

	public boolean isZero() {
		return this.terms.length == 0;
	}

	public double norm() {
		return this.norm;
	}

	/** Returns the weight of the term, zero if the term is not present. */
	public double get(int term) {
		var index = Arrays.binarySearch(this.terms, term);
		if (index < 0) return 0;
		return this.weights[index];
	}

	public void forEach(BiConsumer<Integer, Double> consumer) {
		for (var i = 0; i < this.terms.length; i++) {
			consumer.accept(this.terms[i], this.weights[i]);
		}
	}

	public Map<Integer, Double> toMap() {
		var result = new TreeMap<Integer, Double>();
		this.forEach(result::put);
		return result;
	}

	public double dot(SparseVector other) {
		var result = 0.0;

		var index1 = 0;
		var index2 = 0;

		while (index1 < this.terms.length && index2 < other.terms.length) {
			var a = this.terms[index1];
			var b = other.terms[index2];

			if (a == b) {
				result += this.weights[index1] * other.weights[index2];
				index1++;
				index2++;
			} else if (a < b) {
				index1++;
			} else {
				index2++;
			}
		}

		return result;
	}

	/** Cosine of the angle between the vectors, zero if either of them is zero. */
	public double cosine(SparseVector other) {
		if (this.norm == 0 || other.norm == 0) return 0;
		return this.dot(other) / (this.norm * other.norm);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) return true;
		if (obj instanceof SparseVector other) return Arrays.equals(this.terms, other.terms) && Arrays.equals(this.weights, other.weights);
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(this.terms) + Arrays.hashCode(this.weights);
	}

	@Override
	public String toString() {
		return this.toMap().toString();
	}
}
