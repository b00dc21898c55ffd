package bt7s7k7.herbal_ir.search;

/** A ranked document with the text shown for it. */
public record SearchResult(int document, String name, double score, String summary, String snippet) {}
