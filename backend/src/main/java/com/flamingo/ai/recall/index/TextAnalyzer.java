package com.flamingo.ai.recall.index;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishMinimalStemFilter;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

/**
 * Turns text into index terms. The same analysis runs at build time and at query time.
 *
 * <p>Chain: Unicode word tokenization, lower-casing, accent folding, English and French stop
 * words, single characters dropped, then minimal English plural stemming.
 */
@Component
public class TextAnalyzer extends Analyzer {

  // English and French; the archive mixes both.
  static final CharArraySet STOP_WORDS =
      CharArraySet.unmodifiableSet(
          new CharArraySet(
              List.of(
                  "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "in", "is",
                  "it", "of", "on", "or", "that", "the", "this", "to", "was", "with", "au", "aux",
                  "ce", "ces", "dans", "de", "des", "du", "en", "est", "et", "il", "la", "le",
                  "les", "un", "une", "ou", "par", "pour", "qui", "que", "sur", "se", "sont",
                  "pas", "ne", "nous", "vous"),
              false));

  @Override
  protected TokenStreamComponents createComponents(String fieldName) {
    StandardTokenizer tokenizer = new StandardTokenizer();
    TokenStream stream = new LowerCaseFilter(tokenizer);
    stream = new ASCIIFoldingFilter(stream);
    stream = new StopFilter(stream, STOP_WORDS);
    stream = new LengthFilter(stream, 2, Integer.MAX_VALUE);
    stream = new EnglishMinimalStemFilter(stream);
    return new TokenStreamComponents(tokenizer, stream);
  }

  @Override
  protected TokenStream normalize(String fieldName, TokenStream in) {
    return new ASCIIFoldingFilter(new LowerCaseFilter(in));
  }

  /**
   * Analyzes {@code text} into terms, in order of occurrence, duplicates included.
   *
   * @return the terms; empty for null or blank input
   */
  public List<String> analyze(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> terms = new ArrayList<>();
    try (TokenStream stream = tokenStream("text", text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        terms.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not analyze text", e);
    }
    return terms;
  }
}
