///////////////////////////////////////////////////////////////////////////////
//  Copyright (C) 2010 Travis Brown, The University of Texas at Austin
//
//  Licensed under the Apache License, Version 2.0 (the "License");
//  you may not use this file except in compliance with the License.
//  You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
//  Unless required by applicable law or agreed to in writing, software
//  distributed under the License is distributed on an "AS IS" BASIS,
//  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
//  See the License for the specific language governing permissions and
//  limitations under the License.
///////////////////////////////////////////////////////////////////////////////
package opennlp.storygrounder.filter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import gnu.trove.iterator.TIntDoubleIterator;
import gnu.trove.map.hash.TIntDoubleHashMap;

import opennlp.storygrounder.text.prep.StopList;
import opennlp.storygrounder.text.prep.Tokenizer;
import opennlp.storygrounder.util.CountingLexicon;
import opennlp.storygrounder.util.SimpleCountingLexicon;

/**
 * Bag-of-words model mapping a text to an L2-normalized tf-idf vector.
 *
 * The vocabulary and document frequencies are fixed when the model is fit;
 * terms unseen at fit time are ignored by {@link #transform(String)}.
 * Inverse document frequency is smoothed: idf(t) = ln((1 + n) / (1 + df(t))) + 1.
 */
public class TfIdfVectorizer {

  /** Digits and stray symbols are removed before tokenizing. */
  public static final Pattern BAD_SYMBOLS = Pattern.compile("[\\d?!@#$%^&*_+]+");

  private static final Pattern WORD = Pattern.compile("\\w\\w+", Pattern.UNICODE_CHARACTER_CLASS);

  private final Tokenizer tokenizer;
  private final StopList stopList;
  private final CountingLexicon<String> vocabulary;
  private final int numDocuments;
  private final double[] idf;

  private TfIdfVectorizer(Tokenizer tokenizer, StopList stopList,
                          CountingLexicon<String> vocabulary, int numDocuments) {
    this.tokenizer = tokenizer;
    this.stopList = stopList;
    this.vocabulary = vocabulary;
    this.numDocuments = numDocuments;
    this.idf = new double[vocabulary.size()];
    for (int i = 0; i < this.idf.length; i++) {
      int df = vocabulary.countAtIndex(i);
      this.idf[i] = Math.log((1.0 + numDocuments) / (1.0 + df)) + 1.0;
    }
  }

  /**
   * Learns vocabulary and document frequencies from the given texts.
   */
  public static TfIdfVectorizer fit(List<String> texts, Tokenizer tokenizer, StopList stopList) {
    CountingLexicon<String> vocabulary = new SimpleCountingLexicon<String>();
    for (String text : texts) {
      // each document counts once per term
      Set<String> terms = new LinkedHashSet<String>(analyze(text, tokenizer, stopList));
      for (String term : terms) {
        vocabulary.getOrAdd(term);
      }
    }
    vocabulary.stopGrowing();
    return new TfIdfVectorizer(tokenizer, stopList, vocabulary, texts.size());
  }

  /**
   * Lowercases, strips symbols, tokenizes, and drops stop words and
   * single-character tokens.
   */
  public static List<String> analyze(String text, Tokenizer tokenizer, StopList stopList) {
    List<String> terms = new ArrayList<String>();
    if (text == null)
      return terms;
    String cleaned = BAD_SYMBOLS.matcher(text.toLowerCase()).replaceAll("");
    for (String token : tokenizer.tokenize(cleaned)) {
      if (WORD.matcher(token).matches() && !stopList.contains(token))
        terms.add(token);
    }
    return terms;
  }

  public List<String> analyze(String text) {
    return analyze(text, this.tokenizer, this.stopList);
  }

  /**
   * Sparse tf-idf vector of text, keyed by vocabulary index. The vector is
   * empty if text shares no term with the vocabulary.
   */
  public TIntDoubleHashMap transform(String text) {
    TIntDoubleHashMap vector = new TIntDoubleHashMap();
    for (String term : this.analyze(text)) {
      int index = this.vocabulary.get(term);
      if (index >= 0)
        vector.adjustOrPutValue(index, 1.0, 1.0);
    }

    double norm = 0.0;
    for (TIntDoubleIterator it = vector.iterator(); it.hasNext(); ) {
      it.advance();
      double weight = it.value() * this.idf[it.key()];
      it.setValue(weight);
      norm += weight * weight;
    }
    if (norm > 0.0) {
      norm = Math.sqrt(norm);
      for (TIntDoubleIterator it = vector.iterator(); it.hasNext(); ) {
        it.advance();
        it.setValue(it.value() / norm);
      }
    }
    return vector;
  }

  public static double dot(TIntDoubleHashMap a, TIntDoubleHashMap b) {
    if (a.size() > b.size())
      return dot(b, a);
    double sum = 0.0;
    for (TIntDoubleIterator it = a.iterator(); it.hasNext(); ) {
      it.advance();
      if (b.containsKey(it.key()))
        sum += it.value() * b.get(it.key());
    }
    return sum;
  }

  /**
   * Cosine similarity of two texts; vectors are already normalized, so this
   * is their dot product.
   */
  public double cosine(String text1, String text2) {
    return dot(this.transform(text1), this.transform(text2));
  }

  public int getVocabularySize() {
    return this.vocabulary.size();
  }

  public int getNumDocuments() {
    return this.numDocuments;
  }

  public int documentFrequency(String term) {
    return this.vocabulary.count(term);
  }
}
