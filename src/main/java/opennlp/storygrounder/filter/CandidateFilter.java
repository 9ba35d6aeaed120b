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

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import gnu.trove.map.hash.TIntDoubleHashMap;

import opennlp.storygrounder.text.prep.OpenNLPTokenizer;
import opennlp.storygrounder.text.prep.StopList;
import opennlp.storygrounder.text.prep.Tokenizer;
import opennlp.storygrounder.topo.Location;

/**
 * Ranks and prunes the geocoding candidates of each place by the textual
 * similarity of the candidate's address to the article it was mentioned in.
 *
 * A tf-idf model is fit on every call over the reference corpus plus the
 * article, so that names appearing only in the article are in-vocabulary.
 */
public class CandidateFilter {

  private static final Logger LOG = Logger.getLogger(CandidateFilter.class.getName());

  public static final double DEFAULT_THRESHOLD = 0.1;
  public static final String DEFAULT_CORPUS_RESOURCE = "/reference-corpus.txt";

  /** Address fields that carry codes rather than words. */
  public static final Set<String> EXCLUDED_ADDRESS_COMPONENTS = ImmutableSet.of(
      "ISO_3166-1_alpha-2", "ISO_3166-1_alpha-3", "_type",
      "country_code", "road_type", "postcode");

  /** Upper bin edges for the similarity histograms written to the log. */
  public static final double[] HISTOGRAM_BINS = { 0, .05, .1, .15, .2, .25, .3, 1 };

  private final List<String> corpus;
  private final Tokenizer tokenizer;
  private final StopList stopList;
  private final double threshold;
  private final boolean normed;

  /**
   * @param corpus    reference texts the vocabulary is fit on with the article
   * @param threshold candidates at or below this similarity are discarded
   * @param normed    if true, similarities are divided by the largest
   *                  similarity among all candidates before thresholding
   */
  public CandidateFilter(List<String> corpus, Tokenizer tokenizer, StopList stopList,
                         double threshold, boolean normed) {
    Preconditions.checkNotNull(corpus, "corpus");
    Preconditions.checkNotNull(tokenizer, "tokenizer");
    Preconditions.checkNotNull(stopList, "stopList");
    this.corpus = new ArrayList<String>(corpus);
    this.tokenizer = tokenizer;
    this.stopList = stopList;
    this.threshold = threshold;
    this.normed = normed;
  }

  public CandidateFilter(List<String> corpus, StopList stopList, double threshold) {
    this(corpus, new OpenNLPTokenizer(), stopList, threshold, false);
  }

  /**
   * A filter over the bundled reference corpus and stop list.
   */
  public static CandidateFilter createDefault(double threshold, boolean normed) throws IOException {
    return new CandidateFilter(defaultCorpus(), new OpenNLPTokenizer(),
                               StopList.fromResource(StopList.DEFAULT_RESOURCE),
                               threshold, normed);
  }

  public static List<String> defaultCorpus() throws IOException {
    InputStream in = CandidateFilter.class.getResourceAsStream(DEFAULT_CORPUS_RESOURCE);
    if (in == null)
      throw new IOException("reference corpus resource not found: " + DEFAULT_CORPUS_RESOURCE);
    try {
      return readCorpus(in);
    } finally {
      in.close();
    }
  }

  public static List<String> loadCorpus(String path) throws IOException {
    InputStream in = new FileInputStream(path);
    try {
      return readCorpus(in);
    } finally {
      in.close();
    }
  }

  /**
   * Reads one text per non-blank line.
   */
  public static List<String> readCorpus(InputStream in) throws IOException {
    List<String> texts = new ArrayList<String>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim();
      if (line.length() > 0)
        texts.add(line);
    }
    return texts;
  }

  /**
   * Address text compared against the article: the word-bearing address
   * components if the geocoder supplied any, else the formatted address.
   */
  public static String addressText(Location location) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> component : location.getComponents().entrySet()) {
      if (EXCLUDED_ADDRESS_COMPONENTS.contains(component.getKey()))
        continue;
      if (sb.length() > 0)
        sb.append(' ');
      sb.append(component.getValue());
    }
    if (location.getComponents().isEmpty())
      return location.getAddress();
    return sb.toString();
  }

  /**
   * Returns, for each place with at least one surviving candidate, its
   * surviving candidates ordered by descending similarity. Places are kept in
   * input order; raw address components are stripped from the survivors.
   */
  public Map<String, List<Location>> filter(Map<String, List<Location>> candidatesByPlace,
                                            String articleText) {
    List<String> documents = new ArrayList<String>(this.corpus);
    documents.add(articleText);
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(documents, this.tokenizer, this.stopList);
    TIntDoubleHashMap articleVector = vectorizer.transform(articleText);

    Map<String, double[]> similarities = new LinkedHashMap<String, double[]>();
    double max = 0.0;
    for (Map.Entry<String, List<Location>> entry : candidatesByPlace.entrySet()) {
      List<Location> candidates = entry.getValue();
      double[] sims = new double[candidates.size()];
      for (int i = 0; i < sims.length; i++) {
        sims[i] = TfIdfVectorizer.dot(vectorizer.transform(addressText(candidates.get(i))),
                                      articleVector);
        max = Math.max(max, sims[i]);
      }
      similarities.put(entry.getKey(), sims);
    }

    Map<String, List<Location>> filtered = new LinkedHashMap<String, List<Location>>();
    for (Map.Entry<String, List<Location>> entry : candidatesByPlace.entrySet()) {
      String name = entry.getKey();
      final List<Location> candidates = entry.getValue();
      final double[] sims = similarities.get(name);
      if (this.normed) {
        for (int i = 0; i < sims.length; i++)
          sims[i] = max > 0.0 ? sims[i] / max : 0.0;
      }

      if (LOG.isLoggable(Level.FINE))
        LOG.fine(String.format("%s: similarity histogram %s", name, histogramString(sims)));

      List<Integer> order = new ArrayList<Integer>(sims.length);
      for (int i = 0; i < sims.length; i++)
        order.add(i);
      Collections.sort(order, new Comparator<Integer>() {
        public int compare(Integer a, Integer b) {
          return Double.compare(sims[b], sims[a]);
        }
      });

      List<Location> kept = new ArrayList<Location>();
      for (int i : order) {
        Location candidate = candidates.get(i);
        LOG.fine(String.format("%s: %.3f %s", name, sims[i], candidate.getAddress()));
        if (sims[i] > this.threshold)
          kept.add(candidate.withoutComponents());
      }

      if (kept.isEmpty()) {
        LOG.warning(String.format("Dropping %s: none of %d candidates above similarity %.3f",
                                  name, candidates.size(), this.threshold));
      } else {
        filtered.put(name, kept);
      }
    }
    return filtered;
  }

  /**
   * Counts of values falling in each interval (bins[i], bins[i+1]]; the
   * first interval also takes values equal to bins[0].
   */
  public static int[] histogram(double[] values, double[] bins) {
    int[] counts = new int[bins.length - 1];
    for (double value : values) {
      for (int b = 0; b < counts.length; b++) {
        if (value <= bins[b + 1] && (value > bins[b] || b == 0 && value >= bins[0])) {
          counts[b]++;
          break;
        }
      }
    }
    return counts;
  }

  private static String histogramString(double[] values) {
    int[] counts = histogram(values, HISTOGRAM_BINS);
    StringBuilder sb = new StringBuilder();
    for (int b = 0; b < counts.length; b++) {
      if (b > 0)
        sb.append(' ');
      sb.append(HISTOGRAM_BINS[b + 1]).append(':').append(counts[b]);
    }
    return sb.toString();
  }

  public double getThreshold() {
    return this.threshold;
  }

  public boolean isNormed() {
    return this.normed;
  }
}
