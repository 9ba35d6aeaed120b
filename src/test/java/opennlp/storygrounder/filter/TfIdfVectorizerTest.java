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

import java.util.Arrays;
import java.util.HashSet;

import gnu.trove.map.hash.TIntDoubleHashMap;

import org.junit.Test;

import opennlp.storygrounder.text.prep.OpenNLPTokenizer;
import opennlp.storygrounder.text.prep.StopList;

import static org.junit.Assert.*;

public class TfIdfVectorizerTest {

  private final OpenNLPTokenizer tokenizer = new OpenNLPTokenizer();

  @Test
  public void analyzeLowercasesAndDropsSymbolsDigitsAndShortTokens() {
    StopList stopList = new StopList(new HashSet<String>(Arrays.asList("in")));
    assertEquals(Arrays.asList("talks", "geneva", "switzerland"),
                 TfIdfVectorizer.analyze("Talks in Geneva, Switzerland: 2019! A", this.tokenizer, stopList));
  }

  @Test
  public void smoothedIdf() {
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(Arrays.asList("apple banana", "apple cherry"),
                                                     this.tokenizer, StopList.empty());
    assertEquals(3, vectorizer.getVocabularySize());
    assertEquals(2, vectorizer.documentFrequency("apple"));
    assertEquals(1, vectorizer.documentFrequency("banana"));
    assertEquals(0, vectorizer.documentFrequency("durian"));

    // apple: idf 1; banana: idf ln(3/2) + 1
    TIntDoubleHashMap v = vectorizer.transform("apple banana");
    double banana = Math.log(1.5) + 1.0;
    double norm = Math.sqrt(1.0 + banana * banana);
    assertEquals(2, v.size());
    double[] weights = v.values();
    Arrays.sort(weights);
    assertEquals(1.0 / norm, weights[0], 1e-12);
    assertEquals(banana / norm, weights[1], 1e-12);
  }

  @Test
  public void documentFrequencyCountsEachDocumentOnce() {
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(Arrays.asList("rain rain rain", "sun"),
                                                     this.tokenizer, StopList.empty());
    assertEquals(1, vectorizer.documentFrequency("rain"));
    assertEquals(2, vectorizer.getNumDocuments());
  }

  @Test
  public void vectorsAreUnitLength() {
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(
        Arrays.asList("the storm moved north", "rain fell in the north overnight"),
        this.tokenizer, StopList.empty());
    TIntDoubleHashMap v = vectorizer.transform("storm storm north rain");
    assertEquals(1.0, TfIdfVectorizer.dot(v, v), 1e-12);
  }

  @Test
  public void cosineOfIdenticalTextIsOne() {
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(Arrays.asList("delegates met in geneva"),
                                                     this.tokenizer, StopList.empty());
    assertEquals(1.0, vectorizer.cosine("Delegates met in Geneva", "delegates met in geneva"), 1e-12);
  }

  @Test
  public void unknownTermsAreIgnored() {
    TfIdfVectorizer vectorizer = TfIdfVectorizer.fit(Arrays.asList("delegates met in geneva"),
                                                     this.tokenizer, StopList.empty());
    assertTrue(vectorizer.transform("Illinois").isEmpty());
    assertEquals(0.0, vectorizer.cosine("Illinois", "delegates met in geneva"), 0.0);
  }
}
