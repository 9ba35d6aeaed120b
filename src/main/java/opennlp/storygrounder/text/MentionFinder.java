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
package opennlp.storygrounder.text;

import java.io.BufferedInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import opennlp.tools.sentdetect.SentenceDetector;
import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;

import opennlp.storygrounder.text.prep.BreakIteratorSentenceDetector;

/**
 * Extracts the sentences of a story in which a place is mentioned.
 */
public class MentionFinder {

  public static final int MAX_MENTIONS = 6;

  private final SentenceDetector detector;
  private final int limit;

  public MentionFinder() {
    this(new BreakIteratorSentenceDetector(), MAX_MENTIONS);
  }

  public MentionFinder(SentenceDetector detector, int limit) {
    this.detector = detector;
    this.limit = limit;
  }

  /**
   * Uses a trained OpenNLP sentence model (e.g. en-sent.bin) for splitting.
   */
  public static MentionFinder fromModel(String modelPath) throws IOException {
    InputStream in = new BufferedInputStream(new FileInputStream(modelPath));
    try {
      return new MentionFinder(new SentenceDetectorME(new SentenceModel(in)), MAX_MENTIONS);
    } finally {
      in.close();
    }
  }

  /**
   * Sentences of text containing placeText verbatim, in story order, at
   * most limit of them.
   */
  public List<String> find(String placeText, String text) {
    List<String> mentions = new ArrayList<String>();
    if (placeText == null || placeText.length() == 0 || text == null)
      return mentions;
    String[] sentences;
    // SentenceDetectorME keeps per-call state
    synchronized (this.detector) {
      sentences = this.detector.sentDetect(text);
    }
    for (String sentence : sentences) {
      if (mentions.size() >= this.limit)
        break;
      if (sentence.contains(placeText))
        mentions.add(sentence);
    }
    return mentions;
  }

  /**
   * Fills in mentions for places that arrived without any.
   */
  public Map<String, Place> addMentions(Map<String, Place> places, String text) {
    Map<String, Place> withMentions = new LinkedHashMap<String, Place>();
    for (Map.Entry<String, Place> entry : places.entrySet()) {
      Place place = entry.getValue();
      if (place.getMentions().isEmpty())
        place = place.withMentions(this.find(place.getText(), text));
      withMentions.put(entry.getKey(), place);
    }
    return withMentions;
  }
}
