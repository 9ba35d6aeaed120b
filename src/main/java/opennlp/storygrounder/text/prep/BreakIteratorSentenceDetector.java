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
package opennlp.storygrounder.text.prep;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import opennlp.tools.sentdetect.SentenceDetector;
import opennlp.tools.util.Span;

/**
 * Rule-based sentence splitting for when no trained OpenNLP sentence model is
 * available. Sentence spans are trimmed of surrounding whitespace.
 */
public class BreakIteratorSentenceDetector implements SentenceDetector {

  private final Locale locale;

  public BreakIteratorSentenceDetector() {
    this(Locale.ENGLISH);
  }

  public BreakIteratorSentenceDetector(Locale locale) {
    this.locale = locale;
  }

  public String[] sentDetect(String s) {
    return Span.spansToStrings(this.sentPosDetect(s), s);
  }

  public Span[] sentPosDetect(String s) {
    BreakIterator iterator = BreakIterator.getSentenceInstance(this.locale);
    iterator.setText(s);
    List<Span> spans = new ArrayList<Span>();
    int start = iterator.first();
    for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
      int from = start;
      int to = end;
      while (from < to && Character.isWhitespace(s.charAt(from)))
        from++;
      while (to > from && Character.isWhitespace(s.charAt(to - 1)))
        to--;
      if (to > from)
        spans.add(new Span(from, to));
    }
    return spans.toArray(new Span[spans.size()]);
  }
}
