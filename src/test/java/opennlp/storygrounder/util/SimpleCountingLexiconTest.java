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
package opennlp.storygrounder.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class SimpleCountingLexiconTest {

  @Test
  public void countsAdditions() {
    SimpleCountingLexicon<String> lexicon = new SimpleCountingLexicon<String>();
    assertEquals(0, lexicon.getOrAdd("geneva"));
    assertEquals(1, lexicon.getOrAdd("lausanne"));
    assertEquals(0, lexicon.getOrAdd("geneva"));

    assertEquals(2, lexicon.size());
    assertEquals(2, lexicon.count("geneva"));
    assertEquals(1, lexicon.countAtIndex(1));
    assertEquals(0, lexicon.count("bern"));
    assertEquals(-1, lexicon.get("bern"));
    assertEquals("lausanne", lexicon.atIndex(1));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void stoppedLexiconRejectsNewEntries() {
    SimpleCountingLexicon<String> lexicon = new SimpleCountingLexicon<String>();
    lexicon.getOrAdd("geneva");
    lexicon.stopGrowing();
    assertFalse(lexicon.isGrowing());
    lexicon.getOrAdd("bern");
  }
}
