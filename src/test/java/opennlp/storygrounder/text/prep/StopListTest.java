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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import static org.junit.Assert.*;

public class StopListTest {

  @Test
  public void readsWordsSkippingCommentsAndBlanks() throws Exception {
    String text = "# stop words\nThe\n\n  and \nwell-known\n";
    StopList stopList = StopList.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    assertTrue(stopList.contains("the"));
    assertTrue(stopList.contains("and"));
    assertTrue(stopList.contains("well"));
    assertTrue(stopList.contains("known"));
    assertFalse(stopList.contains("# stop words"));
    assertEquals(4, stopList.size());
  }

  @Test
  public void bundledListHasCommonWordsOnly() throws Exception {
    StopList stopList = StopList.fromResource(StopList.DEFAULT_RESOURCE);
    assertTrue(stopList.contains("the"));
    assertTrue(stopList.contains("in"));
    assertFalse(stopList.contains("geneva"));
    assertFalse(stopList.contains("switzerland"));
    assertTrue(StopList.empty().size() == 0);
  }
}
