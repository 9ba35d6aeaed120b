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
package opennlp.storygrounder.text.io;

import java.io.IOException;
import java.io.StringReader;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.text.Story;

import static org.junit.Assert.*;

public class StoryJsonSourceTest {

  private static final String STORIES = "["
      + "{\"id\": \"a1\", \"text\": \"Flooding hit Maputo.\", \"places\": {"
      + "  \"Maputo\": {\"text\": \"Maputo\", \"relevance\": 0.85, \"mentions\": [\"Flooding hit Maputo.\"]},"
      + "  \"Mozambique\": {\"relevance\": 0.4}}},"
      + "{\"text\": \"Nothing happened.\", \"places\": {}}"
      + "]";

  @Test
  public void readsStories() throws Exception {
    StoryJsonSource source = new StoryJsonSource(new StringReader(STORIES));
    List<Story> stories = source.readAll();
    source.close();

    assertEquals(2, stories.size());
    Story first = stories.get(0);
    assertEquals("a1", first.getId());
    assertEquals(2, first.getPlaces().size());
    Place maputo = first.getPlaces().get("Maputo");
    assertEquals(0.85, maputo.getRelevance(), 1e-9);
    assertEquals(1, maputo.getMentions().size());
    Place mozambique = first.getPlaces().get("Mozambique");
    assertEquals("Mozambique", mozambique.getText());
    assertTrue(mozambique.getMentions().isEmpty());

    assertEquals("1", stories.get(1).getId());
    assertTrue(stories.get(1).getPlaces().isEmpty());
  }

  @Test
  public void iterates() throws Exception {
    StoryJsonSource source = new StoryJsonSource(new StringReader(STORIES));
    Iterator<Story> it = source.iterator();
    assertTrue(it.hasNext());
    assertEquals("a1", it.next().getId());
    assertTrue(it.hasNext());
    it.next();
    assertFalse(it.hasNext());
    source.close();
  }

  @Test(expected = IOException.class)
  public void rejectsNonArray() throws Exception {
    new StoryJsonSource(new StringReader("{\"id\": 1}"));
  }

  @Test(expected = IOException.class)
  public void rejectsRelevanceOutOfRange() throws Exception {
    StoryJsonSource source = new StoryJsonSource(new StringReader(
        "[{\"id\": 1, \"text\": \"x\", \"places\": {\"X\": {\"relevance\": 3.0}}}]"));
    source.readAll();
  }
}
