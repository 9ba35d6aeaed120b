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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.text.Story;

/**
 * Reads stories from a JSON array of objects of the form
 * <pre>
 * {"id": ..., "text": ..., "places": {name: {"text": ..., "relevance": ..., "mentions": [...]}}}
 * </pre>
 * one at a time. A place without "text" uses its name; "mentions" is
 * optional.
 */
public class StoryJsonSource implements Iterable<Story>, Closeable {

  private final ObjectMapper mapper;
  private final JsonParser parser;
  private int count = 0;

  public StoryJsonSource(Reader reader) throws IOException {
    this.mapper = new ObjectMapper();
    this.parser = this.mapper.getFactory().createParser(reader);
    if (this.parser.nextToken() != JsonToken.START_ARRAY)
      throw new IOException("Expected a JSON array of stories");
  }

  public static StoryJsonSource fromFile(String path) throws IOException {
    return new StoryJsonSource(new BufferedReader(
        new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8)));
  }

  /**
   * The next story, or null at the end of the array.
   */
  public Story read() throws IOException {
    JsonToken token = this.parser.nextToken();
    if (token == null || token == JsonToken.END_ARRAY)
      return null;
    JsonNode node = this.mapper.readTree(this.parser);
    return parseStory(node, Integer.toString(this.count++));
  }

  public List<Story> readAll() throws IOException {
    List<Story> stories = new ArrayList<Story>();
    Story story;
    while ((story = this.read()) != null)
      stories.add(story);
    return stories;
  }

  /**
   * @param defaultId used if the record has no id
   */
  public static Story parseStory(JsonNode node, String defaultId) throws IOException {
    if (node == null || !node.isObject())
      throw new IOException("Story record is not an object: " + node);
    String id = node.hasNonNull("id") ? node.get("id").asText() : defaultId;
    String text = node.path("text").asText("");

    Map<String, Place> places = new LinkedHashMap<String, Place>();
    JsonNode placesNode = node.path("places");
    for (Iterator<Map.Entry<String, JsonNode>> it = placesNode.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      String name = entry.getKey();
      JsonNode data = entry.getValue();
      List<String> mentions = new ArrayList<String>();
      for (JsonNode mention : data.path("mentions"))
        mentions.add(mention.asText());
      try {
        places.put(name, new Place(name, data.path("text").asText(name),
                                   data.path("relevance").asDouble(0.0), mentions));
      } catch (IllegalArgumentException e) {
        throw new IOException("Bad place " + name + " in story " + id, e);
      }
    }
    return new Story(id, text, places);
  }

  public Iterator<Story> iterator() {
    return new Iterator<Story>() {
      private Story next = advance();

      private Story advance() {
        try {
          return StoryJsonSource.this.read();
        } catch (IOException e) {
          throw new IllegalStateException("Error reading story source", e);
        }
      }

      public boolean hasNext() {
        return this.next != null;
      }

      public Story next() {
        if (this.next == null)
          throw new NoSuchElementException();
        Story story = this.next;
        this.next = this.advance();
        return story;
      }

      public void remove() {
        throw new UnsupportedOperationException("Cannot remove item from story source.");
      }
    };
  }

  public void close() throws IOException {
    this.parser.close();
  }
}
