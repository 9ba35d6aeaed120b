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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A named entity extracted from a story that (possibly) denotes a geographic
 * location. Places are immutable inputs to resolution.
 */
public class Place implements Serializable {

  private static final long serialVersionUID = 42L;

  private final String name;
  private final String text;
  private final double relevance;
  private final List<String> mentions;

  /**
   * @param name     key of the place, used as the geocoding query
   * @param text     the place name as it appears in the story
   * @param relevance extractor relevance in [0,1]
   * @param mentions sentences of the story in which text appears, in order
   */
  public Place(String name, String text, double relevance, List<String> mentions) {
    Preconditions.checkNotNull(name, "name");
    Preconditions.checkNotNull(text, "text");
    Preconditions.checkArgument(relevance >= 0.0 && relevance <= 1.0,
                                "relevance %s of %s is outside [0,1]", relevance, name);
    this.name = name;
    this.text = text;
    this.relevance = relevance;
    this.mentions = mentions == null
        ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<String>(mentions));
  }

  public Place(String name, String text, double relevance) {
    this(name, text, relevance, null);
  }

  public String getName() {
    return this.name;
  }

  public String getText() {
    return this.text;
  }

  public double getRelevance() {
    return this.relevance;
  }

  public List<String> getMentions() {
    return this.mentions;
  }

  public Place withMentions(List<String> mentions) {
    return new Place(this.name, this.text, this.relevance, mentions);
  }

  @Override
  public String toString() {
    return String.format("%s (%.3f)", this.name, this.relevance);
  }
}
