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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An article's text together with the places an extractor found in it.
 */
public class Story {

  private final String id;
  private final String text;
  private final Map<String, Place> places;

  public Story(String id, String text, Map<String, Place> places) {
    this.id = id;
    this.text = text == null ? "" : text;
    this.places = Collections.unmodifiableMap(new LinkedHashMap<String, Place>(places));
  }

  public String getId() {
    return this.id;
  }

  public String getText() {
    return this.text;
  }

  public Map<String, Place> getPlaces() {
    return this.places;
  }
}
