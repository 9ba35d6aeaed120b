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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

/**
 * Words ignored when building bag-of-words vectors. One word per line;
 * blank lines and lines starting with '#' are skipped.
 */
public class StopList {

  public static final String DEFAULT_RESOURCE = "/stopwords.txt";

  private final Set<String> words;

  public StopList(Set<String> words) {
    this.words = new HashSet<String>(words);
  }

  public static StopList empty() {
    return new StopList(new HashSet<String>());
  }

  public static StopList fromResource(String resource) throws IOException {
    InputStream in = StopList.class.getResourceAsStream(resource);
    if (in == null)
      throw new IOException("stop list resource not found: " + resource);
    try {
      return read(in);
    } finally {
      in.close();
    }
  }

  public static StopList read(InputStream in) throws IOException {
    Set<String> words = new HashSet<String>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim().toLowerCase();
      if (line.length() == 0 || line.startsWith("#"))
        continue;
      // hyphenated entries count as their parts
      for (String part : line.split("-")) {
        if (part.length() > 0)
          words.add(part);
      }
    }
    return new StopList(words);
  }

  public boolean contains(String word) {
    return this.words.contains(word);
  }

  public int size() {
    return this.words.size();
  }
}
