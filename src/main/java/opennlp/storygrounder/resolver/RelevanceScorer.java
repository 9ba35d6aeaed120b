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
package opennlp.storygrounder.resolver;

import java.util.List;
import java.util.Map;

/**
 * Assigns each resolved location of a story a probability per relevance
 * category, such as "core" and "relevant".
 */
public interface RelevanceScorer {
  /**
   * Scores all locations in one batch. The result is aligned with the input:
   * element i holds the probabilities for locations.get(i).
   */
  public List<Map<String, Double>> score(List<ResolvedLocation> locations) throws ScoringException;
}
