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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the single location a story is about from scored locations.
 */
public class CoreLocationSelector {

  public static final double DEFAULT_CUTOFF = 0.5;
  public static final String CORE = "core";
  public static final String RELEVANT = "relevant";

  private final double cutoff;

  public CoreLocationSelector(double cutoff) {
    this.cutoff = cutoff;
  }

  public CoreLocationSelector() {
    this(DEFAULT_CUTOFF);
  }

  /**
   * Locations whose "core" probability exceeds the cutoff come first, by
   * descending "core" probability; then those whose "relevant" probability
   * exceeds it, by descending "relevant" probability. Returns the first, or
   * null if no location clears the cutoff.
   */
  public ResolvedLocation select(Collection<ResolvedLocation> locations) {
    List<ResolvedLocation> ranked = this.rank(locations);
    return ranked.isEmpty() ? null : ranked.get(0);
  }

  public List<ResolvedLocation> rank(Collection<ResolvedLocation> locations) {
    List<ResolvedLocation> core = new ArrayList<ResolvedLocation>();
    List<ResolvedLocation> relevant = new ArrayList<ResolvedLocation>();
    for (ResolvedLocation location : locations) {
      if (location.getMapRelevance(CORE) > this.cutoff)
        core.add(location);
      else if (location.getMapRelevance(RELEVANT) > this.cutoff)
        relevant.add(location);
    }
    Collections.sort(core, byDescending(CORE));
    Collections.sort(relevant, byDescending(RELEVANT));

    List<ResolvedLocation> ranked = new ArrayList<ResolvedLocation>(core);
    ranked.addAll(relevant);
    return ranked;
  }

  private static Comparator<ResolvedLocation> byDescending(final String category) {
    return new Comparator<ResolvedLocation>() {
      public int compare(ResolvedLocation a, ResolvedLocation b) {
        return Double.compare(b.getMapRelevance(category), a.getMapRelevance(category));
      }
    };
  }

  public double getCutoff() {
    return this.cutoff;
  }
}
