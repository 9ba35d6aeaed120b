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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import opennlp.storygrounder.UnlocatedStoryException;
import opennlp.storygrounder.cluster.Cluster;
import opennlp.storygrounder.cluster.ClusterGrower;
import opennlp.storygrounder.cluster.GrowthResult;
import opennlp.storygrounder.filter.CandidateFilter;
import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.gaz.Gazetteer;
import opennlp.storygrounder.topo.gaz.GeocodingException;

/**
 * Resolves the places of one story to locations: geocodes every place with
 * every gazetteer, filters the candidates against the story text, grows
 * clusters over the survivors and, if a scorer is configured, scores the
 * result.
 *
 * A resolver holds no per-story state, so one instance may serve several
 * threads as long as its gazetteers and scorer can.
 */
public class LocationResolver {

  private static final Logger LOG = Logger.getLogger(LocationResolver.class.getName());

  private final List<Gazetteer> gazetteers;
  private final CandidateFilter filter;
  private final ClusterGrower grower;
  private final RelevanceScorer scorer;
  private final CoreLocationSelector selector;

  /**
   * @param scorer may be null, in which case locations are not scored and
   *               no core location is ever picked
   */
  public LocationResolver(List<Gazetteer> gazetteers, CandidateFilter filter, ClusterGrower grower,
                          RelevanceScorer scorer, CoreLocationSelector selector) {
    Preconditions.checkArgument(!gazetteers.isEmpty(), "no gazetteers");
    Preconditions.checkNotNull(filter, "filter");
    Preconditions.checkNotNull(grower, "grower");
    Preconditions.checkNotNull(selector, "selector");
    this.gazetteers = new ArrayList<Gazetteer>(gazetteers);
    this.filter = filter;
    this.grower = grower;
    this.scorer = scorer;
    this.selector = selector;
  }

  public LocationResolver(List<Gazetteer> gazetteers, CandidateFilter filter, ClusterGrower grower) {
    this(gazetteers, filter, grower, null, new CoreLocationSelector());
  }

  /**
   * Candidates of every gazetteer for every name, in gazetteer order. A
   * gazetteer failing for a name is logged and skipped; names without any
   * candidate are left out.
   */
  public Map<String, List<Location>> assembleGeocodings(Collection<String> names) {
    Map<String, List<Location>> candidates = new LinkedHashMap<String, List<Location>>();
    for (String name : names) {
      List<Location> locations = new ArrayList<Location>();
      for (Gazetteer gazetteer : this.gazetteers) {
        try {
          locations.addAll(gazetteer.lookup(name));
        } catch (GeocodingException e) {
          LOG.log(Level.WARNING, "Geocoding " + name + " with " + gazetteer.getName() + " failed", e);
        }
      }
      if (!locations.isEmpty())
        candidates.put(name, locations);
    }
    return candidates;
  }

  /**
   * Resolves a story's places.
   *
   * @param places places by name; names are the geocoding queries
   * @param text   the story text candidates are filtered against
   * @return resolved location per place, cluster by cluster
   * @throws UnlocatedStoryException if no place has a usable candidate
   * @throws ScoringException if the scorer fails
   */
  public Map<String, ResolvedLocation> resolveStory(Map<String, Place> places, String text)
      throws UnlocatedStoryException, ScoringException {
    Map<String, List<Location>> candidates = this.assembleGeocodings(places.keySet());
    if (candidates.isEmpty())
      throw new UnlocatedStoryException("No candidate coordinates found.");

    Map<String, List<Location>> filtered = this.filter.filter(candidates, text);
    if (filtered.isEmpty())
      throw new UnlocatedStoryException("No candidates left after filtering.");

    GrowthResult growth = this.grower.resolve(filtered);

    Map<String, ResolvedLocation> locations = new LinkedHashMap<String, ResolvedLocation>();
    for (Cluster cluster : growth.getClusters()) {
      List<String> members = cluster.getPlaceNames();
      double ratio = (double) cluster.size() / filtered.size();
      for (Map.Entry<String, Location> member : cluster.getMembers().entrySet()) {
        String name = member.getKey();
        locations.put(name, new ResolvedLocation(name, member.getValue(), places.get(name),
                                                 members, ratio));
      }
    }
    LOG.info(String.format("Resolved %d of %d places into %d clusters",
                           locations.size(), places.size(), growth.getClusters().size()));

    if (this.scorer != null)
      this.score(new ArrayList<ResolvedLocation>(locations.values()));
    return locations;
  }

  private void score(List<ResolvedLocation> locations) throws ScoringException {
    List<Map<String, Double>> scores = this.scorer.score(locations);
    if (scores.size() != locations.size())
      throw new ScoringException("Got " + scores.size() + " scores for " + locations.size() + " locations");
    for (int i = 0; i < locations.size(); i++)
      locations.get(i).setMapRelevance(scores.get(i));
  }

  /**
   * The best scored location, or null if none clears the selector's cutoff.
   */
  public ResolvedLocation pickCore(Collection<ResolvedLocation> locations) {
    ResolvedLocation core = this.selector.select(locations);
    if (core != null)
      LOG.info("Core location: " + core.getName());
    return core;
  }

  public boolean hasScorer() {
    return this.scorer != null;
  }
}
