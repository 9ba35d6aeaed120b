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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.RectRegion;

/**
 * The location chosen for a place, together with the place's own metadata
 * and the cluster it ended up in.
 */
public class ResolvedLocation {

  private final String name;
  private final Location location;
  private final Place place;
  private final List<String> cluster;
  private final double clusterRatio;
  private Map<String, Double> mapRelevance = Collections.emptyMap();

  public ResolvedLocation(String name, Location location, Place place,
                          List<String> cluster, double clusterRatio) {
    this.name = name;
    this.location = location;
    this.place = place;
    this.cluster = Collections.unmodifiableList(cluster);
    this.clusterRatio = clusterRatio;
  }

  public String getName() {
    return this.name;
  }

  public Location getLocation() {
    return this.location;
  }

  public Place getPlace() {
    return this.place;
  }

  public String getAddress() {
    return this.location.getAddress();
  }

  /**
   * The place name as written in the story.
   */
  public String getText() {
    return this.place == null ? this.name : this.place.getText();
  }

  public Coordinate getCoordinate() {
    return this.location.getCoordinate();
  }

  public RectRegion getBoundingBox() {
    return this.location.getBoundingBox();
  }

  public double getRelevance() {
    return this.place == null ? 0.0 : this.place.getRelevance();
  }

  public List<String> getMentions() {
    return this.place == null ? Collections.<String>emptyList() : this.place.getMentions();
  }

  /** Names of all places in the same cluster, this one included. */
  public List<String> getCluster() {
    return this.cluster;
  }

  public double getClusterRatio() {
    return this.clusterRatio;
  }

  /**
   * Probability per relevance category ("core", "relevant", ...) assigned by
   * a {@link RelevanceScorer}; empty if the location was not scored.
   */
  public Map<String, Double> getMapRelevance() {
    return this.mapRelevance;
  }

  public double getMapRelevance(String category) {
    Double p = this.mapRelevance.get(category);
    return p == null ? 0.0 : p;
  }

  public void setMapRelevance(Map<String, Double> mapRelevance) {
    this.mapRelevance = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(mapRelevance));
  }

  @Override
  public String toString() {
    return this.name + " -> " + this.location;
  }
}
