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
package opennlp.storygrounder.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import opennlp.storygrounder.UnlocatedStoryException;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.Region;

/**
 * Assigns each place one of its candidate locations so that places end up in
 * few, large spatial clusters.
 *
 * The best-ranked candidate of every place seeds an initial clustering. The
 * grower then makes passes over all places, in random order, trying each of
 * a place's candidates against every other cluster it is close to. The move
 * with the largest gain in the objective is applied if that gain is
 * positive. Growth stops after a pass that applies no move. Each applied
 * move strictly increases the objective, which is bounded, so growth always
 * terminates.
 */
public class ClusterGrower {

  private static final Logger LOG = Logger.getLogger(ClusterGrower.class.getName());

  private final GeoClusterer clusterer;
  private final ClusterObjective objective;
  private final Random random;

  public ClusterGrower(GeoClusterer clusterer, ClusterObjective objective, Random random) {
    Preconditions.checkNotNull(clusterer, "clusterer");
    Preconditions.checkNotNull(objective, "objective");
    Preconditions.checkNotNull(random, "random");
    this.clusterer = clusterer;
    this.objective = objective;
    this.random = random;
  }

  public ClusterGrower(GeoClusterer clusterer) {
    this(clusterer, new SquaredSizeObjective(), new Random());
  }

  public ClusterGrower() {
    this(new GeoClusterer());
  }

  /**
   * Seeds and grows clusters from the ranked candidates of each place.
   *
   * @param candidatesByPlace candidates per place name, best first
   * @throws UnlocatedStoryException if no candidate has coordinates
   */
  public GrowthResult resolve(Map<String, List<Location>> candidatesByPlace)
      throws UnlocatedStoryException {
    ClusterSet clusters = this.seed(candidatesByPlace);
    return this.grow(clusters, candidatesByPlace);
  }

  /**
   * Clusters the first candidate with coordinates of every place. Places
   * whose seed is an outlier stay unassigned.
   */
  public ClusterSet seed(Map<String, List<Location>> candidatesByPlace)
      throws UnlocatedStoryException {
    List<String> names = new ArrayList<String>();
    List<Location> seeds = new ArrayList<Location>();
    List<Coordinate> points = new ArrayList<Coordinate>();
    for (Map.Entry<String, List<Location>> entry : candidatesByPlace.entrySet()) {
      for (Location candidate : entry.getValue()) {
        if (candidate.hasCoordinate()) {
          names.add(entry.getKey());
          seeds.add(candidate);
          points.add(candidate.getCoordinate());
          break;
        }
      }
    }
    if (points.isEmpty())
      throw new UnlocatedStoryException("No lat/lon(s) found.");

    ClusterSet clusters = new ClusterSet();
    for (List<Integer> group : this.clusterer.clusterIndices(points)) {
      Map<String, Location> members = new LinkedHashMap<String, Location>();
      for (int index : group)
        members.put(names.get(index), seeds.get(index));
      clusters.add(members);
    }
    if (LOG.isLoggable(Level.FINE))
      LOG.fine(String.format("Seeded %d clusters from %d places", clusters.size(), points.size()));
    return clusters;
  }

  /**
   * Applies improving moves to clusters until a full pass finds none.
   */
  public GrowthResult grow(ClusterSet clusters, Map<String, List<Location>> candidatesByPlace) {
    List<Double> trace = new ArrayList<Double>();
    trace.add(clusters.score(this.objective));

    List<String> places = new ArrayList<String>(candidatesByPlace.keySet());
    int passes = 0;
    int moves = 0;
    while (true) {
      passes++;
      Collections.shuffle(places, this.random);
      List<Integer> order = clusters.shuffledOrder(this.random);

      int accepted = 0;
      for (String place : places) {
        for (Location candidate : candidatesByPlace.get(place)) {
          if (!candidate.hasCoordinate())
            continue;
          Move move = this.bestMove(clusters, order, place, candidate);
          if (move != null) {
            clusters.apply(move);
            accepted++;
            double score = clusters.score(this.objective);
            trace.add(score);
            if (LOG.isLoggable(Level.FINE))
              LOG.fine(String.format("pass %d: %s, objective %.1f", passes, move, score));
          }
        }
      }
      moves += accepted;
      if (accepted == 0)
        break;
    }

    double score = clusters.score(this.objective);
    List<Cluster> result = clusters.nonEmpty();
    LOG.fine(String.format("Converged after %d passes and %d moves: %d clusters, objective %.1f",
                           passes, moves, result.size(), score));
    return new GrowthResult(result, passes, moves, score, trace);
  }

  /**
   * The move of place to candidate with the largest positive gain, or null.
   * Of equal gains the cluster earliest in order wins.
   */
  private Move bestMove(ClusterSet clusters, List<Integer> order, String place, Location candidate) {
    int source = clusters.indexOf(place);
    int sourceSize = clusters.sizeOf(source);
    Move best = null;
    for (int target : order) {
      if (target == source || clusters.sizeOf(target) == 0)
        continue;
      double gain = this.objective.gain(sourceSize, clusters.sizeOf(target));
      if (gain <= 0.0 || (best != null && gain <= best.getGain()))
        continue;
      if (this.matches(candidate, clusters.get(target)))
        best = new Move(place, candidate, source, target, gain);
    }
    return best;
  }

  /**
   * Whether candidate intersects a member of cluster, or lies within the
   * clustering radius of a member's coordinates.
   */
  public boolean matches(Location candidate, Cluster cluster) {
    Region extent = candidate.getRegion();
    for (Location member : cluster.getMembers().values()) {
      Region memberExtent = member.getRegion();
      if (extent != null && memberExtent != null && extent.intersects(memberExtent))
        return true;
      if (member.hasCoordinate() && this.clusterer.isNear(candidate.getCoordinate(), member.getCoordinate()))
        return true;
    }
    return false;
  }

  public GeoClusterer getClusterer() {
    return this.clusterer;
  }

  public ClusterObjective getObjective() {
    return this.objective;
  }
}
