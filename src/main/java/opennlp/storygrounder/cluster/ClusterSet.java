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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.google.common.base.Preconditions;

import gnu.trove.map.hash.TObjectIntHashMap;

import opennlp.storygrounder.topo.Location;

/**
 * The working partition of one resolution: clusters stored by integer index
 * plus the index of the cluster holding each place. Clusters are never
 * removed, so indices stay valid; a cluster emptied by moves stays in place.
 */
public class ClusterSet implements Iterable<Cluster> {

  public static final int UNASSIGNED = -1;

  private final List<Cluster> clusters = new ArrayList<Cluster>();
  private final TObjectIntHashMap<String> assignments =
      new TObjectIntHashMap<String>(10, 0.5f, UNASSIGNED);

  /**
   * A fresh set holding the same assignments as the given clusters.
   */
  public static ClusterSet copyOf(List<Cluster> clusters) {
    ClusterSet copy = new ClusterSet();
    for (Cluster cluster : clusters)
      copy.add(cluster.getMembers());
    return copy;
  }

  /**
   * Adds a new cluster with the given members and returns its index.
   */
  public int add(Map<String, Location> members) {
    int index = this.clusters.size();
    Cluster cluster = new Cluster(index);
    for (Map.Entry<String, Location> member : members.entrySet()) {
      Preconditions.checkArgument(!this.assignments.containsKey(member.getKey()),
                                  "%s is already in cluster %s", member.getKey(),
                                  this.assignments.get(member.getKey()));
      cluster.put(member.getKey(), member.getValue());
      this.assignments.put(member.getKey(), index);
    }
    this.clusters.add(cluster);
    return index;
  }

  public int indexOf(String placeName) {
    return this.assignments.get(placeName);
  }

  public Cluster get(int index) {
    return this.clusters.get(index);
  }

  /**
   * Number of cluster slots, empty ones included.
   */
  public int size() {
    return this.clusters.size();
  }

  public int sizeOf(int index) {
    return index == UNASSIGNED ? 0 : this.clusters.get(index).size();
  }

  /**
   * The location currently chosen for a place, or null if it is unassigned.
   */
  public Location locationOf(String placeName) {
    int index = this.indexOf(placeName);
    return index == UNASSIGNED ? null : this.clusters.get(index).getLocation(placeName);
  }

  /**
   * Applies a move as a single update: the place leaves its source cluster
   * and joins the target under the move's candidate.
   *
   * @throws IllegalStateException if the place is no longer in the move's
   *         source cluster
   */
  public void apply(Move move) {
    String placeName = move.getPlaceName();
    int current = this.indexOf(placeName);
    if (current != move.getSource())
      throw new IllegalStateException("stale move " + move + ": place is in cluster " + current);
    Preconditions.checkArgument(move.getTarget() != move.getSource(), "move to own cluster: %s", move);

    if (current != UNASSIGNED)
      this.clusters.get(current).remove(placeName);
    this.clusters.get(move.getTarget()).put(placeName, move.getCandidate());
    this.assignments.put(placeName, move.getTarget());
  }

  /**
   * Cluster indices in a random order drawn from the given source.
   */
  public List<Integer> shuffledOrder(Random random) {
    List<Integer> order = new ArrayList<Integer>(this.clusters.size());
    for (int i = 0; i < this.clusters.size(); i++)
      order.add(i);
    Collections.shuffle(order, random);
    return order;
  }

  public List<Cluster> nonEmpty() {
    List<Cluster> nonEmpty = new ArrayList<Cluster>();
    for (Cluster cluster : this.clusters) {
      if (!cluster.isEmpty())
        nonEmpty.add(cluster);
    }
    return nonEmpty;
  }

  public double score(ClusterObjective objective) {
    int[] sizes = new int[this.clusters.size()];
    for (int i = 0; i < sizes.length; i++)
      sizes[i] = this.clusters.get(i).size();
    return objective.score(sizes);
  }

  public Iterator<Cluster> iterator() {
    return Collections.unmodifiableList(this.clusters).iterator();
  }
}
