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

import opennlp.storygrounder.topo.Location;

/**
 * A proposed reassignment of one place to another cluster under a given
 * candidate location. Nothing changes until the move is applied to a
 * {@link ClusterSet}.
 */
public class Move {

  private final String placeName;
  private final Location candidate;
  private final int source;
  private final int target;
  private final double gain;

  /**
   * @param source index of the place's current cluster, or
   *               {@link ClusterSet#UNASSIGNED}
   * @param gain   change of the objective if the move is applied
   */
  public Move(String placeName, Location candidate, int source, int target, double gain) {
    this.placeName = placeName;
    this.candidate = candidate;
    this.source = source;
    this.target = target;
    this.gain = gain;
  }

  public String getPlaceName() {
    return this.placeName;
  }

  public Location getCandidate() {
    return this.candidate;
  }

  public int getSource() {
    return this.source;
  }

  public int getTarget() {
    return this.target;
  }

  public double getGain() {
    return this.gain;
  }

  @Override
  public String toString() {
    return String.format("%s: %d -> %d as %s (%+.1f)",
                         this.placeName, this.source, this.target, this.candidate, this.gain);
  }
}
