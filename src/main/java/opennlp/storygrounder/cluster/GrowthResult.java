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

import java.util.Collections;
import java.util.List;

/**
 * Converged clusters together with a record of how the optimizer got there.
 */
public class GrowthResult {

  private final List<Cluster> clusters;
  private final int passes;
  private final int moves;
  private final double score;
  private final List<Double> trace;

  public GrowthResult(List<Cluster> clusters, int passes, int moves, double score, List<Double> trace) {
    this.clusters = Collections.unmodifiableList(clusters);
    this.passes = passes;
    this.moves = moves;
    this.score = score;
    this.trace = Collections.unmodifiableList(trace);
  }

  /** Non-empty clusters, singletons included. */
  public List<Cluster> getClusters() {
    return this.clusters;
  }

  public int getPasses() {
    return this.passes;
  }

  public int getMoves() {
    return this.moves;
  }

  public double getScore() {
    return this.score;
  }

  /**
   * Objective value before growth followed by its value after each accepted
   * move.
   */
  public List<Double> getTrace() {
    return this.trace;
  }
}
