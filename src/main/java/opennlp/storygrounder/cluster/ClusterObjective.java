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

/**
 * Score of a partition of places into clusters, written as a sum of
 * per-cluster terms that depend only on cluster size. The grower accepts a
 * move only if it strictly increases the score.
 */
public abstract class ClusterObjective {

  /**
   * Contribution of one cluster of the given size. Must be 0 for size 0.
   */
  public abstract double term(int size);

  public double score(int[] sizes) {
    double score = 0.0;
    for (int size : sizes)
      score += this.term(size);
    return score;
  }

  /**
   * Change of the score when one place leaves a cluster of sourceSize and
   * joins one of targetSize. A sourceSize of 0 means the place was not in
   * any cluster.
   */
  public double gain(int sourceSize, int targetSize) {
    double gain = this.term(targetSize + 1) - this.term(targetSize);
    if (sourceSize > 0)
      gain += this.term(sourceSize - 1) - this.term(sourceSize);
    return gain;
  }
}
