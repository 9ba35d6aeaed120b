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
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;

import com.google.common.base.Preconditions;

import opennlp.storygrounder.topo.Coordinate;

/**
 * Density-based clustering of coordinates under the haversine metric.
 *
 * Two points share a cluster only if they are connected by a chain of
 * points, each within maxDistKm of the next. A cluster needs at least
 * minSize points in the neighborhood of one of its core points, the point
 * itself included; points in no cluster are outliers and are not returned.
 */
public class GeoClusterer {

  public static final double DEFAULT_MAX_DIST_KM = 150.0;
  public static final int DEFAULT_MIN_SIZE = 1;

  private final double maxDistKm;
  private final double maxRadians;
  private final int minSize;

  public GeoClusterer(double maxDistKm, int minSize) {
    Preconditions.checkArgument(maxDistKm > 0.0, "max distance must be positive: %s", maxDistKm);
    Preconditions.checkArgument(minSize >= 1, "min cluster size must be at least 1: %s", minSize);
    this.maxDistKm = maxDistKm;
    this.maxRadians = Coordinate.kmToRadians(maxDistKm);
    this.minSize = minSize;
  }

  public GeoClusterer() {
    this(DEFAULT_MAX_DIST_KM, DEFAULT_MIN_SIZE);
  }

  /**
   * Clusters the given coordinates. The input is not modified.
   */
  public List<List<Coordinate>> cluster(List<Coordinate> points) {
    List<List<Coordinate>> clusters = new ArrayList<List<Coordinate>>();
    for (List<Integer> group : this.clusterIndices(points)) {
      List<Coordinate> cluster = new ArrayList<Coordinate>(group.size());
      for (int index : group)
        cluster.add(points.get(index));
      clusters.add(cluster);
    }
    return clusters;
  }

  /**
   * Clusters the given coordinates, returning each group as ascending
   * indices into points. Groups come in order of their first member.
   */
  public List<List<Integer>> clusterIndices(List<Coordinate> points) {
    Preconditions.checkArgument(!points.isEmpty(), "nothing to cluster");
    List<IndexedPoint> wrapped = new ArrayList<IndexedPoint>(points.size());
    for (int i = 0; i < points.size(); i++) {
      Coordinate coordinate = points.get(i);
      Preconditions.checkArgument(coordinate != null && coordinate.isValid(),
                                  "invalid coordinate at %s: %s", i, coordinate);
      wrapped.add(new IndexedPoint(i, coordinate));
    }

    // the neighborhoods of commons-math exclude the point itself
    DBSCANClusterer<IndexedPoint> dbscan =
        new DBSCANClusterer<IndexedPoint>(this.maxRadians, this.minSize - 1,
                                          new HaversineDistance());

    List<List<Integer>> groups = new ArrayList<List<Integer>>();
    for (org.apache.commons.math3.ml.clustering.Cluster<IndexedPoint> cluster : dbscan.cluster(wrapped)) {
      List<Integer> group = new ArrayList<Integer>();
      for (IndexedPoint point : cluster.getPoints())
        group.add(point.index);
      Collections.sort(group);
      groups.add(group);
    }
    Collections.sort(groups, new Comparator<List<Integer>>() {
      public int compare(List<Integer> a, List<Integer> b) {
        return a.get(0).compareTo(b.get(0));
      }
    });
    return groups;
  }

  /**
   * Whether two coordinates are within the clustering radius of each other.
   */
  public boolean isNear(Coordinate a, Coordinate b) {
    return a.distanceInKm(b) <= this.maxDistKm;
  }

  public double getMaxDistKm() {
    return this.maxDistKm;
  }

  public int getMinSize() {
    return this.minSize;
  }

  /**
   * Identity-compared wrapper so that duplicate coordinates stay distinct
   * points.
   */
  private static class IndexedPoint implements Clusterable {
    private final int index;
    private final double[] point;

    IndexedPoint(int index, Coordinate coordinate) {
      this.index = index;
      this.point = new double[] { coordinate.getLatRadians(), coordinate.getLngRadians() };
    }

    public double[] getPoint() {
      return this.point;
    }
  }
}
