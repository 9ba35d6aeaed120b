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

import org.apache.commons.math3.ml.distance.DistanceMeasure;

import opennlp.storygrounder.topo.Coordinate;

/**
 * Great-circle distance between points given as {lat, lng} in radians. The
 * result is the central angle in radians.
 */
public class HaversineDistance implements DistanceMeasure {

  private static final long serialVersionUID = 42L;

  public double compute(double[] a, double[] b) {
    return Coordinate.haversine(a[0], a[1], b[0], b[1]);
  }
}
