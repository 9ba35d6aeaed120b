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
package opennlp.storygrounder.topo;

import java.util.Collections;
import java.util.List;

/**
 * Extent of a location for which the geocoder supplied no bounding box.
 */
public class PointRegion extends Region {

  private static final long serialVersionUID = 42L;

  private final Coordinate coordinate;

  public PointRegion(Coordinate coordinate) {
    if (coordinate == null)
      throw new NullPointerException("coordinate");
    this.coordinate = coordinate;
  }

  public Coordinate getCenter() {
    return this.coordinate;
  }

  public boolean contains(double lat, double lng) {
    return lat == this.coordinate.getLatDegrees() && lng == this.coordinate.getLngDegrees();
  }

  public boolean intersects(Region other) {
    return other.contains(this.coordinate);
  }

  public double getMinLat() {
    return this.coordinate.getLatDegrees();
  }

  public double getMaxLat() {
    return this.coordinate.getLatDegrees();
  }

  public double getMinLng() {
    return this.coordinate.getLngDegrees();
  }

  public double getMaxLng() {
    return this.coordinate.getLngDegrees();
  }

  public List<Coordinate> getRepresentatives() {
    return Collections.singletonList(this.coordinate);
  }

  public String toString() {
    return "point: " + this.coordinate;
  }
}
