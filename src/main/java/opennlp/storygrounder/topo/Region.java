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

import java.io.Serializable;
import java.util.List;

/**
 * The spatial extent of a geocoded location: either a single point or a
 * bounding box. Intersection and proximity tests are defined per variant.
 */
public abstract class Region implements Serializable {

  private static final long serialVersionUID = 42L;

  public abstract Coordinate getCenter();
  public abstract boolean contains(double lat, double lng);

  public abstract double getMinLat();
  public abstract double getMaxLat();
  public abstract double getMinLng();
  public abstract double getMaxLng();
  public abstract List<Coordinate> getRepresentatives();

  /**
   * Whether the two extents share at least one point. Touching boundaries
   * count as an intersection.
   */
  public abstract boolean intersects(Region other);

  public boolean contains(Coordinate coordinate) {
    return this.contains(coordinate.getLatDegrees(), coordinate.getLngDegrees());
  }
}
