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

import java.util.ArrayList;
import java.util.List;

/**
 * A latitude/longitude box in degrees. A box whose minimum longitude is
 * greater than its maximum longitude wraps around 180/-180.
 */
public class RectRegion extends Region {

  private static final long serialVersionUID = 42L;

  private final double minLat;
  private final double maxLat;
  private final double minLng;
  private final double maxLng;

  private RectRegion(double minLat, double maxLat, double minLng, double maxLng) {
    this.minLat = minLat;
    this.maxLat = maxLat;
    this.minLng = minLng;
    this.maxLng = maxLng;
  }

  public static RectRegion fromDegrees(double minLat, double maxLat, double minLng, double maxLng) {
    if (minLat > maxLat)
      throw new IllegalArgumentException("minLat " + minLat + " > maxLat " + maxLat);
    return new RectRegion(minLat, maxLat, minLng, maxLng);
  }

  /**
   * Builds a box from bounds in (minlon, minlat, maxlon, maxlat) order, the
   * order used on the wire.
   */
  public static RectRegion fromBounds(double minLng, double minLat, double maxLng, double maxLat) {
    return fromDegrees(minLat, maxLat, minLng, maxLng);
  }

  /**
   * Returns the average of the minimum and maximum values for latitude and
   * longitude.
   */
  public Coordinate getCenter() {
    double lng;
    if (this.minLng <= this.maxLng) {
      lng = (this.maxLng + this.minLng) / 2.0;
    } else {
      lng = (this.minLng + this.maxLng + 360.0) / 2.0;
      if (lng > 180.0)
        lng -= 360.0;
    }
    return Coordinate.fromDegrees((this.maxLat + this.minLat) / 2.0, lng);
  }

  public boolean contains(double lat, double lng) {
    return lat >= this.minLat && lat <= this.maxLat && this.containsLng(lng);
  }

  private boolean containsLng(double lng) {
    if (this.minLng <= this.maxLng)
      return lng >= this.minLng && lng <= this.maxLng;
    // for boxes around 180/-180 longitude:
    return lng >= this.minLng || lng <= this.maxLng;
  }

  public boolean intersects(Region other) {
    if (other instanceof RectRegion) {
      RectRegion box = (RectRegion) other;
      if (box.minLat > this.maxLat || box.maxLat < this.minLat)
        return false;
      for (double[] mine : this.lngIntervals()) {
        for (double[] theirs : box.lngIntervals()) {
          if (mine[0] <= theirs[1] && theirs[0] <= mine[1])
            return true;
        }
      }
      return false;
    }
    return other.intersects(this);
  }

  private double[][] lngIntervals() {
    if (this.minLng <= this.maxLng)
      return new double[][] { { this.minLng, this.maxLng } };
    return new double[][] { { this.minLng, 180.0 }, { -180.0, this.maxLng } };
  }

  public double getMinLat() {
    return this.minLat;
  }

  public double getMaxLat() {
    return this.maxLat;
  }

  public double getMinLng() {
    return this.minLng;
  }

  public double getMaxLng() {
    return this.maxLng;
  }

  /**
   * Bounds in (minlon, minlat, maxlon, maxlat) order.
   */
  public double[] getBounds() {
    return new double[] { this.minLng, this.minLat, this.maxLng, this.maxLat };
  }

  public List<Coordinate> getRepresentatives() {
    List<Coordinate> representatives = new ArrayList<Coordinate>(4);
    representatives.add(Coordinate.fromDegrees(this.minLat, this.minLng));
    representatives.add(Coordinate.fromDegrees(this.maxLat, this.minLng));
    representatives.add(Coordinate.fromDegrees(this.maxLat, this.maxLng));
    representatives.add(Coordinate.fromDegrees(this.minLat, this.maxLng));
    return representatives;
  }

    public String toString() {
        return "lat: [" + minLat + ", " + maxLat + "] lon: ["
            + minLng + ", " + maxLng + "]";
    }
}
