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
 * A latitude/longitude pair in degrees, as returned by geocoders.
 */
public class Coordinate implements Serializable {

    private static final long serialVersionUID = 42L;

    /** Mean radius of the Earth in km (spherical approximation). */
    public static final double EARTH_RADIUS_KM = 6371.009;

    private final double lat;
    private final double lng;

    public Coordinate(double lat, double lng) {
      this.lat = lat;
      this.lng = lng;
    }

    public static Coordinate fromDegrees(double lat, double lng) {
      return new Coordinate(lat, lng);
    }

    public static Coordinate fromRadians(double lat, double lng) {
      return new Coordinate(lat * 180.0 / Math.PI, lng * 180.0 / Math.PI);
    }

    public double getLatDegrees() {
      return this.lat;
    }

    public double getLngDegrees() {
      return this.lng;
    }

    public double getLatRadians() {
      return this.lat * Math.PI / 180.0;
    }

    public double getLngRadians() {
      return this.lng * Math.PI / 180.0;
    }

    /**
     * Whether this is a usable geodetic coordinate: no NaNs, latitude within
     * [-90, 90] and longitude within [-180, 180].
     */
    public boolean isValid() {
      return !Double.isNaN(this.lat) && !Double.isNaN(this.lng)
          && this.lat >= -90.0 && this.lat <= 90.0
          && this.lng >= -180.0 && this.lng <= 180.0;
    }

    /**
     * Great-circle distance to another coordinate, as a central angle in
     * radians.
     */
    public double distance(Coordinate other) {
      if (this.lat == other.lat && this.lng == other.lng)
        return 0;
      return haversine(this.getLatRadians(), this.getLngRadians(),
                       other.getLatRadians(), other.getLngRadians());
    }

    public double distanceInKm(Coordinate other) {
      return EARTH_RADIUS_KM * this.distance(other);
    }

    /**
     * Haversine central angle between two points given in radians.
     */
    public static double haversine(double lat1, double lng1, double lat2, double lng2) {
      double sinHalfLat = Math.sin((lat2 - lat1) / 2.0);
      double sinHalfLng = Math.sin((lng2 - lng1) / 2.0);
      double a = sinHalfLat * sinHalfLat
          + Math.cos(lat1) * Math.cos(lat2) * sinHalfLng * sinHalfLng;
      return 2.0 * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    /**
     * Converts a surface distance in km to the equivalent central angle.
     */
    public static double kmToRadians(double km) {
      return km / EARTH_RADIUS_KM;
    }

    /**
     * Compute the approximate centroid by averaging the sines and cosines of
     * the latitudes and longitudes.
     */
    public static Coordinate centroid(List<Coordinate> coordinates) {
      double latSins = 0.0;
      double latCoss = 0.0;
      double lngSins = 0.0;
      double lngCoss = 0.0;

      for (int i = 0; i < coordinates.size(); i++) {
        latSins += Math.sin(coordinates.get(i).getLatRadians());
        latCoss += Math.cos(coordinates.get(i).getLatRadians());
        lngSins += Math.sin(coordinates.get(i).getLngRadians());
        lngCoss += Math.cos(coordinates.get(i).getLngRadians());
      }

      latSins /= coordinates.size();
      latCoss /= coordinates.size();
      lngSins /= coordinates.size();
      lngCoss /= coordinates.size();

      double lat = Math.atan2(latSins, latCoss);
      double lng = Math.atan2(lngSins, lngCoss);

      return Coordinate.fromRadians(lat, lng);
    }

    public String toString() {
      return String.format("%.02f,%.02f", this.lat, this.lng);
    }

    @Override
    public boolean equals(Object other) {
      return other != null &&
             other.getClass() == this.getClass() &&
             ((Coordinate) other).lat == this.lat &&
             ((Coordinate) other).lng == this.lng;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 29 * hash + (int) (Double.doubleToLongBits(this.lng) ^ (Double.doubleToLongBits(this.lng) >>> 32));
        hash = 29 * hash + (int) (Double.doubleToLongBits(this.lat) ^ (Double.doubleToLongBits(this.lat) >>> 32));
        return hash;
    }
}
