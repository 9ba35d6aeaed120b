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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One geocoding candidate for a place name: a formatted address, its
 * coordinates and (when the geocoder supplies one) a bounding box. Raw address
 * components are kept so candidates can be matched against article text.
 *
 * Two Locations are only equal if they are the same object; geocoders can
 * return distinct records with identical coordinates.
 */
public class Location implements Serializable {

  private static final long serialVersionUID = 42L;

  private final String address;
  private final Coordinate coordinate;
  private final RectRegion boundingBox;
  private final Map<String, String> components;
  private final String geocoder;
  private final String osmUrl;

  public Location(String address, Coordinate coordinate, RectRegion boundingBox,
                  Map<String, String> components, String geocoder, String osmUrl) {
    this.address = address == null ? "" : address;
    this.coordinate = coordinate;
    this.boundingBox = boundingBox;
    this.components = components == null
        ? Collections.<String, String>emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<String, String>(components));
    this.geocoder = geocoder;
    this.osmUrl = osmUrl;
  }

  public Location(String address, Coordinate coordinate, RectRegion boundingBox) {
    this(address, coordinate, boundingBox, null, null, null);
  }

  public Location(String address, Coordinate coordinate) {
    this(address, coordinate, null);
  }

  public String getAddress() {
    return this.address;
  }

  /**
   * Returns null for a malformed record that came back without lat/lon.
   */
  public Coordinate getCoordinate() {
    return this.coordinate;
  }

  public boolean hasCoordinate() {
    return this.coordinate != null && this.coordinate.isValid();
  }

  public RectRegion getBoundingBox() {
    return this.boundingBox;
  }

  /**
   * The bounding box if there is one, else the point, else null.
   */
  public Region getRegion() {
    if (this.boundingBox != null)
      return this.boundingBox;
    if (this.hasCoordinate())
      return new PointRegion(this.coordinate);
    return null;
  }

  public Map<String, String> getComponents() {
    return this.components;
  }

  public String getGeocoder() {
    return this.geocoder;
  }

  public String getOsmUrl() {
    return this.osmUrl;
  }

  /**
   * A copy of this location with the raw address components dropped.
   */
  public Location withoutComponents() {
    if (this.components.isEmpty())
      return this;
    return new Location(this.address, this.coordinate, this.boundingBox,
                        null, this.geocoder, this.osmUrl);
  }

  @Override
  public String toString() {
    return String.format("%s (%s)", this.address, this.coordinate);
  }
}
