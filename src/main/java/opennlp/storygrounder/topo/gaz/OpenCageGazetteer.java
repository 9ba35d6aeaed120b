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
package opennlp.storygrounder.topo.gaz;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.RectRegion;

/**
 * Finds lat/lon codings for place names via the OpenCage geocoder (based on
 * OpenStreetMap data).
 */
public class OpenCageGazetteer extends HttpGazetteer {

  public static final String DEFAULT_URL = "https://api.opencagedata.com/geocode/v1/json";
  public static final int DEFAULT_LIMIT = 10;

  private final String apiKey;
  private final int limit;

  public OpenCageGazetteer(String apiKey) {
    this(DEFAULT_URL, apiKey, DEFAULT_LIMIT, new OkHttpClient());
  }

  public OpenCageGazetteer(String baseUrl, String apiKey, int limit, OkHttpClient client) {
    super(baseUrl, client);
    if (apiKey == null || apiKey.length() == 0)
      throw new IllegalArgumentException("OpenCage requires an API key");
    this.apiKey = apiKey;
    this.limit = limit;
  }

  public String getName() {
    return "opencage";
  }

  @Override
  protected void addQueryParameters(HttpUrl.Builder url, String query) {
    url.addQueryParameter("q", query);
    url.addQueryParameter("key", this.apiKey);
    url.addQueryParameter("limit", Integer.toString(this.limit));
  }

  @Override
  protected List<Location> parseRecords(JsonNode root) throws GeocodingException {
    JsonNode results = root.path("results");
    if (!results.isArray())
      throw new GeocodingException("opencage response has no results array");

    List<Location> locations = new ArrayList<Location>(results.size());
    for (JsonNode record : results) {
      locations.add(this.clean(record));
    }
    return locations;
  }

  /* Format a raw OpenCage record. */
  private Location clean(JsonNode record) {
    Coordinate coordinate = null;
    Double lat = optionalDouble(record.path("geometry").path("lat"));
    Double lng = optionalDouble(record.path("geometry").path("lng"));
    if (lat != null && lng != null)
      coordinate = Coordinate.fromDegrees(lat, lng);

    RectRegion bounds = null;
    JsonNode ne = record.path("bounds").path("northeast");
    JsonNode sw = record.path("bounds").path("southwest");
    Double north = optionalDouble(ne.path("lat"));
    Double east = optionalDouble(ne.path("lng"));
    Double south = optionalDouble(sw.path("lat"));
    Double west = optionalDouble(sw.path("lng"));
    if (north != null && east != null && south != null && west != null && south <= north)
      bounds = RectRegion.fromBounds(west, south, east, north);

    Map<String, String> components = new LinkedHashMap<String, String>();
    Iterator<Map.Entry<String, JsonNode>> fields = record.path("components").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isTextual())
        components.put(field.getKey(), field.getValue().textValue());
    }

    String osmUrl = record.path("annotations").path("OSM").path("url").asText("");

    return new Location(record.path("formatted").asText(""), coordinate, bounds,
                        components, this.getName(), osmUrl);
  }
}
