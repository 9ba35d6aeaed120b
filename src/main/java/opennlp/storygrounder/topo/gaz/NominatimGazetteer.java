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
import okhttp3.Request;

import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.RectRegion;

/**
 * Searches OpenStreetMap records through a Nominatim server. Nominatim is
 * verbose, often returning dozens of records for incomplete addresses.
 *
 * The public server allows at most one query per second, so each lookup
 * waits requestDelayMillis before going out.
 */
public class NominatimGazetteer extends HttpGazetteer {

  public static final String DEFAULT_URL = "https://nominatim.openstreetmap.org/search";
  public static final int DEFAULT_LIMIT = 20;
  public static final long DEFAULT_DELAY_MILLIS = 500;

  private final String userAgent;
  private final int limit;
  private final long requestDelayMillis;

  public NominatimGazetteer(String userAgent) {
    this(DEFAULT_URL, userAgent, DEFAULT_LIMIT, DEFAULT_DELAY_MILLIS, new OkHttpClient());
  }

  public NominatimGazetteer(String baseUrl, String userAgent, int limit,
                            long requestDelayMillis, OkHttpClient client) {
    super(baseUrl, client);
    this.userAgent = userAgent;
    this.limit = limit;
    this.requestDelayMillis = requestDelayMillis;
  }

  public String getName() {
    return "osm";
  }

  @Override
  public List<Location> lookup(String query) throws GeocodingException {
    if (this.requestDelayMillis > 0) {
      try {
        Thread.sleep(this.requestDelayMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GeocodingException("interrupted before querying '" + query + "'", e);
      }
    }
    return super.lookup(query);
  }

  @Override
  protected void addQueryParameters(HttpUrl.Builder url, String query) {
    url.addQueryParameter("q", query);
    url.addQueryParameter("format", "json");
    url.addQueryParameter("addressdetails", "1");
    url.addQueryParameter("limit", Integer.toString(this.limit));
  }

  @Override
  protected void decorate(Request.Builder request) {
    request.header("User-Agent", this.userAgent);
  }

  @Override
  protected List<Location> parseRecords(JsonNode root) throws GeocodingException {
    if (!root.isArray())
      throw new GeocodingException("nominatim response is not an array");

    List<Location> locations = new ArrayList<Location>(root.size());
    for (JsonNode record : root) {
      locations.add(this.clean(record));
    }
    return locations;
  }

  /* Format a raw OSM record. Nominatim sends numbers as strings. */
  private Location clean(JsonNode record) {
    Coordinate coordinate = null;
    Double lat = optionalDouble(record.path("lat"));
    Double lon = optionalDouble(record.path("lon"));
    if (lat != null && lon != null)
      coordinate = Coordinate.fromDegrees(lat, lon);

    // boundingbox is [minlat, maxlat, minlon, maxlon]
    RectRegion bounds = null;
    JsonNode box = record.path("boundingbox");
    if (box.isArray() && box.size() == 4) {
      Double minLat = optionalDouble(box.get(0));
      Double maxLat = optionalDouble(box.get(1));
      Double minLon = optionalDouble(box.get(2));
      Double maxLon = optionalDouble(box.get(3));
      if (minLat != null && maxLat != null && minLon != null && maxLon != null && minLat <= maxLat)
        bounds = RectRegion.fromDegrees(minLat, maxLat, minLon, maxLon);
    }

    Map<String, String> components = new LinkedHashMap<String, String>();
    Iterator<Map.Entry<String, JsonNode>> fields = record.path("address").fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isTextual())
        components.put(field.getKey(), field.getValue().textValue());
    }

    String osmUrl = "";
    String osmType = record.path("osm_type").asText("");
    String osmId = record.path("osm_id").asText("");
    if (osmType.length() > 0 && osmId.length() > 0)
      osmUrl = "https://www.openstreetmap.org/" + osmType + "/" + osmId;

    return new Location(record.path("display_name").asText(""), coordinate, bounds,
                        components, this.getName(), osmUrl);
  }
}
