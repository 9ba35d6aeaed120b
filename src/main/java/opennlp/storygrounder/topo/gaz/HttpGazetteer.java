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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.Region;

/**
 * Base class for gazetteers that query a JSON geocoding API over HTTP with a
 * single GET per place name.
 */
public abstract class HttpGazetteer implements Gazetteer {

  private static final Logger LOGGER = Logger.getLogger(HttpGazetteer.class.getName());

  protected final OkHttpClient client;
  protected final ObjectMapper mapper;
  private final HttpUrl baseUrl;
  private boolean dropIntersecting = false;

  protected HttpGazetteer(String baseUrl, OkHttpClient client) {
    this.baseUrl = HttpUrl.get(baseUrl);
    this.client = client;
    this.mapper = new ObjectMapper();
  }

  /**
   * When set, a record whose extent intersects an earlier record of the same
   * response is discarded.
   */
  public void setDropIntersecting(boolean dropIntersecting) {
    this.dropIntersecting = dropIntersecting;
  }

  public boolean isDropIntersecting() {
    return this.dropIntersecting;
  }

  protected abstract void addQueryParameters(HttpUrl.Builder url, String query);

  protected abstract List<Location> parseRecords(JsonNode root) throws GeocodingException;

  /**
   * Hook for request headers (user agents and the like).
   */
  protected void decorate(Request.Builder request) {
  }

  public List<Location> lookup(String query) throws GeocodingException {
    HttpUrl.Builder url = this.baseUrl.newBuilder();
    this.addQueryParameters(url, query);
    Request.Builder request = new Request.Builder().url(url.build()).get();
    this.decorate(request);

    JsonNode root;
    Response response = null;
    try {
      response = this.client.newCall(request.build()).execute();
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new GeocodingException(this.getName() + " returned HTTP "
            + response.code() + " for '" + query + "': " + text);
      }
      root = this.mapper.readTree(text);
    } catch (GeocodingException e) {
      throw e;
    } catch (IOException e) {
      throw new GeocodingException(this.getName() + " failed for '" + query + "'", e);
    } finally {
      if (response != null)
        response.close();
    }

    List<Location> locations = this.parseRecords(root);
    if (this.dropIntersecting)
      locations = dropIntersecting(locations);
    LOGGER.fine(this.getName() + ": " + locations.size() + " record(s) for '" + query + "'");
    return locations;
  }

  /**
   * Keeps each location only if its extent does not intersect the extent of
   * an already kept one.
   */
  public static List<Location> dropIntersecting(List<Location> locations) {
    List<Location> kept = new ArrayList<Location>(locations.size());
    for (Location location : locations) {
      Region region = location.getRegion();
      boolean clash = false;
      if (region != null) {
        for (Location other : kept) {
          Region otherRegion = other.getRegion();
          if (otherRegion != null && region.intersects(otherRegion)) {
            clash = true;
            break;
          }
        }
      }
      if (!clash)
        kept.add(location);
    }
    return kept;
  }

  protected static Double optionalDouble(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull())
      return null;
    if (node.isNumber())
      return node.doubleValue();
    if (node.isTextual()) {
      try {
        return Double.valueOf(node.textValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
