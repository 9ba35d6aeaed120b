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
package opennlp.storygrounder.text.io;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;

import opennlp.storygrounder.resolver.ResolvedLocation;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.RectRegion;

/**
 * JSON records for resolved locations, as handed to the relevance scorer and
 * written for the rest of the pipeline.
 */
public class LocationJson {

  /** Fields kept in the core location record. */
  public static final Set<String> CORE_FIELDS = ImmutableSet.of(
      "address", "boundingbox", "lat", "lon", "mentions", "osm_url", "map_relevance", "text");

  private final ObjectMapper mapper;

  public LocationJson(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public LocationJson() {
    this(new ObjectMapper());
  }

  /**
   * The full record: address, text, lat, lon, boundingbox (minlon, minlat,
   * maxlon, maxlat), osm_url, geocoder, relevance, mentions, cluster,
   * cluster_ratio and map_relevance. Absent optional values are omitted.
   */
  public ObjectNode toJson(ResolvedLocation location) {
    ObjectNode node = this.mapper.createObjectNode();
    node.put("address", location.getAddress());
    node.put("text", location.getText());

    Coordinate coordinate = location.getCoordinate();
    if (coordinate != null) {
      node.put("lat", coordinate.getLatDegrees());
      node.put("lon", coordinate.getLngDegrees());
    }
    RectRegion box = location.getBoundingBox();
    if (box != null) {
      ArrayNode bounds = node.putArray("boundingbox");
      for (double bound : box.getBounds())
        bounds.add(bound);
    }
    if (location.getLocation().getOsmUrl() != null)
      node.put("osm_url", location.getLocation().getOsmUrl());
    if (location.getLocation().getGeocoder() != null)
      node.put("geocoder", location.getLocation().getGeocoder());

    node.put("relevance", location.getRelevance());
    ArrayNode mentions = node.putArray("mentions");
    for (String mention : location.getMentions())
      mentions.add(mention);
    ArrayNode cluster = node.putArray("cluster");
    for (String name : location.getCluster())
      cluster.add(name);
    node.put("cluster_ratio", location.getClusterRatio());

    ObjectNode relevance = node.putObject("map_relevance");
    for (Map.Entry<String, Double> entry : location.getMapRelevance().entrySet())
      relevance.put(entry.getKey(), entry.getValue());
    return node;
  }

  public ArrayNode toJson(List<ResolvedLocation> locations) {
    ArrayNode array = this.mapper.createArrayNode();
    for (ResolvedLocation location : locations)
      array.add(this.toJson(location));
    return array;
  }

  /**
   * Place name to full record.
   */
  public ObjectNode locationsJson(Map<String, ResolvedLocation> locations) {
    ObjectNode node = this.mapper.createObjectNode();
    for (Map.Entry<String, ResolvedLocation> entry : locations.entrySet())
      node.set(entry.getKey(), this.toJson(entry.getValue()));
    return node;
  }

  /**
   * The record restricted to {@link #CORE_FIELDS}.
   */
  public ObjectNode coreJson(ResolvedLocation location) {
    ObjectNode node = this.toJson(location);
    List<String> dropped = new ArrayList<String>();
    for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
      String field = it.next();
      if (!CORE_FIELDS.contains(field))
        dropped.add(field);
    }
    node.remove(dropped);
    return node;
  }

  /**
   * Output record of one story: id, locations and, if there is one,
   * core_location.
   */
  public ObjectNode storyJson(String id, Map<String, ResolvedLocation> locations,
                              ResolvedLocation core) {
    ObjectNode node = this.mapper.createObjectNode();
    node.put("id", id);
    node.set("locations", this.locationsJson(locations));
    if (core != null)
      node.set("core_location", this.coreJson(core));
    return node;
  }
}
