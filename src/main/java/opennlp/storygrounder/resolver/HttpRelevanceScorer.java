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
package opennlp.storygrounder.resolver;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import opennlp.storygrounder.text.io.LocationJson;

/**
 * Scores locations with a remote classifier. All locations of a story go in
 * one form POST, as a JSON array in the field locations_data; the answer is
 * a JSON array of {category: probability} objects in the same order.
 */
public class HttpRelevanceScorer implements RelevanceScorer {

  public static final String FORM_FIELD = "locations_data";

  private final String url;
  private final OkHttpClient client;
  private final ObjectMapper mapper;
  private final LocationJson json;

  public HttpRelevanceScorer(String url, OkHttpClient client) {
    this.url = url;
    this.client = client;
    this.mapper = new ObjectMapper();
    this.json = new LocationJson(this.mapper);
  }

  public HttpRelevanceScorer(String url) {
    this(url, new OkHttpClient());
  }

  public List<Map<String, Double>> score(List<ResolvedLocation> locations) throws ScoringException {
    String data;
    try {
      data = this.mapper.writeValueAsString(this.json.toJson(locations));
    } catch (IOException e) {
      throw new ScoringException("Could not serialize locations", e);
    }
    Request request = new Request.Builder()
        .url(this.url)
        .post(new FormBody.Builder().add(FORM_FIELD, data).build())
        .build();

    String text;
    Response response = null;
    try {
      response = this.client.newCall(request).execute();
      ResponseBody body = response.body();
      text = body == null ? "" : body.string();
      if (!response.isSuccessful())
        throw new ScoringException("Scorer at " + this.url + " returned HTTP " + response.code(),
                                   response.code(), text);
    } catch (ScoringException e) {
      throw e;
    } catch (IOException e) {
      throw new ScoringException("Scorer at " + this.url + " failed", e);
    } finally {
      if (response != null)
        response.close();
    }

    List<Map<String, Double>> scores = this.parse(text);
    if (scores.size() != locations.size())
      throw new ScoringException("Scorer returned " + scores.size() + " scores for "
                                 + locations.size() + " locations", 200, text);
    return scores;
  }

  private List<Map<String, Double>> parse(String text) throws ScoringException {
    JsonNode root;
    try {
      root = this.mapper.readTree(text);
    } catch (IOException e) {
      throw new ScoringException("Unparseable scorer response", e);
    }
    if (root == null || !root.isArray())
      throw new ScoringException("Scorer response is not an array", 200, text);

    List<Map<String, Double>> scores = new ArrayList<Map<String, Double>>(root.size());
    for (JsonNode record : root) {
      if (!record.isObject())
        throw new ScoringException("Scorer record is not an object", 200, text);
      Map<String, Double> probs = new LinkedHashMap<String, Double>();
      for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> field = it.next();
        if (!field.getValue().isNumber())
          throw new ScoringException("Non-numeric probability for " + field.getKey(), 200, text);
        probs.put(field.getKey(), field.getValue().doubleValue());
      }
      scores.add(probs);
    }
    return scores;
  }

  public String getUrl() {
    return this.url;
  }
}
