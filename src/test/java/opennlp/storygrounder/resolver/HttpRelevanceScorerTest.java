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

import java.net.URLDecoder;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.RectRegion;

import static org.junit.Assert.*;

public class HttpRelevanceScorerTest {

  private MockWebServer server;
  private HttpRelevanceScorer scorer;

  @Before
  public void setUp() throws Exception {
    this.server = new MockWebServer();
    this.server.start();
    this.scorer = new HttpRelevanceScorer(this.server.url("/locations").toString(), new OkHttpClient());
  }

  @After
  public void tearDown() throws Exception {
    this.server.shutdown();
  }

  private static List<ResolvedLocation> locations() {
    ResolvedLocation kabul = new ResolvedLocation(
        "Kabul",
        new Location("Kabul, Afghanistan", Coordinate.fromDegrees(34.55, 69.21),
                     RectRegion.fromBounds(69.0, 34.4, 69.4, 34.7)),
        new Place("Kabul", "Kabul", 0.82), Arrays.asList("Kabul", "Ali Abad"), 1.0);
    ResolvedLocation aliAbad = new ResolvedLocation(
        "Ali Abad",
        new Location("Ali Abad hospital, Kabul", Coordinate.fromDegrees(34.52, 69.13)),
        new Place("Ali Abad", "Ali Abad hospital", 0.66), Arrays.asList("Kabul", "Ali Abad"), 1.0);
    return Arrays.asList(kabul, aliAbad);
  }

  @Test
  public void postsLocationsAsFormField() throws Exception {
    this.server.enqueue(new MockResponse().setBody(
        "[{\"core\": 0.9, \"relevant\": 0.05}, {\"core\": 0.1, \"relevant\": 0.7}]"));

    List<Map<String, Double>> scores = this.scorer.score(locations());
    assertEquals(2, scores.size());
    assertEquals(0.9, scores.get(0).get("core"), 1e-9);
    assertEquals(0.7, scores.get(1).get("relevant"), 1e-9);

    RecordedRequest request = this.server.takeRequest();
    assertEquals("POST", request.getMethod());
    String form = request.getBody().readUtf8();
    assertTrue(form.startsWith(HttpRelevanceScorer.FORM_FIELD + "="));
    String data = URLDecoder.decode(form.substring(HttpRelevanceScorer.FORM_FIELD.length() + 1), "UTF-8");
    JsonNode sent = new ObjectMapper().readTree(data);
    assertTrue(sent.isArray());
    assertEquals(2, sent.size());
    assertEquals("Kabul, Afghanistan", sent.get(0).get("address").asText());
    assertEquals(69.0, sent.get(0).get("boundingbox").get(0).asDouble(), 1e-9);
    assertEquals("Ali Abad hospital", sent.get(1).get("text").asText());
  }

  @Test
  public void errorStatusKeepsBody() throws Exception {
    this.server.enqueue(new MockResponse().setResponseCode(500).setBody("model not loaded"));
    try {
      this.scorer.score(locations());
      fail("expected ScoringException");
    } catch (ScoringException e) {
      assertEquals(500, e.getStatus());
      assertEquals("model not loaded", e.getBody());
      assertTrue(e.getMessage().contains("model not loaded"));
    }
  }

  @Test(expected = ScoringException.class)
  public void misalignedResponseIsRejected() throws Exception {
    this.server.enqueue(new MockResponse().setBody("[{\"core\": 0.9}]"));
    this.scorer.score(locations());
  }

  @Test(expected = ScoringException.class)
  public void nonArrayResponseIsRejected() throws Exception {
    this.server.enqueue(new MockResponse().setBody("{\"core\": 0.9}"));
    this.scorer.score(Collections.singletonList(locations().get(0)));
  }

  @Test(expected = ScoringException.class)
  public void unparseableResponseIsRejected() throws Exception {
    this.server.enqueue(new MockResponse().setBody("<html>oops</html>"));
    this.scorer.score(locations());
  }
}
