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

import java.util.List;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import opennlp.storygrounder.topo.Location;

import static org.junit.Assert.*;

public class OpenCageGazetteerTest {

  private static final String GENEVA_RESPONSE = "{\"results\": ["
      + "{\"formatted\": \"Geneva, Switzerland\","
      + " \"geometry\": {\"lat\": 46.2017559, \"lng\": 6.1466014},"
      + " \"bounds\": {\"northeast\": {\"lat\": 46.2192, \"lng\": 6.1749},"
      + "            \"southwest\": {\"lat\": 46.1777, \"lng\": 6.1101}},"
      + " \"components\": {\"_type\": \"city\", \"city\": \"Geneva\", \"country\": \"Switzerland\","
      + "                  \"country_code\": \"ch\", \"ISO_3166-1_alpha-2\": \"CH\"},"
      + " \"annotations\": {\"OSM\": {\"url\": \"https://www.openstreetmap.org/?mlat=46.20&mlon=6.15\"}}},"
      + "{\"formatted\": \"Geneva, IL, United States of America\","
      + " \"geometry\": {\"lat\": 41.8875, \"lng\": -88.3054},"
      + " \"components\": {\"city\": \"Geneva\", \"state\": \"Illinois\"}},"
      + "{\"formatted\": \"Somewhere without geometry\"}"
      + "]}";

  private MockWebServer server;
  private OpenCageGazetteer gazetteer;

  @Before
  public void setUp() throws Exception {
    this.server = new MockWebServer();
    this.server.start();
    this.gazetteer = new OpenCageGazetteer(this.server.url("/geocode/v1/json").toString(),
                                           "secret", 10, new OkHttpClient());
  }

  @After
  public void tearDown() throws Exception {
    this.server.shutdown();
  }

  @Test
  public void parsesRecords() throws Exception {
    this.server.enqueue(new MockResponse().setBody(GENEVA_RESPONSE));
    List<Location> locations = this.gazetteer.lookup("Geneva");

    assertEquals(3, locations.size());
    Location ch = locations.get(0);
    assertEquals("Geneva, Switzerland", ch.getAddress());
    assertEquals(46.2017559, ch.getCoordinate().getLatDegrees(), 1e-9);
    assertEquals(6.1466014, ch.getCoordinate().getLngDegrees(), 1e-9);
    assertArrayEquals(new double[] { 6.1101, 46.1777, 6.1749, 46.2192 },
                      ch.getBoundingBox().getBounds(), 1e-9);
    assertEquals("Switzerland", ch.getComponents().get("country"));
    assertEquals("opencage", ch.getGeocoder());
    assertTrue(ch.getOsmUrl().startsWith("https://www.openstreetmap.org/"));

    assertNull(locations.get(1).getBoundingBox());
    assertFalse(locations.get(2).hasCoordinate());

    RecordedRequest request = this.server.takeRequest();
    assertEquals("Geneva", request.getRequestUrl().queryParameter("q"));
    assertEquals("secret", request.getRequestUrl().queryParameter("key"));
    assertEquals("10", request.getRequestUrl().queryParameter("limit"));
  }

  @Test
  public void dropsIntersectingRecordsWhenAsked() throws Exception {
    String body = "{\"results\": ["
        + "{\"formatted\": \"Vaud\", \"geometry\": {\"lat\": 46.6, \"lng\": 6.6},"
        + " \"bounds\": {\"northeast\": {\"lat\": 47.0, \"lng\": 7.2}, \"southwest\": {\"lat\": 46.2, \"lng\": 6.0}}},"
        + "{\"formatted\": \"Lausanne\", \"geometry\": {\"lat\": 46.52, \"lng\": 6.63}},"
        + "{\"formatted\": \"Lausanne, Kentucky\", \"geometry\": {\"lat\": 37.0, \"lng\": -85.0}}"
        + "]}";
    this.server.enqueue(new MockResponse().setBody(body));
    this.gazetteer.setDropIntersecting(true);
    List<Location> locations = this.gazetteer.lookup("Lausanne");
    assertEquals(2, locations.size());
    assertEquals("Vaud", locations.get(0).getAddress());
    assertEquals("Lausanne, Kentucky", locations.get(1).getAddress());
  }

  @Test
  public void httpErrorCarriesBody() throws Exception {
    this.server.enqueue(new MockResponse().setResponseCode(401).setBody("invalid API key"));
    try {
      this.gazetteer.lookup("Geneva");
      fail("expected GeocodingException");
    } catch (GeocodingException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("401"));
      assertTrue(e.getMessage(), e.getMessage().contains("invalid API key"));
    }
  }

  @Test(expected = GeocodingException.class)
  public void missingResultsIsAnError() throws Exception {
    this.server.enqueue(new MockResponse().setBody("{\"status\": {\"code\": 200}}"));
    this.gazetteer.lookup("Geneva");
  }

  @Test(expected = GeocodingException.class)
  public void unparseableBodyIsAnError() throws Exception {
    this.server.enqueue(new MockResponse().setBody("<html>oops</html>"));
    this.gazetteer.lookup("Geneva");
  }

  @Test(expected = IllegalArgumentException.class)
  public void requiresKey() {
    new OpenCageGazetteer(OpenCageGazetteer.DEFAULT_URL, "", 10, new OkHttpClient());
  }
}
