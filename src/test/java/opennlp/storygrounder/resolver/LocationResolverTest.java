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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

import opennlp.storygrounder.UnlocatedStoryException;
import opennlp.storygrounder.cluster.ClusterGrower;
import opennlp.storygrounder.cluster.GeoClusterer;
import opennlp.storygrounder.cluster.SquaredSizeObjective;
import opennlp.storygrounder.filter.CandidateFilter;
import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.text.prep.OpenNLPTokenizer;
import opennlp.storygrounder.text.prep.StopList;
import opennlp.storygrounder.topo.Coordinate;
import opennlp.storygrounder.topo.Location;
import opennlp.storygrounder.topo.gaz.Gazetteer;
import opennlp.storygrounder.topo.gaz.GeocodingException;

import static org.junit.Assert.*;

public class LocationResolverTest {

  private static final List<String> CORPUS = Arrays.asList(
      "Markets rallied on Tuesday after the central bank held rates.",
      "The storm moved north across the coast overnight.");

  private static final String ARTICLE =
      "Delegates met in Geneva, Switzerland on Monday. Talks continue in Lausanne later this week.";

  private static class MapGazetteer implements Gazetteer {
    private final Map<String, List<Location>> records = new HashMap<String, List<Location>>();
    private final List<String> queries = new ArrayList<String>();

    MapGazetteer add(String name, Location... locations) {
      this.records.put(name, Arrays.asList(locations));
      return this;
    }

    public String getName() {
      return "map";
    }

    public List<Location> lookup(String query) {
      this.queries.add(query);
      List<Location> locations = this.records.get(query);
      return locations == null ? Collections.<Location>emptyList() : locations;
    }
  }

  private static class FailingGazetteer implements Gazetteer {
    public String getName() {
      return "failing";
    }

    public List<Location> lookup(String query) throws GeocodingException {
      throw new GeocodingException("service unavailable");
    }
  }

  private static class FixedScorer implements RelevanceScorer {
    private final Map<String, Map<String, Double>> scores = new HashMap<String, Map<String, Double>>();
    private List<ResolvedLocation> seen;

    FixedScorer put(String name, double core, double relevant) {
      Map<String, Double> probs = new LinkedHashMap<String, Double>();
      probs.put("core", core);
      probs.put("relevant", relevant);
      this.scores.put(name, probs);
      return this;
    }

    public List<Map<String, Double>> score(List<ResolvedLocation> locations) {
      this.seen = locations;
      List<Map<String, Double>> result = new ArrayList<Map<String, Double>>();
      for (ResolvedLocation location : locations) {
        Map<String, Double> probs = this.scores.get(location.getName());
        result.add(probs == null ? new HashMap<String, Double>() : probs);
      }
      return result;
    }
  }

  private static Location candidate(String address, double lat, double lng, String... components) {
    Map<String, String> map = new LinkedHashMap<String, String>();
    for (int i = 0; i < components.length; i += 2)
      map.put(components[i], components[i + 1]);
    return new Location(address, Coordinate.fromDegrees(lat, lng), null, map, "map", null);
  }

  private CandidateFilter filter;
  private MapGazetteer gazetteer;
  private Map<String, Place> places;

  @Before
  public void setUp() throws Exception {
    this.filter = new CandidateFilter(CORPUS, new OpenNLPTokenizer(),
                                      StopList.fromResource(StopList.DEFAULT_RESOURCE),
                                      CandidateFilter.DEFAULT_THRESHOLD, false);
    this.gazetteer = new MapGazetteer()
        .add("Geneva",
             candidate("Geneva, IL, United States of America", 41.88, -88.30,
                       "county", "Kane County", "state", "Illinois", "country", "United States"),
             candidate("Geneva, Switzerland", 46.20, 6.14,
                       "city", "Geneva", "country", "Switzerland", "country_code", "ch"))
        .add("Lausanne",
             candidate("Lausanne, Vaud, Switzerland", 46.52, 6.63,
                       "city", "Lausanne", "state", "Vaud", "country", "Switzerland"));

    this.places = new LinkedHashMap<String, Place>();
    this.places.put("Geneva", new Place("Geneva", "Geneva", 0.9,
                                        Collections.singletonList("Delegates met in Geneva, Switzerland on Monday.")));
    this.places.put("Lausanne", new Place("Lausanne", "Lausanne", 0.6));
  }

  private ClusterGrower grower() {
    return new ClusterGrower(new GeoClusterer(), new SquaredSizeObjective(), new Random(7));
  }

  private LocationResolver resolver(RelevanceScorer scorer, Gazetteer... gazetteers) {
    return new LocationResolver(Arrays.asList(gazetteers), this.filter, this.grower(),
                                scorer, new CoreLocationSelector());
  }

  @Test
  public void resolvesGenevaNextToLausanne() throws Exception {
    Map<String, ResolvedLocation> locations = this.resolver(null, this.gazetteer).resolveStory(this.places, ARTICLE);

    assertEquals(2, locations.size());
    ResolvedLocation geneva = locations.get("Geneva");
    assertEquals("Geneva, Switzerland", geneva.getAddress());
    assertEquals(1.0, geneva.getClusterRatio(), 1e-9);
    assertEquals(1.0, locations.get("Lausanne").getClusterRatio(), 1e-9);
    assertEquals(2, geneva.getCluster().size());
    assertTrue(geneva.getCluster().contains("Lausanne"));

    assertEquals(0.9, geneva.getRelevance(), 1e-9);
    assertEquals(1, geneva.getMentions().size());
    assertTrue(geneva.getMapRelevance().isEmpty());
  }

  @Test
  public void failingGazetteerDoesNotSinkTheStory() throws Exception {
    Map<String, ResolvedLocation> locations =
        this.resolver(null, new FailingGazetteer(), this.gazetteer).resolveStory(this.places, ARTICLE);
    assertEquals(2, locations.size());
    assertEquals(Arrays.asList("Geneva", "Lausanne"), this.gazetteer.queries);
  }

  @Test
  public void assemblesCandidatesOfAllGazetteers() {
    MapGazetteer other = new MapGazetteer().add("Geneva", candidate("Genève", 46.2, 6.15));
    Map<String, List<Location>> candidates = this.resolver(null, this.gazetteer, other)
        .assembleGeocodings(Arrays.asList("Geneva", "Atlantis"));
    assertEquals(1, candidates.size());
    assertEquals(3, candidates.get("Geneva").size());
    assertEquals("Genève", candidates.get("Geneva").get(2).getAddress());
  }

  @Test(expected = UnlocatedStoryException.class)
  public void noCandidatesMeansUnlocated() throws Exception {
    this.resolver(null, new MapGazetteer(), new FailingGazetteer()).resolveStory(this.places, ARTICLE);
  }

  @Test(expected = UnlocatedStoryException.class)
  public void everythingFilteredMeansUnlocated() throws Exception {
    this.resolver(null, this.gazetteer).resolveStory(this.places, "Quarterly earnings beat forecasts.");
  }

  @Test
  public void scoresAndPicksCore() throws Exception {
    FixedScorer scorer = new FixedScorer().put("Geneva", 0.8, 0.1).put("Lausanne", 0.2, 0.7);
    LocationResolver resolver = this.resolver(scorer, this.gazetteer);
    Map<String, ResolvedLocation> locations = resolver.resolveStory(this.places, ARTICLE);

    assertEquals(2, scorer.seen.size());
    assertEquals(0.8, locations.get("Geneva").getMapRelevance("core"), 1e-9);
    assertEquals(0.7, locations.get("Lausanne").getMapRelevance("relevant"), 1e-9);
    assertSame(locations.get("Geneva"), resolver.pickCore(locations.values()));
  }

  @Test
  public void lowScoresGiveNoCore() throws Exception {
    FixedScorer scorer = new FixedScorer().put("Geneva", 0.3, 0.4).put("Lausanne", 0.1, 0.2);
    LocationResolver resolver = this.resolver(scorer, this.gazetteer);
    Map<String, ResolvedLocation> locations = resolver.resolveStory(this.places, ARTICLE);
    assertNull(resolver.pickCore(locations.values()));
  }

  @Test
  public void scorerFailurePropagates() throws Exception {
    RelevanceScorer broken = new RelevanceScorer() {
      public List<Map<String, Double>> score(List<ResolvedLocation> locations) throws ScoringException {
        throw new ScoringException("Scorer returned HTTP 502", 502, "bad gateway");
      }
    };
    try {
      this.resolver(broken, this.gazetteer).resolveStory(this.places, ARTICLE);
      fail("expected ScoringException");
    } catch (ScoringException e) {
      assertEquals(502, e.getStatus());
      assertEquals("bad gateway", e.getBody());
    }
  }

  @Test(expected = ScoringException.class)
  public void misalignedScoresAreRejected() throws Exception {
    RelevanceScorer partial = new RelevanceScorer() {
      public List<Map<String, Double>> score(List<ResolvedLocation> locations) {
        return Collections.singletonList(Collections.singletonMap("core", 0.9));
      }
    };
    this.resolver(partial, this.gazetteer).resolveStory(this.places, ARTICLE);
  }
}
