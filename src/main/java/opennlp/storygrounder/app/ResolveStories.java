/*
 * Resolves the places of a batch of stories to locations and picks each story's core location.
 */

package opennlp.storygrounder.app;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.OkHttpClient;

import opennlp.storygrounder.UnlocatedStoryException;
import opennlp.storygrounder.cluster.ClusterGrower;
import opennlp.storygrounder.cluster.GeoClusterer;
import opennlp.storygrounder.cluster.SquaredSizeObjective;
import opennlp.storygrounder.filter.CandidateFilter;
import opennlp.storygrounder.resolver.CoreLocationSelector;
import opennlp.storygrounder.resolver.HttpRelevanceScorer;
import opennlp.storygrounder.resolver.LocationResolver;
import opennlp.storygrounder.resolver.RelevanceScorer;
import opennlp.storygrounder.resolver.ResolvedLocation;
import opennlp.storygrounder.resolver.ScoringException;
import opennlp.storygrounder.text.MentionFinder;
import opennlp.storygrounder.text.Place;
import opennlp.storygrounder.text.Story;
import opennlp.storygrounder.text.io.ClusterKMLWriter;
import opennlp.storygrounder.text.io.LocationJson;
import opennlp.storygrounder.text.io.StoryJsonSource;
import opennlp.storygrounder.text.prep.OpenNLPTokenizer;
import opennlp.storygrounder.text.prep.StopList;
import opennlp.storygrounder.text.prep.Tokenizer;
import opennlp.storygrounder.topo.gaz.Gazetteer;
import opennlp.storygrounder.topo.gaz.NominatimGazetteer;
import opennlp.storygrounder.topo.gaz.OpenCageGazetteer;
import opennlp.storygrounder.util.Constants;

public class ResolveStories extends BaseApp {

    private static final Logger LOG = Logger.getLogger(ResolveStories.class.getName());

    public static void main(String[] args) throws Exception {

        long startTime = System.currentTimeMillis();

        configureLogging();
        initializeOptionsFromCommandLine(args);

        if(getInputPath() == null) {
            System.out.println("Abort: you must specify an input path to a JSON array of stories.");
            System.exit(0);
        }

        System.out.print("Reading stories from " + getInputPath() + " ...");
        StoryJsonSource source = StoryJsonSource.fromFile(getInputPath());
        List<Story> stories;
        try {
            stories = source.readAll();
        } finally {
            source.close();
        }
        System.out.println("done (" + stories.size() + " stories).");

        OkHttpClient client = new OkHttpClient();
        List<Gazetteer> gazetteers = createGazetteers(client);
        CandidateFilter filter = createFilter();
        RelevanceScorer scorer = getScorerUrl() == null ? null : new HttpRelevanceScorer(getScorerUrl(), client);
        MentionFinder mentionFinder = getSentenceModelPath() == null
            ? new MentionFinder() : MentionFinder.fromModel(getSentenceModelPath());

        ClusterKMLWriter kml = getKMLOutputPath() == null ? null : new ClusterKMLWriter();
        StoryTask.Context context = new StoryTask.Context(gazetteers, filter, scorer, mentionFinder, kml);

        System.out.println("Resolving with " + getNumThreads() + " thread(s)...");
        ExecutorService executor = Executors.newFixedThreadPool(getNumThreads());
        List<Future<ObjectNode>> futures = new ArrayList<Future<ObjectNode>>(stories.size());
        long seed = getSeed() == null ? System.nanoTime() : getSeed();
        for(int i = 0; i < stories.size(); i++)
            futures.add(executor.submit(new StoryTask(context, stories.get(i), new Random(seed + i))));
        executor.shutdown();

        ObjectMapper mapper = new ObjectMapper();
        ArrayNode results = mapper.createArrayNode();
        int failed = 0;
        for(int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                failed++;
                LOG.log(Level.SEVERE, "Story " + stories.get(i).getId() + " failed", e.getCause());
            }
        }

        if(getOutputPath() != null) {
            System.out.print("Writing resolved stories to " + getOutputPath() + " ...");
            mapper.writerWithDefaultPrettyPrinter().writeValue(new File(getOutputPath()), results);
            System.out.println("done.");
        }
        else {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(results));
        }

        if(kml != null) {
            System.out.print("Writing clusters in KML format to " + getKMLOutputPath() + " ...");
            kml.write(new File(getKMLOutputPath()));
            System.out.println("done.");
        }

        long endTime = System.currentTimeMillis();
        float seconds = (endTime - startTime) / 1000F;
        System.out.println("\nTotal time elapsed: " + Float.toString(seconds/(float)60.0) + " minutes.");

        if(failed > 0) {
            System.out.println(failed + " of " + stories.size() + " stories failed and were not written.");
            System.exit(1);
        }
    }

    protected static List<Gazetteer> createGazetteers(OkHttpClient client) {
        List<Gazetteer> gazetteers = new ArrayList<Gazetteer>();
        for(GEOCODER geocoder : getGeocoders()) {
            if(geocoder == GEOCODER.NOMINATIM) {
                gazetteers.add(new NominatimGazetteer(NominatimGazetteer.DEFAULT_URL, Constants.getNominatimUserAgent(),
                                                      NominatimGazetteer.DEFAULT_LIMIT,
                                                      NominatimGazetteer.DEFAULT_DELAY_MILLIS, client));
            }
            else {
                String key = Constants.getOpenCageApiKey();
                if(key == null || key.length() == 0)
                    throw new IllegalStateException("Set " + Constants.OPENCAGE_API_KEY_VAR + " to use OpenCage.");
                gazetteers.add(new OpenCageGazetteer(OpenCageGazetteer.DEFAULT_URL, key,
                                                     OpenCageGazetteer.DEFAULT_LIMIT, client));
            }
        }
        return gazetteers;
    }

    protected static CandidateFilter createFilter() throws Exception {
        List<String> corpus = getCorpusPath() == null
            ? CandidateFilter.defaultCorpus() : CandidateFilter.loadCorpus(getCorpusPath());
        Tokenizer tokenizer;
        if(getTokenizerModelPath() == null) {
            tokenizer = new OpenNLPTokenizer();
        }
        else {
            InputStream in = new FileInputStream(getTokenizerModelPath());
            try {
                tokenizer = new OpenNLPTokenizer(in);
            } finally {
                in.close();
            }
        }
        return new CandidateFilter(corpus, tokenizer, StopList.fromResource(StopList.DEFAULT_RESOURCE),
                                   getFilterThreshold(), isNormedFilter());
    }

    /**
     * Resolves one story. Each task gets its own optimizer so that runs with
     * a fixed seed are repeatable whatever the thread count.
     */
    static class StoryTask implements Callable<ObjectNode> {

        static class Context {
            final List<Gazetteer> gazetteers;
            final CandidateFilter filter;
            final RelevanceScorer scorer;
            final MentionFinder mentionFinder;
            final ClusterKMLWriter kml;
            final LocationJson json = new LocationJson();

            Context(List<Gazetteer> gazetteers, CandidateFilter filter, RelevanceScorer scorer,
                    MentionFinder mentionFinder, ClusterKMLWriter kml) {
                this.gazetteers = gazetteers;
                this.filter = filter;
                this.scorer = scorer;
                this.mentionFinder = mentionFinder;
                this.kml = kml;
            }
        }

        private final Context context;
        private final Story story;
        private final Random random;

        StoryTask(Context context, Story story, Random random) {
            this.context = context;
            this.story = story;
            this.random = random;
        }

        public ObjectNode call() throws ScoringException {
            ClusterGrower grower = new ClusterGrower(new GeoClusterer(getMaxDistKm(), getMinClusterSize()),
                                                     new SquaredSizeObjective(), this.random);
            LocationResolver resolver = new LocationResolver(this.context.gazetteers, this.context.filter, grower,
                                                             this.context.scorer, new CoreLocationSelector());

            Map<String, Place> places = this.context.mentionFinder.addMentions(this.story.getPlaces(),
                                                                               this.story.getText());
            Map<String, ResolvedLocation> locations;
            try {
                locations = resolver.resolveStory(places, this.story.getText());
            } catch (UnlocatedStoryException e) {
                LOG.info("Story " + this.story.getId() + " is unlocated: " + e.getMessage());
                locations = Collections.<String, ResolvedLocation>emptyMap();
            }

            ResolvedLocation core = locations.isEmpty() ? null : resolver.pickCore(locations.values());
            if(this.context.kml != null && !locations.isEmpty())
                this.context.kml.add(this.story.getId(), new LinkedHashMap<String, ResolvedLocation>(locations), core);
            return this.context.json.storyJson(this.story.getId(), locations, core);
        }
    }
}
