/*
 * Base app for resolving stories: command line options and logging set-up.
 */

package opennlp.storygrounder.app;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;

import org.apache.commons.cli.*;

import opennlp.storygrounder.cluster.GeoClusterer;
import opennlp.storygrounder.filter.CandidateFilter;

public class BaseApp {

    public static final String LOGGING_RESOURCE = "/logging.properties";

    private static Options options = new Options();

    private static String inputPath = null;
    private static String outputPath = null;
    private static String kmlOutputPath = null;
    private static String corpusPath = null;
    private static String scorerUrl = null;
    private static String sentenceModelPath = null;
    private static String tokenizerModelPath = null;

    private static double maxDistKm = GeoClusterer.DEFAULT_MAX_DIST_KM;
    private static int minClusterSize = GeoClusterer.DEFAULT_MIN_SIZE;
    private static double filterThreshold = CandidateFilter.DEFAULT_THRESHOLD;
    private static boolean normedFilter = false;
    private static Long seed = null;
    private static int numThreads = 1;

    public static enum GEOCODER {
        OPENCAGE,
        NOMINATIM
    }
    protected static List<GEOCODER> geocoders = new ArrayList<GEOCODER>();

    protected static void initializeOptionsFromCommandLine(String[] args) throws Exception {

        options = new Options();
        options.addOption("i", "input", true, "input path (JSON array of stories)");
        options.addOption("o", "output", true, "output path");
        options.addOption("ok", "output-kml", true, "kml output path");
        options.addOption("md", "max-distance", true, "maximum distance in km between neighboring cluster members [default = 150]");
        options.addOption("ms", "min-size", true, "minimum number of places to form a cluster [default = 1]");
        options.addOption("t", "threshold", true, "minimum text similarity of a kept candidate [default = 0.1]");
        options.addOption("n", "normed", false, "divide similarities by the story's largest similarity before thresholding");
        options.addOption("corpus", "reference-corpus", true, "path to reference corpus (one text per line) [default = bundled corpus]");
        options.addOption("scorer", "scorer-url", true, "URL of the location relevance scorer");
        options.addOption("g", "geocoders", true, "comma-separated geocoders (OpenCage, Nominatim) [default = OpenCage]");
        options.addOption("seed", "random-seed", true, "seed for the cluster optimizer's random order");
        options.addOption("threads", "threads", true, "number of stories resolved in parallel [default = 1]");
        options.addOption("sm", "sentence-model", true, "path to OpenNLP sentence detector model used to find mentions");
        options.addOption("tm", "tokenizer-model", true, "path to OpenNLP tokenizer model used for text similarity");

        options.addOption("h", "help", false, "print help");

        CommandLineParser optparse = new PosixParser();
        CommandLine cline = optparse.parse(options, args);

        if (cline.hasOption('h')) {
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("storygrounder [command] ", options);
            System.exit(0);
        }

        geocoders.clear();
        for (Option option : cline.getOptions()) {
            String value = option.getValue();
            switch (option.getOpt().charAt(0)) {
                case 'i':
                    inputPath = value;
                    break;
                case 'o':
                    if(option.getOpt().equals("o"))
                        outputPath = value;
                    else if(option.getOpt().equals("ok"))
                        kmlOutputPath = value;
                    break;
                case 'm':
                    if(option.getOpt().equals("md"))
                        maxDistKm = Double.parseDouble(value);
                    else if(option.getOpt().equals("ms"))
                        minClusterSize = Integer.parseInt(value);
                    break;
                case 't':
                    if(option.getOpt().equals("t"))
                        filterThreshold = Double.parseDouble(value);
                    else if(option.getOpt().equals("threads"))
                        numThreads = Integer.parseInt(value);
                    else if(option.getOpt().equals("tm"))
                        tokenizerModelPath = value;
                    break;
                case 'n':
                    normedFilter = true;
                    break;
                case 'c':
                    corpusPath = value;
                    break;
                case 's':
                    if(option.getOpt().equals("scorer"))
                        scorerUrl = value;
                    else if(option.getOpt().equals("seed"))
                        seed = Long.parseLong(value);
                    else if(option.getOpt().equals("sm"))
                        sentenceModelPath = value;
                    break;
                case 'g':
                    for(String name : value.split(",")) {
                        name = name.trim().toLowerCase();
                        if(name.startsWith("n") || name.equals("osm"))
                            geocoders.add(GEOCODER.NOMINATIM);
                        else if(name.startsWith("o"))
                            geocoders.add(GEOCODER.OPENCAGE);
                        else
                            throw new ParseException("Unknown geocoder: " + name);
                    }
                    break;
            }
        }

        if(geocoders.isEmpty())
            geocoders.add(GEOCODER.OPENCAGE);
    }

    /**
     * Reads the bundled logging configuration, if there is one.
     */
    protected static void configureLogging() throws IOException {
        InputStream in = BaseApp.class.getResourceAsStream(LOGGING_RESOURCE);
        if(in == null)
            return;
        try {
            LogManager.getLogManager().readConfiguration(in);
        } finally {
            in.close();
        }
    }

    public static String getInputPath() {
        return inputPath;
    }

    public static String getOutputPath() {
        return outputPath;
    }

    public static String getKMLOutputPath() {
        return kmlOutputPath;
    }

    public static String getCorpusPath() {
        return corpusPath;
    }

    public static String getScorerUrl() {
        return scorerUrl;
    }

    public static String getSentenceModelPath() {
        return sentenceModelPath;
    }

    public static String getTokenizerModelPath() {
        return tokenizerModelPath;
    }

    public static double getMaxDistKm() {
        return maxDistKm;
    }

    public static int getMinClusterSize() {
        return minClusterSize;
    }

    public static double getFilterThreshold() {
        return filterThreshold;
    }

    public static boolean isNormedFilter() {
        return normedFilter;
    }

    public static Long getSeed() {
        return seed;
    }

    public static int getNumThreads() {
        return numThreads;
    }

    public static List<GEOCODER> getGeocoders() {
        return geocoders;
    }
}
