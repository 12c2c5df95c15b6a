package com.example.reviewsearch.cli;

import com.example.reviewsearch.ReviewSearchService;
import com.example.reviewsearch.error.InvalidQueryException;
import com.example.reviewsearch.error.ReviewSearchException;
import com.example.reviewsearch.error.UnsupportedPlatformException;
import com.example.reviewsearch.io.JsonWriter;
import com.example.reviewsearch.model.ScrapeResult;
import com.example.reviewsearch.model.SearchResult;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

public class App {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar review-search.jar <command> [args]",
            "  platforms                                   list supported platforms",
            "  categories                                  list filter categories",
            "  scrape <url> [platform] [out=<file>]        scrape all reviews on a page",
            "  search <url> [key=value ...] [out=<file>]   filter and rank reviews",
            "         keys: keywords, categories, min_rating, max_rating, sentiment, sort_by, limit");

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE_ERROR = 2;

    private final Supplier<ReviewSearchService> services;
    private final PrintStream out;
    private final PrintStream err;

    App(Supplier<ReviewSearchService> services, PrintStream out, PrintStream err) {
        this.services = services;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new App(ReviewSearchService::createDefault, System.out, System.err).run(args);
        if (code != OK) {
            System.exit(code);
        }
    }

    int run(String[] args) {
        if (args.length < 1) {
            out.println(USAGE);
            return USAGE_ERROR;
        }

        String command = args[0].toLowerCase(Locale.ROOT);
        try {
            switch (command) {
                case "platforms":
                    out.println(JsonWriter.toJson(services.get().platforms()));
                    return OK;
                case "categories":
                    out.println(JsonWriter.toJson(services.get().categories()));
                    return OK;
                case "scrape":
                    return scrape(args);
                case "search":
                    return search(args);
                default:
                    err.println("Unsupported command: " + command);
                    out.println(USAGE);
                    return USAGE_ERROR;
            }
        } catch (InvalidQueryException ex) {
            err.println("Invalid " + ex.getParameter() + ": " + ex.getMessage());
            return USAGE_ERROR;
        } catch (UnsupportedPlatformException ex) {
            err.println(ex.getMessage());
            return FAILED;
        } catch (ReviewSearchException ex) {
            err.println("Error: " + ex.getMessage());
            return FAILED;
        } catch (IOException ex) {
            err.println("Could not write output: " + ex.getMessage());
            return FAILED;
        }
    }

    private int scrape(String[] args) throws ReviewSearchException, IOException {
        if (args.length < 2) {
            out.println(USAGE);
            return USAGE_ERROR;
        }
        String url = args[1];
        Map<String, String> options = options(args, 2);
        String platform = options.remove("platform");
        if (platform == null && args.length >= 3 && !args[2].contains("=")) {
            platform = args[2];
        }

        ScrapeResult result = services.get().scrape(url, platform);
        out.println("Collected " + result.getTotalReviews() + " reviews.");

        String filename = options.getOrDefault("out",
                String.format("reviews_%s_scrape.json", result.getPlatform()));
        File written = JsonWriter.write(result, filename);
        out.println("Wrote " + written.getAbsolutePath());
        return OK;
    }

    private int search(String[] args) throws ReviewSearchException, IOException {
        if (args.length < 2) {
            out.println(USAGE);
            return USAGE_ERROR;
        }
        String url = args[1];
        Map<String, String> params = options(args, 2);
        String outFile = params.remove("out");

        SearchResult result = services.get().search(url, params);
        out.println(result.summary() + ".");

        String filename = outFile != null ? outFile
                : String.format("reviews_%s_search.json", result.getPlatform());
        File written = JsonWriter.write(result, filename);
        out.println("Wrote " + written.getAbsolutePath());
        return OK;
    }

    /**
     * key=value arguments from `start` on; bare words are ignored here.
     */
    static Map<String, String> options(String[] args, int start) {
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = start; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) continue;
            params.put(args[i].substring(0, eq).trim().toLowerCase(Locale.ROOT), args[i].substring(eq + 1));
        }
        return params;
    }
}
