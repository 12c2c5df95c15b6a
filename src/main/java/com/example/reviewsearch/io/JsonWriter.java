package com.example.reviewsearch.io;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Small JSON writer utility. Field names are written in snake_case.
 */
public class JsonWriter {
    private static final Gson G = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    public static File write(Object payload, String filename) throws IOException {
        File f = new File(filename);
        try (Writer w = Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8)) {
            G.toJson(payload, w);
        }
        return f;
    }

    public static String toJson(Object payload) {
        return G.toJson(payload);
    }
}
