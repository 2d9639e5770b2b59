package org.ecosysx.analytics;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes {@link AnalyticsExport} snapshots to pretty-printed JSON with snake_case field names.
 */
public final class AnalyticsExporter {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsExporter.class);

    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeSpecialFloatingPointValues()
            .setPrettyPrinting()
            .create();

    public String toJson(AnalyticsExport export) {
        return gson.toJson(export);
    }

    /**
     * Writes the export to {@code path}, creating parent directories as needed.
     *
     * @throws IOException if the file cannot be written.
     */
    public void write(AnalyticsExport export, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(export, writer);
        }
        LOG.info("Analytics exported to {} ({} windows, {} contact pairs)",
                path, export.recentWindows().size(), export.contactMatrix().size());
    }
}
