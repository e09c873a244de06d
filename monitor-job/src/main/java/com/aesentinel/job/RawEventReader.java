package com.aesentinel.job;

import com.aesentinel.core.model.RawEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads the raw adverse-event counts that the fetch step stored for a product.
 *
 * <p>
 * The file is {@code <dataDir>/<product>_adverse_events.json} and holds either
 * a JSON array of {@code {"time": "yyyyMMdd", "count": n}} objects or an
 * openFDA count response with such an array under {@code results}.
 * </p>
 *
 * <p>
 * A missing or unreadable file means "no data for this product": it is logged
 * and an empty list is returned so that one product cannot fail the whole run.
 * Individual elements that cannot be mapped (a non-numeric or fractional
 * count, a non-object element) are passed on as {@link RawEvent#malformed()}
 * so that normalization drops them and counts them with the other bad events.
 * </p>
 */
public class RawEventReader {

    private static final Logger LOG = LoggerFactory.getLogger(RawEventReader.class);

    static final String FILE_SUFFIX = "_adverse_events.json";

    private final Path dataDir;
    private final ObjectMapper mapper = JsonMappers.create();

    public RawEventReader(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
    }

    /**
     * @param product product identifier
     * @return the raw events, possibly empty; never {@code null}
     */
    public List<RawEvent> read(String product) {
        Objects.requireNonNull(product, "product must not be null");
        Path file = fileFor(product);
        if (!Files.isRegularFile(file)) {
            LOG.warn("No adverse event file for '{}' at {}", product, file);
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            LOG.warn("Failed to read adverse events for '{}' from {}, treating as no data: {}",
                    product, file, e.getMessage());
            return Collections.emptyList();
        }

        JsonNode records = root != null && root.has("results") ? root.get("results") : root;
        if (records == null || !records.isArray()) {
            LOG.warn("Unexpected JSON layout in {}, expected an array of events", file);
            return Collections.emptyList();
        }

        List<RawEvent> events = new ArrayList<>(records.size());
        int unmappable = 0;
        for (JsonNode node : records) {
            try {
                events.add(mapper.treeToValue(node, RawEvent.class));
            } catch (IOException e) {
                unmappable++;
                events.add(RawEvent.malformed());
                LOG.trace("Unmappable event {}: {}", node, e.getMessage());
            }
        }
        if (unmappable > 0) {
            LOG.warn("{} unmappable record(s) in {} will be dropped", unmappable, file);
        }
        LOG.info("Read {} raw event(s) for '{}' from {}", events.size(), product, file);
        return events;
    }

    Path fileFor(String product) {
        return dataDir.resolve(product + FILE_SUFFIX);
    }
}
