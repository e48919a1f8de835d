package org.netpreserve.mapcrawl.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration for a crawl.
 *
 * @param store   where queue and documents are persisted
 * @param crawl   how to crawl (budget, pool, politeness)
 * @param sources which sitemaps to crawl
 */
public record JobConfig(
        StoreConfig store,
        CrawlConfig crawl,
        List<SourceConfig> sources
) {
    public JobConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public JobConfig withCrawl(CrawlConfig crawl) {
        return new JobConfig(store, crawl, sources);
    }

    public List<String> sourceNames() {
        return sources.stream().map(SourceConfig::name).toList();
    }

    public void validate() throws ConfigException {
        if (store == null) throw new ConfigException("store section is required");
        if (crawl == null) throw new ConfigException("crawl section is required");
        store.validate();
        crawl.validate();
        var names = new HashSet<String>();
        for (var source : sources) {
            if (source.name() == null || source.name().isBlank()) {
                throw new ConfigException("every source needs a name");
            }
            if (source.sitemapIndex() == null || source.sitemapIndex().isBlank()) {
                throw new ConfigException("source " + source.name() + " needs a sitemapIndex");
            }
            if (!names.add(source.name())) {
                throw new ConfigException("duplicate source name: " + source.name());
            }
        }
    }

    public static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Loads the built-in defaults, merges the given file over them (if not null) and validates the result.
     */
    public static JobConfig load(@Nullable Path configFile) throws ConfigException {
        var mapper = mapper();
        try {
            JsonNode tree;
            try (InputStream stream = Objects.requireNonNull(JobConfig.class.getResourceAsStream("defaults.yaml"),
                    "missing defaults.yaml")) {
                tree = mapper.readTree(stream);
            }
            if (configFile != null) {
                if (!Files.exists(configFile)) throw new ConfigException("config file not found: " + configFile);
                JsonNode override = mapper.readTree(configFile.toFile());
                if (override != null && !override.isMissingNode() && !override.isNull()) {
                    if (!override.isObject()) throw new ConfigException("config root must be a mapping: " + configFile);
                    tree = deepMerge(tree, override);
                }
            }
            JobConfig config = mapper.treeToValue(tree, JobConfig.class);
            config.validate();
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigException("malformed config: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("unable to read config: " + e.getMessage(), e);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode baseValue = merged.get(key);
            merged.set(key, baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }
}
