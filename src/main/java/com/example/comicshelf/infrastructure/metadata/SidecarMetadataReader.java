package com.example.comicshelf.infrastructure.metadata;

import com.example.comicshelf.domain.model.SidecarMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads series.json sidecars leniently: unknown keys are ignored, a field of the wrong shape
 * is dropped on its own, and an unreadable document yields {@code null}.
 */
@Component
public class SidecarMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(SidecarMetadataReader.class);

    private final ObjectMapper objectMapper;

    public SidecarMetadataReader() {
        this(new ObjectMapper());
    }

    SidecarMetadataReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SidecarMetadata read(Path file) {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            log.warn("SIDECAR_READ_FAILED file={} msg={}", file, e.getMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            log.warn("SIDECAR_NOT_OBJECT file={}", file);
            return null;
        }
        SidecarMetadata metadata = new SidecarMetadata();
        metadata.setSeries(text(root, "series"));
        metadata.setTitle(text(root, "title"));
        metadata.setTitleEnglish(text(root, "title_english"));
        metadata.setTitleJapanese(textOrJson(root, "title_japanese"));
        metadata.setSynonyms(jsonArray(root, "synonyms"));
        metadata.setAuthors(jsonArray(root, "authors"));
        metadata.setSynopsis(text(root, "synopsis"));
        metadata.setGenres(jsonArray(root, "genres"));
        metadata.setTags(jsonArray(root, "tags"));
        metadata.setDemographics(jsonArray(root, "demographics"));
        metadata.setStatus(text(root, "status"));
        metadata.setTotalVolumes(integer(root, "total_volumes"));
        metadata.setTotalChapters(integer(root, "total_chapters"));
        metadata.setReleaseYear(integer(root, "release_year"));
        metadata.setMalId(longValue(root, "mal_id"));
        metadata.setAnilistId(longValue(root, "anilist_id"));
        JsonNode adult = root.get("is_adult");
        if (adult != null && !adult.isNull()) {
            metadata.setAdult(adult.isBoolean() ? adult.booleanValue() : adult.asInt(0) != 0);
        }
        return metadata;
    }

    private String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private String textOrJson(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node != null && node.isArray()) {
            return writeJson(node);
        }
        return text(root, field);
    }

    /**
     * Always stores an array; a bare string becomes a one-element array.
     */
    private String jsonArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return writeJson(node);
        }
        if (node.isValueNode()) {
            String value = node.asText().trim();
            if (value.isEmpty()) {
                return null;
            }
            ArrayNode array = objectMapper.createArrayNode();
            array.add(value);
            return writeJson(array);
        }
        return null;
    }

    private Integer integer(JsonNode root, String field) {
        Long value = longValue(root, field);
        if (value == null || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    private Long longValue(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("SIDECAR_FIELD_IGNORED field={} value={}", field, node.asText());
                return null;
            }
        }
        return null;
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sidecar field", e);
        }
    }
}
