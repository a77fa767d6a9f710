package com.example.comicshelf.infrastructure.metadata;

import com.example.comicshelf.domain.model.SidecarMetadata;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SidecarMetadataReaderTest {

    @TempDir
    Path tempDir;

    private final SidecarMetadataReader reader = new SidecarMetadataReader();

    @Test
    void shouldReadKnownFieldsAndIgnoreUnknownOnes() throws IOException {
        Path file = write("{"
                + "\"series\": \" Vinland Saga \","
                + "\"title\": \"Vinland Saga\","
                + "\"title_japanese\": [\"ヴィンランド・サガ\"],"
                + "\"genres\": [\"Action\", \"Drama\"],"
                + "\"tags\": \"Vikings\","
                + "\"total_chapters\": \"210\","
                + "\"total_volumes\": 27,"
                + "\"mal_id\": \"not-a-number\","
                + "\"is_adult\": false,"
                + "\"publisher\": {\"name\": \"Kodansha\"}"
                + "}");

        SidecarMetadata metadata = reader.read(file);

        Assertions.assertNotNull(metadata);
        Assertions.assertEquals("Vinland Saga", metadata.getSeries());
        Assertions.assertEquals("Vinland Saga", metadata.preferredSeriesName());
        Assertions.assertEquals("[\"ヴィンランド・サガ\"]", metadata.getTitleJapanese());
        Assertions.assertEquals("[\"Action\",\"Drama\"]", metadata.getGenres());
        Assertions.assertEquals("[\"Vikings\"]", metadata.getTags());
        Assertions.assertEquals(Integer.valueOf(210), metadata.getTotalChapters());
        Assertions.assertEquals(Integer.valueOf(27), metadata.getTotalVolumes());
        Assertions.assertNull(metadata.getMalId());
        Assertions.assertNull(metadata.getSynopsis());
        Assertions.assertEquals(Boolean.FALSE, metadata.getAdult());
    }

    @Test
    void shouldTreatNumericAdultFlag() throws IOException {
        SidecarMetadata metadata = reader.read(write("{\"title\": \"Other\", \"is_adult\": 1}"));

        Assertions.assertEquals(Boolean.TRUE, metadata.getAdult());
        Assertions.assertEquals("Other", metadata.preferredSeriesName());
    }

    @Test
    void shouldReturnNullForUnreadableDocuments() throws IOException {
        Assertions.assertNull(reader.read(write("{not json")));
        Assertions.assertNull(reader.read(write("[1, 2, 3]")));
        Assertions.assertNull(reader.read(tempDir.resolve("missing.json")));
    }

    private Path write(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "series", ".json");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
