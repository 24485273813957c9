package org.cnfanalysis.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cnfanalysis.features.FeatureMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureRecordWriterTest {

    private static final FeatureMap FEATURES = FeatureMap.builder()
            .put("clauses_count", 2L)
            .put("clauses_length_mean", 2.5)
            .put("true_trivial", false)
            .build();

    private static final FeatureRecord RECORD = new FeatureRecord(
            Instant.parse("2024-05-01T10:15:30Z"), FeatureRecord.CURRENT_VERSION, "esempio.cnf",
            "d41d8cd98f00b204e9800998ecf8427e", "da39a3ee5e6b4b0d3255bfef95601890afd80709", FEATURES);

    private static String render(FeatureRecordWriter writer, FeatureRecord record) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.write(record, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("JSON: metadati '@' prima delle metriche, tipi preservati")
    void json() throws IOException {
        JsonNode root = new ObjectMapper().readTree(render(new JsonFeatureRecordWriter(), RECORD));

        List<String> names = new ArrayList<>();
        Iterator<String> fields = root.fieldNames();
        fields.forEachRemaining(names::add);

        assertThat(names).containsExactly("@timestamp", "@version", "@filename", "@md5sum", "@sha1sum",
                "clauses_count", "clauses_length_mean", "true_trivial");
        assertThat(root.get("@timestamp").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(root.get("clauses_count").isIntegralNumber()).isTrue();
        assertThat(root.get("clauses_length_mean").asDouble()).isEqualTo(2.5);
        assertThat(root.get("true_trivial").isBoolean()).isTrue();
    }

    @Test
    @DisplayName("JSON: senza hash (standard input) le chiavi relative sono omesse")
    void jsonWithoutDigests() throws IOException {
        FeatureRecord stdin = FeatureRecord.of("stdin", null, FEATURES);

        JsonNode root = new ObjectMapper().readTree(render(new JsonFeatureRecordWriter(), stdin));

        assertThat(root.has("@md5sum")).isFalse();
        assertThat(root.get("@version").asText()).isEqualTo(FeatureRecord.CURRENT_VERSION);
    }

    @Test
    @DisplayName("XML: elemento file con metadati come attributi e un featuring per metrica")
    void xml() throws Exception {
        String xml = render(new XmlFeatureRecordWriter(), RECORD);
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

        assertThat(document.getDocumentElement().getTagName()).isEqualTo("features");
        Element file = (Element) document.getElementsByTagName("file").item(0);
        assertThat(file.getAttribute("filename")).isEqualTo("esempio.cnf");
        assertThat(file.getAttribute("sha1sum")).isEqualTo("da39a3ee5e6b4b0d3255bfef95601890afd80709");

        NodeList featurings = file.getElementsByTagName("featuring");
        assertThat(featurings.getLength()).isEqualTo(3);
        Element first = (Element) featurings.item(0);
        assertThat(first.getAttribute("name")).isEqualTo("clauses_count");
        assertThat(first.getAttribute("value")).isEqualTo("2");
    }

    @Test
    @DisplayName("Digest MD5 e SHA-1 dei byte letti attraverso lo stream avvolto")
    void digests() throws IOException {
        FileDigests digests = new FileDigests();
        try (var in = digests.wrap(new ByteArrayInputStream("abc".getBytes(StandardCharsets.US_ASCII)))) {
            in.readAllBytes();
        }

        assertThat(digests.md5Hex()).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
        assertThat(digests.sha1Hex()).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
        assertThat(digests.md5Hex()).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }
}
