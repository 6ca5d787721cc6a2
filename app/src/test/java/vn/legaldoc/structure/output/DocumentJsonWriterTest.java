package vn.legaldoc.structure.output;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vn.legaldoc.structure.model.Attachment;
import vn.legaldoc.structure.model.DocumentMetadata;
import vn.legaldoc.structure.model.DocumentResult;
import vn.legaldoc.structure.model.LegalNode;
import vn.legaldoc.structure.model.NodeType;

class DocumentJsonWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private static DocumentResult sample() {
        LegalNode point = new LegalNode(NodeType.POINT, "a)", List.of("foo"), List.of(), Optional.empty());
        LegalNode clause = new LegalNode(NodeType.CLAUSE, "1", List.of("xyz"), List.of(point), Optional.empty());
        LegalNode article = new LegalNode(NodeType.ARTICLE, "Điều 1. Phạm vi", List.of("Dòng một", "Dòng hai"),
                List.of(clause), Optional.of("dieu_1"));
        LegalNode root = new LegalNode(NodeType.DOCUMENT, "Luật", List.of(), List.of(article), Optional.empty());
        return new DocumentResult(root,
                new DocumentMetadata(List.of("Nơi nhận:"), List.of("TM. CHÍNH PHỦ")),
                List.of(new Attachment("Phụ lục I", "Danh mục")));
    }

    @Test
    void writesNodeShapeWithOptionalFieldsOmitted() throws Exception {
        JsonNode json = mapper.readTree(new DocumentJsonWriter(false).toJson(sample()));

        JsonNode root = json.get("structure");
        assertThat(root.get("type").asText()).isEqualTo("document");
        assertThat(root.get("title").asText()).isEqualTo("Luật");
        assertThat(root.has("content")).isFalse();
        assertThat(root.has("html_id")).isFalse();

        JsonNode article = root.get("children").get(0);
        assertThat(article.get("type").asText()).isEqualTo("article");
        assertThat(article.get("html_id").asText()).isEqualTo("dieu_1");
        assertThat(article.get("content").asText()).isEqualTo("Dòng một\nDòng hai");

        JsonNode point = article.get("children").get(0).get("children").get(0);
        assertThat(point.get("title").asText()).isEqualTo("a)");
        assertThat(point.get("content").asText()).isEqualTo("foo");
        assertThat(point.has("children")).isFalse();
    }

    @Test
    void keepsFieldOrderAndNonAsciiText() {
        String json = new DocumentJsonWriter(false).toJson(sample());

        assertThat(json).startsWith("{\"structure\":{\"type\":\"document\",\"title\":\"Luật\",\"children\":[");
        assertThat(json).contains("{\"type\":\"article\",\"title\":\"Điều 1. Phạm vi\",\"html_id\":\"dieu_1\",\"content\":");
        assertThat(json).contains("\"metadata\":{\"recipients\":[\"Nơi nhận:\"],\"signers\":[\"TM. CHÍNH PHỦ\"]}");
        assertThat(json).endsWith("\"attachments\":[{\"title\":\"Phụ lục I\",\"content\":\"Danh mục\"}]}");
    }

    @Test
    void emptyResultHasEmptySideChannels() throws Exception {
        JsonNode json = mapper.readTree(new DocumentJsonWriter(false).toJson(DocumentResult.empty("T")));

        assertThat(json.get("structure").has("children")).isFalse();
        assertThat(json.get("metadata").get("recipients").size()).isZero();
        assertThat(json.get("metadata").get("signers").size()).isZero();
        assertThat(json.get("attachments").size()).isZero();
    }

    @Test
    void writesUtf8FileAndCreatesDirectories() throws Exception {
        DocumentJsonWriter writer = new DocumentJsonWriter(true);
        Path target = tempDir.resolve("nested/out.json");

        writer.write(writer.toTree(sample()), target);

        String content = Files.readString(target, StandardCharsets.UTF_8);
        assertThat(content).contains("Điều 1. Phạm vi");
        assertThat(content).contains("\n  \"structure\"");
        assertThat(mapper.readTree(content).get("structure").get("title").asText()).isEqualTo("Luật");
    }
}
