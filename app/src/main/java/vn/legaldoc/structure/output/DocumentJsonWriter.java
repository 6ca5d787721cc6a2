package vn.legaldoc.structure.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import vn.legaldoc.structure.model.Attachment;
import vn.legaldoc.structure.model.DocumentMetadata;
import vn.legaldoc.structure.model.DocumentResult;
import vn.legaldoc.structure.model.LegalNode;

/**
 * Serializes parse results into the JSON shape read by the indexing and QA pipelines.
 */
public class DocumentJsonWriter {

    private final ObjectMapper objectMapper;
    private final ObjectWriter objectWriter;

    public DocumentJsonWriter(boolean prettyPrint) {
        this(new ObjectMapper(), prettyPrint);
    }

    DocumentJsonWriter(ObjectMapper objectMapper, boolean prettyPrint) {
        this.objectMapper = objectMapper;
        this.objectWriter = prettyPrint ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
    }

    /**
     * Node object with {@code type}, {@code title}, and, when present, {@code html_id},
     * {@code content} and {@code children}.
     */
    public ObjectNode toTree(LegalNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("type", node.type().wireName());
        json.put("title", node.title());
        node.anchorId().ifPresent(anchor -> json.put("html_id", anchor));
        String content = node.joinedContent();
        if (!content.isEmpty()) {
            json.put("content", content);
        }
        if (!node.children().isEmpty()) {
            ArrayNode children = json.putArray("children");
            node.children().forEach(child -> children.add(toTree(child)));
        }
        return json;
    }

    public ObjectNode toTree(DocumentResult result) {
        ObjectNode json = objectMapper.createObjectNode();
        json.set("structure", toTree(result.root()));
        json.set("metadata", metadataTree(result.metadata()));
        ArrayNode attachments = json.putArray("attachments");
        for (Attachment attachment : result.attachments()) {
            attachments.addObject()
                    .put("title", attachment.title())
                    .put("content", attachment.content());
        }
        return json;
    }

    public String toJson(DocumentResult result) {
        return write(toTree(result));
    }

    public String write(ObjectNode tree) {
        try {
            return objectWriter.writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize parse result", ex);
        }
    }

    public void write(ObjectNode tree, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(tree), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
    }

    private ObjectNode metadataTree(DocumentMetadata metadata) {
        ObjectNode json = objectMapper.createObjectNode();
        ArrayNode recipients = json.putArray("recipients");
        metadata.recipients().forEach(recipients::add);
        ArrayNode signers = json.putArray("signers");
        metadata.signers().forEach(signers::add);
        return json;
    }
}
