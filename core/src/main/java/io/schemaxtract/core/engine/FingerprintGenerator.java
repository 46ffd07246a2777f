package io.schemaxtract.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaxtract.core.model.ExtractionResult;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.ResourceGroup;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural fingerprints of an {@link ExtractionResult}, for change
 * detection.
 *
 * <p>
 * {@link #primary} hashes a canonical projection: each field's id and binding
 * path, and each resource group's id and element count, both lists sorted by
 * id and then by the projected value. The projection is serialized as compact
 * JSON with a fixed property order, so upstream iteration order never changes
 * the digest.
 *
 * <p>
 * {@link #quick} hashes only the form id, the field count and the sorted id
 * lists. It is less complete but ignores binding path and element churn, which
 * helps to narrow down a primary-digest mismatch.
 *
 * <p>
 * Both digests are SHA-256 over UTF-8, rendered as lowercase hex.
 * Thread-safe: stateless.
 */
public final class FingerprintGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(FingerprintGenerator.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String ALGORITHM = "SHA-256";

    // equal ids are ordered by the projected value, never by input order
    private static final Comparator<FieldDescriptor> FIELD_ORDER = Comparator.comparing(FieldDescriptor::id)
            .thenComparing(FieldDescriptor::bindingPath, Comparator.nullsFirst(Comparator.naturalOrder()));
    private static final Comparator<ResourceGroup> GROUP_ORDER =
            Comparator.comparing(ResourceGroup::id).thenComparingInt(ResourceGroup::elementCount);

    /** Computes the primary structural digest. */
    public String primary(ExtractionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        String canonical = canonicalProjection(result);
        String digest = sha256Hex(canonical);
        LOG.debug(
                "fingerprint.primary fields={} resource_groups={} bytes={} digest={}",
                result.fields().size(),
                result.resourceGroups().size(),
                canonical.length(),
                digest);
        return digest;
    }

    /** Computes the quick digest over ids and counts only. */
    public String quick(ExtractionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        ObjectNode quick = JSON.createObjectNode();
        if (result.formHierarchyCollectionId() != null) {
            quick.put("formId", result.formHierarchyCollectionId());
        }
        quick.put("fieldCount", result.fields().size());
        ArrayNode fieldIds = quick.putArray("fieldIds");
        sortedIds(result.fields().stream().map(FieldDescriptor::id).toList()).forEach(fieldIds::add);
        ArrayNode groupIds = quick.putArray("resourceGroupIds");
        sortedIds(result.resourceGroups().stream().map(ResourceGroup::id).toList())
                .forEach(groupIds::add);
        return sha256Hex(write(quick));
    }

    /**
     * Returns the exact text the primary digest is computed over. Exposed for
     * diagnosing digest mismatches between hosts.
     */
    public String canonicalProjection(ExtractionResult result) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode fields = root.putArray("fields");
        result.fields().stream()
                .sorted(FIELD_ORDER)
                .forEach(field -> {
                    ObjectNode node = fields.addObject();
                    node.put("id", field.id());
                    node.put("bindingPath", field.bindingPath());
                });
        ArrayNode groups = root.putArray("resourceGroups");
        result.resourceGroups().stream()
                .sorted(GROUP_ORDER)
                .forEach(group -> {
                    ObjectNode node = groups.addObject();
                    node.put("id", group.id());
                    node.put("count", group.elementCount());
                });
        return write(root);
    }

    private static List<String> sortedIds(List<String> ids) {
        return ids.stream().sorted().toList();
    }

    private static String write(ObjectNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fingerprint projection", e);
        }
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
