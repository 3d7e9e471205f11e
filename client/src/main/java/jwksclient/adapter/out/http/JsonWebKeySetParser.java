package jwksclient.adapter.out.http;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import org.jboss.logging.Logger;

import jwksclient.core.model.JsonWebKey;
import jwksclient.core.model.JsonWebKeySet;
import jwksclient.core.model.KeyType;
import jwksclient.core.port.out.JwksFetchException;
import jwksclient.core.port.out.JwksFetchException.Kind;

/**
 * Reads and writes JSON Web Key Set documents ({@code {"keys": [...]}}).
 *
 * <p>Keys of a type this client does not model (for example {@code oct} or {@code OKP}) are
 * skipped rather than failing the whole document.
 */
public class JsonWebKeySetParser {

    private static final Logger LOG = Logger.getLogger(JsonWebKeySetParser.class);

    private final ObjectMapper objectMapper;

    public JsonWebKeySetParser() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    /**
     * Parse a JWKS document.
     *
     * @throws JwksFetchException of kind {@code PARSE} when the body is not a valid key set document
     */
    public JsonWebKeySet parse(String body) {
        if (body == null || body.isBlank()) {
            throw new JwksFetchException(Kind.PARSE, "Key set document is empty");
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new JwksFetchException(
                    Kind.PARSE, "Key set document is not valid JSON: " + e.getOriginalMessage(), e);
        }

        final var keysNode = root.get("keys");
        if (keysNode == null || !keysNode.isArray()) {
            throw new JwksFetchException(Kind.PARSE, "Key set document has no keys array");
        }

        final var keys = new ArrayList<JsonWebKey>(keysNode.size());
        for (final var keyNode : keysNode) {
            final var kty = keyNode.path("kty").asText("");
            if (!isSupported(kty)) {
                LOG.debugv("Skipping key {0} with unsupported kty \"{1}\"", keyNode.path("kid").asText("?"), kty);
                continue;
            }
            try {
                keys.add(objectMapper.treeToValue(keyNode, JsonWebKey.class));
            } catch (JsonProcessingException e) {
                throw new JwksFetchException(Kind.PARSE, "Invalid " + kty + " key: " + e.getOriginalMessage(), e);
            }
        }
        return new JsonWebKeySet(keys);
    }

    /**
     * Serialize a key set to a JWKS document that {@link #parse(String)} reads back unchanged.
     */
    public String write(JsonWebKeySet keySet) {
        try {
            return objectMapper.writeValueAsString(new Document(keySet.keys()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize key set", e);
        }
    }

    private static boolean isSupported(String kty) {
        for (final var type : KeyType.values()) {
            if (type.name().equals(kty)) {
                return true;
            }
        }
        return false;
    }

    private record Document(@JsonProperty("keys") List<JsonWebKey> keys) {}
}
