package hlsyde.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;
import java.util.Optional;

/**
 * Anything the pipeline hands back to a caller as plain data: graphs, schedule
 * snapshots, architecture reports.
 *
 * Implementations are expected to be records or simple beans that Jackson can
 * serialize as they are.
 */
public interface SynthesisArtifact {

    /**
     * @return The name under which the artifact is reported. Default value is the
     *         class name.
     */
    default String category() {
        return getClass().getSimpleName();
    }

    /**
     * @return the artifact as a JSON string, when possible.
     */
    default Optional<String> asJsonString() {
        try {
            return Optional.of(objectMapper.writeValueAsString(this));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * @return the artifact as a CBOR byte array, when possible.
     */
    default Optional<byte[]> asCBORBinary() {
        try {
            return Optional.of(objectMapperCBOR.writeValueAsBytes(this));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static <T extends SynthesisArtifact> Optional<T> fromJsonString(String str, Class<T> cls) {
        try {
            return Optional.of(objectMapper.readValue(str, cls));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    static <T extends SynthesisArtifact> Optional<T> fromCBOR(byte[] bytes, Class<T> cls) {
        try {
            return Optional.of(objectMapperCBOR.readValue(bytes, cls));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * The shared and static Jackson object mapper used for (de) serialization to
     * (from) JSON.
     */
    static ObjectMapper objectMapper = new ObjectMapper().registerModule(new Jdk8Module());
    /**
     * The shared and static Jackson object mapper used for (de) serialization to
     * (from) CBOR.
     */
    static ObjectMapper objectMapperCBOR = new ObjectMapper(new CBORFactory()).registerModule(new Jdk8Module());
}
