package tech.mediagateway.auth.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * JSON encoding of records kept in the credential store.
 *
 * <p>Compare-and-set operations compare the encoded form, so callers pass back
 * the exact string they read, never a re-encoding of the decoded record.
 */
@ApplicationScoped
public class StoredRecordCodec {

    @Inject
    ObjectMapper objectMapper;

    public String encode(Object record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + record.getClass().getSimpleName(), e);
        }
    }

    public <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt " + type.getSimpleName() + " record in credential store", e);
        }
    }
}
