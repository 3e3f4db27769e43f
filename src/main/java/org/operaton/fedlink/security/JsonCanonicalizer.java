package org.operaton.fedlink.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.operaton.fedlink.exception.SigningException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Produces the JSON Canonicalization Scheme (RFC 8785) form that integrity
 * proofs are computed over. Jackson writes the document, the JCS library
 * sorts members and normalizes numbers and string escapes.
 */
@Component
public class JsonCanonicalizer {

    private final ObjectMapper objectMapper;

    public JsonCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] canonicalize(Object document) {
        try {
            String json = objectMapper.writeValueAsString(document);
            return new org.erdtman.jcs.JsonCanonicalizer(json).getEncodedUTF8();
        } catch (JsonProcessingException e) {
            throw new SigningException("Failed to serialize document for canonicalization", e);
        } catch (IOException e) {
            throw new SigningException("Failed to canonicalize document", e);
        }
    }
}
