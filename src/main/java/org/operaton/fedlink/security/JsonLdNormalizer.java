package org.operaton.fedlink.security;

import com.apicatalog.jsonld.JsonLd;
import com.apicatalog.jsonld.JsonLdError;
import com.apicatalog.jsonld.JsonLdErrorCode;
import com.apicatalog.jsonld.document.Document;
import com.apicatalog.jsonld.document.JsonDocument;
import com.apicatalog.jsonld.loader.DocumentLoaderOptions;
import com.apicatalog.rdf.RdfDataset;
import com.apicatalog.rdf.RdfNQuad;
import com.apicatalog.rdf.canon.RdfCanonicalizer;
import com.apicatalog.rdf.io.nquad.NQuadsWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.DocumentLoaderException;
import org.operaton.fedlink.exception.SigningException;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.loader.RemoteDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalizes JSON-LD documents to canonical N-Quads with the URDNA2015
 * (RDFC-1.0) algorithm, the form {@code RsaSignature2017} signatures hash.
 *
 * Remote contexts are read through the given {@link DocumentLoader}; this class
 * never opens a connection itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonLdNormalizer {

    private final ObjectMapper objectMapper;

    /**
     * Expands the document, converts it to an RDF dataset and returns the
     * canonical N-Quads, one line per quad in code point order.
     *
     * @throws SigningException if the document is not valid JSON-LD or a context cannot be loaded
     */
    public String normalize(Map<String, Object> document, DocumentLoader contextLoader) {
        RdfDataset dataset;
        try {
            dataset = JsonLd.toRdf(toJsonDocument(document))
                .loader(new ContextLoader(contextLoader))
                .get();
        } catch (JsonLdError e) {
            throw new SigningException("Failed to convert document to RDF: " + e.getMessage(), e);
        }

        List<String> lines = new ArrayList<>();
        for (RdfNQuad quad : RdfCanonicalizer.canonicalize(dataset.toList())) {
            StringWriter line = new StringWriter();
            try {
                new NQuadsWriter(line).write(quad);
            } catch (IOException e) {
                throw new SigningException("Failed to write N-Quad", e);
            }
            lines.add(line.toString());
        }
        Collections.sort(lines);
        log.trace("Normalized {} to {} quads", document.get("id"), lines.size());
        return String.join("", lines);
    }

    private JsonDocument toJsonDocument(Map<String, Object> json) throws JsonLdError {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(json);
        } catch (JsonProcessingException e) {
            throw new SigningException("Failed to serialize document for normalization", e);
        }
        return JsonDocument.of(new ByteArrayInputStream(bytes));
    }

    /**
     * Serves JSON-LD contexts from a {@link DocumentLoader}.
     */
    @RequiredArgsConstructor
    private final class ContextLoader implements com.apicatalog.jsonld.loader.DocumentLoader {

        private final DocumentLoader delegate;

        @Override
        public Document loadDocument(URI url, DocumentLoaderOptions options) throws JsonLdError {
            RemoteDocument remote;
            try {
                remote = delegate.load(url);
            } catch (DocumentLoaderException e) {
                throw new JsonLdError(JsonLdErrorCode.LOADING_REMOTE_CONTEXT_FAILED,
                    "Failed to load context " + url + ": " + e.getMessage(), e);
            }
            log.debug("Loaded JSON-LD context {}", url);

            JsonDocument context = toJsonDocument(remote.document());
            context.setDocumentUrl(remote.documentUrl());
            if (remote.contextUrl() != null) {
                context.setContextUrl(remote.contextUrl());
            }
            return context;
        }
    }
}
