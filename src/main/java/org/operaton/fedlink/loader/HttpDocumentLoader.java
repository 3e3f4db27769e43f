package org.operaton.fedlink.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.DocumentLoaderException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads ActivityPub documents over HTTP.
 *
 * The RestTemplate does not follow redirects, so they are followed here and every
 * hop goes through the {@link UrlValidator} again.
 */
@Slf4j
public class HttpDocumentLoader implements DocumentLoader {

    static final String ACCEPT = "application/activity+json, "
        + "application/ld+json; profile=\"https://www.w3.org/ns/activitystreams\", "
        + "application/ld+json, application/json;q=0.9";

    private static final int MAX_REDIRECTS = 5;

    private static final Pattern CONTEXT_LINK = Pattern.compile(
        "<([^>]+)>\\s*;[^,]*rel=\"?http://www\\.w3\\.org/ns/json-ld#context\"?"
    );

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final UrlValidator urlValidator;
    private final String userAgent;

    public HttpDocumentLoader(RestTemplate restTemplate, ObjectMapper objectMapper,
                              UrlValidator urlValidator, String userAgent) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.urlValidator = urlValidator;
        this.userAgent = userAgent;
    }

    @Override
    public RemoteDocument load(URI url) {
        log.debug("Fetching document: {}", url);

        URI current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            validate(url, current);
            ResponseEntity<String> response = fetch(url, current);

            if (response.getStatusCode().is3xxRedirection()) {
                URI location = response.getHeaders().getLocation();
                if (location == null) {
                    throw new DocumentLoaderException(url, "Redirect without Location header from " + current);
                }
                log.debug("Following redirect from {} to {}", current, location);
                current = current.resolve(location);
                continue;
            }

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DocumentLoaderException(url,
                    "Unexpected status " + response.getStatusCode().value() + " while fetching " + current);
            }

            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new DocumentLoaderException(url, "Empty document response from: " + current);
            }

            Map<String, Object> document;
            try {
                document = objectMapper.readValue(body, DOCUMENT_TYPE);
            } catch (JsonProcessingException e) {
                throw new DocumentLoaderException(url, "Invalid JSON document from: " + current, e);
            }

            URI contextUrl = extractContextUrl(response.getHeaders().get(HttpHeaders.LINK));
            log.debug("Fetched document {} ({} properties)", current, document.size());
            return new RemoteDocument(current, contextUrl, document);
        }

        throw new DocumentLoaderException(url, "Too many redirects while fetching " + url);
    }

    private void validate(URI url, URI current) {
        try {
            urlValidator.validate(current);
        } catch (IllegalArgumentException e) {
            throw new DocumentLoaderException(url, "Refusing to fetch " + current + ": " + e.getMessage(), e);
        }
    }

    private ResponseEntity<String> fetch(URI url, URI current) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Fetching " + url + " was cancelled");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ACCEPT);
        headers.set(HttpHeaders.USER_AGENT, userAgent);

        try {
            return restTemplate.exchange(current, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (RestClientResponseException e) {
            throw new DocumentLoaderException(url,
                "HTTP " + e.getStatusCode().value() + " while fetching " + current, e);
        } catch (RestClientException e) {
            if (Thread.currentThread().isInterrupted()) {
                CancellationException cancellation = new CancellationException("Fetching " + url + " was cancelled");
                cancellation.initCause(e);
                throw cancellation;
            }
            throw new DocumentLoaderException(url, "Failed to fetch " + current + ": " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the JSON-LD context advertised through {@code Link} headers.
     *
     * @param linkHeaders the Link header values, may be null
     * @return the context URL, or null
     */
    static URI extractContextUrl(List<String> linkHeaders) {
        if (linkHeaders == null) {
            return null;
        }
        for (String header : linkHeaders) {
            Matcher matcher = CONTEXT_LINK.matcher(header);
            if (matcher.find()) {
                return URI.create(matcher.group(1));
            }
        }
        return null;
    }
}
