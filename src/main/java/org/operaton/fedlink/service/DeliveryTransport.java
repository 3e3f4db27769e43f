package org.operaton.fedlink.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.DeliveryException;
import org.operaton.fedlink.model.SignedActivity;
import org.operaton.fedlink.security.HttpSignatureSigner;
import org.operaton.fedlink.security.SenderKeyPair;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.util.concurrent.CompletableFuture;

/**
 * Posts signed activities to remote inboxes. One attempt per call; retrying is
 * up to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryTransport {

    static final String SEND_OBSERVATION = "activitypub.send_activity";
    static final String ACTIVITY_JSON = "application/activity+json";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final HttpSignatureSigner httpSignatureSigner;
    private final ObservationRegistry observationRegistry;

    /**
     * Send an activity to a remote inbox.
     *
     * @param activity the signed activity
     * @param inbox the remote inbox URL
     * @param extraHeaders additional request headers, may be null
     * @throws DeliveryException if the inbox answers with a non-2xx status
     */
    public void deliver(SignedActivity activity, URI inbox, HttpHeaders extraHeaders) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(activity.document());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize activity " + activity.activityId(), e);
        }

        HttpHeaders headers = new HttpHeaders();
        if (extraHeaders != null) {
            headers.addAll(extraHeaders);
        }
        headers.set(HttpHeaders.CONTENT_TYPE, ACTIVITY_JSON);
        if (!headers.containsKey(HttpHeaders.ACCEPT)) {
            headers.set(HttpHeaders.ACCEPT, ACTIVITY_JSON);
        }

        if (activity.getRsaKey().isPresent()) {
            SenderKeyPair key = activity.getRsaKey().get();
            HttpSignatureSigner.SignatureHeaders signatureHeaders = httpSignatureSigner.signRequest(
                "POST", inbox, body, (PrivateKey) key.privateKey(), key.keyId());

            // The Host header has to be exactly the one that was signed
            headers.set(HttpHeaders.HOST, signatureHeaders.host());
            headers.set(HttpHeaders.DATE, signatureHeaders.date());
            headers.set("Digest", signatureHeaders.digest());
            headers.set("Signature", signatureHeaders.signature());
        } else {
            log.warn("No supported key found to sign the request to {}. The request will be sent without a signature. "
                + "In order to sign the request, at least one RSASSA-PKCS1-v1_5 key must be provided.", inbox);
        }

        Object type = activity.document().get("type");
        Observation observation = Observation.createNotStarted(SEND_OBSERVATION, observationRegistry)
            .highCardinalityKeyValue("activitypub.activity.id", String.valueOf(activity.activityId()))
            .highCardinalityKeyValue("activitypub.inbox.url", inbox.toString())
            .lowCardinalityKeyValue("activitypub.activity.type", String.valueOf(type))
            .start();
        try {
            DeliveryResponse response;
            try {
                response = restTemplate.execute(inbox, HttpMethod.POST, request -> {
                    request.getHeaders().putAll(headers);
                    request.getBody().write(body);
                }, DeliveryTransport::readResponse);
            } catch (RestClientResponseException e) {
                throw failure(activity, inbox, e.getStatusCode().value(), e.getStatusText(), readBody(e));
            }

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw failure(activity, inbox, status, response.statusText(), response.body());
            }
            log.info("Sent activity {} to: {} - Status: {}", activity.activityId(), inbox, status);

        } catch (RuntimeException e) {
            observation.error(e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    /**
     * Runs {@link #deliver} on the delivery executor.
     */
    @Async("deliveryExecutor")
    public CompletableFuture<Void> deliverAsync(SignedActivity activity, URI inbox, HttpHeaders extraHeaders) {
        deliver(activity, inbox, extraHeaders);
        return CompletableFuture.completedFuture(null);
    }

    private DeliveryException failure(SignedActivity activity, URI inbox, int status, String statusText,
                                      String responseBody) {
        log.error("Failed to send activity {} to {} ({} {}):\n{}",
            activity.activityId(), inbox, status, statusText, responseBody);
        return new DeliveryException(activity.activityId(), inbox, status, statusText, responseBody);
    }

    private static DeliveryResponse readResponse(ClientHttpResponse response) throws IOException {
        String body;
        try {
            body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException bodyFailure) {
            log.debug("Could not read response body: {}", bodyFailure.getMessage());
            body = "";
        }
        return new DeliveryResponse(response.getStatusCode().value(), response.getStatusText(), body);
    }

    private static String readBody(RestClientResponseException e) {
        try {
            return e.getResponseBodyAsString();
        } catch (RuntimeException bodyFailure) {
            log.debug("Could not read response body: {}", bodyFailure.getMessage());
            return "";
        }
    }

    private record DeliveryResponse(int statusCode, String statusText, String body) {
    }
}
