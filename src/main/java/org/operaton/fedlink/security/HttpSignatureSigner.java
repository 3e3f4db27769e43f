package org.operaton.fedlink.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fedlink.exception.SigningException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signs and validates HTTP Signatures for ActivityPub federation.
 *
 * Outbound requests always cover {@code (request-target) host date digest} with
 * rsa-sha256, which is what the widely deployed servers expect.
 *
 * Reference: https://datatracker.ietf.org/doc/html/draft-cavage-http-signatures
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpSignatureSigner {

    static final String SIGNED_HEADERS = "(request-target) host date digest";

    private static final Pattern PARAMETER_PATTERN = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    private static final DateTimeFormatter HTTP_DATE =
        DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US);

    private final Clock clock;

    /**
     * Container for HTTP signature headers.
     */
    public record SignatureHeaders(String host, String date, String digest, String signature) {
    }

    /**
     * Signs an outbound HTTP request.
     *
     * @param method the HTTP method (e.g., "POST")
     * @param target the target URL
     * @param body the exact request body bytes
     * @param privateKey the sender's RSA private key
     * @param keyId the public key ID
     * @return the headers to add to the request
     */
    public SignatureHeaders signRequest(String method, URI target, byte[] body, PrivateKey privateKey, URI keyId) {
        String host = target.getPort() == -1 ? target.getHost() : target.getHost() + ":" + target.getPort();
        String path = target.getRawPath() == null || target.getRawPath().isEmpty() ? "/" : target.getRawPath();
        if (target.getRawQuery() != null) {
            path += "?" + target.getRawQuery();
        }

        String requestTarget = method.toLowerCase(Locale.ROOT) + " " + path;
        String digestValue = computeDigest(body);
        String date = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC).format(HTTP_DATE);

        String signingString = String.format(
            "(request-target): %s\nhost: %s\ndate: %s\ndigest: %s",
            requestTarget, host, date, digestValue
        );
        log.debug("HTTP signing string for {}:\n{}", target, signingString);

        String signatureBase64 = sign(signingString, privateKey);

        String signatureHeader = String.format(
            "keyId=\"%s\",algorithm=\"rsa-sha256\",headers=\"%s\",signature=\"%s\"",
            keyId, SIGNED_HEADERS, signatureBase64
        );

        return new SignatureHeaders(host, date, digestValue, signatureHeader);
    }

    /**
     * Validates an HTTP signature.
     *
     * @param signatureHeader the Signature header value
     * @param headers the request headers with lower-case names, plus {@code (request-target)}
     * @param publicKey the signer's public key
     * @return true if the signature is valid
     */
    public boolean validate(String signatureHeader, Map<String, String> headers, PublicKey publicKey) {
        Map<String, String> parameters = parseSignatureHeader(signatureHeader);
        String signatureBase64 = parameters.get("signature");
        if (signatureBase64 == null) {
            log.warn("Invalid signature header format");
            return false;
        }

        String algorithm = parameters.getOrDefault("algorithm", "rsa-sha256");
        if (!"rsa-sha256".equalsIgnoreCase(algorithm) && !"hs2019".equalsIgnoreCase(algorithm)) {
            log.warn("Unsupported signature algorithm: {}", algorithm);
            return false;
        }

        String signingString = buildSigningString(parameters.getOrDefault("headers", "date"), headers);

        byte[] signature;
        try {
            signature = Base64.getDecoder().decode(signatureBase64);
        } catch (IllegalArgumentException e) {
            log.warn("Signature is not valid Base64");
            return false;
        }

        try {
            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initVerify(publicKey);
            sig.update(signingString.getBytes(StandardCharsets.UTF_8));
            return sig.verify(signature);
        } catch (GeneralSecurityException e) {
            log.warn("Error validating HTTP signature: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @return the value of a {@code Digest} header for the body
     */
    public static String computeDigest(byte[] body) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(body);
            return "SHA-256=" + Base64.getEncoder().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new SigningException("SHA-256 is not available", e);
        }
    }

    static Map<String, String> parseSignatureHeader(String signatureHeader) {
        Map<String, String> parameters = new HashMap<>();
        if (signatureHeader == null) {
            return parameters;
        }
        Matcher matcher = PARAMETER_PATTERN.matcher(signatureHeader);
        while (matcher.find()) {
            parameters.put(matcher.group(1), matcher.group(2));
        }
        return parameters;
    }

    private String buildSigningString(String headersString, Map<String, String> headers) {
        String[] headerNames = headersString.trim().split("\\s+");
        StringBuilder signingString = new StringBuilder();

        for (int i = 0; i < headerNames.length; i++) {
            String headerName = headerNames[i].toLowerCase(Locale.ROOT);
            String headerValue = headers.get(headerName);

            if (headerValue == null) {
                log.warn("Header {} specified in signature but not found in request", headerName);
                headerValue = "";
            }

            signingString.append(headerName).append(": ").append(headerValue);
            if (i < headerNames.length - 1) {
                signingString.append("\n");
            }
        }

        return signingString.toString();
    }

    private String sign(String signingString, PrivateKey privateKey) {
        try {
            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initSign(privateKey);
            sig.update(signingString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(sig.sign());
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to sign request", e);
        }
    }
}
