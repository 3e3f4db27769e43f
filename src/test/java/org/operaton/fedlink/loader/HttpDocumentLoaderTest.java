package org.operaton.fedlink.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.operaton.fedlink.exception.DocumentLoaderException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpDocumentLoaderTest {

    private static final String ACTOR_JSON = """
        {
          "@context": "https://www.w3.org/ns/activitystreams",
          "id": "https://remote.example/users/bob",
          "type": "Person",
          "preferredUsername": "bob"
        }
        """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private HttpDocumentLoader loader;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        loader = new HttpDocumentLoader(restTemplate, new ObjectMapper(), new UrlValidator(true), "Fedlink/test");
    }

    @Test
    void load_shouldSendAcceptHeaderAndParseDocument() {
        server.expect(requestTo("https://remote.example/users/bob"))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header(HttpHeaders.ACCEPT, HttpDocumentLoader.ACCEPT))
            .andExpect(header(HttpHeaders.USER_AGENT, "Fedlink/test"))
            .andRespond(withSuccess(ACTOR_JSON, MediaType.parseMediaType("application/activity+json")));

        RemoteDocument document = loader.load(URI.create("https://remote.example/users/bob"));

        server.verify();
        assertThat(document.documentUrl()).isEqualTo(URI.create("https://remote.example/users/bob"));
        assertThat(document.contextUrl()).isNull();
        assertThat(document.document())
            .containsEntry("type", "Person")
            .containsEntry("preferredUsername", "bob");
    }

    @Test
    void load_withRedirect_shouldFollowAndReportFinalUrl() {
        server.expect(requestTo("https://remote.example/@bob"))
            .andRespond(withStatus(HttpStatus.MOVED_PERMANENTLY)
                .location(URI.create("https://remote.example/users/bob")));
        server.expect(requestTo("https://remote.example/users/bob"))
            .andRespond(withSuccess(ACTOR_JSON, MediaType.APPLICATION_JSON));

        RemoteDocument document = loader.load(URI.create("https://remote.example/@bob"));

        server.verify();
        assertThat(document.documentUrl()).isEqualTo(URI.create("https://remote.example/users/bob"));
    }

    @Test
    void load_withRedirectToPrivateAddress_shouldRefuse() {
        HttpDocumentLoader strictLoader = new HttpDocumentLoader(restTemplate, new ObjectMapper(),
            new UrlValidator(false), "Fedlink/test");
        server.expect(requestTo("https://93.184.216.34/users/bob"))
            .andRespond(withStatus(HttpStatus.FOUND).location(URI.create("http://127.0.0.1/admin")));

        assertThatThrownBy(() -> strictLoader.load(URI.create("https://93.184.216.34/users/bob")))
            .isInstanceOf(DocumentLoaderException.class)
            .hasMessageContaining("Loopback addresses are not allowed");
    }

    @Test
    void load_withNotFound_shouldThrowDocumentLoaderException() {
        URI url = URI.create("https://remote.example/notes/404");
        server.expect(requestTo(url)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> loader.load(url))
            .isInstanceOf(DocumentLoaderException.class)
            .hasMessageContaining("HTTP 404")
            .satisfies(e -> assertThat(((DocumentLoaderException) e).getUrl()).isEqualTo(url));
    }

    @Test
    void load_withInvalidJson_shouldThrowDocumentLoaderException() {
        server.expect(requestTo("https://remote.example/broken"))
            .andRespond(withSuccess("<html>not json</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> loader.load(URI.create("https://remote.example/broken")))
            .isInstanceOf(DocumentLoaderException.class)
            .hasMessageContaining("Invalid JSON document");
    }

    @Test
    void load_withContextLinkHeader_shouldExposeContextUrl() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LINK,
            "<https://remote.example/context.jsonld>; rel=\"http://www.w3.org/ns/json-ld#context\"; type=\"application/ld+json\"");
        server.expect(requestTo("https://remote.example/users/bob"))
            .andRespond(withSuccess(ACTOR_JSON, MediaType.APPLICATION_JSON).headers(headers));

        RemoteDocument document = loader.load(URI.create("https://remote.example/users/bob"));

        assertThat(document.contextUrl()).isEqualTo(URI.create("https://remote.example/context.jsonld"));
    }

    @Test
    void extractContextUrl_withUnrelatedLinks_shouldReturnNull() {
        assertThat(HttpDocumentLoader.extractContextUrl(null)).isNull();
        assertThat(HttpDocumentLoader.extractContextUrl(
            List.of("<https://remote.example/users/bob.atom>; rel=\"alternate\""))).isNull();
    }

    @Test
    void load_withInterruptedThread_shouldThrowCancellation() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> loader.load(URI.create("https://remote.example/users/bob")))
                .isInstanceOf(java.util.concurrent.CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
