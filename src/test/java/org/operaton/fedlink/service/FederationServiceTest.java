package org.operaton.fedlink.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.fedlink.exception.ActivityValidationException;
import org.operaton.fedlink.exception.DeliveryException;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.model.RemoteActor;
import org.operaton.fedlink.model.SignedActivity;
import org.operaton.fedlink.model.vocab.Activity;
import org.operaton.fedlink.model.vocab.Note;
import org.operaton.fedlink.model.vocab.Person;
import org.operaton.fedlink.resolve.ReferenceResolver;
import org.operaton.fedlink.resolve.ResolveOptions;
import org.operaton.fedlink.security.IntegrityProofSigner;
import org.operaton.fedlink.security.JsonCanonicalizer;
import org.operaton.fedlink.security.JsonLdNormalizer;
import org.operaton.fedlink.security.KeyValidator;
import org.operaton.fedlink.security.LinkedDataSigner;
import org.operaton.fedlink.security.TestContexts;
import org.operaton.fedlink.security.TestKeys;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FederationService.
 */
@ExtendWith(MockitoExtension.class)
class FederationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final URI SHARED_INBOX = URI.create("https://remote.example/inbox");
    private static final URI DAVE_INBOX = URI.create("https://other.example/users/dave/inbox");

    @Mock
    private DeliveryTransport deliveryTransport;

    @Mock
    private ReferenceResolver referenceResolver;

    private FederationService federationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ObjectMapper objectMapper = new ObjectMapper();
        SigningPipeline signingPipeline = new SigningPipeline(new KeyValidator(),
            new IntegrityProofSigner(new JsonCanonicalizer(objectMapper)),
            new LinkedDataSigner(new JsonLdNormalizer(objectMapper)), clock);
        federationService = new FederationService(signingPipeline, new InboxTargetResolver(),
            deliveryTransport, referenceResolver, TestContexts.loader(), clock);
    }

    // ==================== Send Tests ====================

    @Test
    void sendActivity_shouldSignOnceAndDeliverToEachInbox() {
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), any(URI.class), any()))
            .thenReturn(CompletableFuture.completedFuture(null));

        CompletableFuture<Void> result = federationService.sendActivity(activity(),
            List.of(TestKeys.rsaSender(), TestKeys.ed25519Sender()), recipients(),
            SendOptions.builder().preferSharedInbox(true).build());

        assertThat(result).isCompleted();
        ArgumentCaptor<SignedActivity> signed = ArgumentCaptor.forClass(SignedActivity.class);
        ArgumentCaptor<URI> inboxes = ArgumentCaptor.forClass(URI.class);
        verify(deliveryTransport, times(2)).deliverAsync(signed.capture(), inboxes.capture(), eq(HttpHeaders.EMPTY));
        assertThat(inboxes.getAllValues()).containsExactly(SHARED_INBOX, DAVE_INBOX);
        assertThat(signed.getAllValues().get(0)).isSameAs(signed.getAllValues().get(1));
        assertThat(signed.getValue().proofCount()).isEqualTo(1);
        assertThat(signed.getValue().hasLinkedDataSignature()).isTrue();
    }

    @Test
    void sendActivity_withExcludedOrigin_shouldSkipLocalInboxes() {
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), any(URI.class), any()))
            .thenReturn(CompletableFuture.completedFuture(null));

        federationService.sendActivity(activity(), List.of(TestKeys.rsaSender()), recipients(),
            SendOptions.builder().excludeBaseUris(List.of(URI.create("https://remote.example/"))).build());

        verify(deliveryTransport, times(1)).deliverAsync(any(SignedActivity.class), eq(DAVE_INBOX), any());
    }

    @Test
    void sendActivity_withFailedDelivery_shouldCompleteExceptionallyAfterOthers() {
        DeliveryException failure = new DeliveryException(URI.create("https://local.example/activities/1"),
            SHARED_INBOX, 500, "Internal Server Error", "boom");
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), eq(SHARED_INBOX), any()))
            .thenReturn(CompletableFuture.failedFuture(failure));
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), eq(DAVE_INBOX), any()))
            .thenReturn(CompletableFuture.completedFuture(null));

        CompletableFuture<Void> result = federationService.sendActivity(activity(),
            List.of(TestKeys.rsaSender()), recipients(), SendOptions.builder().preferSharedInbox(true).build());

        assertThatThrownBy(result::join)
            .isInstanceOf(CompletionException.class)
            .hasCause(failure);
        verify(deliveryTransport).deliverAsync(any(SignedActivity.class), eq(DAVE_INBOX), any());
    }

    @Test
    void sendActivity_withRejectedDelivery_shouldReturnFailedFuture() {
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), any(URI.class), any()))
            .thenThrow(new TaskRejectedException("queue full"));

        CompletableFuture<Void> result = federationService.sendActivity(activity(),
            List.of(TestKeys.rsaSender()), recipients(), null);

        assertThat(result).isCompletedExceptionally();
    }

    @Test
    void sendActivity_withContextLoaderOption_shouldSignWithIt() {
        when(deliveryTransport.deliverAsync(any(SignedActivity.class), any(URI.class), any()))
            .thenReturn(CompletableFuture.completedFuture(null));
        List<URI> requested = new ArrayList<>();
        DocumentLoader recording = url -> {
            requested.add(url);
            return TestContexts.loader().load(url);
        };

        federationService.sendActivity(activity(), List.of(TestKeys.rsaSender()), recipients(),
            SendOptions.builder().contextLoader(recording).build());

        assertThat(requested).contains(URI.create("https://w3id.org/identity/v1"));
    }

    @Test
    void sendActivity_withoutId_shouldFailBeforeAnyDelivery() {
        Activity activity = Activity.builder("Create")
            .reference(Activity.ACTOR, "https://local.example/users/alice")
            .build();

        assertThatThrownBy(() -> federationService.sendActivity(activity, List.of(TestKeys.rsaSender()),
            recipients(), SendOptions.defaults()))
            .isInstanceOf(ActivityValidationException.class);
        verifyNoInteractions(deliveryTransport, referenceResolver);
    }

    // ==================== Lookup Tests ====================

    @Test
    void fetchRemoteActor_shouldBuildSnapshot() {
        URI bob = URI.create("https://remote.example/users/bob");
        Person person = Person.TYPE.parse(Map.of(
            "id", bob.toString(),
            "type", "Person",
            "preferredUsername", "bob",
            "name", "Bob",
            "inbox", bob + "/inbox",
            "endpoints", Map.of("sharedInbox", SHARED_INBOX.toString()))).getValue();
        when(referenceResolver.lookupObject(bob, ResolveOptions.defaults())).thenReturn(Optional.of(person));

        Optional<RemoteActor> actor = federationService.fetchRemoteActor(bob, ResolveOptions.defaults());

        assertThat(actor).isPresent();
        assertThat(actor.get().getHandle()).isEqualTo("bob@remote.example");
        assertThat(actor.get().getDisplayName()).isEqualTo("Bob");
        assertThat(actor.get().getInboxId()).isEqualTo(URI.create(bob + "/inbox"));
        assertThat(actor.get().getSharedInboxId()).isEqualTo(SHARED_INBOX);
        assertThat(actor.get().getLastFetchedAt()).isEqualTo(NOW);
    }

    @Test
    void fetchRemoteActor_withNonActor_shouldReturnEmpty() {
        URI noteId = URI.create("https://remote.example/notes/1");
        when(referenceResolver.lookupObject(noteId, ResolveOptions.defaults()))
            .thenReturn(Optional.of(Note.builder().id(noteId).build()));

        assertThat(federationService.fetchRemoteActor(noteId, ResolveOptions.defaults())).isEmpty();
    }

    private static Activity activity() {
        return Activity.builder("Create")
            .id("https://local.example/activities/1")
            .reference(Activity.ACTOR, "https://local.example/users/alice")
            .reference(Activity.OBJECT, "https://local.example/notes/1")
            .build();
    }

    private static List<RemoteActor> recipients() {
        return List.of(
            RemoteActor.builder()
                .actorUri(URI.create("https://remote.example/users/bob"))
                .inboxUrl(URI.create("https://remote.example/users/bob/inbox"))
                .sharedInboxUrl(SHARED_INBOX)
                .build(),
            RemoteActor.builder()
                .actorUri(URI.create("https://remote.example/users/carol"))
                .inboxUrl(URI.create("https://remote.example/users/carol/inbox"))
                .sharedInboxUrl(SHARED_INBOX)
                .build(),
            RemoteActor.builder()
                .actorUri(URI.create("https://other.example/users/dave"))
                .inboxUrl(DAVE_INBOX)
                .build());
    }
}
