package org.operaton.fedlink.service;

import org.junit.jupiter.api.Test;
import org.operaton.fedlink.model.RemoteActor;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for InboxTargetResolver.
 */
class InboxTargetResolverTest {

    private final InboxTargetResolver resolver = new InboxTargetResolver();

    private static final RemoteActor BOB = actor("https://remote.example/users/bob",
        "https://remote.example/users/bob/inbox", "https://remote.example/inbox");
    private static final RemoteActor CAROL = actor("https://remote.example/users/carol",
        "https://remote.example/users/carol/inbox", "https://remote.example/inbox");
    private static final RemoteActor DAVE = actor("https://other.example/users/dave",
        "https://other.example/users/dave/inbox", null);

    @Test
    void extractInboxes_shouldUsePersonalInboxesByDefault() {
        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(BOB, CAROL, DAVE), false, List.of());

        assertThat(inboxes).containsOnlyKeys(
            "https://remote.example/users/bob/inbox",
            "https://remote.example/users/carol/inbox",
            "https://other.example/users/dave/inbox");
        assertThat(inboxes.keySet()).containsExactly(
            "https://remote.example/users/bob/inbox",
            "https://remote.example/users/carol/inbox",
            "https://other.example/users/dave/inbox");
    }

    @Test
    void extractInboxes_withPreferSharedInbox_shouldGroupRecipients() {
        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(BOB, CAROL, DAVE), true, List.of());

        assertThat(inboxes.keySet()).containsExactly(
            "https://remote.example/inbox",
            "https://other.example/users/dave/inbox");
        assertThat(inboxes.get("https://remote.example/inbox")).containsExactly(BOB.getId(), CAROL.getId());
        assertThat(inboxes.get("https://other.example/users/dave/inbox")).containsExactly(DAVE.getId());
    }

    @Test
    void extractInboxes_withSharedPersonalInbox_shouldDeduplicateRecipients() {
        RemoteActor bobAgain = actor("https://remote.example/users/bob", "https://remote.example/users/bob/inbox", null);

        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(BOB, bobAgain), false, List.of());

        assertThat(inboxes).hasSize(1);
        assertThat(inboxes.get("https://remote.example/users/bob/inbox")).containsExactly(BOB.getId());
    }

    @Test
    void extractInboxes_withExcludedOrigin_shouldSkipEveryInboxOnIt() {
        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(BOB, CAROL, DAVE), false,
            List.of(URI.create("https://remote.example/some/other/path")));

        assertThat(inboxes.keySet()).containsExactly("https://other.example/users/dave/inbox");
    }

    @Test
    void extractInboxes_withExplicitDefaultPort_shouldMatchOrigin() {
        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(DAVE), false,
            List.of(URI.create("https://other.example:443/")));

        assertThat(inboxes).isEmpty();
    }

    @Test
    void extractInboxes_withOtherPortOrScheme_shouldNotExclude() {
        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(DAVE), false,
            List.of(URI.create("https://other.example:8443/"), URI.create("http://other.example/")));

        assertThat(inboxes).containsOnlyKeys("https://other.example/users/dave/inbox");
    }

    @Test
    void extractInboxes_withSameOriginDifferentPaths_shouldNotMerge() {
        RemoteActor first = actor("https://remote.example/users/erin", "https://remote.example/inbox/a", null);
        RemoteActor second = actor("https://remote.example/users/frank", "https://remote.example/inbox/b", null);

        Map<String, Set<URI>> inboxes = resolver.extractInboxes(List.of(first, second), false, List.of());

        assertThat(inboxes).hasSize(2);
    }

    @Test
    void extractInboxes_withoutInbox_shouldSkipRecipient() {
        RemoteActor noInbox = actor("https://remote.example/users/ghost", null, null);

        assertThat(resolver.extractInboxes(List.of(noInbox), true, List.of())).isEmpty();
    }

    @Test
    void origin_shouldNormalizeDefaultPorts() {
        assertThat(InboxTargetResolver.origin(URI.create("https://Remote.Example/inbox")))
            .isEqualTo("https://remote.example:443");
        assertThat(InboxTargetResolver.origin(URI.create("http://remote.example:80/")))
            .isEqualTo("http://remote.example:80");
        assertThat(InboxTargetResolver.origin(URI.create("urn:uuid:1234"))).isNull();
    }

    private static RemoteActor actor(String id, String inbox, String sharedInbox) {
        return RemoteActor.builder()
            .actorUri(URI.create(id))
            .inboxUrl(inbox != null ? URI.create(inbox) : null)
            .sharedInboxUrl(sharedInbox != null ? URI.create(sharedInbox) : null)
            .build();
    }
}
