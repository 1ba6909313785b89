package com.trellis.composition;

import com.trellis.composition.testing.InMemorySessionStore;
import com.trellis.composition.testing.InMemoryTemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FragmentComposer")
class FragmentComposerTest {

    private InMemoryTemplateRenderer renderer;
    private InMemorySessionStore sessions;
    private FragmentComposer composer;
    private TemplateRef dashboard;
    private TemplateRef stats;
    private TemplateRef members;

    @BeforeEach
    void setUp() {
        renderer = InMemoryTemplateRenderer.withBuiltins()
                .template("teams/dashboard")
                .template("teams/stats")
                .template("teams/members")
                .template("teams/header", model -> "<div id=\"team-header\" class=\"x\">" + model.get("team") + "</div>")
                .failing("teams/broken", new IllegalStateException("missing variable"));
        sessions = new InMemorySessionStore();
        TemplateCatalog catalog = TemplateCatalog.builder(renderer)
                .register("teams/dashboard", "teams/stats", "teams/members", "teams/header", "teams/broken")
                .build();
        composer = new FragmentComposer(catalog, sessions);
        dashboard = catalog.ref("teams/dashboard");
        stats = catalog.ref("teams/stats");
        members = catalog.ref("teams/members");
    }

    private static InboundRequest fragmentRequest() {
        return InboundRequest.builder("GET", "/teams/42/panel").sessionId("s-1").fragment(true).build();
    }

    @Nested
    @DisplayName("protocol enforcement")
    class ProtocolEnforcement {

        @Test
        @DisplayName("dispatch rejects requests without the fragment marker")
        void dispatchRejectsFullRequests() {
            var request = InboundRequest.builder("GET", "/teams/42/panel").sessionId("s-1").build();

            assertThatThrownBy(() -> composer.dispatch(request))
                    .isInstanceOf(FragmentProtocolViolationException.class)
                    .hasMessageContaining("/teams/42/panel");
            assertThat(renderer.renderedTemplates()).isEmpty();
        }

        @Test
        @DisplayName("render rejects requests without the fragment marker")
        void renderRejectsFullRequests() {
            var request = InboundRequest.builder("GET", "/teams/42/panel").build();
            var context = new RenderContext(Shell.FULL, false, "/teams/42/panel");

            assertThatThrownBy(() -> composer.render(request, context, FragmentSet.of(dashboard)))
                    .isInstanceOf(FragmentProtocolViolationException.class);
            assertThat(renderer.renderedTemplates()).isEmpty();
        }

        @Test
        @DisplayName("dispatch opens an empty-shell context for fragment requests")
        void dispatchOpensEmptyShell() {
            RenderContext context = composer.dispatch(fragmentRequest());

            assertThat(context.shell()).isEqualTo(Shell.EMPTY);
        }
    }

    @Nested
    @DisplayName("body assembly")
    class BodyAssembly {

        @Test
        @DisplayName("emits primary unwrapped, then secondaries in declaration order")
        void ordersPrimaryThenSecondaries() {
            var request = fragmentRequest();
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .secondary("team-members", members)
                    .build();

            ViewResponse response = composer.render(request, composer.dispatch(request), fragments);

            assertThat(response.body()).isEqualTo(
                    "[teams/dashboard]"
                            + "<div id=\"team-stats\" hx-swap-oob=\"true\">[teams/stats oob]</div>"
                            + "<div id=\"team-members\" hx-swap-oob=\"true\">[teams/members oob]</div>");
            assertThat(response.oobTargets()).containsExactly("team-stats", "team-members");
            assertThat(response.contentType()).isEqualTo(ViewResponse.TEXT_HTML);
        }

        @Test
        @DisplayName("injects the swap attribute when the block already carries the target id")
        void injectsSwapAttributeIntoOwnDiv() {
            var request = fragmentRequest();
            RenderContext context = composer.dispatch(request).put("team", "Acme");
            var fragments = FragmentSet.builder()
                    .secondary("team-header", new TemplateRef("teams/header"))
                    .build();

            ViewResponse response = composer.render(request, context, fragments);

            assertThat(response.body())
                    .isEqualTo("<div id=\"team-header\" hx-swap-oob=\"true\" class=\"x\">Acme</div>");
        }

        @Test
        @DisplayName("allows a response without a primary block")
        void allowsMissingPrimary() {
            var request = fragmentRequest();
            request.notifications().success("Saved");

            ViewResponse response = composer.render(request, composer.dispatch(request), FragmentSet.builder().build());

            assertThat(response.body()).startsWith("<div id=\"toast-container\" hx-swap-oob=\"true\">");
            assertThat(response.oobTargets()).containsExactly(FragmentComposer.TOAST_TARGET);
        }

        @Test
        @DisplayName("composes byte-identical output for identical inputs")
        void isDeterministic() {
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .secondary("team-members", members)
                    .activeSection("teams")
                    .build();

            var first = fragmentRequest();
            String once = composer.render(first, composer.dispatch(first).put("team", "Acme"), fragments).body();
            var second = fragmentRequest();
            String twice = composer.render(second, composer.dispatch(second).put("team", "Acme"), fragments).body();

            assertThat(once).isEqualTo(twice);
        }
    }

    @Nested
    @DisplayName("synthesized blocks")
    class SynthesizedBlocks {

        @Test
        @DisplayName("orders explicit, navigation, modal, then notifications")
        void ordersSynthesizedBlocks() {
            var request = fragmentRequest();
            request.notifications().info("Heads up");
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .activeSection("teams")
                    .includeModals()
                    .build();

            ViewResponse response = composer.render(request, composer.dispatch(request), fragments);

            assertThat(response.oobTargets()).containsExactly(
                    "team-stats", FragmentComposer.NAV_TARGET, FragmentComposer.MODAL_TARGET,
                    FragmentComposer.TOAST_TARGET);
            assertThat(response.body()).contains("<span data-active=\"teams\"></span>");
            assertThat(response.body()).contains("<div id=\"modal-container\" hx-swap-oob=\"true\"></div>");
        }

        @Test
        @DisplayName("drains the notification queue into one toast block")
        void drainsNotifications() {
            var request = fragmentRequest();
            request.notifications().success("x");
            request.notifications().error("y");

            ViewResponse response = composer.render(request, composer.dispatch(request), FragmentSet.of(dashboard));

            assertThat(request.notifications().isEmpty()).isTrue();
            assertThat(response.body())
                    .contains("Notification[level=SUCCESS, text=x]")
                    .contains("Notification[level=ERROR, text=y]");
            assertThat(response.oobTargets()).containsExactly(FragmentComposer.TOAST_TARGET);
        }

        @Test
        @DisplayName("does not repeat drained notifications in a later request")
        void doesNotLeakNotificationsIntoLaterRequests() {
            var first = fragmentRequest();
            first.notifications().success("x");
            first.notifications().error("y");
            composer.render(first, composer.dispatch(first), FragmentSet.of(dashboard));

            var second = fragmentRequest();
            ViewResponse response = composer.render(second, composer.dispatch(second), FragmentSet.of(dashboard));

            assertThat(response.body()).isEqualTo("[teams/dashboard]");
            assertThat(response.oobTargets()).isEmpty();
        }

        @Test
        @DisplayName("adds no toast block when the queue is empty")
        void skipsToastsWhenQueueEmpty() {
            var request = fragmentRequest();

            ViewResponse response = composer.render(request, composer.dispatch(request), FragmentSet.of(dashboard));

            assertThat(response.oobTargets()).isEmpty();
        }

        @Test
        @DisplayName("leaves the queue alone when folding is turned off")
        void respectsSuppressedFolding() {
            var request = fragmentRequest();
            request.notifications().warning("later");

            ViewResponse response = composer.render(request, composer.dispatch(request),
                    FragmentSet.builder().primary(dashboard).withoutNotifications().build());

            assertThat(response.oobTargets()).isEmpty();
            assertThat(request.notifications().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("hands the notifications to an explicitly declared toast block")
        void explicitToastBlockReceivesNotifications() {
            renderer.template("custom/toasts", model -> "custom:" + model.get("notifications"));
            TemplateCatalog catalog = TemplateCatalog.builder(renderer).register("teams/dashboard", "custom/toasts").build();
            var custom = new FragmentComposer(catalog, sessions);
            var request = fragmentRequest();
            request.notifications().success("done");

            ViewResponse response = custom.render(request, custom.dispatch(request), FragmentSet.builder()
                    .primary(dashboard)
                    .secondary(FragmentComposer.TOAST_TARGET, new TemplateRef("custom/toasts"))
                    .build());

            assertThat(response.oobTargets()).containsExactly(FragmentComposer.TOAST_TARGET);
            assertThat(response.body()).contains("custom:[Notification[level=SUCCESS, text=done]]");
            assertThat(request.notifications().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("history instruction")
    class HistoryInstruction {

        @Test
        @DisplayName("attaches exactly one push instruction when a push URL is given")
        void attachesPushUrl() {
            var request = fragmentRequest();

            ViewResponse response = composer.render(request, composer.dispatch(request),
                    FragmentSet.builder().primary(dashboard).pushUrl("/teams/42/").build());

            assertThat(response.headers()).containsExactly(
                    java.util.Map.entry(FragmentHeaders.PUSH_URL, "/teams/42/"));
        }

        @Test
        @DisplayName("attaches no push instruction without a push URL")
        void omitsPushUrl() {
            var request = fragmentRequest();

            ViewResponse response = composer.render(request, composer.dispatch(request), FragmentSet.of(dashboard));

            assertThat(response.headers()).doesNotContainKey(FragmentHeaders.PUSH_URL);
        }

        @Test
        @DisplayName("falls back to the history URL of the render context")
        void usesContextHistoryUrl() {
            var request = fragmentRequest();
            RenderContext context = composer.dispatch(request).pushHistory("/teams/7/");

            ViewResponse response = composer.render(request, context, dashboard);

            assertThat(response.header(FragmentHeaders.PUSH_URL)).contains("/teams/7/");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("fails fast on duplicate secondary targets")
        void failsFastOnDuplicates() {
            var request = fragmentRequest();
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .secondary("team-stats", members)
                    .build();

            assertThatThrownBy(() -> composer.render(request, composer.dispatch(request), fragments))
                    .isInstanceOf(DuplicateFragmentTargetException.class)
                    .hasMessageContaining("team-stats");
            assertThat(renderer.renderedTemplates()).isEmpty();
        }

        @Test
        @DisplayName("keeps the first declaration under the first-wins policy")
        void firstWinsOnDuplicates() {
            var lenient = new FragmentComposer(composer.catalog(), sessions, DuplicateTargetPolicy.FIRST_WINS);
            var request = fragmentRequest();
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .secondary("team-stats", members)
                    .build();

            ViewResponse response = lenient.render(request, lenient.dispatch(request), fragments);

            assertThat(response.oobTargets()).containsExactly("team-stats");
            assertThat(response.body()).contains("[teams/stats oob]").doesNotContain("teams/members");
        }

        @Test
        @DisplayName("propagates render failures and keeps queued notifications")
        void propagatesRenderFailures() {
            var request = fragmentRequest();
            request.notifications().success("kept");
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("broken", new TemplateRef("teams/broken"))
                    .build();

            assertThatThrownBy(() -> composer.render(request, composer.dispatch(request), fragments))
                    .isInstanceOf(TemplateRenderException.class)
                    .hasMessageContaining("teams/broken")
                    .hasRootCauseMessage("missing variable");
            assertThat(request.notifications().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects templates that were never registered")
        void rejectsUnregisteredTemplates() {
            var request = fragmentRequest();

            assertThatThrownBy(() -> composer.render(request, composer.dispatch(request),
                    FragmentSet.of(new TemplateRef("teams/unknown"))))
                    .isInstanceOf(UnknownTemplateException.class)
                    .hasMessageContaining("teams/unknown");
        }

        @Test
        @DisplayName("aborts when the client goes away mid-composition")
        void abortsOnCancellation() {
            AtomicInteger checks = new AtomicInteger();
            var request = InboundRequest.builder("GET", "/teams/42/panel")
                    .fragment(true)
                    .cancellation(() -> checks.incrementAndGet() > 1)
                    .build();
            var fragments = FragmentSet.builder()
                    .primary(dashboard)
                    .secondary("team-stats", stats)
                    .build();

            assertThatThrownBy(() -> composer.render(request, composer.dispatch(request), fragments))
                    .isInstanceOf(CompositionCancelledException.class);
            assertThat(renderer.renderedTemplates()).containsExactly("teams/dashboard");
        }
    }
}
