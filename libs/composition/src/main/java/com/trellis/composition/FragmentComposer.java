package com.trellis.composition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders fragment responses: one primary block plus out-of-band blocks for other parts of the
 * page.
 *
 * <p>Endpoints served through the composer exist only for the fragment client. Both {@link
 * #dispatch(InboundRequest)} and the render methods reject requests without the fragment marker
 * with {@link FragmentProtocolViolationException}, before any handler logic runs; such endpoints
 * never degrade to a full page.
 *
 * <p>Body layout, always in this order:
 *
 * <ol>
 *   <li>the primary block, unwrapped
 *   <li>explicit secondary blocks, in declaration order
 *   <li>{@value #NAV_TARGET}, when an active section is declared
 *   <li>{@value #MODAL_TARGET}, when modals are included
 *   <li>{@value #TOAST_TARGET}, when notifications are folded and the queue is not empty
 * </ol>
 *
 * <p>A block the caller declared explicitly for one of the reserved targets replaces the
 * synthesized one; an explicit {@value #TOAST_TARGET} block still receives the queued
 * notifications. Secondary blocks are rendered with {@code is_oob=true}.
 *
 * <p>The body is assembled in memory and returned only when every block rendered. A render failure
 * propagates and leaves the notification queue untouched.
 */
public class FragmentComposer extends ViewDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FragmentComposer.class);

    public static final String TOAST_TARGET = "toast-container";
    public static final String NAV_TARGET = "nav-active-marker";
    public static final String MODAL_TARGET = "modal-container";

    private final DuplicateTargetPolicy duplicatePolicy;

    public FragmentComposer(TemplateCatalog catalog, SessionStore sessions) {
        this(catalog, sessions, DuplicateTargetPolicy.FAIL_FAST);
    }

    public FragmentComposer(TemplateCatalog catalog, SessionStore sessions, DuplicateTargetPolicy duplicatePolicy) {
        super(catalog, sessions);
        if (duplicatePolicy == null) {
            throw new IllegalArgumentException("duplicatePolicy must not be null");
        }
        this.duplicatePolicy = duplicatePolicy;
    }

    /**
     * Opens the render context for a fragment-only endpoint.
     *
     * @throws FragmentProtocolViolationException if the request lacks the fragment marker
     */
    @Override
    public RenderContext dispatch(InboundRequest request) {
        requireFragmentRequest(request);
        return super.dispatch(request);
    }

    /** Renders a single primary block, still folding notifications. */
    @Override
    public ViewResponse render(InboundRequest request, RenderContext context, TemplateRef template) {
        return render(request, context, FragmentSet.of(template));
    }

    /**
     * Composes the fragment response.
     *
     * @param request the inbound request (must carry the fragment marker)
     * @param context the request's render context
     * @param fragments blocks making up the response
     * @return the assembled response; {@code HX-Push-Url} is set when the fragment set or the
     *     context asks for a history update
     * @throws FragmentProtocolViolationException if the request lacks the fragment marker
     * @throws TemplateRenderException if any block fails to render
     * @throws DuplicateFragmentTargetException if a target repeats under {@link
     *     DuplicateTargetPolicy#FAIL_FAST}
     * @throws CompositionCancelledException if the client went away mid-composition
     */
    public ViewResponse render(InboundRequest request, RenderContext context, FragmentSet fragments) {
        requireFragmentRequest(request);

        Set<String> targets = new LinkedHashSet<>();
        fragments.primary().ifPresent(primary -> targets.add(primary.targetId()));
        List<FragmentDescriptor> blocks = explicitBlocks(fragments.secondaries(), targets);

        List<Notification> pending = request.notifications().peekAll();
        boolean explicitToasts = targets.contains(TOAST_TARGET);
        List<Notification> delivered =
                explicitToasts || (fragments.foldNotifications() && !pending.isEmpty()) ? pending : List.of();

        fragments.activeSection().ifPresent(section ->
                addSynthesized(blocks, targets, NAV_TARGET, TemplateCatalog.ACTIVE_NAV));
        if (fragments.includeModals()) {
            addSynthesized(blocks, targets, MODAL_TARGET, TemplateCatalog.MODALS);
        }
        if (!delivered.isEmpty() && !explicitToasts) {
            addSynthesized(blocks, targets, TOAST_TARGET, TemplateCatalog.TOASTS);
        }

        StringBuilder body = new StringBuilder();
        Optional<FragmentDescriptor> primary = fragments.primary();
        if (primary.isPresent()) {
            checkCancelled(request);
            body.append(catalog.render(primary.get().templateRef(), context.templateModel(Map.of())));
        }

        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put(RenderContext.IS_OOB, true);
        overlay.put(RenderContext.NOTIFICATIONS, delivered);
        fragments.activeSection().ifPresent(section -> overlay.put(RenderContext.ACTIVE_SECTION, section));
        Map<String, Object> oobModel = context.templateModel(overlay);

        List<String> oobTargets = new ArrayList<>(blocks.size());
        for (FragmentDescriptor block : blocks) {
            checkCancelled(request);
            String html = catalog.render(block.templateRef(), oobModel);
            body.append(OobMarkup.mark(block.targetId(), html));
            oobTargets.add(block.targetId());
        }

        request.notifications().acknowledge(delivered.size());

        ViewResponse response = ViewResponse.fragments(body.toString(), oobTargets);
        Optional<String> pushUrl = fragments.pushUrl().or(context::historyUrl);
        if (pushUrl.isPresent()) {
            response = response.withHeader(FragmentHeaders.PUSH_URL, pushUrl.get());
        }
        log.debug("Composed fragment response for {}: primary={}, oob={}",
                request.fullPath(), primary.map(p -> p.templateRef().name()).orElse("-"), oobTargets);
        return response;
    }

    public DuplicateTargetPolicy duplicatePolicy() {
        return duplicatePolicy;
    }

    private List<FragmentDescriptor> explicitBlocks(List<FragmentDescriptor> declared, Set<String> targets) {
        List<FragmentDescriptor> blocks = new ArrayList<>(declared.size());
        for (FragmentDescriptor descriptor : declared) {
            if (targets.add(descriptor.targetId())) {
                blocks.add(descriptor);
                continue;
            }
            if (duplicatePolicy == DuplicateTargetPolicy.FAIL_FAST) {
                throw new DuplicateFragmentTargetException(descriptor.targetId());
            }
            log.error("Fragment target '{}' declared more than once; keeping the first declaration",
                    descriptor.targetId());
        }
        return blocks;
    }

    private static void addSynthesized(
            List<FragmentDescriptor> blocks, Set<String> targets, String targetId, TemplateRef template) {
        if (targets.add(targetId)) {
            blocks.add(FragmentDescriptor.secondary(targetId, template));
        }
    }

    private static void requireFragmentRequest(InboundRequest request) {
        if (!request.fragmentRequest()) {
            throw new FragmentProtocolViolationException(request.fullPath());
        }
    }

    private static void checkCancelled(InboundRequest request) {
        if (request.cancelled()) {
            throw new CompositionCancelledException(request.fullPath());
        }
    }
}
