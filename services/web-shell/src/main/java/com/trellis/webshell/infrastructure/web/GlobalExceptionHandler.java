package com.trellis.webshell.infrastructure.web;

import com.trellis.composition.CompositionCancelledException;
import com.trellis.composition.FragmentDescriptor;
import com.trellis.composition.FragmentHeaders;
import com.trellis.composition.FragmentProtocolViolationException;
import com.trellis.composition.RenderContext;
import com.trellis.composition.Shell;
import com.trellis.composition.TemplateCatalog;
import com.trellis.composition.TemplateRef;
import com.trellis.composition.TemplateRenderException;
import com.trellis.composition.ViewResponse;
import com.trellis.observability.FragmentMetrics;
import com.trellis.observability.RequestLogContext;
import com.trellis.observability.RequestLogContextHolder;
import com.trellis.webshell.web.ViewTemplates;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps exceptions from HTML endpoints to error pages.
 *
 * <p>Plain requests get the full error page. Fragment requests get a small error block meant for
 * the element the client targeted ({@code HX-Target}, else {@value
 * FragmentDescriptor#DEFAULT_PRIMARY_TARGET}). If the error template itself fails, a static body is
 * sent. Every error body carries the request id so a report can be matched to the log.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String STATIC_ERROR_BODY =
            "<!DOCTYPE html><html><head><title>Error</title></head><body><h1>%d</h1>"
                    + "<p>Something went wrong.</p></body></html>";

    private final TemplateCatalog catalog;
    private final FragmentMetrics metrics;
    private final TemplateRef errorPage;
    private final TemplateRef fragmentError;

    public GlobalExceptionHandler(TemplateCatalog catalog, FragmentMetrics metrics) {
        this.catalog = catalog;
        this.metrics = metrics;
        this.errorPage = catalog.ref(ViewTemplates.ERROR_PAGE);
        this.fragmentError = catalog.ref(ViewTemplates.FRAGMENT_ERROR);
    }

    @ExceptionHandler(FragmentProtocolViolationException.class)
    public ResponseEntity<String> handleProtocolViolation(
            FragmentProtocolViolationException ex, HttpServletRequest request) {
        log.error("Fragment-only endpoint requested without the fragment marker: {}", ex.path());
        metrics.recordProtocolViolation();
        return errorResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "This page can't be loaded directly.");
    }

    @ExceptionHandler(TemplateRenderException.class)
    public ResponseEntity<String> handleRenderFailure(TemplateRenderException ex, HttpServletRequest request) {
        log.error("Rendering failed for {}", InboundRequests.fullPath(request), ex);
        return errorResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "This content could not be displayed.");
    }

    @ExceptionHandler(CompositionCancelledException.class)
    public ResponseEntity<String> handleCancelled(CompositionCancelledException ex) {
        log.info("Client went away during composition of {}", ex.path());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {}", ex.getMessage());
        return errorResponse(request, HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.debug("{} for {}: {}", status.value(), InboundRequests.fullPath(request), ex.getMessage());
            return errorResponse(request, status, status.is4xxClientError()
                    ? "The page you asked for is not available."
                    : "An unexpected error occurred.");
        }
        log.error("Internal server error", ex);
        return errorResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred.");
    }

    private ResponseEntity<String> errorResponse(HttpServletRequest request, HttpStatusCode status, String message) {
        boolean fragment = InboundRequests.isFragment(request);
        String requestId = RequestLogContextHolder.get().map(RequestLogContext::requestId).orElse("");
        var context = new RenderContext(fragment ? Shell.EMPTY : Shell.FULL, false, InboundRequests.fullPath(request))
                .put("status", status.value())
                .put("message", message)
                .put("requestId", requestId)
                .put("target", primaryTarget(request));
        String body;
        try {
            body = catalog.render(fragment ? fragmentError : errorPage,
                    context.templateModel(Map.of(RenderContext.NOTIFICATIONS, List.of())));
        } catch (RuntimeException e) {
            log.error("Error page failed to render", e);
            body = STATIC_ERROR_BODY.formatted(status.value());
        }
        return ViewSupport.toResponseEntity(ViewResponse.html(body).withStatus(status.value()));
    }

    private static String primaryTarget(HttpServletRequest request) {
        String target = request.getHeader(FragmentHeaders.TARGET);
        return target == null || target.isBlank() ? FragmentDescriptor.DEFAULT_PRIMARY_TARGET : target;
    }
}
