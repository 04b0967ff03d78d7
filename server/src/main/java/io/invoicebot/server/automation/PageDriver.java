package io.invoicebot.server.automation;

import java.util.List;
import java.util.Optional;

/**
 * The only view the router has of the automated page. Implementations wrap a concrete browser driver.
 * Transient failures may be thrown as runtime exceptions; the step executor retries them.
 */
public interface PageDriver extends AutoCloseable {

    List<PageElement> findCandidates(String selector);

    boolean isInteractable(PageElement element);

    ActionResult act(PageElement element, RouteAction action);

    String currentUrl();

    default Optional<String> captureScreenshot(String name) {
        return Optional.empty();
    }

    @Override
    default void close() {
    }
}
