package io.invoicebot.server.automation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scripted page: selectors map to elements, each element answers actions from a queue of outcomes.
 */
public class FakePageDriver implements PageDriver {

    private final Map<String, List<PageElement>> elements = new HashMap<>();
    private final Map<PageElement, Deque<Outcome>> outcomes = new HashMap<>();
    private final Map<PageElement, Boolean> interactable = new HashMap<>();
    private final List<String> actedOn = new ArrayList<>();
    private String url;
    private boolean closed;

    public FakePageDriver(String startUrl) {
        this.url = startUrl;
    }

    public Element element(String selector, String text, String href) {
        Element element = new Element(selector, text, href);
        elements.computeIfAbsent(selector, k -> new ArrayList<>()).add(element);
        interactable.put(element, true);
        outcomes.put(element, new ArrayDeque<>());
        return element;
    }

    public FakePageDriver hidden(PageElement element) {
        interactable.put(element, false);
        return this;
    }

    public FakePageDriver navigatesTo(PageElement element, String destination) {
        outcomes.get(element).add(new Outcome(ActionResult.ok(), destination, null));
        return this;
    }

    public FakePageDriver failsWith(PageElement element, String message) {
        outcomes.get(element).add(new Outcome(ActionResult.failed(message), null, null));
        return this;
    }

    public FakePageDriver throwsOn(PageElement element, RuntimeException error) {
        outcomes.get(element).add(new Outcome(null, null, error));
        return this;
    }

    public List<String> actedOn() {
        return actedOn;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public List<PageElement> findCandidates(String selector) {
        return List.copyOf(elements.getOrDefault(selector, List.of()));
    }

    @Override
    public boolean isInteractable(PageElement element) {
        return interactable.getOrDefault(element, false);
    }

    @Override
    public ActionResult act(PageElement element, RouteAction action) {
        actedOn.add(element.selector());
        Deque<Outcome> queue = outcomes.get(element);
        Outcome outcome = queue.size() > 1 ? queue.poll() : queue.peek();
        if (outcome == null) {
            return ActionResult.failed("no scripted outcome");
        }
        if (outcome.error() != null) {
            throw outcome.error();
        }
        if (outcome.destination() != null) {
            url = outcome.destination();
        }
        return outcome.result();
    }

    @Override
    public String currentUrl() {
        return url;
    }

    @Override
    public Optional<String> captureScreenshot(String name) {
        return Optional.of("evidence/" + name + ".png");
    }

    @Override
    public void close() {
        closed = true;
    }

    public record Element(String selector, String text, String href) implements PageElement {
    }

    private record Outcome(ActionResult result, String destination, RuntimeException error) {
    }
}
