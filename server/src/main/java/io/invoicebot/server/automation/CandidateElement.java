package io.invoicebot.server.automation;

public record CandidateElement(String selector, String text, String href, boolean visible) {

    static CandidateElement of(PageElement element, boolean visible) {
        return new CandidateElement(element.selector(), element.text(), element.href(), visible);
    }
}
