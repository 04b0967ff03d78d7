package io.invoicebot.server.automation;

public interface PageElement {

    String selector();

    String text();

    String href();
}
