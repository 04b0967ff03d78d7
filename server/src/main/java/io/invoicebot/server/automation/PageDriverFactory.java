package io.invoicebot.server.automation;

public interface PageDriverFactory {

    PageDriver open(String url);
}
