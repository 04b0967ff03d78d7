package io.invoicebot.server.persistence;

@FunctionalInterface
public interface SessionStateProvider {

    SessionProgress currentProgress();
}
