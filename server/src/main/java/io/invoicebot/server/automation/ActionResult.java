package io.invoicebot.server.automation;

public record ActionResult(boolean success, String message) {

    public static ActionResult ok() {
        return new ActionResult(true, "ok");
    }

    public static ActionResult failed(String message) {
        return new ActionResult(false, message);
    }
}
