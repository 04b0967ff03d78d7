package io.invoicebot.server.automation;

public enum RouteAction {
    CLICK,
    NAVIGATE,
    SUBMIT;

    public ActionType actionType() {
        return switch (this) {
            case CLICK -> ActionType.CLICK;
            case NAVIGATE -> ActionType.NAVIGATE;
            case SUBMIT -> ActionType.SUBMIT;
        };
    }
}
