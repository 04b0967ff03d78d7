package io.invoicebot.server.job;

import io.invoicebot.server.automation.Route;
import io.invoicebot.server.automation.RouteAction;
import java.util.List;

/**
 * Where invoicing links usually live on a merchant portal.
 */
public final class PortalRoutes {

    public static final String HEADER = "header";
    public static final String HERO = "hero";
    public static final String FOOTER = "footer";

    private PortalRoutes() {
    }

    public static List<Route> defaults() {
        return List.of(
            new Route(HEADER, 1, List.of(
                "nav a[href*='factura']",
                "header a[href*='factura']",
                ".navbar a[href*='factura']",
                "nav a[href*='billing']"
            ), false, RouteAction.NAVIGATE),
            new Route(HERO, 2, List.of(
                ".hero a.btn",
                ".banner a[href*='factura']",
                ".carousel a.btn",
                ".hero-section a"
            ), true, RouteAction.NAVIGATE),
            new Route(FOOTER, 3, List.of(
                "footer a[href*='factura']",
                ".footer a[href*='billing']"
            ), false, RouteAction.NAVIGATE)
        );
    }
}
