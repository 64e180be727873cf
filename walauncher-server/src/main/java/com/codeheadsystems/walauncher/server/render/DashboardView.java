package com.codeheadsystems.walauncher.server.render;

import com.codeheadsystems.walauncher.model.config.WidgetConfigResponse;
import com.codeheadsystems.walauncher.server.tenant.ShopDomain;

/**
 * Everything a dashboard shell needs to render.
 *
 * @param shop      the tenant
 * @param host      the platform's opaque {@code host} launch parameter, may be null
 * @param clientId  the app's public client identifier, used by the frontend bridge
 * @param appUrl    public base URL of this app
 * @param installed whether the shop has an installation
 * @param config    the saved configuration, or the not-configured form
 */
public record DashboardView(ShopDomain shop,
                            String host,
                            String clientId,
                            String appUrl,
                            boolean installed,
                            WidgetConfigResponse config) {
}
