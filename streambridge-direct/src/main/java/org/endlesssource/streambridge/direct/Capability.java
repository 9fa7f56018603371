package org.endlesssource.streambridge.direct;

import java.util.List;

/**
 * Operations a directly bound extension object may offer, with the method
 * names probed for each, in order.
 */
enum Capability {
    HOME(false, "getHomeRails", "homeRails", "buildRoot", "BuildRoot"),
    RAIL(true, "getRailItems", "getRail", "railItems", "browse", "Browse"),
    SEARCH(false, "search", "Search", "searchItems"),
    PLAYABLE(true, "getPlayable", "getStream", "GetStream", "playable"),
    REGION(false, "getRegion", "region", "getMarketplace"),
    LOGIN(false, "isLoggedIn", "loggedIn", "isLogin"),
    DRM(false, "isDrmReady", "drmReady");

    private final boolean required;
    private final List<String> methodNames;

    Capability(boolean required, String... methodNames) {
        this.required = required;
        this.methodNames = List.of(methodNames);
    }

    boolean required() {
        return required;
    }

    List<String> methodNames() {
        return methodNames;
    }
}
