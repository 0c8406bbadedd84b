package io.github.shangor.gateway.rewrite;

public enum RewriteMode {
    /**
     * A page of the target site: same-host references go to {@code /browse},
     * the rest to {@code /external/}.
     */
    BROWSE,
    /**
     * A page reached through {@code /navigate} or {@code /external/}: links and
     * forms go to {@code /navigate}, everything else to {@code /external/}.
     */
    NAVIGATION
}
