package io.github.shangor.gateway.intercept;

/**
 * Where a request issued by a proxied page gets routed.
 */
public enum TrafficClass {
    /** gateway routes and non-network schemes; left untouched */
    BYPASS,
    /** top-level or frame navigation to a foreign origin; sent to /navigate or /external */
    EXTERNAL_NAVIGATION,
    /** ad or verification traffic; relayed with referer and query rewriting */
    AD,
    /** script, style, image or XHR to a foreign origin; relayed */
    EXTERNAL_RESOURCE,
    /** a target-site path requested relative to the gateway; prefixed with /browse */
    SAME_ORIGIN
}
