package io.github.shangor.gateway.rewrite;

/**
 * What goes back to the browser for one proxied answer.
 *
 * @param substituted true when an upstream error page was replaced by an empty body
 */
public record RewrittenContent(String contentType, byte[] body, boolean substituted) {
}
