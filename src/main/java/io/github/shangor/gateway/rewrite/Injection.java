package io.github.shangor.gateway.rewrite;

/**
 * Markup added to a rewritten document: {@code head} is prepended to the
 * head element, {@code body} appended to the body element.
 */
public record Injection(String head, String body) {
    public static final Injection NONE = new Injection(null, null);

    public static Injection head(String markup) {
        return new Injection(markup, null);
    }

    public static Injection body(String markup) {
        return new Injection(null, markup);
    }
}
