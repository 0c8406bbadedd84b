package io.github.shangor.gateway.intercept;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class AdReferenceRewriterTest {
    private static final String GATEWAY = "http://localhost:8080";
    private static final String TARGET = "https://example.com";

    private final AdReferenceRewriter rewriter = new AdReferenceRewriter();

    @Test
    void testAppliesToVerifyingHosts() {
        assertTrue(rewriter.appliesTo(URI.create("https://googleads.g.doubleclick.net/pagead/ads")));
        assertTrue(rewriter.appliesTo(URI.create("https://ep1.adtrafficquality.google/getconfig")));
        assertFalse(rewriter.appliesTo(URI.create("https://cdn.example.net/app.js")));
    }

    @Test
    void testRewritesEncodedAndPlainOriginsInQuery() {
        String url = "https://googleads.g.doubleclick.net/pagead/ads?client=ca-pub-1"
                + "&url=http%3A%2F%2Flocalhost%3A8080%2Fbrowse%2Fnews%2F1"
                + "&ref=http%3A%2F%2Flocalhost%3A8080%2F"
                + "&loc=http://localhost:8080/browse/a#frag";

        String rewritten = rewriter.rewriteUrl(url, GATEWAY, TARGET);

        assertEquals("https://googleads.g.doubleclick.net/pagead/ads?client=ca-pub-1"
                + "&url=https%3A%2F%2Fexample.com%2Fnews%2F1"
                + "&ref=https%3A%2F%2Fexample.com%2F"
                + "&loc=https://example.com/a#frag", rewritten);
    }

    @Test
    void testUrlWithoutQueryIsUntouched() {
        String url = "https://pagead2.googlesyndication.com/pagead/js/adsbygoogle.js";
        assertSame(url, rewriter.rewriteUrl(url, GATEWAY, TARGET));
    }

    @Test
    void testReferer() {
        assertEquals("https://example.com/news/1", rewriter.rewriteReferer("http://localhost:8080/browse/news/1", GATEWAY, TARGET));
        assertEquals("https://other.org/", rewriter.rewriteReferer("https://other.org/", GATEWAY, TARGET));
        assertNull(rewriter.rewriteReferer(null, GATEWAY, TARGET));
    }
}
