package io.github.shangor.gateway.rewrite;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HtmlRewriterTest {
    private static final URI PAGE = URI.create("https://example.com/dir/page.html");
    private static final String HTML = """
            <html><head>
            <link rel="stylesheet" href="/css/site.css">
            <script src="https://cdn.other.com/lib.js"></script>
            <meta http-equiv="refresh" content="5; url=/next">
            <style>.hero{background:url(/img/hero.jpg)}</style>
            </head><body>
            <a id="about" href="about.html">About</a>
            <a id="foreign" href="https://foo.com/x" target="_blank">Foo</a>
            <a id="top" href="#top">Top</a>
            <a id="js" href="javascript:void(0)">JS</a>
            <form id="search" action="/search" method="get"></form>
            <img id="pic" src="a.png" srcset="a.png 1x, https://img.other.com/b.png 2x" data-src="lazy.png">
            <div id="styled" style="background:url(/bg.png)"></div>
            <iframe id="frame" src="https://ads.other.com/frame"></iframe>
            <video id="clip" src="clip.mp4" poster="poster.jpg"></video>
            </body></html>
            """;

    private final UrlRewriter urls = new UrlRewriter(URI.create("https://example.com"));
    private final HtmlRewriter rewriter = new HtmlRewriter(urls, new CssRewriter(urls));

    private Document browse(String html, Injection injection) {
        return Jsoup.parse(rewriter.rewrite(html, PAGE, RewriteMode.BROWSE, injection));
    }

    @Test
    void testBrowseModeRewritesEveryReference() {
        Document doc = browse(HTML, Injection.NONE);

        assertEquals("/browse/css/site.css", doc.selectFirst("link").attr("href"));
        assertEquals("/external/https%3A%2F%2Fcdn.other.com%2Flib.js", doc.selectFirst("script").attr("src"));
        assertEquals("5; url=/browse/next", doc.selectFirst("meta[http-equiv]").attr("content"));
        assertTrue(doc.selectFirst("style").data().contains("url('/browse/img/hero.jpg')"));
        assertEquals("/browse/dir/about.html", doc.getElementById("about").attr("href"));
        assertEquals("/external/https%3A%2F%2Ffoo.com%2Fx", doc.getElementById("foreign").attr("href"));
        assertEquals("_blank", doc.getElementById("foreign").attr("target"));
        assertEquals("/browse/search", doc.getElementById("search").attr("action"));
        assertEquals("/browse/dir/a.png", doc.getElementById("pic").attr("src"));
        assertEquals("/browse/dir/a.png 1x, /external/https%3A%2F%2Fimg.other.com%2Fb.png 2x",
                doc.getElementById("pic").attr("srcset"));
        assertEquals("/browse/dir/lazy.png", doc.getElementById("pic").attr("data-src"));
        assertEquals("background:url('/browse/bg.png')", doc.getElementById("styled").attr("style"));
        assertEquals("/external/https%3A%2F%2Fads.other.com%2Fframe", doc.getElementById("frame").attr("src"));
        assertEquals("/browse/dir/clip.mp4", doc.getElementById("clip").attr("src"));
        assertEquals("/browse/dir/poster.jpg", doc.getElementById("clip").attr("poster"));
    }

    @Test
    void testSkippedReferencesStayAsTheyAre() {
        Document doc = browse(HTML, Injection.NONE);
        assertEquals("#top", doc.getElementById("top").attr("href"));
        assertEquals("javascript:void(0)", doc.getElementById("js").attr("href"));
    }

    @Test
    void testRewritingTwiceChangesNothing() {
        String once = rewriter.rewrite(HTML, PAGE, RewriteMode.BROWSE, Injection.NONE);
        String twice = rewriter.rewrite(once, PAGE, RewriteMode.BROWSE, Injection.NONE);
        assertEquals(once, twice);
    }

    @Test
    void testNavigationMode() {
        Document doc = Jsoup.parse(rewriter.rewrite(HTML, PAGE, RewriteMode.NAVIGATION,
                Injection.body("<script src=\"/gateway/navigate.js\"></script>")));

        assertEquals("/navigate?url=https%3A%2F%2Fexample.com%2Fdir%2Fabout.html", doc.getElementById("about").attr("href"));
        assertEquals("/navigate?url=https%3A%2F%2Ffoo.com%2Fx", doc.getElementById("foreign").attr("href"));
        assertFalse(doc.getElementById("foreign").hasAttr("target"));
        assertEquals("/navigate?url=https%3A%2F%2Fexample.com%2Fsearch", doc.getElementById("search").attr("action"));
        assertEquals("/external/https%3A%2F%2Fexample.com%2Fdir%2Fa.png", doc.getElementById("pic").attr("src"));
        assertEquals("/external/https%3A%2F%2Fexample.com%2Fcss%2Fsite.css", doc.selectFirst("link").attr("href"));

        Element last = doc.body().children().last();
        assertEquals("script", last.tagName());
        assertEquals("/gateway/navigate.js", last.attr("src"));
    }

    @Test
    void testHeadInjectionComesFirst() {
        Document doc = browse("<html><head><title>t</title></head><body></body></html>",
                Injection.head("<script>window.cfg=1;</script><script src=\"/gateway/intercept.js\"></script>"));

        Element first = doc.head().child(0);
        assertEquals("script", first.tagName());
        assertEquals("window.cfg=1;", first.data());
        assertEquals("/gateway/intercept.js", doc.head().child(1).attr("src"));
    }

    @Test
    void testBaseHrefIsHonouredThenRemoved() {
        Document doc = browse("<html><head><base href=\"https://example.com/other/\"></head>"
                + "<body><a id=\"l\" href=\"x.html\">x</a></body></html>", Injection.NONE);

        assertNull(doc.selectFirst("base"));
        assertEquals("/browse/other/x.html", doc.getElementById("l").attr("href"));
    }

    @Test
    void testSrcsetKeepsDescriptors() {
        Optional<String> out = HtmlRewriter.rewriteSrcset("a.png 480w,  b.png 800w", ref -> Optional.of("/r/" + ref));
        assertEquals(Optional.of("/r/a.png 480w, /r/b.png 800w"), out);
        assertTrue(HtmlRewriter.rewriteSrcset("data:x 1x", ref -> Optional.empty()).isEmpty());
        assertTrue(HtmlRewriter.rewriteSrcset("  ", ref -> Optional.of("x")).isEmpty());
    }
}
