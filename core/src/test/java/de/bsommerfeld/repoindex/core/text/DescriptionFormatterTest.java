package de.bsommerfeld.repoindex.core.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionFormatterTest {

    private final DescriptionFormatter formatter = new DescriptionFormatter(
            appId -> new LinkResolver.Link("fdroid.app:" + appId, "Bee"));

    // -- blocks --

    @Test
    void toHtml_shouldReturnEmptyStringForMissingDescription() {
        assertEquals("", formatter.toHtml(null));
        assertEquals("", formatter.toHtml("  \n "));
    }

    @Test
    void toHtml_shouldWrapParagraphs() {
        assertEquals("<p>First line continued</p><p>Second</p>",
                formatter.toHtml("First line\ncontinued\n\nSecond"));
    }

    @Test
    void toHtml_shouldRenderBulletAndNumberedLists() {
        assertEquals("<p>Intro</p><ul><li>one</li><li>two</li></ul>",
                formatter.toHtml("Intro\n* one\n* two"));
        assertEquals("<ol><li>a</li><li>b</li></ol>", formatter.toHtml("# a\n# b"));
    }

    // -- inline --

    @Test
    void toHtml_shouldResolveAppLinks() {
        assertEquals("<p>See <a href=\"fdroid.app:org.b\">Bee</a></p>", formatter.toHtml("See [[org.b]]"));
    }

    @Test
    void toHtml_shouldRenderWebLinksWithAndWithoutText() {
        assertEquals("<p><a href=\"https://example.org\">Site</a></p>",
                formatter.toHtml("[https://example.org Site]"));
        assertEquals("<p><a href=\"https://example.org\">https://example.org</a></p>",
                formatter.toHtml("[https://example.org]"));
    }

    @Test
    void toHtml_shouldRenderBoldAndItalic() {
        assertEquals("<p><b>bold</b> and <i>it</i></p>", formatter.toHtml("'''bold''' and ''it''"));
    }

    @Test
    void toHtml_shouldEscapeMarkup() {
        assertEquals("<p>a &lt; b &amp; c</p>", formatter.toHtml("a < b & c"));
    }

    @Test
    void toHtml_shouldPropagateResolverFailures() {
        DescriptionFormatter strict = new DescriptionFormatter(appId -> {
            throw new IllegalStateException("unknown " + appId);
        });

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> strict.toHtml("See [[org.missing]]"));
        assertEquals("unknown org.missing", e.getMessage());
    }
}
