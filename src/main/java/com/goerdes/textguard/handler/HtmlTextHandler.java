package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Extracts the visible main content of an HTML page.
 * <p>
 * Non-content elements are removed first. Article-like containers are preferred; when none
 * exists or they carry almost no text, the whole body is used.
 */
@Component
public class HtmlTextHandler implements TextHandler {

    static final String NON_CONTENT = "script, noscript, style, template, iframe, svg, form, header, footer, nav, aside";

    static final String MAIN_CONTENT = "article, main, [role=main], #content, .post, .entry-content, .article, .post-body, .content";

    private static final int MIN_MAIN_CONTENT_CHARS = 200;

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".html") || filename.endsWith(".htm") || filename.endsWith(".xhtml");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        return extract(Jsoup.parse(PlainTextHandler.decode(content)));
    }

    public ExtractionResult extract(Document doc) {
        doc.select(NON_CONTENT).remove();

        Elements main = doc.select(MAIN_CONTENT);
        String text = join(main);
        if (text.length() < MIN_MAIN_CONTENT_CHARS && doc.body() != null) {
            text = clean(doc.body().text());
        }
        return ExtractionResult.ok(text);
    }

    private static String join(Elements elements) {
        // nested matches (article inside main) would otherwise be counted twice
        return clean(elements.stream()
                .filter(e -> e.parents().stream().noneMatch(elements::contains))
                .map(Element::text)
                .collect(Collectors.joining("\n")));
    }

    private static String clean(String text) {
        return text.replace('\u00A0', ' ').replaceAll("\\s{2,}", " ").trim();
    }
}
