package com.jobsearchops.pipeline.feed;

import com.jobsearchops.pipeline.model.FeedPosting;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads postings out of RSS 2.0 and Atom 1.0 documents. Entries without a link are dropped since
 * the link is the dedup key.
 */
@Component
public class FeedParser {

    public List<FeedPosting> parse(String xmlPayload) {
        if (xmlPayload == null || xmlPayload.isBlank()) {
            throw new FeedFormatException("Empty feed document");
        }
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        boolean rss = !xml.getElementsByTag("rss").isEmpty() || !xml.getElementsByTag("channel").isEmpty();
        boolean atom = !xml.getElementsByTag("feed").isEmpty();
        if (!rss && !atom) {
            throw new FeedFormatException("Document is neither RSS nor Atom");
        }

        List<FeedPosting> postings = new ArrayList<>();
        for (Element item : xml.getElementsByTag("item")) {
            String link = childText(item, "link");
            if (link.isEmpty()) {
                continue;
            }
            postings.add(new FeedPosting(childText(item, "title"), link, childText(item, "description")));
        }
        for (Element entry : xml.getElementsByTag("entry")) {
            String link = atomLink(entry);
            if (link.isEmpty()) {
                continue;
            }
            String description = childText(entry, "summary");
            if (description.isEmpty()) {
                description = childText(entry, "content");
            }
            postings.add(new FeedPosting(childText(entry, "title"), link, description));
        }
        return postings;
    }

    /**
     * Visible text of an HTML fragment, whitespace collapsed.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }

    private String atomLink(Element entry) {
        String fallback = "";
        for (Element child : entry.children()) {
            if (!child.tagName().equalsIgnoreCase("link")) {
                continue;
            }
            String href = child.attr("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = child.attr("rel").trim().toLowerCase(Locale.ROOT);
            if (rel.isEmpty() || rel.equals("alternate")) {
                return href;
            }
            if (fallback.isEmpty()) {
                fallback = href;
            }
        }
        return fallback;
    }

    private String childText(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                return child.text().trim();
            }
        }
        return "";
    }
}
