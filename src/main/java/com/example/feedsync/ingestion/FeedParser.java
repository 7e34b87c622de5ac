package com.example.feedsync.ingestion;

import com.example.feedsync.exception.MalformedFeedException;
import com.example.feedsync.model.ItemOrigin;
import com.example.feedsync.model.ItemStub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an Atom push body into item stubs. Has no dependencies and keeps no
 * state; entries that cannot be used are counted and skipped so the rest of the
 * batch still goes through.
 */
@Slf4j
@Component
public class FeedParser {

    static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    static final String YT_NS = "http://www.youtube.com/xml/schemas/2015";
    static final String TOMBSTONE_NS = "http://purl.org/atompub/tombstones/1.0";

    private static final Pattern ITEM_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final Pattern WATCH_PARAM = Pattern.compile("[?&]v=([^&#]+)");
    private static final Pattern CHANNEL_URI = Pattern.compile("/channel/([^/?#]+)");

    /**
     * @param body           verified raw push body
     * @param channelTracked decides whether a channel id belongs to a tracked channel
     * @throws MalformedFeedException if the body is not well-formed XML
     */
    public FeedParseResult parse(byte[] body, Predicate<String> channelTracked) {
        Document document = readDocument(body);

        int deleted = document.getElementsByTagNameNS(TOMBSTONE_NS, "deleted-entry").getLength();
        if (deleted > 0) {
            log.info("Feed carried {} deleted-entry tombstones; ignoring", deleted);
        }

        NodeList entries = document.getElementsByTagNameNS(ATOM_NS, "entry");
        List<ItemStub> stubs = new ArrayList<>(entries.getLength());
        int dropped = 0;
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String itemId = extractItemId(entry);
            if (itemId == null || !ITEM_ID.matcher(itemId).matches()) {
                log.warn("Dropping feed entry with unusable item id '{}'", itemId);
                dropped++;
                continue;
            }
            String channelId = extractChannelId(entry);
            if (channelId == null || !channelTracked.test(channelId)) {
                log.warn("Dropping item {} for untracked channel '{}'", itemId, channelId);
                dropped++;
                continue;
            }
            stubs.add(new ItemStub(itemId, channelId, extractTimestamp(entry), ItemOrigin.PUSH));
        }
        return new FeedParseResult(List.copyOf(stubs), dropped, deleted);
    }

    private Document readDocument(byte[] body) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(body));
        } catch (SAXException | IOException ex) {
            throw new MalformedFeedException("Push body is not a readable feed: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    private String extractItemId(Element entry) {
        String videoId = childText(entry, YT_NS, "videoId");
        if (videoId != null) {
            return videoId;
        }
        NodeList links = entry.getElementsByTagNameNS(ATOM_NS, "link");
        for (int i = 0; i < links.getLength(); i++) {
            String href = ((Element) links.item(i)).getAttribute("href");
            Matcher matcher = WATCH_PARAM.matcher(href);
            if (href.contains("watch") && matcher.find()) {
                return matcher.group(1);
            }
        }
        // <id>yt:video:XXXXXXXXXXX</id>
        String atomId = childText(entry, ATOM_NS, "id");
        if (atomId != null && atomId.contains(":")) {
            return atomId.substring(atomId.lastIndexOf(':') + 1);
        }
        return null;
    }

    private String extractChannelId(Element entry) {
        String channelId = childText(entry, YT_NS, "channelId");
        if (channelId != null) {
            return channelId;
        }
        NodeList uris = entry.getElementsByTagNameNS(ATOM_NS, "uri");
        for (int i = 0; i < uris.getLength(); i++) {
            Matcher matcher = CHANNEL_URI.matcher(uris.item(i).getTextContent());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private Instant extractTimestamp(Element entry) {
        String value = childText(entry, ATOM_NS, "published");
        if (value == null) {
            value = childText(entry, ATOM_NS, "updated");
        }
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ex) {
            log.debug("Unparseable entry timestamp '{}'", value);
            return null;
        }
    }

    private String childText(Element parent, String namespace, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(namespace, localName);
        if (nodes.getLength() == 0) {
            return null;
        }
        String text = nodes.item(0).getTextContent();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
