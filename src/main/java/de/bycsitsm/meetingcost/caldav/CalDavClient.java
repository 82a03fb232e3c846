package de.bycsitsm.meetingcost.caldav;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Low-level CalDAV protocol client that communicates with CalDAV servers
 * using Java's built-in {@link HttpClient}.
 * <p>
 * Supports the requests needed to keep members' calendars annotated:
 * <ul>
 *   <li>{@code principal-property-search} REPORT (RFC 3744) to enumerate principals
 *       together with their calendar user addresses,</li>
 *   <li>{@code sync-collection} REPORT (RFC 6578) for incremental change listing,
 *       including truncated result sets,</li>
 *   <li>{@code calendar-query} REPORT with a time range (RFC 4791) for a full scan,</li>
 *   <li>GET and conditional PUT of single calendar object resources.</li>
 * </ul>
 */
@Component
class CalDavClient {

    private static final Logger log = LoggerFactory.getLogger(CalDavClient.class);

    private static final String DAV_NS = "DAV:";
    private static final String CALDAV_NS = "urn:ietf:params:xml:ns:caldav";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private static final DateTimeFormatter ICAL_UTC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
            .withZone(ZoneOffset.UTC);

    private final HttpClient httpClient;
    private final String authorization;

    CalDavClient(CalDavProperties properties) {
        var clientBuilder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (properties.trustAllCertificates()) {
            log.warn("CalDAV client is configured to accept all SSL certificates including self-signed. "
                    + "Set caldav.trust-all-certificates=false to enforce certificate validation.");
            clientBuilder.sslContext(createTrustAllSslContext());
        }
        this.httpClient = clientBuilder.build();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(
                (properties.username() + ":" + properties.password()).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * XML body for a REPORT request that discovers all principals on the server.
     * Uses an empty match element to match all display names (wildcard).
     */
    private static final String PRINCIPAL_SEARCH_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:principal-property-search xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav" test="anyof">
              <d:property-search>
                <d:prop>
                  <d:displayname/>
                </d:prop>
                <d:match/>
              </d:property-search>
              <d:prop>
                <d:displayname/>
                <d:resourcetype/>
                <c:calendar-user-address-set/>
              </d:prop>
            </d:principal-property-search>
            """;

    private static final String SYNC_COLLECTION_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:sync-collection xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:sync-token>%s</d:sync-token>
              <d:sync-level>1</d:sync-level>
              <d:limit><d:nresults>%d</d:nresults></d:limit>
              <d:prop>
                <d:getetag/>
                <c:calendar-data/>
              </d:prop>
            </d:sync-collection>
            """;

    private static final String CALENDAR_QUERY_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <c:calendar-query xmlns:d="DAV:" xmlns:c="urn:ietf:params:xml:ns:caldav">
              <d:prop>
                <d:getetag/>
                <c:calendar-data/>
              </d:prop>
              <c:filter>
                <c:comp-filter name="VCALENDAR">
                  <c:comp-filter name="VEVENT">
                    <c:time-range start="%s" end="%s"/>
                  </c:comp-filter>
                </c:comp-filter>
              </c:filter>
            </c:calendar-query>
            """;

    private static final String PROPFIND_SYNC_TOKEN_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <d:propfind xmlns:d="DAV:">
              <d:prop>
                <d:sync-token/>
              </d:prop>
            </d:propfind>
            """;

    /**
     * Represents a principal (user) discovered on the server.
     *
     * @param displayName the display name of the principal
     * @param href        the href/path of the principal's collection
     * @param address     the principal's mail address from its calendar user address set, if any
     */
    record Principal(String displayName, String href, @Nullable String address) {
    }

    /**
     * A calendar object resource, or the tombstone of a removed one.
     *
     * @param href         the path of the resource
     * @param etag         the entity tag of the resource, if reported
     * @param calendarData the iCalendar text, if reported
     * @param deleted      whether the resource no longer exists
     */
    record Resource(String href, @Nullable String etag, @Nullable String calendarData, boolean deleted) {
    }

    /**
     * Parsed multistatus response of a report.
     *
     * @param resources the reported resources
     * @param syncToken the sync token of the collection, for sync reports
     * @param truncated whether the server truncated the result set and more changes are pending
     */
    record Multistatus(List<Resource> resources, @Nullable String syncToken, boolean truncated) {
    }

    /**
     * Discovers all principals on the CalDAV server using the
     * {@code principal-property-search} REPORT method.
     *
     * @param url the CalDAV server root
     * @return a list of all discovered principals
     * @throws CalDavException if the request fails or the response cannot be parsed
     */
    List<Principal> discoverPrincipals(String url) {
        var normalizedUrl = normalizeUrl(url);
        log.debug("Sending REPORT principal-property-search to {}", normalizedUrl);
        var response = send(report(normalizedUrl, "0", PRINCIPAL_SEARCH_XML));
        return parsePrincipalSearchResponse(expectMultistatus(response, "search principals"));
    }

    /**
     * Lists the changes of a calendar collection since the given sync token.
     *
     * @param calendarUrl the calendar collection
     * @param syncToken   the token of the previous sync, or {@code null} for an initial sync
     * @param limit       the maximum number of results the server should return
     * @throws CalDavException if the request fails; {@link CalDavException#isInvalidSyncToken()}
     *                         tells whether the token was rejected
     */
    Multistatus syncCollection(String calendarUrl, @Nullable String syncToken, int limit) {
        var body = SYNC_COLLECTION_XML.formatted(syncToken == null ? "" : escapeXml(syncToken), limit);
        log.debug("Sending REPORT sync-collection to {}", calendarUrl);
        var response = send(report(calendarUrl, "1", body));
        return parseMultistatusResponse(expectMultistatus(response, "list changes"));
    }

    /**
     * Returns all events of a calendar collection that overlap the given time range.
     */
    Multistatus calendarQuery(String calendarUrl, Instant start, Instant end) {
        var body = CALENDAR_QUERY_XML.formatted(ICAL_UTC.format(start), ICAL_UTC.format(end));
        log.debug("Sending REPORT calendar-query to {} for {} - {}", calendarUrl, start, end);
        var response = send(report(calendarUrl, "1", body));
        return parseMultistatusResponse(expectMultistatus(response, "query events"));
    }

    /**
     * Returns the current sync token of a calendar collection.
     */
    @Nullable String fetchSyncToken(String calendarUrl) {
        var request = requestBuilder(calendarUrl)
                .method("PROPFIND", HttpRequest.BodyPublishers.ofString(PROPFIND_SYNC_TOKEN_XML))
                .header("Content-Type", "application/xml; charset=utf-8")
                .header("Depth", "0")
                .build();
        log.debug("Sending PROPFIND sync-token to {}", calendarUrl);
        var xml = expectMultistatus(send(request), "read sync token");
        try {
            var document = parseXml(xml);
            var tokens = document.getElementsByTagNameNS(DAV_NS, "sync-token");
            if (tokens.getLength() == 0) {
                return null;
            }
            var text = tokens.item(0).getTextContent();
            return text == null || text.isBlank() ? null : text.strip();
        } catch (Exception e) {
            throw new CalDavException("Failed to parse sync token response: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a single calendar object resource.
     */
    Resource get(String resourceUrl) {
        var request = requestBuilder(resourceUrl).GET().build();
        log.debug("Sending GET to {}", resourceUrl);
        var response = send(request);
        return switch (response.statusCode()) {
            case 200 -> new Resource(URI.create(resourceUrl).getPath(),
                    response.headers().firstValue("ETag").orElse(null), response.body(), false);
            case 404, 410 -> new Resource(URI.create(resourceUrl).getPath(), null, null, true);
            default -> throw failure(response, "read event");
        };
    }

    /**
     * Replaces a calendar object resource if it still has the given entity tag.
     *
     * @throws CalDavException with status 412 if the resource was modified in the meantime
     */
    void put(String resourceUrl, String calendarData, @Nullable String etag) {
        var builder = requestBuilder(resourceUrl)
                .PUT(HttpRequest.BodyPublishers.ofString(calendarData, StandardCharsets.UTF_8))
                .header("Content-Type", "text/calendar; charset=utf-8");
        if (etag != null) {
            builder.header("If-Match", etag);
        }
        log.debug("Sending PUT to {} (If-Match {})", resourceUrl, etag);
        var response = send(builder.build());
        switch (response.statusCode()) {
            case 200, 201, 204 -> {
            }
            case 412 -> throw new CalDavException("Event was modified concurrently.", 412, null);
            default -> throw failure(response, "write event");
        }
    }

    /**
     * Parses a principal-property-search response into a list of principals.
     */
    List<Principal> parsePrincipalSearchResponse(String xml) {
        var principals = new ArrayList<Principal>();
        try {
            var document = parseXml(xml);
            var responses = document.getElementsByTagNameNS(DAV_NS, "response");
            for (int i = 0; i < responses.getLength(); i++) {
                var response = (Element) responses.item(i);
                var href = getTextContent(response, DAV_NS, "href");
                if (href == null) {
                    continue;
                }

                if (!isSuccessResponse(response)) {
                    continue;
                }

                // Only include actual principals (have <principal/> in resourcetype)
                if (!isPrincipalResource(response)) {
                    continue;
                }

                var displayName = getPropertyText(response, DAV_NS, "displayname");
                if (displayName == null || displayName.isBlank()) {
                    displayName = href;
                }

                principals.add(new Principal(displayName, href, findMailAddress(response)));
            }
        } catch (Exception e) {
            throw new CalDavException("Failed to parse principal search response: " + e.getMessage(), e);
        }
        return principals;
    }

    /**
     * Parses the multistatus response of a {@code sync-collection} or {@code calendar-query} report.
     * <p>
     * Members with a {@code 404} status are tombstones of removed resources. A {@code 507}
     * status on the collection itself signals a truncated result set.
     */
    Multistatus parseMultistatusResponse(String xml) {
        var resources = new ArrayList<Resource>();
        var truncated = false;
        @Nullable String syncToken = null;
        try {
            var root = parseXml(xml).getDocumentElement();
            var tokenElement = directChild(root, DAV_NS, "sync-token");
            if (tokenElement != null && tokenElement.getTextContent() != null
                    && !tokenElement.getTextContent().isBlank()) {
                syncToken = tokenElement.getTextContent().strip();
            }

            var responses = root.getElementsByTagNameNS(DAV_NS, "response");
            for (int i = 0; i < responses.getLength(); i++) {
                var response = (Element) responses.item(i);
                var href = getTextContent(response, DAV_NS, "href");
                if (href == null) {
                    continue;
                }
                href = href.strip();

                var status = directChild(response, DAV_NS, "status");
                if (status != null) {
                    var statusText = status.getTextContent();
                    if (statusText.contains("507")) {
                        truncated = true;
                    } else if (statusText.contains("404")) {
                        resources.add(new Resource(href, null, null, true));
                    }
                    continue;
                }

                if (!isSuccessResponse(response)) {
                    continue;
                }
                resources.add(new Resource(href,
                        getPropertyText(response, DAV_NS, "getetag"),
                        getRawPropertyText(response, CALDAV_NS, "calendar-data"),
                        false));
            }
        } catch (CalDavException e) {
            throw e;
        } catch (Exception e) {
            throw new CalDavException("Failed to parse server response: " + e.getMessage(), e);
        }
        return new Multistatus(resources, syncToken, truncated);
    }

    private @Nullable String findMailAddress(Element response) {
        var sets = response.getElementsByTagNameNS(CALDAV_NS, "calendar-user-address-set");
        for (int i = 0; i < sets.getLength(); i++) {
            var hrefs = ((Element) sets.item(i)).getElementsByTagNameNS(DAV_NS, "href");
            for (int j = 0; j < hrefs.getLength(); j++) {
                var value = hrefs.item(j).getTextContent();
                if (value != null && value.strip().toLowerCase(Locale.ROOT).startsWith("mailto:")) {
                    return value.strip().substring("mailto:".length());
                }
            }
        }
        return null;
    }

    private boolean isPrincipalResource(Element response) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var props = propstat.getElementsByTagNameNS(DAV_NS, "prop");
            for (int j = 0; j < props.getLength(); j++) {
                var prop = (Element) props.item(j);
                var resourceTypes = prop.getElementsByTagNameNS(DAV_NS, "resourcetype");
                for (int k = 0; k < resourceTypes.getLength(); k++) {
                    var resourceType = (Element) resourceTypes.item(k);
                    var principalElements = resourceType.getElementsByTagNameNS(DAV_NS, "principal");
                    if (principalElements.getLength() > 0) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean isSuccessResponse(Element response) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var statusText = getTextContent(propstat, DAV_NS, "status");
            if (statusText != null && statusText.contains("200")) {
                return true;
            }
        }
        return false;
    }

    private @Nullable String getPropertyText(Element response, String namespace, String localName) {
        var text = getRawPropertyText(response, namespace, localName);
        return (text != null && !text.isBlank()) ? text.strip() : null;
    }

    private @Nullable String getRawPropertyText(Element response, String namespace, String localName) {
        var propstats = response.getElementsByTagNameNS(DAV_NS, "propstat");
        for (int i = 0; i < propstats.getLength(); i++) {
            var propstat = (Element) propstats.item(i);
            var statusText = getTextContent(propstat, DAV_NS, "status");
            if (statusText != null && !statusText.contains("200")) {
                continue;
            }
            var props = propstat.getElementsByTagNameNS(DAV_NS, "prop");
            for (int j = 0; j < props.getLength(); j++) {
                var prop = (Element) props.item(j);
                var elements = prop.getElementsByTagNameNS(namespace, localName);
                if (elements.getLength() > 0) {
                    var text = elements.item(0).getTextContent();
                    return (text != null && !text.isBlank()) ? text : null;
                }
            }
        }
        return null;
    }

    private @Nullable String getTextContent(Element parent, String namespace, String localName) {
        var elements = parent.getElementsByTagNameNS(namespace, localName);
        if (elements.getLength() > 0) {
            return elements.item(0).getTextContent();
        }
        return null;
    }

    private @Nullable Element directChild(Element parent, String namespace, String localName) {
        for (var node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && namespace.equals(node.getNamespaceURI())
                    && localName.equals(node.getLocalName())) {
                return (Element) node;
            }
        }
        return null;
    }

    private Document parseXml(String xml) throws Exception {
        var factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        var builder = factory.newDocumentBuilder();
        return builder.parse(new InputSource(new StringReader(xml)));
    }

    private HttpRequest report(String url, String depth, String body) {
        return requestBuilder(url)
                .method("REPORT", HttpRequest.BodyPublishers.ofString(body))
                .header("Content-Type", "application/xml; charset=utf-8")
                .header("Depth", depth)
                .build();
    }

    private HttpRequest.Builder requestBuilder(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", authorization)
                .timeout(REQUEST_TIMEOUT);
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CalDavException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalDavException("Request to " + request.uri() + " was interrupted.", e);
        }
    }

    private String expectMultistatus(HttpResponse<String> response, String action) {
        if (response.statusCode() == 207) {
            return response.body();
        }
        throw failure(response, action);
    }

    private CalDavException failure(HttpResponse<String> response, String action) {
        var status = response.statusCode();
        var body = response.body() == null ? "" : response.body();
        if ((status == 403 || status == 409) && body.contains(CalDavException.VALID_SYNC_TOKEN)) {
            return new CalDavException("Sync token is no longer valid.", status, CalDavException.VALID_SYNC_TOKEN);
        }
        return switch (status) {
            case 401 -> new CalDavException("Authentication failed. Please check caldav.username and caldav.password.",
                    status, null);
            case 403 -> new CalDavException("Access denied. Cannot " + action + ".", status, null);
            case 404 -> new CalDavException("URL not found. Cannot " + action + ".", status, null);
            default -> new CalDavException("Server returned unexpected status " + status + ". Cannot " + action + ".",
                    status, null);
        };
    }

    private static String escapeXml(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /**
     * Resolves an href (which may be relative) against the base URL
     * to produce an absolute URL.
     */
    static String resolveHref(String baseUrl, String href) {
        if (href.startsWith("http://") || href.startsWith("https://")) {
            return href;
        }
        // href is a path like /caldav.php/username/ - combine with base URL's scheme+host
        return URI.create(baseUrl).resolve(href).toString();
    }

    static String normalizeUrl(String url) {
        var normalized = url.strip();
        if (!normalized.endsWith("/")) {
            normalized += "/";
        }
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            normalized = "https://" + normalized;
        }
        return normalized;
    }

    /**
     * Creates an {@link SSLContext} that trusts all certificates, including self-signed ones.
     */
    private static SSLContext createTrustAllSslContext() {
        try {
            var trustAllManager = new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // Trust all client certificates
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // Trust all server certificates
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            };

            var sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{trustAllManager}, null);
            return sslContext;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new CalDavException("Failed to create SSL context for trusting all certificates.", e);
        }
    }
}
