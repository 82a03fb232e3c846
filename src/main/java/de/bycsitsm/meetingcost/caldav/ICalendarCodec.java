package de.bycsitsm.meetingcost.caldav;

import de.bycsitsm.meetingcost.calendar.Attendee;
import de.bycsitsm.meetingcost.calendar.CalendarEvent;
import de.bycsitsm.meetingcost.calendar.ResponseStatus;
import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads and rewrites the iCalendar data of a calendar object resource.
 * <p>
 * A resource may hold several {@code VEVENT} components: a recurring master and overridden
 * instances carrying a {@code RECURRENCE-ID}. The master (or, without one, the first event)
 * is the one read and written. Properties of nested components such as {@code VALARM} are
 * never taken for properties of the event.
 * <p>
 * Private metadata is stored as {@code X-PRIVATE-PROPERTY;KEY=name:value} lines.
 */
final class ICalendarCodec {

    static final String PRIVATE_PROPERTY = "X-PRIVATE-PROPERTY";
    static final String SCHEDULE_AGENT = "SCHEDULE-AGENT";

    private static final int MAX_LINE_OCTETS = 75;

    private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private final ZoneId defaultZone;

    ICalendarCodec(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    /**
     * A content line split into name, parameters and raw value.
     */
    record Property(String name, Map<String, String> parameters, String value) {

        @Nullable String parameter(String parameterName) {
            return parameters.get(parameterName);
        }
    }

    /**
     * Converts the event of a resource into a {@link CalendarEvent}.
     *
     * @param id           the event identifier (the resource href)
     * @param etag         the entity tag of the resource, if known
     * @param calendarData the iCalendar text
     * @return the event, or empty if the resource contains no {@code VEVENT}
     */
    Optional<CalendarEvent> parse(String id, @Nullable String etag, String calendarData) {
        var lines = unfold(calendarData);
        var begin = selectEvent(lines);
        if (begin < 0) {
            return Optional.empty();
        }

        @Nullable String uid = null;
        @Nullable Property dtStart = null;
        @Nullable Property dtEnd = null;
        @Nullable Property duration = null;
        @Nullable String organizer = null;
        @Nullable String description = null;
        var recurring = false;
        var cancelled = false;
        var attendees = new ArrayList<Attendee>();
        var privateProperties = new LinkedHashMap<String, String>();

        for (var property : eventProperties(lines, begin)) {
            switch (property.name()) {
                case "UID" -> uid = property.value();
                case "DTSTART" -> dtStart = property;
                case "DTEND" -> dtEnd = property;
                case "DURATION" -> duration = property;
                case "RRULE", "RECURRENCE-ID" -> recurring = true;
                case "STATUS" -> cancelled = "CANCELLED".equalsIgnoreCase(property.value().strip());
                case "DESCRIPTION" -> description = unescapeText(property.value());
                case "ORGANIZER" -> organizer = address(property);
                case "ATTENDEE" -> {
                    var address = address(property);
                    if (address != null) {
                        attendees.add(new Attendee(address, ResponseStatus.fromPartStat(property.parameter("PARTSTAT"))));
                    }
                }
                case PRIVATE_PROPERTY -> {
                    var key = property.parameter("KEY");
                    if (key != null) {
                        privateProperties.put(key, unescapeText(property.value()));
                    }
                }
                default -> {
                }
            }
        }

        var allDay = dtStart == null || isDate(dtStart);
        @Nullable Instant start = allDay || dtStart == null ? null : parseDateTime(dtStart);
        @Nullable Instant end = null;
        if (!allDay) {
            if (dtEnd != null && !isDate(dtEnd)) {
                end = parseDateTime(dtEnd);
            } else if (duration != null && start != null) {
                end = start.plus(parseDuration(duration.value()));
            } else if (dtEnd == null) {
                end = start;
            }
        }

        return Optional.of(new CalendarEvent(
                id,
                recurring ? uid : null,
                start,
                end,
                allDay,
                organizer,
                attendees,
                description == null || description.isEmpty() ? null : description,
                privateProperties,
                cancelled,
                etag));
    }

    /**
     * Replaces description and private metadata of the resource's event. Every other line,
     * including other components, is kept.
     * <p>
     * Without {@code notifyAttendees}, the event's {@code ORGANIZER} and {@code ATTENDEE}
     * properties are marked {@code SCHEDULE-AGENT=CLIENT} (RFC 6638), which stops the server
     * from sending scheduling messages for this write.
     *
     * @throws CalDavException if the data contains no {@code VEVENT}
     */
    String rewrite(String calendarData, String description, Map<String, String> privateProperties,
                   boolean notifyAttendees) {
        var lines = unfold(calendarData);
        var begin = selectEvent(lines);
        if (begin < 0) {
            throw new CalDavException("Calendar data contains no VEVENT.");
        }
        var end = endOfComponent(lines, begin);

        var result = new ArrayList<String>(lines.size() + privateProperties.size() + 1);
        var depth = 0;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (i > begin && i < end) {
                var name = nameOf(line);
                if (name.equals("BEGIN")) {
                    depth++;
                } else if (name.equals("END")) {
                    depth--;
                } else if (depth == 0 && (name.equals("DESCRIPTION") || name.equals(PRIVATE_PROPERTY))) {
                    continue;
                } else if (depth == 0 && !notifyAttendees && (name.equals("ORGANIZER") || name.equals("ATTENDEE"))) {
                    line = withParameter(line, SCHEDULE_AGENT, "CLIENT");
                }
            }
            if (i == end) {
                if (!description.isEmpty()) {
                    result.add("DESCRIPTION:" + escapeText(description));
                }
                new TreeMap<>(privateProperties).forEach((key, value) ->
                        result.add(PRIVATE_PROPERTY + ";KEY=" + quoteParameter(key) + ":" + escapeText(value)));
            }
            result.add(line);
        }

        var out = new StringBuilder();
        for (var line : result) {
            out.append(fold(line)).append("\r\n");
        }
        return out.toString();
    }

    // -------------------------------------------------------------------------
    // Content lines
    // -------------------------------------------------------------------------

    static List<String> unfold(String calendarData) {
        var lines = new ArrayList<String>();
        for (var raw : calendarData.split("\\r?\\n")) {
            if ((raw.startsWith(" ") || raw.startsWith("\t")) && !lines.isEmpty()) {
                var last = lines.size() - 1;
                lines.set(last, lines.get(last) + raw.substring(1));
            } else if (!raw.isEmpty()) {
                lines.add(raw);
            }
        }
        return lines;
    }

    static String fold(String line) {
        var out = new StringBuilder(line.length() + 8);
        var used = 0;
        for (var i = 0; i < line.length(); ) {
            var codePoint = line.codePointAt(i);
            var octets = utf8Length(codePoint);
            if (used + octets > MAX_LINE_OCTETS) {
                out.append("\r\n ");
                used = 1;
            }
            out.appendCodePoint(codePoint);
            used += octets;
            i += Character.charCount(codePoint);
        }
        return out.toString();
    }

    static Property parseProperty(String line) {
        var colon = indexOutsideQuotes(line, ':', 0);
        var head = colon < 0 ? line : line.substring(0, colon);
        var value = colon < 0 ? "" : line.substring(colon + 1);

        var parameters = new LinkedHashMap<String, String>();
        var semicolon = indexOutsideQuotes(head, ';', 0);
        var name = (semicolon < 0 ? head : head.substring(0, semicolon)).toUpperCase(Locale.ROOT);
        while (semicolon >= 0) {
            var next = indexOutsideQuotes(head, ';', semicolon + 1);
            var parameter = next < 0 ? head.substring(semicolon + 1) : head.substring(semicolon + 1, next);
            var equals = parameter.indexOf('=');
            if (equals > 0) {
                var parameterValue = parameter.substring(equals + 1);
                if (parameterValue.length() >= 2 && parameterValue.startsWith("\"") && parameterValue.endsWith("\"")) {
                    parameterValue = parameterValue.substring(1, parameterValue.length() - 1);
                }
                parameters.put(parameter.substring(0, equals).toUpperCase(Locale.ROOT), parameterValue);
            }
            semicolon = next;
        }
        return new Property(name, parameters, value);
    }

    /**
     * Returns the content line with the parameter set to the value, replacing an existing one.
     */
    static String withParameter(String line, String parameterName, String parameterValue) {
        var property = parseProperty(line);
        var parameters = new LinkedHashMap<>(property.parameters());
        parameters.put(parameterName, parameterValue);
        var out = new StringBuilder(property.name());
        parameters.forEach((key, value) -> out.append(';').append(key).append('=').append(quoteParameter(value)));
        return out.append(':').append(property.value()).toString();
    }

    static String escapeText(String text) {
        var out = new StringBuilder(text.length() + 16);
        for (var c : text.toCharArray()) {
            switch (c) {
                case '\\' -> out.append("\\\\");
                case ';' -> out.append("\\;");
                case ',' -> out.append("\\,");
                case '\n' -> out.append("\\n");
                case '\r' -> {
                }
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    static String unescapeText(String text) {
        var out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                var next = text.charAt(++i);
                out.append(next == 'n' || next == 'N' ? '\n' : next);
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    // -------------------------------------------------------------------------
    // Components
    // -------------------------------------------------------------------------

    /**
     * Returns the index of the {@code BEGIN:VEVENT} line of the event to work on: the first
     * event without {@code RECURRENCE-ID}, or the first event if all are overrides.
     */
    private static int selectEvent(List<String> lines) {
        var first = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).equalsIgnoreCase("BEGIN:VEVENT")) {
                continue;
            }
            if (first < 0) {
                first = i;
            }
            var isOverride = eventProperties(lines, i).stream()
                    .anyMatch(property -> property.name().equals("RECURRENCE-ID"));
            if (!isOverride) {
                return i;
            }
            i = endOfComponent(lines, i);
        }
        return first;
    }

    /**
     * Returns the properties directly inside the component starting at {@code begin},
     * skipping nested components.
     */
    private static List<Property> eventProperties(List<String> lines, int begin) {
        var properties = new ArrayList<Property>();
        var depth = 0;
        for (int i = begin + 1; i < lines.size(); i++) {
            var property = parseProperty(lines.get(i));
            if (property.name().equals("BEGIN")) {
                depth++;
            } else if (property.name().equals("END")) {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (depth == 0) {
                properties.add(property);
            }
        }
        return properties;
    }

    private static int endOfComponent(List<String> lines, int begin) {
        var depth = 0;
        for (int i = begin + 1; i < lines.size(); i++) {
            var name = nameOf(lines.get(i));
            if (name.equals("BEGIN")) {
                depth++;
            } else if (name.equals("END")) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        throw new CalDavException("Calendar data contains an unterminated component.");
    }

    private static String nameOf(String line) {
        var end = line.length();
        for (int i = 0; i < line.length(); i++) {
            var c = line.charAt(i);
            if (c == ':' || c == ';') {
                end = i;
                break;
            }
        }
        return line.substring(0, end).toUpperCase(Locale.ROOT);
    }

    // -------------------------------------------------------------------------
    // Values
    // -------------------------------------------------------------------------

    private static @Nullable String address(Property property) {
        var email = property.parameter("EMAIL");
        var value = property.value().strip();
        if (value.regionMatches(true, 0, "mailto:", 0, "mailto:".length())) {
            value = value.substring("mailto:".length());
        } else if (email != null) {
            value = email;
        }
        return value.isBlank() || !value.contains("@") ? null : value.strip();
    }

    private static boolean isDate(Property property) {
        return "DATE".equalsIgnoreCase(property.parameter("VALUE")) || property.value().strip().length() == 8;
    }

    private @Nullable Instant parseDateTime(Property property) {
        var value = property.value().strip();
        try {
            if (value.endsWith("Z") || value.endsWith("z")) {
                return LocalDateTime.parse(value.substring(0, value.length() - 1), LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(value, LOCAL_DATE_TIME).atZone(zoneOf(property)).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private ZoneId zoneOf(Property property) {
        var tzid = property.parameter("TZID");
        if (tzid == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(tzid.startsWith("/") ? tzid.substring(1) : tzid);
        } catch (DateTimeException e) {
            return defaultZone;
        }
    }

    static Duration parseDuration(String value) {
        var text = value.strip().toUpperCase(Locale.ROOT);
        var negative = text.startsWith("-");
        if (negative || text.startsWith("+")) {
            text = text.substring(1);
        }
        try {
            Duration duration;
            if (text.endsWith("W")) {
                duration = Duration.ofDays(7L * Long.parseLong(text.substring(1, text.length() - 1)));
            } else {
                duration = Duration.parse(text);
            }
            return negative ? duration.negated() : duration;
        } catch (DateTimeParseException | NumberFormatException e) {
            return Duration.ZERO;
        }
    }

    private static String quoteParameter(String value) {
        if (value.contains(":") || value.contains(";") || value.contains(",")) {
            return "\"" + value.replace("\"", "") + "\"";
        }
        return value;
    }

    private static int indexOutsideQuotes(String text, char target, int from) {
        var quoted = false;
        for (int i = from; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == target && !quoted) {
                return i;
            }
        }
        return -1;
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
