package de.bycsitsm.meetingcost.caldav;

import de.bycsitsm.meetingcost.ConfigurationException;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Configuration properties for the CalDAV server holding the members' calendars.
 *
 * @param url                   the CalDAV server root used for principal discovery
 * @param username              the service account allowed to read and write all calendars
 * @param password              the password of the service account
 * @param calendarPath          path of a member's default calendar, relative to the principal collection
 * @param trustAllCertificates  whether self-signed certificates are accepted
 * @param pageSize              the maximum number of results per {@code sync-collection} report
 * @param defaultTimeZone       time zone applied to floating event times
 */
@ConfigurationProperties(prefix = "caldav")
public record CalDavProperties(
        @Nullable String url,
        @Nullable String username,
        @Nullable String password,
        @DefaultValue("calendar/") String calendarPath,
        @DefaultValue("false") boolean trustAllCertificates,
        @DefaultValue("500") int pageSize,
        @DefaultValue("UTC") String defaultTimeZone
) {

    public CalDavProperties {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("caldav.url must not be empty.");
        }
        if (username == null || username.isBlank()) {
            throw new ConfigurationException("caldav.username must not be empty.");
        }
        if (password == null) {
            password = "";
        }
        if (pageSize <= 0) {
            throw new ConfigurationException("caldav.page-size must be positive, was " + pageSize + ".");
        }
        try {
            ZoneId.of(defaultTimeZone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("caldav.default-time-zone is not a valid zone: " + defaultTimeZone);
        }
    }

    ZoneId zone() {
        return ZoneId.of(defaultTimeZone);
    }
}
