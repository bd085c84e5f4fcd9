package com.chatty.synth.service.context;

import com.chatty.synth.config.properties.TimeProperties;
import com.chatty.synth.domain.ChatRequest;
import com.chatty.synth.domain.TimeContext;
import com.chatty.synth.domain.TimeOfDay;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TimeAwarenessService} backed by a {@link Clock}.
 *
 * <p>Zone selection: the request's timezone hint when it is a valid zone id, else
 * {@code synth.time.default-zone}, else the clock's own zone.
 */
@Service
public class ClockTimeAwarenessService implements TimeAwarenessService {

    private static final Logger LOG = LogManager.getLogger(ClockTimeAwarenessService.class);
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.US);

    private final Clock clock;
    private final TimeProperties props;

    public ClockTimeAwarenessService(Clock clock, TimeProperties props) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Optional<TimeContext> resolve(ChatRequest request) {
        if (!props.enabled()) {
            return Optional.empty();
        }
        ZoneId zone = resolveZone(request == null ? null : request.timezone());
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        TimeContext ctx = new TimeContext(
                LOCAL_TIME.format(now),
                TimeOfDay.fromHour(now.getHour()).label(),
                now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US),
                zone.getId());
        LOG.debug("Time context resolved: {}", ctx);
        return Optional.of(ctx);
    }

    private ZoneId resolveZone(String hint) {
        ZoneId fromHint = parseZone(hint);
        if (fromHint != null) {
            return fromHint;
        }
        ZoneId configured = parseZone(props.defaultZone());
        return configured != null ? configured : clock.getZone();
    }

    private static ZoneId parseZone(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(id.trim());
        } catch (DateTimeException e) {
            LOG.debug("Ignoring unknown zone id '{}': {}", id, e.getMessage());
            return null;
        }
    }
}
