package ai.romantext.harmony.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One JSON object per event: timestamp, level, logger, message, the MDC entries and any exception summary.
 */
public class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        JsonObject json = new JsonObject();
        json.addProperty("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        json.addProperty("level", event.getLevel().toString());
        json.addProperty("logger", event.getLoggerName());
        json.addProperty("thread", event.getThreadName());
        json.addProperty("message", event.getFormattedMessage());

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && !mdc.isEmpty()) {
            JsonObject context = new JsonObject();
            mdc.forEach(context::addProperty);
            json.add("mdc", context);
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            JsonObject error = new JsonObject();
            error.addProperty("type", throwable.getClassName());
            error.addProperty("message", throwable.getMessage());
            json.add("error", error);
        }
        return json + System.lineSeparator();
    }
}
