package quest.gekko.trend.service.ingest;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Forward-only read of the raw channel documents. The returned stream holds the underlying
 * cursor and must be closed by the caller.
 */
public interface ChannelDocumentSource {
    Stream<Map<String, Object>> openCursor();
}
