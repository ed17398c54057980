package org.luxbulb.webinfo.enricher.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.luxbulb.webinfo.models.results.EnrichmentResult;
import org.luxbulb.webinfo.serialization.JsonSerializer;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes each result as a JSON object on its own line. Successful results are written as the enriched record,
 * failed ones as the status code and error message along with the input record.
 */
public class JsonLinesResultConsumer implements ResultConsumer {
    private static final byte[] NEWLINE = {'\n'};

    private final OutputStream _output;
    private final JsonSerializer<Object> _serializer;

    public JsonLinesResultConsumer(@NotNull OutputStream output, @NotNull ObjectMapper mapper, boolean pretty) {
        _output = output;
        _serializer = new JsonSerializer<>(mapper, pretty);
    }

    @Override
    public void consume(@NotNull EnrichmentResult result) throws IOException {
        final Object value = result.success() ? result.record() : result;
        _output.write(_serializer.serialize(value));
        _output.write(NEWLINE);
        _output.flush();
    }

    @Override
    public void flush() throws IOException {
        _output.flush();
    }
}
