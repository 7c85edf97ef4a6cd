package at.sv.sunriset.table;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the table as a JSON array with one object per date, keyed by column header.
 */
public final class JsonSolarTableWriter implements SolarTableWriter {

    private final ObjectMapper mapper;

    public JsonSolarTableWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public void write(SolarTable table, Writer writer) throws IOException {
        mapper.writeValue(writer, table.toRows());
        writer.flush();
    }
}
