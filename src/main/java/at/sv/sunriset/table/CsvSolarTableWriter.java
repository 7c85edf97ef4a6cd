package at.sv.sunriset.table;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

public final class CsvSolarTableWriter implements SolarTableWriter {

    private static final CsvSchema SCHEMA = createSchema();

    private final CsvMapper mapper;

    public CsvSolarTableWriter() {
        mapper = new CsvMapper();
        mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    private static CsvSchema createSchema() {
        CsvSchema.Builder builder = CsvSchema.builder().addColumn(SolarColumn.DATE_HEADER);
        for (SolarColumn column : SolarColumn.values()) {
            builder.addColumn(column.getHeader());
        }
        return builder.build().withHeader();
    }

    @Override
    public void write(SolarTable table, Writer writer) throws IOException {
        try (SequenceWriter sequenceWriter = mapper.writer(SCHEMA).writeValues(writer)) {
            for (Map<String, Object> row : table.toRows()) {
                sequenceWriter.write(row);
            }
        }
        writer.flush();
    }
}
