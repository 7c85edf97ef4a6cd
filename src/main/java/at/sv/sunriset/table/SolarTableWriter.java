package at.sv.sunriset.table;

import java.io.IOException;
import java.io.Writer;

public interface SolarTableWriter {

    /**
     * Writes the table to the given writer. The writer is flushed but not closed.
     */
    void write(SolarTable table, Writer writer) throws IOException;

    static SolarTableWriter forFormat(OutputFormat format) {
        return switch (format) {
            case CSV -> new CsvSolarTableWriter();
            case JSON -> new JsonSolarTableWriter();
        };
    }
}
