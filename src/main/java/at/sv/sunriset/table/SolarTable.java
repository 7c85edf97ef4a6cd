package at.sv.sunriset.table;

import at.sv.sunriset.calc.SolarDay;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One complete {@link SolarDay} per row, ordered by date. Dates skipped in lenient mode are listed
 * separately and never appear as partial rows.
 */
@Data
public final class SolarTable {

    private final List<SolarDay> rows;
    private final List<LocalDate> skippedDates;

    public int size() {
        return rows.size();
    }

    public List<Map<String, Object>> toRows() {
        return rows.stream().map(SolarColumn::toRow).toList();
    }
}
