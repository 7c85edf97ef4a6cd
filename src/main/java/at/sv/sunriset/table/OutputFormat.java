package at.sv.sunriset.table;

public enum OutputFormat {
    CSV,
    JSON
}
