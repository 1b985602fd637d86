package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "spreadsheet" prefix, e.g.
 * spreadsheet.rows=100
 * spreadsheet.columns=26
 * spreadsheet.history-size=10
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SheetProperties {

    private int rows = 100;
    private int columns = 26;
    // How many undo steps are kept
    private int historySize = 10;

    public int getRows() {
        return rows;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getColumns() {
        return columns;
    }

    public void setColumns(int columns) {
        this.columns = columns;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
