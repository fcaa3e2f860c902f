package com.wangbin.idlegateway.core.analysis.catalog;

/**
 * 汇总字段
 */
public enum SummaryField {

    BYTES_IN("Total_Bytes_In"),
    BYTES_OUT("Total_Bytes_Out"),
    PACKETS_IN("Total_Packets_In"),
    PACKETS_OUT("Total_Packets_Out"),

    // NAT
    CONNECTION_ATTEMPTS("Total_Connection_Attempts"),
    CONNECTION_TIMEOUTS("Total_Connection_Timeouts"),
    PORT_ALLOCATION_ERRORS("Port_Allocation_Errors"),

    // IGW
    BLACKHOLE_DROP_BYTES("Total_Blackhole_Drops_Bytes"),
    NOROUTE_DROP_BYTES("Total_NoRoute_Drops_Bytes"),
    BLACKHOLE_DROP_PACKETS("Total_Blackhole_Drops_Packets"),
    NOROUTE_DROP_PACKETS("Total_NoRoute_Drops_Packets");

    private final String columnName;

    SummaryField(String columnName) {
        this.columnName = columnName;
    }

    /**
     * 报告列名
     */
    public String getColumnName() {
        return columnName;
    }
}
