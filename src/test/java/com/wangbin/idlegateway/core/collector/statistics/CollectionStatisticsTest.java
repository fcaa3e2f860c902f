package com.wangbin.idlegateway.core.collector.statistics;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionStatisticsTest {

    @Test
    void countersAccumulatePerGateway() {
        CollectionStatistics statistics = new CollectionStatistics();
        statistics.chunkFetched("nat-1", 10, 40);
        statistics.chunkFetched("nat-1", 5, 20);
        statistics.probed("igw-1");
        statistics.zeroFilled("igw-1");
        statistics.fetchFailed("igw-1");

        Map<String, Object> nat = statistics.getGatewayStatistics("nat-1");
        assertEquals(2, nat.get("chunks"));
        assertEquals(15L, nat.get("samples"));
        assertEquals(30L, nat.get("averageExecutionTime"));

        Map<String, Object> igw = statistics.getGatewayStatistics("igw-1");
        assertEquals(1, igw.get("probes"));
        assertEquals(1, igw.get("zeroFills"));
        assertEquals(1, igw.get("failures"));
        assertEquals(2, statistics.getAllStatistics().size());
    }

    @Test
    void unknownGatewayHasNoStatistics() {
        CollectionStatistics statistics = new CollectionStatistics();
        statistics.chunkFetched("nat-1", 1, 1);
        statistics.clearAllStatistics();

        assertTrue(statistics.getGatewayStatistics("nat-1").isEmpty());
        assertTrue(statistics.getAllStatistics().isEmpty());
    }
}
