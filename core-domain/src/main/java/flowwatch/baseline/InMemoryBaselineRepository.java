package flowwatch.baseline;

import flowwatch.domain.baseline.HistoricalBaselineTable;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryBaselineRepository implements BaselineRepository {

    private final ConcurrentMap<String, HistoricalBaselineTable> tables = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String siteId) {
        return tables.containsKey(siteId);
    }

    @Override
    public Optional<HistoricalBaselineTable> read(String siteId) {
        return Optional.ofNullable(tables.get(siteId));
    }

    @Override
    public HistoricalBaselineTable createIfAbsent(HistoricalBaselineTable table) {
        HistoricalBaselineTable existing = tables.putIfAbsent(table.siteId(), table);
        return existing != null ? existing : table;
    }

    @Override
    public boolean delete(String siteId) {
        return tables.remove(siteId) != null;
    }
}
