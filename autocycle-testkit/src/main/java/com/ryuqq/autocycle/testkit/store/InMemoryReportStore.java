package com.ryuqq.autocycle.testkit.store;

import com.ryuqq.autocycle.core.report.CycleReport;
import com.ryuqq.autocycle.core.spi.PersistenceException;
import com.ryuqq.autocycle.core.spi.ReportStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of ReportStore for testing purposes.
 *
 * <p>References are sequential ({@code report-0001}, {@code report-0002}, ...)
 * and never reused.</p>
 *
 * @author Autocycle Team
 * @since 1.0.0
 */
public class InMemoryReportStore implements ReportStore {

    private final Map<String, CycleReport> reports = new LinkedHashMap<>();
    private int sequence;
    private boolean failWrites;

    @Override
    public void prepare() {
        // nothing to prepare
    }

    @Override
    public synchronized String write(CycleReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        if (failWrites) {
            throw new PersistenceException("report write failed (simulated)");
        }
        String reference = String.format("report-%04d", ++sequence);
        reports.put(reference, report);
        return reference;
    }

    @Override
    public synchronized Optional<CycleReport> read(String reference) {
        return Optional.ofNullable(reports.get(reference));
    }

    @Override
    public synchronized List<String> list() {
        return new ArrayList<>(reports.keySet());
    }

    /**
     * All stored reports in write order.
     */
    public synchronized List<CycleReport> reports() {
        return new ArrayList<>(reports.values());
    }

    /**
     * Makes subsequent writes throw {@link PersistenceException}.
     */
    public synchronized void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public synchronized void clear() {
        reports.clear();
        sequence = 0;
        failWrites = false;
    }
}
