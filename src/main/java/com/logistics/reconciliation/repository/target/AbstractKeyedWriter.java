package com.logistics.reconciliation.repository.target;

import com.logistics.reconciliation.model.PageWriteResult;
import com.logistics.reconciliation.model.TransferRecord;
import com.logistics.reconciliation.model.WriteMode;
import com.logistics.reconciliation.repository.AbstractJdbcRepository;
import com.logistics.reconciliation.repository.RecordWriter;
import com.logistics.reconciliation.repository.SqlTemplateLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a page to a Target table keyed by a natural key.
 * <p>
 * Existing keys are looked up first, then new rows are batch-inserted and, in
 * {@link WriteMode#MERGE}, existing rows are batch-updated. Rows sharing a key
 * within one page collapse to the last occurrence.
 */
@Slf4j
public abstract class AbstractKeyedWriter<T extends TransferRecord> extends AbstractJdbcRepository
        implements RecordWriter<T> {

    protected AbstractKeyedWriter(NamedParameterJdbcTemplate jdbc, SqlTemplateLoader sql) {
        super(jdbc, sql);
    }

    /**
     * Rows that can be written, and how many were set aside because their
     * parent does not exist in Target.
     */
    protected record Prepared<T>(List<T> rows, int orphaned) {
    }

    @Override
    public PageWriteResult writePage(List<T> page, WriteMode mode) {
        if (page.isEmpty()) {
            return PageWriteResult.empty();
        }

        Map<String, T> latest = new LinkedHashMap<>();
        int unkeyed = 0;
        for (T row : page) {
            String key = row.naturalKey();
            if (key == null) {
                unkeyed++;
                continue;
            }
            latest.put(key, row);
        }
        int collapsed = page.size() - unkeyed - latest.size();
        if (unkeyed > 0) {
            log.warn("Skipped {} rows without a natural key for {}", unkeyed, table());
        }

        Prepared<T> prepared = prepare(new ArrayList<>(latest.values()));
        Set<String> existing = prepared.rows().isEmpty() ? Set.of() : findExistingKeys(prepared.rows());

        List<T> fresh = new ArrayList<>();
        List<T> present = new ArrayList<>();
        for (T row : prepared.rows()) {
            if (existing.contains(row.naturalKey())) {
                present.add(row);
            } else {
                fresh.add(row);
            }
        }

        batch(insertStatement(), fresh);
        int updated = 0;
        int skipped = unkeyed + collapsed;
        if (mode == WriteMode.MERGE) {
            updated = affectedRows(batch(updateStatement(), present));
            if (updated < present.size()) {
                log.warn("{} of {} existing rows in {} matched no row on update", present.size() - updated,
                        present.size(), table());
                skipped += present.size() - updated;
            }
        } else {
            skipped += present.size();
        }

        PageWriteResult result = new PageWriteResult(fresh.size(), updated, skipped, prepared.orphaned());
        log.debug("{} page of {} rows in {} mode: {}", table(), page.size(), mode, result);
        return result;
    }

    /**
     * Hook for resolving parents before the existing-key lookup.
     */
    protected Prepared<T> prepare(List<T> rows) {
        return new Prepared<>(rows, 0);
    }

    /**
     * Natural keys among {@code rows} that already exist in Target.
     */
    protected abstract Set<String> findExistingKeys(Collection<T> rows);

    protected abstract String insertStatement();

    protected abstract String updateStatement();

    protected abstract SqlParameterSource toParameters(T row);

    private int[] batch(String statement, List<T> rows) {
        if (rows.isEmpty()) {
            return new int[0];
        }
        SqlParameterSource[] batchArgs = rows.stream()
                .map(this::toParameters)
                .toArray(SqlParameterSource[]::new);
        return jdbc.batchUpdate(statement, batchArgs);
    }

    /**
     * Statements that changed a row. Drivers that report
     * {@link Statement#SUCCESS_NO_INFO} are taken at their word.
     */
    static int affectedRows(int[] counts) {
        int affected = 0;
        for (int count : counts) {
            if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
                affected++;
            }
        }
        return affected;
    }
}
