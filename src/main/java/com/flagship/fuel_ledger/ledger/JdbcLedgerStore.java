package com.flagship.fuel_ledger.ledger;

import com.flagship.fuel_ledger.ledger.exception.ExpenseConflictException;
import com.flagship.fuel_ledger.ledger.exception.ExpenseNotFoundException;
import com.flagship.fuel_ledger.period.LedgerCalendar;
import com.flagship.fuel_ledger.period.MonthRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL ledger store on plain JDBC.
 *
 * The unique (owner, tx_date) constraint backs the one-row-per-day invariant;
 * the engine checks first, so hitting it means a bug.
 * Joins whatever transaction is active on the calling thread.
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String RECORD_COLUMNS = "id, owner, tx_date, amount";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ExpenseRecord> findByDate(String owner, LocalDate date) {
        List<ExpenseRecord> records = jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM expense_records WHERE owner = ? AND tx_date = ?",
            expenseRecordRowMapper(),
            owner,
            date
        );
        return records.stream().findFirst();
    }

    @Override
    public long create(String owner, LocalDate date, BigDecimal amount) {
        try {
            Long id = jdbcTemplate.queryForObject(
                "INSERT INTO expense_records (owner, tx_date, amount) VALUES (?, ?, ?) RETURNING id",
                Long.class,
                owner,
                date,
                amount
            );
            log.debug("Created expense record {} for {} on {}", id, owner, date);
            return id;
        } catch (DuplicateKeyException e) {
            throw new ExpenseConflictException(owner, date);
        }
    }

    @Override
    public void updateAmount(long id, BigDecimal newAmount) {
        int updated = jdbcTemplate.update(
            "UPDATE expense_records SET amount = ? WHERE id = ?",
            newAmount,
            id
        );
        if (updated == 0) {
            throw new ExpenseNotFoundException(id);
        }
        log.debug("Updated expense record {} to {}", id, newAmount);
    }

    @Override
    public BigDecimal monthlyTotal(String owner, int year, int month) {
        MonthRange range = LedgerCalendar.monthBounds(year, month);
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM expense_records " +
            "WHERE owner = ? AND tx_date >= ? AND tx_date <= ?",
            BigDecimal.class,
            owner,
            range.getFirstDay(),
            range.getLastDay()
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    @Override
    public List<ExpenseRecord> findMonth(String owner, int year, int month) {
        MonthRange range = LedgerCalendar.monthBounds(year, month);
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM expense_records " +
            "WHERE owner = ? AND tx_date >= ? AND tx_date <= ? " +
            "ORDER BY tx_date ASC, id DESC",
            expenseRecordRowMapper(),
            owner,
            range.getFirstDay(),
            range.getLastDay()
        );
    }

    @Override
    public long deleteMonth(String owner, int year, int month) {
        MonthRange range = LedgerCalendar.monthBounds(year, month);
        int deleted = jdbcTemplate.update(
            "DELETE FROM expense_records WHERE owner = ? AND tx_date >= ? AND tx_date <= ?",
            owner,
            range.getFirstDay(),
            range.getLastDay()
        );
        log.debug("Deleted {} expense records for {} in {}-{}", deleted, owner, year, month);
        return deleted;
    }

    @Override
    public Optional<ExpenseRecord> deleteLatestInMonth(String owner, int year, int month) {
        MonthRange range = LedgerCalendar.monthBounds(year, month);
        // Single statement, so the selected row is the one removed
        List<ExpenseRecord> deleted = jdbcTemplate.query(
            "DELETE FROM expense_records WHERE id = (" +
            "  SELECT id FROM expense_records " +
            "  WHERE owner = ? AND tx_date >= ? AND tx_date <= ? " +
            "  ORDER BY tx_date DESC, id DESC LIMIT 1" +
            ") RETURNING " + RECORD_COLUMNS,
            expenseRecordRowMapper(),
            owner,
            range.getFirstDay(),
            range.getLastDay()
        );
        return deleted.stream().findFirst();
    }

    @Override
    public List<MonthTotal> yearTotals(String owner, int year) {
        return jdbcTemplate.query(
            "SELECT CAST(EXTRACT(MONTH FROM tx_date) AS INTEGER) AS month, SUM(amount) AS total " +
            "FROM expense_records " +
            "WHERE owner = ? AND tx_date >= ? AND tx_date <= ? " +
            "GROUP BY 1 ORDER BY 1",
            (rs, rowNum) -> new MonthTotal(rs.getInt("month"), rs.getBigDecimal("total")),
            owner,
            LocalDate.of(year, 1, 1),
            LocalDate.of(year, 12, 31)
        );
    }

    private RowMapper<ExpenseRecord> expenseRecordRowMapper() {
        return (rs, rowNum) -> new ExpenseRecord(
            rs.getLong("id"),
            rs.getString("owner"),
            rs.getObject("tx_date", LocalDate.class),
            rs.getBigDecimal("amount")
        );
    }
}
