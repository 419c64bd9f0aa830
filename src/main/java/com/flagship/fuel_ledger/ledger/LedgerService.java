package com.flagship.fuel_ledger.ledger;

import com.flagship.fuel_ledger.account.AccountStore;
import com.flagship.fuel_ledger.account.UserAccount;
import com.flagship.fuel_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.fuel_ledger.ledger.exception.InvalidInputException;
import com.flagship.fuel_ledger.observability.LedgerMetrics;
import com.flagship.fuel_ledger.period.LedgerCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The expense ledger engine.
 *
 * This service enforces the core invariants:
 * 1. At most one expense record per user and day (same-day amounts are merged)
 * 2. A month's total never exceeds the user's limit through addExpense
 * 3. The read-decide-write in addExpense is atomic per user
 *
 * All state lives in the stores. Every summary is recomputed from the records,
 * so nothing happens at a month boundary: "current month" is whatever the
 * calendar says today is.
 */
@Service
@Slf4j
public class LedgerService {

    private static final int MONEY_SCALE = 2;

    private final LedgerStore ledgerStore;
    private final AccountStore accountStore;
    private final LedgerUnitOfWork unitOfWork;
    private final LimitPolicy limitPolicy;
    private final LedgerCalendar calendar;
    private final StorageGuard storageGuard;
    private final LedgerMetrics metrics;

    public LedgerService(LedgerStore ledgerStore,
                         AccountStore accountStore,
                         LedgerUnitOfWork unitOfWork,
                         LimitPolicy limitPolicy,
                         LedgerCalendar calendar,
                         StorageGuard storageGuard,
                         LedgerMetrics metrics) {
        this.ledgerStore = ledgerStore;
        this.accountStore = accountStore;
        this.unitOfWork = unitOfWork;
        this.limitPolicy = limitPolicy;
        this.calendar = calendar;
        this.storageGuard = storageGuard;
        this.metrics = metrics;
    }

    /**
     * Adds an expense to today's record, if the month stays within the limit.
     *
     * @param owner registered username
     * @param amount positive amount with at most 2 decimal places
     * @return Accepted with the new month total, or Rejected with the store untouched
     * @throws InvalidInputException if the amount is missing, not positive or too precise
     * @throws AccountNotFoundException if the user is not registered
     * @throws com.flagship.fuel_ledger.ledger.exception.StorageException on persistence failure
     */
    public AddExpenseResult addExpense(String owner, BigDecimal amount) {
        requireOwner(owner);
        requireMoney(amount, "Expense amount");

        LocalDate date = calendar.today();
        long started = System.nanoTime();
        try {
            AddExpenseResult result = storageGuard.call("add_expense",
                () -> unitOfWork.execute(owner, () -> addWithinLimit(owner, date, amount)));
            if (result.isAccepted()) {
                metrics.incrementExpensesAccepted();
            } else {
                metrics.incrementExpensesRejected();
            }
            return result;
        } finally {
            metrics.recordAddExpenseDuration(Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private AddExpenseResult addWithinLimit(String owner, LocalDate date, BigDecimal amount) {
        UserAccount account = accountStore.findByUsername(owner)
            .orElseThrow(() -> new AccountNotFoundException(owner));
        BigDecimal limit = account.getMonthlyLimit();

        BigDecimal currentTotal = ledgerStore.monthlyTotal(owner, date.getYear(), date.getMonthValue());
        Optional<ExpenseRecord> existing = ledgerStore.findByDate(owner, date);

        LimitDecision decision = limitPolicy.decide(
            currentTotal,
            existing.map(ExpenseRecord::getAmount).orElse(null),
            amount,
            limit
        );

        if (decision instanceof LimitDecision.Rejected rejected) {
            log.debug("Rejected expense of {} for {}: month total {} against limit {}",
                amount, owner, currentTotal, limit);
            return new AddExpenseResult.Rejected(
                money(rejected.getCurrentTotal()),
                money(rejected.getAttempted()),
                money(rejected.getLimit())
            );
        }

        LimitDecision.Accepted accepted = (LimitDecision.Accepted) decision;
        if (existing.isPresent()) {
            ledgerStore.updateAmount(existing.get().getId(), accepted.getCombinedAmount());
        } else {
            ledgerStore.create(owner, date, accepted.getCombinedAmount());
        }

        BigDecimal newTotal = money(accepted.getNewTotal());
        log.debug("Recorded expense of {} for {} on {}, month total {}", amount, owner, date, newTotal);
        return new AddExpenseResult.Accepted(newTotal, money(limit.subtract(newTotal)));
    }

    /**
     * Current month total against the user's limit.
     *
     * @throws AccountNotFoundException if the user is not registered
     */
    public MonthlySummary monthlySummary(String owner) {
        requireOwner(owner);
        UserAccount account = storageGuard.call("monthly_summary", () -> accountStore.findByUsername(owner))
            .orElseThrow(() -> new AccountNotFoundException(owner));

        YearMonth month = calendar.currentMonth();
        BigDecimal totalSpent = money(storageGuard.call("monthly_summary",
            () -> ledgerStore.monthlyTotal(owner, month.getYear(), month.getMonthValue())));
        BigDecimal limit = money(account.getMonthlyLimit());

        return new MonthlySummary(totalSpent, limit, limit.subtract(totalSpent));
    }

    /**
     * Current month records, date ascending. Empty when nothing was spent.
     */
    public List<ExpenseRecord> listMonth(String owner) {
        requireOwner(owner);
        YearMonth month = calendar.currentMonth();
        return storageGuard.call("list_month",
            () -> ledgerStore.findMonth(owner, month.getYear(), month.getMonthValue()));
    }

    /**
     * Deletes every record of the current month.
     *
     * @return number of records deleted, 0 for an empty month
     */
    public long clearMonth(String owner) {
        requireOwner(owner);
        YearMonth month = calendar.currentMonth();
        long deleted = storageGuard.call("clear_month",
            () -> ledgerStore.deleteMonth(owner, month.getYear(), month.getMonthValue()));
        log.info("Cleared {} expense records of {} for {}", deleted, owner, month);
        return deleted;
    }

    /**
     * Deletes the most recent record of the current month (latest date, then latest id).
     */
    public Optional<ExpenseRecord> removeLast(String owner) {
        requireOwner(owner);
        YearMonth month = calendar.currentMonth();
        Optional<ExpenseRecord> removed = storageGuard.call("remove_last",
            () -> ledgerStore.deleteLatestInMonth(owner, month.getYear(), month.getMonthValue()));
        removed.ifPresent(record ->
            log.info("Removed expense of {} on {} for {}", record.getAmount(), record.getTxDate(), owner));
        return removed;
    }

    /**
     * Per-month totals for the current year with their grand total.
     */
    public YearSummary yearSummary(String owner) {
        requireOwner(owner);
        int year = calendar.today().getYear();
        List<MonthTotal> totals = storageGuard.call("year_summary", () -> ledgerStore.yearTotals(owner, year));

        List<YearSummary.MonthEntry> months = totals.stream()
            .map(total -> new YearSummary.MonthEntry(
                total.getMonth(),
                Month.of(total.getMonth()).getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                money(total.getTotal())))
            .toList();
        BigDecimal grandTotal = months.stream()
            .map(YearSummary.MonthEntry::getTotal)
            .reduce(money(BigDecimal.ZERO), BigDecimal::add);

        return new YearSummary(year, months, grandTotal);
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidInputException("Username is required");
        }
    }

    private static void requireMoney(BigDecimal value, String label) {
        if (value == null || value.compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidInputException(label + " must be a positive number, got: " + value);
        }
        if (value.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new InvalidInputException(label + " must have at most 2 decimal places, got: " + value);
        }
    }

    // Stored values never exceed two decimals, so this never rounds
    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
    }
}
