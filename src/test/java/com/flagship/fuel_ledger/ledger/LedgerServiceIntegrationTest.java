package com.flagship.fuel_ledger.ledger;

import com.flagship.fuel_ledger.account.AccountService;
import com.flagship.fuel_ledger.account.RegistrationResult;
import com.flagship.fuel_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.fuel_ledger.period.LedgerCalendar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Try to break the ledger through the engine, on a real database.
 *
 * These tests attempt to violate the ledger invariants:
 * - Spending past the monthly limit with concurrent adds
 * - Creating a second record for a day with concurrent adds
 * - Leaking one user's records into another user's views
 *
 * The ledger clock is pinned to 2024-03-15 12:00 in Madrid, so no run
 * straddles a day or month boundary.
 */
@SpringBootTest
@Testcontainers
class LedgerServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_fuel_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "10");
    }

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedLedgerClock() {
            ZoneId zone = ZoneId.of("Europe/Madrid");
            return Clock.fixed(LocalDateTime.of(2024, 3, 15, 12, 0).atZone(zone).toInstant(), zone);
        }
    }

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerCalendar calendar;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String owner;

    @BeforeEach
    void setUp() {
        owner = "u-" + UUID.randomUUID().toString().substring(0, 8);
        assertEquals(RegistrationResult.CREATED, accountService.register(owner, "chat-" + owner));
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private int recordCount(String username) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expense_records WHERE owner = ?", Integer.class, username);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Full month lifecycle through the engine")
    void monthLifecycle() {
        printTestHeader("Full month lifecycle");

        printInput("Expense", "45.50");
        AddExpenseResult first = ledgerService.addExpense(owner, new BigDecimal("45.50"));
        printOutput("Result", first);
        assertEquals(new AddExpenseResult.Accepted(new BigDecimal("45.50"), new BigDecimal("164.50")), first);

        printInput("Expense", "200");
        AddExpenseResult second = ledgerService.addExpense(owner, new BigDecimal("200"));
        printOutput("Result", second);
        assertEquals(new AddExpenseResult.Rejected(
            new BigDecimal("45.50"), new BigDecimal("200.00"), new BigDecimal("210.00")), second);

        MonthlySummary summary = ledgerService.monthlySummary(owner);
        printOutput("Summary", summary);
        assertEquals(new MonthlySummary(
            new BigDecimal("45.50"), new BigDecimal("210.00"), new BigDecimal("164.50")), summary);

        List<ExpenseRecord> records = ledgerService.listMonth(owner);
        assertEquals(1, records.size());
        assertEquals(LocalDate.of(2024, 3, 15), records.get(0).getTxDate());
        assertEquals(LocalDate.of(2024, 3, 15), calendar.today());

        YearSummary year = ledgerService.yearSummary(owner);
        printOutput("Year", year);
        assertEquals(2024, year.getYear());
        assertEquals(List.of(new YearSummary.MonthEntry(3, "March", new BigDecimal("45.50"))), year.getMonths());
        assertEquals(new BigDecimal("45.50"), year.getGrandTotal());

        Optional<ExpenseRecord> removed = ledgerService.removeLast(owner);
        assertTrue(removed.isPresent());
        assertEquals(new BigDecimal("45.50"), removed.get().getAmount());
        assertEquals(Optional.empty(), ledgerService.removeLast(owner));

        ledgerService.addExpense(owner, new BigDecimal("10.00"));
        assertEquals(1, ledgerService.clearMonth(owner));
        assertEquals(0, recordCount(owner));

        printSuccess("Lifecycle kept every total consistent");
    }

    @Test
    @DisplayName("Raising the limit lets a previously rejected expense through")
    void limitChangeAppliesImmediately() {
        printTestHeader("Limit change");

        ledgerService.addExpense(owner, new BigDecimal("200.00"));
        assertFalse(ledgerService.addExpense(owner, new BigDecimal("50.00")).isAccepted());

        accountService.updateLimit(owner, new BigDecimal("300"));
        AddExpenseResult result = ledgerService.addExpense(owner, new BigDecimal("50.00"));
        printOutput("Result", result);

        assertEquals(new AddExpenseResult.Accepted(new BigDecimal("250.00"), new BigDecimal("50.00")), result);
        printSuccess("New limit was used by the next add");
    }

    @Test
    @DisplayName("Records from other months and users stay out of the current month")
    void monthAndOwnerIsolation() {
        printTestHeader("Month and owner isolation");

        String neighbour = "u-" + UUID.randomUUID().toString().substring(0, 8);
        accountService.register(neighbour, "chat-" + neighbour);
        LocalDate lastMonth = calendar.today().withDayOfMonth(1).minusDays(1);
        jdbcTemplate.update("INSERT INTO expense_records (owner, tx_date, amount) VALUES (?, ?, ?)",
            owner, lastMonth, new BigDecimal("200.00"));
        ledgerService.addExpense(neighbour, new BigDecimal("150.00"));

        AddExpenseResult result = ledgerService.addExpense(owner, new BigDecimal("210.00"));

        assertTrue(result.isAccepted());
        assertEquals(1, ledgerService.listMonth(owner).size());
        assertEquals(1, ledgerService.clearMonth(owner));
        assertEquals(1, recordCount(owner));
        assertEquals(1, recordCount(neighbour));
        printSuccess("Only the current month of the owner was touched");
    }

    @Test
    void unregisteredUserCannotSpend() {
        String ghost = "ghost-" + UUID.randomUUID().toString().substring(0, 8);

        assertThrows(AccountNotFoundException.class, () -> ledgerService.addExpense(ghost, new BigDecimal("1.00")));
        assertEquals(0, recordCount(ghost));
    }

    @Test
    @DisplayName("Concurrent adds never exceed the limit nor create a second record")
    void concurrentAddsRespectLimit() throws Exception {
        printTestHeader("Concurrent adds for one user");

        int threads = 10;
        BigDecimal amount = new BigDecimal("30.00");
        printInput("Threads", threads);
        printInput("Amount each", amount);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AddExpenseResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledgerService.addExpense(owner, amount);
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<AddExpenseResult> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).isAccepted()) {
                    accepted++;
                }
            }
            printOutput("Accepted", accepted);

            // 7 x 30.00 = 210.00, the limit
            assertEquals(7, accepted);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, recordCount(owner));
        MonthlySummary summary = ledgerService.monthlySummary(owner);
        printOutput("Summary", summary);
        assertEquals(new BigDecimal("210.00"), summary.getTotalSpent());
        assertEquals(new BigDecimal("0.00"), summary.getRemaining());
        printSuccess("Total stayed within the limit with one record for the day");
    }

    @Test
    @DisplayName("Concurrent adds for different users do not interfere")
    void concurrentAddsForDifferentUsers() throws Exception {
        printTestHeader("Concurrent adds for different users");

        List<String> owners = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String username = "u-" + UUID.randomUUID().toString().substring(0, 8);
            accountService.register(username, "chat-" + username);
            owners.add(username);
        }

        ExecutorService executor = Executors.newFixedThreadPool(owners.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AddExpenseResult>> futures = new ArrayList<>();
        try {
            for (String username : owners) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledgerService.addExpense(username, new BigDecimal("210.00"));
                }));
            }
            start.countDown();

            for (Future<AddExpenseResult> future : futures) {
                assertTrue(future.get(30, TimeUnit.SECONDS).isAccepted());
            }
        } finally {
            executor.shutdownNow();
        }

        for (String username : owners) {
            assertEquals(1, recordCount(username));
        }
        printSuccess("Every user spent up to their own limit");
    }
}
