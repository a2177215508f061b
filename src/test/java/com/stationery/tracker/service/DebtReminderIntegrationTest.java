package com.stationery.tracker.service;

import com.stationery.tracker.dto.DebtRequest;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.model.Debt;
import com.stationery.tracker.model.Item;
import com.stationery.tracker.notification.BulkReminderResult;
import com.stationery.tracker.notification.NotificationChannel;
import com.stationery.tracker.notification.ReminderMessageRenderer;
import com.stationery.tracker.repository.CustomerRepository;
import com.stationery.tracker.repository.ItemRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@SpringBootTest
@Transactional
public class DebtReminderIntegrationTest {

    @Autowired
    private DebtReminderService reminderService;

    @Autowired
    private ReminderMessageRenderer renderer;

    @Autowired
    private DebtService debtService;

    @Autowired
    private ItemRepository itemRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @MockBean
    private AuditService auditService;

    private Debt debt;

    @BeforeEach
    void setUp() {
        Item item = new Item();
        item.setName("Reminder Ruler");
        item.setSku("REM-RUL-001");
        item.setUnitPrice(new BigDecimal("1500.00"));
        item.setCostPrice(new BigDecimal("900.00"));
        item.setStockQuantity(10);
        item = itemRepository.save(item);

        Customer customer = new Customer();
        customer.setName("Neema Stationers");
        customer.setPhone("0712345678");
        customer = customerRepository.save(customer);

        debt = debtService.createDebt(new DebtRequest(customer.getId(), null, item.getId(), 2, null,
                LocalDate.now().plusDays(30), "Rulers on credit"), Actor.SYSTEM);
    }

    @Test
    public void testRenderUsesTheApplicationsTemplates() {
        String message = renderer.render(debt, NotificationChannel.SMS, LocalDate.now());

        Assertions.assertTrue(message.contains("Neema Stationers"), message);
        Assertions.assertTrue(message.contains("3,000"), message);
    }

    @Test
    public void testBulkReminderReportsGatewayFailurePerRecipient() {
        // The SMS gateway is disabled in the test configuration
        BulkReminderResult result = reminderService.sendBulkReminders(List.of(debt.getId()),
                NotificationChannel.SMS, Actor.SYSTEM);

        Assertions.assertEquals(0, result.sent());
        Assertions.assertEquals(1, result.failed());
        Assertions.assertEquals("SMS service not configured properly", result.results().get(0).delivery().error());
    }
}
