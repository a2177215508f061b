package com.stationery.tracker.service;

import com.stationery.tracker.dto.ExpenditureRequest;
import com.stationery.tracker.model.Expenditure;
import com.stationery.tracker.model.ExpenditureCategory;
import com.stationery.tracker.repository.ExpenditureRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpenditureServiceTest {

    @Mock
    private ExpenditureRepository expenditureRepository;
    @Mock
    private UserService userService;
    @Mock
    private AuditService auditService;

    private ExpenditureService expenditureService;

    @BeforeEach
    void setUp() {
        // Still the 30th in UTC, already the 1st in Dar es Salaam
        Clock clock = Clock.fixed(Instant.parse("2024-06-30T22:00:00Z"), ZoneId.of("Africa/Dar_es_Salaam"));
        expenditureService = new ExpenditureService(expenditureRepository, userService, auditService, clock);
    }

    @Test
    void createExpenditure_WithoutDate_ShouldUseBusinessToday() {
        when(expenditureRepository.save(any(Expenditure.class))).thenAnswer(i -> i.getArguments()[0]);

        Expenditure saved = expenditureService.createExpenditure(new ExpenditureRequest(ExpenditureCategory.UTILITIES,
                "Electricity", new BigDecimal("45000"), null), Actor.SYSTEM);

        assertEquals(LocalDate.of(2024, 7, 1), saved.getExpenseDate());
        verify(auditService).log(Actor.SYSTEM, "CREATE_EXPENDITURE", "Utilities: Electricity (45000)");
    }

    @Test
    void listExpenditures_OpenRange_ShouldBeUnbounded() {
        when(expenditureRepository.findByExpenseDateBetweenOrderByExpenseDateDesc(LocalDate.of(1970, 1, 1),
                LocalDate.of(2024, 6, 30))).thenReturn(List.of());

        assertTrue(expenditureService.listExpenditures(null, LocalDate.of(2024, 6, 30)).isEmpty());
    }
}
