package com.stationery.tracker.service;

import com.stationery.tracker.dto.ExpenditureRequest;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.model.Expenditure;
import com.stationery.tracker.repository.ExpenditureRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class ExpenditureService {

    private static final LocalDate EARLIEST = LocalDate.of(1970, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final ExpenditureRepository expenditureRepository;
    private final UserService userService;
    private final AuditService auditService;
    private final Clock clock;

    public ExpenditureService(ExpenditureRepository expenditureRepository, UserService userService,
            AuditService auditService, Clock clock) {
        this.expenditureRepository = expenditureRepository;
        this.userService = userService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Expenditure> listExpenditures(LocalDate from, LocalDate to) {
        return expenditureRepository.findByExpenseDateBetweenOrderByExpenseDateDesc(
                from != null ? from : EARLIEST, to != null ? to : LATEST);
    }

    @Transactional(readOnly = true)
    public BigDecimal totalBetween(LocalDate from, LocalDate to) {
        return expenditureRepository.sumBetween(from != null ? from : EARLIEST, to != null ? to : LATEST);
    }

    @Transactional(readOnly = true)
    public Expenditure getExpenditure(Long id) {
        return expenditureRepository.findById(id).orElseThrow(() -> new NotFoundException("Expenditure", id));
    }

    @Transactional
    public Expenditure createExpenditure(ExpenditureRequest request, Actor actor) {
        Expenditure expenditure = new Expenditure();
        apply(expenditure, request);
        expenditure.setCreatedBy(userService.referenceFor(actor));
        expenditure = expenditureRepository.save(expenditure);
        auditService.log(actor, "CREATE_EXPENDITURE", expenditure.getCategory().getLabel() + ": "
                + expenditure.getDescription() + " (" + expenditure.getAmount() + ")");
        return expenditure;
    }

    @Transactional
    public Expenditure updateExpenditure(Long id, ExpenditureRequest request, Actor actor) {
        Expenditure expenditure = getExpenditure(id);
        apply(expenditure, request);
        auditService.log(actor, "UPDATE_EXPENDITURE", "Expenditure #" + id + " now " + expenditure.getAmount());
        return expenditure;
    }

    @Transactional
    public void deleteExpenditure(Long id, Actor actor) {
        Expenditure expenditure = getExpenditure(id);
        expenditureRepository.delete(expenditure);
        auditService.log(actor, "DELETE_EXPENDITURE", "Expenditure #" + id + ": " + expenditure.getDescription());
    }

    private void apply(Expenditure expenditure, ExpenditureRequest request) {
        expenditure.setCategory(request.category());
        expenditure.setDescription(request.description());
        expenditure.setAmount(request.amount());
        expenditure.setExpenseDate(request.expenseDate() != null ? request.expenseDate() : LocalDate.now(clock));
    }
}
