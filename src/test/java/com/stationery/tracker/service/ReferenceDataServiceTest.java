package com.stationery.tracker.service;

import com.stationery.tracker.dto.CategoryRequest;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Category;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.repository.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReferenceDataServiceTest {

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private SaleRepository saleRepository;
    @Mock
    private DebtRepository debtRepository;
    @Mock
    private ItemRepository itemRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private ReferenceDataService referenceDataService;

    @Test
    void saveCategory_DuplicateName_ShouldBeRejected() {
        Category existing = new Category("Pens", null);
        existing.setId(1L);
        when(categoryRepository.findByName("Pens")).thenReturn(Optional.of(existing));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> referenceDataService.saveCategory(null, new CategoryRequest(" Pens ", null), Actor.SYSTEM));

        assertEquals("name", ex.getField());
        verify(categoryRepository, never()).save(any());
    }

    @Test
    void saveCategory_RenameToOwnName_ShouldBeAllowed() {
        Category existing = new Category("Pens", null);
        existing.setId(1L);
        when(categoryRepository.findByName("Pens")).thenReturn(Optional.of(existing));
        when(categoryRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(categoryRepository.save(existing)).thenReturn(existing);

        Category saved = referenceDataService.saveCategory(1L, new CategoryRequest("Pens", "Ballpoint pens"),
                Actor.SYSTEM);

        assertEquals("Ballpoint pens", saved.getDescription());
    }

    @Test
    void deleteCustomer_WithDebts_ShouldBeRefused() {
        Customer customer = new Customer();
        customer.setId(4L);
        customer.setName("Juma Stores");
        when(customerRepository.findById(4L)).thenReturn(Optional.of(customer));
        when(saleRepository.existsByCustomerId(4L)).thenReturn(false);
        when(debtRepository.existsByCustomerId(4L)).thenReturn(true);

        assertThrows(ValidationException.class, () -> referenceDataService.deleteCustomer(4L, Actor.SYSTEM));
        verify(customerRepository, never()).delete(any());
    }

    @Test
    void deleteCategory_Unused_ShouldDelete() {
        Category unused = new Category("Stamps", null);
        unused.setId(9L);
        when(categoryRepository.findById(9L)).thenReturn(Optional.of(unused));

        referenceDataService.deleteCategory(9L, Actor.SYSTEM);

        verify(categoryRepository).delete(unused);
        verify(auditService).log(Actor.SYSTEM, "DELETE_CATEGORY", "Category: Stamps");
    }
}
