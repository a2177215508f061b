package com.stationery.tracker.service;

import com.stationery.tracker.dto.CategoryRequest;
import com.stationery.tracker.dto.CustomerRequest;
import com.stationery.tracker.dto.SupplierRequest;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.Category;
import com.stationery.tracker.model.Customer;
import com.stationery.tracker.model.Supplier;
import com.stationery.tracker.repository.CategoryRepository;
import com.stationery.tracker.repository.CustomerRepository;
import com.stationery.tracker.repository.DebtRepository;
import com.stationery.tracker.repository.ItemRepository;
import com.stationery.tracker.repository.ProductRepository;
import com.stationery.tracker.repository.SaleRepository;
import com.stationery.tracker.repository.SupplierRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class ReferenceDataService {

    private final CustomerRepository customerRepository;
    private final SupplierRepository supplierRepository;
    private final CategoryRepository categoryRepository;
    private final SaleRepository saleRepository;
    private final DebtRepository debtRepository;
    private final ItemRepository itemRepository;
    private final ProductRepository productRepository;
    private final AuditService auditService;

    public ReferenceDataService(CustomerRepository customerRepository, SupplierRepository supplierRepository,
            CategoryRepository categoryRepository, SaleRepository saleRepository, DebtRepository debtRepository,
            ItemRepository itemRepository, ProductRepository productRepository, AuditService auditService) {
        this.customerRepository = customerRepository;
        this.supplierRepository = supplierRepository;
        this.categoryRepository = categoryRepository;
        this.saleRepository = saleRepository;
        this.debtRepository = debtRepository;
        this.itemRepository = itemRepository;
        this.productRepository = productRepository;
        this.auditService = auditService;
    }

    // --- customers ---

    @Transactional(readOnly = true)
    public List<Customer> listCustomers(String search) {
        if (search != null && !search.isBlank()) {
            return customerRepository.findByNameContainingIgnoreCaseOrderByNameAsc(search.trim());
        }
        return customerRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(Long id) {
        return customerRepository.findById(id).orElseThrow(() -> new NotFoundException("Customer", id));
    }

    @Transactional
    public Customer saveCustomer(Long id, CustomerRequest request, Actor actor) {
        Customer customer = id != null ? getCustomer(id) : new Customer();
        customer.setName(request.name().trim());
        customer.setEmail(request.email());
        customer.setPhone(request.phone());
        customer.setAddress(request.address());
        if (request.active() != null) {
            customer.setActive(request.active());
        }
        customer = customerRepository.save(customer);
        auditService.log(actor, id != null ? "UPDATE_CUSTOMER" : "CREATE_CUSTOMER", "Customer: " + customer.getName());
        return customer;
    }

    @Transactional
    public void deleteCustomer(Long id, Actor actor) {
        Customer customer = getCustomer(id);
        if (saleRepository.existsByCustomerId(id) || debtRepository.existsByCustomerId(id)) {
            throw new ValidationException("Cannot delete customer " + customer.getName()
                    + ". They have sales or debts on record.");
        }
        customerRepository.delete(customer);
        auditService.log(actor, "DELETE_CUSTOMER", "Customer: " + customer.getName());
    }

    // --- suppliers ---

    @Transactional(readOnly = true)
    public List<Supplier> listSuppliers() {
        return supplierRepository.findByActiveTrueOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Supplier getSupplier(Long id) {
        return supplierRepository.findById(id).orElseThrow(() -> new NotFoundException("Supplier", id));
    }

    @Transactional
    public Supplier saveSupplier(Long id, SupplierRequest request, Actor actor) {
        Supplier supplier = id != null ? getSupplier(id) : new Supplier();
        supplier.setName(request.name().trim());
        supplier.setContactPerson(request.contactPerson());
        supplier.setPhone(request.phone());
        supplier.setEmail(request.email());
        supplier.setAddress(request.address());
        if (request.active() != null) {
            supplier.setActive(request.active());
        }
        supplier = supplierRepository.save(supplier);
        auditService.log(actor, id != null ? "UPDATE_SUPPLIER" : "CREATE_SUPPLIER", "Supplier: " + supplier.getName());
        return supplier;
    }

    @Transactional
    public void deleteSupplier(Long id, Actor actor) {
        Supplier supplier = getSupplier(id);
        if (productRepository.existsBySupplierId(id)) {
            throw new ValidationException("Cannot delete supplier " + supplier.getName()
                    + ". Wholesale products still reference it.");
        }
        supplierRepository.delete(supplier);
        auditService.log(actor, "DELETE_SUPPLIER", "Supplier: " + supplier.getName());
    }

    // --- categories ---

    @Transactional(readOnly = true)
    public List<Category> listCategories() {
        return categoryRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Category getCategory(Long id) {
        return categoryRepository.findById(id).orElseThrow(() -> new NotFoundException("Category", id));
    }

    @Transactional
    public Category saveCategory(Long id, CategoryRequest request, Actor actor) {
        String name = request.name().trim();
        categoryRepository.findByName(name)
                .filter(existing -> !existing.getId().equals(id))
                .ifPresent(existing -> {
                    throw new ValidationException("name", "Category " + name + " already exists");
                });
        Category category = id != null ? getCategory(id) : new Category();
        category.setName(name);
        category.setDescription(request.description());
        category = categoryRepository.save(category);
        auditService.log(actor, id != null ? "UPDATE_CATEGORY" : "CREATE_CATEGORY", "Category: " + name);
        return category;
    }

    @Transactional
    public void deleteCategory(Long id, Actor actor) {
        Category category = getCategory(id);
        if (itemRepository.existsByCategoryId(id) || productRepository.existsByCategoryId(id)) {
            throw new ValidationException("Cannot delete category " + category.getName()
                    + ". Items or products are filed under it.");
        }
        categoryRepository.delete(category);
        auditService.log(actor, "DELETE_CATEGORY", "Category: " + category.getName());
    }
}
