package com.tbmerch.backoffice.service;

import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import com.tbmerch.backoffice.domain.SupplierType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supplier CRUD plus implicit supplier resolution for imports.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplierRegistry {

    private final SupplierRepository supplierRepository;

    /** Serialises find-then-insert so concurrent imports of one type create a single supplier. */
    private final Lock resolveLock = new ReentrantLock();

    /**
     * Returns the oldest active supplier of the given type, creating one named after the type when none exists.
     * Never creates a second active supplier of a type that already has one.
     */
    public Supplier resolveOrCreate(SupplierType type) {
        resolveLock.lock();
        try {
            return supplierRepository.findFirstByTypeAndActiveTrueOrderByCreatedAtAsc(type)
                    .orElseGet(() -> {
                        Supplier created = supplierRepository.save(Supplier.builder()
                                .name(type.humanizedName())
                                .type(type)
                                .settings(new HashMap<>())
                                .active(true)
                                .build());
                        log.info("Supplier auto-created | supplierId={} | type={} | name={}",
                                created.getId(), type.slug(), created.getName());
                        return created;
                    });
        } finally {
            resolveLock.unlock();
        }
    }

    @Transactional
    public Supplier create(SupplierRequest request) {
        Supplier supplier = new Supplier();
        apply(supplier, request);
        Supplier saved = supplierRepository.save(supplier);
        log.info("Supplier created | supplierId={} | type={} | name={}",
                saved.getId(), saved.getType().slug(), saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public Supplier get(UUID supplierId) {
        return supplierRepository.findById(supplierId)
                .orElseThrow(() -> new SupplierNotFoundException(supplierId));
    }

    @Transactional(readOnly = true)
    public List<Supplier> list(boolean activeOnly) {
        return activeOnly ? supplierRepository.findByActiveTrue() : supplierRepository.findAll();
    }

    /** Full overwrite of every client-settable field. */
    @Transactional
    public Supplier update(UUID supplierId, SupplierRequest request) {
        Supplier supplier = get(supplierId);
        apply(supplier, request);
        log.info("Supplier updated | supplierId={} | active={}", supplierId, supplier.isActive());
        return supplierRepository.save(supplier);
    }

    /** Products and orders that reference the supplier are left as they are. */
    @Transactional
    public void delete(UUID supplierId) {
        if (!supplierRepository.existsById(supplierId)) {
            throw new SupplierNotFoundException(supplierId);
        }
        supplierRepository.deleteById(supplierId);
        log.info("Supplier deleted | supplierId={}", supplierId);
    }

    private void apply(Supplier supplier, SupplierRequest request) {
        supplier.setName(request.name());
        supplier.setType(request.type());
        supplier.setApiEndpoint(request.apiEndpoint());
        supplier.setApiKey(request.apiKey());
        supplier.setWebhookUrl(request.webhookUrl());
        supplier.setSettings(request.settings() == null ? new HashMap<>() : new HashMap<>(request.settings()));
        supplier.setActive(request.active() == null || request.active());
    }
}
