package com.tbmerch.backoffice.config;

import com.tbmerch.backoffice.domain.Supplier;
import com.tbmerch.backoffice.domain.SupplierRepository;
import com.tbmerch.backoffice.domain.SupplierType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.HashMap;

/**
 * Seeds a "Direct" supplier into an empty store so products can be created right away.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final SupplierRepository supplierRepository;

    @Override
    public void run(String... args) {
        if (supplierRepository.count() > 0) {
            log.info("Seed skipped | suppliers={}", supplierRepository.count());
            return;
        }
        Supplier direct = supplierRepository.save(Supplier.builder()
                .name("Direct")
                .type(SupplierType.DIRECT)
                .settings(new HashMap<>())
                .active(true)
                .build());
        log.info("Seed supplier created | supplierId={} | name={}", direct.getId(), direct.getName());
    }
}
