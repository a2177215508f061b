package com.stationery.tracker.config;

import com.stationery.tracker.model.Category;
import com.stationery.tracker.model.User;
import com.stationery.tracker.model.UserRole;
import com.stationery.tracker.repository.CategoryRepository;
import com.stationery.tracker.repository.UserRepository;
import com.stationery.tracker.service.DebtSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    static final Map<String, String> DEFAULT_CATEGORIES = new LinkedHashMap<>();

    static {
        DEFAULT_CATEGORIES.put("Pens", "Ballpoint, gel and fountain pens");
        DEFAULT_CATEGORIES.put("Pencils", "Graphite and colored pencils");
        DEFAULT_CATEGORIES.put("Paper", "Printing paper, cardstock and specialty paper");
        DEFAULT_CATEGORIES.put("Notebooks", "Exercise books, journals and notepads");
        DEFAULT_CATEGORIES.put("Office Supplies", "Staplers, clips, folders and desk items");
        DEFAULT_CATEGORIES.put("Art Supplies", "Paints, brushes, crayons and markers");
        DEFAULT_CATEGORIES.put("Erasers & Correctors", "Erasers, correction fluid and tape");
        DEFAULT_CATEGORIES.put("Rulers & Measuring", "Rulers, protractors and geometry sets");
        DEFAULT_CATEGORIES.put("Storage & Organization", "Files, boxes and organizers");
        DEFAULT_CATEGORIES.put("Labels & Stickers", "Labels, stickers and tags");
    }

    @Bean
    CommandLineRunner init(UserRepository userRepo, CategoryRepository categoryRepo, PasswordEncoder encoder,
            TrackerProperties properties) {
        return args -> {
            // Admin user on an empty database
            if (userRepo.count() == 0) {
                User admin = new User();
                admin.setUsername("admin");
                admin.setPassword(encoder.encode(properties.getInitialAdminPassword()));
                admin.setRole(UserRole.ADMIN);
                admin.setFullName("System Admin");
                userRepo.save(admin);
                logger.info("Created initial admin user");
            }

            // Default categories, matched by name
            int created = 0;
            for (Map.Entry<String, String> entry : DEFAULT_CATEGORIES.entrySet()) {
                if (categoryRepo.findByName(entry.getKey()).isEmpty()) {
                    categoryRepo.save(new Category(entry.getKey(), entry.getValue()));
                    created++;
                }
            }
            if (created > 0) {
                logger.info("Created {} default categories", created);
            }
        };
    }

    // --realign-debt-due-dates recomputes auto-created debts' due dates from their sales
    @Bean
    ApplicationRunner realignDebtDueDates(DebtSyncService debtSyncService) {
        return args -> {
            if (args.containsOption("realign-debt-due-dates")) {
                int changed = debtSyncService.realignAutoDebtDueDates();
                logger.info("Realigned due dates of {} auto-created debts", changed);
            }
        };
    }
}
