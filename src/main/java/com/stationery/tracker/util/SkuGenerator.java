package com.stationery.tracker.util;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.function.Predicate;

@Component
public class SkuGenerator {

    public String generate(String categoryName, String name, LocalDate today, long createdToday,
            Predicate<String> taken) {
        String categoryAbbr = abbreviate(categoryName);
        String nameAbbr = abbreviate(name);
        String year = String.format("%02d", today.getYear() % 100);
        String sequence = String.format("%03d", createdToday + 1);

        String base = categoryAbbr + "-" + nameAbbr + "-" + year + "-" + sequence;
        String sku = base;
        int counter = 1;
        while (taken.test(sku)) {
            sku = base + "-" + counter;
            counter++;
        }
        return sku;
    }

    static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.replaceAll("[^A-Za-z0-9]", "");
        return cleaned.substring(0, Math.min(3, cleaned.length())).toUpperCase();
    }
}
