package com.stationery.tracker.service;

import com.stationery.tracker.model.AppSetting;
import com.stationery.tracker.repository.AppSettingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class SettingsService {

    public static final String KEY_COMPANY_NAME = "company_name";
    public static final String KEY_CONTACT_NUMBER = "company_phone";
    public static final String KEY_CURRENCY = "currency";

    private final AppSettingRepository appSettingRepository;

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    public String getCompanyName() {
        return appSettingRepository.findBySettingKey(KEY_COMPANY_NAME)
                .map(AppSetting::getSettingValue)
                .orElse("Stationery Tracker");
    }

    public String getContactNumber() {
        return appSettingRepository.findBySettingKey(KEY_CONTACT_NUMBER)
                .map(AppSetting::getSettingValue)
                .orElse("");
    }

    public String getCurrency() {
        return appSettingRepository.findBySettingKey(KEY_CURRENCY)
                .map(AppSetting::getSettingValue)
                .filter(value -> !value.isBlank())
                .orElse("TZS");
    }

    public Map<String, String> getAll() {
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put(KEY_COMPANY_NAME, getCompanyName());
        settings.put(KEY_CONTACT_NUMBER, getContactNumber());
        settings.put(KEY_CURRENCY, getCurrency());
        return settings;
    }

    @Transactional
    public void updateSetting(String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value != null ? value : "");
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(key, value != null ? value : ""));
        }
    }
}
