package com.gt.dailyprep.settings;

import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/settings")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping(produces = "application/json")
    public Settings getSettings() {
        return new Settings(settingsService.getDailyProblemCount());
    }

    @PutMapping(produces = "application/json")
    public Settings saveSettings(@RequestBody Settings settings) {
        return new Settings(settingsService.setDailyProblemCount(settings.dailyProblemCount()));
    }

    private record Settings(int dailyProblemCount) { }
}
